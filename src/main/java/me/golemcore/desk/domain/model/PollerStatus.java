/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.desk.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Discovery poller state for the pipeline status endpoint.
 */
@Data
@Builder
public class PollerStatus {

    private boolean running;
    private String source;
    private int intervalSeconds;
    private int batchSize;
    private Instant lastPollAt;
    private int lastFetched;
    private int lastInserted;
    private String lastError;
}
