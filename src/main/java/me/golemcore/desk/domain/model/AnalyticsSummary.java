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

import java.util.Map;

/**
 * Inbox counters for the analytics dashboard.
 *
 * <p>
 * {@code sentiment} is keyed by the classifier labels and {@code priority} by
 * {@link Priority#label()}. Every known key is present, with zero counts where
 * no message matches.
 */
@Data
@Builder
public class AnalyticsSummary {

    private long total;
    private long last24h;
    private Map<String, Long> sentiment;
    private Map<String, Long> priority;
    private long resolved;
    private long pending;
}
