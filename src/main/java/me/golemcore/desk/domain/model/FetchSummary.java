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

import java.time.Instant;

/**
 * Outcome of one discovery poll cycle.
 *
 * @param timestamp
 *            when the cycle finished, {@code null} before the first cycle
 * @param fetched
 *            messages returned by the connector
 * @param inserted
 *            new records created after deduplication
 * @param source
 *            connector name
 */
public record FetchSummary(Instant timestamp, int fetched, int inserted, String source) {

    public static FetchSummary never(String source) {
        return new FetchSummary(null, 0, 0, source);
    }
}
