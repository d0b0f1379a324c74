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

import java.util.Comparator;

/**
 * Pending request to generate a response for one message.
 *
 * @param messageId
 *            message to answer
 * @param priority
 *            priority class used for ordering
 * @param sequence
 *            monotonic push counter, tie-break within a class
 */
public record DispatchJob(long messageId, Priority priority, long sequence) {

    /**
     * Urgent first, then push order.
     */
    public static final Comparator<DispatchJob> ORDER = Comparator
            .comparingInt((DispatchJob job) -> job.priority().rank())
            .thenComparingLong(DispatchJob::sequence);
}
