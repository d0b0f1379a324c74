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

/**
 * States a dispatch job passes through inside the worker.
 *
 * <pre>
 * PENDING → GENERATING → {COMPLETED, RETRY_SCHEDULED, FALLBACK_COMPLETED}
 * </pre>
 *
 * {@link #DISCARDED} covers jobs whose message is gone or already answered.
 */
public enum JobState {
    PENDING,
    GENERATING,
    COMPLETED,
    RETRY_SCHEDULED,
    FALLBACK_COMPLETED,
    DISCARDED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FALLBACK_COMPLETED || this == DISCARDED;
    }
}
