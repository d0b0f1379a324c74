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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse urgency bucket of a support message.
 *
 * <p>
 * Only two classes exist. The {@link #rank()} drives queue ordering: lower rank
 * is served first.
 */
public enum Priority {

    URGENT(0, "Urgent"),
    NORMAL(1, "Not urgent");

    private final int rank;
    private final String label;

    Priority(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isUrgent() {
        return this == URGENT;
    }

    /**
     * Lenient parse. Accepts enum names, labels and the short class names
     * {@code urgent}/{@code normal}. Unknown or blank input maps to
     * {@link #NORMAL}.
     */
    @JsonCreator
    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        String value = raw.trim();
        for (Priority priority : values()) {
            if (priority.name().equalsIgnoreCase(value) || priority.label.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        return NORMAL;
    }
}
