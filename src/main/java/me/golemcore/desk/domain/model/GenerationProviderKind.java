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

import java.util.Locale;

/**
 * Closed set of generation provider variants. Selected once at startup from
 * {@code desk.generation.provider}.
 */
public enum GenerationProviderKind {

    /** OpenAI-compatible chat completion endpoint (primary remote). */
    OPENAI("openai"),

    /** Anthropic messages endpoint (secondary remote). */
    ANTHROPIC("anthropic"),

    /** No network; deterministic template only. */
    LOCAL("local");

    private final String id;

    GenerationProviderKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isRemote() {
        return this != LOCAL;
    }

    public static GenerationProviderKind fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOCAL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (GenerationProviderKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown generation provider: " + raw);
    }
}
