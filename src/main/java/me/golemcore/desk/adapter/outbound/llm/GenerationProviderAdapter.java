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

package me.golemcore.desk.adapter.outbound.llm;

import me.golemcore.desk.domain.model.GenerationProviderKind;
import me.golemcore.desk.port.outbound.TextGenerationPort;

/**
 * Interface for text-generation provider adapters.
 *
 * <p>
 * Extends {@link TextGenerationPort} with provider identification and
 * availability checks. All provider adapters must implement this interface to
 * be managed by {@link GenerationProviderRegistry}.
 *
 * @see GenerationProviderRegistry
 */
public interface GenerationProviderAdapter extends TextGenerationPort {

    GenerationProviderKind getKind();

    /**
     * Model name sent to the provider, or {@code "none"} for local.
     */
    String getModel();

    /**
     * Check if an API key is configured.
     */
    boolean hasCredential();

    /**
     * Check if this adapter can be called: credential present and not
     * force-disabled.
     */
    boolean isAvailable();
}
