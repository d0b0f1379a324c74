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

package me.golemcore.desk.port.outbound;

import me.golemcore.desk.domain.model.GenerationRequest;
import me.golemcore.desk.domain.model.ProviderErrorKind;

/**
 * Port for a single remote text-generation call.
 *
 * <p>
 * Implementations perform exactly one network request per invocation and
 * surface provider failures as exceptions; retry, backoff and fallback policy
 * lives in the response generator.
 */
public interface TextGenerationPort {

    /**
     * Generate text for the request.
     *
     * @return generated text, possibly empty
     * @throws ProviderCallException
     *             if the provider rejected the call for a known reason
     */
    String complete(GenerationRequest request);

    /**
     * Provider failure already categorized by the adapter that observed it.
     */
    class ProviderCallException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final ProviderErrorKind kind;

        public ProviderCallException(ProviderErrorKind kind, String message, Throwable cause) {
            super(message, cause);
            this.kind = kind;
        }

        public ProviderErrorKind getKind() {
            return kind;
        }
    }
}
