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
import me.golemcore.desk.domain.model.GenerationRequest;
import org.springframework.stereotype.Component;

/**
 * Placeholder adapter for the template-only mode.
 *
 * <p>
 * Never available, so the response generator always answers with the local
 * template when this provider is selected.
 */
@Component
public class LocalTemplateAdapter implements GenerationProviderAdapter {

    @Override
    public GenerationProviderKind getKind() {
        return GenerationProviderKind.LOCAL;
    }

    @Override
    public String getModel() {
        return "none";
    }

    @Override
    public boolean hasCredential() {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String complete(GenerationRequest request) {
        throw new UnsupportedOperationException("Local provider performs no remote generation");
    }
}
