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
import me.golemcore.desk.infrastructure.config.DeskProperties;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Secondary remote provider: Anthropic messages API.
 */
@Component
public class AnthropicGenerationAdapter extends Langchain4jGenerationAdapter {

    private static final String DEFAULT_MODEL = "claude-3-5-haiku-latest";

    public AnthropicGenerationAdapter(DeskProperties properties) {
        super(properties);
    }

    @Override
    public GenerationProviderKind getKind() {
        return GenerationProviderKind.ANTHROPIC;
    }

    @Override
    protected String getDefaultModel() {
        return DEFAULT_MODEL;
    }

    @Override
    protected ChatModel createModel(DeskProperties.ProviderProperties config, String modelName) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by the response generator
                .maxTokens(properties.getGeneration().getMaxOutputTokens())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
