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

import me.golemcore.desk.domain.model.GenerationRequest;
import me.golemcore.desk.domain.model.ProviderErrorKind;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import me.golemcore.desk.port.outbound.TextGenerationPort.ProviderCallException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Base for remote providers reached through langchain4j.
 *
 * <p>
 * Each call is a single request: the underlying model is built with
 * {@code maxRetries(0)} because retry and backoff are decided by the response
 * generator. Per-request temperature and output cap go into the
 * {@link ChatRequest} so one model instance serves regular, strict and salvage
 * prompts. langchain4j rate-limit, timeout, authentication and HTTP status
 * failures leave as {@link ProviderCallException}.
 */
@Slf4j
public abstract class Langchain4jGenerationAdapter implements GenerationProviderAdapter {

    protected final DeskProperties properties;

    private ChatModel chatModel;

    protected Langchain4jGenerationAdapter(DeskProperties properties) {
        this.properties = properties;
    }

    /**
     * Build the langchain4j model for the given provider settings.
     */
    protected abstract ChatModel createModel(DeskProperties.ProviderProperties config, String modelName);

    protected abstract String getDefaultModel();

    @Override
    public String complete(GenerationRequest request) {
        ChatModel model = getChatModel();

        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getPrompt() != null ? request.getPrompt() : ""));

        ChatRequest chatRequest = ChatRequest.builder()
                .messages(messages)
                .temperature(request.getTemperature())
                .maxOutputTokens(request.getMaxOutputTokens())
                .build();

        ChatResponse response;
        try {
            response = model.chat(chatRequest);
        } catch (RuntimeException e) {
            ProviderErrorKind kind = errorKindOf(e);
            if (kind == ProviderErrorKind.UNKNOWN) {
                throw e;
            }
            throw new ProviderCallException(kind, e.getMessage(), e);
        }
        AiMessage aiMessage = response != null ? response.aiMessage() : null;
        String text = aiMessage != null ? aiMessage.text() : null;
        return text != null ? text : "";
    }

    @Override
    public String getModel() {
        DeskProperties.ProviderProperties config = getConfig();
        if (config != null && config.getModel() != null && !config.getModel().isBlank()) {
            return config.getModel();
        }
        return getDefaultModel();
    }

    @Override
    public boolean hasCredential() {
        DeskProperties.ProviderProperties config = getConfig();
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public boolean isAvailable() {
        DeskProperties.ProviderProperties config = getConfig();
        return hasCredential() && !config.isForceDisabled();
    }

    static ProviderErrorKind errorKindOf(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof RateLimitException) {
                return ProviderErrorKind.RATE_LIMIT;
            }
            if (current instanceof TimeoutException) {
                return ProviderErrorKind.TIMEOUT;
            }
            if (current instanceof AuthenticationException) {
                return ProviderErrorKind.AUTHENTICATION;
            }
            if (current instanceof HttpException httpException) {
                return errorKindOfStatus(httpException.statusCode());
            }
            current = current.getCause();
        }
        return ProviderErrorKind.UNKNOWN;
    }

    private static ProviderErrorKind errorKindOfStatus(int statusCode) {
        return switch (statusCode) {
        case 429 -> ProviderErrorKind.RATE_LIMIT;
        case 402 -> ProviderErrorKind.QUOTA_EXCEEDED;
        case 401, 403 -> ProviderErrorKind.AUTHENTICATION;
        case 408, 504 -> ProviderErrorKind.TIMEOUT;
        default -> ProviderErrorKind.UNKNOWN;
        };
    }

    protected DeskProperties.ProviderProperties getConfig() {
        return properties.getGeneration().getProviders().get(getKind().id());
    }

    private synchronized ChatModel getChatModel() {
        if (chatModel == null) {
            DeskProperties.ProviderProperties config = getConfig();
            if (config == null || !hasCredential()) {
                throw new IllegalStateException("Provider not configured: " + getKind().id()
                        + ". Add desk.generation.providers." + getKind().id() + ".api-key");
            }
            chatModel = createModel(config, getModel());
            log.info("[Generator] {} model initialized: {}", getKind().id(), getModel());
        }
        return chatModel;
    }
}
