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

package me.golemcore.desk.adapter.outbound.knowledge;

import me.golemcore.desk.infrastructure.config.DeskProperties;
import me.golemcore.desk.port.outbound.KnowledgePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * LightRAG adapter: retrieves knowledge snippets over the LightRAG REST API.
 *
 * <p>
 * Calls {@code POST /query} with the configured query mode and top-k. Chunked
 * responses ({@code chunks[].content} or a bare JSON array) yield one snippet
 * per chunk; a plain {@code {"response": "..."}} answer yields a single
 * snippet. Disabled retrieval and any failure yield no snippets.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code desk.knowledge.enabled} - Enable/disable retrieval
 * <li>{@code desk.knowledge.url} - LightRAG API base URL
 * <li>{@code desk.knowledge.api-key} - Optional API key
 * <li>{@code desk.knowledge.query-mode} - Query mode (local/global/hybrid/naive)
 * <li>{@code desk.knowledge.top-k} - Maximum snippets returned
 * <li>{@code desk.knowledge.timeout-seconds} - HTTP timeout
 * </ul>
 */
@Component
@Slf4j
public class LightRagKnowledgeAdapter implements KnowledgePort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final DeskProperties.KnowledgeProperties config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public LightRagKnowledgeAdapter(DeskProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.config = properties.getKnowledge();
        this.objectMapper = objectMapper;

        int timeoutSeconds = config.getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public List<String> retrieve(String query) {
        if (!isAvailable() || query == null || query.isBlank()) {
            return List.of();
        }

        try {
            String url = config.getUrl() + "/query";
            String body = objectMapper.writeValueAsString(
                    new QueryRequest(query, config.getQueryMode(), config.getTopK()));

            Request.Builder requestBuilder = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(body, JSON));
            addApiKeyHeader(requestBuilder);

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    log.warn("[Knowledge] Query failed: HTTP {}", response.code());
                    return List.of();
                }
                List<String> snippets = parseSnippets(responseBody.string());
                log.debug("[Knowledge] Retrieved {} snippets", snippets.size());
                return snippets;
            }
        } catch (IOException | RuntimeException e) {
            log.warn("[Knowledge] Query error: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && config.getUrl() != null && !config.getUrl().isBlank();
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    List<String> parseSnippets(String responseBody) {
        int limit = Math.max(1, config.getTopK());
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            if (node == null) {
                return List.of();
            }
            if (node.isArray()) {
                return collectChunks(node, limit);
            }
            if (node.has("chunks") && node.get("chunks").isArray()) {
                return collectChunks(node.get("chunks"), limit);
            }
            if (node.has("response")) {
                return singleton(node.get("response").asText(""));
            }
            return List.of();
        } catch (JsonProcessingException e) {
            log.debug("[Knowledge] Non-JSON query response, using raw text");
            return singleton(responseBody);
        }
    }

    private List<String> collectChunks(JsonNode chunks, int limit) {
        List<String> snippets = new ArrayList<>();
        for (JsonNode chunk : chunks) {
            if (snippets.size() >= limit) {
                break;
            }
            String text = chunk.isTextual() ? chunk.asText() : chunk.path("content").asText("");
            if (!text.isBlank()) {
                snippets.add(text.strip());
            }
        }
        return snippets;
    }

    private static List<String> singleton(String text) {
        return text == null || text.isBlank() ? List.of() : List.of(text.strip());
    }

    // Request DTO
    record QueryRequest(String query, String mode, int top_k) {
    }
}
