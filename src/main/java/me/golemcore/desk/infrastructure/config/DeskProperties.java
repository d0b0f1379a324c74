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

package me.golemcore.desk.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the support desk, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code desk.*} prefix:
 * <ul>
 * <li>{@link GenerationProperties} - response generator and providers</li>
 * <li>{@link DispatchProperties} - dispatch worker retry policy</li>
 * <li>{@link PollerProperties} - discovery poller cadence</li>
 * <li>{@link MailProperties} - mailbox connector</li>
 * <li>{@link BroadcastProperties} - event stream</li>
 * <li>{@link KnowledgeProperties} - knowledge snippet retrieval</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "desk")
@Data
public class DeskProperties {

    private GenerationProperties generation = new GenerationProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private PollerProperties poller = new PollerProperties();
    private MailProperties mail = new MailProperties();
    private BroadcastProperties broadcast = new BroadcastProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== GENERATION ====================

    @Data
    public static class GenerationProperties {
        private String provider = "local";
        private String secondaryProvider = "";
        private boolean localFallbackEnabled = true;
        private long quotaBackoffSeconds = 600;
        private long rateLimitCooldownSeconds = 60;
        private long rateLimitRetryDelayMs = 2000;
        private long maxServerRetryDelayMs = 30000;
        private int salvageBodyChars = 400;
        private int salvageMaxOutputTokens = 200;
        private int maxOutputTokens = 512;
        private double temperature = 0.4;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private String model;
        private long timeoutMs = 8000;
        private long minIntervalMs = 0;
        private long jitterMs = 250;
        private boolean forceDisabled = false;
    }

    // ==================== PIPELINE ====================

    @Data
    public static class DispatchProperties {
        private boolean enabled = true;
        private int maxAttempts = 3;
        private long idleWaitMs = 2000;
        private long errorRetryDelayMs = 3000;
        private long emptyRetryDelayMs = 2000;
        private boolean requeueOnStartup = true;
    }

    @Data
    public static class PollerProperties {
        private boolean enabled = false;
        private int intervalSeconds = 120;
        private int batchSize = 20;
    }

    @Data
    public static class MailProperties {
        private String source = "none";
        private String host = "";
        private int port = 993;
        private String username = "";
        private String password = "";
        private String security = "ssl";
        private String folder = "INBOX";
        private String label = "";
        private List<String> subjectKeywords = new ArrayList<>(List.of("support", "query", "request", "help"));
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
        private int maxBodyLength = 50000;
    }

    @Data
    public static class BroadcastProperties {
        private int channelCapacity = 100;
        private int keepaliveSeconds = 15;
    }

    // ==================== KNOWLEDGE (LightRAG) ====================

    @Data
    public static class KnowledgeProperties {
        private boolean enabled = false;
        private String url = "http://localhost:9621";
        private String apiKey = "";
        private String queryMode = "hybrid";
        private int topK = 3;
        private int timeoutSeconds = 5;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/desk";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
    }
}
