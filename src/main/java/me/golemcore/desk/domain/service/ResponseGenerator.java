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

package me.golemcore.desk.domain.service;

import me.golemcore.desk.adapter.outbound.llm.GenerationProviderAdapter;
import me.golemcore.desk.adapter.outbound.llm.GenerationProviderRegistry;
import me.golemcore.desk.domain.model.GenerationProviderKind;
import me.golemcore.desk.domain.model.GenerationRequest;
import me.golemcore.desk.domain.model.GeneratorDiagnostics;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.domain.model.PingResult;
import me.golemcore.desk.domain.model.ProviderErrorKind;
import me.golemcore.desk.domain.model.ReplyContext;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces support replies through the configured remote provider with a
 * deterministic local fallback.
 *
 * <p>
 * {@link #generate} is total: every failure ends in either the local template
 * or, when local fallback is disabled, a sentinel token. Policy per call:
 * <ol>
 * <li>unavailable provider (local, force-disabled, no credential) - fallback
 * immediately</li>
 * <li>active quota backoff or rate-limit cooldown - fallback without network
 * I/O</li>
 * <li>cooperative minimum call spacing with jitter</li>
 * <li>hard timeout per call</li>
 * <li>rate limit - wait the server delay or an exponential default, retry once,
 * then enter cooldown</li>
 * <li>quota or payment error - one salvage retry with a truncated prompt</li>
 * <li>empty output - one strict retry, then the secondary provider</li>
 * <li>anything else - record the error and fall back</li>
 * </ol>
 * A failed primary call is handed to the secondary provider when one is
 * configured.
 */
@Service
@Slf4j
public class ResponseGenerator {

    public static final String SENTINEL_UNAVAILABLE = "[PROVIDER_UNAVAILABLE]";
    public static final String SENTINEL_QUOTA_BACKOFF = "[PROVIDER_QUOTA_BACKOFF]";
    public static final String SENTINEL_RATE_LIMITED = "[PROVIDER_RATE_LIMITED]";
    public static final String SENTINEL_TIMEOUT = "[PROVIDER_TIMEOUT]";
    public static final String SENTINEL_EMPTY = "[PROVIDER_EMPTY]";
    public static final String SENTINEL_ERROR = "[PROVIDER_ERROR]";

    private static final List<String> SENTINELS = List.of(SENTINEL_UNAVAILABLE, SENTINEL_QUOTA_BACKOFF,
            SENTINEL_RATE_LIMITED, SENTINEL_TIMEOUT, SENTINEL_EMPTY, SENTINEL_ERROR);
    private static final int PING_TEXT_MAX_CHARS = 120;

    private final DeskProperties.GenerationProperties config;
    private final GenerationProviderRegistry registry;
    private final ProviderThrottle throttle;
    private final PromptBuilder promptBuilder;
    private final ExecutorService callExecutor;

    public ResponseGenerator(DeskProperties properties, GenerationProviderRegistry registry,
            ProviderThrottle throttle) {
        this.config = properties.getGeneration();
        this.registry = registry;
        this.throttle = throttle;
        this.promptBuilder = new PromptBuilder(config.getMaxOutputTokens(), config.getTemperature(),
                config.getSalvageBodyChars(), config.getSalvageMaxOutputTokens());
        AtomicInteger threadCounter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "generator-call-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    public static boolean isSentinel(String text) {
        return text != null && SENTINELS.contains(text.trim());
    }

    /**
     * Generate a reply. Never throws.
     *
     * @return generated text, the local template, or a sentinel token
     */
    public String generate(String subject, String body, String sentiment, Priority priority,
            List<String> snippets) {
        ReplyContext context;
        try {
            context = new ReplyContext(subject, body, sentiment, priority, snippets);
        } catch (RuntimeException e) {
            log.warn("[Generator] Invalid input, using fallback: {}", e.getMessage());
            return fallbackOr(SENTINEL_ERROR, subject, body, priority);
        }
        try {
            return generate(context);
        } catch (RuntimeException e) {
            log.error("[Generator] Unexpected failure, using fallback", e);
            return fallbackOr(SENTINEL_ERROR, context);
        }
    }

    /**
     * Generate a reply from a resolved context. Never throws for provider
     * failures.
     */
    public String generate(ReplyContext context) {
        GenerationProviderAdapter primary = registry.getPrimary();
        if (primary == null || !primary.isAvailable()) {
            if (primary != null && primary.getKind().isRemote()) {
                log.warn("[Generator] Provider {} unavailable (credential: {}, force-disabled: {})",
                        primary.getKind().id(), primary.hasCredential(),
                        registry.settings(primary.getKind()).isForceDisabled());
            }
            return fallbackOr(SENTINEL_UNAVAILABLE, context);
        }

        String result = callWithPolicy(primary, context);
        if (!isSentinel(result)) {
            return result;
        }

        Optional<GenerationProviderAdapter> secondary = registry.getSecondary();
        if (secondary.isPresent() && secondary.get().isAvailable()) {
            log.info("[Generator] {} failed with {}, trying {}", primary.getKind().id(), result,
                    secondary.get().getKind().id());
            String secondaryResult = callWithPolicy(secondary.get(), context);
            if (!isSentinel(secondaryResult)) {
                return secondaryResult;
            }
        }
        return fallbackOr(result, context);
    }

    /**
     * One provider, full retry policy.
     *
     * @return non-blank generated text or a sentinel
     */
    String callWithPolicy(GenerationProviderAdapter provider, ReplyContext context) {
        GenerationProviderKind kind = provider.getKind();

        Duration quotaRemaining = throttle.quotaBackoffRemaining(kind,
                Duration.ofSeconds(config.getQuotaBackoffSeconds()));
        if (!quotaRemaining.isZero()) {
            log.info("[Generator] Quota backoff active for {}, {}s remaining", kind.id(),
                    quotaRemaining.toSeconds());
            return SENTINEL_QUOTA_BACKOFF;
        }
        Duration cooldownRemaining = throttle.cooldownRemaining(kind);
        if (!cooldownRemaining.isZero()) {
            log.info("[Generator] Rate-limit cooldown active for {}, {}s remaining", kind.id(),
                    cooldownRemaining.toSeconds());
            return SENTINEL_RATE_LIMITED;
        }

        GenerationRequest request = promptBuilder.regular(context);
        int rateLimitHits = 0;
        boolean salvageTried = false;
        boolean strictTried = false;

        while (true) {
            try {
                String text = invoke(provider, request);
                if (text != null && !text.isBlank()) {
                    log.info("[Generator] Reply generated by {} ({} chars)", kind.id(), text.trim().length());
                    return text.trim();
                }
                if (!strictTried) {
                    strictTried = true;
                    log.warn("[Generator] {} returned empty text, retrying with strict prompt", kind.id());
                    request = promptBuilder.strict(context);
                    continue;
                }
                throttle.recordError(kind, ProviderErrorKind.EMPTY_OUTPUT, "empty output after strict retry");
                log.warn("[Generator] {} returned empty text twice", kind.id());
                return SENTINEL_EMPTY;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throttle.recordError(kind, ProviderErrorKind.UNKNOWN, "interrupted");
                return SENTINEL_ERROR;
            } catch (Exception e) {
                ProviderErrorKind errorKind = ProviderErrorClassifier.classify(e);
                String description = ProviderErrorClassifier.describe(e);

                switch (errorKind) {
                case RATE_LIMIT -> {
                    rateLimitHits++;
                    throttle.recordError(kind, errorKind, description);
                    if (rateLimitHits >= 2) {
                        throttle.startCooldown(kind, Duration.ofSeconds(config.getRateLimitCooldownSeconds()));
                        return SENTINEL_RATE_LIMITED;
                    }
                    long delayMs = rateLimitDelayMs(e, rateLimitHits);
                    log.warn("[Generator] Rate limit from {}, retrying in {}ms", kind.id(), delayMs);
                    if (!pause(delayMs)) {
                        return SENTINEL_RATE_LIMITED;
                    }
                }
                case QUOTA_EXCEEDED -> {
                    if (!salvageTried) {
                        salvageTried = true;
                        log.warn("[Generator] Quota error from {}, retrying with reduced prompt", kind.id());
                        request = promptBuilder.salvage(context);
                    } else {
                        throttle.recordError(kind, errorKind, description);
                        log.warn("[Generator] Quota exhausted for {}, backing off {}s", kind.id(),
                                config.getQuotaBackoffSeconds());
                        return SENTINEL_QUOTA_BACKOFF;
                    }
                }
                case TIMEOUT -> {
                    throttle.recordError(kind, errorKind, description);
                    log.warn("[Generator] {} timed out after {}ms", kind.id(),
                            registry.settings(kind).getTimeoutMs());
                    return SENTINEL_TIMEOUT;
                }
                default -> {
                    throttle.recordError(kind, errorKind, description);
                    log.error("[Generator] {} generation failed: {}", kind.id(), description);
                    return SENTINEL_ERROR;
                }
                }
            }
        }
    }

    /**
     * Diagnostics for the active provider.
     */
    public GeneratorDiagnostics diagnostics() {
        GenerationProviderAdapter primary = registry.getPrimary();
        GenerationProviderKind kind = primary != null ? primary.getKind() : GenerationProviderKind.LOCAL;
        DeskProperties.ProviderProperties settings = registry.settings(kind);

        return GeneratorDiagnostics.builder()
                .provider(kind.id())
                .secondaryProvider(registry.getSecondary().map(p -> p.getKind().id()).orElse(null))
                .model(primary != null ? primary.getModel() : "none")
                .hasCredential(primary != null && primary.hasCredential())
                .forceDisabled(settings.isForceDisabled())
                .localFallbackEnabled(config.isLocalFallbackEnabled())
                .timeoutMs(settings.getTimeoutMs())
                .minIntervalMs(settings.getMinIntervalMs())
                .quotaBackoffSeconds(config.getQuotaBackoffSeconds())
                .quotaBackoffRemainingSeconds(throttle
                        .quotaBackoffRemaining(kind, Duration.ofSeconds(config.getQuotaBackoffSeconds()))
                        .toSeconds())
                .rateLimitCooldownSeconds(config.getRateLimitCooldownSeconds())
                .cooldownRemainingSeconds(throttle.cooldownRemaining(kind).toSeconds())
                .lastError(throttle.lastError(kind).orElse(null))
                .build();
    }

    /**
     * Send a short ping prompt to the active provider, bypassing retry policy.
     */
    public PingResult ping() {
        GenerationProviderAdapter primary = registry.getPrimary();
        if (primary == null || !primary.getKind().isRemote()) {
            return PingResult.failure(GenerationProviderKind.LOCAL.id(), "none", "local_provider");
        }
        String id = primary.getKind().id();
        if (!primary.hasCredential()) {
            return PingResult.failure(id, primary.getModel(), "missing_api_key");
        }
        if (!primary.isAvailable()) {
            return PingResult.failure(id, primary.getModel(), "force_disabled");
        }
        try {
            String text = invoke(primary, promptBuilder.ping());
            String trimmed = text != null ? text.trim() : "";
            if (trimmed.length() > PING_TEXT_MAX_CHARS) {
                trimmed = trimmed.substring(0, PING_TEXT_MAX_CHARS);
            }
            return PingResult.success(id, primary.getModel(), trimmed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PingResult.failure(id, primary.getModel(), "interrupted");
        } catch (Exception e) {
            log.warn("[Generator] Ping of {} failed: {}", id, ProviderErrorClassifier.describe(e));
            return PingResult.failure(id, primary.getModel(), ProviderErrorClassifier.describe(e));
        }
    }

    private String invoke(GenerationProviderAdapter provider, GenerationRequest request) throws Exception {
        DeskProperties.ProviderProperties settings = registry.settings(provider.getKind());
        throttle.awaitCallSlot(provider.getKind(), settings.getMinIntervalMs(), settings.getJitterMs());

        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> provider.complete(request),
                callExecutor);
        try {
            return future.get(settings.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private long rateLimitDelayMs(Throwable error, int hit) {
        long serverDelayMs = ProviderErrorClassifier.extractRetryDelayMs(error);
        if (serverDelayMs >= 0) {
            return Math.min(serverDelayMs, config.getMaxServerRetryDelayMs());
        }
        return config.getRateLimitRetryDelayMs() * (1L << (hit - 1));
    }

    /**
     * @return {@code false} if interrupted
     */
    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String fallbackOr(String sentinel, ReplyContext context) {
        return fallbackOr(sentinel, context.subject(), context.body(), context.priority());
    }

    private String fallbackOr(String sentinel, String subject, String body, Priority priority) {
        if (config.isLocalFallbackEnabled()) {
            return LocalReplyTemplate.render(subject, body, priority);
        }
        return sentinel;
    }
}
