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

import me.golemcore.desk.domain.model.GenerationProviderKind;
import me.golemcore.desk.domain.model.ProviderErrorKind;
import me.golemcore.desk.domain.model.ProviderErrorState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Client-side rate limiting and error memory per generation provider.
 *
 * <p>
 * Tracks for each provider:
 * <ul>
 * <li>the time of the last issued call, used for minimum call spacing</li>
 * <li>an extended cooldown deadline entered after repeated throttling</li>
 * <li>the last observed error, one slot per provider, last write wins</li>
 * </ul>
 *
 * <p>
 * Call slots are reserved under the provider's monitor and waited for outside
 * it, so concurrent callers are spaced out rather than released together.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderThrottle {

    private final Clock clock;

    private final Map<GenerationProviderKind, RateState> states = new ConcurrentHashMap<>();
    private final Map<GenerationProviderKind, ProviderErrorState> lastErrors = new ConcurrentHashMap<>();

    /**
     * Block until the provider's minimum call interval has elapsed since its
     * previous call, plus random jitter.
     *
     * @return milliseconds waited
     */
    public long awaitCallSlot(GenerationProviderKind provider, long minIntervalMs, long jitterMs)
            throws InterruptedException {
        RateState state = states.computeIfAbsent(provider, k -> new RateState());
        long waitMs = state.reserve(clock.millis(), minIntervalMs, jitterMs);
        if (waitMs > 0) {
            log.debug("[Generator] Spacing call to {} by {}ms", provider.id(), waitMs);
            sleep(waitMs);
        }
        return waitMs;
    }

    public void startCooldown(GenerationProviderKind provider, Duration duration) {
        RateState state = states.computeIfAbsent(provider, k -> new RateState());
        state.setCooldownUntil(clock.instant().plus(duration));
        log.warn("[Generator] {} in rate-limit cooldown for {}s", provider.id(), duration.toSeconds());
    }

    /**
     * @return remaining cooldown, or {@link Duration#ZERO} when none is active
     */
    public Duration cooldownRemaining(GenerationProviderKind provider) {
        RateState state = states.get(provider);
        if (state == null || state.getCooldownUntil() == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), state.getCooldownUntil());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void recordError(GenerationProviderKind provider, ProviderErrorKind kind, String message) {
        lastErrors.put(provider, new ProviderErrorState(provider.id(), kind, message, clock.instant()));
    }

    public Optional<ProviderErrorState> lastError(GenerationProviderKind provider) {
        return Optional.ofNullable(lastErrors.get(provider));
    }

    /**
     * Remaining quota backoff: the last error was {@link ProviderErrorKind#QUOTA_EXCEEDED}
     * and happened less than {@code window} ago.
     */
    public Duration quotaBackoffRemaining(GenerationProviderKind provider, Duration window) {
        ProviderErrorState error = lastErrors.get(provider);
        if (error == null || error.kind() != ProviderErrorKind.QUOTA_EXCEEDED) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), error.timestamp().plus(window));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    private static final class RateState {

        private long nextAllowedAtMillis = 0;
        private volatile Instant cooldownUntil;

        synchronized long reserve(long nowMillis, long minIntervalMs, long jitterMs) {
            if (minIntervalMs <= 0) {
                return 0;
            }
            long jitter = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0;
            long startAt = Math.max(nowMillis, nextAllowedAtMillis);
            long waitMs = startAt - nowMillis;
            if (waitMs > 0) {
                waitMs += jitter;
                startAt += jitter;
            }
            nextAllowedAtMillis = startAt + minIntervalMs;
            return waitMs;
        }

        Instant getCooldownUntil() {
            return cooldownUntil;
        }

        void setCooldownUntil(Instant cooldownUntil) {
            this.cooldownUntil = cooldownUntil;
        }
    }
}
