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

import me.golemcore.desk.domain.model.ProviderErrorKind;
import me.golemcore.desk.port.outbound.TextGenerationPort.ProviderCallException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps provider failures to {@link ProviderErrorKind} by walking the cause
 * chain.
 *
 * <p>
 * A {@link ProviderCallException} carries the kind its adapter decided on.
 * Quota markers in the text still win over it: some providers report exhausted
 * credit as HTTP 429. Otherwise the message text is searched for status codes,
 * which count only at the start of the message or after {@code HTTP},
 * {@code status}, {@code code} or {@code error}.
 */
public final class ProviderErrorClassifier {

    private static final Pattern HTTP_STATUS_PATTERN = Pattern
            .compile("(?:^|\\b(?:http|status|code|error)\\W{0,3})(\\d{3})\\b");
    private static final Pattern RESET_SECONDS_PATTERN = Pattern
            .compile("\"reset_seconds\"\\s*:\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern RETRY_DELAY_PATTERN = Pattern
            .compile("\"retryDelay\"\\s*:\\s*\"(\\d+(?:\\.\\d+)?)s\"");
    private static final Pattern RETRY_AFTER_PATTERN = Pattern
            .compile("(?i)retry[\\s_-]?after\\D{0,5}(\\d+(?:\\.\\d+)?)");

    private ProviderErrorClassifier() {
    }

    public static ProviderErrorKind classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            ProviderErrorKind kind = classifySingle(current);
            if (kind != ProviderErrorKind.UNKNOWN) {
                return kind;
            }
            current = current.getCause();
        }
        return ProviderErrorKind.UNKNOWN;
    }

    /**
     * Server-requested retry delay carried in the error text.
     *
     * @return delay in milliseconds, or -1 if the error carries none
     */
    public static long extractRetryDelayMs(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            String message = current.getMessage();
            if (message != null) {
                for (Pattern pattern : new Pattern[] { RESET_SECONDS_PATTERN, RETRY_DELAY_PATTERN,
                        RETRY_AFTER_PATTERN }) {
                    Matcher matcher = pattern.matcher(message);
                    if (matcher.find()) {
                        return Math.round(Double.parseDouble(matcher.group(1)) * 1000);
                    }
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    /**
     * Short single-line description for error state and logs.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "";
        }
        String message = throwable.getMessage();
        String text = throwable.getClass().getSimpleName()
                + (message != null && !message.isBlank() ? ": " + message : "");
        text = text.replace('\n', ' ');
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }

    private static ProviderErrorKind classifySingle(Throwable throwable) {
        String message = throwable.getMessage() != null ? throwable.getMessage().toLowerCase(Locale.ROOT) : "";

        int status = statusCode(message);

        if (status == 402 || isQuotaMessage(message)) {
            return ProviderErrorKind.QUOTA_EXCEEDED;
        }
        if (throwable instanceof ProviderCallException callException
                && callException.getKind() != ProviderErrorKind.UNKNOWN) {
            return callException.getKind();
        }
        if (throwable instanceof TimeoutException
                || throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException) {
            return ProviderErrorKind.TIMEOUT;
        }

        if (status == 429 || message.contains("rate_limit") || message.contains("rate limit")
                || message.contains("too many requests")) {
            return ProviderErrorKind.RATE_LIMIT;
        }
        if (message.contains("timed out") || message.contains("timeout")) {
            return ProviderErrorKind.TIMEOUT;
        }
        if (status == 401 || message.contains("invalid api key") || message.contains("unauthorized")) {
            return ProviderErrorKind.AUTHENTICATION;
        }
        return ProviderErrorKind.UNKNOWN;
    }

    private static int statusCode(String message) {
        Matcher matcher = HTTP_STATUS_PATTERN.matcher(message);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : -1;
    }

    private static boolean isQuotaMessage(String message) {
        return message.contains("payment required")
                || message.contains("insufficient_quota")
                || message.contains("quota exceeded")
                || message.contains("exceeded your current quota")
                || message.contains("resource_exhausted")
                || message.contains("credit balance");
    }
}
