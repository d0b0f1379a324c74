package me.golemcore.desk.domain.service;

import me.golemcore.desk.domain.model.ProviderErrorKind;
import me.golemcore.desk.port.outbound.TextGenerationPort.ProviderCallException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorClassifierTest {

    @Test
    void classifiesRateLimitMessages() {
        assertEquals(ProviderErrorKind.RATE_LIMIT,
                ProviderErrorClassifier.classify(new RuntimeException("HTTP 429 Too Many Requests")));
        assertEquals(ProviderErrorKind.RATE_LIMIT,
                ProviderErrorClassifier.classify(new RuntimeException("rate_limit_error")));
    }

    @Test
    void quotaTakesPrecedenceOverRateLimit() {
        RuntimeException error = new RuntimeException(
                "429: You exceeded your current quota, please check your plan (insufficient_quota)");

        assertEquals(ProviderErrorKind.QUOTA_EXCEEDED, ProviderErrorClassifier.classify(error));
    }

    @Test
    void classifiesPaymentRequiredAsQuota() {
        assertEquals(ProviderErrorKind.QUOTA_EXCEEDED,
                ProviderErrorClassifier.classify(new RuntimeException("402 Payment Required")));
        assertEquals(ProviderErrorKind.QUOTA_EXCEEDED,
                ProviderErrorClassifier.classify(new RuntimeException("Your credit balance is too low")));
    }

    @Test
    void classifiesTimeoutsByTypeAndMessage() {
        assertEquals(ProviderErrorKind.TIMEOUT, ProviderErrorClassifier.classify(new TimeoutException()));
        assertEquals(ProviderErrorKind.TIMEOUT,
                ProviderErrorClassifier.classify(new SocketTimeoutException("read")));
        assertEquals(ProviderErrorKind.TIMEOUT,
                ProviderErrorClassifier.classify(new RuntimeException("request timed out")));
    }

    @Test
    void classifiesAuthenticationFailures() {
        assertEquals(ProviderErrorKind.AUTHENTICATION,
                ProviderErrorClassifier.classify(new RuntimeException("401 Unauthorized")));
        assertEquals(ProviderErrorKind.AUTHENTICATION,
                ProviderErrorClassifier.classify(new RuntimeException("Invalid API key provided")));
    }

    @Test
    void usesKindDecidedByAdapter() {
        RuntimeException wrapped = new RuntimeException("generation failed",
                new ProviderCallException(ProviderErrorKind.AUTHENTICATION, "rejected", null));

        assertEquals(ProviderErrorKind.AUTHENTICATION, ProviderErrorClassifier.classify(wrapped));
    }

    @Test
    void quotaTextOverridesAdapterRateLimit() {
        ProviderCallException error = new ProviderCallException(ProviderErrorKind.RATE_LIMIT,
                "You exceeded your current quota", null);

        assertEquals(ProviderErrorKind.QUOTA_EXCEEDED, ProviderErrorClassifier.classify(error));
    }

    @Test
    void statusCodesCountOnlyInStatusPosition() {
        assertEquals(ProviderErrorKind.UNKNOWN,
                ProviderErrorClassifier.classify(new RuntimeException("Order 4290 failed")));
        assertEquals(ProviderErrorKind.UNKNOWN,
                ProviderErrorClassifier.classify(new RuntimeException("Ticket 402 could not be parsed")));
        assertEquals(ProviderErrorKind.UNKNOWN,
                ProviderErrorClassifier.classify(new RuntimeException("Model returned 1401 tokens")));
        assertEquals(ProviderErrorKind.RATE_LIMIT,
                ProviderErrorClassifier.classify(new RuntimeException("Request failed with status code 429")));
        assertEquals(ProviderErrorKind.QUOTA_EXCEEDED,
                ProviderErrorClassifier.classify(new RuntimeException("error: 402")));
    }

    @Test
    void walksCauseChain() {
        RuntimeException wrapped = new RuntimeException("call failed",
                new IOException("wrapper", new SocketTimeoutException("connect")));

        assertEquals(ProviderErrorKind.TIMEOUT, ProviderErrorClassifier.classify(wrapped));
    }

    @Test
    void unrecognizedErrorsAreUnknown() {
        assertEquals(ProviderErrorKind.UNKNOWN,
                ProviderErrorClassifier.classify(new IllegalStateException("boom")));
        assertEquals(ProviderErrorKind.UNKNOWN, ProviderErrorClassifier.classify(null));
    }

    @Test
    void extractsServerRetryDelays() {
        assertEquals(7000, ProviderErrorClassifier.extractRetryDelayMs(
                new RuntimeException("{\"error\":{\"reset_seconds\": 7}}")));
        assertEquals(12500, ProviderErrorClassifier.extractRetryDelayMs(
                new RuntimeException("{\"retryDelay\": \"12.5s\"}")));
        assertEquals(3000, ProviderErrorClassifier.extractRetryDelayMs(
                new RuntimeException("Too many requests, retry-after: 3")));
    }

    @Test
    void retryDelayIsNegativeWhenAbsent() {
        assertEquals(-1, ProviderErrorClassifier.extractRetryDelayMs(new RuntimeException("429")));
    }

    @Test
    void describeIsSingleLineAndBounded() {
        String description = ProviderErrorClassifier.describe(
                new IllegalStateException("line one\nline two " + "x".repeat(400)));

        assertTrue(description.startsWith("IllegalStateException: line one line two"));
        assertFalse(description.contains("\n"));
        assertEquals(303, description.length());
        assertEquals("", ProviderErrorClassifier.describe(null));
    }
}
