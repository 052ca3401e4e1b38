package me.golemcore.relay.retry;

import me.golemcore.relay.domain.model.MattermostApiException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryClassifierTest {

    @Test
    void shouldRetryTransientStatusCodes() {
        for (int status : new int[] { 429, 500, 502, 503, 504 }) {
            assertTrue(RetryClassifier.isRetryable(new MattermostApiException("HTTP " + status, status), List.of()),
                    "status " + status);
        }
    }

    @Test
    void shouldNotRetryOtherClientErrors() {
        for (int status : new int[] { 400, 401, 403, 404, 409 }) {
            assertFalse(RetryClassifier.isRetryable(new MattermostApiException("HTTP " + status, status), List.of()),
                    "status " + status);
        }
    }

    @Test
    void shouldRetryApiErrorWithoutStatus() {
        assertTrue(RetryClassifier.isRetryable(new MattermostApiException("network error: reset", null), List.of()));
    }

    @Test
    void shouldRetryIoFailuresAnywhereInCauseChain() {
        assertTrue(RetryClassifier.isRetryable(new SocketTimeoutException("read"), List.of()));
        assertTrue(RetryClassifier.isRetryable(
                new UncheckedIOException(new IOException("broken pipe")), List.of()));
    }

    @Test
    void shouldRetryOnMessagePatterns() {
        assertTrue(RetryClassifier.isRetryable(new IllegalStateException("Rate limit exceeded"), List.of()));
        assertTrue(RetryClassifier.isRetryable(new IllegalStateException("Network unreachable"), List.of()));
        assertTrue(RetryClassifier.isRetryable(new IllegalStateException("request timeout"), List.of()));
        assertTrue(RetryClassifier.isRetryable(new IllegalStateException("Maintenance Mode"),
                List.of("maintenance")));
    }

    @Test
    void shouldNotRetryPlainProgrammingErrors() {
        assertFalse(RetryClassifier.isRetryable(new IllegalArgumentException("bad id"), List.of()));
        assertFalse(RetryClassifier.isRetryable(new NullPointerException(), List.of()));
        assertFalse(RetryClassifier.isRetryable(null, List.of()));
    }
}
