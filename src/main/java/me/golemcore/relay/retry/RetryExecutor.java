package me.golemcore.relay.retry;

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

import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs an operation with exponential backoff and jitter.
 *
 * <p>
 * Every attempt first passes through the shared {@link RateLimiter}. Failures
 * are classified by {@link RetryClassifier}; non-retryable ones propagate
 * immediately. Retry number {@code n} waits
 * {@code min(baseDelay * exponentialBase^(n-1), maxDelay)} plus up to
 * {@code maxJitterMs} of random jitter. After {@code maxRetries + 1} failed
 * attempts the last error is rethrown.
 *
 * <p>
 * Two policies come from configuration: the per-call default
 * ({@code relay.retry.*}) and the initialization policy used while the
 * upstream server may still be booting.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class RetryExecutor {

    private final RateLimiter rateLimiter;
    private final RetryPolicy defaultPolicy;
    private final RetryPolicy initializationPolicy;

    @Autowired
    public RetryExecutor(RateLimiter rateLimiter, RelayProperties properties) {
        this(rateLimiter, policyFrom(properties.getRetry(), false), policyFrom(properties.getRetry(), true));
    }

    public RetryExecutor(RateLimiter rateLimiter, RetryPolicy defaultPolicy, RetryPolicy initializationPolicy) {
        this.rateLimiter = rateLimiter;
        this.defaultPolicy = defaultPolicy;
        this.initializationPolicy = initializationPolicy;
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public RetryPolicy getInitializationPolicy() {
        return initializationPolicy;
    }

    public <T> T execute(Callable<T> operation, String operationName) {
        return execute(operation, operationName, defaultPolicy);
    }

    /**
     * Execute {@code operation}, retrying transient failures per
     * {@code policy}.
     *
     * @return the operation's result
     * @throws RuntimeException
     *             the last failure once retries are exhausted, or the first
     *             non-retryable one; checked exceptions are wrapped
     */
    public <T> T execute(Callable<T> operation, String operationName, RetryPolicy policy) {
        int maxAttempts = policy.getMaxRetries() + 1;

        for (int attempt = 1;; attempt++) {
            rateLimiter.acquire();
            try {
                T result = operation.call();
                if (attempt > 1) {
                    log.info("[Retry] {} succeeded on attempt {}", operationName, attempt);
                }
                return result;
            } catch (Exception e) {
                boolean retryable = RetryClassifier.isRetryable(e, policy.getRetryablePatterns());
                if (!retryable || attempt >= maxAttempts) {
                    log.error("[Retry] {} failed after {} attempt(s): {}", operationName, attempt, e.getMessage());
                    throw asUnchecked(e);
                }

                long delay = policy.computeBaseDelay(attempt) + jitter(policy.getMaxJitterMs());
                log.warn("[Retry] {} attempt {}/{} failed, retrying in {}ms: {}",
                        operationName, attempt, maxAttempts, delay, e.getMessage());
                try {
                    sleepForRetry(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[Retry] {} interrupted while backing off", operationName);
                    throw asUnchecked(e);
                }
            }
        }
    }

    // Package-private for testing
    void sleepForRetry(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }

    long jitter(long maxJitterMs) {
        if (maxJitterMs <= 0) {
            return 0;
        }
        return ThreadLocalRandom.current().nextLong(maxJitterMs + 1);
    }

    private static RuntimeException asUnchecked(Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        if (e instanceof IOException io) {
            return new UncheckedIOException(io);
        }
        return new IllegalStateException(e.getMessage(), e);
    }

    private static RetryPolicy policyFrom(RelayProperties.RetryProperties retry, boolean initialization) {
        return RetryPolicy.builder()
                .maxRetries(initialization ? retry.getInitMaxRetries() : retry.getMaxRetries())
                .baseDelayMs(initialization ? retry.getInitBaseDelayMs() : retry.getBaseDelayMs())
                .maxDelayMs(retry.getMaxDelayMs())
                .exponentialBase(retry.getExponentialBase())
                .maxJitterMs(retry.getMaxJitterMs())
                .build();
    }
}
