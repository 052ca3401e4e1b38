package me.golemcore.relay.ratelimit;

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

import me.golemcore.relay.domain.model.RateLimitWindow;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Fixed-window request limiter shared by every REST call in the process.
 *
 * <p>
 * Admits at most {@code requestsPerWindow} requests per {@code windowMs}
 * (default 10 per second). When the window is exhausted the caller sleeps until
 * the window boundary, the counter resets, and the caller is admitted. Counting
 * happens under a lock, sleeping happens outside it, so one waiting thread
 * never blocks another thread from reading the state.
 *
 * <p>
 * The limiter also honours the server's own view: when the last response
 * reported {@code X-Ratelimit-Remaining: 0}, callers wait until the reported
 * reset instant.
 *
 * <p>
 * Process-wide scope comes from the Spring singleton, not from a static field.
 * Tests construct isolated instances with their own clock.
 *
 * <p>
 * Can be disabled via {@code relay.rate-limit.enabled=false}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    private final boolean enabled;
    private final int requestsPerWindow;
    private final long windowMs;
    private final Clock clock;

    private final Object lock = new Object();
    private int requestCount;
    private long windowStartMs;
    private Integer serverRemaining;
    private Long serverResetAtMs;

    @Autowired
    public FixedWindowRateLimiter(RelayProperties properties, Clock clock) {
        this(properties.getRateLimit().isEnabled(),
                properties.getRateLimit().getRequestsPerWindow(),
                properties.getRateLimit().getWindowMs(),
                clock);
    }

    public FixedWindowRateLimiter(boolean enabled, int requestsPerWindow, long windowMs, Clock clock) {
        if (requestsPerWindow <= 0) {
            throw new IllegalArgumentException("requestsPerWindow must be positive");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
        this.enabled = enabled;
        this.requestsPerWindow = requestsPerWindow;
        this.windowMs = windowMs;
        this.clock = clock;
        this.windowStartMs = clock.millis();
    }

    @Override
    public void acquire() {
        if (!enabled) {
            return;
        }

        while (true) {
            long waitMs;
            synchronized (lock) {
                long now = clock.millis();
                if (now - windowStartMs >= windowMs) {
                    windowStartMs = now;
                    requestCount = 0;
                }

                waitMs = serverWaitMs(now);
                if (waitMs <= 0) {
                    if (requestCount < requestsPerWindow) {
                        requestCount++;
                        return;
                    }
                    waitMs = windowMs - (now - windowStartMs);
                }
            }

            log.debug("[RateLimit] Window exhausted, waiting {}ms", waitMs);
            try {
                sleep(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for rate limit window", e);
            }
        }
    }

    @Override
    public void updateFromHeaders(String remaining, String resetSeconds) {
        Integer parsedRemaining = parseInteger(remaining);
        Integer parsedReset = parseInteger(resetSeconds);
        synchronized (lock) {
            if (parsedRemaining != null) {
                serverRemaining = parsedRemaining;
            }
            if (parsedReset != null) {
                serverResetAtMs = clock.millis() + parsedReset * 1000L;
            }
        }
    }

    @Override
    public RateLimitWindow getWindow() {
        synchronized (lock) {
            return RateLimitWindow.builder()
                    .requestCount(requestCount)
                    .windowStartMs(windowStartMs)
                    .serverRemaining(serverRemaining)
                    .serverResetAtMs(serverResetAtMs)
                    .build();
        }
    }

    // Package-private for testing
    void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    private long serverWaitMs(long now) {
        if (serverRemaining == null || serverRemaining > 0 || serverResetAtMs == null) {
            return 0;
        }
        long wait = serverResetAtMs - now;
        if (wait <= 0) {
            serverRemaining = null;
            serverResetAtMs = null;
            return 0;
        }
        return wait;
    }

    private static Integer parseInteger(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.debug("[RateLimit] Ignoring malformed header value: {}", value);
            return null;
        }
    }
}
