package me.golemcore.relay.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CircuitBreakerStatus;
import me.golemcore.relay.domain.model.CircuitState;

import java.time.Clock;

/**
 * Per-dependency circuit breaker.
 *
 * <p>
 * CLOSED counts failures; a success in CLOSED forgives one failure. Reaching
 * {@code failureThreshold} opens the circuit. OPEN rejects calls until
 * {@code openTimeoutMs} has passed since the last failure, then lets calls
 * through in HALF_OPEN. {@code halfOpenSuccesses} consecutive successes close
 * it again; any failure in HALF_OPEN reopens it.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final long openTimeoutMs;
    private final int halfOpenSuccesses;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failures;
    private long lastFailureTimeMs;
    private int successCount;

    public CircuitBreaker(String name, int failureThreshold, long openTimeoutMs, int halfOpenSuccesses, Clock clock) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.openTimeoutMs = openTimeoutMs;
        this.halfOpenSuccesses = halfOpenSuccesses;
        this.clock = clock;
    }

    /**
     * Whether a call may proceed now. Moves OPEN to HALF_OPEN once the timeout
     * elapsed.
     */
    public synchronized boolean tryAcquirePermission() {
        if (state != CircuitState.OPEN) {
            return true;
        }
        if (clock.millis() - lastFailureTimeMs >= openTimeoutMs) {
            state = CircuitState.HALF_OPEN;
            successCount = 0;
            log.info("[Circuit] {} half-open, probing", name);
            return true;
        }
        return false;
    }

    public synchronized void onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            successCount++;
            if (successCount >= halfOpenSuccesses) {
                state = CircuitState.CLOSED;
                failures = 0;
                successCount = 0;
                log.info("[Circuit] {} closed", name);
            }
        } else if (state == CircuitState.CLOSED && failures > 0) {
            failures--;
        }
    }

    public synchronized void onError() {
        failures++;
        lastFailureTimeMs = clock.millis();
        if (state == CircuitState.HALF_OPEN || failures >= failureThreshold) {
            if (state != CircuitState.OPEN) {
                log.warn("[Circuit] {} opened after {} failure(s)", name, failures);
            }
            state = CircuitState.OPEN;
            successCount = 0;
        }
    }

    public String getName() {
        return name;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStatus getStatus() {
        return CircuitBreakerStatus.builder()
                .name(name)
                .state(state)
                .failures(failures)
                .lastFailureTimeMs(lastFailureTimeMs)
                .successCount(successCount)
                .build();
    }
}
