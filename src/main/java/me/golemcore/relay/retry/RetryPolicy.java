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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable retry configuration for one {@link RetryExecutor#execute} call.
 *
 * <p>
 * Attempt state never lives here; a policy can be shared between concurrent
 * calls.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    long baseDelayMs = 1000;

    @Builder.Default
    long maxDelayMs = 10000;

    @Builder.Default
    double exponentialBase = 2.0;

    @Builder.Default
    long maxJitterMs = 1000;

    /** Extra lower-case message fragments that mark an error as transient. */
    @Singular
    List<String> retryablePatterns;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy initialization() {
        return RetryPolicy.builder()
                .maxRetries(5)
                .baseDelayMs(2000)
                .build();
    }

    /**
     * Delay before retry number {@code attempt} (1-based), without jitter:
     * {@code min(baseDelay * exponentialBase^(attempt-1), maxDelay)}.
     */
    public long computeBaseDelay(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double delay = baseDelayMs * Math.pow(exponentialBase, exponent);
        if (Double.isNaN(delay) || delay >= maxDelayMs) {
            return maxDelayMs;
        }
        return (long) delay;
    }
}
