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

import me.golemcore.relay.domain.model.MattermostApiException;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a failed attempt is worth repeating.
 *
 * <p>
 * A {@link MattermostApiException} carries its own verdict (no status, a
 * 429/5xx status, or a rate-limit message). Any other error is retryable when
 * an {@link IOException} sits in its cause chain or its message mentions a
 * rate limit, a network or timeout problem, or one of the caller's patterns.
 */
public final class RetryClassifier {

    private static final List<String> GENERIC_PATTERNS = List.of("network", "timeout");

    private RetryClassifier() {
    }

    public static boolean isRetryable(Throwable error, List<String> retryablePatterns) {
        if (error == null) {
            return false;
        }
        if (error instanceof MattermostApiException apiException) {
            return apiException.isRetryable();
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = error;
        while (current != null && visited.add(current)) {
            if (current instanceof IOException) {
                return true;
            }
            if (matchesMessage(current.getMessage(), retryablePatterns)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean matchesMessage(String message, List<String> retryablePatterns) {
        if (message == null || message.isBlank()) {
            return false;
        }
        if (MattermostApiException.isRateLimitMessage(message)) {
            return true;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : GENERIC_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        if (retryablePatterns != null) {
            for (String pattern : retryablePatterns) {
                if (pattern != null && !pattern.isBlank() && lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }
}
