package me.golemcore.relay.domain.model;

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

import java.util.Locale;
import java.util.Set;

/**
 * Normalized failure of a Mattermost REST call.
 *
 * <p>
 * Every transport error (HTTP status, I/O failure, malformed body) is mapped
 * to this type so the retry executor and the callers share one vocabulary:
 * <ul>
 * <li>{@code statusCode} - HTTP status, or null for network-level
 * failures</li>
 * <li>{@code retryable} - whether repeating the same call can succeed</li>
 * <li>{@code serverErrorId} - Mattermost's {@code id} field from the error
 * body, when present</li>
 * </ul>
 *
 * @since 1.0
 */
public class MattermostApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    private final Integer statusCode;
    private final boolean retryable;
    private final String serverErrorId;

    public MattermostApiException(String message, Integer statusCode) {
        this(message, statusCode, null, null);
    }

    public MattermostApiException(String message, Integer statusCode, String serverErrorId, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.serverErrorId = serverErrorId;
        this.retryable = classifyRetryable(statusCode, message);
    }

    /**
     * Build an exception whose message reads {@code "<context>: <detail>"}.
     */
    public static MattermostApiException of(String context, String detail, Integer statusCode,
            String serverErrorId, Throwable cause) {
        String message = detail == null || detail.isBlank() ? context : context + ": " + detail;
        return new MattermostApiException(message, statusCode, serverErrorId, cause);
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getServerErrorId() {
        return serverErrorId;
    }

    public boolean isAuthenticationFailure() {
        return statusCode != null && (statusCode == 401 || statusCode == 403);
    }

    public static boolean isRetryableStatus(Integer statusCode) {
        return statusCode != null && RETRYABLE_STATUS_CODES.contains(statusCode);
    }

    public static boolean isRateLimitMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("rate limit") || lower.contains("too many requests");
    }

    private static boolean classifyRetryable(Integer statusCode, String message) {
        if (statusCode == null) {
            return true;
        }
        return isRetryableStatus(statusCode) || isRateLimitMessage(message);
    }
}
