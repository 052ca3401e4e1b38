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

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Coarse failure categories used for user-facing apologies and health
 * metrics.
 */
public enum ErrorType {
    NETWORK_ERROR,
    API_RATE_LIMIT,
    AI_MODEL_ERROR,
    AUTHENTICATION_ERROR,
    VALIDATION_ERROR,
    TIMEOUT_ERROR,
    UNKNOWN_ERROR;

    /**
     * Categorize a failure from its status code and message, walking the cause
     * chain. Checks run in a fixed order: network, rate limit, authentication,
     * timeout, validation, model.
     */
    public static ErrorType categorize(Throwable error) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = error;
        while (current != null && visited.add(current)) {
            ErrorType type = categorizeSingle(current);
            if (type != UNKNOWN_ERROR) {
                return type;
            }
            current = current.getCause();
        }
        return UNKNOWN_ERROR;
    }

    private static ErrorType categorizeSingle(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage().toLowerCase(Locale.ROOT) : "";
        Integer status = error instanceof MattermostApiException api ? api.getStatusCode() : null;

        if (message.contains("network") || message.contains("connection refused")
                || error instanceof UnknownHostException || error instanceof ConnectException) {
            return NETWORK_ERROR;
        }
        if (message.contains("rate limit") || message.contains("too many requests")
                || (status != null && status == 429)) {
            return API_RATE_LIMIT;
        }
        if (message.contains("unauthorized") || message.contains("forbidden")
                || (status != null && (status == 401 || status == 403))) {
            return AUTHENTICATION_ERROR;
        }
        if (message.contains("timeout") || message.contains("timed out")
                || error instanceof TimeoutException
                || error instanceof SocketTimeoutException) {
            return TIMEOUT_ERROR;
        }
        if (message.contains("validation") || message.contains("invalid") || (status != null && status == 400)) {
            return VALIDATION_ERROR;
        }
        if (message.contains("model") || message.contains("generation")) {
            return AI_MODEL_ERROR;
        }
        return UNKNOWN_ERROR;
    }
}
