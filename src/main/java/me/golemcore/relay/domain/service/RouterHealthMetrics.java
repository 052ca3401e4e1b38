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

import me.golemcore.relay.domain.model.ErrorType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters of routed messages and a rolling average of their processing
 * time.
 */
class RouterHealthMetrics {

    static final int MAX_RESPONSE_TIME_SAMPLES = 100;

    private long totalMessages;
    private long successfulResponses;
    private long failedResponses;
    private final Map<ErrorType, Long> errorsByType = new EnumMap<>(ErrorType.class);
    private final Deque<Long> responseTimes = new ArrayDeque<>();
    private long responseTimeSum;

    synchronized void recordSuccess(long responseTimeMs) {
        totalMessages++;
        successfulResponses++;
        addSample(responseTimeMs);
    }

    synchronized void recordFailure(long responseTimeMs, ErrorType errorType) {
        totalMessages++;
        failedResponses++;
        errorsByType.merge(errorType, 1L, Long::sum);
        addSample(responseTimeMs);
    }

    synchronized long getTotalMessages() {
        return totalMessages;
    }

    synchronized long getSuccessfulResponses() {
        return successfulResponses;
    }

    synchronized long getFailedResponses() {
        return failedResponses;
    }

    synchronized double getAverageResponseTimeMs() {
        return responseTimes.isEmpty() ? 0.0 : (double) responseTimeSum / responseTimes.size();
    }

    synchronized Map<ErrorType, Long> getErrorsByType() {
        Map<ErrorType, Long> copy = new EnumMap<>(ErrorType.class);
        for (ErrorType type : ErrorType.values()) {
            copy.put(type, errorsByType.getOrDefault(type, 0L));
        }
        return copy;
    }

    synchronized void clearResponseTimes() {
        responseTimes.clear();
        responseTimeSum = 0;
    }

    private void addSample(long responseTimeMs) {
        responseTimes.addLast(responseTimeMs);
        responseTimeSum += responseTimeMs;
        if (responseTimes.size() > MAX_RESPONSE_TIME_SAMPLES) {
            responseTimeSum -= responseTimes.removeFirst();
        }
    }
}
