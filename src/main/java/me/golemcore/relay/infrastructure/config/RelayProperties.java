package me.golemcore.relay.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the relay.
 *
 * <p>
 * All relay configuration is organized under the {@code relay.*} prefix. This
 * class contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link MattermostProperties} - server URL, credential, team, bot
 * identity</li>
 * <li>{@link RateLimitProperties} - shared outbound request ceiling</li>
 * <li>{@link RetryProperties} - per-call and initialization retry
 * policies</li>
 * <li>{@link StreamProperties} - event stream authentication and
 * reconnection</li>
 * <li>{@link RouterProperties} - message routing and reply generation</li>
 * <li>{@link LlmProperties} - reasoning backend selection</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private boolean enabled = true;
    private MattermostProperties mattermost = new MattermostProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private RetryProperties retry = new RetryProperties();
    private StreamProperties stream = new StreamProperties();
    private RouterProperties router = new RouterProperties();
    private HttpProperties http = new HttpProperties();
    private LlmProperties llm = new LlmProperties();

    @Data
    public static class MattermostProperties {
        private String url;
        private String token;
        private String team;
        private String botUsername = "relay-bot";
        private long wsPingIntervalMs = 30000;
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int requestsPerWindow = 10;
        private long windowMs = 1000;
    }

    @Data
    public static class RetryProperties {
        private int maxRetries = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 10000;
        private double exponentialBase = 2.0;
        private long maxJitterMs = 1000;
        private int initMaxRetries = 5;
        private long initBaseDelayMs = 2000;
    }

    @Data
    public static class StreamProperties {
        private long authTimeoutMs = 10000;
        private int maxReconnectAttempts = 10;
        private long reconnectBaseDelayMs = 1000;
        private long reconnectMaxDelayMs = 30000;
    }

    @Data
    public static class RouterProperties {
        private int workerThreads = 8;
        private int maxCacheSize = 1000;
        private int threadContextMaxMessages = 15;
        private double temperature = 0.7;
        private int maxTokens = 256;
        private boolean fallbackMessagesEnabled = true;
        private int breakerFailureThreshold = 5;
        private long breakerOpenTimeoutMs = 60000;
        private int breakerHalfOpenSuccesses = 3;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private long timeoutMs = 60000;
    }
}
