package me.golemcore.relay.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the shared OkHttp client.
 *
 * <p>
 * The REST gateway and the event stream client derive their own clients from
 * this one via {@link OkHttpClient#newBuilder()}, so they share the connection
 * pool and dispatcher threads. Every request carries the relay's
 * {@code User-Agent}; request lines are logged at debug level without headers,
 * so the bearer token never reaches the log.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    static final String USER_AGENT = "golemcore-relay";

    private final RelayProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        RelayProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(false)
                .addInterceptor(OkHttpConfig::tagAndLog)
                .build();
    }

    static Response tagAndLog(Interceptor.Chain chain) throws IOException {
        Request request = chain.request().newBuilder()
                .header("User-Agent", USER_AGENT)
                .build();
        long startedAt = System.nanoTime();
        Response response = chain.proceed(request);
        if (log.isDebugEnabled()) {
            log.debug("[HTTP] {} {} -> {} ({}ms)", request.method(), request.url().encodedPath(), response.code(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
        }
        return response;
    }
}
