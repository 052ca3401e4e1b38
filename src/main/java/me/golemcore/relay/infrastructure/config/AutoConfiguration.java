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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.service.RelayService;
import me.golemcore.relay.port.outbound.ReasoningPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring auto-configuration that starts the relay on application startup and
 * stops it on shutdown.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock}, {@link ObjectMapper} and router
 * worker pool</li>
 * <li>Logs startup information (server, team, reasoning provider)</li>
 * <li>Starts the relay via {@code @PostConstruct} when
 * {@code relay.enabled} is true</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RelayProperties properties;
    private final RelayService relayService;
    private final ReasoningPort reasoningPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdown")
    public static ExecutorService routerExecutor(RelayProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getRouter().getWorkerThreads()), r -> {
            Thread t = new Thread(r, "relay-router-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Relay v{} starting...", version);
        log.info("Mattermost server: {}", properties.getMattermost().getUrl());
        log.info("Team: {}", properties.getMattermost().getTeam());
        log.info("Reasoning provider: {}", reasoningPort.getProviderName());

        if (!properties.isEnabled()) {
            log.info("Relay disabled (relay.enabled=false), not connecting");
            return;
        }
        relayService.start();
        log.info("GolemCore Relay started successfully");
    }

    @PreDestroy
    public void shutdown() {
        relayService.stop();
    }
}
