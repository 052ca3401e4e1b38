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
import me.golemcore.relay.domain.model.ServiceHealth;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.EventStreamPort;
import me.golemcore.relay.port.outbound.ChatApiPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts and stops the relay as one unit.
 *
 * <p>
 * Start order is REST gateway, event stream, message router, channel
 * memberships. Stop runs in reverse and never throws. Only configuration and
 * REST failures abort a start; an event stream that does not come up in time
 * is left to its own reconnect loop.
 */
@Service
@Slf4j
public class RelayService {

    private final ChatApiPort chatApi;
    private final EventStreamPort eventStream;
    private final MessageRouter messageRouter;
    private final ChannelMembershipService membershipService;
    private final long connectTimeoutMs;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private volatile long startedAtMs;

    public RelayService(ChatApiPort chatApi, EventStreamPort eventStream, MessageRouter messageRouter,
            ChannelMembershipService membershipService, RelayProperties properties, Clock clock) {
        this.chatApi = chatApi;
        this.eventStream = eventStream;
        this.messageRouter = messageRouter;
        this.membershipService = membershipService;
        this.connectTimeoutMs = properties.getStream().getAuthTimeoutMs() + properties.getHttp().getConnectTimeout();
        this.clock = clock;
    }

    /**
     * Bring the relay up. A second call while running is a no-op.
     *
     * @throws IllegalStateException
     *             when the REST gateway or a later component fails to
     *             initialize; components started so far are stopped again
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Relay] Already running");
                return;
            }
            log.info("[Relay] Starting");
            try {
                chatApi.initialize();
                log.info("[Relay] REST gateway ready as {}", chatApi.getBotUser().getUsername());

                awaitStream();

                messageRouter.initialize();
                membershipService.initialize();

                startedAtMs = clock.millis();
                running = true;
                log.info("[Relay] Started, listening in {} channel(s)", membershipService.getJoinedChannels().size());
            } catch (RuntimeException e) {
                log.error("[Relay] Failed to start: {}", e.getMessage());
                log.error("[Relay] Check relay.mattermost.url (server reachable), relay.mattermost.token "
                        + "(valid bot access token) and relay.mattermost.team (team name the bot belongs to)");
                shutdownComponents();
                throw e instanceof IllegalStateException ise ? ise
                        : new IllegalStateException("Relay failed to start: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Bring the relay down. Safe to call at any time.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            boolean wasRunning = running;
            running = false;
            shutdownComponents();
            if (wasRunning) {
                log.info("[Relay] Stopped after {}", Duration.ofMillis(clock.millis() - startedAtMs));
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Health is HEALTHY when every component is up, UNHEALTHY when the REST
     * gateway is unusable or stream reconnection gave up, DEGRADED otherwise.
     */
    public ServiceHealth getHealth() {
        boolean apiAvailable = chatApi.isReady();
        boolean streamConnected = eventStream.isConnected();
        boolean routerReady = messageRouter.isReady();
        boolean reconnectExhausted = eventStream.isReconnectExhausted();

        ServiceHealth.Status status;
        if (!apiAvailable || reconnectExhausted) {
            status = ServiceHealth.Status.UNHEALTHY;
        } else if (streamConnected && routerReady) {
            status = ServiceHealth.Status.HEALTHY;
        } else {
            status = ServiceHealth.Status.DEGRADED;
        }

        return ServiceHealth.builder()
                .status(status)
                .streamConnected(streamConnected)
                .apiAvailable(apiAvailable)
                .routerReady(routerReady)
                .reconnectExhausted(reconnectExhausted)
                .uptime(running ? Duration.ofMillis(clock.millis() - startedAtMs) : Duration.ZERO)
                .build();
    }

    private void awaitStream() {
        try {
            eventStream.connect().get(connectTimeoutMs, TimeUnit.MILLISECONDS);
            log.info("[Relay] Event stream authenticated");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while connecting the event stream", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Relay] Event stream not connected yet, reconnecting in background: {}", cause.getMessage());
        } catch (TimeoutException e) {
            log.warn("[Relay] Event stream did not authenticate within {}ms, reconnecting in background",
                    connectTimeoutMs);
        }
    }

    private void shutdownComponents() {
        try {
            messageRouter.cleanup();
        } catch (RuntimeException e) {
            log.warn("[Relay] Router cleanup failed: {}", e.getMessage());
        }
        try {
            membershipService.cleanup();
        } catch (RuntimeException e) {
            log.warn("[Relay] Membership cleanup failed: {}", e.getMessage());
        }
        try {
            eventStream.disconnect();
        } catch (RuntimeException e) {
            log.warn("[Relay] Stream disconnect failed: {}", e.getMessage());
        }
    }
}
