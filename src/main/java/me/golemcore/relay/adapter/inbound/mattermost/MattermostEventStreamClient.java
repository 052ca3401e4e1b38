package me.golemcore.relay.adapter.inbound.mattermost;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ConnectionState;
import me.golemcore.relay.domain.model.StreamEvent;
import me.golemcore.relay.domain.model.StreamEventMetadata;
import me.golemcore.relay.infrastructure.config.MattermostSettingsValidator;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.EventStreamPort;
import me.golemcore.relay.port.inbound.StreamEventListener;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mattermost WebSocket event stream client.
 *
 * <p>
 * Connection lifecycle:
 * <ol>
 * <li>{@link #connect()} opens the socket (CONNECTING)
 * <li>on open, the authentication challenge carrying the access token is sent
 * (AUTHENTICATING)
 * <li>the server's {@code hello} event completes authentication
 * (AUTHENTICATED) and a synthetic {@code authenticated} event is emitted
 * <li>close or failure returns to DISCONNECTED
 * </ol>
 *
 * <p>
 * An attempt that is not authenticated within {@code relay.stream.auth-timeout-ms}
 * fails. Failed attempts and unexpected closures (any close code other than
 * 1000) schedule a reconnection after {@code min(base * 2^attempt, max)}
 * milliseconds. After {@code relay.stream.max-reconnect-attempts} consecutive
 * failures the client gives up, logs an error and emits
 * {@value #RECONNECT_EXHAUSTED_EVENT}.
 *
 * <p>
 * Frames are dispatched in arrival order on OkHttp's reader thread, to
 * listeners of the exact event name and then to wildcard listeners. Dispatch
 * iterates a snapshot of the registry, so listeners may (un)register others
 * while running. A throwing listener is logged and skipped.
 *
 * <p>
 * Callbacks from a socket that is no longer current (replaced by a reconnect
 * or closed by {@link #disconnect()}) are ignored.
 *
 * @see EventStreamPort
 */
@Component
@Slf4j
public class MattermostEventStreamClient implements EventStreamPort {

    static final String HELLO_EVENT = "hello";
    static final String AUTHENTICATED_EVENT = "authenticated";
    static final String RECONNECT_EXHAUSTED_EVENT = "reconnect_exhausted";
    static final int NORMAL_CLOSURE = 1000;

    private final WebSocket.Factory socketFactory;
    private final ObjectMapper objectMapper;
    private final StreamFrameParser frameParser;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Settings settings;
    private final Clock clock;

    private final Map<String, Set<StreamEventListener>> listeners = new ConcurrentHashMap<>();

    private final Object stateLock = new Object();
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private WebSocket socket;
    private CompletableFuture<Void> pendingConnect;
    private ScheduledFuture<?> authTimeoutTask;
    private ScheduledFuture<?> reconnectTask;
    private int reconnectAttempts;
    private boolean reconnectExhausted;
    private boolean shutdownRequested;
    private long nextSeq = 1;

    /**
     * Connection settings of the stream.
     */
    @Value
    @Builder
    public static class Settings {
        HttpUrl streamUrl;
        String token;
        @Builder.Default
        long authTimeoutMs = 10000;
        @Builder.Default
        int maxReconnectAttempts = 10;
        @Builder.Default
        long reconnectBaseDelayMs = 1000;
        @Builder.Default
        long reconnectMaxDelayMs = 30000;
    }

    @Autowired
    public MattermostEventStreamClient(RelayProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper, Clock clock) {
        this(baseHttpClient.newBuilder()
                .pingInterval(properties.getMattermost().getWsPingIntervalMs(), TimeUnit.MILLISECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build(),
                objectMapper,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "mattermost-stream");
                    t.setDaemon(true);
                    return t;
                }),
                true,
                settingsFrom(properties),
                clock);
    }

    public MattermostEventStreamClient(WebSocket.Factory socketFactory, ObjectMapper objectMapper,
            ScheduledExecutorService scheduler, Settings settings, Clock clock) {
        this(socketFactory, objectMapper, scheduler, false, settings, clock);
    }

    private MattermostEventStreamClient(WebSocket.Factory socketFactory, ObjectMapper objectMapper,
            ScheduledExecutorService scheduler, boolean ownsScheduler, Settings settings, Clock clock) {
        this.socketFactory = socketFactory;
        this.objectMapper = objectMapper;
        this.frameParser = new StreamFrameParser(objectMapper);
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.settings = settings;
        this.clock = clock;
    }

    // ==================== CONNECTION ====================

    @Override
    public CompletableFuture<Void> connect() {
        synchronized (stateLock) {
            if (state == ConnectionState.AUTHENTICATED) {
                return CompletableFuture.completedFuture(null);
            }
            if (pendingConnect != null && !pendingConnect.isDone()) {
                log.debug("[Stream] Connect already in flight, sharing pending attempt");
                return pendingConnect;
            }
            shutdownRequested = false;
            reconnectExhausted = false;
            reconnectAttempts = 0;
            cancel(reconnectTask);
            reconnectTask = null;

            pendingConnect = new CompletableFuture<>();
            CompletableFuture<Void> result = pendingConnect;
            openSocketLocked();
            return result;
        }
    }

    @Override
    public void disconnect() {
        WebSocket toClose;
        CompletableFuture<Void> abandoned;
        synchronized (stateLock) {
            shutdownRequested = true;
            cancel(reconnectTask);
            cancel(authTimeoutTask);
            reconnectTask = null;
            authTimeoutTask = null;
            toClose = socket;
            socket = null;
            abandoned = pendingConnect;
            pendingConnect = null;
            state = ConnectionState.DISCONNECTED;
            reconnectAttempts = 0;
        }

        if (toClose != null) {
            toClose.close(NORMAL_CLOSURE, "Client disconnect");
        }
        if (abandoned != null) {
            abandoned.completeExceptionally(new IllegalStateException("Event stream disconnected"));
        }
        listeners.clear();
        log.info("[Stream] Disconnected");
    }

    @PreDestroy
    public void destroy() {
        disconnect();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    @Override
    public boolean isConnected() {
        synchronized (stateLock) {
            return state == ConnectionState.AUTHENTICATED && socket != null;
        }
    }

    @Override
    public ConnectionState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    @Override
    public boolean isReconnectExhausted() {
        synchronized (stateLock) {
            return reconnectExhausted;
        }
    }

    int getReconnectAttempts() {
        synchronized (stateLock) {
            return reconnectAttempts;
        }
    }

    /**
     * Delay before reconnection attempt {@code attempt} (0-based).
     */
    long computeReconnectDelay(int attempt) {
        double delay = settings.getReconnectBaseDelayMs() * Math.pow(2, attempt);
        return (long) Math.min(delay, settings.getReconnectMaxDelayMs());
    }

    // Caller holds stateLock
    private void openSocketLocked() {
        state = ConnectionState.CONNECTING;
        Request request = new Request.Builder().url(settings.getStreamUrl()).build();
        log.info("[Stream] Connecting to {}", settings.getStreamUrl());
        WebSocket opened = socketFactory.newWebSocket(request, new ConnectionListener());
        socket = opened;
        cancel(authTimeoutTask);
        authTimeoutTask = scheduler.schedule(() -> onAuthenticationTimeout(opened),
                settings.getAuthTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    private void onOpen(WebSocket webSocket) {
        long seq;
        synchronized (stateLock) {
            if (webSocket != socket) {
                return;
            }
            state = ConnectionState.AUTHENTICATING;
            seq = nextSeq++;
        }

        AuthenticationChallengeFrame challenge = AuthenticationChallengeFrame.of(seq, settings.getToken());
        try {
            webSocket.send(objectMapper.writeValueAsString(challenge));
            log.info("[Stream] Socket open, authentication challenge sent");
        } catch (JsonProcessingException e) {
            log.error("[Stream] Cannot serialize authentication challenge", e);
            webSocket.cancel();
        }
    }

    private void onText(WebSocket webSocket, String text) {
        synchronized (stateLock) {
            if (webSocket != socket) {
                return;
            }
        }

        Optional<StreamEventFrame> parsed = frameParser.parse(text);
        if (parsed.isEmpty()) {
            return;
        }
        StreamEventFrame frame = parsed.get();
        StreamEventMetadata metadata = StreamEventMetadata.builder()
                .originalFrame(frame.original())
                .broadcast(frame.broadcast())
                .seq(frame.seq())
                .timestamp(clock.instant())
                .build();

        if (HELLO_EVENT.equals(frame.event())) {
            onAuthenticated(webSocket, frame, metadata);
            return;
        }
        dispatch(frame.event(), frame.data(), metadata);
    }

    private void onAuthenticated(WebSocket webSocket, StreamEventFrame frame, StreamEventMetadata metadata) {
        CompletableFuture<Void> completed;
        synchronized (stateLock) {
            if (webSocket != socket) {
                return;
            }
            state = ConnectionState.AUTHENTICATED;
            reconnectAttempts = 0;
            reconnectExhausted = false;
            cancel(authTimeoutTask);
            authTimeoutTask = null;
            completed = pendingConnect;
            pendingConnect = null;
        }

        log.info("[Stream] Authenticated (server {})", frame.data().path("server_version").asText("unknown"));
        if (completed != null) {
            completed.complete(null);
        }
        dispatch(AUTHENTICATED_EVENT, frame.data(), metadata);
    }

    private void onAuthenticationTimeout(WebSocket webSocket) {
        CompletableFuture<Void> failed;
        synchronized (stateLock) {
            if (webSocket != socket || state == ConnectionState.AUTHENTICATED) {
                return;
            }
            socket = null;
            authTimeoutTask = null;
            state = ConnectionState.DISCONNECTED;
            failed = pendingConnect;
            pendingConnect = null;
        }

        log.warn("[Stream] Not authenticated within {}ms, abandoning socket", settings.getAuthTimeoutMs());
        webSocket.cancel();
        if (failed != null) {
            failed.completeExceptionally(new TimeoutException(
                    "Event stream authentication timed out after " + settings.getAuthTimeoutMs() + "ms"));
        }
        scheduleReconnect();
    }

    private void onClosed(WebSocket webSocket, Integer code, String reason, Throwable error) {
        CompletableFuture<Void> failed;
        boolean reconnect;
        synchronized (stateLock) {
            if (webSocket != socket) {
                return;
            }
            socket = null;
            cancel(authTimeoutTask);
            authTimeoutTask = null;
            state = ConnectionState.DISCONNECTED;
            failed = pendingConnect;
            pendingConnect = null;
            reconnect = !shutdownRequested && (code == null || code != NORMAL_CLOSURE);
        }

        if (error != null) {
            log.warn("[Stream] Connection failed: {}", error.getMessage());
        } else {
            log.info("[Stream] Connection closed (code {}, reason '{}')", code, reason);
        }
        if (failed != null) {
            failed.completeExceptionally(error != null
                    ? error
                    : new IllegalStateException("Event stream closed before authentication (code " + code + ")"));
        }
        if (reconnect) {
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        boolean exhausted = false;
        long delay = 0;
        int attempt = 0;
        synchronized (stateLock) {
            if (shutdownRequested || (reconnectTask != null && !reconnectTask.isDone())) {
                return;
            }
            if (reconnectAttempts >= settings.getMaxReconnectAttempts()) {
                reconnectExhausted = true;
                exhausted = true;
            } else {
                delay = computeReconnectDelay(reconnectAttempts);
                reconnectAttempts++;
                attempt = reconnectAttempts;
                reconnectTask = scheduler.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
            }
        }

        if (exhausted) {
            log.error("[Stream] Maximum reconnection attempts ({}) reached, giving up",
                    settings.getMaxReconnectAttempts());
            emit(RECONNECT_EXHAUSTED_EVENT, objectMapper.createObjectNode()
                    .put("attempts", settings.getMaxReconnectAttempts()));
        } else {
            log.info("[Stream] Reconnecting in {}ms (attempt {}/{})", delay, attempt,
                    settings.getMaxReconnectAttempts());
        }
    }

    private void reconnect() {
        synchronized (stateLock) {
            reconnectTask = null;
            if (shutdownRequested || state != ConnectionState.DISCONNECTED) {
                return;
            }
            if (pendingConnect == null || pendingConnect.isDone()) {
                pendingConnect = new CompletableFuture<>();
            }
            openSocketLocked();
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    // ==================== LISTENERS ====================

    @Override
    public void on(String event, StreamEventListener listener) {
        listeners.computeIfAbsent(event, key -> new CopyOnWriteArraySet<>()).add(listener);
    }

    @Override
    public void off(String event, StreamEventListener listener) {
        listeners.computeIfPresent(event, (key, registered) -> {
            registered.removeIf(candidate -> candidate == listener
                    || (candidate instanceof OnceListener once && once.delegate == listener));
            return registered.isEmpty() ? null : registered;
        });
    }

    @Override
    public void once(String event, StreamEventListener listener) {
        on(event, new OnceListener(event, listener));
    }

    @Override
    public void removeAllListeners(String event) {
        listeners.remove(event);
    }

    @Override
    public void removeAllListeners() {
        listeners.clear();
    }

    @Override
    public int listenerCount(String event) {
        Set<StreamEventListener> registered = listeners.get(event);
        return registered != null ? registered.size() : 0;
    }

    @Override
    public Set<String> eventNames() {
        Set<String> names = new LinkedHashSet<>();
        listeners.forEach((name, registered) -> {
            if (!registered.isEmpty()) {
                names.add(name);
            }
        });
        return names;
    }

    @Override
    public void emit(String event, JsonNode data) {
        dispatch(event, data != null ? data : objectMapper.createObjectNode(), StreamEventMetadata.builder()
                .timestamp(clock.instant())
                .build());
    }

    private void dispatch(String event, JsonNode data, StreamEventMetadata metadata) {
        List<StreamEventListener> targets = new ArrayList<>(snapshot(event));
        if (!WILDCARD.equals(event)) {
            targets.addAll(snapshot(WILDCARD));
        }
        if (targets.isEmpty()) {
            log.trace("[Stream] No listeners for '{}'", event);
            return;
        }

        StreamEvent streamEvent = StreamEvent.builder()
                .name(event)
                .data(data)
                .metadata(metadata)
                .build();

        int failures = 0;
        for (StreamEventListener listener : targets) {
            try {
                listener.onEvent(streamEvent);
            } catch (RuntimeException e) {
                failures++;
                log.error("[Stream] Listener for '{}' failed: {}", event, e.getMessage(), e);
            }
        }
        if (failures > 0) {
            log.warn("[Stream] Event '{}' delivered with errors: {} ok, {} failed", event,
                    targets.size() - failures, failures);
        }
    }

    private List<StreamEventListener> snapshot(String event) {
        Set<StreamEventListener> registered = listeners.get(event);
        return registered != null ? new ArrayList<>(registered) : List.of();
    }

    private static Settings settingsFrom(RelayProperties properties) {
        HttpUrl baseUrl = MattermostSettingsValidator.validate(properties.getMattermost());
        RelayProperties.StreamProperties stream = properties.getStream();
        return Settings.builder()
                .streamUrl(baseUrl.newBuilder().addPathSegments("api/v4/websocket").build())
                .token(properties.getMattermost().getToken().trim())
                .authTimeoutMs(stream.getAuthTimeoutMs())
                .maxReconnectAttempts(stream.getMaxReconnectAttempts())
                .reconnectBaseDelayMs(stream.getReconnectBaseDelayMs())
                .reconnectMaxDelayMs(stream.getReconnectMaxDelayMs())
                .build();
    }

    private final class OnceListener implements StreamEventListener {

        private final String event;
        private final StreamEventListener delegate;
        private final AtomicBoolean fired = new AtomicBoolean();

        private OnceListener(String event, StreamEventListener delegate) {
            this.event = event;
            this.delegate = delegate;
        }

        @Override
        public void onEvent(StreamEvent streamEvent) {
            if (fired.compareAndSet(false, true)) {
                off(event, this);
                delegate.onEvent(streamEvent);
            }
        }
    }

    private final class ConnectionListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            MattermostEventStreamClient.this.onOpen(webSocket);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            onText(webSocket, text);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            MattermostEventStreamClient.this.onClosed(webSocket, code, reason, null);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            MattermostEventStreamClient.this.onClosed(webSocket, null, null, t);
        }
    }
}
