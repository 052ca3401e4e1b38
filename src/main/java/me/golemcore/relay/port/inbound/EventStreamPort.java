package me.golemcore.relay.port.inbound;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.relay.domain.model.ConnectionState;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the persistent server event stream.
 *
 * <p>
 * Listeners are registered per event name; the wildcard {@value #WILDCARD}
 * receives every event. A failing listener never prevents the others from
 * running.
 */
public interface EventStreamPort {

    String WILDCARD = "*";

    /**
     * Open and authenticate the stream. Concurrent callers share one in-flight
     * attempt; an authenticated stream returns a completed future.
     */
    CompletableFuture<Void> connect();

    /**
     * Deliberate shutdown: cancel reconnection, close the socket, drop all
     * listeners.
     */
    void disconnect();

    boolean isConnected();

    ConnectionState getState();

    /**
     * True once automatic reconnection gave up.
     */
    boolean isReconnectExhausted();

    void on(String event, StreamEventListener listener);

    void off(String event, StreamEventListener listener);

    /**
     * Register a listener that unregisters itself after its first invocation.
     */
    void once(String event, StreamEventListener listener);

    void removeAllListeners(String event);

    void removeAllListeners();

    int listenerCount(String event);

    /**
     * Names of events with at least one listener.
     */
    Set<String> eventNames();

    /**
     * Dispatch a locally generated event to registered listeners.
     */
    void emit(String event, JsonNode data);
}
