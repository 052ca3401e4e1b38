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

/**
 * Why a message was, or was not, routed to the reasoning backend. Declared in
 * evaluation order; the first matching rule wins.
 */
public enum RoutingReason {
    OWN_MESSAGE(false, "Bot's own message - skipping to prevent loops"),
    DUPLICATE(false, "Message already processed - duplicate prevention"),
    EMPTY_OR_SYSTEM(false, "System message or empty content"),
    DIRECT_MESSAGE(true, "Direct message - always process"),
    MENTION(true, "Bot mentioned - process mention"),
    NO_MENTION(false, "Shared channel without mention - skipping");

    private final boolean routed;
    private final String description;

    RoutingReason(boolean routed, String description) {
        this.routed = routed;
        this.description = description;
    }

    public boolean isRouted() {
        return routed;
    }

    public String getDescription() {
        return description;
    }
}
