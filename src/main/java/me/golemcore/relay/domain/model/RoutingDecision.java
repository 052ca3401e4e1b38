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

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of classifying one inbound message.
 */
@Value
@Builder
public class RoutingDecision {

    boolean shouldRoute;
    RoutingReason reason;

    /** Human-readable reason, suitable for logs. */
    String detail;

    boolean directMessage;
    boolean mention;

    public static RoutingDecision of(RoutingReason reason, boolean directMessage, boolean mention) {
        return of(reason, reason.getDescription(), directMessage, mention);
    }

    public static RoutingDecision of(RoutingReason reason, String detail, boolean directMessage, boolean mention) {
        return RoutingDecision.builder()
                .shouldRoute(reason.isRouted())
                .reason(reason)
                .detail(detail)
                .directMessage(directMessage)
                .mention(mention)
                .build();
    }
}
