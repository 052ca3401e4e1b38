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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.relay.domain.model.StreamBroadcast;

/**
 * Validated inbound event frame {@code {event, data, broadcast, seq}}.
 *
 * @param event
 *            non-blank event name
 * @param data
 *            event payload; an empty object when the frame had none
 * @param broadcast
 *            audience, or null
 * @param seq
 *            server sequence number, or null
 * @param original
 *            the whole frame tree
 */
record StreamEventFrame(String event, JsonNode data, StreamBroadcast broadcast, Long seq, JsonNode original) {
}
