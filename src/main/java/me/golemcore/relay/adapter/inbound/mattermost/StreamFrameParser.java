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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.StreamBroadcast;

import java.util.Optional;

/**
 * Schema check for inbound stream frames.
 *
 * <p>
 * A valid event frame is a JSON object with a non-blank textual
 * {@code event}; {@code data} and {@code broadcast} must be objects and
 * {@code seq} a number when present. Replies to client commands (frames with
 * {@code seq_reply} and no {@code event}) are recognized and skipped. Anything
 * else is logged and dropped, never thrown.
 */
@Slf4j
class StreamFrameParser {

    private final ObjectMapper objectMapper;

    StreamFrameParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    Optional<StreamEventFrame> parse(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[Stream] Dropping non-JSON frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("[Stream] Dropping frame that is not a JSON object");
            return Optional.empty();
        }

        JsonNode event = root.get("event");
        if (event == null || event.isNull()) {
            if (root.has("seq_reply")) {
                log.debug("[Stream] Reply to command {}: status={}", root.get("seq_reply").asText(),
                        root.path("status").asText());
            } else {
                log.warn("[Stream] Dropping frame without event name");
            }
            return Optional.empty();
        }
        if (!event.isTextual() || event.asText().isBlank()) {
            log.warn("[Stream] Dropping frame with invalid event name");
            return Optional.empty();
        }
        String name = event.asText();

        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            data = objectMapper.createObjectNode();
        } else if (!data.isObject()) {
            log.warn("[Stream] Dropping '{}' frame: data is not an object", name);
            return Optional.empty();
        }

        StreamBroadcast broadcast = null;
        JsonNode broadcastNode = root.get("broadcast");
        if (broadcastNode != null && !broadcastNode.isNull()) {
            if (!broadcastNode.isObject()) {
                log.warn("[Stream] Dropping '{}' frame: broadcast is not an object", name);
                return Optional.empty();
            }
            try {
                broadcast = objectMapper.treeToValue(broadcastNode, StreamBroadcast.class);
            } catch (JsonProcessingException e) {
                log.warn("[Stream] Dropping '{}' frame: malformed broadcast: {}", name, e.getOriginalMessage());
                return Optional.empty();
            }
        }

        Long seq = null;
        JsonNode seqNode = root.get("seq");
        if (seqNode != null && !seqNode.isNull()) {
            if (!seqNode.isNumber()) {
                log.warn("[Stream] Dropping '{}' frame: seq is not a number", name);
                return Optional.empty();
            }
            seq = seqNode.asLong();
        }

        return Optional.of(new StreamEventFrame(name, data, broadcast, seq, root));
    }
}
