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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.GeneratedReply;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Normalizes whatever the reasoning backend returned into a
 * {@link GeneratedReply}.
 *
 * <p>
 * Accepted shapes:
 * <ul>
 * <li>{@code null} - empty</li>
 * <li>a {@link CharSequence} - its text</li>
 * <li>a {@link Map}, {@link JsonNode} or any bean - the first non-blank string
 * among {@link #TEXT_FIELDS}, in that order</li>
 * </ul>
 * Blank text and objects without a usable field become
 * {@link GeneratedReply#empty()}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReasoningResponseAdapter {

    static final List<String> TEXT_FIELDS = List.of("text", "message");

    private final ObjectMapper objectMapper;

    public GeneratedReply normalize(Object raw) {
        if (raw == null) {
            return GeneratedReply.empty();
        }
        if (raw instanceof GeneratedReply reply) {
            return reply;
        }
        if (raw instanceof CharSequence text) {
            return GeneratedReply.text(text.toString());
        }
        if (raw instanceof Map<?, ?> map) {
            return fromMap(map);
        }
        if (raw instanceof JsonNode node) {
            return fromJson(node);
        }

        try {
            return fromJson(objectMapper.valueToTree(raw));
        } catch (IllegalArgumentException e) {
            log.warn("[Router] Cannot interpret reasoning result of type {}", raw.getClass().getName());
            return GeneratedReply.empty();
        }
    }

    private GeneratedReply fromMap(Map<?, ?> map) {
        for (String field : TEXT_FIELDS) {
            Object value = map.get(field);
            if (value instanceof CharSequence text && !text.toString().isBlank()) {
                return GeneratedReply.text(text.toString());
            }
        }
        return GeneratedReply.empty();
    }

    private GeneratedReply fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return GeneratedReply.empty();
        }
        if (node.isTextual()) {
            return GeneratedReply.text(node.asText());
        }
        if (!node.isObject()) {
            return GeneratedReply.empty();
        }
        for (String field : TEXT_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return GeneratedReply.text(value.asText());
            }
        }
        return GeneratedReply.empty();
    }
}
