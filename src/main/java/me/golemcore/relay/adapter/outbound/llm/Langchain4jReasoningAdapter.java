package me.golemcore.relay.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ReasoningRequest;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ReasoningPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Reasoning backend backed by an OpenAI-compatible chat model through
 * langchain4j.
 *
 * <p>
 * Each request is sent as a single user message; the model's text is returned
 * as is and left to the router to normalize. Retries are not configured on
 * the model: a failed generation surfaces immediately and the router answers
 * with an apology.
 */
@Component
@ConditionalOnProperty(name = "relay.llm.provider", havingValue = "openai")
@Slf4j
public class Langchain4jReasoningAdapter implements ReasoningPort {

    private final ChatModel chatModel;

    @Autowired
    public Langchain4jReasoningAdapter(RelayProperties properties) {
        this(createModel(properties.getLlm()));
        log.info("[LLM] Using OpenAI-compatible model {}", properties.getLlm().getModel());
    }

    Langchain4jReasoningAdapter(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    private static ChatModel createModel(RelayProperties.LlmProperties llm) {
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            throw new IllegalStateException("relay.llm.api-key is required when relay.llm.provider=openai");
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public CompletableFuture<Object> generate(ReasoningRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(UserMessage.from(request.getPrompt()))
                    .temperature(request.getTemperature())
                    .maxOutputTokens(request.getMaxTokens())
                    .build();
            try {
                ChatResponse response = chatModel.chat(chatRequest);
                AiMessage aiMessage = response != null ? response.aiMessage() : null;
                log.debug("[LLM] Generated reply for user {}", request.getUser());
                return aiMessage != null ? aiMessage.text() : null;
            } catch (RuntimeException e) {
                log.warn("[LLM] Model generation failed: {}", e.getMessage());
                throw new IllegalStateException("Model generation failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public String getProviderName() {
        return "openai";
    }
}
