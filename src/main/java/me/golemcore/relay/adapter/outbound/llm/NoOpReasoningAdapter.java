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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ReasoningRequest;
import me.golemcore.relay.port.outbound.ReasoningPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Reasoning backend used when none is configured. Produces no text, so every
 * routed message is answered with the audience fallback reply.
 */
@Component
@ConditionalOnProperty(name = "relay.llm.provider", havingValue = "none", matchIfMissing = true)
@Slf4j
public class NoOpReasoningAdapter implements ReasoningPort {

    @Override
    public CompletableFuture<Object> generate(ReasoningRequest request) {
        log.debug("[LLM] No reasoning backend configured, returning empty reply");
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String getProviderName() {
        return "none";
    }
}
