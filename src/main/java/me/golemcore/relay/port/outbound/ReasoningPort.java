package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.ReasoningRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the external reasoning backend that writes replies.
 *
 * <p>
 * Backends disagree on what they return: a plain string, a structured object
 * with a {@code text} or {@code message} field, or nothing. The result is
 * therefore untyped here and normalized by
 * {@link me.golemcore.relay.domain.service.ReasoningResponseAdapter} before the
 * router looks at it.
 */
public interface ReasoningPort {

    /**
     * Generate a reply for the prompt.
     *
     * @return a future with the raw backend result (may complete with null),
     *         or completed exceptionally when the backend fails
     */
    CompletableFuture<Object> generate(ReasoningRequest request);

    /**
     * Short backend name for logs.
     */
    String getProviderName();
}
