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

@Value
@Builder
public class ThreadContextOptions {

    /** Upper bound of messages kept in the context window. */
    @Builder.Default
    int maxMessages = 15;

    /**
     * When true the earliest {@code maxMessages} are kept instead of the most
     * recent ones.
     */
    @Builder.Default
    boolean includeFuture = false;

    public static ThreadContextOptions defaults() {
        return ThreadContextOptions.builder().build();
    }

    public static ThreadContextOptions ofMaxMessages(int maxMessages) {
        return ThreadContextOptions.builder().maxMessages(maxMessages).build();
    }
}
