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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Bounded window of a thread's history plus derived statistics.
 *
 * <p>
 * Messages are ordered by creation time, oldest first.
 * {@code participantCount} counts distinct authors of the returned messages,
 * {@code active} is true when the last activity is less than 24 hours old.
 *
 * @since 1.0
 */
@Value
@Builder
public class ThreadContext {

    String threadId;
    String channelId;

    @Singular
    List<ThreadMessage> messages;

    int messageCount;
    int participantCount;
    long lastActivityMs;
    boolean active;

    /** The thread's root post; null only when the root could not be loaded. */
    ChatPost rootPost;

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
