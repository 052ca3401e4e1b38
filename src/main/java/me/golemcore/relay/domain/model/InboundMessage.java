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
 * A post received from the event stream, flattened for routing.
 *
 * <p>
 * Built once per {@code posted} event and never persisted. Mentions are not
 * part of the post itself: Mattermost sends them as a separate list next to it.
 *
 * @since 1.0
 */
@Value
@Builder
public class InboundMessage {

    String id;
    String authorId;
    String channelId;

    /** Root of the thread when this post is a reply, otherwise null. */
    String threadRootId;

    String text;
    ChannelKind channelKind;

    /** Empty for regular posts; {@code system_*} for system messages. */
    String messageKind;

    @Singular
    List<String> mentionedUserIds;

    @Singular
    List<String> fileIds;

    long createAt;

    /** Sender display name as reported by the event, may be null. */
    String senderName;

    /** Channel display name as reported by the event, may be null. */
    String channelName;

    public boolean isReply() {
        return threadRootId != null && !threadRootId.isBlank();
    }

    /**
     * The post ID a reply should be attached to: the thread root for replies,
     * the post itself otherwise.
     */
    public String threadAnchor() {
        return isReply() ? threadRootId : id;
    }

    public boolean isSystemMessage() {
        return messageKind != null && !messageKind.isBlank();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
