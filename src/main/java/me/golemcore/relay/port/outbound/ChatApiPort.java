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

import me.golemcore.relay.domain.model.ChannelMember;
import me.golemcore.relay.domain.model.ChatChannel;
import me.golemcore.relay.domain.model.ChatFileInfo;
import me.golemcore.relay.domain.model.ChatPost;
import me.golemcore.relay.domain.model.ChatTeam;
import me.golemcore.relay.domain.model.ChatUser;
import me.golemcore.relay.domain.model.CreatePostOptions;
import me.golemcore.relay.domain.model.PostList;
import me.golemcore.relay.domain.model.PostQuery;

import java.util.List;

/**
 * Port for authenticated request/response calls against the chat server.
 *
 * <p>
 * Calls block the current thread; callers run them on worker threads. Every
 * data-plane method requires {@link #isReady()} and fails with
 * {@link IllegalStateException} otherwise. Transport failures surface as
 * {@link me.golemcore.relay.domain.model.MattermostApiException} after the
 * configured retries.
 */
public interface ChatApiPort {

    /**
     * Validate the credential and team, cache the bot user and team. Retried
     * with the initialization policy; a no-op once ready.
     */
    void initialize();

    /**
     * True once both the bot user and the team are cached.
     */
    boolean isReady();

    /**
     * Check credential and connectivity without touching cached state.
     */
    boolean testConnection();

    ChatUser getBotUser();

    ChatTeam getTeam();

    ChatUser getUser(String userId);

    /**
     * Create a post in a channel.
     *
     * @param channelId
     *            target channel
     * @param message
     *            post text
     * @param options
     *            thread anchor, file IDs and props; never null
     */
    ChatPost createPost(String channelId, String message, CreatePostOptions options);

    /**
     * Post into an existing thread.
     */
    ChatPost replyToThread(String channelId, String rootId, String message);

    ChatPost getPost(String postId);

    PostList getPostsForChannel(String channelId, PostQuery query);

    /**
     * Fetch a whole thread (root plus replies) from the dedicated thread
     * endpoint.
     */
    PostList getPostThread(String postId);

    /**
     * Replace the text of an existing post.
     */
    ChatPost updatePost(String postId, String message);

    ChatChannel getChannel(String channelId);

    ChatChannel getChannelByName(String teamId, String channelName);

    /**
     * Public channels of a team.
     */
    List<ChatChannel> getChannelsForTeam(String teamId);

    /**
     * Channels of a team the given user belongs to.
     */
    List<ChatChannel> getChannelsForUser(String userId, String teamId);

    List<ChannelMember> getChannelMembers(String channelId, int page, int perPage);

    /**
     * Add the bot user to a channel.
     */
    ChannelMember joinChannel(String channelId);

    /**
     * Remove the bot user from a channel.
     */
    void leaveChannel(String channelId);

    /**
     * Upload one file to a channel; returns the stored file metadata.
     */
    List<ChatFileInfo> uploadFile(String channelId, byte[] content, String fileName);

    ChatFileInfo getFileInfo(String fileId);
}
