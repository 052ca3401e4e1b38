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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ChannelKind;
import me.golemcore.relay.domain.model.ChatChannel;
import me.golemcore.relay.port.outbound.ChatApiPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which channels the bot belongs to and joins or leaves them on
 * request.
 *
 * <p>
 * Direct and group channels cannot be joined or left through the API; they
 * are only added to or removed from tracking. Join, leave and access checks
 * report failure as {@code false} instead of throwing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelMembershipService {

    private final ChatApiPort chatApi;

    private final Set<String> joinedChannels = ConcurrentHashMap.newKeySet();
    private final Map<String, ChannelKind> channelKinds = new ConcurrentHashMap<>();

    private volatile String botUserId;
    private volatile String teamId;
    private volatile boolean initialized;

    /**
     * Cache the bot and team IDs and load the channels the bot already
     * belongs to. Requires a ready gateway.
     *
     * @throws IllegalStateException
     *             when the gateway is not ready or the lookups fail
     */
    public void initialize() {
        try {
            String userId = chatApi.getBotUser().getId();
            String team = chatApi.getTeam().getId();
            List<ChatChannel> channels = chatApi.getChannelsForUser(userId, team);

            botUserId = userId;
            teamId = team;
            joinedChannels.clear();
            channels.forEach(this::track);
            initialized = true;
            log.info("[Channels] Initialized with {} joined channel(s)", joinedChannels.size());
        } catch (RuntimeException e) {
            log.error("[Channels] Initialization failed: {}", e.getMessage());
            throw new IllegalStateException("Channel membership initialization failed: " + e.getMessage(), e);
        }
    }

    public void cleanup() {
        joinedChannels.clear();
        channelKinds.clear();
        botUserId = null;
        teamId = null;
        initialized = false;
        log.info("[Channels] Cleaned up");
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Join a channel. Already joined counts as success.
     */
    public boolean joinChannel(String channelId) {
        try {
            requireInitialized();
            if (joinedChannels.contains(channelId)) {
                log.debug("[Channels] Already joined {}", channelId);
                return true;
            }
            ChatChannel channel = chatApi.getChannel(channelId);
            channelKinds.put(channelId, channel.kind());
            if (!channel.kind().isJoinable()) {
                joinedChannels.add(channelId);
                log.debug("[Channels] Tracking {} channel {}", channel.kind(), channelId);
                return true;
            }
            chatApi.joinChannel(channelId);
            joinedChannels.add(channelId);
            log.info("[Channels] Joined {} ({})", channel.getDisplayName(), channelId);
            return true;
        } catch (RuntimeException e) {
            log.error("[Channels] Failed to join {}: {}", channelId, e.getMessage());
            return false;
        }
    }

    public boolean joinChannelByName(String channelName) {
        try {
            requireInitialized();
            ChatChannel channel = chatApi.getChannelByName(teamId, channelName);
            return joinChannel(channel.getId());
        } catch (RuntimeException e) {
            log.error("[Channels] Failed to join channel named {}: {}", channelName, e.getMessage());
            return false;
        }
    }

    /**
     * Leave a channel. Not being a member counts as success.
     */
    public boolean leaveChannel(String channelId) {
        try {
            requireInitialized();
            if (!joinedChannels.contains(channelId)) {
                log.debug("[Channels] Not a member of {}", channelId);
                return true;
            }
            ChatChannel channel = chatApi.getChannel(channelId);
            if (channel.kind().isJoinable()) {
                chatApi.leaveChannel(channelId);
                log.info("[Channels] Left {} ({})", channel.getDisplayName(), channelId);
            } else {
                log.debug("[Channels] Stopped tracking {} channel {}", channel.kind(), channelId);
            }
            joinedChannels.remove(channelId);
            return true;
        } catch (RuntimeException e) {
            log.error("[Channels] Failed to leave {}: {}", channelId, e.getMessage());
            return false;
        }
    }

    /**
     * True if the bot is a member of the channel or can at least read it.
     */
    public boolean validateChannelAccess(String channelId) {
        try {
            requireInitialized();
            if (joinedChannels.contains(channelId)) {
                return true;
            }
            ChatChannel channel = chatApi.getChannel(channelId);
            channelKinds.put(channelId, channel.kind());
            log.debug("[Channels] Access to {} ({}) confirmed", channel.getDisplayName(), channelId);
            return true;
        } catch (RuntimeException e) {
            log.warn("[Channels] No access to {}: {}", channelId, e.getMessage());
            return false;
        }
    }

    /**
     * Kind of a channel, looked up once and cached. Empty when the channel
     * cannot be read.
     */
    public Optional<ChannelKind> getChannelKind(String channelId) {
        ChannelKind cached = channelKinds.get(channelId);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            requireInitialized();
            ChannelKind kind = chatApi.getChannel(channelId).kind();
            channelKinds.put(channelId, kind);
            return Optional.of(kind);
        } catch (RuntimeException e) {
            log.error("[Channels] Failed to resolve kind of {}: {}", channelId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replace the tracked memberships with the server's current view.
     *
     * @throws IllegalStateException
     *             when not initialized
     */
    public void refreshMemberships() {
        requireInitialized();
        List<ChatChannel> channels = chatApi.getChannelsForUser(botUserId, teamId);
        joinedChannels.clear();
        channels.forEach(this::track);
        log.info("[Channels] Refreshed memberships: {} channel(s)", joinedChannels.size());
    }

    public boolean isJoined(String channelId) {
        return joinedChannels.contains(channelId);
    }

    public Set<String> getJoinedChannels() {
        return Set.copyOf(joinedChannels);
    }

    private void track(ChatChannel channel) {
        joinedChannels.add(channel.getId());
        if (channel.getType() != null) {
            channelKinds.put(channel.getId(), channel.kind());
        }
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Channel membership service not initialized");
        }
    }
}
