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
import me.golemcore.relay.domain.model.ChatPost;
import me.golemcore.relay.domain.model.ChatUser;
import me.golemcore.relay.domain.model.PostList;
import me.golemcore.relay.domain.model.PostQuery;
import me.golemcore.relay.domain.model.ThreadContext;
import me.golemcore.relay.domain.model.ThreadContextOptions;
import me.golemcore.relay.domain.model.ThreadMessage;
import me.golemcore.relay.domain.model.ThreadStats;
import me.golemcore.relay.port.outbound.ChatApiPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a bounded, ordered view of a thread for prompt construction.
 *
 * <p>
 * Candidates come from the dedicated thread endpoint. When that fails or
 * returns nothing, a page of {@code maxMessages * 2} channel posts is filtered
 * down to the root and its replies. The result is sorted oldest first and cut
 * to {@code maxMessages}: the most recent window by default, the earliest one
 * when {@code includeFuture} is set.
 *
 * <p>
 * Never throws. Any failure yields {@link Optional#empty()} so the caller can
 * answer without context. Author names are resolved once per call; a failed
 * lookup falls back to {@code user-<id prefix>}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThreadContextAssembler {

    static final Duration ACTIVE_WINDOW = Duration.ofHours(24);
    static final int STATS_MAX_MESSAGES = 50;
    private static final int FALLBACK_NAME_PREFIX_LENGTH = 8;

    private final ChatApiPort chatApi;
    private final Clock clock;

    public Optional<ThreadContext> getThreadContext(String threadRootId, String channelId,
            ThreadContextOptions options) {
        ThreadContextOptions effective = options != null ? options : ThreadContextOptions.defaults();
        try {
            List<ChatPost> candidates = fetchThreadPosts(threadRootId, channelId, effective.getMaxMessages());
            ChatPost root = candidates.stream()
                    .filter(post -> threadRootId.equals(post.getId()))
                    .findFirst()
                    .orElseGet(() -> loadRoot(threadRootId));

            List<ChatPost> sorted = new ArrayList<>(candidates);
            sorted.sort(Comparator.comparingLong(ChatPost::getCreateAt));
            List<ChatPost> window = truncate(sorted, effective);

            Map<String, String> names = new HashMap<>();
            List<ThreadMessage> messages = new ArrayList<>(window.size());
            Set<String> participants = new LinkedHashSet<>();
            long lastActivity = 0;
            for (ChatPost post : window) {
                participants.add(post.getUserId());
                lastActivity = Math.max(lastActivity, post.getCreateAt());
                messages.add(ThreadMessage.builder()
                        .postId(post.getId())
                        .authorId(post.getUserId())
                        .displayName(names.computeIfAbsent(post.getUserId(), this::resolveDisplayName))
                        .text(post.getMessage())
                        .timestampMs(post.getCreateAt())
                        .build());
            }

            ThreadContext context = ThreadContext.builder()
                    .threadId(threadRootId)
                    .channelId(channelId)
                    .messages(messages)
                    .messageCount(messages.size())
                    .participantCount(participants.size())
                    .lastActivityMs(lastActivity)
                    .active(lastActivity > 0 && clock.millis() - lastActivity < ACTIVE_WINDOW.toMillis())
                    .rootPost(root)
                    .build();
            log.debug("[Thread] Context for {}: {} message(s), {} participant(s)",
                    threadRootId, context.getMessageCount(), context.getParticipantCount());
            return Optional.of(context);
        } catch (RuntimeException e) {
            log.warn("[Thread] Could not build context for thread {}: {}", threadRootId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Statistics over the most recent {@value #STATS_MAX_MESSAGES} messages of
     * a thread; zeroed when the thread cannot be read.
     */
    public ThreadStats getThreadStats(String threadRootId, String channelId) {
        return getThreadContext(threadRootId, channelId, ThreadContextOptions.ofMaxMessages(STATS_MAX_MESSAGES))
                .map(context -> ThreadStats.builder()
                        .threadId(threadRootId)
                        .messageCount(context.getMessageCount())
                        .participantCount(context.getParticipantCount())
                        .lastActivityMs(context.getLastActivityMs())
                        .active(context.isActive())
                        .build())
                .orElseGet(() -> ThreadStats.empty(threadRootId));
    }

    private List<ChatPost> fetchThreadPosts(String threadRootId, String channelId, int maxMessages) {
        try {
            List<ChatPost> thread = filterToThread(chatApi.getPostThread(threadRootId), threadRootId);
            if (!thread.isEmpty()) {
                return thread;
            }
            log.debug("[Thread] Thread endpoint returned nothing for {}, scanning channel", threadRootId);
        } catch (RuntimeException e) {
            log.debug("[Thread] Thread endpoint failed for {}, scanning channel: {}", threadRootId, e.getMessage());
        }
        PostList page = chatApi.getPostsForChannel(channelId, PostQuery.firstPage(maxMessages * 2));
        return filterToThread(page, threadRootId);
    }

    private static List<ChatPost> filterToThread(PostList posts, String threadRootId) {
        List<ChatPost> result = new ArrayList<>();
        if (posts == null) {
            return result;
        }
        for (ChatPost post : posts.orderedPosts()) {
            if (threadRootId.equals(post.getId()) || threadRootId.equals(post.getRootId())) {
                result.add(post);
            }
        }
        return result;
    }

    private static List<ChatPost> truncate(List<ChatPost> sorted, ThreadContextOptions options) {
        int max = Math.max(0, options.getMaxMessages());
        if (sorted.size() <= max) {
            return sorted;
        }
        if (options.isIncludeFuture()) {
            return new ArrayList<>(sorted.subList(0, max));
        }
        return new ArrayList<>(sorted.subList(sorted.size() - max, sorted.size()));
    }

    private ChatPost loadRoot(String threadRootId) {
        try {
            return chatApi.getPost(threadRootId);
        } catch (RuntimeException e) {
            log.debug("[Thread] Root post {} unavailable: {}", threadRootId, e.getMessage());
            return null;
        }
    }

    private String resolveDisplayName(String userId) {
        try {
            ChatUser user = chatApi.getUser(userId);
            String name = user != null ? user.displayName() : null;
            if (name != null && !name.isBlank()) {
                return name;
            }
        } catch (RuntimeException e) {
            log.debug("[Thread] Profile lookup failed for {}: {}", userId, e.getMessage());
        }
        return fallbackName(userId);
    }

    static String fallbackName(String userId) {
        if (userId == null || userId.isEmpty()) {
            return "user-unknown";
        }
        return "user-" + userId.substring(0, Math.min(FALLBACK_NAME_PREFIX_LENGTH, userId.length()));
    }
}
