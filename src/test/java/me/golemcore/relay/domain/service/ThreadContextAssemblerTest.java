package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ChatPost;
import me.golemcore.relay.domain.model.ChatUser;
import me.golemcore.relay.domain.model.MattermostApiException;
import me.golemcore.relay.domain.model.PostList;
import me.golemcore.relay.domain.model.PostQuery;
import me.golemcore.relay.domain.model.ThreadContext;
import me.golemcore.relay.domain.model.ThreadContextOptions;
import me.golemcore.relay.domain.model.ThreadMessage;
import me.golemcore.relay.domain.model.ThreadStats;
import me.golemcore.relay.port.outbound.ChatApiPort;
import me.golemcore.relay.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ThreadContextAssemblerTest {

    private static final String ROOT = "root";
    private static final String CHANNEL = "c1";
    private static final long NOW = Duration.ofDays(30).toMillis();

    private ChatApiPort chatApi;
    private MutableClock clock;
    private ThreadContextAssembler assembler;

    @BeforeEach
    void setUp() {
        chatApi = mock(ChatApiPort.class);
        clock = new MutableClock(NOW);
        assembler = new ThreadContextAssembler(chatApi, clock);
        when(chatApi.getUser("alice-0001")).thenReturn(ChatUser.builder().id("alice-0001").username("alice").build());
        when(chatApi.getUser("bob-00002")).thenReturn(ChatUser.builder().id("bob-00002").nickname("Bobby").build());
    }

    private static ChatPost post(String id, String rootId, String userId, String text, long createAt) {
        return ChatPost.builder()
                .id(id)
                .rootId(rootId)
                .userId(userId)
                .channelId(CHANNEL)
                .message(text)
                .createAt(createAt)
                .build();
    }

    private static PostList listOf(ChatPost... posts) {
        List<String> order = new ArrayList<>();
        Map<String, ChatPost> byId = new LinkedHashMap<>();
        for (ChatPost post : posts) {
            order.add(post.getId());
            byId.put(post.getId(), post);
        }
        return PostList.builder().order(order).posts(byId).build();
    }

    @Test
    void shouldBuildOrderedContextFromThreadEndpoint() {
        when(chatApi.getPostThread(ROOT)).thenReturn(listOf(
                post("r2", ROOT, "bob-00002", "second reply", NOW - 1000),
                post(ROOT, null, "alice-0001", "question", NOW - 3000),
                post("r1", ROOT, "alice-0001", "first reply", NOW - 2000)));

        ThreadContext context = assembler.getThreadContext(ROOT, CHANNEL, ThreadContextOptions.defaults())
                .orElseThrow();

        assertEquals(List.of(ROOT, "r1", "r2"), context.getMessages().stream().map(ThreadMessage::getPostId).toList());
        assertEquals(List.of("alice", "alice", "Bobby"),
                context.getMessages().stream().map(ThreadMessage::getDisplayName).toList());
        assertEquals(3, context.getMessageCount());
        assertEquals(2, context.getParticipantCount());
        assertEquals(NOW - 1000, context.getLastActivityMs());
        assertTrue(context.isActive());
        assertEquals("question", context.getRootPost().getMessage());
        verify(chatApi, times(1)).getUser("alice-0001");
        verify(chatApi, never()).getPostsForChannel(anyString(), any());
    }

    @Test
    void shouldKeepMostRecentWindowByDefault() {
        List<ChatPost> posts = new ArrayList<>();
        posts.add(post(ROOT, null, "alice-0001", "q", 1));
        for (int i = 1; i <= 5; i++) {
            posts.add(post("r" + i, ROOT, "alice-0001", "reply " + i, 1 + i));
        }
        when(chatApi.getPostThread(ROOT)).thenReturn(listOf(posts.toArray(new ChatPost[0])));

        ThreadContext context = assembler.getThreadContext(ROOT, CHANNEL, ThreadContextOptions.ofMaxMessages(3))
                .orElseThrow();

        assertEquals(List.of("r3", "r4", "r5"), context.getMessages().stream().map(ThreadMessage::getPostId).toList());
        assertEquals(ROOT, context.getRootPost().getId());
    }

    @Test
    void includeFutureShouldKeepEarliestWindow() {
        when(chatApi.getPostThread(ROOT)).thenReturn(listOf(
                post(ROOT, null, "alice-0001", "q", 1),
                post("r1", ROOT, "alice-0001", "a", 2),
                post("r2", ROOT, "alice-0001", "b", 3)));
        ThreadContextOptions options = ThreadContextOptions.builder().maxMessages(2).includeFuture(true).build();

        ThreadContext context = assembler.getThreadContext(ROOT, CHANNEL, options).orElseThrow();

        assertEquals(List.of(ROOT, "r1"), context.getMessages().stream().map(ThreadMessage::getPostId).toList());
    }

    @Test
    void shouldFallBackToChannelScanWhenThreadEndpointFails() {
        when(chatApi.getPostThread(ROOT)).thenThrow(new MattermostApiException("Get thread root: HTTP 404", 404));
        when(chatApi.getPostsForChannel(eq(CHANNEL), any(PostQuery.class))).thenReturn(listOf(
                post("other", null, "bob-00002", "unrelated", 5),
                post("r1", ROOT, "bob-00002", "reply", 4),
                post(ROOT, null, "alice-0001", "question", 3)));

        ThreadContext context = assembler.getThreadContext(ROOT, CHANNEL, ThreadContextOptions.ofMaxMessages(10))
                .orElseThrow();

        assertEquals(List.of(ROOT, "r1"), context.getMessages().stream().map(ThreadMessage::getPostId).toList());
        ArgumentCaptor<PostQuery> query = ArgumentCaptor.forClass(PostQuery.class);
        verify(chatApi).getPostsForChannel(eq(CHANNEL), query.capture());
        assertEquals(20, query.getValue().getPerPage());
    }

    @Test
    void shouldLoadRootSeparatelyWhenOutsideWindow() {
        when(chatApi.getPostThread(ROOT)).thenReturn(listOf(post("r1", ROOT, "alice-0001", "reply", 4)));
        when(chatApi.getPost(ROOT)).thenReturn(post(ROOT, null, "alice-0001", "question", 3));

        ThreadContext context = assembler.getThreadContext(ROOT, CHANNEL, null).orElseThrow();

        assertEquals("question", context.getRootPost().getMessage());
        assertEquals(1, context.getMessageCount());
    }

    @Test
    void failedProfileLookupShouldUseIdPrefix() {
        when(chatApi.getUser("carol-123456789")).thenThrow(new MattermostApiException("HTTP 404", 404));
        when(chatApi.getPostThread(ROOT)).thenReturn(listOf(post(ROOT, null, "carol-123456789", "hi", 1)));

        ThreadContext context = assembler.getThreadContext(ROOT, CHANNEL, null).orElseThrow();

        assertEquals("user-carol-12", context.getMessages().get(0).getDisplayName());
        assertEquals("user-unknown", ThreadContextAssembler.fallbackName(null));
        assertEquals("user-abc", ThreadContextAssembler.fallbackName("abc"));
    }

    @Test
    void staleThreadShouldNotBeActive() {
        when(chatApi.getPostThread(ROOT)).thenReturn(listOf(
                post(ROOT, null, "alice-0001", "old", NOW - Duration.ofHours(25).toMillis())));

        ThreadContext context = assembler.getThreadContext(ROOT, CHANNEL, null).orElseThrow();

        assertFalse(context.isActive());
    }

    @Test
    void shouldReturnEmptyWhenEverythingFails() {
        when(chatApi.getPostThread(ROOT)).thenThrow(new MattermostApiException("network error", null));
        when(chatApi.getPostsForChannel(eq(CHANNEL), any(PostQuery.class)))
                .thenThrow(new MattermostApiException("network error", null));

        Optional<ThreadContext> context = assembler.getThreadContext(ROOT, CHANNEL, null);

        assertTrue(context.isEmpty());
    }

    @Test
    void statsShouldSummarizeThreadOrBeZeroed() {
        when(chatApi.getPostThread(ROOT)).thenReturn(listOf(
                post(ROOT, null, "alice-0001", "q", NOW - 10),
                post("r1", ROOT, "bob-00002", "a", NOW - 5)));

        ThreadStats stats = assembler.getThreadStats(ROOT, CHANNEL);
        assertEquals(2, stats.getMessageCount());
        assertEquals(2, stats.getParticipantCount());
        assertTrue(stats.isActive());

        when(chatApi.getPostThread("gone")).thenThrow(new IllegalStateException("not ready"));
        when(chatApi.getPostsForChannel(eq(CHANNEL), any(PostQuery.class))).thenThrow(new IllegalStateException("x"));
        ThreadStats empty = assembler.getThreadStats("gone", CHANNEL);
        assertEquals(0, empty.getMessageCount());
        assertFalse(empty.isActive());
    }
}
