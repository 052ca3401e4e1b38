package me.golemcore.relay.adapter.outbound.mattermost;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.ChatFileInfo;
import me.golemcore.relay.domain.model.ChatPost;
import me.golemcore.relay.domain.model.CreatePostOptions;
import me.golemcore.relay.domain.model.MattermostApiException;
import me.golemcore.relay.domain.model.PostList;
import me.golemcore.relay.domain.model.PostQuery;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayConfigurationException;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.ratelimit.FixedWindowRateLimiter;
import me.golemcore.relay.retry.RetryExecutor;
import me.golemcore.relay.retry.RetryPolicy;
import me.golemcore.relay.testsupport.http.OkHttpMockEngine;
import me.golemcore.relay.testsupport.http.OkHttpMockEngine.CapturedRequest;
import me.golemcore.relay.testsupport.time.MutableClock;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class MattermostRestGatewayTest {

    private static final String TOKEN = "s3cr3t-bot-token";
    private static final String BOT_JSON = "{\"id\":\"bot1\",\"username\":\"relay-bot\"}";
    private static final String TEAM_JSON = "{\"id\":\"team1\",\"name\":\"eng\",\"display_name\":\"Engineering\"}";
    private static final String MEMBER_JSON = "{\"team_id\":\"team1\",\"user_id\":\"bot1\"}";

    private OkHttpMockEngine engine;
    private FixedWindowRateLimiter rateLimiter;
    private RelayProperties properties;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        rateLimiter = new FixedWindowRateLimiter(false, 10, 1000, new MutableClock(0));
        objectMapper = AutoConfiguration.objectMapper();

        properties = new RelayProperties();
        properties.getMattermost().setUrl("https://chat.example.com");
        properties.getMattermost().setToken(TOKEN);
        properties.getMattermost().setTeam("eng");
    }

    private MattermostRestGateway gateway() {
        RetryPolicy immediate = RetryPolicy.builder().baseDelayMs(0).maxDelayMs(0).maxJitterMs(0).build();
        RetryPolicy immediateInit = RetryPolicy.initialization().toBuilder()
                .baseDelayMs(0).maxDelayMs(0).maxJitterMs(0).build();
        RetryExecutor retryExecutor = new RetryExecutor(rateLimiter, immediate, immediateInit);
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        return new MattermostRestGateway(properties, client, objectMapper, retryExecutor, rateLimiter);
    }

    private MattermostRestGateway initializedGateway() {
        MattermostRestGateway gateway = gateway();
        engine.enqueueJson(200, BOT_JSON);
        engine.enqueueJson(200, TEAM_JSON);
        engine.enqueueJson(200, MEMBER_JSON);
        gateway.initialize();
        while (engine.takeRequest() != null) {
            // drain initialization traffic
        }
        return gateway;
    }

    // ===== Construction =====

    @Test
    void shouldFailFastOnMissingToken() {
        properties.getMattermost().setToken(" ");

        RelayConfigurationException e = assertThrows(RelayConfigurationException.class, this::gateway);

        assertEquals("relay.mattermost.token", e.getSetting());
        assertEquals(0, engine.getRequestCount());
    }

    // ===== Initialization =====

    @Test
    void shouldInitializeWithBotUserAndTeam() {
        MattermostRestGateway gateway = gateway();
        engine.enqueueJson(200, BOT_JSON);
        engine.enqueueJson(200, TEAM_JSON);
        engine.enqueueJson(200, MEMBER_JSON);

        gateway.initialize();

        assertTrue(gateway.isReady());
        assertEquals("bot1", gateway.getBotUser().getId());
        assertEquals("team1", gateway.getTeam().getId());

        CapturedRequest me = engine.takeRequest();
        assertEquals("GET", me.method());
        assertEquals("/api/v4/users/me", me.target());
        assertEquals("Bearer " + TOKEN, me.header("Authorization"));
        assertEquals("/api/v4/teams/name/eng", engine.takeRequest().target());
        assertEquals("/api/v4/teams/team1/members/bot1", engine.takeRequest().target());
    }

    @Test
    void secondInitializeShouldNotCallServer() {
        MattermostRestGateway gateway = initializedGateway();

        gateway.initialize();

        assertNull(engine.takeRequest());
    }

    @Test
    void failedMembershipCheckShouldNotBlockInitialization() {
        MattermostRestGateway gateway = gateway();
        engine.enqueueJson(200, BOT_JSON);
        engine.enqueueJson(200, TEAM_JSON);
        engine.enqueueJson(403, "{\"id\":\"api.context.permissions.app_error\",\"message\":\"no\"}");

        gateway.initialize();

        assertTrue(gateway.isReady());
    }

    @Test
    void shouldReportTokenHintOnUnauthorizedWithoutRetrying() {
        MattermostRestGateway gateway = gateway();
        engine.enqueueJson(401, "{\"id\":\"api.context.session_expired.app_error\",\"message\":\"Invalid token\"}");

        MattermostApiException e = assertThrows(MattermostApiException.class, gateway::initialize);

        assertEquals(401, e.getStatusCode());
        assertTrue(e.getMessage().contains("relay.mattermost.token"));
        assertFalse(e.getMessage().contains(TOKEN));
        assertEquals(1, engine.getRequestCount());
        assertFalse(gateway.isReady());
    }

    @Test
    void shouldReportTeamHintWhenTeamMissing() {
        MattermostRestGateway gateway = gateway();
        engine.enqueueJson(200, BOT_JSON);
        engine.enqueueJson(404, "{\"message\":\"Unable to find the existing team\"}");

        MattermostApiException e = assertThrows(MattermostApiException.class, gateway::initialize);

        assertTrue(e.getMessage().contains("relay.mattermost.team"));
        assertTrue(e.getMessage().contains("'eng'"));
    }

    @Test
    void shouldRetryInitializationWhileServerIsStarting() {
        MattermostRestGateway gateway = gateway();
        engine.enqueueJson(503, "{\"message\":\"starting\"}");
        engine.enqueueFailure(new ConnectException("Connection refused"));
        engine.enqueueJson(200, BOT_JSON);
        engine.enqueueJson(200, TEAM_JSON);
        engine.enqueueJson(200, MEMBER_JSON);

        gateway.initialize();

        assertTrue(gateway.isReady());
        assertEquals(5, engine.getRequestCount());
    }

    @Test
    void shouldReportUrlHintWhenServerUnreachable() {
        MattermostRestGateway gateway = gateway();
        for (int i = 0; i < 6; i++) {
            engine.enqueueFailure(new ConnectException("Connection refused"));
        }

        MattermostApiException e = assertThrows(MattermostApiException.class, gateway::initialize);

        assertNull(e.getStatusCode());
        assertTrue(e.getMessage().contains("relay.mattermost.url"));
        assertEquals(6, engine.getRequestCount());
    }

    // ===== Readiness =====

    @Test
    void dataCallsShouldRequireInitialization() {
        MattermostRestGateway gateway = gateway();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> gateway.getPost("p1"));

        assertEquals("REST gateway not initialized. Call initialize() first.", e.getMessage());
        assertEquals(0, engine.getRequestCount());
    }

    // ===== Posts =====

    @Test
    void shouldCreateThreadReply() throws Exception {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(201, "{\"id\":\"p9\",\"channel_id\":\"c1\",\"root_id\":\"root1\",\"message\":\"hi\"}");

        ChatPost created = gateway.createPost("c1", "hi", CreatePostOptions.replyTo("root1"));

        assertEquals("p9", created.getId());
        CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/api/v4/posts", request.target());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("c1", body.get("channel_id").asText());
        assertEquals("hi", body.get("message").asText());
        assertEquals("root1", body.get("root_id").asText());
        assertFalse(body.has("file_ids"));
    }

    @Test
    void shouldOmitRootIdForTopLevelPost() throws Exception {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(201, "{\"id\":\"p10\"}");

        gateway.createPost("c1", "hello", CreatePostOptions.none());

        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertFalse(body.has("root_id"));
    }

    @Test
    void shouldSurfaceClientErrorWithServerId() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(400, "{\"id\":\"api.post.create_post.root_id.app_error\",\"message\":\"Invalid RootId\"}");

        MattermostApiException e = assertThrows(MattermostApiException.class,
                () -> gateway.createPost("c1", "hi", CreatePostOptions.replyTo("bad")));

        assertEquals(400, e.getStatusCode());
        assertEquals("api.post.create_post.root_id.app_error", e.getServerErrorId());
        assertTrue(e.getMessage().contains("HTTP 400 Invalid RootId"));
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldRetryTransientFailureOfDataCall() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(502, "");
        engine.enqueueJson(200, "{\"id\":\"p1\",\"message\":\"hello\"}");

        ChatPost post = gateway.getPost("p1");

        assertEquals("hello", post.getMessage());
        assertEquals(2, engine.getRequestCount());
    }

    @Test
    void shouldPassPagingParametersForChannelPosts() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(200, "{\"order\":[\"b\",\"a\"],\"posts\":{\"a\":{\"id\":\"a\"},\"b\":{\"id\":\"b\"}}}");

        PostList posts = gateway.getPostsForChannel("c1", PostQuery.firstPage(30));

        assertEquals(List.of("b", "a"), posts.orderedPosts().stream().map(ChatPost::getId).toList());
        CapturedRequest request = engine.takeRequest();
        assertEquals("/api/v4/channels/c1/posts", request.url().encodedPath());
        assertEquals("0", request.url().queryParameter("page"));
        assertEquals("30", request.url().queryParameter("per_page"));
    }

    @Test
    void shouldFetchThreadFromThreadEndpoint() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(200, "{\"order\":[\"r\"],\"posts\":{\"r\":{\"id\":\"r\"}}}");

        gateway.getPostThread("r");

        assertEquals("/api/v4/posts/r/thread", engine.takeRequest().target());
    }

    @Test
    void shouldPatchPostText() throws Exception {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(200, "{\"id\":\"p1\",\"message\":\"edited\"}");

        gateway.updatePost("p1", "edited");

        CapturedRequest request = engine.takeRequest();
        assertEquals("PUT", request.method());
        assertEquals("/api/v4/posts/p1/patch", request.target());
        assertEquals("Bearer " + TOKEN, request.header("Authorization"));
        assertEquals("edited", objectMapper.readTree(request.body()).get("message").asText());
    }

    @Test
    void malformedBodyShouldCarryStatus() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(200, "{not json");

        MattermostApiException e = assertThrows(MattermostApiException.class, () -> gateway.getPost("p1"));

        assertEquals(200, e.getStatusCode());
        assertFalse(e.isRetryable());
    }

    // ===== Channels =====

    @Test
    void shouldJoinChannelAsBotUser() throws Exception {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(201, "{\"channel_id\":\"c1\",\"user_id\":\"bot1\"}");

        gateway.joinChannel("c1");

        CapturedRequest request = engine.takeRequest();
        assertEquals("/api/v4/channels/c1/members", request.target());
        assertEquals("bot1", objectMapper.readTree(request.body()).get("user_id").asText());
    }

    @Test
    void shouldLeaveChannelWithAuthorizedDelete() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(200, "{\"status\":\"OK\"}");

        gateway.leaveChannel("c1");

        CapturedRequest request = engine.takeRequest();
        assertEquals("DELETE", request.method());
        assertEquals("/api/v4/channels/c1/members/bot1", request.target());
        assertEquals("Bearer " + TOKEN, request.header("Authorization"));
    }

    @Test
    void shouldListChannelsForUser() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(200, "[{\"id\":\"c1\",\"type\":\"O\"},{\"id\":\"d1\",\"type\":\"D\"}]");

        assertEquals(2, gateway.getChannelsForUser("bot1", "team1").size());
        assertEquals("/api/v4/users/bot1/teams/team1/channels", engine.takeRequest().target());
    }

    @Test
    void emptyMembersBodyShouldYieldEmptyList() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(200, "");

        assertTrue(gateway.getChannelMembers("c1", 0, 50).isEmpty());
    }

    // ===== Files =====

    @Test
    void shouldUploadFileAsMultipart() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(201, "{\"file_infos\":[{\"id\":\"f1\",\"name\":\"notes.txt\"}],\"client_ids\":[]}");

        List<ChatFileInfo> infos = gateway.uploadFile("c1", "hello".getBytes(StandardCharsets.UTF_8), "notes.txt");

        assertEquals(1, infos.size());
        assertEquals("f1", infos.get(0).getId());
        CapturedRequest request = engine.takeRequest();
        assertEquals("/api/v4/files", request.target());
        assertTrue(request.contentType().startsWith("multipart/form-data"));
        assertTrue(request.body().contains("name=\"channel_id\""));
        assertTrue(request.body().contains("filename=\"notes.txt\""));
    }

    @Test
    void emptyUploadBodyShouldYieldNoFileInfos() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(201, "");

        assertTrue(gateway.uploadFile("c1", new byte[] {1, 2}, "blob.bin").isEmpty());
    }

    // ===== Rate limit headers =====

    @Test
    void everyRequestShouldTakeOneRateLimitSlot() {
        rateLimiter = spy(new FixedWindowRateLimiter(false, 10, 1000, new MutableClock(0)));
        MattermostRestGateway gateway = gateway();
        engine.enqueueJson(200, BOT_JSON);
        engine.enqueueJson(200, TEAM_JSON);
        engine.enqueueJson(200, MEMBER_JSON);
        engine.enqueueJson(200, BOT_JSON);

        gateway.initialize();
        assertTrue(gateway.testConnection());

        assertEquals(4, engine.getRequestCount());
        verify(rateLimiter, times(4)).acquire();
    }

    @Test
    void retriedAttemptsShouldEachTakeASlot() {
        rateLimiter = spy(new FixedWindowRateLimiter(false, 10, 1000, new MutableClock(0)));
        MattermostRestGateway gateway = gateway();
        engine.enqueueJson(503, "{\"message\":\"starting\"}");
        engine.enqueueJson(200, BOT_JSON);
        engine.enqueueJson(200, TEAM_JSON);
        engine.enqueueFailure(new IOException("connection reset"));

        gateway.initialize();

        assertEquals(4, engine.getRequestCount());
        verify(rateLimiter, times(4)).acquire();
    }

    @Test
    void shouldFeedServerRateLimitHeadersToLimiter() {
        MattermostRestGateway gateway = initializedGateway();
        engine.enqueueJson(200, "{\"id\":\"u2\",\"username\":\"alice\"}",
                Headers.of("X-Ratelimit-Remaining", "7", "X-Ratelimit-Reset", "1"));

        gateway.getUser("u2");

        assertEquals(7, rateLimiter.getWindow().getServerRemaining());
        assertEquals(1000L, rateLimiter.getWindow().getServerResetAtMs());
    }

    @Test
    void connectionTestShouldNotThrow() {
        MattermostRestGateway gateway = gateway();
        engine.enqueueFailure(new IOException("connection reset"));

        assertFalse(gateway.testConnection());

        engine.enqueueJson(200, BOT_JSON);
        assertTrue(gateway.testConnection());
        assertFalse(gateway.isReady());
    }
}
