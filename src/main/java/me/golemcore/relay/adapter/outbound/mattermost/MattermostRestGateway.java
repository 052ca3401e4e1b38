package me.golemcore.relay.adapter.outbound.mattermost;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ChannelMember;
import me.golemcore.relay.domain.model.ChatChannel;
import me.golemcore.relay.domain.model.ChatFileInfo;
import me.golemcore.relay.domain.model.ChatPost;
import me.golemcore.relay.domain.model.ChatTeam;
import me.golemcore.relay.domain.model.ChatUser;
import me.golemcore.relay.domain.model.CreatePostOptions;
import me.golemcore.relay.domain.model.MattermostApiException;
import me.golemcore.relay.domain.model.PostList;
import me.golemcore.relay.domain.model.PostQuery;
import me.golemcore.relay.domain.model.TeamMember;
import me.golemcore.relay.infrastructure.config.MattermostSettingsValidator;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ChatApiPort;
import me.golemcore.relay.ratelimit.RateLimiter;
import me.golemcore.relay.retry.RetryExecutor;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Mattermost REST API v4 adapter.
 *
 * <p>
 * Every HTTP request takes one slot from the shared {@link RateLimiter}:
 * retried calls through {@link RetryExecutor} per attempt, single-attempt
 * checks directly. Responses feed the server's rate
 * limit headers back into the limiter. Non-2xx responses and I/O failures are
 * normalized into {@link MattermostApiException}.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /users/me, /users/{id} - identity and profile lookup
 * <li>GET /teams/name/{name}, /teams/{team}/members/{user} - team access
 * <li>POST /posts, GET /posts/{id}, PUT /posts/{id}/patch, GET
 * /posts/{id}/thread
 * <li>GET /channels/{id}/posts, /channels/{id}, /channels/{id}/members
 * <li>POST /files, GET /files/{id}/info
 * </ul>
 *
 * <p>
 * Configuration is validated in the constructor, before any network call. The
 * access token is only ever placed in the {@code Authorization} header and is
 * never logged.
 *
 * @see ChatApiPort
 */
@Component
@Slf4j
public class MattermostRestGateway implements ChatApiPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final int DEFAULT_PER_PAGE = 200;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RetryExecutor retryExecutor;
    private final RateLimiter rateLimiter;
    private final HttpUrl apiBase;
    private final String token;
    private final String teamName;

    private final Object initLock = new Object();
    private volatile ChatUser botUser;
    private volatile ChatTeam team;

    public MattermostRestGateway(RelayProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper,
            RetryExecutor retryExecutor, RateLimiter rateLimiter) {
        RelayProperties.MattermostProperties settings = properties.getMattermost();
        HttpUrl baseUrl = MattermostSettingsValidator.validate(settings);

        this.httpClient = baseHttpClient;
        this.objectMapper = objectMapper;
        this.retryExecutor = retryExecutor;
        this.rateLimiter = rateLimiter;
        this.apiBase = baseUrl.newBuilder().addPathSegments("api/v4").build();
        this.token = settings.getToken().trim();
        this.teamName = settings.getTeam().trim();
    }

    // ==================== LIFECYCLE ====================

    @Override
    public void initialize() {
        synchronized (initLock) {
            if (isReady()) {
                log.debug("[REST] Already initialized");
                return;
            }

            log.info("[REST] Initializing against {} (team '{}')", apiBase, teamName);
            try {
                ChatUser self = initCall("Fetch bot user", get(url("users", "me")), type(ChatUser.class));
                ChatTeam resolvedTeam = initCall("Fetch team '" + teamName + "'",
                        get(url("teams", "name", teamName)), type(ChatTeam.class));
                if (self == null || resolvedTeam == null) {
                    throw MattermostApiException.of("REST initialization", "empty bot user or team response",
                            null, null, null);
                }
                verifyTeamMembership(resolvedTeam, self);
                this.botUser = self;
                this.team = resolvedTeam;
            } catch (MattermostApiException e) {
                throw withOperatorHint(e);
            }

            log.info("[REST] Initialized as @{} ({}) in team {} ({})",
                    botUser.getUsername(), botUser.getId(), team.getName(), team.getId());
        }
    }

    @Override
    public boolean isReady() {
        return botUser != null && team != null;
    }

    @Override
    public boolean testConnection() {
        try {
            ChatUser self = sendOnce(get(url("users", "me")), type(ChatUser.class), "Test connection");
            log.info("[REST] Connection test succeeded as @{}", self != null ? self.getUsername() : "?");
            return true;
        } catch (MattermostApiException e) {
            log.warn("[REST] Connection test failed: {}", e.getMessage());
            return false;
        }
    }

    // ==================== USERS / TEAMS ====================

    @Override
    public ChatUser getBotUser() {
        requireReady();
        return botUser;
    }

    @Override
    public ChatTeam getTeam() {
        requireReady();
        return team;
    }

    @Override
    public ChatUser getUser(String userId) {
        requireReady();
        log.debug("[REST] Fetching user {}", userId);
        return call("Get user " + userId, get(url("users", userId)), type(ChatUser.class));
    }

    // ==================== POSTS ====================

    @Override
    public ChatPost createPost(String channelId, String message, CreatePostOptions options) {
        requireReady();
        CreatePostOptions effective = options != null ? options : CreatePostOptions.none();
        log.debug("[REST] Creating post in channel {} (root: {}, {} chars)",
                channelId, effective.getRootId(), message != null ? message.length() : 0);

        ObjectNode body = objectMapper.createObjectNode();
        body.put("channel_id", channelId);
        body.put("message", message);
        if (effective.getRootId() != null && !effective.getRootId().isBlank()) {
            body.put("root_id", effective.getRootId());
        }
        if (!effective.getFileIds().isEmpty()) {
            body.set("file_ids", objectMapper.valueToTree(effective.getFileIds()));
        }
        if (!effective.getProps().isEmpty()) {
            body.set("props", objectMapper.valueToTree(effective.getProps()));
        }

        ChatPost created = call("Create post in " + channelId, post(url("posts"), body), type(ChatPost.class));
        log.info("[REST] Created post {} in channel {}", created != null ? created.getId() : null, channelId);
        return created;
    }

    @Override
    public ChatPost replyToThread(String channelId, String rootId, String message) {
        return createPost(channelId, message, CreatePostOptions.replyTo(rootId));
    }

    @Override
    public ChatPost getPost(String postId) {
        requireReady();
        log.debug("[REST] Fetching post {}", postId);
        return call("Get post " + postId, get(url("posts", postId)), type(ChatPost.class));
    }

    @Override
    public PostList getPostsForChannel(String channelId, PostQuery query) {
        requireReady();
        PostQuery effective = query != null ? query : PostQuery.builder().build();
        HttpUrl.Builder url = url("channels", channelId, "posts").newBuilder()
                .addQueryParameter("page", String.valueOf(effective.getPage()))
                .addQueryParameter("per_page", String.valueOf(effective.getPerPage()));
        if (effective.getSince() != null) {
            url.addQueryParameter("since", String.valueOf(effective.getSince()));
        }
        if (effective.getBefore() != null) {
            url.addQueryParameter("before", effective.getBefore());
        }
        if (effective.getAfter() != null) {
            url.addQueryParameter("after", effective.getAfter());
        }

        PostList posts = call("Get posts for channel " + channelId, get(url.build()), type(PostList.class));
        log.debug("[REST] Fetched {} posts from channel {}", sizeOf(posts), channelId);
        return posts;
    }

    @Override
    public PostList getPostThread(String postId) {
        requireReady();
        PostList thread = call("Get thread " + postId, get(url("posts", postId, "thread")), type(PostList.class));
        log.debug("[REST] Fetched {} posts of thread {}", sizeOf(thread), postId);
        return thread;
    }

    @Override
    public ChatPost updatePost(String postId, String message) {
        requireReady();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("message", message);
        Request request = authorized(new Request.Builder()
                .url(url("posts", postId, "patch"))
                .put(jsonBody(body)));
        ChatPost updated = call("Update post " + postId, request, type(ChatPost.class));
        log.info("[REST] Updated post {}", postId);
        return updated;
    }

    // ==================== CHANNELS ====================

    @Override
    public ChatChannel getChannel(String channelId) {
        requireReady();
        return call("Get channel " + channelId, get(url("channels", channelId)), type(ChatChannel.class));
    }

    @Override
    public ChatChannel getChannelByName(String teamId, String channelName) {
        requireReady();
        return call("Get channel by name " + channelName,
                get(url("teams", teamId, "channels", "name", channelName)), type(ChatChannel.class));
    }

    @Override
    public List<ChatChannel> getChannelsForTeam(String teamId) {
        requireReady();
        HttpUrl url = url("teams", teamId, "channels").newBuilder()
                .addQueryParameter("per_page", String.valueOf(DEFAULT_PER_PAGE))
                .build();
        List<ChatChannel> channels = call("Get channels for team " + teamId, get(url), listOf(ChatChannel.class));
        return channels != null ? channels : List.of();
    }

    @Override
    public List<ChatChannel> getChannelsForUser(String userId, String teamId) {
        requireReady();
        List<ChatChannel> channels = call("Get channels for user " + userId,
                get(url("users", userId, "teams", teamId, "channels")), listOf(ChatChannel.class));
        return channels != null ? channels : List.of();
    }

    @Override
    public List<ChannelMember> getChannelMembers(String channelId, int page, int perPage) {
        requireReady();
        HttpUrl url = url("channels", channelId, "members").newBuilder()
                .addQueryParameter("page", String.valueOf(page))
                .addQueryParameter("per_page", String.valueOf(perPage > 0 ? perPage : DEFAULT_PER_PAGE))
                .build();
        List<ChannelMember> members = call("Get members of channel " + channelId, get(url),
                listOf(ChannelMember.class));
        List<ChannelMember> result = members != null ? members : List.of();
        log.debug("[REST] Channel {} has {} members on page {}", channelId, result.size(), page);
        return result;
    }

    @Override
    public ChannelMember joinChannel(String channelId) {
        requireReady();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("user_id", botUser.getId());
        ChannelMember member = call("Join channel " + channelId, post(url("channels", channelId, "members"), body),
                type(ChannelMember.class));
        log.info("[REST] Joined channel {}", channelId);
        return member;
    }

    @Override
    public void leaveChannel(String channelId) {
        requireReady();
        Request request = authorized(new Request.Builder()
                .url(url("channels", channelId, "members", botUser.getId()))
                .delete());
        call("Leave channel " + channelId, request, type(JsonNode.class));
        log.info("[REST] Left channel {}", channelId);
    }

    // ==================== FILES ====================

    @Override
    public List<ChatFileInfo> uploadFile(String channelId, byte[] content, String fileName) {
        requireReady();
        log.debug("[REST] Uploading {} ({} bytes) to channel {}", fileName, content.length, channelId);
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("channel_id", channelId)
                .addFormDataPart("files", fileName, RequestBody.create(content, OCTET_STREAM))
                .build();
        Request request = authorized(new Request.Builder()
                .url(url("files"))
                .post(body));
        FileUploadResponse response = call("Upload file " + fileName, request, type(FileUploadResponse.class));
        List<ChatFileInfo> infos = response != null && response.fileInfos() != null ? response.fileInfos()
                : List.of();
        log.info("[REST] Uploaded {} to channel {} ({} file(s))", fileName, channelId, infos.size());
        return infos;
    }

    @Override
    public ChatFileInfo getFileInfo(String fileId) {
        requireReady();
        return call("Get file info " + fileId, get(url("files", fileId, "info")), type(ChatFileInfo.class));
    }

    // ==================== TRANSPORT ====================

    private <T> T call(String operation, Request request, JavaType responseType) {
        try {
            return retryExecutor.execute(() -> send(request, responseType, operation), operation);
        } catch (RuntimeException e) {
            log.warn("[REST] {} failed: {}", operation, e.getMessage());
            throw e;
        }
    }

    private <T> T initCall(String operation, Request request, JavaType responseType) {
        return retryExecutor.execute(() -> send(request, responseType, operation), operation,
                retryExecutor.getInitializationPolicy());
    }

    /**
     * Single attempt outside the retry executor; still takes one rate-limit
     * slot.
     */
    private <T> T sendOnce(Request request, JavaType responseType, String operation) {
        rateLimiter.acquire();
        return send(request, responseType, operation);
    }

    // Callers hold a rate-limit slot: the retry executor takes one per attempt
    private <T> T send(Request request, JavaType responseType, String operation) {
        int code;
        String body;
        try (Response response = httpClient.newCall(request).execute()) {
            rateLimiter.updateFromHeaders(
                    response.header("X-Ratelimit-Remaining"),
                    response.header("X-Ratelimit-Reset"));

            code = response.code();
            ResponseBody responseBody = response.body();
            body = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw errorFromResponse(operation, code, body);
            }
        } catch (IOException e) {
            throw MattermostApiException.of(operation, "network error: " + e.getMessage(), null, null, e);
        }

        if (body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, responseType);
        } catch (JsonProcessingException e) {
            throw MattermostApiException.of(operation, "malformed response body", code, null, e);
        }
    }

    private MattermostApiException errorFromResponse(String operation, int code, String body) {
        String detail = "HTTP " + code;
        String errorId = null;
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node.hasNonNull("message")) {
                    detail = detail + " " + node.get("message").asText();
                }
                if (node.hasNonNull("id")) {
                    errorId = node.get("id").asText();
                }
            } catch (JsonProcessingException e) {
                log.debug("[REST] Non-JSON error body for {}", operation);
            }
        }
        return MattermostApiException.of(operation, detail, code, errorId, null);
    }

    private void verifyTeamMembership(ChatTeam resolvedTeam, ChatUser self) {
        try {
            sendOnce(get(url("teams", resolvedTeam.getId(), "members", self.getId())), type(TeamMember.class),
                    "Verify team membership");
            log.debug("[REST] Bot is a member of team {}", resolvedTeam.getName());
        } catch (MattermostApiException e) {
            log.warn("[REST] Could not verify team membership for team {}: {}", resolvedTeam.getName(),
                    e.getMessage());
        }
    }

    private MattermostApiException withOperatorHint(MattermostApiException e) {
        String hint;
        if (e.isAuthenticationFailure()) {
            hint = "Mattermost rejected the access token; check relay.mattermost.token";
        } else if (e.getStatusCode() != null && e.getStatusCode() == 404) {
            hint = "Team '" + teamName + "' not found or not accessible; check relay.mattermost.team";
        } else if (e.getStatusCode() == null) {
            hint = "Cannot reach Mattermost at " + apiBase + "; check relay.mattermost.url";
        } else {
            return e;
        }
        log.error("[REST] Initialization failed: {}", hint);
        return new MattermostApiException(hint + " (" + e.getMessage() + ")", e.getStatusCode(),
                e.getServerErrorId(), e);
    }

    private void requireReady() {
        if (!isReady()) {
            throw new IllegalStateException("REST gateway not initialized. Call initialize() first.");
        }
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = apiBase.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private Request get(HttpUrl url) {
        return authorized(new Request.Builder().url(url).get());
    }

    private Request post(HttpUrl url, JsonNode body) {
        return authorized(new Request.Builder().url(url).post(jsonBody(body)));
    }

    private Request authorized(Request.Builder builder) {
        return builder.header("Authorization", "Bearer " + token).build();
    }

    private RequestBody jsonBody(JsonNode body) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
    }

    private JavaType type(Class<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }

    private JavaType listOf(Class<?> elementType) {
        return objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    private static int sizeOf(PostList posts) {
        return posts != null && posts.getPosts() != null ? posts.getPosts().size() : 0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FileUploadResponse(@JsonProperty("file_infos") List<ChatFileInfo> fileInfos,
            @JsonProperty("client_ids") List<String> clientIds) {
    }
}
