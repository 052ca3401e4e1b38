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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ChannelKind;
import me.golemcore.relay.domain.model.ChatPost;
import me.golemcore.relay.domain.model.ChatUser;
import me.golemcore.relay.domain.model.CircuitBreakerStatus;
import me.golemcore.relay.domain.model.CreatePostOptions;
import me.golemcore.relay.domain.model.ErrorType;
import me.golemcore.relay.domain.model.GeneratedReply;
import me.golemcore.relay.domain.model.InboundMessage;
import me.golemcore.relay.domain.model.ReasoningRequest;
import me.golemcore.relay.domain.model.RouterHealthStatus;
import me.golemcore.relay.domain.model.RoutingDecision;
import me.golemcore.relay.domain.model.RoutingReason;
import me.golemcore.relay.domain.model.StreamEvent;
import me.golemcore.relay.domain.model.ThreadContext;
import me.golemcore.relay.domain.model.ThreadContextOptions;
import me.golemcore.relay.domain.model.ThreadMessage;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.EventStreamPort;
import me.golemcore.relay.port.inbound.StreamEventListener;
import me.golemcore.relay.port.outbound.ChatApiPort;
import me.golemcore.relay.port.outbound.ReasoningPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Decides which stream posts get an answer and delivers that answer.
 *
 * <p>
 * Classification runs on the stream's dispatch thread, in a fixed precedence
 * order (first match wins):
 * <ol>
 * <li>the bot's own post - skip
 * <li>an ID already routed - skip
 * <li>empty text or a system post - skip
 * <li>a direct message - route
 * <li>a post that mentions the bot - route
 * <li>anything else - skip
 * </ol>
 *
 * <p>
 * Routing marks the ID as processed before handing off to the worker pool, so
 * a second delivery of the same post is dropped. On a worker the router loads
 * thread context for replies, asks the reasoning backend for text and posts it
 * as a reply to the thread anchor. An accepted message always gets a visible
 * answer: generated text, a fallback when the backend produced nothing, or an
 * apology when it failed.
 *
 * <p>
 * Calls to the reasoning backend, the thread assembler and post creation each
 * sit behind a {@link CircuitBreaker}.
 */
@Service
@Slf4j
public class MessageRouter {

    static final String POSTED_EVENT = "posted";
    static final String POST_EDITED_EVENT = "post_edited";
    static final String CHANNEL_VIEWED_EVENT = "channel_viewed";

    static final String AI_GENERATION = "ai-generation";
    static final String THREAD_CONTEXT = "thread-context";
    static final String MESSAGE_POSTING = "message-posting";

    static final String CONTEXT_HEADER = "Previous conversation:";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ChatApiPort chatApi;
    private final EventStreamPort eventStream;
    private final ReasoningPort reasoningPort;
    private final ReasoningResponseAdapter responseAdapter;
    private final ThreadContextAssembler contextAssembler;
    private final ObjectMapper objectMapper;
    private final ExecutorService routerExecutor;
    private final RelayProperties.RouterProperties settings;
    private final Clock clock;

    private final ProcessedMessageCache processedMessages;
    private final RouterHealthMetrics metrics = new RouterHealthMetrics();
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final Map<String, StreamEventListener> registeredHandlers = new LinkedHashMap<>();

    private final Object lifecycleLock = new Object();
    private volatile boolean ready;
    private volatile String botUserId;

    public MessageRouter(ChatApiPort chatApi, EventStreamPort eventStream, ReasoningPort reasoningPort,
            ReasoningResponseAdapter responseAdapter, ThreadContextAssembler contextAssembler,
            ObjectMapper objectMapper, ExecutorService routerExecutor, RelayProperties properties, Clock clock) {
        this.chatApi = chatApi;
        this.eventStream = eventStream;
        this.reasoningPort = reasoningPort;
        this.responseAdapter = responseAdapter;
        this.contextAssembler = contextAssembler;
        this.objectMapper = objectMapper;
        this.routerExecutor = routerExecutor;
        this.settings = properties.getRouter();
        this.clock = clock;
        this.processedMessages = new ProcessedMessageCache(settings.getMaxCacheSize());
    }

    // ==================== LIFECYCLE ====================

    /**
     * Resolve the bot identity and subscribe to stream events. A second call
     * while ready is a no-op.
     *
     * @throws IllegalStateException
     *             when the gateway cannot be initialized or the bot user
     *             cannot be resolved
     */
    public void initialize() {
        synchronized (lifecycleLock) {
            if (ready) {
                log.debug("[Router] Already initialized");
                return;
            }
            try {
                if (!chatApi.isReady()) {
                    chatApi.initialize();
                }
                ChatUser botUser = chatApi.getBotUser();
                if (botUser == null || botUser.getId() == null || botUser.getId().isBlank()) {
                    throw new IllegalStateException("bot user could not be resolved");
                }
                botUserId = botUser.getId();

                register(POSTED_EVENT, this::handlePostedEvent);
                register(POST_EDITED_EVENT, this::handlePostEditedEvent);
                register(CHANNEL_VIEWED_EVENT, this::handleChannelViewedEvent);

                ready = true;
                log.info("[Router] Ready as bot user {} (provider: {})", botUserId, reasoningPort.getProviderName());
            } catch (RuntimeException e) {
                unregisterHandlers();
                botUserId = null;
                log.error("[Router] Initialization failed: {}", e.getMessage());
                throw new IllegalStateException("Message router initialization failed: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Unsubscribe and forget all routing state. Work already handed to the
     * worker pool is not cancelled. Safe to call when never initialized.
     */
    public void cleanup() {
        synchronized (lifecycleLock) {
            unregisterHandlers();
            processedMessages.clear();
            metrics.clearResponseTimes();
            circuitBreakers.clear();
            botUserId = null;
            ready = false;
            log.info("[Router] Cleaned up");
        }
    }

    public boolean isReady() {
        return ready;
    }

    public String getBotUserId() {
        return botUserId;
    }

    private void register(String event, StreamEventListener handler) {
        eventStream.on(event, handler);
        registeredHandlers.put(event, handler);
    }

    private void unregisterHandlers() {
        for (Map.Entry<String, StreamEventListener> entry : registeredHandlers.entrySet()) {
            try {
                eventStream.off(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                log.warn("[Router] Failed to unregister '{}' handler: {}", entry.getKey(), e.getMessage());
            }
        }
        registeredHandlers.clear();
    }

    // ==================== CLASSIFICATION ====================

    /**
     * Decide whether a message should be answered. Pure apart from reading the
     * processed-ID cache.
     */
    public RoutingDecision classify(InboundMessage message) {
        String botId = botUserId;
        boolean directMessage = message.getChannelKind() == ChannelKind.DIRECT;
        boolean mention = botId != null && message.getMentionedUserIds().contains(botId);

        if (botId != null && botId.equals(message.getAuthorId())) {
            return RoutingDecision.of(RoutingReason.OWN_MESSAGE, directMessage, mention);
        }
        if (processedMessages.contains(message.getId())) {
            return RoutingDecision.of(RoutingReason.DUPLICATE, directMessage, mention);
        }
        if (!message.hasText() || message.isSystemMessage()) {
            return RoutingDecision.of(RoutingReason.EMPTY_OR_SYSTEM,
                    RoutingReason.EMPTY_OR_SYSTEM.getDescription() + " - type: " + message.getMessageKind(),
                    directMessage, mention);
        }
        if (directMessage) {
            return RoutingDecision.of(RoutingReason.DIRECT_MESSAGE, true, mention);
        }
        if (mention) {
            return RoutingDecision.of(RoutingReason.MENTION, false, true);
        }
        return RoutingDecision.of(RoutingReason.NO_MENTION, false, false);
    }

    // ==================== EVENT HANDLERS ====================

    void handlePostedEvent(StreamEvent event) {
        if (!ready) {
            log.debug("[Router] Not ready, ignoring posted event");
            return;
        }
        Optional<InboundMessage> parsed = parsePostedEvent(event.getData());
        if (parsed.isEmpty()) {
            return;
        }

        InboundMessage message = parsed.get();
        RoutingDecision decision = classify(message);
        if (!decision.isShouldRoute()) {
            log.debug("[Router] Skipping {}: {}", message.getId(), decision.getDetail());
            return;
        }
        log.info("[Router] Routing {} from {} in channel {}: {}", message.getId(), message.getAuthorId(),
                message.getChannelId(), decision.getDetail());
        route(message, decision);
    }

    private void handlePostEditedEvent(StreamEvent event) {
        log.debug("[Router] Post edited (channel {})", event.getData().path("channel_id").asText(null));
    }

    private void handleChannelViewedEvent(StreamEvent event) {
        log.debug("[Router] Channel viewed: {}", event.getData().path("channel_id").asText(null));
    }

    /**
     * Flatten a {@code posted} event payload. The post arrives as a JSON
     * string, the mentions as a JSON-encoded array string.
     */
    Optional<InboundMessage> parsePostedEvent(JsonNode data) {
        try {
            JsonNode postNode = data.get("post");
            if (postNode == null || postNode.isNull()) {
                log.warn("[Router] Posted event without post payload");
                return Optional.empty();
            }
            ChatPost post = postNode.isTextual()
                    ? objectMapper.readValue(postNode.asText(), ChatPost.class)
                    : objectMapper.treeToValue(postNode, ChatPost.class);
            if (post == null || post.getId() == null || post.getChannelId() == null) {
                log.warn("[Router] Posted event with incomplete post, dropping");
                return Optional.empty();
            }

            return Optional.of(InboundMessage.builder()
                    .id(post.getId())
                    .authorId(post.getUserId())
                    .channelId(post.getChannelId())
                    .threadRootId(post.isReply() ? post.getRootId() : null)
                    .text(post.getMessage())
                    .messageKind(post.getType())
                    .channelKind(ChannelKind.fromCode(data.path("channel_type").asText(null)))
                    .mentionedUserIds(parseMentions(data.get("mentions")))
                    .fileIds(post.getFileIds() != null ? post.getFileIds() : List.of())
                    .createAt(post.getCreateAt())
                    .senderName(data.path("sender_name").asText(null))
                    .channelName(data.path("channel_display_name").asText(null))
                    .build());
        } catch (JsonProcessingException e) {
            log.warn("[Router] Malformed posted event, dropping: {}", e.getOriginalMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("[Router] Malformed posted event, dropping: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> parseMentions(JsonNode mentions) throws JsonProcessingException {
        if (mentions == null || mentions.isNull()) {
            return List.of();
        }
        List<String> ids = null;
        if (mentions.isTextual()) {
            String raw = mentions.asText();
            ids = raw.isBlank() ? null : objectMapper.readValue(raw, STRING_LIST);
        } else if (mentions.isArray()) {
            ids = objectMapper.convertValue(mentions, STRING_LIST);
        }
        // "null" decodes to a null list
        return ids != null ? ids : List.of();
    }

    // ==================== ROUTING ====================

    /**
     * Answer a message that {@link #classify} accepted. The returned future
     * completes once the reply (or apology) was attempted; it never completes
     * exceptionally.
     */
    public CompletableFuture<Void> route(InboundMessage message, RoutingDecision decision) {
        if (!processedMessages.markIfAbsent(message.getId())) {
            log.debug("[Router] {} already routed, dropping duplicate", message.getId());
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(() -> processMessage(message, decision), routerExecutor);
        } catch (RejectedExecutionException e) {
            log.error("[Router] Worker pool rejected message {}: {}", message.getId(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private void processMessage(InboundMessage message, RoutingDecision decision) {
        long startedAt = clock.millis();
        boolean directMessage = decision.isDirectMessage();
        boolean threadReply = message.isReply();
        String anchor = message.threadAnchor();

        ThreadContext context = threadReply ? loadThreadContext(message) : null;
        String prompt = buildPrompt(message, context);

        String reply;
        try {
            ReasoningRequest request = ReasoningRequest.builder()
                    .prompt(prompt)
                    .temperature(settings.getTemperature())
                    .maxTokens(settings.getMaxTokens())
                    .user(message.getAuthorId())
                    .build();
            Object raw = guarded(AI_GENERATION, () -> reasoningPort.generate(request).get());
            GeneratedReply generated = responseAdapter.normalize(raw);
            metrics.recordSuccess(clock.millis() - startedAt);
            reply = generated.text().orElseGet(() -> {
                log.warn("[Router] Reasoning returned no usable text for {}, using fallback", message.getId());
                return ReplyTemplates.fallback(directMessage, threadReply);
            });
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            Throwable cause = unwrap(e);
            ErrorType errorType = ErrorType.categorize(cause);
            metrics.recordFailure(clock.millis() - startedAt, errorType);
            log.error("[Router] Reasoning failed for {} ({}): {}", message.getId(), errorType, cause.getMessage());
            reply = settings.isFallbackMessagesEnabled()
                    ? ReplyTemplates.apology(errorType, directMessage)
                    : ReplyTemplates.TEMPORARILY_UNAVAILABLE;
        }

        postReply(message, anchor, reply, directMessage);
    }

    private ThreadContext loadThreadContext(InboundMessage message) {
        try {
            Optional<ThreadContext> context = guarded(THREAD_CONTEXT, () -> contextAssembler.getThreadContext(
                    message.getThreadRootId(), message.getChannelId(),
                    ThreadContextOptions.ofMaxMessages(settings.getThreadContextMaxMessages())));
            return context != null ? context.orElse(null) : null;
        } catch (Exception e) {
            log.warn("[Router] Thread context unavailable for {}: {}", message.getThreadRootId(),
                    unwrap(e).getMessage());
            return null;
        }
    }

    /**
     * Raw text when there is no prior conversation, otherwise the prior
     * messages as {@code "<name>: <text>"} lines under a fixed header followed
     * by the current message.
     */
    String buildPrompt(InboundMessage message, ThreadContext context) {
        if (context == null) {
            return message.getText();
        }
        List<String> lines = new ArrayList<>();
        for (ThreadMessage prior : context.getMessages()) {
            if (message.getId().equals(prior.getPostId()) || prior.getText() == null || prior.getText().isBlank()) {
                continue;
            }
            lines.add(prior.getDisplayName() + ": " + prior.getText());
        }
        if (lines.isEmpty()) {
            return message.getText();
        }
        return CONTEXT_HEADER + "\n" + String.join("\n", lines) + "\n\nCurrent message: " + message.getText();
    }

    private void postReply(InboundMessage message, String anchor, String reply, boolean directMessage) {
        try {
            guarded(MESSAGE_POSTING, () -> chatApi.createPost(message.getChannelId(), reply,
                    CreatePostOptions.replyTo(anchor)));
            log.info("[Router] Replied to {} in channel {} ({} chars)", message.getId(), message.getChannelId(),
                    reply.length());
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            ErrorType errorType = ErrorType.categorize(cause);
            log.error("[Router] Failed to post reply to {} ({}): {}", message.getId(), errorType,
                    cause.getMessage());

            String apology = ReplyTemplates.apology(errorType, directMessage);
            try {
                chatApi.createPost(message.getChannelId(), apology, CreatePostOptions.replyTo(anchor));
            } catch (RuntimeException apologyError) {
                log.error("[Router] Failed to post apology to {}: {}", message.getId(), apologyError.getMessage());
            }
        }
    }

    private <T> T guarded(String dependency, Callable<T> call) throws Exception {
        CircuitBreaker breaker = circuitBreaker(dependency);
        if (!breaker.tryAcquirePermission()) {
            throw new CircuitOpenException(dependency);
        }
        try {
            T result = call.call();
            breaker.onSuccess();
            return result;
        } catch (Exception e) {
            breaker.onError();
            throw e;
        }
    }

    private CircuitBreaker circuitBreaker(String dependency) {
        return circuitBreakers.computeIfAbsent(dependency, name -> new CircuitBreaker(name,
                settings.getBreakerFailureThreshold(), settings.getBreakerOpenTimeoutMs(),
                settings.getBreakerHalfOpenSuccesses(), clock));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // ==================== HEALTH ====================

    public RouterHealthStatus getHealthStatus() {
        Map<String, CircuitBreakerStatus> breakers = new LinkedHashMap<>();
        circuitBreakers.forEach((name, breaker) -> breakers.put(name, breaker.getStatus()));
        return RouterHealthStatus.builder()
                .totalMessages(metrics.getTotalMessages())
                .successfulResponses(metrics.getSuccessfulResponses())
                .failedResponses(metrics.getFailedResponses())
                .averageResponseTimeMs(metrics.getAverageResponseTimeMs())
                .errorsByType(metrics.getErrorsByType())
                .circuitBreakers(breakers)
                .processedCacheSize(processedMessages.size())
                .processedCacheMaxSize(processedMessages.getMaxSize())
                .build();
    }

    public Map<String, Integer> getCacheStats() {
        return Map.of("size", processedMessages.size(), "maxSize", processedMessages.getMaxSize());
    }
}
