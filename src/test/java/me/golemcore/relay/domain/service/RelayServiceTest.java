package me.golemcore.relay.domain.service;

import me.golemcore.relay.adapter.inbound.mattermost.MattermostEventStreamClient;
import me.golemcore.relay.domain.model.ChatUser;
import me.golemcore.relay.domain.model.MattermostApiException;
import me.golemcore.relay.domain.model.ServiceHealth;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.EventStreamPort;
import me.golemcore.relay.port.outbound.ChatApiPort;
import me.golemcore.relay.testsupport.time.MutableClock;
import okhttp3.HttpUrl;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RelayServiceTest {

    private ChatApiPort chatApi;
    private EventStreamPort eventStream;
    private MessageRouter messageRouter;
    private ChannelMembershipService membershipService;
    private MutableClock clock;
    private RelayProperties properties;
    private RelayService relayService;

    @BeforeEach
    void setUp() {
        chatApi = mock(ChatApiPort.class);
        eventStream = mock(EventStreamPort.class);
        messageRouter = mock(MessageRouter.class);
        membershipService = mock(ChannelMembershipService.class);
        clock = new MutableClock(1_000);

        properties = new RelayProperties();
        properties.getStream().setAuthTimeoutMs(100);
        properties.getHttp().setConnectTimeout(100);

        when(chatApi.getBotUser()).thenReturn(ChatUser.builder().id("bot").username("relay-bot").build());
        when(eventStream.connect()).thenReturn(CompletableFuture.completedFuture(null));
        when(membershipService.getJoinedChannels()).thenReturn(Set.of("town"));

        relayService = new RelayService(chatApi, eventStream, messageRouter, membershipService, properties, clock);
    }

    @Test
    void shouldStartComponentsInOrder() {
        relayService.start();

        assertTrue(relayService.isRunning());
        InOrder order = inOrder(chatApi, eventStream, messageRouter, membershipService);
        order.verify(chatApi).initialize();
        order.verify(eventStream).connect();
        order.verify(messageRouter).initialize();
        order.verify(membershipService).initialize();
    }

    @Test
    void secondStartShouldBeNoOp() {
        relayService.start();
        relayService.start();

        verify(chatApi, times(1)).initialize();
    }

    @Test
    void failedGatewayShouldAbortStartAndCleanUp() {
        doThrow(new MattermostApiException("Get bot user: HTTP 401", 401)).when(chatApi).initialize();

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> relayService.start());

        assertTrue(error.getMessage().contains("HTTP 401"));
        assertFalse(relayService.isRunning());
        verify(eventStream, never()).connect();
        verify(messageRouter).cleanup();
        verify(membershipService).cleanup();
        verify(eventStream).disconnect();
    }

    @Test
    void failedStreamShouldNotAbortStart() {
        when(eventStream.connect()).thenReturn(CompletableFuture.failedFuture(new IOException("refused")));

        assertDoesNotThrow(() -> relayService.start());

        assertTrue(relayService.isRunning());
        verify(messageRouter).initialize();
        verify(membershipService).initialize();
        verify(eventStream, never()).disconnect();
    }

    @Test
    void streamThatNeverAuthenticatesShouldNotAbortStart() {
        when(eventStream.connect()).thenReturn(new CompletableFuture<>());

        assertDoesNotThrow(() -> relayService.start());

        assertTrue(relayService.isRunning());
        verify(messageRouter).initialize();
        verify(eventStream, never()).disconnect();
    }

    @Test
    void refusedFirstConnectShouldLeaveStreamReconnecting() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
                .thenAnswer(invocation -> mock(ScheduledFuture.class));
        List<WebSocketListener> listeners = new CopyOnWriteArrayList<>();
        WebSocket.Factory factory = (request, listener) -> {
            WebSocket socket = mock(WebSocket.class);
            listeners.add(listener);
            if (listeners.size() == 1) {
                CompletableFuture.runAsync(
                        () -> listener.onFailure(socket, new IOException("Connection refused"), null));
            }
            return socket;
        };
        MattermostEventStreamClient streamClient = new MattermostEventStreamClient(factory,
                AutoConfiguration.objectMapper(), scheduler,
                MattermostEventStreamClient.Settings.builder()
                        .streamUrl(HttpUrl.parse("https://chat.example.com/api/v4/websocket"))
                        .token("secret-token")
                        .authTimeoutMs(10_000)
                        .reconnectBaseDelayMs(1_000)
                        .build(),
                clock);
        RelayService service = new RelayService(chatApi, streamClient, messageRouter, membershipService,
                properties, clock);

        assertDoesNotThrow(service::start);

        assertTrue(service.isRunning());
        verify(membershipService).initialize();
        ArgumentCaptor<Runnable> reconnect = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, timeout(2000)).schedule(reconnect.capture(), eq(1_000L), eq(TimeUnit.MILLISECONDS));
        assertFalse(streamClient.isReconnectExhausted());

        reconnect.getValue().run();
        assertEquals(2, listeners.size());
    }

    @Test
    void stopShouldShutDownEvenWhenComponentsThrow() {
        relayService.start();
        doThrow(new IllegalStateException("boom")).when(messageRouter).cleanup();

        relayService.stop();

        assertFalse(relayService.isRunning());
        verify(membershipService).cleanup();
        verify(eventStream).disconnect();
    }

    @Test
    void healthShouldBeHealthyWhenEverythingIsUp() {
        relayService.start();
        when(chatApi.isReady()).thenReturn(true);
        when(eventStream.isConnected()).thenReturn(true);
        when(messageRouter.isReady()).thenReturn(true);
        clock.advance(5_000);

        ServiceHealth health = relayService.getHealth();

        assertEquals(ServiceHealth.Status.HEALTHY, health.getStatus());
        assertEquals(Duration.ofSeconds(5), health.getUptime());
    }

    @Test
    void disconnectedStreamShouldDegradeHealth() {
        when(chatApi.isReady()).thenReturn(true);
        when(messageRouter.isReady()).thenReturn(true);

        ServiceHealth health = relayService.getHealth();

        assertEquals(ServiceHealth.Status.DEGRADED, health.getStatus());
        assertFalse(health.isStreamConnected());
        assertEquals(Duration.ZERO, health.getUptime());
    }

    @Test
    void exhaustedReconnectOrUnavailableApiShouldBeUnhealthy() {
        when(chatApi.isReady()).thenReturn(true);
        when(eventStream.isReconnectExhausted()).thenReturn(true);
        assertEquals(ServiceHealth.Status.UNHEALTHY, relayService.getHealth().getStatus());

        when(chatApi.isReady()).thenReturn(false);
        when(eventStream.isReconnectExhausted()).thenReturn(false);
        when(eventStream.isConnected()).thenReturn(true);
        assertEquals(ServiceHealth.Status.UNHEALTHY, relayService.getHealth().getStatus());
    }
}
