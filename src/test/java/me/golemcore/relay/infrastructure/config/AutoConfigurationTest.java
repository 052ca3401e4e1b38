package me.golemcore.relay.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.ChatPost;
import me.golemcore.relay.domain.service.RelayService;
import me.golemcore.relay.port.outbound.ReasoningPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Mock
    private RelayService relayService;
    @Mock
    private ReasoningPort reasoningPort;
    @Mock
    private ObjectProvider<BuildProperties> buildPropertiesProvider;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(reasoningPort.getProviderName()).thenReturn("none");
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(null);
    }

    private AutoConfiguration autoConfiguration(RelayProperties properties) {
        return new AutoConfiguration(properties, relayService, reasoningPort, buildPropertiesProvider);
    }

    @Test
    void shouldStartRelayOnInitWhenEnabled() {
        AutoConfiguration autoConfiguration = autoConfiguration(new RelayProperties());

        autoConfiguration.init();

        verify(relayService).start();
    }

    @Test
    void shouldSkipStartOnInitWhenDisabled() {
        RelayProperties properties = new RelayProperties();
        properties.setEnabled(false);

        autoConfiguration(properties).init();

        verify(relayService, never()).start();
    }

    @Test
    void startFailureShouldAbortInit() {
        doThrow(new IllegalStateException("Relay failed to start: HTTP 401")).when(relayService).start();

        assertThrows(IllegalStateException.class, () -> autoConfiguration(new RelayProperties()).init());
    }

    @Test
    void shouldStopRelayOnShutdown() {
        autoConfiguration(new RelayProperties()).shutdown();

        verify(relayService).stop();
    }

    @Test
    void objectMapperShouldIgnoreUnknownFields() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        ChatPost post = mapper.readValue("{\"id\":\"p1\",\"is_pinned\":true,\"reply_count\":3}", ChatPost.class);

        assertEquals("p1", post.getId());
    }

    @Test
    void routerExecutorShouldUseNamedDaemonThreads() throws Exception {
        RelayProperties properties = new RelayProperties();
        properties.getRouter().setWorkerThreads(2);
        ExecutorService executor = AutoConfiguration.routerExecutor(properties);
        try {
            Future<Thread> worker = executor.submit(Thread::currentThread);
            Thread thread = worker.get();

            assertTrue(thread.getName().startsWith("relay-router-"));
            assertTrue(thread.isDaemon());
        } finally {
            executor.shutdownNow();
        }
    }
}
