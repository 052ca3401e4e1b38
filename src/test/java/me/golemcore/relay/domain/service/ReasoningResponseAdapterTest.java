package me.golemcore.relay.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.GeneratedReply;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningResponseAdapterTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private final ReasoningResponseAdapter adapter = new ReasoningResponseAdapter(objectMapper);

    record BackendResult(String text, String message) {
    }

    @Test
    void shouldAcceptPlainString() {
        assertEquals(Optional.of("Hi there"), adapter.normalize("Hi there").text());
    }

    @Test
    void shouldPreferTextOverMessage() {
        assertEquals(Optional.of("Hi"), adapter.normalize(Map.of("text", "Hi", "message", "Hello")).text());
    }

    @Test
    void shouldFallBackToMessageField() {
        assertEquals(Optional.of("Hello"), adapter.normalize(Map.of("message", "Hello")).text());
    }

    @Test
    void shouldSkipBlankTextField() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("text", "   ");
        raw.put("message", "Hello");

        assertEquals(Optional.of("Hello"), adapter.normalize(raw).text());
    }

    @Test
    void shouldReadJsonAndBeans() throws Exception {
        assertEquals(Optional.of("from json"),
                adapter.normalize(objectMapper.readTree("{\"text\":\"from json\"}")).text());
        assertEquals(Optional.of("from bean"), adapter.normalize(new BackendResult(null, "from bean")).text());
    }

    @Test
    void shouldTreatUnusableResultsAsEmpty() {
        assertTrue(adapter.normalize(null).isEmpty());
        assertTrue(adapter.normalize("").isEmpty());
        assertTrue(adapter.normalize("  \n").isEmpty());
        assertTrue(adapter.normalize(Map.of("action", "CONTINUE")).isEmpty());
        assertTrue(adapter.normalize(Map.of("text", 42)).isEmpty());
        assertTrue(adapter.normalize(List.of("a", "b")).isEmpty());
    }

    @Test
    void shouldPassThroughGeneratedReply() {
        GeneratedReply reply = GeneratedReply.text("ready");

        assertSame(reply, adapter.normalize(reply));
    }
}
