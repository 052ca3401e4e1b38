package me.golemcore.relay.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.relay.domain.model.ReasoningRequest;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jReasoningAdapterTest {

    private static final ReasoningRequest REQUEST = ReasoningRequest.builder()
            .prompt("hello")
            .temperature(0.7)
            .maxTokens(256)
            .user("alice")
            .build();

    @Test
    void shouldSendPromptAsSingleUserMessage() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("hi there")).build());
        Langchain4jReasoningAdapter adapter = new Langchain4jReasoningAdapter(model);

        Object result = adapter.generate(REQUEST).join();

        assertEquals("hi there", result);
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(model).chat(captor.capture());
        ChatRequest sent = captor.getValue();
        assertEquals(1, sent.messages().size());
        assertEquals("hello", ((UserMessage) sent.messages().get(0)).singleText());
        assertEquals(0.7, sent.parameters().temperature());
        assertEquals(256, sent.parameters().maxOutputTokens());
        assertEquals("openai", adapter.getProviderName());
    }

    @Test
    void modelFailureShouldSurfaceAsGenerationError() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("upstream 500"));
        Langchain4jReasoningAdapter adapter = new Langchain4jReasoningAdapter(model);

        CompletionException error = assertThrows(CompletionException.class, () -> adapter.generate(REQUEST).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("Model generation failed: upstream 500", error.getCause().getMessage());
    }

    @Test
    void shouldRequireApiKey() {
        RelayProperties properties = new RelayProperties();
        properties.getLlm().setProvider("openai");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new Langchain4jReasoningAdapter(properties));

        assertTrue(error.getMessage().contains("relay.llm.api-key"));
    }

    @Test
    void noOpAdapterShouldProduceNothing() {
        NoOpReasoningAdapter adapter = new NoOpReasoningAdapter();

        assertNull(adapter.generate(REQUEST).join());
        assertEquals("none", adapter.getProviderName());
    }
}
