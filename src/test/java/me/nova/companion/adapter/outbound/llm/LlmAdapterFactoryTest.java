package me.nova.companion.adapter.outbound.llm;

import me.nova.companion.domain.model.LlmRequest;
import me.nova.companion.domain.model.LlmResponse;
import me.nova.companion.domain.service.ReplyPicker;
import me.nova.companion.infrastructure.config.NovaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private NovaProperties properties;
    private MockLlmAdapter mockAdapter;

    @BeforeEach
    void setUp() {
        properties = new NovaProperties();
        mockAdapter = new MockLlmAdapter(new ReplyPicker(new Random(7)));
    }

    private static LlmProviderAdapter adapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        when(adapter.getCurrentModel()).thenReturn(providerId + "-model");
        return adapter;
    }

    // ===== init() =====

    @Test
    void shouldSelectConfiguredProviderWhenAvailable() {
        LlmProviderAdapter openai = adapter("openai", true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(openai, mockAdapter));
        factory.init();

        assertSame(openai, factory.getActiveAdapter());
        assertEquals("openai", factory.getProviderId());
        assertEquals("openai-model", factory.getCurrentModel());
        assertFalse(factory.isMock());
    }

    @Test
    void shouldFallBackToMockWhenProviderHasNoKey() {
        LlmProviderAdapter openai = adapter("openai", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(openai, mockAdapter));
        factory.init();

        assertSame(mockAdapter, factory.getActiveAdapter());
        assertTrue(factory.isMock());
        assertTrue(factory.isAvailable());
    }

    @Test
    void shouldFallBackToMockWhenProviderUnknown() {
        properties.getLlm().setProvider("nonexistent");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(adapter("openai", true), mockAdapter));
        factory.init();

        assertEquals("mock", factory.getProviderId());
    }

    @Test
    void shouldFailChatWhenNoAdapters() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertTrue(factory.isMock());
        assertFalse(factory.isAvailable());
        CompletableFuture<LlmResponse> future = factory.chat(LlmRequest.builder().build());
        assertThrows(ExecutionException.class, future::get);
    }

    // ===== chat delegation =====

    @Test
    void shouldDelegateChatToActiveAdapter() {
        LlmProviderAdapter openai = adapter("openai", true);
        LlmRequest request = LlmRequest.builder().model("openai-model").build();
        CompletableFuture<LlmResponse> reply = CompletableFuture.completedFuture(
                LlmResponse.builder().content("Okay.").build());
        when(openai.chat(request)).thenReturn(reply);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(openai, mockAdapter));
        factory.init();

        assertSame(reply, factory.chat(request));
        verify(openai).chat(request);
    }

    @Test
    void mockAdapterShouldAnswerFromCannedReplies() {
        LlmResponse response = mockAdapter.chat(LlmRequest.builder().build()).join();

        assertTrue(MockLlmAdapter.RESPONSES.contains(response.getContent()));
        assertEquals("mock", response.getModel());
    }
}
