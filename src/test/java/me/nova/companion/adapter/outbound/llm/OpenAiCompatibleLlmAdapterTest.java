package me.nova.companion.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.nova.companion.domain.model.ChatMessage;
import me.nova.companion.domain.model.LlmRequest;
import me.nova.companion.domain.model.LlmResponse;
import me.nova.companion.infrastructure.config.AutoConfiguration;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.infrastructure.http.FeignClientFactory;
import me.nova.companion.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleLlmAdapterTest {

    private static final String COMPLETION = """
            {"id":"cmpl-1","model":"gpt-test","choices":[
              {"index":0,"message":{"role":"assistant","content":"Sounds heavy."},"finish_reason":"stop"}]}
            """;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    private NovaProperties properties;
    private OkHttpMockEngine engine;
    private OpenAiCompatibleLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new NovaProperties();
        properties.getLlm().setApiUrl("https://llm.test/v1");
        properties.getLlm().setApiKey("sk-test");
        properties.getLlm().setModel("gpt-test");

        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(engine)
                .retryOnConnectionFailure(false)
                .build();
        adapter = new OpenAiCompatibleLlmAdapter(properties, new FeignClientFactory(client, objectMapper));
    }

    private static LlmRequest request() {
        return LlmRequest.builder()
                .model("gpt-test")
                .systemPrompt("You are Nova.")
                .messages(List.of(ChatMessage.user("long day"), ChatMessage.assistant("Mm."),
                        ChatMessage.user("yeah, really long")))
                .temperature(0.5)
                .build();
    }

    // ===== isAvailable =====

    @Test
    void shouldBeAvailableWithUrlAndKey() {
        assertTrue(adapter.isAvailable());
        assertEquals("openai", adapter.getProviderId());
        assertEquals("gpt-test", adapter.getCurrentModel());
    }

    @Test
    void shouldNotBeAvailableWithoutKey() {
        properties.getLlm().setApiKey(" ");

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailWithoutRequestWhenNotConfigured() {
        properties.getLlm().setApiKey(null);

        CompletableFuture<LlmResponse> future = adapter.chat(request());

        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
        assertEquals(0, engine.getRequestCount());
    }

    // ===== chat =====

    @Test
    void shouldPostChatCompletionWithSystemPromptFirst() throws Exception {
        engine.enqueueJson(200, COMPLETION);

        LlmResponse response = adapter.chat(request()).get(5, TimeUnit.SECONDS);

        assertEquals("Sounds heavy.", response.getContent());
        assertEquals("stop", response.getFinishReason());
        assertEquals("gpt-test", response.getModel());

        OkHttpMockEngine.CapturedRequest sent = engine.takeRequest();
        assertNotNull(sent);
        assertEquals("POST", sent.method());
        assertEquals("/v1/chat/completions", sent.path());
        assertEquals("Bearer sk-test", sent.headers().get("Authorization"));

        JsonNode body = objectMapper.readTree(sent.body());
        assertEquals("gpt-test", body.get("model").asText());
        assertEquals(0.5, body.get("temperature").asDouble(), 1e-9);
        JsonNode messages = body.get("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("You are Nova.", messages.get(0).get("content").asText());
        assertEquals("user", messages.get(3).get("role").asText());
        assertEquals("yeah, really long", messages.get(3).get("content").asText());
    }

    @Test
    void shouldReturnEmptyContentWhenNoChoices() throws Exception {
        engine.enqueueJson(200, "{\"id\":\"cmpl-2\",\"choices\":[]}");

        LlmResponse response = adapter.chat(request()).get(5, TimeUnit.SECONDS);

        assertEquals("", response.getContent());
        assertEquals("error", response.getFinishReason());
    }

    @Test
    void shouldFailOnServerErrorWithoutRetry() {
        engine.enqueueJson(500, "{\"error\":\"overloaded\"}");
        engine.enqueueJson(200, COMPLETION);

        CompletableFuture<LlmResponse> future = adapter.chat(request());

        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(OpenAiCompatibleLlmAdapter.LlmCallException.class, thrown.getCause());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldFailOnConnectionErrorWithoutRetry() {
        engine.enqueueFailure(new IOException("connection reset"));
        engine.enqueueJson(200, COMPLETION);

        CompletableFuture<LlmResponse> future = adapter.chat(request());

        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(1, engine.getRequestCount());
    }
}
