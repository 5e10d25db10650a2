package me.nova.companion.adapter.outbound.llm;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.nova.companion.domain.model.ChatMessage;
import me.nova.companion.domain.model.LlmRequest;
import me.nova.companion.domain.model.LlmResponse;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for OpenAI-compatible chat completion APIs using Feign + OkHttp.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code nova.llm.api-url} - Base URL of the API
 * <li>{@code nova.llm.api-key} - API key for authentication
 * <li>{@code nova.llm.model} - Model name sent with each request
 * </ul>
 *
 * <p>
 * Provider ID: {@code "openai"}. One {@link #chat} call issues exactly one HTTP
 * request; neither Feign nor OkHttp retries it.
 *
 * @see FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "openai";

    private final NovaProperties properties;
    private final FeignClientFactory feignClientFactory;

    private volatile ChatCompletionsApi client;

    private synchronized ChatCompletionsApi client() {
        if (client == null) {
            String apiUrl = properties.getLlm().getApiUrl();
            client = feignClientFactory.create(ChatCompletionsApi.class, apiUrl);
            log.info("OpenAI-compatible adapter initialized with URL: {}", apiUrl);
        }
        return client;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new IllegalStateException("OpenAI-compatible adapter is not configured");
            }
            try {
                ChatCompletionResponse apiResponse = client().chatCompletion(properties.getLlm().getApiKey(),
                        buildRequest(request));
                return convertResponse(apiResponse);
            } catch (RuntimeException e) {
                log.error("[LLM] Chat completion failed: {}", e.getMessage());
                throw new LlmCallException("Chat completion failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        NovaProperties.LlmProperties llm = properties.getLlm();
        return llm.getApiUrl() != null && !llm.getApiUrl().isBlank()
                && llm.getApiKey() != null && !llm.getApiKey().isBlank();
    }

    private ChatCompletionRequest buildRequest(LlmRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : getCurrentModel());
        apiRequest.setTemperature(request.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens());

        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(ApiMessage.of(ChatMessage.ROLE_SYSTEM, request.getSystemPrompt()));
        }
        for (ChatMessage message : request.getMessages()) {
            messages.add(ApiMessage.of(message.getRole(), message.getContent()));
        }
        apiRequest.setMessages(messages);
        return apiRequest;
    }

    private LlmResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            return LlmResponse.builder()
                    .content("")
                    .finishReason("error")
                    .build();
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        return LlmResponse.builder()
                .content(choice.getMessage() != null ? choice.getMessage().getContent() : "")
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    /**
     * Unchecked failure of a model call, surfaced through the returned future.
     */
    public static class LlmCallException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public LlmCallException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    // Feign API interface
    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    public static class ApiMessage {
        private String role;
        private String content;

        static ApiMessage of(String role, String content) {
            ApiMessage message = new ApiMessage();
            message.setRole(role);
            message.setContent(content);
            return message;
        }
    }
}
