package me.nova.companion.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.nova.companion.adapter.inbound.web.dto.ChatCompletionRequest;
import me.nova.companion.adapter.inbound.web.dto.ChatCompletionResponse;
import me.nova.companion.adapter.outbound.llm.LlmAdapterFactory;
import me.nova.companion.domain.gate.GatePipeline;
import me.nova.companion.domain.model.ChatMessage;
import me.nova.companion.domain.model.GateOutcome;
import me.nova.companion.domain.model.Turn;
import me.nova.companion.domain.model.VoiceSettings;
import me.nova.companion.domain.service.KeyValidator;
import me.nova.companion.domain.service.VoiceSettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Chat completion endpoint. Every turn goes through the {@link GatePipeline};
 * the model is called at most once per request.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String USER_HEADER = "X-Nova-User";
    static final String ROUTE = "/api/chat/completions";

    private static final Set<String> ROLES = Set.of(ChatMessage.ROLE_USER, ChatMessage.ROLE_ASSISTANT,
            ChatMessage.ROLE_SYSTEM);

    private final GatePipeline gatePipeline;
    private final VoiceSettingsService voiceSettingsService;
    private final LlmAdapterFactory llmAdapterFactory;

    @PostMapping("/completions")
    public Mono<ResponseEntity<ChatCompletionResponse>> complete(
            @RequestHeader(name = USER_HEADER, required = false) String userHeader,
            @RequestBody ChatCompletionRequest request) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        String conversationId = normalizeConversationId(request.getConversationId());
        List<ChatMessage> messages = validateMessages(request.getMessages());

        return Mono.fromCallable(() -> {
            VoiceSettings settings = voiceSettingsService.getSettings(userKey);
            Turn turn = Turn.builder()
                    .userId(userKey)
                    .conversationId(conversationId)
                    .route(ROUTE)
                    .messages(withoutSystemMessages(messages))
                    .systemPrompt(resolveSystemPrompt(request, messages, settings))
                    .voiceMode(settings.getVoiceMode())
                    .allowMemoryReferences(settings.isAllowMemoryReferences())
                    .build();
            GateOutcome outcome = gatePipeline.evaluate(turn);
            return ResponseEntity.ok(toResponse(outcome, turn));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private String normalizeConversationId(String conversationId) {
        try {
            return KeyValidator.normalizeConversationIdOrThrow(conversationId);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid request: " + e.getMessage());
        }
    }

    private List<ChatMessage> validateMessages(List<ChatCompletionRequest.MessageDto> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Invalid request: messages must be a non-empty array");
        }
        List<ChatMessage> result = new ArrayList<>(messages.size());
        boolean hasUserMessage = false;
        for (int i = 0; i < messages.size(); i++) {
            ChatCompletionRequest.MessageDto message = messages.get(i);
            if (message == null || message.getRole() == null || !ROLES.contains(message.getRole())) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Invalid request: messages[" + i + "].role must be user, assistant or system");
            }
            if (message.getContent() == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Invalid request: messages[" + i + "].content must be a string");
            }
            hasUserMessage |= ChatMessage.ROLE_USER.equals(message.getRole());
            result.add(new ChatMessage(message.getRole(), message.getContent()));
        }
        if (!hasUserMessage) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Invalid request: at least one user message is required");
        }
        return result;
    }

    private String resolveSystemPrompt(ChatCompletionRequest request, List<ChatMessage> messages,
            VoiceSettings settings) {
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            return request.getSystemPrompt();
        }
        return messages.stream()
                .filter(message -> ChatMessage.ROLE_SYSTEM.equals(message.getRole()))
                .map(ChatMessage::getContent)
                .filter(content -> !content.isBlank())
                .findFirst()
                .orElseGet(() -> voiceSettingsService.resolveSystemPrompt(settings));
    }

    private static List<ChatMessage> withoutSystemMessages(List<ChatMessage> messages) {
        return messages.stream()
                .filter(message -> !ChatMessage.ROLE_SYSTEM.equals(message.getRole()))
                .toList();
    }

    private ChatCompletionResponse toResponse(GateOutcome outcome, Turn turn) {
        ChatCompletionRequest.MessageDto reply = ChatCompletionRequest.MessageDto.builder()
                .role(ChatMessage.ROLE_ASSISTANT)
                .content(outcome.getResponse())
                .build();
        return ChatCompletionResponse.builder()
                .mock(llmAdapterFactory.isMock())
                .voiceEngine(ChatCompletionResponse.VoiceEngineInfo.builder()
                        .shortCircuited(outcome.isShortCircuited())
                        .rewritten(outcome.isRewritten())
                        .mode(turn.getVoiceMode().getId())
                        .build())
                .choices(List.of(ChatCompletionResponse.Choice.builder().message(reply).build()))
                .build();
    }
}
