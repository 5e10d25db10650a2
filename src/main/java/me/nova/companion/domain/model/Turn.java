package me.nova.companion.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One inbound user message together with its conversation history, the
 * caller's voice mode and routing flags.
 */
@Value
@Builder
public class Turn {

    String userId;
    String conversationId;
    String route;

    @Singular
    List<ChatMessage> messages;

    String systemPrompt;

    @Builder.Default
    VoiceMode voiceMode = VoiceMode.QUIET;

    boolean allowMemoryReferences;

    /**
     * Content of the most recent user message, or an empty string.
     */
    public String lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage message = messages.get(i);
            if (message.isUserMessage()) {
                return message.getContent() != null ? message.getContent() : "";
            }
        }
        return "";
    }

    /**
     * User message contents in conversation order.
     */
    public List<String> userMessages() {
        return messages.stream()
                .filter(ChatMessage::isUserMessage)
                .map(message -> message.getContent() != null ? message.getContent() : "")
                .toList();
    }

    public ResponseStyle style() {
        return voiceMode.getStyle();
    }
}
