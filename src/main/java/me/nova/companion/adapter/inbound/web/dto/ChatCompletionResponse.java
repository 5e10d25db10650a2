package me.nova.companion.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-shaped envelope around the gate outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionResponse {

    private boolean mock;
    private VoiceEngineInfo voiceEngine;
    private List<Choice> choices;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VoiceEngineInfo {
        private boolean shortCircuited;
        private boolean rewritten;
        private String mode;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Choice {
        private ChatCompletionRequest.MessageDto message;
    }
}
