package me.nova.companion.domain.gate;

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

import me.nova.companion.domain.model.ResponseStyle;
import me.nova.companion.domain.model.VoiceMode;
import org.springframework.stereotype.Component;

/**
 * Appends the voice rules for a mode to the base system prompt sent with the
 * model call.
 */
@Component
public class SystemPromptRenderer {

    public String render(String basePrompt, VoiceMode mode) {
        ResponseStyle style = mode.getStyle();
        StringBuilder prompt = new StringBuilder(basePrompt != null ? basePrompt : "");

        prompt.append("\n\n**Voice Rules:**\n");
        prompt.append("- You are a companion, not a therapist or counselor. Be present, not performative.\n");
        prompt.append("- Default to ").append(style.maxSentences())
                .append(style.maxSentences() > 1 ? " sentences" : " sentence")
                .append(" maximum unless the user provides substantial context.\n");
        prompt.append("- NEVER use phrases like: \"Tell me how that makes you feel\", \"Thank you for sharing\", ")
                .append("or similar counselor-speak.\n");
        prompt.append("- Only say \"As an AI...\" if the user explicitly asks about your nature or capabilities.\n");
        if (style.allowQuestionsOnGreeting()) {
            prompt.append("- You may ask brief questions only when the user provides context.\n");
        } else {
            prompt.append("- Do not ask questions on simple greetings. Just acknowledge presence.\n");
        }
        prompt.append("- Depth gating: only expand or ask follow-up questions when the user provides context ")
                .append("or asks you something directly.\n");
        prompt.append("- Warmth level: ").append(style.warmthBias()).append("% - ")
                .append(style.warmthDescriptor()).append('\n');
        prompt.append("- Mode: ").append(mode.getDisplayName());

        String flavor = flavorLine(mode);
        if (flavor != null) {
            prompt.append('\n').append(flavor);
        }
        return prompt.toString();
    }

    private static String flavorLine(VoiceMode mode) {
        return switch (mode) {
        case MYTHIC -> "- Speak with subtle weight and presence, as if each word matters.";
        case BLUNT -> "- Be direct and minimal. No fluff.";
        default -> null;
        };
    }
}
