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

import lombok.RequiredArgsConstructor;
import me.nova.companion.domain.model.GateOutcome;
import me.nova.companion.domain.model.GateStageKind;
import me.nova.companion.domain.model.Turn;
import me.nova.companion.domain.model.VoiceMode;
import me.nova.companion.domain.service.ReplyPicker;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mode-specific reply to a plain greeting (order=40). Only modes whose style
 * allows questions on greeting have replies that ask something back.
 */
@Component
@RequiredArgsConstructor
public class GreetingStage implements GateStage {

    static final Map<VoiceMode, List<String>> RESPONSES = new EnumMap<>(Map.of(
            VoiceMode.QUIET, List.of("Hey.", "Hi.", "Mm.", "Yeah.", "I'm here.", "Here.", "Hey, I'm here."),
            VoiceMode.ENGAGED, List.of("Hey.", "Hi.", "I'm here.", "Yeah, I'm here.",
                    "Hey. How's today been?"),
            VoiceMode.MYTHIC, List.of("I’m here.", "I’m with you.", "Here.", "Still here."),
            VoiceMode.BLUNT, List.of("Yeah.", "Here.", "I'm here.")));

    private final ReplyPicker replyPicker;

    @Override
    public String getName() {
        return "GreetingStage";
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public Optional<GateOutcome> tryMatch(Turn turn) {
        if (!Utterances.isGreeting(turn.lastUserMessage())) {
            return Optional.empty();
        }
        return Optional.of(GateOutcome.shortCircuit(GateStageKind.GREETING, "greeting",
                replyPicker.pick(repliesFor(turn.getVoiceMode()))));
    }

    static List<String> repliesFor(VoiceMode mode) {
        List<String> replies = RESPONSES.get(mode);
        if (mode.getStyle().allowQuestionsOnGreeting()) {
            return replies;
        }
        return replies.stream().filter(reply -> !reply.contains("?")).toList();
    }
}
