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
import me.nova.companion.domain.service.ReplyPicker;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Soft acknowledgement for tiny inputs (order=20): at most two words and six
 * characters, or one of the minimal acknowledgements. Greetings are left to
 * {@link GreetingStage} so they get a mode-specific reply, and presence checks
 * such as "hello?" to {@link CasualProbeStage}.
 */
@Component
@RequiredArgsConstructor
public class UltraShortStage implements GateStage {

    static final List<String> RESPONSES = List.of("Yeah.", "Mm.", "Got it.", "Okay.");

    static final Set<String> ACKNOWLEDGEMENTS = Set.of(
            "ok", "okay", "k", "kk", "yeah", "yea", "yep", "yup", "yes", "no", "nope", "nah",
            "sure", "fine", "cool", "mm", "mhm", "hmm", "right", "true", "thanks", "thank you", "ty",
            "got it", "i see", "lol", "haha");

    private static final int MAX_WORDS = 2;
    private static final int MAX_CHARS = 6;

    private final ReplyPicker replyPicker;

    @Override
    public String getName() {
        return "UltraShortStage";
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public Optional<GateOutcome> tryMatch(Turn turn) {
        String trimmed = turn.lastUserMessage().trim();
        if (trimmed.isEmpty() || Utterances.isGreeting(trimmed) || CasualProbeStage.isPresenceCheck(trimmed)) {
            return Optional.empty();
        }
        boolean tiny = Utterances.wordCount(trimmed) <= MAX_WORDS && trimmed.length() <= MAX_CHARS;
        if (!tiny && !isAcknowledgement(trimmed)) {
            return Optional.empty();
        }
        return Optional.of(GateOutcome.shortCircuit(GateStageKind.ULTRA_SHORT, "tiny_ack",
                replyPicker.pick(RESPONSES)));
    }

    private boolean isAcknowledgement(String trimmed) {
        String bare = Utterances.normalize(trimmed).replaceAll("[\\s!.,?]+$", "");
        return ACKNOWLEDGEMENTS.contains(bare);
    }
}
