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
import java.util.regex.Pattern;

/**
 * Presence check for "you there?" style probes (order=30).
 */
@Component
@RequiredArgsConstructor
public class CasualProbeStage implements GateStage {

    static final List<String> RESPONSES = List.of("Yeah.", "I’m here.", "Here.", "I’m here with you.");

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("^(you there|are you there|u there)\\??$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^what('?re| are) you (doing|up to)\\??$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(whatcha|watcha) (doing|doin)\\??$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(still there|anyone there|hello\\?+)\\??$", Pattern.CASE_INSENSITIVE));

    private final ReplyPicker replyPicker;

    @Override
    public String getName() {
        return "CasualProbeStage";
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public Optional<GateOutcome> tryMatch(Turn turn) {
        if (!isPresenceCheck(turn.lastUserMessage())) {
            return Optional.empty();
        }
        return Optional.of(GateOutcome.shortCircuit(GateStageKind.CASUAL_PROBE, "presence_check",
                replyPicker.pick(RESPONSES)));
    }

    /**
     * Whether the message asks if Nova is there, e.g. "you there?" or "hello?".
     */
    static boolean isPresenceCheck(String message) {
        String trimmed = message.trim();
        return PATTERNS.stream().anyMatch(pattern -> pattern.matcher(trimmed).matches());
    }
}
