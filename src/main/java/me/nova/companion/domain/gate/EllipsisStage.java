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

/**
 * Answers a bare "..." (or the single ellipsis glyph) with a presence phrase
 * (order=10).
 */
@Component
@RequiredArgsConstructor
public class EllipsisStage implements GateStage {

    static final List<String> RESPONSES = List.of("…", "Mm.", "I’m here.", "Still here.");

    private final ReplyPicker replyPicker;

    @Override
    public String getName() {
        return "EllipsisStage";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public Optional<GateOutcome> tryMatch(Turn turn) {
        String trimmed = turn.lastUserMessage().trim();
        if (!"...".equals(trimmed) && !"…".equals(trimmed)) {
            return Optional.empty();
        }
        return Optional.of(GateOutcome.shortCircuit(GateStageKind.ELLIPSIS, "ellipsis", replyPicker.pick(RESPONSES)));
    }
}
