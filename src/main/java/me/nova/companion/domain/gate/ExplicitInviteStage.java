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

import me.nova.companion.domain.model.GateOutcome;
import me.nova.companion.domain.model.GateStageKind;
import me.nova.companion.domain.model.Turn;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The user asks for room to talk (order=50); Nova simply says it is listening.
 */
@Component
public class ExplicitInviteStage implements GateStage {

    static final String RESPONSE = "Go ahead. I'm listening.";

    private static final Pattern INVITE = Pattern.compile(
            "^(i (want|need|wanna) (to )?talk( to you)?( about something)?"
                    + "|can (i|we) talk( to you)?( for a (sec|second|minute))?"
                    + "|can i tell you something"
                    + "|i have something to tell you"
                    + "|can i vent( for a (sec|second|minute))?"
                    + "|i need to vent"
                    + "|got a (sec|second|minute)"
                    + "|do you have a (sec|second|minute))[\\s!.?,]*$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String getName() {
        return "ExplicitInviteStage";
    }

    @Override
    public int getOrder() {
        return 50;
    }

    @Override
    public Optional<GateOutcome> tryMatch(Turn turn) {
        if (!INVITE.matcher(Utterances.normalize(turn.lastUserMessage())).matches()) {
            return Optional.empty();
        }
        return Optional.of(GateOutcome.shortCircuit(GateStageKind.EXPLICIT_INVITE, "invites_conversation",
                RESPONSE));
    }
}
