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
import me.nova.companion.domain.model.Turn;

import java.util.Optional;

/**
 * One short-circuit stage of the gate pipeline. Stages are evaluated in
 * ascending {@link #getOrder()}; the first stage returning an outcome answers
 * the turn and no later stage (nor the model) runs.
 */
public interface GateStage {

    /**
     * Get the stage name.
     */
    String getName();

    /**
     * Get the evaluation order (lower = earlier).
     */
    int getOrder();

    /**
     * Answers the turn locally, or returns empty to let the next stage try.
     */
    Optional<GateOutcome> tryMatch(Turn turn);
}
