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
import lombok.Value;

/**
 * Result of evaluating one turn. {@code stage} and {@code reason} feed the
 * decision record and are not part of the HTTP payload.
 */
@Value
@Builder(toBuilder = true)
public class GateOutcome {

    String response;
    boolean shortCircuited;
    boolean rewritten;
    GateStageKind stage;
    String reason;
    int memoryReadCount;

    public static GateOutcome shortCircuit(GateStageKind stage, String reason, String response) {
        return GateOutcome.builder()
                .response(response)
                .shortCircuited(true)
                .rewritten(false)
                .stage(stage)
                .reason(reason)
                .build();
    }
}
