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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable audit entry describing which gate stage handled a turn and what it
 * cost. One record is produced per inbound turn.
 *
 * <p>
 * {@code modelCallCount} is always 0 or 1.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "ts", "route", "stage", "reason", "shortCircuited", "rewritten", "modelCallCount",
        "memoryReadCount" })
public class DecisionRecord {

    @JsonProperty("ts")
    Instant timestamp;

    String route;
    GateStageKind stage;
    String reason;
    boolean shortCircuited;
    boolean rewritten;
    int modelCallCount;
    int memoryReadCount;

    // policy-relevant metadata, no content and no secrets
    String conversationId;
    VoiceMode voiceMode;
    Boolean allowMemoryReferences;
    String model;

    @Builder
    public DecisionRecord(Instant timestamp, String route, GateStageKind stage, String reason,
            boolean shortCircuited, boolean rewritten, int modelCallCount, int memoryReadCount,
            String conversationId, VoiceMode voiceMode, Boolean allowMemoryReferences, String model) {
        if (modelCallCount < 0 || modelCallCount > 1) {
            throw new IllegalStateException("A turn may issue at most one model call, got " + modelCallCount);
        }
        this.timestamp = timestamp;
        this.route = route;
        this.stage = stage;
        this.reason = reason;
        this.shortCircuited = shortCircuited;
        this.rewritten = rewritten;
        this.modelCallCount = modelCallCount;
        this.memoryReadCount = memoryReadCount;
        this.conversationId = conversationId;
        this.voiceMode = voiceMode;
        this.allowMemoryReferences = allowMemoryReferences;
        this.model = model;
    }
}
