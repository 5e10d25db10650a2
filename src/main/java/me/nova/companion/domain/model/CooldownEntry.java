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

import java.time.Duration;
import java.time.Instant;

/**
 * Timed gate state for one {@link CooldownKey}. Reflection entries carry the
 * signature of the message that triggered them; continuity entries carry the
 * id of the memory that was referenced.
 */
@Value
@Builder
public class CooldownEntry {

    Instant lastAt;
    String lastMessageSignature;
    String lastMemoryId;

    public static CooldownEntry reflection(Instant at, String signature) {
        return CooldownEntry.builder().lastAt(at).lastMessageSignature(signature).build();
    }

    public static CooldownEntry continuity(Instant at, String memoryId) {
        return CooldownEntry.builder().lastAt(at).lastMemoryId(memoryId).build();
    }

    /**
     * True when at least {@code cooldown} has passed since {@link #lastAt}.
     */
    public boolean hasElapsed(Duration cooldown, Instant now) {
        return lastAt == null || !now.isBefore(lastAt.plus(cooldown));
    }
}
