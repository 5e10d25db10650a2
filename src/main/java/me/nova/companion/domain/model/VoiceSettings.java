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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-user voice preferences read by the chat route. Persisted to storage and
 * loaded lazily on first use.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoiceSettings {

    @Builder.Default
    private VoiceMode voiceMode = VoiceMode.QUIET;

    /** Memory references are opt-in; off until the user enables them. */
    @Builder.Default
    private boolean allowMemoryReferences = false;

    /** Base system prompt override (null = configured default) */
    private String systemPrompt;
}
