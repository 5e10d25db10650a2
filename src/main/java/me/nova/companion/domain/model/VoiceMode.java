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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Named response-style configuration selected per user. Each mode carries an
 * immutable {@link ResponseStyle} fixed at startup.
 */
public enum VoiceMode {

    QUIET(new ResponseStyle(2, false, 40)),
    ENGAGED(new ResponseStyle(4, true, 70)),
    MYTHIC(new ResponseStyle(3, false, 50)),
    BLUNT(new ResponseStyle(2, false, 20));

    private final ResponseStyle style;

    VoiceMode(ResponseStyle style) {
        this.style = style;
    }

    public ResponseStyle getStyle() {
        return style;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Display name used in the rendered prompt, e.g. "Quiet".
     */
    public String getDisplayName() {
        String id = getId();
        return Character.toUpperCase(id.charAt(0)) + id.substring(1);
    }

    /**
     * Resolves a mode id case-insensitively.
     *
     * @throws IllegalArgumentException
     *             if the id is not a known mode
     */
    @JsonCreator
    public static VoiceMode fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Voice mode is required");
        }
        for (VoiceMode mode : values()) {
            if (mode.getId().equalsIgnoreCase(id.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown voice mode: " + id);
    }
}
