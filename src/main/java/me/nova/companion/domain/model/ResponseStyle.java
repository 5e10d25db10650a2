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

/**
 * Brevity and warmth settings for one voice mode.
 *
 * @param maxSentences
 *            sentence cap applied to model output when the user has not
 *            provided context
 * @param allowQuestionsOnGreeting
 *            whether greeting replies may ask something back
 * @param warmthBias
 *            warmth level in the range 0-100
 */
public record ResponseStyle(int maxSentences, boolean allowQuestionsOnGreeting, int warmthBias) {

    public ResponseStyle {
        if (maxSentences < 1) {
            throw new IllegalArgumentException("maxSentences must be positive");
        }
        if (warmthBias < 0 || warmthBias > 100) {
            throw new IllegalArgumentException("warmthBias must be within 0..100");
        }
    }

    public String warmthDescriptor() {
        if (warmthBias < 30) {
            return "cool and minimal";
        }
        if (warmthBias < 60) {
            return "subtly warm";
        }
        return "warm and engaged";
    }
}
