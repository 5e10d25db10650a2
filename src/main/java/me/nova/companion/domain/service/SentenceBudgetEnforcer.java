package me.nova.companion.domain.service;

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

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic sentence cap for model output.
 *
 * <p>
 * A sentence unit ends with a run of terminal punctuation ({@code .}, {@code !},
 * {@code ?}); the run stays attached to the clause before it. Text with no
 * terminator at all is never truncated.
 */
@Component
public class SentenceBudgetEnforcer {

    private static final Pattern TERMINATOR_RUN = Pattern.compile("[.!?]+");

    /**
     * Counts terminal punctuation runs in the text.
     */
    public int countSentences(String text) {
        if (text == null) {
            return 0;
        }
        Matcher matcher = TERMINATOR_RUN.matcher(text.trim());
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Keeps the first {@code maxSentences} sentence units.
     *
     * @throws IllegalArgumentException
     *             if {@code maxSentences} is less than 1
     */
    public String truncate(String text, int maxSentences) {
        if (maxSentences < 1) {
            throw new IllegalArgumentException("maxSentences must be positive");
        }
        if (text == null) {
            return null;
        }

        Matcher matcher = TERMINATOR_RUN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
            if (count == maxSentences) {
                return text.substring(0, matcher.end()).trim();
            }
        }

        if (count == 0) {
            return text;
        }
        return text.trim();
    }
}
