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

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the gate stages.
 */
public final class Utterances {

    static final Pattern GREETING = Pattern.compile("^(hi|hey|hello|yo|sup|heya|hiya|howdy)[\\s!.,]*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int SIGNATURE_LENGTH = 140;
    private static final int RECENT_CONTEXT_WINDOW = 5;
    private static final int SUBSTANTIAL_LENGTH = 50;
    private static final int MEANINGFUL_LENGTH = 20;

    private Utterances() {
    }

    public static boolean isGreeting(String message) {
        return message != null && GREETING.matcher(message.trim()).matches();
    }

    public static int wordCount(String message) {
        if (message == null || message.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(message.trim()).length;
    }

    /**
     * Trimmed, lower-cased, whitespace-collapsed form used for comparisons.
     */
    public static String normalize(String message) {
        if (message == null) {
            return "";
        }
        return WHITESPACE.matcher(message.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * First 140 characters of the normalized message.
     */
    public static String signature(String message) {
        String normalized = normalize(message);
        return normalized.length() > SIGNATURE_LENGTH ? normalized.substring(0, SIGNATURE_LENGTH) : normalized;
    }

    /**
     * Whether the user has given enough to warrant a longer answer: a recent
     * message over 50 characters or containing a question mark, or at least two
     * non-greeting messages over 20 characters.
     */
    public static boolean hasUserProvidedContext(List<String> userMessages) {
        if (userMessages == null || userMessages.isEmpty()) {
            return false;
        }

        List<String> recent = userMessages.subList(Math.max(0, userMessages.size() - RECENT_CONTEXT_WINDOW),
                userMessages.size());
        for (String message : recent) {
            String content = message.trim();
            if (content.length() > SUBSTANTIAL_LENGTH || content.contains("?")) {
                return true;
            }
        }

        long meaningful = userMessages.stream()
                .filter(message -> message.trim().length() > MEANINGFUL_LENGTH && !isGreeting(message))
                .count();
        return meaningful >= 2;
    }
}
