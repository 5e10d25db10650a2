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

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects and removes counselor-speak from model output without calling the
 * model again.
 *
 * <p>
 * Detection is a case-insensitive substring scan over a fixed phrase list.
 * "As an AI" style disclaimers are only banned when the user did not ask about
 * Nova's nature in the same turn.
 *
 * <p>
 * {@link #sanitize(String, String)} is deterministic and idempotent: text that
 * does not contain the phrase is returned untouched.
 */
@Component
public class BannedPhraseSanitizer {

    public static final String EMPTY_FALLBACK = "I'm here.";

    static final List<String> BANNED_PHRASES = List.of(
            "tell me how that makes you feel",
            "that's a thoughtful observation",
            "i'm here to help",
            "how does that make you feel",
            "what a great question",
            "that's a great point",
            "i understand how you feel",
            "it sounds like you're feeling",
            "i hear what you're saying",
            "thank you for sharing",
            "i'm glad you shared that",
            "that's understandable",
            "that must be difficult",
            "i can imagine",
            "let's explore that",
            "let's unpack that",
            "it sounds like",
            "i'm sorry you're going through",
            "you are valid");

    static final List<String> CONDITIONAL_BANNED_PHRASES = List.of(
            "as an ai",
            "as an artificial intelligence");

    private static final List<String> NATURE_QUESTIONS = List.of(
            "are you ai",
            "are you an ai",
            "what are you",
            "who are you",
            "are you real",
            "how do you work",
            "can you feel",
            "do you have feelings");

    private static final Pattern MULTI_WHITESPACE = Pattern.compile("\\s{2,}");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([,.;:!?])");
    private static final Pattern PUNCTUATION_BEFORE_LETTER = Pattern.compile("([,.;:!?])([A-Za-z])");
    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[,.;:!?]+\\s*");
    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"'“”‘’]+|[\"'“”‘’]+$");
    private static final int MAX_CLEANUP_PASSES = 32;

    /**
     * Whether the user is asking what Nova is or what it can do.
     */
    public boolean isAskingAboutNature(String userMessage) {
        if (userMessage == null) {
            return false;
        }
        String normalized = userMessage.trim().toLowerCase(Locale.ROOT);
        return NATURE_QUESTIONS.stream().anyMatch(normalized::contains);
    }

    /**
     * Returns the first banned phrase found in the response, if any.
     */
    public Optional<String> findBannedPhrase(String response, boolean userAskedAboutNature) {
        if (response == null || response.isEmpty()) {
            return Optional.empty();
        }
        String lower = response.toLowerCase(Locale.ROOT);
        for (String phrase : BANNED_PHRASES) {
            if (lower.contains(phrase)) {
                return Optional.of(phrase);
            }
        }
        if (!userAskedAboutNature) {
            for (String phrase : CONDITIONAL_BANNED_PHRASES) {
                if (lower.contains(phrase)) {
                    return Optional.of(phrase);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Removes the phrase (case-insensitive) and repairs the spacing and
     * punctuation the removal leaves behind. Falls back to
     * {@value #EMPTY_FALLBACK} when nothing meaningful remains.
     */
    public String sanitize(String text, String phrase) {
        if (text == null || phrase == null || phrase.isEmpty()) {
            return text;
        }
        Pattern phrasePattern = Pattern.compile(Pattern.quote(phrase), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        if (!phrasePattern.matcher(text).find()) {
            return text;
        }

        // whitespace repair can join a new occurrence together, so removal and
        // clean-up run as one loop until neither changes the text
        String sanitized = text;
        for (int pass = 0; pass < MAX_CLEANUP_PASSES; pass++) {
            String cleaned = cleanup(phrasePattern.matcher(sanitized).replaceAll(""));
            if (cleaned.equals(sanitized)) {
                break;
            }
            sanitized = cleaned;
        }

        if (sanitized.isBlank()) {
            return EMPTY_FALLBACK;
        }
        return sanitized;
    }

    private String cleanup(String text) {
        String result = MULTI_WHITESPACE.matcher(text).replaceAll(" ");
        result = SPACE_BEFORE_PUNCTUATION.matcher(result).replaceAll("$1");
        result = PUNCTUATION_BEFORE_LETTER.matcher(result).replaceAll("$1 $2");
        result = result.trim();
        result = LEADING_PUNCTUATION.matcher(result).replaceAll("");
        result = SURROUNDING_QUOTES.matcher(result).replaceAll("");
        return result.trim();
    }
}
