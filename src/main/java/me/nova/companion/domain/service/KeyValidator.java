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

import java.util.regex.Pattern;

/**
 * User and conversation key validation helpers.
 *
 * <p>
 * Keys become file names and map keys, so both follow
 * {@code ^[a-zA-Z0-9_-]{1,64}$}.
 */
public final class KeyValidator {

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    public static final String DEFAULT_USER_KEY = "local";
    public static final String DEFAULT_CONVERSATION_ID = "default";

    private KeyValidator() {
    }

    public static boolean isValidKey(String value) {
        String normalized = normalize(value);
        return normalized != null && KEY_PATTERN.matcher(normalized).matches();
    }

    /**
     * Normalizes a user key, falling back to {@link #DEFAULT_USER_KEY} when
     * absent.
     *
     * @throws IllegalArgumentException
     *             if a key is supplied but malformed
     */
    public static String normalizeUserKeyOrThrow(String value) {
        return normalizeOrDefault(value, DEFAULT_USER_KEY, "userKey");
    }

    /**
     * Normalizes a conversation id, falling back to
     * {@link #DEFAULT_CONVERSATION_ID} when absent.
     *
     * @throws IllegalArgumentException
     *             if an id is supplied but malformed
     */
    public static String normalizeConversationIdOrThrow(String value) {
        return normalizeOrDefault(value, DEFAULT_CONVERSATION_ID, "conversationId");
    }

    private static String normalizeOrDefault(String value, String fallback, String field) {
        String normalized = normalize(value);
        if (normalized == null) {
            return fallback;
        }
        if (!KEY_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException(field + " must match ^[a-zA-Z0-9_-]{1,64}$");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String candidate = value.trim();
        return candidate.isEmpty() ? null : candidate;
    }
}
