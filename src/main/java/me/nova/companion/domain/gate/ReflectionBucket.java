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
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One emotional theme Nova can reflect back without calling the model.
 *
 * @param key
 *            stable identifier recorded as the decision reason
 * @param pattern
 *            case-insensitive matcher applied to a user message
 * @param firstLines
 *            lines used the first time the theme comes up
 * @param repeatLines
 *            lines used once the theme keeps coming back
 */
public record ReflectionBucket(String key, Pattern pattern, List<String> firstLines, List<String> repeatLines) {

    public ReflectionBucket {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(pattern, "pattern");
        if (firstLines == null || firstLines.isEmpty() || repeatLines == null || repeatLines.isEmpty()) {
            throw new IllegalArgumentException("Bucket " + key + " needs first and repeat lines");
        }
        firstLines = List.copyOf(firstLines);
        repeatLines = List.copyOf(repeatLines);
    }

    static ReflectionBucket of(String key, String regex, List<String> firstLines, List<String> repeatLines) {
        return new ReflectionBucket(key, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), firstLines, repeatLines);
    }

    public boolean matches(String message) {
        return message != null && pattern.matcher(message).find();
    }
}
