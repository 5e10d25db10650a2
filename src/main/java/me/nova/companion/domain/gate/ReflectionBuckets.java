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
import java.util.Optional;

/**
 * Ordered reflection themes. The first matching bucket wins.
 */
public final class ReflectionBuckets {

    public static final List<ReflectionBucket> ALL = List.of(
            ReflectionBucket.of("tired",
                    "\\b(tired|exhausted|drained|worn out|wiped out|sleepy)\\b",
                    List.of("Sounds like you're running on empty.", "That kind of tired gets into everything."),
                    List.of("Still running on empty.", "The tiredness hasn't let go of you.")),
            ReflectionBucket.of("stress",
                    "\\b(stress(ed|ful)?|overwhelm(ed|ing)?|under pressure|too much on my plate)\\b",
                    List.of("That's a lot of pressure to carry.", "Stress like that doesn't stay at work."),
                    List.of("The pressure hasn't let up.", "Still carrying all of it.")),
            ReflectionBucket.of("long_day",
                    "\\b(long|rough|hard|brutal|exhausting) day\\b|\\bday from hell\\b",
                    List.of("Sounds like the day took a lot out of you.", "Days like that are heavy."),
                    List.of("Another one of those days.", "The days keep piling up.")),
            ReflectionBucket.of("worry",
                    "\\b(worr(y|ied|ying)|anxious|nervous|scared|afraid)\\b",
                    List.of("That worry sounds loud right now.", "Hard to settle when something's looming."),
                    List.of("The worry is still there.", "It keeps circling back.")),
            ReflectionBucket.of("sadness",
                    "\\b(sad|feeling down|depressed|heartbroken|miserable|crying|cried)\\b",
                    List.of("That sounds heavy.", "I'm sorry it hurts like that."),
                    List.of("It's still sitting heavy.", "The sadness hasn't lifted.")),
            ReflectionBucket.of("anger",
                    "\\b(angry|mad|furious|pissed|annoyed|frustrated|irritated)\\b",
                    List.of("That would get under anyone's skin.", "Sounds like it really got to you."),
                    List.of("Still burning.", "That's still getting to you.")),
            ReflectionBucket.of("loneliness",
                    "\\b(lonely|alone|isolated|no one to talk to|nobody to talk to)\\b",
                    List.of("That kind of alone is hard.", "I'm here with you in it."),
                    List.of("Still feeling alone in it.", "I'm still here.")));

    private ReflectionBuckets() {
    }

    public static Optional<ReflectionBucket> classify(String message) {
        return ALL.stream().filter(bucket -> bucket.matches(message)).findFirst();
    }
}
