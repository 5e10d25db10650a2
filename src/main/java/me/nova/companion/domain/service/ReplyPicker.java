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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Picks canned replies. Backed by the injected {@link Random} so tests can pin
 * the choice with a seeded or stubbed source.
 */
@Component
@RequiredArgsConstructor
public class ReplyPicker {

    private final Random random;

    public String pick(List<String> replies) {
        if (replies == null || replies.isEmpty()) {
            throw new IllegalArgumentException("No replies to pick from");
        }
        return replies.get(random.nextInt(replies.size()));
    }
}
