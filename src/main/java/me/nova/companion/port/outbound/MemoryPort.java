package me.nova.companion.port.outbound;

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

import me.nova.companion.domain.model.MemoryItem;

import java.util.List;

/**
 * Read access to a user's stored memories.
 */
public interface MemoryPort {

    /**
     * Lists the memories stored for a user, oldest first.
     *
     * @throws RuntimeException
     *             if the store is unavailable; callers that must not fail treat
     *             this as "no memories"
     */
    List<MemoryItem> listMemories(String userId);
}
