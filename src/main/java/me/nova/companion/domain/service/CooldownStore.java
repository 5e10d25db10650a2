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

import me.nova.companion.domain.model.CooldownEntry;
import me.nova.companion.domain.model.CooldownKey;
import me.nova.companion.domain.model.StageKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory cooldown state keyed by (user, conversation, stage kind).
 *
 * <p>
 * Each (user, conversation) pair owns its own {@link ReentrantLock}, so
 * unrelated conversations never contend. Gate stages that must check and then
 * update a cooldown do both inside {@link #withConversation}, which makes the
 * decision linearizable per conversation: two concurrent turns can never both
 * pass the same cooldown.
 *
 * <p>
 * Entries are created lazily and never evicted; state resets on restart.
 */
@Component
public class CooldownStore {

    private final Map<ConversationKey, ConversationCooldowns> conversations = new ConcurrentHashMap<>();

    public Optional<CooldownEntry> get(CooldownKey key) {
        return withConversation(key.userId(), key.conversationId(),
                cooldowns -> Optional.ofNullable(cooldowns.get(key.stageKind())));
    }

    public void put(CooldownKey key, CooldownEntry entry) {
        withConversation(key.userId(), key.conversationId(), cooldowns -> {
            cooldowns.put(key.stageKind(), entry);
            return null;
        });
    }

    /**
     * Runs {@code action} while holding the conversation's lock.
     */
    public <T> T withConversation(String userId, String conversationId, Function<ConversationCooldowns, T> action) {
        ConversationCooldowns cooldowns = conversations.computeIfAbsent(
                new ConversationKey(userId, conversationId), key -> new ConversationCooldowns());
        cooldowns.lock.lock();
        try {
            return action.apply(cooldowns);
        } finally {
            cooldowns.lock.unlock();
        }
    }

    /**
     * Number of conversations with cooldown state.
     */
    public int conversationCount() {
        return conversations.size();
    }

    private record ConversationKey(String userId, String conversationId) {
    }

    /**
     * Cooldown entries of one conversation. Only usable while the owning lock is
     * held, i.e. inside {@link CooldownStore#withConversation}.
     */
    public static final class ConversationCooldowns {

        private final ReentrantLock lock = new ReentrantLock();
        private final Map<StageKind, CooldownEntry> entries = new EnumMap<>(StageKind.class);

        public CooldownEntry get(StageKind kind) {
            requireLock();
            return entries.get(kind);
        }

        public void put(StageKind kind, CooldownEntry entry) {
            requireLock();
            entries.put(kind, entry);
        }

        private void requireLock() {
            if (!lock.isHeldByCurrentThread()) {
                throw new IllegalStateException("Cooldown state accessed outside its conversation lock");
            }
        }
    }
}
