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

import lombok.extern.slf4j.Slf4j;
import me.nova.companion.domain.model.CooldownEntry;
import me.nova.companion.domain.model.MemoryItem;
import me.nova.companion.domain.model.StageKind;
import me.nova.companion.domain.model.Turn;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.port.outbound.MemoryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Picks at most one stored memory to reference when Nova reflects on a
 * message.
 *
 * <p>
 * Only runs when the user opted in to memory references, the continuity
 * cooldown for the conversation has elapsed, and the message mentions one of
 * the focus terms. Memories are scored by how many of the message's focus terms
 * they contain; the memory referenced last time in this conversation is
 * skipped. Any failure yields {@link ContinuityResult#none(int)} and never
 * propagates.
 *
 * <p>
 * Must be called while holding the conversation lock of
 * {@link CooldownStore}.
 */
@Component
@Slf4j
public class MemoryContinuityScorer {

    static final List<String> FOCUS_TERMS = List.of(
            "stress",
            "tired",
            "exhaust",
            "worr",
            "anxi",
            "overwhelm",
            "sad",
            "angry",
            "upset",
            "lonely",
            "alone",
            "scared",
            "afraid");

    static final int MAX_SNIPPET_LENGTH = 80;

    private final MemoryPort memoryPort;
    private final Clock clock;
    private final Duration cooldown;

    public MemoryContinuityScorer(MemoryPort memoryPort, NovaProperties properties, Clock clock) {
        this.memoryPort = memoryPort;
        this.clock = clock;
        this.cooldown = properties.getVoice().getContinuityCooldown();
    }

    public ContinuityResult findContinuity(Turn turn, CooldownStore.ConversationCooldowns cooldowns) {
        if (!turn.isAllowMemoryReferences()) {
            return ContinuityResult.none(0);
        }

        Instant now = clock.instant();
        CooldownEntry previous = cooldowns.get(StageKind.CONTINUITY);
        if (previous != null && !previous.hasElapsed(cooldown, now)) {
            return ContinuityResult.none(0);
        }

        String message = turn.lastUserMessage().toLowerCase(Locale.ROOT);
        List<String> mentioned = FOCUS_TERMS.stream().filter(message::contains).toList();
        if (mentioned.isEmpty()) {
            return ContinuityResult.none(0);
        }

        List<MemoryItem> memories;
        try {
            memories = memoryPort.listMemories(turn.getUserId());
        } catch (RuntimeException e) {
            log.debug("[Continuity] Memory read failed, skipping: {}", e.getMessage());
            return ContinuityResult.none(1);
        }
        if (memories == null || memories.isEmpty()) {
            return ContinuityResult.none(1);
        }

        String excludedId = previous != null ? previous.getLastMemoryId() : null;
        MemoryItem best = null;
        int bestScore = 0;
        for (MemoryItem memory : memories) {
            if (memory == null || memory.getContent() == null || memory.getContent().isBlank()) {
                continue;
            }
            if (excludedId != null && excludedId.equals(memory.getId())) {
                continue;
            }
            int score = score(memory.getContent(), mentioned);
            if (score > bestScore) {
                best = memory;
                bestScore = score;
            }
        }
        if (best == null) {
            return ContinuityResult.none(1);
        }

        cooldowns.put(StageKind.CONTINUITY, CooldownEntry.continuity(now, best.getId()));
        log.debug("[Continuity] Referencing memory {} (score {})", best.getId(), bestScore);
        return new ContinuityResult(clauseFor(best.getContent()), best.getId(), 1);
    }

    static String snippet(String content) {
        String collapsed = content.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (collapsed.length() > MAX_SNIPPET_LENGTH) {
            collapsed = collapsed.substring(0, MAX_SNIPPET_LENGTH - 1).trim() + "…";
        }
        while (!collapsed.isEmpty() && ".!?,;:".indexOf(collapsed.charAt(collapsed.length() - 1)) >= 0) {
            collapsed = collapsed.substring(0, collapsed.length() - 1);
        }
        return collapsed;
    }

    private static String clauseFor(String content) {
        return "You mentioned \"" + snippet(content) + "\" before.";
    }

    private static int score(String content, List<String> terms) {
        String lower = content.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String term : terms) {
            if (lower.contains(term)) {
                score++;
            }
        }
        return score;
    }

    /**
     * Outcome of a continuity attempt. {@code clause} is null when nothing should
     * be referenced; {@code memoryReadCount} counts reads issued either way.
     */
    public record ContinuityResult(String clause, String memoryId, int memoryReadCount) {

        public static ContinuityResult none(int memoryReadCount) {
            return new ContinuityResult(null, null, memoryReadCount);
        }

        public boolean isPresent() {
            return clause != null;
        }
    }
}
