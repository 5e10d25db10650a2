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

import lombok.extern.slf4j.Slf4j;
import me.nova.companion.domain.model.CooldownEntry;
import me.nova.companion.domain.model.GateOutcome;
import me.nova.companion.domain.model.GateStageKind;
import me.nova.companion.domain.model.StageKind;
import me.nova.companion.domain.model.Turn;
import me.nova.companion.domain.service.CooldownStore;
import me.nova.companion.domain.service.MemoryContinuityScorer;
import me.nova.companion.domain.service.MemoryContinuityScorer.ContinuityResult;
import me.nova.companion.domain.service.ReplyPicker;
import me.nova.companion.infrastructure.config.NovaProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reflects an emotional theme back to the user without calling the model
 * (order=60).
 *
 * <p>
 * Fires only for messages of at least three words that match a
 * {@link ReflectionBuckets bucket}, when the conversation's reflection
 * cooldown has elapsed and the message differs from the one that last
 * triggered a reflection. The check and the cooldown update happen under the
 * conversation lock, together with the optional memory continuity prefix.
 */
@Component
@Slf4j
public class ReflectionStage implements GateStage {

    private static final int MIN_WORDS = 3;
    private static final int REPEAT_WINDOW = 6;
    private static final int REPEAT_THRESHOLD = 2;
    private static final String CONTINUITY_SUFFIX = "+continuity";

    private final CooldownStore cooldownStore;
    private final MemoryContinuityScorer continuityScorer;
    private final ReplyPicker replyPicker;
    private final Clock clock;
    private final Duration cooldown;

    public ReflectionStage(CooldownStore cooldownStore, MemoryContinuityScorer continuityScorer,
            ReplyPicker replyPicker, NovaProperties properties, Clock clock) {
        this.cooldownStore = cooldownStore;
        this.continuityScorer = continuityScorer;
        this.replyPicker = replyPicker;
        this.clock = clock;
        this.cooldown = properties.getVoice().getReflectionCooldown();
    }

    @Override
    public String getName() {
        return "ReflectionStage";
    }

    @Override
    public int getOrder() {
        return 60;
    }

    @Override
    public Optional<GateOutcome> tryMatch(Turn turn) {
        String message = turn.lastUserMessage();
        if (Utterances.wordCount(message) < MIN_WORDS) {
            return Optional.empty();
        }
        Optional<ReflectionBucket> match = ReflectionBuckets.classify(message);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        ReflectionBucket bucket = match.get();

        return cooldownStore.withConversation(turn.getUserId(), turn.getConversationId(), cooldowns -> {
            Instant now = clock.instant();
            String signature = Utterances.signature(message);
            CooldownEntry previous = cooldowns.get(StageKind.REFLECTION);
            if (previous != null) {
                if (!previous.hasElapsed(cooldown, now)) {
                    log.debug("[Reflection] Cooldown active for conversation {}", turn.getConversationId());
                    return Optional.<GateOutcome>empty();
                }
                if (signature.equals(previous.getLastMessageSignature())) {
                    log.debug("[Reflection] Same message as last reflection, skipping");
                    return Optional.<GateOutcome>empty();
                }
            }

            List<String> pool = isRepeated(bucket, turn.userMessages()) ? bucket.repeatLines() : bucket.firstLines();
            String line = replyPicker.pick(pool);
            ContinuityResult continuity = findContinuity(turn, cooldowns);
            cooldowns.put(StageKind.REFLECTION, CooldownEntry.reflection(now, signature));

            String response = continuity.isPresent() ? continuity.clause() + " " + line : line;
            String reason = continuity.isPresent() ? bucket.key() + CONTINUITY_SUFFIX : bucket.key();
            return Optional.of(GateOutcome.shortCircuit(GateStageKind.REFLECTION, reason, response)
                    .toBuilder()
                    .memoryReadCount(continuity.memoryReadCount())
                    .build());
        });
    }

    private ContinuityResult findContinuity(Turn turn, CooldownStore.ConversationCooldowns cooldowns) {
        try {
            return continuityScorer.findContinuity(turn, cooldowns);
        } catch (RuntimeException e) {
            log.warn("[Reflection] Continuity lookup failed: {}", e.getMessage());
            return ContinuityResult.none(0);
        }
    }

    private static boolean isRepeated(ReflectionBucket bucket, List<String> userMessages) {
        List<String> window = userMessages.subList(Math.max(0, userMessages.size() - REPEAT_WINDOW),
                userMessages.size());
        long hits = window.stream().filter(bucket::matches).count();
        return hits >= REPEAT_THRESHOLD;
    }
}
