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
import me.nova.companion.domain.model.DecisionRecord;
import me.nova.companion.domain.model.GateOutcome;
import me.nova.companion.domain.model.GateStageKind;
import me.nova.companion.domain.model.LlmRequest;
import me.nova.companion.domain.model.LlmResponse;
import me.nova.companion.domain.model.Turn;
import me.nova.companion.domain.service.BannedPhraseSanitizer;
import me.nova.companion.domain.service.DecisionRecorder;
import me.nova.companion.domain.service.SentenceBudgetEnforcer;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides how Nova answers one user turn.
 *
 * <p>
 * Gate stages are evaluated in ascending order and the first match answers the
 * turn locally. Otherwise the model is called exactly once with the rendered
 * voice rules, and its reply is sanitized for banned phrases and cut to the
 * mode's sentence budget. Model failures and timeouts produce a fixed apology
 * and are never retried.
 *
 * <p>
 * Every evaluation records one {@link DecisionRecord}.
 */
@Service
@Slf4j
public class GatePipeline {

    static final String MODEL_FAILURE_RESPONSE = "I couldn't reach the model just now. Try again in a moment.";

    private final List<GateStage> stages;
    private final LlmPort llmPort;
    private final BannedPhraseSanitizer sanitizer;
    private final SentenceBudgetEnforcer enforcer;
    private final SystemPromptRenderer promptRenderer;
    private final DecisionRecorder decisionRecorder;
    private final NovaProperties properties;
    private final Clock clock;

    public GatePipeline(List<GateStage> stages, LlmPort llmPort, BannedPhraseSanitizer sanitizer,
            SentenceBudgetEnforcer enforcer, SystemPromptRenderer promptRenderer, DecisionRecorder decisionRecorder,
            NovaProperties properties, Clock clock) {
        List<GateStage> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(GateStage::getOrder));
        this.stages = List.copyOf(sorted);
        this.llmPort = llmPort;
        this.sanitizer = sanitizer;
        this.enforcer = enforcer;
        this.promptRenderer = promptRenderer;
        this.decisionRecorder = decisionRecorder;
        this.properties = properties;
        this.clock = clock;
    }

    public GateOutcome evaluate(Turn turn) {
        Optional<GateOutcome> shortCircuit = runStages(turn);
        if (shortCircuit.isPresent()) {
            GateOutcome outcome = shortCircuit.get();
            log.debug("[Gate] {} answered turn ({})", outcome.getStage(), outcome.getReason());
            record(turn, outcome, 0, null);
            return outcome;
        }

        String model = llmPort.getCurrentModel();
        GateOutcome outcome = callModel(turn, model);
        record(turn, outcome, 1, model);
        return outcome;
    }

    /**
     * Stages in evaluation order.
     */
    public List<GateStage> getStages() {
        return stages;
    }

    private Optional<GateOutcome> runStages(Turn turn) {
        for (GateStage stage : stages) {
            try {
                Optional<GateOutcome> outcome = stage.tryMatch(turn);
                if (outcome.isPresent()) {
                    return outcome;
                }
            } catch (RuntimeException e) {
                log.warn("[Gate] Stage {} failed, continuing: {}", stage.getName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private GateOutcome callModel(Turn turn, String model) {
        LlmRequest request = LlmRequest.builder()
                .model(model)
                .systemPrompt(promptRenderer.render(turn.getSystemPrompt(), turn.getVoiceMode()))
                .messages(turn.getMessages())
                .temperature(properties.getLlm().getTemperature())
                .build();

        String content;
        Duration timeout = properties.getVoice().getModelTimeout();
        CompletableFuture<LlmResponse> future = null;
        try {
            future = llmPort.chat(request);
            LlmResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            content = response != null ? response.getContent() : null;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Gate] Model call timed out after {}", timeout);
            return modelFailure("model_timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return modelFailure("model_interrupted");
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[Gate] Model call failed: {}", cause.getMessage());
            return modelFailure("model_error");
        }

        if (content == null || content.isBlank()) {
            log.warn("[Gate] Model returned an empty reply");
            return modelFailure("model_empty");
        }
        return postProcess(turn, content);
    }

    private GateOutcome postProcess(Turn turn, String content) {
        String response = content;
        List<String> reasons = new ArrayList<>();
        boolean rewritten = false;

        boolean askedAboutNature = sanitizer.isAskingAboutNature(turn.lastUserMessage());
        Optional<String> banned = sanitizer.findBannedPhrase(response, askedAboutNature);
        if (banned.isPresent()) {
            String sanitized = sanitizer.sanitize(response, banned.get());
            if (!sanitized.equals(response)) {
                log.debug("[Gate] Removed banned phrase \"{}\"", banned.get());
                response = sanitized;
                rewritten = true;
                reasons.add("banned_phrase");
            }
        }

        int maxSentences = turn.style().maxSentences();
        if (!Utterances.hasUserProvidedContext(turn.userMessages())
                && enforcer.countSentences(response) > maxSentences) {
            response = enforcer.truncate(response, maxSentences);
            reasons.add("truncated");
        }

        return GateOutcome.builder()
                .response(response)
                .shortCircuited(false)
                .rewritten(rewritten)
                .stage(GateStageKind.MODEL_CALL)
                .reason(reasons.isEmpty() ? "model_reply" : String.join("+", reasons))
                .build();
    }

    private static GateOutcome modelFailure(String reason) {
        return GateOutcome.builder()
                .response(MODEL_FAILURE_RESPONSE)
                .shortCircuited(false)
                .rewritten(false)
                .stage(GateStageKind.MODEL_CALL)
                .reason(reason)
                .build();
    }

    private void record(Turn turn, GateOutcome outcome, int modelCallCount, String model) {
        try {
            DecisionRecord decision = DecisionRecord.builder()
                    .timestamp(clock.instant())
                    .route(turn.getRoute())
                    .stage(outcome.getStage())
                    .reason(outcome.getReason())
                    .shortCircuited(outcome.isShortCircuited())
                    .rewritten(outcome.isRewritten())
                    .modelCallCount(modelCallCount)
                    .memoryReadCount(outcome.getMemoryReadCount())
                    .conversationId(turn.getConversationId())
                    .voiceMode(turn.getVoiceMode())
                    .allowMemoryReferences(turn.isAllowMemoryReferences())
                    .model(model)
                    .build();
            decisionRecorder.record(turn.getUserId(), decision);
        } catch (RuntimeException e) {
            log.warn("[Gate] Failed to record decision: {}", e.getMessage());
        }
    }
}
