package me.nova.companion.adapter.inbound.web.controller;

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
import lombok.extern.slf4j.Slf4j;
import me.nova.companion.adapter.inbound.web.dto.DecisionsResponse;
import me.nova.companion.adapter.inbound.web.dto.DiagnosticsResponse;
import me.nova.companion.domain.model.DecisionRecord;
import me.nova.companion.domain.service.DecisionRecorder;
import me.nova.companion.domain.service.KeyValidator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.List;

/**
 * Policy diagnostics and the caller's gate decision history.
 */
@RestController
@RequestMapping("/api/diagnostics")
@RequiredArgsConstructor
@Slf4j
public class DiagnosticsController {

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 200;

    private final DecisionRecorder decisionRecorder;
    private final Clock clock;

    @GetMapping
    public Mono<ResponseEntity<DiagnosticsResponse>> getDiagnostics(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        long uptimeSec = ManagementFactory.getRuntimeMXBean().getUptime() / 1000;

        DiagnosticsResponse response = DiagnosticsResponse.builder()
                .ok(true)
                .now(clock.instant().toString())
                .uptimeSec(uptimeSec)
                .policy(DiagnosticsResponse.Policy.builder()
                        .noHiddenBackgroundCognition(true)
                        .reflection(new DiagnosticsResponse.Mode("user-invoked-only"))
                        .memory(new DiagnosticsResponse.Mode("opt-in-only"))
                        .artifacts(new DiagnosticsResponse.Mode("off"))
                        .build())
                .decisionLog(DiagnosticsResponse.DecisionLog.builder()
                        .count(decisionRecorder.count(userKey))
                        .path(decisionRecorder.getLogLocation())
                        .build())
                .lastDecision(decisionRecorder.last(userKey).orElse(null))
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/decisions")
    public Mono<ResponseEntity<DecisionsResponse>> getDecisions(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader,
            @RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        List<DecisionRecord> records = decisionRecorder.recent(userKey, bounded);
        return Mono.just(ResponseEntity.ok(DecisionsResponse.builder()
                .userKey(userKey)
                .count(records.size())
                .records(records)
                .build()));
    }

    @DeleteMapping("/decisions")
    public Mono<ResponseEntity<Void>> clearDecisions(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        return Mono.fromCallable(() -> {
            decisionRecorder.clear(userKey);
            log.info("[Telemetry] Decision history cleared on request of {}", userKey);
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
