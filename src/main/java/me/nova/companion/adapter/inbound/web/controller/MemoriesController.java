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
import me.nova.companion.adapter.inbound.web.dto.MemoryCreateRequest;
import me.nova.companion.adapter.inbound.web.dto.MemoryUpdateRequest;
import me.nova.companion.domain.model.MemoryItem;
import me.nova.companion.domain.service.KeyValidator;
import me.nova.companion.domain.service.MemoryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Memories the user chose to keep. Only these endpoints write memories.
 */
@RestController
@RequestMapping("/api/memories")
@RequiredArgsConstructor
public class MemoriesController {

    private final MemoryService memoryService;

    @GetMapping
    public Mono<ResponseEntity<List<MemoryItem>>> listMemories(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryService.listMemories(userKey)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping
    public Mono<ResponseEntity<MemoryItem>> createMemory(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader,
            @RequestBody MemoryCreateRequest request) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(memoryService.addMemory(userKey, request.getContent(), request.getTags())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PatchMapping("/{id}")
    public Mono<ResponseEntity<MemoryItem>> updateMemory(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader,
            @PathVariable String id,
            @RequestBody MemoryUpdateRequest request) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        return Mono.fromCallable(() -> memoryService.updateMemory(userKey, id, request.getContent(), request.getTags())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Memory not found")))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteMemory(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader,
            @PathVariable String id) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        return Mono.fromCallable(() -> {
            if (!memoryService.deleteMemory(userKey, id)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Memory not found");
            }
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
