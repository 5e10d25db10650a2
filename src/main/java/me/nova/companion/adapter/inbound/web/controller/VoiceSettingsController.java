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
import me.nova.companion.adapter.inbound.web.dto.VoiceSettingsDto;
import me.nova.companion.domain.model.VoiceMode;
import me.nova.companion.domain.model.VoiceSettings;
import me.nova.companion.domain.service.KeyValidator;
import me.nova.companion.domain.service.VoiceSettingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Voice mode, memory opt-in and base prompt of the calling user.
 */
@RestController
@RequestMapping("/api/settings/voice")
@RequiredArgsConstructor
public class VoiceSettingsController {

    private final VoiceSettingsService voiceSettingsService;

    @GetMapping
    public Mono<ResponseEntity<VoiceSettingsDto>> getVoiceSettings(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        return Mono.fromCallable(() -> ResponseEntity.ok(toDto(voiceSettingsService.getSettings(userKey))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping
    public Mono<ResponseEntity<VoiceSettingsDto>> updateVoiceSettings(
            @RequestHeader(name = ChatController.USER_HEADER, required = false) String userHeader,
            @RequestBody VoiceSettingsDto request) {
        String userKey = KeyValidator.normalizeUserKeyOrThrow(userHeader);
        VoiceMode mode = request.getVoiceMode() != null ? VoiceMode.fromId(request.getVoiceMode()) : null;

        return Mono.fromCallable(() -> {
            VoiceSettings settings = voiceSettingsService.getSettings(userKey);
            if (mode != null) {
                settings.setVoiceMode(mode);
            }
            if (request.getAllowMemoryReferences() != null) {
                settings.setAllowMemoryReferences(request.getAllowMemoryReferences());
            }
            if (request.getSystemPrompt() != null) {
                settings.setSystemPrompt(request.getSystemPrompt().isBlank() ? null : request.getSystemPrompt());
            }
            return ResponseEntity.ok(toDto(voiceSettingsService.saveSettings(userKey, settings)));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private VoiceSettingsDto toDto(VoiceSettings settings) {
        return VoiceSettingsDto.builder()
                .voiceMode(settings.getVoiceMode().getId())
                .allowMemoryReferences(settings.isAllowMemoryReferences())
                .systemPrompt(voiceSettingsService.resolveSystemPrompt(settings))
                .build();
    }
}
