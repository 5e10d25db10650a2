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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.nova.companion.domain.model.VoiceSettings;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user voice settings stored in {@code settings/<userKey>.json}. Settings
 * are loaded on first access and cached; unknown users get the defaults
 * (quiet mode, memory references off, configured base prompt).
 */
@Service
@Slf4j
public class VoiceSettingsService {

    private static final String SETTINGS_DIR = "settings";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final NovaProperties properties;

    private final Map<String, VoiceSettings> cache = new ConcurrentHashMap<>();

    public VoiceSettingsService(StoragePort storagePort, ObjectMapper objectMapper, NovaProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Get a copy of the user's settings.
     */
    public VoiceSettings getSettings(String userKey) {
        return copyOf(cache.computeIfAbsent(userKey, this::load));
    }

    /**
     * Save the user's settings.
     *
     * @throws IllegalStateException
     *             if persistence fails (the cached value is left untouched)
     */
    public VoiceSettings saveSettings(String userKey, VoiceSettings settings) {
        VoiceSettings stored = copyOf(settings);
        try {
            String json = objectMapper.writeValueAsString(stored);
            storagePort.putTextAtomic(SETTINGS_DIR, fileName(userKey), json).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to save voice settings for {}", userKey, e);
            throw new IllegalStateException("Failed to persist voice settings", e);
        }
        cache.put(userKey, stored);
        log.debug("Saved voice settings for {}: mode={}, memoryReferences={}", userKey, stored.getVoiceMode(),
                stored.isAllowMemoryReferences());
        return copyOf(stored);
    }

    /**
     * Base system prompt for the user: their override when set, otherwise the
     * configured default.
     */
    public String resolveSystemPrompt(VoiceSettings settings) {
        String prompt = settings.getSystemPrompt();
        if (prompt == null || prompt.isBlank()) {
            return properties.getVoice().getDefaultSystemPrompt();
        }
        return prompt;
    }

    private VoiceSettings load(String userKey) {
        try {
            String json = storagePort.getText(SETTINGS_DIR, fileName(userKey)).join();
            if (json != null && !json.isBlank()) {
                return objectMapper.readValue(json, VoiceSettings.class);
            }
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - fall back to defaults
            log.warn("Failed to load voice settings for {}, using defaults: {}", userKey, e.getMessage());
        }
        return VoiceSettings.builder().build();
    }

    private static String fileName(String userKey) {
        return userKey + ".json";
    }

    private static VoiceSettings copyOf(VoiceSettings settings) {
        return VoiceSettings.builder()
                .voiceMode(settings.getVoiceMode())
                .allowMemoryReferences(settings.isAllowMemoryReferences())
                .systemPrompt(settings.getSystemPrompt())
                .build();
    }
}
