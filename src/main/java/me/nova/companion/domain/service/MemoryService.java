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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.nova.companion.domain.model.MemoryItem;
import me.nova.companion.port.outbound.MemoryPort;
import me.nova.companion.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memories the user explicitly asked Nova to keep, one JSON list per user in
 * {@code memories/<userKey>.json}. Nothing is ever added automatically.
 */
@Service
@Slf4j
public class MemoryService implements MemoryPort {

    private static final String MEMORIES_DIR = "memories";
    private static final int MAX_CONTENT_LENGTH = 2000;
    private static final TypeReference<List<MemoryItem>> LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, List<MemoryItem>> cache = new ConcurrentHashMap<>();

    public MemoryService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public List<MemoryItem> listMemories(String userKey) {
        List<MemoryItem> memories = memoriesOf(userKey);
        synchronized (memories) {
            return memories.stream().map(MemoryService::copyOf).toList();
        }
    }

    /**
     * Stores a new memory.
     *
     * @throws IllegalArgumentException
     *             if the content is blank or too long
     * @throws IllegalStateException
     *             if persistence fails
     */
    public MemoryItem addMemory(String userKey, String content, List<String> tags) {
        validateContent(content);

        MemoryItem item = MemoryItem.builder()
                .id(UUID.randomUUID().toString())
                .content(content.trim())
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .createdAt(clock.instant())
                .build();

        List<MemoryItem> memories = memoriesOf(userKey);
        synchronized (memories) {
            List<MemoryItem> updated = new ArrayList<>(memories);
            updated.add(item);
            persist(userKey, updated);
            memories.add(item);
        }
        log.info("Stored memory {} for {}", item.getId(), userKey);
        return copyOf(item);
    }

    /**
     * Replaces the content and/or tags of a memory; null arguments keep the
     * current value.
     *
     * @return the updated memory, or empty if no memory has that id
     * @throws IllegalArgumentException
     *             if new content is blank or too long
     * @throws IllegalStateException
     *             if persistence fails
     */
    public Optional<MemoryItem> updateMemory(String userKey, String memoryId, String content, List<String> tags) {
        if (content != null) {
            validateContent(content);
        }
        List<MemoryItem> memories = memoriesOf(userKey);
        MemoryItem updatedItem;
        synchronized (memories) {
            int index = indexOf(memories, memoryId);
            if (index < 0) {
                return Optional.empty();
            }
            updatedItem = copyOf(memories.get(index));
            if (content != null) {
                updatedItem.setContent(content.trim());
            }
            if (tags != null) {
                updatedItem.setTags(new ArrayList<>(tags));
            }
            List<MemoryItem> updated = new ArrayList<>(memories);
            updated.set(index, updatedItem);
            persist(userKey, updated);
            memories.set(index, updatedItem);
        }
        log.info("Updated memory {} for {}", memoryId, userKey);
        return Optional.of(copyOf(updatedItem));
    }

    /**
     * Deletes a memory.
     *
     * @return true if the memory existed
     */
    public boolean deleteMemory(String userKey, String memoryId) {
        List<MemoryItem> memories = memoriesOf(userKey);
        synchronized (memories) {
            List<MemoryItem> updated = new ArrayList<>(memories);
            boolean removed = updated.removeIf(item -> item.getId().equals(memoryId));
            if (!removed) {
                return false;
            }
            persist(userKey, updated);
            memories.removeIf(item -> item.getId().equals(memoryId));
        }
        log.info("Deleted memory {} for {}", memoryId, userKey);
        return true;
    }

    private static void validateContent(String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Memory content is required");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("Memory content must be at most " + MAX_CONTENT_LENGTH + " characters");
        }
    }

    private static int indexOf(List<MemoryItem> memories, String memoryId) {
        for (int i = 0; i < memories.size(); i++) {
            if (memories.get(i).getId().equals(memoryId)) {
                return i;
            }
        }
        return -1;
    }

    private List<MemoryItem> memoriesOf(String userKey) {
        return cache.computeIfAbsent(userKey, this::load);
    }

    private List<MemoryItem> load(String userKey) {
        String json = storagePort.getText(MEMORIES_DIR, fileName(userKey)).join();
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, LIST_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt memory file for " + userKey, e);
        }
    }

    private void persist(String userKey, List<MemoryItem> memories) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(memories);
            storagePort.putTextAtomic(MEMORIES_DIR, fileName(userKey), json).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to persist memories for {}", userKey, e);
            throw new IllegalStateException("Failed to persist memories", e);
        }
    }

    private static String fileName(String userKey) {
        return userKey + ".json";
    }

    private static MemoryItem copyOf(MemoryItem item) {
        return MemoryItem.builder()
                .id(item.getId())
                .content(item.getContent())
                .tags(item.getTags() != null ? new ArrayList<>(item.getTags()) : new ArrayList<>())
                .createdAt(item.getCreatedAt())
                .build();
    }
}
