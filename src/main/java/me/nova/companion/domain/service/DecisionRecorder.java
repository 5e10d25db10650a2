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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.nova.companion.domain.model.DecisionRecord;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only record of gate decisions.
 *
 * <p>
 * Keeps a bounded ring buffer per user (oldest entries dropped past
 * {@code nova.telemetry.max-records-per-user}) and mirrors every record as one
 * JSON line to {@code telemetry/gate-decisions.jsonl}. The durable mirror is
 * best-effort: write failures are logged and never fail the turn.
 *
 * <p>
 * {@link #clear(String)} is only invoked from an explicit user request. It
 * removes that user's buffer and rewrites the log without that user's lines.
 */
@Service
@Slf4j
public class DecisionRecorder {

    private static final String USER_KEY_FIELD = "userKey";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final int maxPerUser;
    private final String directory;
    private final String fileName;

    private final Map<String, Deque<DecisionRecord>> buffers = new ConcurrentHashMap<>();
    private final Object sinkLock = new Object();

    public DecisionRecorder(StoragePort storagePort, NovaProperties properties, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.maxPerUser = Math.max(1, properties.getTelemetry().getMaxRecordsPerUser());
        this.directory = properties.getTelemetry().getDirectory();
        this.fileName = properties.getTelemetry().getDecisionLogFile();
    }

    public void record(String userKey, DecisionRecord decision) {
        buffers.compute(userKey, (key, existing) -> {
            Deque<DecisionRecord> buffer = existing != null ? existing : new ArrayDeque<>();
            synchronized (buffer) {
                buffer.addLast(decision);
                while (buffer.size() > maxPerUser) {
                    buffer.removeFirst();
                }
            }
            return buffer;
        });
        appendDurably(userKey, decision);
    }

    /**
     * Most recent records for a user, oldest first and most recent last.
     */
    public List<DecisionRecord> recent(String userKey, int limit) {
        Deque<DecisionRecord> buffer = buffers.get(userKey);
        if (buffer == null || limit <= 0) {
            return List.of();
        }
        synchronized (buffer) {
            List<DecisionRecord> all = new ArrayList<>(buffer);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public Optional<DecisionRecord> last(String userKey) {
        Deque<DecisionRecord> buffer = buffers.get(userKey);
        if (buffer == null) {
            return Optional.empty();
        }
        synchronized (buffer) {
            return Optional.ofNullable(buffer.peekLast());
        }
    }

    public int count(String userKey) {
        Deque<DecisionRecord> buffer = buffers.get(userKey);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            return buffer.size();
        }
    }

    /**
     * Deletes a user's decision history from memory and from the durable log.
     */
    public void clear(String userKey) {
        buffers.remove(userKey);

        synchronized (sinkLock) {
            try {
                String content = storagePort.getText(directory, fileName).join();
                if (content == null || content.isEmpty()) {
                    return;
                }
                String retained = withoutUser(content, userKey);
                storagePort.putTextAtomic(directory, fileName, retained).join();
                log.info("[Telemetry] Cleared decision log for user {}", userKey);
            } catch (RuntimeException e) {
                log.warn("[Telemetry] Failed to clear durable decision log: {}", e.getMessage());
            }
        }
    }

    /**
     * Location of the durable log, for diagnostics.
     */
    public String getLogLocation() {
        return storagePort.describeLocation(directory, fileName);
    }

    private void appendDurably(String userKey, DecisionRecord decision) {
        String line;
        try {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put(USER_KEY_FIELD, userKey);
            json.putAll(objectMapper.convertValue(decision, MAP_TYPE));
            line = objectMapper.writeValueAsString(json) + "\n";
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Telemetry] Failed to serialize decision record: {}", e.getMessage());
            return;
        }

        synchronized (sinkLock) {
            try {
                storagePort.appendText(directory, fileName, line).join();
            } catch (RuntimeException e) {
                log.warn("[Telemetry] Failed to append decision record: {}", e.getMessage());
            }
        }
    }

    private String withoutUser(String content, String userKey) {
        StringBuilder retained = new StringBuilder();
        Iterator<String> lines = content.lines().iterator();
        while (lines.hasNext()) {
            String line = lines.next();
            if (line.isBlank() || belongsTo(line, userKey)) {
                continue;
            }
            retained.append(line).append('\n');
        }
        return retained.toString();
    }

    private boolean belongsTo(String line, String userKey) {
        try {
            JsonNode node = objectMapper.readTree(line);
            JsonNode owner = node.get(USER_KEY_FIELD);
            return owner != null && userKey.equals(owner.asText());
        } catch (JsonProcessingException e) {
            // keep lines we cannot attribute
            return false;
        }
    }
}
