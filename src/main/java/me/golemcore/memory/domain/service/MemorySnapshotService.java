package me.golemcore.memory.domain.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemorySnapshot;

/**
 * JSON encoding of engine snapshots.
 */
@Slf4j
@RequiredArgsConstructor
public class MemorySnapshotService {

    private final ObjectMapper objectMapper;

    public String write(MemorySnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize memory snapshot: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses and checks a snapshot.
     *
     * @throws InvalidSnapshotException
     *             if the JSON is malformed, of an unsupported version, or holds
     *             items without a tier
     */
    public MemorySnapshot read(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidSnapshotException("Snapshot JSON is empty");
        }
        MemorySnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(json, MemorySnapshot.class);
        } catch (JsonProcessingException e) {
            throw new InvalidSnapshotException("Malformed snapshot JSON: " + e.getOriginalMessage(), e);
        }
        if (snapshot == null) {
            throw new InvalidSnapshotException("Snapshot JSON is null");
        }
        if (snapshot.getVersion() > MemorySnapshot.CURRENT_VERSION || snapshot.getVersion() <= 0) {
            throw new InvalidSnapshotException("Unsupported snapshot version " + snapshot.getVersion());
        }
        if (snapshot.getItems() == null) {
            throw new InvalidSnapshotException("Snapshot has no items list");
        }
        for (MemoryItem item : snapshot.getItems()) {
            if (item == null || item.getTier() == null) {
                throw new InvalidSnapshotException("Snapshot contains an item without a tier");
            }
        }
        log.debug("[MemorySnapshot] Parsed snapshot of agent {} with {} items", snapshot.getAgentId(),
                snapshot.getItems().size());
        return snapshot;
    }

    /**
     * Raised when a snapshot cannot be imported.
     */
    public static class InvalidSnapshotException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public InvalidSnapshotException(String message) {
            super(message);
        }

        public InvalidSnapshotException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
