package me.golemcore.memory.domain.model;

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

import java.util.Locale;

/**
 * Numeric field used to order tier search results (always descending).
 */
public enum MemorySortKey {

    TIMESTAMP("timestamp"),
    IMPORTANCE("importance"),
    ATTENTION("attention"),
    CONFIDENCE("confidence"),
    SUCCESS_RATE("successRate"),
    EXECUTION_COUNT("executionCount"),
    EMOTIONAL_VALENCE("emotionalValence");

    private final String fieldName;

    MemorySortKey(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * Sort value of the item for this key. Fields missing on the item's tier sort
     * as {@code 0}.
     */
    public double sortValue(MemoryItem item) {
        if (item == null) {
            return 0.0;
        }
        return switch (this) {
        case TIMESTAMP -> item.getTimestamp() != null ? item.getTimestamp().toEpochMilli() : 0.0;
        case IMPORTANCE -> orZero(item.getImportance());
        case ATTENTION -> orZero(item.getAttention());
        case CONFIDENCE -> orZero(item.getConfidence());
        case SUCCESS_RATE -> orZero(item.getSuccessRate());
        case EXECUTION_COUNT -> item.getExecutionCount() != null ? item.getExecutionCount() : 0.0;
        case EMOTIONAL_VALENCE -> orZero(item.getEmotionalValence());
        };
    }

    /**
     * Natural ordering field for a tier when the caller names none.
     */
    public static MemorySortKey defaultFor(MemoryTier tier) {
        if (tier == null) {
            return TIMESTAMP;
        }
        return switch (tier) {
        case WORKING -> ATTENTION;
        case EPISODIC -> IMPORTANCE;
        case SEMANTIC -> CONFIDENCE;
        case PROCEDURAL -> SUCCESS_RATE;
        };
    }

    /**
     * Accepts the field name ({@code "successRate"}), enum name
     * ({@code "SUCCESS_RATE"}) or a case-insensitive variant of either.
     *
     * @throws IllegalArgumentException
     *             if the key names no sortable field
     */
    public static MemorySortKey fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Sort key must not be blank");
        }
        String normalized = value.trim().replace("_", "").toLowerCase(Locale.ROOT);
        for (MemorySortKey key : values()) {
            if (key.fieldName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown sort key: " + value);
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
