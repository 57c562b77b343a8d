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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Memory tier discriminant. Each tier has its own retention and scoring rules.
 */
public enum MemoryTier {

    WORKING("working"), EPISODIC("episodic"), SEMANTIC("semantic"), PROCEDURAL("procedural");

    private final String value;

    MemoryTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a tier from its lowercase name ({@code "working"}) or enum name.
     *
     * @throws IllegalArgumentException
     *             if the value names no tier
     */
    @JsonCreator
    public static MemoryTier fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Memory tier must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MemoryTier tier : values()) {
            if (tier.value.equals(normalized)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown memory tier: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
