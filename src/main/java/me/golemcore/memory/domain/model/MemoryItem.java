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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single memory record for all four tiers.
 *
 * <p>
 * The {@link #tier} field is the discriminant: storage, iteration and
 * serialization treat every item uniformly, while tier-specific operations
 * switch on it. Fields that belong to another tier stay {@code null} (or
 * empty).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MemoryItem {

    public static final String REINFORCEMENT_COUNT = "reinforcementCount";
    public static final String PARTICIPANTS = "participants";
    public static final String PROMOTED_FROM = "promotedFrom";
    public static final String MERGED_FROM = "mergedFrom";

    private String id;
    private Instant timestamp;
    private MemoryTier tier;
    private String source;
    private String content;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    // working
    private Double attention;
    private Double decay;

    // episodic
    private String eventType;

    @Builder.Default
    private Set<String> participants = new LinkedHashSet<>();

    private Double emotionalValence;
    private Double importance;

    // semantic
    private String category;
    private Double confidence;

    @Builder.Default
    private List<MemoryRelation> relations = new ArrayList<>();

    // procedural
    private String skillName;

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    @Builder.Default
    private Set<String> prerequisites = new LinkedHashSet<>();

    private Integer executionCount;
    private Double successRate;
    private Double averageExecutionTime;

    /**
     * Deep copy: collections are duplicated so the copy can be handed out without
     * exposing engine state.
     */
    public MemoryItem copy() {
        return toBuilder()
                .metadata(copyMetadata(metadata))
                .participants(participants != null ? new LinkedHashSet<>(participants) : new LinkedHashSet<>())
                .relations(relations != null ? new ArrayList<>(relations) : new ArrayList<>())
                .steps(steps != null ? new ArrayList<>(steps) : new ArrayList<>())
                .prerequisites(prerequisites != null ? new LinkedHashSet<>(prerequisites) : new LinkedHashSet<>())
                .build();
    }

    /**
     * Copies metadata recursively through nested maps and collections; leaf
     * values are shared.
     */
    private static Map<String, Object> copyMetadata(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(key, copyValue(value)));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, copyValue(nested)));
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(element -> copy.add(copyValue(element)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>();
            collection.forEach(element -> copy.add(copyValue(element)));
            return copy;
        }
        return value;
    }

    @JsonIgnore
    public int getReinforcementCount() {
        if (metadata == null) {
            return 0;
        }
        Object value = metadata.get(REINFORCEMENT_COUNT);
        return value instanceof Number number ? number.intValue() : 0;
    }

    @JsonIgnore
    public boolean isTier(MemoryTier expected) {
        return tier == expected;
    }
}
