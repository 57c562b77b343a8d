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

import lombok.RequiredArgsConstructor;
import me.golemcore.memory.domain.model.MemoryEngineConfig;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryRelation;
import me.golemcore.memory.domain.model.MemoryTier;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-tier rules: value normalization, working decay and reinforcement,
 * capacity eviction, episodic retention, promotion eligibility, semantic merge
 * and procedural execution statistics.
 *
 * <p>
 * Every rule is total: out-of-range input is clamped, never rejected.
 */
@RequiredArgsConstructor
public class MemoryTierPolicy {

    public static final String PROMOTED_EVENT_TYPE = "promoted";

    private static final Comparator<MemoryItem> EVICTION_ORDER = Comparator
            .comparingDouble((MemoryItem item) -> attentionOf(item))
            .thenComparing(MemoryItem::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final MemoryEngineConfig config;

    /**
     * Clamps ranged fields and fills missing collections and counters so the
     * stored item satisfies the tier invariants.
     */
    public void normalize(MemoryItem item) {
        if (item.getMetadata() == null) {
            item.setMetadata(new LinkedHashMap<>());
        }
        if (item.getParticipants() == null) {
            item.setParticipants(new LinkedHashSet<>());
        }
        if (item.getRelations() == null) {
            item.setRelations(new ArrayList<>());
        }
        if (item.getSteps() == null) {
            item.setSteps(new ArrayList<>());
        }
        if (item.getPrerequisites() == null) {
            item.setPrerequisites(new LinkedHashSet<>());
        }
        if (item.getContent() == null) {
            item.setContent("");
        }

        switch (item.getTier()) {
        case WORKING -> {
            item.setAttention(MemoryTextSupport.clamp(defaultDouble(item.getAttention(), 1.0)));
            item.setDecay(MemoryTextSupport.clamp(defaultDouble(item.getDecay(), 0.0)));
        }
        case EPISODIC -> {
            item.setEmotionalValence(
                    MemoryTextSupport.clamp(defaultDouble(item.getEmotionalValence(), 0.0), -1.0, 1.0));
            item.setImportance(MemoryTextSupport.clamp(defaultDouble(item.getImportance(), 0.5)));
        }
        case SEMANTIC -> item.setConfidence(MemoryTextSupport.clamp(defaultDouble(item.getConfidence(), 0.5)));
        case PROCEDURAL -> {
            int count = item.getExecutionCount() != null ? item.getExecutionCount() : 0;
            item.setExecutionCount(Math.max(0, count));
            item.setSuccessRate(MemoryTextSupport.clamp(defaultDouble(item.getSuccessRate(), 0.0)));
            item.setAverageExecutionTime(Math.max(0.0, defaultDouble(item.getAverageExecutionTime(), 0.0)));
        }
        }
    }

    /**
     * Applies {@code attention <- clamp(attention * (1 - decay))} {@code ticks}
     * times to a working item.
     *
     * @return true if attention changed
     */
    public boolean decay(MemoryItem item, int ticks) {
        if (ticks <= 0 || !item.isTier(MemoryTier.WORKING)) {
            return false;
        }
        double attention = attentionOf(item);
        double rate = MemoryTextSupport.clamp(defaultDouble(item.getDecay(), 0.0));
        double decayed = MemoryTextSupport.clamp(attention * Math.pow(1.0 - rate, ticks));
        item.setAttention(decayed);
        return decayed != attention;
    }

    /**
     * Bumps the reinforcement counter and, for working items, moves attention
     * toward 1 by {@code reinforcementBoost} of the remaining distance.
     */
    public void reinforce(MemoryItem item) {
        item.getMetadata().put(MemoryItem.REINFORCEMENT_COUNT, item.getReinforcementCount() + 1);
        if (item.isTier(MemoryTier.WORKING)) {
            double attention = attentionOf(item);
            double raised = attention + (1.0 - attention) * config.getReinforcementBoost();
            item.setAttention(MemoryTextSupport.clamp(Math.min(1.0, raised)));
        }
    }

    /**
     * Least-attended working item, oldest first on ties.
     */
    public Optional<MemoryItem> selectEvictionCandidate(Collection<MemoryItem> workingItems) {
        return workingItems.stream().min(EVICTION_ORDER);
    }

    public boolean exceedsWorkingLimit(int workingCount) {
        return workingCount > config.getWorkingMemoryLimit();
    }

    public boolean isExpired(MemoryItem item, Instant now) {
        if (!item.isTier(MemoryTier.EPISODIC) || item.getTimestamp() == null) {
            return false;
        }
        Instant cutoff = now.minus(config.getEpisodicRetentionDays(), ChronoUnit.DAYS);
        return item.getTimestamp().isBefore(cutoff);
    }

    public boolean shouldPromote(MemoryItem item) {
        return item != null
                && item.isTier(MemoryTier.WORKING)
                && item.getReinforcementCount() >= config.getPromotionReinforcementThreshold();
    }

    /**
     * Episodic copy of a reinforced working item. The caller assigns identity and
     * removes the original.
     */
    public MemoryItem toPromoted(MemoryItem working) {
        Map<String, Object> metadata = new LinkedHashMap<>(working.getMetadata());
        Object carried = metadata.remove(MemoryItem.PARTICIPANTS);
        metadata.put(MemoryItem.PROMOTED_FROM, working.getId());

        return MemoryItem.builder()
                .tier(MemoryTier.EPISODIC)
                .source(working.getSource())
                .content(working.getContent())
                .metadata(metadata)
                .eventType(PROMOTED_EVENT_TYPE)
                .participants(toParticipants(carried))
                .emotionalValence(0.0)
                .importance(MemoryTextSupport.clamp(attentionOf(working)))
                .build();
    }

    /**
     * Lossless merge of two semantic facts: relations are the ordered union,
     * confidence the maximum, distinct contents are joined.
     */
    public MemoryItem merge(MemoryItem first, MemoryItem second) {
        MemoryItem primary = confidenceOf(second) > confidenceOf(first) ? second : first;
        MemoryItem other = primary == first ? second : first;

        Set<MemoryRelation> relations = new LinkedHashSet<>(first.getRelations());
        relations.addAll(second.getRelations());

        Map<String, Object> metadata = new LinkedHashMap<>(other.getMetadata());
        metadata.putAll(primary.getMetadata());
        metadata.put(MemoryItem.MERGED_FROM, List.of(first.getId(), second.getId()));
        metadata.put(MemoryItem.REINFORCEMENT_COUNT,
                first.getReinforcementCount() + second.getReinforcementCount());

        return MemoryItem.builder()
                .tier(MemoryTier.SEMANTIC)
                .source(primary.getSource() != null ? primary.getSource() : other.getSource())
                .content(joinContent(primary.getContent(), other.getContent()))
                .metadata(metadata)
                .category(primary.getCategory())
                .confidence(Math.max(confidenceOf(first), confidenceOf(second)))
                .relations(new ArrayList<>(relations))
                .build();
    }

    /**
     * Running-average update of the procedural counters.
     */
    public void recordExecution(MemoryItem item, boolean success, long durationMs) {
        int previousCount = item.getExecutionCount() != null ? item.getExecutionCount() : 0;
        int count = previousCount + 1;
        double previousRate = defaultDouble(item.getSuccessRate(), 0.0);
        double previousAverage = defaultDouble(item.getAverageExecutionTime(), 0.0);
        double duration = Math.max(0L, durationMs);

        item.setExecutionCount(count);
        item.setSuccessRate(MemoryTextSupport.clamp((previousRate * previousCount + (success ? 1.0 : 0.0)) / count));
        item.setAverageExecutionTime((previousAverage * previousCount + duration) / count);
    }

    private static String joinContent(String primary, String other) {
        if (other == null || other.isBlank() || Objects.equals(primary, other)) {
            return primary;
        }
        if (primary == null || primary.isBlank()) {
            return other;
        }
        return primary + "; " + other;
    }

    private static Set<String> toParticipants(Object carried) {
        Set<String> participants = new LinkedHashSet<>();
        if (carried instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null) {
                    participants.add(value.toString());
                }
            }
        }
        return participants;
    }

    private static double attentionOf(MemoryItem item) {
        return defaultDouble(item.getAttention(), 0.0);
    }

    private static double confidenceOf(MemoryItem item) {
        return defaultDouble(item.getConfidence(), 0.0);
    }

    private static double defaultDouble(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
