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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryTier;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tier-partitioned keyed collection of memory items with synchronous capacity
 * enforcement.
 *
 * <p>
 * Not thread-safe: the owning {@link AgentMemoryEngine} serializes writers and
 * guards readers. Public read methods return copies; the {@code live*} methods
 * expose internal instances to engine components that mutate them in place.
 */
@Slf4j
public class TieredMemoryStore {

    private final Clock clock;
    private final MemoryTierPolicy tierPolicy;

    private final Map<String, MemoryItem> itemsById = new HashMap<>();
    private final Map<MemoryTier, Map<String, MemoryItem>> itemsByTier = new EnumMap<>(MemoryTier.class);
    private final Map<String, String> skillIndex = new HashMap<>();

    private Instant lastTimestamp = Instant.EPOCH;
    private long totalStored;

    public TieredMemoryStore(Clock clock, MemoryTierPolicy tierPolicy) {
        this.clock = clock;
        this.tierPolicy = tierPolicy;
        for (MemoryTier tier : MemoryTier.values()) {
            itemsByTier.put(tier, new LinkedHashMap<>());
        }
    }

    /**
     * Copies the item in, assigns id and timestamp when absent, normalizes it and
     * evicts from working memory until the limit holds again.
     *
     * @throws IllegalArgumentException
     *             if the item or its tier is missing
     */
    public StoreOutcome store(MemoryItem input) {
        if (input == null || input.getTier() == null) {
            throw new IllegalArgumentException("Memory item and its tier are required");
        }
        MemoryItem item = input.copy();
        tierPolicy.normalize(item);

        MemoryItem replaced = null;
        if (item.isTier(MemoryTier.PROCEDURAL) && item.getSkillName() != null) {
            String existingId = skillIndex.get(skillKey(item.getSkillName()));
            if (existingId != null && !existingId.equals(item.getId())) {
                MemoryItem existing = itemsById.get(existingId);
                item.setId(existingId);
                if (item.getTimestamp() == null && existing != null) {
                    item.setTimestamp(existing.getTimestamp());
                }
            }
        }

        if (item.getId() == null || item.getId().isBlank()) {
            item.setId(UUID.randomUUID().toString());
        }
        if (item.getTimestamp() == null) {
            item.setTimestamp(nextTimestamp());
        } else if (item.getTimestamp().isAfter(lastTimestamp)) {
            lastTimestamp = item.getTimestamp();
        }

        MemoryItem previous = itemsById.get(item.getId());
        if (previous != null) {
            carryExecutionStats(previous, item);
            replaced = removeInternal(item.getId());
        }
        insertInternal(item);
        totalStored++;

        List<MemoryItem> evicted = enforceWorkingLimit();
        log.debug("[MemoryStore] Stored {} item {} (replaced={}, evicted={})",
                item.getTier(), item.getId(), replaced != null, evicted.size());
        return new StoreOutcome(item.copy(), replaced, evicted);
    }

    public Optional<MemoryItem> retrieve(String id) {
        MemoryItem item = liveItem(id);
        return item != null ? Optional.of(item.copy()) : Optional.empty();
    }

    public List<MemoryItem> getAllByTier(MemoryTier tier) {
        List<MemoryItem> copies = new ArrayList<>();
        for (MemoryItem item : liveTier(tier)) {
            copies.add(item.copy());
        }
        return copies;
    }

    public Optional<MemoryItem> findSkill(String skillName) {
        if (skillName == null || skillName.isBlank()) {
            return Optional.empty();
        }
        String id = skillIndex.get(skillKey(skillName));
        return id != null ? retrieve(id) : Optional.empty();
    }

    public Optional<MemoryItem> remove(String id) {
        if (id == null || !itemsById.containsKey(id)) {
            return Optional.empty();
        }
        return Optional.of(removeInternal(id));
    }

    public void clear() {
        itemsById.clear();
        skillIndex.clear();
        for (Map<String, MemoryItem> tierItems : itemsByTier.values()) {
            tierItems.clear();
        }
        log.debug("[MemoryStore] Cleared all tiers");
    }

    public int count(MemoryTier tier) {
        return itemsByTier.get(tier).size();
    }

    public long getTotalStored() {
        return totalStored;
    }

    /**
     * Next engine-assigned timestamp, never earlier than any timestamp handed out
     * or accepted before.
     */
    public Instant nextTimestamp() {
        Instant now = clock.instant();
        if (now.isBefore(lastTimestamp)) {
            now = lastTimestamp;
        }
        lastTimestamp = now;
        return now;
    }

    public Instant now() {
        return clock.instant();
    }

    MemoryItem liveItem(String id) {
        return id != null ? itemsById.get(id) : null;
    }

    Collection<MemoryItem> liveTier(MemoryTier tier) {
        return Collections.unmodifiableCollection(itemsByTier.get(tier).values());
    }

    /**
     * Execution statistics only change through recorded executions, so a skill
     * stored over an existing one keeps the existing counters.
     */
    private static void carryExecutionStats(MemoryItem previous, MemoryItem replacement) {
        if (!previous.isTier(MemoryTier.PROCEDURAL) || !replacement.isTier(MemoryTier.PROCEDURAL)) {
            return;
        }
        replacement.setExecutionCount(previous.getExecutionCount());
        replacement.setSuccessRate(previous.getSuccessRate());
        replacement.setAverageExecutionTime(previous.getAverageExecutionTime());
    }

    private List<MemoryItem> enforceWorkingLimit() {
        List<MemoryItem> evicted = new ArrayList<>();
        Map<String, MemoryItem> working = itemsByTier.get(MemoryTier.WORKING);
        while (tierPolicy.exceedsWorkingLimit(working.size())) {
            Optional<MemoryItem> candidate = tierPolicy.selectEvictionCandidate(working.values());
            if (candidate.isEmpty()) {
                break;
            }
            MemoryItem removed = removeInternal(candidate.get().getId());
            log.debug("[MemoryStore] Evicted working item {} (attention={})", removed.getId(), removed.getAttention());
            evicted.add(removed);
        }
        return evicted;
    }

    private void insertInternal(MemoryItem item) {
        itemsById.put(item.getId(), item);
        itemsByTier.get(item.getTier()).put(item.getId(), item);
        if (item.isTier(MemoryTier.PROCEDURAL) && item.getSkillName() != null) {
            skillIndex.put(skillKey(item.getSkillName()), item.getId());
        }
    }

    private MemoryItem removeInternal(String id) {
        MemoryItem removed = itemsById.remove(id);
        if (removed == null) {
            return null;
        }
        itemsByTier.get(removed.getTier()).remove(id);
        if (removed.isTier(MemoryTier.PROCEDURAL) && removed.getSkillName() != null) {
            skillIndex.remove(skillKey(removed.getSkillName()), id);
        }
        return removed;
    }

    private static String skillKey(String skillName) {
        return skillName.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Result of a {@link #store} call.
     *
     * @param stored
     *            copy of the item as stored
     * @param replaced
     *            item previously held under the same id or skill name, if any
     * @param evicted
     *            working items dropped to restore the capacity limit
     */
    public record StoreOutcome(MemoryItem stored, MemoryItem replaced, List<MemoryItem> evicted) {

        public String id() {
            return stored.getId();
        }

        public boolean wasEvicted(String id) {
            return evicted.stream().anyMatch(item -> item.getId().equals(id));
        }
    }
}
