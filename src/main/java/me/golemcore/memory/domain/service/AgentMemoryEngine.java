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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.component.AgentMemoryComponent;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.MemoryContext;
import me.golemcore.memory.domain.model.MemoryEngineConfig;
import me.golemcore.memory.domain.model.MemoryEvent;
import me.golemcore.memory.domain.model.MemoryEventType;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemorySearchResult;
import me.golemcore.memory.domain.model.MemorySnapshot;
import me.golemcore.memory.domain.model.MemorySortKey;
import me.golemcore.memory.domain.model.MemoryStats;
import me.golemcore.memory.domain.model.MemoryTier;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.MemoryEventListener;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Memory engine owned by one agent.
 *
 * <p>
 * Single writer, many readers: mutating operations hold the write lock, reads
 * hold the read lock and return copies. Embedding calls run outside the write
 * lock and events are delivered after the lock is released, so listeners may
 * call back into the engine.
 */
@Slf4j
public class AgentMemoryEngine implements AgentMemoryComponent {

    private final String agentId;
    private final MemoryEngineConfig config;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final TieredMemoryStore store;
    private final MemoryTierPolicy tierPolicy;
    private final MemoryEmbeddingCache embeddingCache = new MemoryEmbeddingCache();
    private final MemoryEventDispatcher dispatcher;
    private final MemoryEngineCounters counters = new MemoryEngineCounters();
    private final MemoryRetrievalService retrievalService;
    private final MemoryConsolidationService consolidationService;
    private final MemoryContextAssembler contextAssembler;
    private final MemorySnapshotService snapshotService;
    private final Clock clock;

    /**
     * @throws MemoryEngineConfig.InvalidConfigurationException
     *             if the agent id is blank or any parameter is out of range
     */
    public AgentMemoryEngine(String agentId, MemoryEngineConfig config, EmbeddingPort embeddingPort, Clock clock,
            ObjectMapper objectMapper, List<MemoryEventListener> listeners) {
        if (agentId == null || agentId.isBlank()) {
            throw new MemoryEngineConfig.InvalidConfigurationException("agentId must not be blank");
        }
        if (config == null) {
            throw new MemoryEngineConfig.InvalidConfigurationException("config must not be null");
        }
        this.agentId = agentId;
        this.config = config.toBuilder().build().validate();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.tierPolicy = new MemoryTierPolicy(this.config);
        this.store = new TieredMemoryStore(this.clock, tierPolicy);
        this.dispatcher = new MemoryEventDispatcher(agentId, this.clock, listeners);

        MemoryEmbeddingService embeddingService = new MemoryEmbeddingService(embeddingPort, embeddingCache,
                this.config.getEmbeddingTimeout(), store, lock);
        this.retrievalService = new MemoryRetrievalService(store, lock, embeddingService, this.config);
        this.consolidationService = new MemoryConsolidationService(store, lock, tierPolicy, embeddingService,
                embeddingCache, this.config, dispatcher, counters);
        this.contextAssembler = new MemoryContextAssembler(store, lock, retrievalService, this.config);
        this.snapshotService = new MemorySnapshotService(objectMapper);
        log.debug("[MemoryEngine] Created engine for agent {} (embeddings={})", agentId,
                embeddingPort != null ? embeddingPort.getModel() : "none");
    }

    @Override
    public String getAgentId() {
        return agentId;
    }

    public MemoryEngineConfig getConfig() {
        return config.toBuilder().build();
    }

    // ==================== Store ====================

    @Override
    public String store(MemoryItem item) {
        List<MemoryEvent> events = new ArrayList<>();
        TieredMemoryStore.StoreOutcome outcome;
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            outcome = store.store(item);
            if (outcome.replaced() != null) {
                embeddingCache.invalidate(outcome.replaced().getId());
            }
            for (MemoryItem evicted : outcome.evicted()) {
                embeddingCache.invalidate(evicted.getId());
            }
        } finally {
            writeLock.unlock();
        }

        counters.addEvictions(outcome.evicted().size());
        if (!outcome.wasEvicted(outcome.id())) {
            events.add(dispatcher.event(MemoryEventType.STORED, outcome.stored(), null,
                    Map.of("replaced", outcome.replaced() != null)));
        }
        for (MemoryItem evicted : outcome.evicted()) {
            events.add(dispatcher.event(MemoryEventType.EVICTED, evicted, null,
                    Map.of("attention", evicted.getAttention() != null ? evicted.getAttention() : 0.0)));
        }
        dispatcher.dispatch(events);
        return outcome.id();
    }

    @Override
    public Optional<MemoryItem> retrieve(String id) {
        return read(() -> store.retrieve(id));
    }

    @Override
    public List<MemoryItem> getAllByTier(MemoryTier tier) {
        if (tier == null) {
            return List.of();
        }
        return read(() -> store.getAllByTier(tier));
    }

    /**
     * @throws IllegalArgumentException
     *             if the name is not a tier
     */
    public List<MemoryItem> getAllByTier(String tier) {
        return getAllByTier(MemoryTier.fromValue(tier));
    }

    @Override
    public Optional<MemoryItem> getSkill(String skillName) {
        return read(() -> store.findSkill(skillName));
    }

    @Override
    public Optional<MemoryItem> remove(String id) {
        Optional<MemoryItem> removed = write(() -> {
            Optional<MemoryItem> result = store.remove(id);
            result.ifPresent(item -> embeddingCache.invalidate(item.getId()));
            return result;
        });
        removed.ifPresent(item -> dispatcher.dispatch(List.of(dispatcher.event(MemoryEventType.REMOVED, item))));
        return removed;
    }

    @Override
    public void clear() {
        int removed = write(() -> {
            int count = totalCount();
            store.clear();
            embeddingCache.clear();
            return count;
        });
        log.debug("[MemoryEngine] Cleared {} items of agent {}", removed, agentId);
        dispatcher.dispatch(List.of(dispatcher.event(MemoryEventType.CLEARED, null, null,
                Map.of("removedCount", removed))));
    }

    @Override
    public void destroy() {
        clear();
    }

    // ==================== Tier policies ====================

    @Override
    public void tick(int ticks) {
        if (ticks <= 0) {
            return;
        }
        int changed = write(() -> {
            int count = 0;
            for (MemoryItem item : store.liveTier(MemoryTier.WORKING)) {
                if (tierPolicy.decay(item, ticks)) {
                    count++;
                }
            }
            return count;
        });
        log.debug("[MemoryEngine] Decayed {} working items by {} ticks", changed, ticks);
    }

    @Override
    public Optional<MemoryItem> reinforce(String id) {
        Optional<MemoryItem> reinforced = write(() -> {
            MemoryItem item = store.liveItem(id);
            if (item == null) {
                return Optional.<MemoryItem>empty();
            }
            tierPolicy.reinforce(item);
            return Optional.of(item.copy());
        });
        if (reinforced.isEmpty()) {
            log.debug("[MemoryEngine] Cannot reinforce unknown item {}", id);
            return reinforced;
        }
        MemoryItem item = reinforced.get();
        dispatcher.dispatch(List.of(dispatcher.event(MemoryEventType.REINFORCED, item, null,
                Map.of(MemoryItem.REINFORCEMENT_COUNT, item.getReinforcementCount()))));
        return reinforced;
    }

    @Override
    public ConsolidationReport consolidate() {
        return consolidationService.consolidate();
    }

    @Override
    public int mergeRelatedSemantics(String category) {
        return consolidationService.mergeRelatedSemantics(category);
    }

    // ==================== Procedural tracking ====================

    @Override
    public Optional<MemoryItem> recordExecution(String id, boolean success, long durationMs) {
        Optional<MemoryItem> updated = write(() -> {
            MemoryItem item = store.liveItem(id);
            if (item == null || !item.isTier(MemoryTier.PROCEDURAL)) {
                return Optional.<MemoryItem>empty();
            }
            tierPolicy.recordExecution(item, success, durationMs);
            return Optional.of(item.copy());
        });
        if (updated.isEmpty()) {
            log.warn("[MemoryEngine] Cannot record execution: {} is not a stored skill", id);
            return updated;
        }
        dispatcher.dispatch(List.of(dispatcher.event(MemoryEventType.SKILL_EXECUTED, updated.get(), null,
                Map.of("success", success, "durationMs", Math.max(0L, durationMs)))));
        return updated;
    }

    // ==================== Retrieval ====================

    @Override
    public List<MemoryItem> queryByParticipant(String participant) {
        return retrievalService.queryByParticipant(participant);
    }

    @Override
    public List<MemoryItem> queryByCategory(String category) {
        return retrievalService.queryByCategory(category);
    }

    @Override
    public List<MemoryItem> queryByPrerequisite(String skillName) {
        return retrievalService.queryByPrerequisite(skillName);
    }

    @Override
    public List<MemoryItem> searchByTier(MemoryTier tier, String query, int limit, MemorySortKey sortKey) {
        return retrievalService.searchByTier(tier, query, limit, sortKey);
    }

    /**
     * @throws IllegalArgumentException
     *             if the sort key names no sortable field
     */
    public List<MemoryItem> searchByTierNamed(MemoryTier tier, String query, int limit, String sortKey) {
        MemorySortKey key = sortKey != null ? MemorySortKey.fromValue(sortKey) : null;
        return retrievalService.searchByTier(tier, query, limit, key);
    }

    @Override
    public MemorySearchResult semanticSearch(String query, MemoryTier tier, int limit) {
        return retrievalService.semanticSearch(query, tier, limit);
    }

    @Override
    public MemorySearchResult search(String query, Collection<MemoryTier> tiers, int limit) {
        return retrievalService.search(query, tiers, limit);
    }

    // ==================== Context ====================

    @Override
    public MemoryContext assembleContext(String query) {
        return contextAssembler.assembleContext(query);
    }

    @Override
    public String formatContextForPrompt(MemoryContext context) {
        return contextAssembler.formatContextForPrompt(context);
    }

    // ==================== Stats and snapshots ====================

    @Override
    public MemoryStats getStats() {
        return read(() -> MemoryStats.builder()
                .agentId(agentId)
                .working(store.count(MemoryTier.WORKING))
                .episodic(store.count(MemoryTier.EPISODIC))
                .semantic(store.count(MemoryTier.SEMANTIC))
                .procedural(store.count(MemoryTier.PROCEDURAL))
                .totalStored(store.getTotalStored())
                .evictions(counters.getEvictions())
                .promotions(counters.getPromotions())
                .merges(counters.getMerges())
                .expirations(counters.getExpirations())
                .build());
    }

    @Override
    public String exportSnapshot() {
        MemorySnapshot snapshot = read(() -> {
            List<MemoryItem> items = new ArrayList<>();
            for (MemoryTier tier : MemoryTier.values()) {
                items.addAll(store.getAllByTier(tier));
            }
            return MemorySnapshot.builder()
                    .agentId(agentId)
                    .exportedAt(clock.instant())
                    .items(items)
                    .build();
        });
        return snapshotService.write(snapshot);
    }

    /**
     * @throws MemorySnapshotService.InvalidSnapshotException
     *             if the JSON is not a valid snapshot; the current state is then
     *             left untouched
     */
    @Override
    public int importSnapshot(String json) {
        MemorySnapshot snapshot = snapshotService.read(json);
        int restored = write(() -> {
            store.clear();
            embeddingCache.clear();
            for (MemoryItem item : snapshot.getItems()) {
                store.store(item);
            }
            return totalCount();
        });
        log.info("[MemoryEngine] Imported {} items into agent {} from snapshot of agent {}", restored, agentId,
                snapshot.getAgentId());
        dispatcher.dispatch(List.of(dispatcher.event(MemoryEventType.CLEARED, null, null,
                Map.of("restoredCount", restored))));
        return restored;
    }

    @Override
    public Runnable addListener(MemoryEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        return dispatcher.addListener(listener);
    }

    private int totalCount() {
        int total = 0;
        for (MemoryTier tier : MemoryTier.values()) {
            total += store.count(tier);
        }
        return total;
    }

    private <T> T read(Supplier<T> action) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }
}
