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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.MemoryEngineConfig;
import me.golemcore.memory.domain.model.MemoryEvent;
import me.golemcore.memory.domain.model.MemoryEventType;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryTier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Explicit, caller-triggered maintenance passes: episodic retention, working to
 * episodic promotion, and merging of near-duplicate semantic facts.
 */
@Slf4j
@RequiredArgsConstructor
public class MemoryConsolidationService {

    private final TieredMemoryStore store;
    private final ReadWriteLock lock;
    private final MemoryTierPolicy tierPolicy;
    private final MemoryEmbeddingService embeddingService;
    private final MemoryEmbeddingCache cache;
    private final MemoryEngineConfig config;
    private final MemoryEventDispatcher dispatcher;
    private final MemoryEngineCounters counters;

    /**
     * Expires episodic items older than the retention window, then promotes every
     * sufficiently reinforced working item. The pass runs under the write lock, so
     * no reader observes an item in both tiers or in neither.
     */
    public ConsolidationReport consolidate() {
        ConsolidationReport report = new ConsolidationReport();
        List<MemoryEvent> events = new ArrayList<>();

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Instant now = store.now();
            for (MemoryItem episodic : List.copyOf(store.liveTier(MemoryTier.EPISODIC))) {
                if (!tierPolicy.isExpired(episodic, now)) {
                    continue;
                }
                store.remove(episodic.getId());
                cache.invalidate(episodic.getId());
                report.getExpiredIds().add(episodic.getId());
                events.add(dispatcher.event(MemoryEventType.EXPIRED, episodic));
            }

            for (MemoryItem working : List.copyOf(store.liveTier(MemoryTier.WORKING))) {
                if (!tierPolicy.shouldPromote(working)) {
                    continue;
                }
                MemoryItem promoted = tierPolicy.toPromoted(working);
                store.remove(working.getId());
                cache.invalidate(working.getId());
                TieredMemoryStore.StoreOutcome outcome = store.store(promoted);
                report.getPromotedIds().add(outcome.id());
                events.add(dispatcher.event(MemoryEventType.PROMOTED, outcome.stored(), MemoryTier.WORKING,
                        Map.of(MemoryItem.PROMOTED_FROM, working.getId())));
                log.debug("[MemoryConsolidation] Promoted working item {} to episodic {}", working.getId(),
                        outcome.id());
            }
        } finally {
            writeLock.unlock();
        }

        counters.addExpirations(report.getExpiredCount());
        counters.addPromotions(report.getPromotedCount());
        dispatcher.dispatch(events);
        if (report.getPromotedCount() > 0 || report.getExpiredCount() > 0) {
            log.info("[MemoryConsolidation] Consolidated: {} promoted, {} expired", report.getPromotedCount(),
                    report.getExpiredCount());
        }
        return report;
    }

    /**
     * Merges semantic facts of one category whose similarity exceeds the merge
     * cutoff, round after round, until no pair qualifies. A {@code null} category
     * merges within every category separately.
     *
     * @return number of merges performed
     */
    public int mergeRelatedSemantics(String category) {
        double cutoff = config.resolveMergeCutoff();
        int mergedTotal = 0;
        List<MemoryEvent> events = new ArrayList<>();

        while (true) {
            List<MemoryItem> candidates = snapshotCategory(category);
            if (candidates.size() < 2) {
                break;
            }
            Map<String, float[]> vectors = embedQuietly(candidates);
            List<MergePair> pairs = qualifyingPairs(candidates, vectors, cutoff);
            if (pairs.isEmpty()) {
                break;
            }
            int merged = applyMerges(pairs, events);
            if (merged == 0) {
                break;
            }
            mergedTotal += merged;
        }

        counters.addMerges(mergedTotal);
        dispatcher.dispatch(events);
        if (mergedTotal > 0) {
            log.info("[MemoryConsolidation] Merged {} semantic pairs (category={}, cutoff={})", mergedTotal,
                    category, cutoff);
        }
        return mergedTotal;
    }

    /**
     * Similarity of two facts: content token Jaccard, averaged with embedding
     * cosine when both vectors are known.
     */
    double similarity(MemoryItem first, MemoryItem second, Map<String, float[]> vectors) {
        double lexical = MemoryTextSupport.jaccard(first.getContent(), second.getContent());
        float[] left = vectors.get(first.getId());
        float[] right = vectors.get(second.getId());
        if (left == null || right == null) {
            return lexical;
        }
        double cosine = embeddingService.cosineSimilarity(left, right);
        return (lexical + cosine) / 2.0;
    }

    private List<MemoryItem> snapshotCategory(String category) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.getAllByTier(MemoryTier.SEMANTIC).stream()
                    .filter(item -> category == null || category.equals(item.getCategory()))
                    .toList();
        } finally {
            readLock.unlock();
        }
    }

    private Map<String, float[]> embedQuietly(List<MemoryItem> candidates) {
        if (!embeddingService.isAvailable()) {
            return Map.of();
        }
        try {
            return embeddingService.embedItems(candidates);
        } catch (MemoryEmbeddingService.ProviderDegradedException e) {
            log.warn("[MemoryConsolidation] Embeddings unavailable, merging by token overlap only: {}",
                    e.getMessage());
            return Map.of();
        }
    }

    private List<MergePair> qualifyingPairs(List<MemoryItem> candidates, Map<String, float[]> vectors,
            double cutoff) {
        List<MergePair> pairs = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                MemoryItem first = candidates.get(i);
                MemoryItem second = candidates.get(j);
                if (!Objects.equals(first.getCategory(), second.getCategory())) {
                    continue;
                }
                double score = similarity(first, second, vectors);
                if (score > cutoff) {
                    pairs.add(new MergePair(first, second, score));
                }
            }
        }
        pairs.sort(Comparator.comparingDouble(MergePair::score).reversed());
        return pairs;
    }

    private int applyMerges(List<MergePair> pairs, List<MemoryEvent> events) {
        int merged = 0;
        Set<String> consumed = new HashSet<>();

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            for (MergePair pair : pairs) {
                String firstId = pair.first().getId();
                String secondId = pair.second().getId();
                if (consumed.contains(firstId) || consumed.contains(secondId)) {
                    continue;
                }
                MemoryItem first = store.liveItem(firstId);
                MemoryItem second = store.liveItem(secondId);
                if (isStale(pair.first(), first) || isStale(pair.second(), second)) {
                    log.debug("[MemoryConsolidation] Skipping pair {}/{} changed since snapshot", firstId, secondId);
                    continue;
                }

                MemoryItem combined = tierPolicy.merge(first, second);
                store.remove(firstId);
                store.remove(secondId);
                cache.invalidate(firstId);
                cache.invalidate(secondId);
                TieredMemoryStore.StoreOutcome outcome = store.store(combined);
                consumed.add(firstId);
                consumed.add(secondId);
                merged++;

                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put(MemoryItem.MERGED_FROM, List.of(firstId, secondId));
                attributes.put("similarity", pair.score());
                events.add(dispatcher.event(MemoryEventType.MERGED, outcome.stored(), null, attributes));
                log.debug("[MemoryConsolidation] Merged {} and {} into {} (score={})", firstId, secondId,
                        outcome.id(), pair.score());
            }
        } finally {
            writeLock.unlock();
        }
        return merged;
    }

    private static boolean isStale(MemoryItem snapshot, MemoryItem live) {
        return live == null
                || !live.isTier(MemoryTier.SEMANTIC)
                || !Objects.equals(snapshot.getContent(), live.getContent())
                || !Objects.equals(snapshot.getCategory(), live.getCategory());
    }

    private record MergePair(MemoryItem first, MemoryItem second, double score) {
    }
}
