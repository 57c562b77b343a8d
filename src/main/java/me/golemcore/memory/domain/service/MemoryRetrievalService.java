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
import me.golemcore.memory.domain.model.MemoryEngineConfig;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryScoredItem;
import me.golemcore.memory.domain.model.MemorySearchResult;
import me.golemcore.memory.domain.model.MemorySortKey;
import me.golemcore.memory.domain.model.MemoryTier;
import me.golemcore.memory.domain.model.RetrievalMode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Predicate;

/**
 * Read side of the engine: exact-match filters, tier search ordered by a field,
 * and embedding similarity search with lexical fallback.
 *
 * <p>
 * Candidates are copied under the read lock; embeddings are computed after
 * the lock is released.
 */
@Slf4j
@RequiredArgsConstructor
public class MemoryRetrievalService {

    private static final Comparator<MemoryScoredItem> BY_SCORE = Comparator
            .comparingDouble(MemoryScoredItem::getScore)
            .reversed()
            .thenComparing((MemoryScoredItem scored) -> scored.getItem().getTimestamp(),
                    Comparator.nullsLast(Comparator.reverseOrder()));

    private final TieredMemoryStore store;
    private final ReadWriteLock lock;
    private final MemoryEmbeddingService embeddingService;
    private final MemoryEngineConfig config;

    public List<MemoryItem> queryByParticipant(String participant) {
        if (participant == null) {
            return List.of();
        }
        return filterTier(MemoryTier.EPISODIC,
                item -> item.getParticipants() != null && item.getParticipants().contains(participant));
    }

    public List<MemoryItem> queryByCategory(String category) {
        if (category == null) {
            return List.of();
        }
        return filterTier(MemoryTier.SEMANTIC, item -> category.equals(item.getCategory()));
    }

    public List<MemoryItem> queryByPrerequisite(String skillName) {
        if (skillName == null) {
            return List.of();
        }
        return filterTier(MemoryTier.PROCEDURAL,
                item -> item.getPrerequisites() != null && item.getPrerequisites().contains(skillName));
    }

    /**
     * Up to {@code limit} items of the tier, descending by {@code sortKey} (tier
     * default when null), most recent first on ties. A non-blank query keeps only
     * items whose content or tags match it.
     */
    public List<MemoryItem> searchByTier(MemoryTier tier, String query, int limit, MemorySortKey sortKey) {
        if (tier == null || limit <= 0) {
            return List.of();
        }
        MemorySortKey key = sortKey != null ? sortKey : MemorySortKey.defaultFor(tier);
        Comparator<MemoryItem> order = Comparator
                .comparingDouble(key::sortValue)
                .reversed()
                .thenComparing(MemoryItem::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

        return snapshot(List.of(tier)).stream()
                .filter(item -> MemoryTextSupport.matches(item, query))
                .sorted(order)
                .limit(limit)
                .toList();
    }

    public MemorySearchResult semanticSearch(String query, MemoryTier tier, int limit) {
        MemoryTier target = tier != null ? tier : MemoryTier.SEMANTIC;
        return search(query, List.of(target), limit);
    }

    /**
     * Ranks items of the given tiers by cosine similarity to the query. When the
     * embedding provider is missing, fails or times out, the ranking falls back to
     * token overlap and the result is flagged as degraded.
     */
    public MemorySearchResult search(String query, Collection<MemoryTier> tiers, int limit) {
        long startedAt = System.nanoTime();
        List<MemoryTier> targetTiers = tiers == null || tiers.isEmpty()
                ? List.of(MemoryTier.values())
                : List.copyOf(new LinkedHashSet<>(tiers));
        List<MemoryItem> candidates = snapshot(targetTiers);

        if (limit <= 0 || candidates.isEmpty()) {
            return result(query, List.of(), RetrievalMode.SEMANTIC, false, null, candidates.size(), startedAt);
        }
        if (query == null || query.isBlank()) {
            return result(query, unranked(candidates, targetTiers, limit), RetrievalMode.LEXICAL, false, null,
                    candidates.size(), startedAt);
        }

        try {
            float[] queryVector = embeddingService.embedQuery(query);
            Map<String, float[]> vectors = embeddingService.embedItems(candidates);
            List<MemoryScoredItem> scored = new ArrayList<>();
            for (MemoryItem item : candidates) {
                double similarity = embeddingService.cosineSimilarity(queryVector, vectors.get(item.getId()));
                if (similarity >= config.getSemanticSearchMinScore()) {
                    scored.add(MemoryScoredItem.builder().item(item).score(similarity).build());
                }
            }
            scored.sort(BY_SCORE);
            List<MemoryScoredItem> top = scored.stream().limit(limit).toList();
            log.debug("[MemoryRetrieval] Semantic search over {} candidates returned {}", candidates.size(),
                    top.size());
            return result(query, top, RetrievalMode.SEMANTIC, false, null, candidates.size(), startedAt);
        } catch (MemoryEmbeddingService.ProviderDegradedException e) {
            log.warn("[MemoryRetrieval] Embedding provider degraded, using lexical fallback: {}", e.getMessage());
            List<MemoryScoredItem> lexical = lexicalRank(query, candidates, limit);
            return result(query, lexical, RetrievalMode.LEXICAL, true, e.getMessage(), candidates.size(), startedAt);
        }
    }

    /**
     * Token-overlap ranking over the items {@link #searchByTier} would match.
     */
    List<MemoryScoredItem> lexicalRank(String query, List<MemoryItem> candidates, int limit) {
        List<MemoryScoredItem> scored = new ArrayList<>();
        for (MemoryItem item : candidates) {
            if (!MemoryTextSupport.matches(item, query)) {
                continue;
            }
            scored.add(MemoryScoredItem.builder()
                    .item(item)
                    .score(MemoryTextSupport.lexicalRelevance(query, item))
                    .build());
        }
        scored.sort(BY_SCORE);
        return scored.stream().limit(limit).toList();
    }

    private List<MemoryScoredItem> unranked(List<MemoryItem> candidates, List<MemoryTier> tiers, int limit) {
        MemorySortKey key = tiers.size() == 1 ? MemorySortKey.defaultFor(tiers.get(0)) : MemorySortKey.TIMESTAMP;
        return candidates.stream()
                .map(item -> MemoryScoredItem.builder().item(item).score(0.0).build())
                .sorted(Comparator.comparingDouble((MemoryScoredItem scored) -> key.sortValue(scored.getItem()))
                        .reversed()
                        .thenComparing((MemoryScoredItem scored) -> scored.getItem().getTimestamp(),
                                Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
    }

    private List<MemoryItem> filterTier(MemoryTier tier, Predicate<MemoryItem> predicate) {
        return snapshot(List.of(tier)).stream()
                .filter(predicate)
                .toList();
    }

    private List<MemoryItem> snapshot(List<MemoryTier> tiers) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            List<MemoryItem> items = new ArrayList<>();
            for (MemoryTier tier : tiers) {
                items.addAll(store.getAllByTier(Objects.requireNonNull(tier, "tier")));
            }
            return items;
        } finally {
            readLock.unlock();
        }
    }

    private MemorySearchResult result(String query, List<MemoryScoredItem> results, RetrievalMode mode,
            boolean degraded, String diagnostic, int totalSearched, long startedAt) {
        return MemorySearchResult.builder()
                .query(query)
                .results(new ArrayList<>(results))
                .mode(mode)
                .degraded(degraded)
                .diagnostic(diagnostic)
                .totalSearched(totalSearched)
                .searchTimeMs((System.nanoTime() - startedAt) / 1_000_000L)
                .build();
    }
}
