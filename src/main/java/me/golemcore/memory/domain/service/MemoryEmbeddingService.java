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
import me.golemcore.memory.port.outbound.EmbeddingPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Supplier;

/**
 * Embeds queries and memory items with a bounded wait, filling the per-engine
 * {@link MemoryEmbeddingCache}.
 *
 * <p>
 * Never called under the engine's write lock. Every failure mode (no provider,
 * provider unavailable, error, timeout) surfaces as
 * {@link ProviderDegradedException} so callers can switch to lexical ranking.
 *
 * <p>
 * When bound to a store, vectors are cached only for items that are still
 * stored with the same text once the provider answers; an item removed or
 * merged away while its embedding was in flight leaves no cache entry behind.
 */
@Slf4j
public class MemoryEmbeddingService {

    private final EmbeddingPort embeddingPort;
    private final MemoryEmbeddingCache cache;
    private final Duration timeout;
    private final TieredMemoryStore store;
    private final ReadWriteLock lock;

    public MemoryEmbeddingService(EmbeddingPort embeddingPort, MemoryEmbeddingCache cache, Duration timeout) {
        this(embeddingPort, cache, timeout, null, null);
    }

    public MemoryEmbeddingService(EmbeddingPort embeddingPort, MemoryEmbeddingCache cache, Duration timeout,
            TieredMemoryStore store, ReadWriteLock lock) {
        this.embeddingPort = embeddingPort;
        this.cache = cache;
        this.timeout = timeout;
        this.store = store;
        this.lock = lock;
    }

    public boolean isAvailable() {
        if (embeddingPort == null) {
            return false;
        }
        try {
            return embeddingPort.isAvailable();
        } catch (RuntimeException e) {
            log.warn("[MemoryEmbedding] Availability check failed: {}", e.getMessage());
            return false;
        }
    }

    public double cosineSimilarity(float[] a, float[] b) {
        return embeddingPort.cosineSimilarity(a, b);
    }

    public float[] embedQuery(String query) {
        ensureAvailable();
        float[] vector = await(() -> embeddingPort.embed(query), "query");
        if (vector == null || vector.length == 0) {
            throw new ProviderDegradedException("Embedding provider returned an empty vector");
        }
        return vector;
    }

    /**
     * Embeddings for the given items keyed by id, computing only the ones missing
     * from the cache.
     */
    public Map<String, float[]> embedItems(List<MemoryItem> items) {
        Map<String, float[]> result = new LinkedHashMap<>();
        List<MemoryItem> missing = new ArrayList<>();
        for (MemoryItem item : items) {
            float[] cached = cache.get(item);
            if (cached != null) {
                result.put(item.getId(), cached);
            } else {
                missing.add(item);
            }
        }
        if (missing.isEmpty()) {
            return result;
        }

        ensureAvailable();
        List<String> texts = missing.stream().map(MemoryEmbeddingCache::embeddingText).toList();
        List<float[]> vectors;
        try {
            vectors = await(() -> embeddingPort.embedBatch(texts), "batch");
        } catch (ProviderDegradedException e) {
            log.debug("[MemoryEmbedding] Batch embedding failed, embedding {} items individually", missing.size());
            vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(await(() -> embeddingPort.embed(text), "item"));
            }
        }
        if (vectors == null || vectors.size() != missing.size()) {
            throw new ProviderDegradedException("Embedding provider returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + missing.size() + " texts");
        }

        Map<MemoryItem, float[]> computed = new LinkedHashMap<>();
        for (int i = 0; i < missing.size(); i++) {
            MemoryItem item = missing.get(i);
            float[] vector = vectors.get(i);
            if (vector == null || vector.length == 0) {
                throw new ProviderDegradedException("Embedding provider returned an empty vector for " + item.getId());
            }
            computed.put(item, vector);
            result.put(item.getId(), vector);
        }
        cacheStoredItems(computed);
        log.debug("[MemoryEmbedding] Embedded {} items ({} cached)", missing.size(), items.size() - missing.size());
        return result;
    }

    private void cacheStoredItems(Map<MemoryItem, float[]> computed) {
        if (store == null || lock == null) {
            computed.forEach(cache::put);
            return;
        }
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            computed.forEach((item, vector) -> {
                MemoryItem live = store.liveItem(item.getId());
                if (live != null && Objects.equals(MemoryEmbeddingCache.embeddingText(live),
                        MemoryEmbeddingCache.embeddingText(item))) {
                    cache.put(item, vector);
                }
            });
        } finally {
            readLock.unlock();
        }
    }

    private void ensureAvailable() {
        if (!isAvailable()) {
            throw new ProviderDegradedException("Embedding provider unavailable");
        }
    }

    private <T> T await(Supplier<CompletableFuture<T>> call, String what) {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            throw new ProviderDegradedException("Embedding " + what + " failed: " + e.getMessage(), e);
        }
        if (future == null) {
            throw new ProviderDegradedException("Embedding provider returned no result for " + what);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderDegradedException("Embedding " + what + " timed out after " + timeout.toMillis() + "ms",
                    e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ProviderDegradedException("Embedding " + what + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderDegradedException("Embedding " + what + " interrupted", e);
        } catch (RuntimeException e) {
            throw new ProviderDegradedException("Embedding " + what + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Embedding call failed, timed out or no provider is available.
     */
    public static class ProviderDegradedException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ProviderDegradedException(String message) {
            super(message);
        }

        public ProviderDegradedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
