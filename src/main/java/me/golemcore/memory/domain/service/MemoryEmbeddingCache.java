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

import me.golemcore.memory.domain.model.MemoryItem;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily filled item embeddings keyed by memory id.
 *
 * <p>
 * An entry is only valid for the exact text it was computed from, so an item
 * whose content changed (merge, replacement) misses and is embedded again.
 * Thread-safe; writes happen outside the engine's write lock.
 */
public class MemoryEmbeddingCache {

    private final Map<String, CachedEmbedding> embeddings = new ConcurrentHashMap<>();

    public float[] get(MemoryItem item) {
        if (item == null || item.getId() == null) {
            return null;
        }
        CachedEmbedding cached = embeddings.get(item.getId());
        if (cached == null || !Objects.equals(cached.text(), embeddingText(item))) {
            return null;
        }
        return cached.vector();
    }

    public void put(MemoryItem item, float[] vector) {
        if (item == null || item.getId() == null || vector == null) {
            return;
        }
        embeddings.put(item.getId(), new CachedEmbedding(embeddingText(item), vector));
    }

    public void invalidate(String id) {
        if (id != null) {
            embeddings.remove(id);
        }
    }

    public void clear() {
        embeddings.clear();
    }

    public int size() {
        return embeddings.size();
    }

    /**
     * Text embedded for an item: its content, falling back to the searchable tag
     * text for content-less items.
     */
    public static String embeddingText(MemoryItem item) {
        String content = item.getContent();
        if (content != null && !content.isBlank()) {
            return content;
        }
        return MemoryTextSupport.buildSearchableText(item);
    }

    private record CachedEmbedding(String text, float[] vector) {
    }
}
