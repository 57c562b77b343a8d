package me.golemcore.memory.adapter.outbound.embedding;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the embedding provider named by {@code memory.embedding.provider}.
 *
 * <p>
 * Known providers:
 * <ul>
 * <li>hashing - deterministic offline feature hashing
 * <li>openai - OpenAI embeddings via langchain4j
 * <li>none - no embeddings; similarity search runs lexically and reports
 * degradation
 * </ul>
 * An unknown provider falls back to {@code hashing}.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class EmbeddingAdapterFactory implements EmbeddingPort {

    static final String PROVIDER_NONE = "none";

    private final MemoryEngineProperties properties;
    private final List<EmbeddingProviderAdapter> adapters;

    private final Map<String, EmbeddingProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private EmbeddingProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (EmbeddingProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("[EmbeddingAdapter] Registered embedding adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getEmbedding().getProvider();
        if (PROVIDER_NONE.equals(provider)) {
            activeAdapter = null;
            log.info("[EmbeddingAdapter] Embeddings disabled, similarity search will run lexically");
            return;
        }

        activeAdapter = adaptersByProvider.get(provider);
        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(HashingEmbeddingAdapter.PROVIDER_ID);
            log.warn("[EmbeddingAdapter] Provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("[EmbeddingAdapter] Active embedding provider: {}", provider);
        }
    }

    public EmbeddingPort getActiveAdapter() {
        return activeAdapter;
    }

    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    // ==================== EmbeddingPort delegation ====================

    @Override
    public CompletableFuture<float[]> embed(String text) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No embedding provider configured"));
        }
        return activeAdapter.embed(text);
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No embedding provider configured"));
        }
        return activeAdapter.embedBatch(texts);
    }

    @Override
    public int getDimension() {
        return activeAdapter != null ? activeAdapter.getDimension() : 0;
    }

    @Override
    public String getModel() {
        return activeAdapter != null ? activeAdapter.getModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
