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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Embeds memory text (fact content, episode summaries, skill descriptions)
 * through an OpenAI-compatible endpoint via langchain4j.
 *
 * <p>
 * Selected with {@code memory.embedding.provider=openai}. The model is built on
 * first use; without an API key the adapter reports itself unavailable and
 * every call fails, which the engine turns into lexical fallback.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory.embedding.api-key} - API key
 * <li>{@code memory.embedding.model} - model name, text-embedding-3-small by
 * default
 * <li>{@code memory.embedding.base-url} - OpenAI-compatible endpoint
 * <li>{@code memory.embedding.timeout} - HTTP timeout
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingProviderAdapter {

    static final String PROVIDER_ID = "openai";
    private static final String DEFAULT_MODEL = "text-embedding-3-small";
    private static final int DEFAULT_DIMENSION = 1536;
    private static final Map<String, Integer> MODEL_DIMENSIONS = Map.of(
            "text-embedding-3-small", 1536,
            "text-embedding-3-large", 3072,
            "text-embedding-ada-002", 1536);

    private final MemoryEngineProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;

        MemoryEngineProperties.EmbeddingProperties config = properties.getEmbedding();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[EmbeddingAdapter] No memory.embedding.api-key configured, memory embeddings unavailable");
            return;
        }
        try {
            embeddingModel = createModel(config);
            log.info("[EmbeddingAdapter] Memory embedding model ready: {}", getModel());
        } catch (RuntimeException e) {
            log.error("[EmbeddingAdapter] Failed to create memory embedding model {}", getModel(), e);
        }
    }

    EmbeddingModel createModel(MemoryEngineProperties.EmbeddingProperties config) {
        OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                .apiKey(config.getApiKey())
                .modelName(getModel());
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTimeout() != null) {
            builder.timeout(config.getTimeout());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            Response<Embedding> response = requireModel().embed(text);
            return response.content().vector();
        });
    }

    /**
     * Embeds memory texts in one request. The result keeps input order; a
     * response with a different number of vectors fails the call.
     */
    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();
            List<Embedding> embeddings = requireModel().embedAll(segments).content();
            if (embeddings == null || embeddings.size() != texts.size()) {
                throw new IllegalStateException("Embedding model returned "
                        + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + texts.size() + " texts");
            }
            log.debug("[EmbeddingAdapter] Embedded {} memory texts", texts.size());
            return embeddings.stream()
                    .map(Embedding::vector)
                    .toList();
        });
    }

    @Override
    public int getDimension() {
        return MODEL_DIMENSIONS.getOrDefault(getModel(), DEFAULT_DIMENSION);
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        EmbeddingModel model = embeddingModel;
        if (model == null) {
            throw new IllegalStateException("Memory embedding model not available");
        }
        return model;
    }
}
