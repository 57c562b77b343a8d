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

import lombok.RequiredArgsConstructor;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.zip.CRC32;

/**
 * Deterministic offline embeddings built by feature hashing.
 *
 * <p>
 * Every token of the text increments one bucket chosen by its CRC32, and the
 * vector is L2-normalized. Texts sharing tokens therefore have a positive cosine
 * and identical texts score 1. No model, no network.
 */
@Component
@RequiredArgsConstructor
public class HashingEmbeddingAdapter implements EmbeddingProviderAdapter {

    static final String PROVIDER_ID = "hashing";
    private static final int DEFAULT_DIMENSION = 256;
    private static final String TOKEN_SPLIT = "[^\\p{L}\\p{N}_]+";

    private final MemoryEngineProperties properties;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.completedFuture(vectorize(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(vectorize(text));
        }
        return CompletableFuture.completedFuture(vectors);
    }

    @Override
    public int getDimension() {
        int configured = properties.getEmbedding().getDimensions();
        return configured > 0 ? configured : DEFAULT_DIMENSION;
    }

    @Override
    public String getModel() {
        return "feature-hashing-" + getDimension();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    float[] vectorize(String text) {
        int dimension = getDimension();
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split(TOKEN_SPLIT)) {
            if (token.isEmpty()) {
                continue;
            }
            vector[bucket(token, dimension)] += 1.0f;
        }

        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm == 0) {
            return vector;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < dimension; i++) {
            vector[i] *= scale;
        }
        return vector;
    }

    private static int bucket(String token, int dimension) {
        CRC32 crc = new CRC32();
        crc.update(token.getBytes(StandardCharsets.UTF_8));
        return (int) (crc.getValue() % dimension);
    }
}
