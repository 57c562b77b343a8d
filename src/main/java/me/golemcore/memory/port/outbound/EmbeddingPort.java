package me.golemcore.memory.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for turning text into dense vectors used by memory similarity search and
 * semantic merging.
 *
 * <p>
 * Implementations may fail or time out; callers treat that as degradation, not
 * as an error. No fixed dimensionality is assumed beyond vectors from one
 * provider configuration being comparable with each other.
 */
public interface EmbeddingPort {

    /**
     * Embeds one text, typically a search query.
     *
     * @return vector, completed exceptionally when the provider fails
     */
    CompletableFuture<float[]> embed(String text);

    /**
     * Embeds the texts of several memory items in one call.
     *
     * @return one vector per text, in input order
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    int getDimension();

    /** Model name, reported in engine logs. */
    String getModel();

    /**
     * Whether calls can currently succeed. The engine skips embedding entirely
     * and ranks lexically when this is {@code false}.
     */
    boolean isAvailable();

    /**
     * Cosine of the angle between two vectors, in [-1, 1]. Missing vectors,
     * vectors of different length and zero vectors score 0.
     */
    default double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0;
        }
        double dot = 0;
        double leftNorm = 0;
        double rightNorm = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            leftNorm += a[i] * a[i];
            rightNorm += b[i] * b[i];
        }
        if (leftNorm == 0 || rightNorm == 0) {
            return 0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }
}
