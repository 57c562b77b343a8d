package me.golemcore.memory.domain.service;

import me.golemcore.memory.port.outbound.EmbeddingPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test embedding provider: one dimension per vocabulary word, counting
 * occurrences. Texts without vocabulary words embed to a constant bias vector.
 */
class KeywordEmbeddingPort implements EmbeddingPort {

    private final List<String> vocabulary;
    final AtomicInteger embeddedTexts = new AtomicInteger();

    KeywordEmbeddingPort(String... vocabulary) {
        this.vocabulary = List.of(vocabulary);
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.completedFuture(vectorize(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>();
        for (String text : texts) {
            vectors.add(vectorize(text));
        }
        return CompletableFuture.completedFuture(vectors);
    }

    @Override
    public int getDimension() {
        return vocabulary.size() + 1;
    }

    @Override
    public String getModel() {
        return "keyword-test";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private float[] vectorize(String text) {
        embeddedTexts.incrementAndGet();
        float[] vector = new float[getDimension()];
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (int i = 0; i < vocabulary.size(); i++) {
            if (lower.contains(vocabulary.get(i))) {
                vector[i] = 1.0f;
            }
        }
        vector[vocabulary.size()] = 0.1f;
        return vector;
    }
}
