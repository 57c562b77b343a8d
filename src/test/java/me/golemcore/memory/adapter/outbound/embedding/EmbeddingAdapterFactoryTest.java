package me.golemcore.memory.adapter.outbound.embedding;

import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EmbeddingAdapterFactoryTest {

    private MemoryEngineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MemoryEngineProperties();
    }

    // ===== init() =====

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getEmbedding().setProvider("openai");
        EmbeddingProviderAdapter openai = createMockAdapter("openai", true);
        EmbeddingProviderAdapter hashing = createMockAdapter("hashing", true);

        EmbeddingAdapterFactory factory = new EmbeddingAdapterFactory(properties, List.of(openai, hashing));
        factory.init();

        assertEquals("openai", factory.getProviderId());
        assertSame(openai, factory.getActiveAdapter());
    }

    @Test
    void shouldFallbackToHashingWhenProviderNotFound() {
        properties.getEmbedding().setProvider("nonexistent");
        EmbeddingProviderAdapter hashing = createMockAdapter("hashing", true);

        EmbeddingAdapterFactory factory = new EmbeddingAdapterFactory(properties, List.of(hashing));
        factory.init();

        assertEquals("hashing", factory.getProviderId());
    }

    @Test
    void shouldDisableEmbeddingsForNoneProvider() {
        properties.getEmbedding().setProvider("none");
        EmbeddingProviderAdapter hashing = createMockAdapter("hashing", true);

        EmbeddingAdapterFactory factory = new EmbeddingAdapterFactory(properties, List.of(hashing));
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
        assertEquals(0, factory.getDimension());
        CompletableFuture<float[]> future = factory.embed("text");
        assertThrows(ExecutionException.class, future::get);
    }

    // ===== delegation =====

    @Test
    void shouldDelegateToActiveAdapter() {
        properties.getEmbedding().setProvider("hashing");
        EmbeddingProviderAdapter hashing = createMockAdapter("hashing", true);
        when(hashing.embed("hello")).thenReturn(CompletableFuture.completedFuture(new float[] { 1f }));
        when(hashing.getDimension()).thenReturn(64);
        when(hashing.getModel()).thenReturn("feature-hashing-64");

        EmbeddingAdapterFactory factory = new EmbeddingAdapterFactory(properties, List.of(hashing));
        factory.init();

        assertArrayEquals(new float[] { 1f }, factory.embed("hello").join());
        assertEquals(64, factory.getDimension());
        assertEquals("feature-hashing-64", factory.getModel());
        assertTrue(factory.isAvailable());
        verify(hashing).embed("hello");
    }

    @Test
    void shouldReportUnavailableWhenActiveAdapterIsUnavailable() {
        properties.getEmbedding().setProvider("openai");
        EmbeddingProviderAdapter openai = createMockAdapter("openai", false);

        EmbeddingAdapterFactory factory = new EmbeddingAdapterFactory(properties, List.of(openai));
        factory.init();

        assertFalse(factory.isAvailable());
    }

    private EmbeddingProviderAdapter createMockAdapter(String providerId, boolean available) {
        EmbeddingProviderAdapter adapter = mock(EmbeddingProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        return adapter;
    }
}
