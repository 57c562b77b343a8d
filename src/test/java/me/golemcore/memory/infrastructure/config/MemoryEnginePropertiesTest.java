package me.golemcore.memory.infrastructure.config;

import me.golemcore.memory.domain.model.MemoryEngineConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MemoryEnginePropertiesTest {

    @Test
    void shouldMatchEngineDefaults() {
        MemoryEngineConfig fromProperties = new MemoryEngineProperties().toEngineConfig();

        assertEquals(MemoryEngineConfig.defaults(), fromProperties);
    }

    @Test
    void shouldCarryOverridesIntoEngineConfig() {
        MemoryEngineProperties properties = new MemoryEngineProperties();
        properties.getEngine().setWorkingMemoryLimit(7);
        properties.getEngine().setSemanticConsolidationThreshold(3);
        properties.getEngine().setEmbeddingTimeout(Duration.ofMillis(750));

        MemoryEngineConfig config = properties.toEngineConfig();

        assertEquals(7, config.getWorkingMemoryLimit());
        assertEquals(3.0, config.getSemanticConsolidationThreshold());
        assertEquals(Duration.ofMillis(750), config.getEmbeddingTimeout());
    }

    @Test
    void shouldDefaultToHashingProvider() {
        assertEquals("hashing", new MemoryEngineProperties().getEmbedding().getProvider());
    }
}
