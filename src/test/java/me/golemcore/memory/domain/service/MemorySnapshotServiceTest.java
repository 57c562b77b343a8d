package me.golemcore.memory.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryRelation;
import me.golemcore.memory.domain.model.MemorySnapshot;
import me.golemcore.memory.domain.model.MemoryTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemorySnapshotServiceTest {

    private MemorySnapshotService service;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        service = new MemorySnapshotService(objectMapper);
    }

    @Test
    void shouldWriteTiersAsLowercaseValues() {
        MemorySnapshot snapshot = MemorySnapshot.builder()
                .agentId("agent-1")
                .exportedAt(Instant.parse("2026-03-01T12:00:00Z"))
                .items(List.of(MemoryItem.builder().id("w-1").tier(MemoryTier.WORKING).attention(0.5).build()))
                .build();

        String json = service.write(snapshot);

        assertTrue(json.contains("\"tier\":\"working\""));
        assertTrue(json.contains("\"exportedAt\":\"2026-03-01T12:00:00Z\""));
    }

    @Test
    void shouldReadBackItemsWithRelations() {
        MemoryItem fact = MemoryItem.builder()
                .id("s-1")
                .timestamp(Instant.parse("2026-02-01T08:00:00Z"))
                .tier(MemoryTier.SEMANTIC)
                .content("Redis caches sessions")
                .category("infrastructure")
                .confidence(0.8)
                .relations(new ArrayList<>(List.of(MemoryRelation.of("part_of", "platform"))))
                .build();

        MemorySnapshot restored = service.read(service.write(MemorySnapshot.builder()
                .agentId("agent-1")
                .items(List.of(fact))
                .build()));

        MemoryItem item = restored.getItems().get(0);
        assertEquals("agent-1", restored.getAgentId());
        assertEquals(fact.getTimestamp(), item.getTimestamp());
        assertEquals(List.of(MemoryRelation.of("part_of", "platform")), item.getRelations());
        assertEquals(0.8, item.getConfidence());
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThrows(MemorySnapshotService.InvalidSnapshotException.class, () -> service.read("{not-json"));
        assertThrows(MemorySnapshotService.InvalidSnapshotException.class, () -> service.read(" "));
    }

    @Test
    void shouldRejectUnsupportedVersion() {
        assertThrows(MemorySnapshotService.InvalidSnapshotException.class,
                () -> service.read("{\"version\":99,\"items\":[]}"));
    }

    @Test
    void shouldRejectItemsWithoutTier() {
        assertThrows(MemorySnapshotService.InvalidSnapshotException.class,
                () -> service.read("{\"version\":1,\"items\":[{\"id\":\"x\"}]}"));
    }

    @Test
    void shouldRejectUnknownTier() {
        assertThrows(MemorySnapshotService.InvalidSnapshotException.class,
                () -> service.read("{\"version\":1,\"items\":[{\"id\":\"x\",\"tier\":\"longterm\"}]}"));
    }
}
