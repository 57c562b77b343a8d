package me.golemcore.memory.domain.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.MemoryEngineConfig;
import me.golemcore.memory.domain.model.MemoryEvent;
import me.golemcore.memory.domain.model.MemoryEventType;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryRelation;
import me.golemcore.memory.domain.model.MemorySearchResult;
import me.golemcore.memory.domain.model.MemoryStats;
import me.golemcore.memory.domain.model.MemoryTier;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentMemoryEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private Clock clock;
    private ObjectMapper objectMapper;
    private List<MemoryEvent> events;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        events = Collections.synchronizedList(new ArrayList<>());
    }

    @Test
    void shouldRejectInvalidConfigurationAtConstruction() {
        MemoryEngineConfig invalid = MemoryEngineConfig.builder().workingMemoryLimit(-1).build();

        assertThrows(MemoryEngineConfig.InvalidConfigurationException.class,
                () -> new AgentMemoryEngine("agent", invalid, null, clock, objectMapper, List.of()));
        assertThrows(MemoryEngineConfig.InvalidConfigurationException.class,
                () -> new AgentMemoryEngine(" ", MemoryEngineConfig.defaults(), null, clock, objectMapper,
                        List.of()));
    }

    @Test
    void shouldIsolateEnginesOfDifferentAgents() {
        AgentMemoryEngine first = engine(MemoryEngineConfig.defaults(), null);
        AgentMemoryEngine second = new AgentMemoryEngine("agent-2", MemoryEngineConfig.defaults(), null, clock,
                objectMapper, List.of());

        String id = first.store(fact("Redis caches sessions", "infrastructure"));

        assertTrue(first.retrieve(id).isPresent());
        assertTrue(second.retrieve(id).isEmpty());
        assertEquals(0, second.getStats().getTotal());
    }

    @Test
    void shouldKeepOnlyHighestAttentionItemsWithinLimit() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.builder().workingMemoryLimit(10).build(), null);
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            ids.add(engine.store(MemoryItem.builder()
                    .tier(MemoryTier.WORKING)
                    .content("observation " + i)
                    .attention(0.1 + i * 0.05)
                    .build()));
        }

        assertEquals(10, engine.getAllByTier(MemoryTier.WORKING).size());
        for (int i = 0; i < 5; i++) {
            assertTrue(engine.retrieve(ids.get(i)).isEmpty());
        }
        assertEquals(5, engine.getStats().getEvictions());
        assertEquals(5, events.stream().filter(event -> event.type() == MemoryEventType.EVICTED).count());
    }

    @Test
    void shouldDecayThenPromoteReinforcedWorkingItem() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.builder().promotionReinforcementThreshold(3).build(),
                null);
        String id = engine.store(MemoryItem.builder()
                .tier(MemoryTier.WORKING)
                .content("Customer asked about invoices")
                .attention(0.9)
                .decay(0.01)
                .build());

        engine.tick(10);
        double decayed = engine.retrieve(id).orElseThrow().getAttention();
        assertEquals(0.9 * Math.pow(0.99, 10), decayed, 1e-9);

        engine.reinforce(id);
        engine.reinforce(id);
        engine.reinforce(id);
        double reinforced = engine.retrieve(id).orElseThrow().getAttention();
        assertTrue(reinforced > decayed);

        ConsolidationReport report = engine.consolidate();

        assertEquals(1, report.getPromotedCount());
        assertTrue(engine.getAllByTier(MemoryTier.WORKING).isEmpty());
        List<MemoryItem> episodes = engine.getAllByTier(MemoryTier.EPISODIC);
        assertEquals(1, episodes.size());
        assertEquals(reinforced, episodes.get(0).getImportance(), 1e-9);
        assertEquals(1, engine.getStats().getPromotions());
    }

    @Test
    void shouldIgnoreReinforceOfUnknownItem() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);

        assertTrue(engine.reinforce("missing").isEmpty());
    }

    @Test
    void shouldTrackSkillExecutions() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        String id = engine.store(MemoryItem.builder()
                .tier(MemoryTier.PROCEDURAL)
                .skillName("deploy")
                .steps(new ArrayList<>(List.of("build", "push", "rollout")))
                .build());

        engine.recordExecution(id, true, 5000);
        engine.recordExecution(id, true, 3000);
        MemoryItem skill = engine.recordExecution(id, false, 8000).orElseThrow();

        assertEquals(3, skill.getExecutionCount());
        assertEquals(0.667, skill.getSuccessRate(), 0.001);
        assertEquals(5333.0, skill.getAverageExecutionTime(), 1.0);
        assertEquals(skill.getSuccessRate(), engine.getSkill("DEPLOY").orElseThrow().getSuccessRate());
    }

    @Test
    void shouldKeepExecutionStatsWhenSkillIsStoredAgain() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        String id = engine.store(MemoryItem.builder()
                .tier(MemoryTier.PROCEDURAL)
                .skillName("deploy")
                .steps(new ArrayList<>(List.of("build", "push")))
                .build());
        for (int i = 0; i < 5; i++) {
            engine.recordExecution(id, true, 1000);
        }

        String restoredId = engine.store(MemoryItem.builder()
                .tier(MemoryTier.PROCEDURAL)
                .skillName("Deploy")
                .steps(new ArrayList<>(List.of("build", "test", "push")))
                .build());

        MemoryItem skill = engine.retrieve(restoredId).orElseThrow();
        assertEquals(id, restoredId);
        assertEquals(List.of("build", "test", "push"), skill.getSteps());
        assertEquals(5, skill.getExecutionCount());
        assertEquals(1.0, skill.getSuccessRate());
        assertEquals(1000.0, skill.getAverageExecutionTime(), 0.001);
    }

    @Test
    void shouldReturnEmptyWhenRecordingExecutionOfNonSkill() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        String factId = engine.store(fact("Not a skill", "general"));

        assertTrue(engine.recordExecution("missing", true, 10).isEmpty());
        assertTrue(engine.recordExecution(factId, true, 10).isEmpty());
    }

    @Test
    void shouldNotLeakStateThroughReturnedItems() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        String id = engine.store(MemoryItem.builder().tier(MemoryTier.PROCEDURAL).skillName("lint").build());

        MemoryItem copy = engine.retrieve(id).orElseThrow();
        copy.setExecutionCount(50);
        copy.setSuccessRate(1.0);

        MemoryItem stored = engine.retrieve(id).orElseThrow();
        assertEquals(0, stored.getExecutionCount());
        assertEquals(0.0, stored.getSuccessRate());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNotShareNestedMetadataWithCallers() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        List<String> participants = new ArrayList<>(List.of("alice"));
        String id = engine.store(MemoryItem.builder()
                .tier(MemoryTier.WORKING)
                .content("standup notes")
                .metadata(new LinkedHashMap<>(Map.of(MemoryItem.PARTICIPANTS, participants)))
                .build());

        participants.add("mallory");
        ((List<String>) engine.retrieve(id).orElseThrow().getMetadata().get(MemoryItem.PARTICIPANTS)).add("eve");

        assertEquals(List.of("alice"), engine.retrieve(id).orElseThrow().getMetadata().get(MemoryItem.PARTICIPANTS));
    }

    @Test
    void shouldNotMutateCallerItemOnStore() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        MemoryItem input = MemoryItem.builder().tier(MemoryTier.WORKING).attention(3.0).build();

        String id = engine.store(input);

        assertEquals(3.0, input.getAttention());
        assertEquals(null, input.getId());
        assertEquals(1.0, engine.retrieve(id).orElseThrow().getAttention());
    }

    @Test
    void shouldFilterFactsByCategory() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        engine.store(fact("PostgreSQL is the primary database", "infrastructure"));
        engine.store(fact("Redis caches sessions", "infrastructure"));
        engine.store(fact("Retros happen biweekly", "process"));

        List<MemoryItem> result = engine.queryByCategory("infrastructure");

        assertEquals(2, result.size());
        assertTrue(result.stream().allMatch(item -> "infrastructure".equals(item.getCategory())));
    }

    @Test
    void shouldAcceptSortKeyAndTierNames() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        engine.store(MemoryItem.builder().tier(MemoryTier.EPISODIC).content("minor").importance(0.1).build());
        engine.store(MemoryItem.builder().tier(MemoryTier.EPISODIC).content("major").importance(0.9).build());

        List<MemoryItem> result = engine.searchByTierNamed(MemoryTier.EPISODIC, "", 1, "importance");

        assertEquals("major", result.get(0).getContent());
        assertEquals(2, engine.getAllByTier("episodic").size());
        assertThrows(IllegalArgumentException.class,
                () -> engine.searchByTierNamed(MemoryTier.EPISODIC, "", 1, "size"));
    }

    @Test
    void shouldUseTierDefaultOrderWhenSortKeyIsNull() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        engine.store(MemoryItem.builder().tier(MemoryTier.WORKING).content("faint").attention(0.2).build());
        engine.store(MemoryItem.builder().tier(MemoryTier.WORKING).content("vivid").attention(0.9).build());

        List<MemoryItem> byDefault = engine.searchByTier(MemoryTier.WORKING, "", 2, null);
        List<MemoryItem> byName = engine.searchByTierNamed(MemoryTier.WORKING, "", 2, null);

        assertEquals(List.of("vivid", "faint"), byDefault.stream().map(MemoryItem::getContent).toList());
        assertEquals(List.of("vivid", "faint"), byName.stream().map(MemoryItem::getContent).toList());
    }

    @Test
    void shouldReportDegradedSearchWhenProviderFails() {
        EmbeddingPort failing = mock(EmbeddingPort.class);
        when(failing.isAvailable()).thenReturn(true);
        when(failing.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("provider offline")));
        AgentMemoryEngine engine = engine(MemoryEngineConfig.builder()
                .embeddingTimeout(Duration.ofMillis(200))
                .build(), failing);
        engine.store(fact("Redis caches sessions", "infrastructure"));

        MemorySearchResult result = engine.semanticSearch("redis", MemoryTier.SEMANTIC, 3);

        assertTrue(result.isDegraded());
        assertEquals(1, result.getItems().size());
        assertTrue(engine.assembleContext("redis").isDegraded());
    }

    @Test
    void shouldMergeRelatedFactsThroughEngine() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        MemoryItem first = fact("Redis listens on port 6379", "infrastructure");
        first.setRelations(new ArrayList<>(List.of(MemoryRelation.of("uses", "tcp"))));
        MemoryItem second = fact("Redis listens on port 6379", "infrastructure");
        second.setRelations(new ArrayList<>(List.of(MemoryRelation.of("part_of", "cache"))));
        engine.store(first);
        engine.store(second);

        assertEquals(1, engine.mergeRelatedSemantics("infrastructure"));

        List<MemoryItem> facts = engine.queryByCategory("infrastructure");
        assertEquals(1, facts.size());
        assertEquals(2, facts.get(0).getRelations().size());
        assertEquals(1, engine.getStats().getMerges());
    }

    @Test
    void shouldFormatAssembledContext() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), new KeywordEmbeddingPort("redis"));
        engine.store(MemoryItem.builder().tier(MemoryTier.WORKING).content("Looking at cache metrics").build());
        engine.store(fact("Redis caches sessions", "infrastructure"));

        String prompt = engine.formatContextForPrompt(engine.assembleContext("redis"));

        assertTrue(prompt.contains("Looking at cache metrics"));
        assertTrue(prompt.contains("Redis caches sessions"));
    }

    @Test
    void shouldRoundTripSnapshotPreservingIdsAndTimestamps() {
        AgentMemoryEngine source = engine(MemoryEngineConfig.defaults(), null);
        String factId = source.store(fact("Redis caches sessions", "infrastructure"));
        String episodeId = source.store(MemoryItem.builder()
                .tier(MemoryTier.EPISODIC)
                .timestamp(NOW.minusSeconds(7200))
                .content("Outage review")
                .participants(new LinkedHashSet<>(Set.of("alice")))
                .build());
        String skillId = source.store(MemoryItem.builder().tier(MemoryTier.PROCEDURAL).skillName("deploy").build());
        source.recordExecution(skillId, true, 1200);

        AgentMemoryEngine target = new AgentMemoryEngine("agent-restored", MemoryEngineConfig.defaults(), null,
                clock, objectMapper, List.of());
        int restored = target.importSnapshot(source.exportSnapshot());

        assertEquals(3, restored);
        assertEquals(source.retrieve(factId).orElseThrow(), target.retrieve(factId).orElseThrow());
        assertEquals(NOW.minusSeconds(7200), target.retrieve(episodeId).orElseThrow().getTimestamp());
        assertEquals(1, target.getSkill("deploy").orElseThrow().getExecutionCount());
        assertEquals(List.of("alice"), target.queryByParticipant("alice").stream()
                .flatMap(item -> item.getParticipants().stream()).toList());
    }

    @Test
    void shouldKeepStateWhenSnapshotIsInvalid() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        engine.store(fact("Redis caches sessions", "infrastructure"));

        assertThrows(IllegalArgumentException.class, () -> engine.importSnapshot("{broken"));
        assertEquals(1, engine.getStats().getSemantic());
    }

    @Test
    void shouldRemoveAndClear() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        String id = engine.store(fact("Temporary fact", "general"));
        engine.store(MemoryItem.builder().tier(MemoryTier.WORKING).content("scratch").build());

        assertTrue(engine.remove(id).isPresent());
        assertTrue(engine.remove(id).isEmpty());

        engine.clear();

        MemoryStats stats = engine.getStats();
        assertEquals(0, stats.getTotal());
        assertEquals(2, stats.getTotalStored());
        assertTrue(events.stream().anyMatch(event -> event.type() == MemoryEventType.REMOVED));
        assertEquals(MemoryEventType.CLEARED, events.get(events.size() - 1).type());
    }

    @Test
    void shouldSurviveFailingListener() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        engine.addListener(event -> {
            throw new IllegalStateException("observer crashed");
        });

        String id = engine.store(fact("Still stored", "general"));

        assertTrue(engine.retrieve(id).isPresent());
        assertEquals(MemoryEventType.STORED, events.get(0).type());
    }

    @Test
    void shouldAllowListenersToReadEngineDuringDelivery() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);
        List<Integer> observedTotals = new ArrayList<>();
        engine.addListener(event -> observedTotals.add(engine.getStats().getTotal()));

        engine.store(fact("First", "general"));
        engine.store(fact("Second", "general"));

        assertEquals(List.of(1, 2), observedTotals);
    }

    @Test
    void shouldStayConsistentUnderConcurrentWritersAndReaders() throws Exception {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.builder().workingMemoryLimit(50).build(), null);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int writer = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        engine.store(MemoryItem.builder()
                                .tier(MemoryTier.WORKING)
                                .content("writer " + writer + " item " + i)
                                .attention((i % 10) / 10.0)
                                .build());
                        engine.tick(1);
                    }
                }));
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        int size = engine.getAllByTier(MemoryTier.WORKING).size();
                        assertTrue(size <= 50);
                        engine.searchByTier(MemoryTier.WORKING, "writer", 5, null);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        MemoryStats stats = engine.getStats();
        assertEquals(50, stats.getWorking());
        assertEquals(400, stats.getTotalStored());
        assertEquals(350, stats.getEvictions());
    }

    @Test
    void shouldAssignDistinctIdsToEveryStore() {
        AgentMemoryEngine engine = engine(MemoryEngineConfig.defaults(), null);

        String first = engine.store(fact("a", "general"));
        String second = engine.store(fact("a", "general"));

        assertNotEquals(first, second);
        assertFalse(engine.getAllByTier(MemoryTier.SEMANTIC).isEmpty());
    }

    private AgentMemoryEngine engine(MemoryEngineConfig config, EmbeddingPort port) {
        return new AgentMemoryEngine("agent-1", config, port, clock, objectMapper, List.of(events::add));
    }

    private MemoryItem fact(String content, String category) {
        return MemoryItem.builder()
                .tier(MemoryTier.SEMANTIC)
                .content(content)
                .category(category)
                .confidence(0.7)
                .build();
    }
}
