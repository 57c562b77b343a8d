package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.MemoryEvent;
import me.golemcore.memory.domain.model.MemoryEventType;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryTier;
import me.golemcore.memory.port.outbound.MemoryEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class MemoryEventDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MemoryEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new MemoryEventDispatcher("agent-7", Clock.fixed(NOW, ZoneOffset.UTC), null);
    }

    @Test
    void shouldBuildEventFromItem() {
        MemoryItem item = MemoryItem.builder().id("m-1").tier(MemoryTier.SEMANTIC).build();

        MemoryEvent event = dispatcher.event(MemoryEventType.STORED, item, null, Map.of("replaced", false));

        assertEquals("agent-7", event.agentId());
        assertEquals("m-1", event.memoryId());
        assertEquals(MemoryTier.SEMANTIC, event.tier());
        assertNull(event.previousTier());
        assertEquals(NOW, event.timestamp());
        assertEquals(false, event.attributes().get("replaced"));
    }

    @Test
    void shouldIsolateFailingListener() {
        MemoryEventListener failing = mock(MemoryEventListener.class);
        doThrow(new IllegalStateException("listener down")).when(failing).onMemoryEvent(any());
        List<MemoryEvent> received = new ArrayList<>();
        dispatcher.addListener(failing);
        dispatcher.addListener(received::add);

        assertDoesNotThrow(() -> dispatcher.dispatch(List.of(dispatcher.event(MemoryEventType.CLEARED, null))));

        assertEquals(1, received.size());
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        MemoryEventListener listener = mock(MemoryEventListener.class);
        Runnable unsubscribe = dispatcher.addListener(listener);

        unsubscribe.run();
        dispatcher.dispatch(List.of(dispatcher.event(MemoryEventType.CLEARED, null)));

        verify(listener, never()).onMemoryEvent(any());
        assertEquals(0, dispatcher.listenerCount());
    }

    @Test
    void shouldDeliverEventsInOrder() {
        List<MemoryEventType> received = new ArrayList<>();
        dispatcher.addListener(event -> received.add(event.type()));

        dispatcher.dispatch(List.of(
                dispatcher.event(MemoryEventType.STORED, null),
                dispatcher.event(MemoryEventType.EVICTED, null)));

        assertEquals(List.of(MemoryEventType.STORED, MemoryEventType.EVICTED), received);
    }
}
