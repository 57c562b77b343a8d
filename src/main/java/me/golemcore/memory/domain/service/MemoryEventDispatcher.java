package me.golemcore.memory.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryEvent;
import me.golemcore.memory.domain.model.MemoryEventType;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryTier;
import me.golemcore.memory.port.outbound.MemoryEventListener;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans memory events out to the registered listeners of one engine.
 */
@Slf4j
public class MemoryEventDispatcher {

    private final String agentId;
    private final Clock clock;
    private final List<MemoryEventListener> listeners = new CopyOnWriteArrayList<>();

    public MemoryEventDispatcher(String agentId, Clock clock, List<MemoryEventListener> initialListeners) {
        this.agentId = agentId;
        this.clock = clock;
        if (initialListeners != null) {
            listeners.addAll(initialListeners);
        }
    }

    /**
     * Registers a listener.
     *
     * @return handle that unregisters the listener when run
     */
    public Runnable addListener(MemoryEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public MemoryEvent event(MemoryEventType type, MemoryItem item, MemoryTier previousTier,
            Map<String, Object> attributes) {
        return new MemoryEvent(type, agentId,
                item != null ? item.getId() : null,
                item != null ? item.getTier() : null,
                previousTier,
                clock.instant(),
                attributes);
    }

    public MemoryEvent event(MemoryEventType type, MemoryItem item) {
        return event(type, item, null, Map.of());
    }

    /**
     * Delivers events in order. Must be called outside the engine lock.
     */
    public void dispatch(List<MemoryEvent> events) {
        if (events == null || events.isEmpty() || listeners.isEmpty()) {
            return;
        }
        for (MemoryEvent event : new ArrayList<>(events)) {
            for (MemoryEventListener listener : listeners) {
                try {
                    listener.onMemoryEvent(event);
                } catch (RuntimeException e) {
                    log.warn("[MemoryEvents] Listener {} failed on {}: {}",
                            listener.getClass().getSimpleName(), event.type(), e.getMessage());
                }
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
