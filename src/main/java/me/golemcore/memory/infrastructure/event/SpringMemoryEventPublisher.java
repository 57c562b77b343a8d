package me.golemcore.memory.infrastructure.event;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryEvent;
import me.golemcore.memory.port.outbound.MemoryEventListener;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Republishes memory events through Spring's ApplicationEventPublisher.
 *
 * <p>
 * Attached to every engine built by the factory; observers receive events by
 * annotating methods with {@code @EventListener}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringMemoryEventPublisher implements MemoryEventListener {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void onMemoryEvent(MemoryEvent event) {
        log.trace("[MemoryEvents] Publishing {} for agent {}", event.type(), event.agentId());
        eventPublisher.publishEvent(event);
    }
}
