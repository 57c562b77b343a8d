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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryEngineConfig;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.MemoryEventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Builds memory engines owned by individual agents.
 *
 * <p>
 * Engines share no state with each other: each gets its own store, lock and
 * embedding cache. The configured embedding provider and the Spring-registered
 * event listeners are attached to every engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentMemoryEngineFactory {

    private final MemoryEngineProperties properties;
    private final EmbeddingPort embeddingPort;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final List<MemoryEventListener> eventListeners;

    /**
     * Engine configured from {@code memory.engine.*}.
     */
    public AgentMemoryEngine create(String agentId) {
        return create(agentId, properties.toEngineConfig());
    }

    /**
     * @throws MemoryEngineConfig.InvalidConfigurationException
     *             if the configuration is out of range
     */
    public AgentMemoryEngine create(String agentId, MemoryEngineConfig config) {
        AgentMemoryEngine engine = new AgentMemoryEngine(agentId, config, embeddingPort, clock, objectMapper,
                eventListeners);
        log.info("[MemoryEngine] Created memory engine for agent {}", agentId);
        return engine;
    }
}
