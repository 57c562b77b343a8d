package me.golemcore.memory.infrastructure.config;

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

import lombok.Data;
import me.golemcore.memory.domain.model.MemoryEngineConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Memory engine configuration bound from application.properties.
 *
 * <p>
 * Organized under the {@code memory.*} prefix:
 * <ul>
 * <li>{@link EngineProperties} - defaults for every engine built by the
 * factory</li>
 * <li>{@link EmbeddingProperties} - embedding provider selection and
 * credentials</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryEngineProperties {

    private EngineProperties engine = new EngineProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();

    public MemoryEngineConfig toEngineConfig() {
        return MemoryEngineConfig.builder()
                .workingMemoryLimit(engine.getWorkingMemoryLimit())
                .episodicRetentionDays(engine.getEpisodicRetentionDays())
                .semanticConsolidationThreshold(engine.getSemanticConsolidationThreshold())
                .proceduralMinExecutions(engine.getProceduralMinExecutions())
                .promotionReinforcementThreshold(engine.getPromotionReinforcementThreshold())
                .reinforcementBoost(engine.getReinforcementBoost())
                .contextFactLimit(engine.getContextFactLimit())
                .semanticSearchMinScore(engine.getSemanticSearchMinScore())
                .embeddingTimeout(engine.getEmbeddingTimeout())
                .build();
    }

    @Data
    public static class EngineProperties {
        private int workingMemoryLimit = 20;
        private int episodicRetentionDays = 30;
        private double semanticConsolidationThreshold = 0.8;
        private int proceduralMinExecutions = 3;
        private int promotionReinforcementThreshold = 3;
        private double reinforcementBoost = 0.5;
        private int contextFactLimit = 5;
        private double semanticSearchMinScore = -1.0;
        private Duration embeddingTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class EmbeddingProperties {
        /** Provider id: {@code hashing}, {@code openai} or {@code none}. */
        private String provider = "hashing";
        private String apiKey;
        private String model;
        private String baseUrl;
        private int dimensions = 256;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
