package me.golemcore.memory.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Construction parameters of one agent memory engine.
 *
 * <p>
 * The thresholds are independent knobs: {@link #promotionReinforcementThreshold}
 * governs working to episodic promotion, {@link #semanticConsolidationThreshold}
 * governs semantic merging only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MemoryEngineConfig {

    @Builder.Default
    private int workingMemoryLimit = 20;

    @Builder.Default
    private int episodicRetentionDays = 30;

    /**
     * Merge cutoff. A value in (0, 1] is the similarity cutoff itself; a value
     * above 1 is read as a corroboration count {@code n} and yields the cutoff
     * {@code 1 - 1/n}.
     */
    @Builder.Default
    private double semanticConsolidationThreshold = 0.8;

    @Builder.Default
    private int proceduralMinExecutions = 3;

    @Builder.Default
    private int promotionReinforcementThreshold = 3;

    /** Fraction of the remaining distance to 1 that a reinforcement adds to attention. */
    @Builder.Default
    private double reinforcementBoost = 0.5;

    @Builder.Default
    private int contextFactLimit = 5;

    /** Minimum cosine score for semantic search hits; -1 disables the floor. */
    @Builder.Default
    private double semanticSearchMinScore = -1.0;

    @Builder.Default
    private Duration embeddingTimeout = Duration.ofSeconds(5);

    public static MemoryEngineConfig defaults() {
        return MemoryEngineConfig.builder().build();
    }

    public double resolveMergeCutoff() {
        if (semanticConsolidationThreshold > 1.0) {
            return 1.0 - (1.0 / semanticConsolidationThreshold);
        }
        return semanticConsolidationThreshold;
    }

    /**
     * Checks every parameter and reports all violations at once.
     *
     * @throws InvalidConfigurationException
     *             if any parameter is out of range
     */
    public MemoryEngineConfig validate() {
        List<String> errors = new ArrayList<>();
        if (workingMemoryLimit <= 0) {
            errors.add("workingMemoryLimit must be > 0, got " + workingMemoryLimit);
        }
        if (episodicRetentionDays < 0) {
            errors.add("episodicRetentionDays must be >= 0, got " + episodicRetentionDays);
        }
        if (Double.isNaN(semanticConsolidationThreshold) || Double.isInfinite(semanticConsolidationThreshold)
                || semanticConsolidationThreshold <= 0.0) {
            errors.add("semanticConsolidationThreshold must be in (0, 1] or a count > 1, got "
                    + semanticConsolidationThreshold);
        }
        if (proceduralMinExecutions < 0) {
            errors.add("proceduralMinExecutions must be >= 0, got " + proceduralMinExecutions);
        }
        if (promotionReinforcementThreshold <= 0) {
            errors.add("promotionReinforcementThreshold must be > 0, got " + promotionReinforcementThreshold);
        }
        if (Double.isNaN(reinforcementBoost) || reinforcementBoost < 0.0 || reinforcementBoost > 1.0) {
            errors.add("reinforcementBoost must be in [0, 1], got " + reinforcementBoost);
        }
        if (contextFactLimit <= 0) {
            errors.add("contextFactLimit must be > 0, got " + contextFactLimit);
        }
        if (Double.isNaN(semanticSearchMinScore) || semanticSearchMinScore < -1.0 || semanticSearchMinScore > 1.0) {
            errors.add("semanticSearchMinScore must be in [-1, 1], got " + semanticSearchMinScore);
        }
        if (embeddingTimeout == null || embeddingTimeout.isZero() || embeddingTimeout.isNegative()) {
            errors.add("embeddingTimeout must be positive, got " + embeddingTimeout);
        }
        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(String.join("; ", errors));
        }
        return this;
    }

    /**
     * Raised when an engine is constructed with out-of-range parameters.
     */
    public static class InvalidConfigurationException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public InvalidConfigurationException(String message) {
            super(message);
        }
    }
}
