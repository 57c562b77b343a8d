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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryContext;
import me.golemcore.memory.domain.model.MemoryEngineConfig;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryRelation;
import me.golemcore.memory.domain.model.MemorySearchResult;
import me.golemcore.memory.domain.model.MemorySortKey;
import me.golemcore.memory.domain.model.MemoryTier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Builds the cross-tier context snapshot for a query and renders it as prompt
 * text.
 */
@Slf4j
@RequiredArgsConstructor
public class MemoryContextAssembler {

    private static final String NONE = "- (none)";

    private final TieredMemoryStore store;
    private final ReadWriteLock lock;
    private final MemoryRetrievalService retrievalService;
    private final MemoryEngineConfig config;

    public MemoryContext assembleContext(String query) {
        List<MemoryItem> working;
        List<MemoryItem> procedural;
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            working = store.getAllByTier(MemoryTier.WORKING);
            procedural = store.getAllByTier(MemoryTier.PROCEDURAL);
        } finally {
            readLock.unlock();
        }

        working = working.stream()
                .sorted(descending(MemorySortKey.ATTENTION))
                .toList();

        MemorySearchResult facts = retrievalService.semanticSearch(query, MemoryTier.SEMANTIC,
                config.getContextFactLimit());

        List<MemoryItem> skills = availableSkills(procedural).stream()
                .sorted(descending(MemorySortKey.SUCCESS_RATE))
                .toList();

        log.debug("[MemoryContext] Assembled context: {} working, {} facts ({}), {} skills", working.size(),
                facts.getResults().size(), facts.getMode(), skills.size());

        return MemoryContext.builder()
                .query(query)
                .workingContext(new ArrayList<>(working))
                .relevantFacts(facts.getItems())
                .availableSkills(new ArrayList<>(skills))
                .factsRetrievalMode(facts.getMode())
                .degraded(facts.isDegraded())
                .build();
    }

    /**
     * Skills executed at least {@code proceduralMinExecutions} times, plus skills
     * whose non-empty prerequisites are all satisfied by other available skills,
     * resolved to a fixpoint.
     */
    List<MemoryItem> availableSkills(Collection<MemoryItem> procedural) {
        List<MemoryItem> available = new ArrayList<>();
        Set<String> availableNames = new HashSet<>();
        List<MemoryItem> pending = new ArrayList<>();

        for (MemoryItem skill : procedural) {
            int executions = skill.getExecutionCount() != null ? skill.getExecutionCount() : 0;
            if (executions >= config.getProceduralMinExecutions()) {
                available.add(skill);
                availableNames.add(skillKey(skill.getSkillName()));
            } else if (skill.getPrerequisites() != null && !skill.getPrerequisites().isEmpty()) {
                pending.add(skill);
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (MemoryItem skill : List.copyOf(pending)) {
                boolean satisfied = skill.getPrerequisites().stream()
                        .allMatch(prerequisite -> availableNames.contains(skillKey(prerequisite)));
                if (satisfied) {
                    pending.remove(skill);
                    available.add(skill);
                    availableNames.add(skillKey(skill.getSkillName()));
                    changed = true;
                }
            }
        }
        return available;
    }

    /**
     * Renders the context in a fixed section order. Every field of every included
     * item is written; numbers use {@link Locale#ROOT} and metadata keys are
     * sorted, so equal contexts render to equal strings.
     */
    public String formatContextForPrompt(MemoryContext context) {
        StringBuilder sb = new StringBuilder();
        appendSection(sb, "## Working Memory", context != null ? context.getWorkingContext() : null);
        appendSection(sb, "## Relevant Facts", context != null ? context.getRelevantFacts() : null);
        appendSection(sb, "## Available Skills", context != null ? context.getAvailableSkills() : null);
        return sb.toString().trim();
    }

    private void appendSection(StringBuilder sb, String heading, List<MemoryItem> items) {
        sb.append(heading).append('\n');
        if (items == null || items.isEmpty()) {
            sb.append(NONE).append("\n\n");
            return;
        }
        for (MemoryItem item : items) {
            appendItem(sb, item);
        }
        sb.append('\n');
    }

    private void appendItem(StringBuilder sb, MemoryItem item) {
        sb.append("- [").append(item.getId()).append("] ").append(singleLine(item.getContent())).append('\n');
        field(sb, "tier", item.getTier());
        field(sb, "timestamp", item.getTimestamp());
        field(sb, "source", item.getSource());

        if (item.getTier() != null) {
            switch (item.getTier()) {
            case WORKING -> {
                number(sb, "attention", item.getAttention());
                number(sb, "decay", item.getDecay());
            }
            case EPISODIC -> {
                field(sb, "eventType", item.getEventType());
                field(sb, "participants", joined(item.getParticipants()));
                number(sb, "emotionalValence", item.getEmotionalValence());
                number(sb, "importance", item.getImportance());
            }
            case SEMANTIC -> {
                field(sb, "category", item.getCategory());
                number(sb, "confidence", item.getConfidence());
                field(sb, "relations", relations(item.getRelations()));
            }
            case PROCEDURAL -> {
                field(sb, "skillName", item.getSkillName());
                field(sb, "steps", steps(item.getSteps()));
                field(sb, "prerequisites", joined(item.getPrerequisites()));
                field(sb, "executionCount", item.getExecutionCount());
                number(sb, "successRate", item.getSuccessRate());
                number(sb, "averageExecutionTime", item.getAverageExecutionTime());
            }
            }
        }
        field(sb, "metadata", metadata(item.getMetadata()));
    }

    private static void field(StringBuilder sb, String name, Object value) {
        sb.append("  ").append(name).append(": ").append(value != null ? singleLine(value.toString()) : "")
                .append('\n');
    }

    private static void number(StringBuilder sb, String name, Double value) {
        field(sb, name, value != null ? String.format(Locale.ROOT, "%.3f", value) : null);
    }

    private static String joined(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return "";
        }
        return String.join(", ", values);
    }

    private static String steps(List<String> steps) {
        if (steps == null || steps.isEmpty()) {
            return "";
        }
        List<String> numbered = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            numbered.add((i + 1) + ". " + steps.get(i));
        }
        return String.join(" ", numbered);
    }

    private static String relations(List<MemoryRelation> relations) {
        if (relations == null || relations.isEmpty()) {
            return "";
        }
        List<String> rendered = new ArrayList<>();
        for (MemoryRelation relation : relations) {
            rendered.add(relation.type() + " -> " + relation.target());
        }
        return String.join(", ", rendered);
    }

    private static String metadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : new TreeMap<>(metadata).entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(metadataValue(entry.getValue()));
            first = false;
        }
        return sb.append('}').toString();
    }

    private static String metadataValue(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return String.format(Locale.ROOT, "%.3f", ((Number) value).doubleValue());
        }
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> sorted = new TreeMap<>();
            nested.forEach((key, nestedValue) -> sorted.put(String.valueOf(key), nestedValue));
            return metadata(sorted);
        }
        return String.valueOf(value);
    }

    private static String singleLine(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\r', ' ').replace('\n', ' ').trim();
    }

    private static String skillKey(String skillName) {
        return skillName != null ? skillName.trim().toLowerCase(Locale.ROOT) : "";
    }

    private static Comparator<MemoryItem> descending(MemorySortKey key) {
        return Comparator.comparingDouble(key::sortValue)
                .reversed()
                .thenComparing(MemoryItem::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));
    }
}
