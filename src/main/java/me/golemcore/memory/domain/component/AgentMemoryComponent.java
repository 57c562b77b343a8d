package me.golemcore.memory.domain.component;

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

import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.MemoryContext;
import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemorySearchResult;
import me.golemcore.memory.domain.model.MemorySortKey;
import me.golemcore.memory.domain.model.MemoryStats;
import me.golemcore.memory.domain.model.MemoryTier;
import me.golemcore.memory.port.outbound.MemoryEventListener;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Tiered memory of a single agent: working, episodic, semantic and procedural
 * knowledge with decay, promotion, merging and retrieval. Memory content is
 * assembled into a bounded context for prompt injection.
 */
public interface AgentMemoryComponent extends Component {

    @Override
    default String getComponentType() {
        return "memory";
    }

    String getAgentId();

    /**
     * Stores a copy of the item, assigning id and timestamp when absent.
     *
     * @return id of the stored item
     */
    String store(MemoryItem item);

    Optional<MemoryItem> retrieve(String id);

    List<MemoryItem> getAllByTier(MemoryTier tier);

    Optional<MemoryItem> getSkill(String skillName);

    /**
     * Forgets one item.
     *
     * @return the removed item, or empty if the id is unknown
     */
    Optional<MemoryItem> remove(String id);

    void clear();

    /**
     * Advances working memory decay by {@code ticks} steps.
     */
    void tick(int ticks);

    Optional<MemoryItem> reinforce(String id);

    ConsolidationReport consolidate();

    int mergeRelatedSemantics(String category);

    Optional<MemoryItem> recordExecution(String id, boolean success, long durationMs);

    List<MemoryItem> queryByParticipant(String participant);

    List<MemoryItem> queryByCategory(String category);

    List<MemoryItem> queryByPrerequisite(String skillName);

    List<MemoryItem> searchByTier(MemoryTier tier, String query, int limit, MemorySortKey sortKey);

    MemorySearchResult semanticSearch(String query, MemoryTier tier, int limit);

    MemorySearchResult search(String query, Collection<MemoryTier> tiers, int limit);

    MemoryContext assembleContext(String query);

    String formatContextForPrompt(MemoryContext context);

    MemoryStats getStats();

    String exportSnapshot();

    /**
     * Replaces the whole memory with the items of an exported snapshot.
     *
     * @return number of items restored
     */
    int importSnapshot(String json);

    /**
     * Registers an observer of memory events.
     *
     * @return handle that unregisters the listener when run
     */
    Runnable addListener(MemoryEventListener listener);
}
