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

import java.util.ArrayList;
import java.util.List;

/**
 * Ranked similarity search outcome.
 *
 * <p>
 * A provider failure never surfaces as an exception: the result is ranked
 * lexically instead and {@link #degraded} is set, with the cause in
 * {@link #diagnostic}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemorySearchResult {

    private String query;

    @Builder.Default
    private List<MemoryScoredItem> results = new ArrayList<>();

    private RetrievalMode mode;
    private boolean degraded;
    private String diagnostic;
    private int totalSearched;
    private long searchTimeMs;

    public List<MemoryItem> getItems() {
        List<MemoryItem> items = new ArrayList<>();
        for (MemoryScoredItem scored : results) {
            if (scored.getItem() != null) {
                items.add(scored.getItem());
            }
        }
        return items;
    }

    public List<Double> getScores() {
        return results.stream().map(MemoryScoredItem::getScore).toList();
    }
}
