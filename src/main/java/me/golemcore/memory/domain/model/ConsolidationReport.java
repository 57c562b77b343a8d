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
 * Outcome of one consolidation pass.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsolidationReport {

    /** Ids of the episodic items created by promotion. */
    @Builder.Default
    private List<String> promotedIds = new ArrayList<>();

    /** Ids of episodic items removed by the retention window. */
    @Builder.Default
    private List<String> expiredIds = new ArrayList<>();

    public int getPromotedCount() {
        return promotedIds.size();
    }

    public int getExpiredCount() {
        return expiredIds.size();
    }
}
