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

/**
 * Point-in-time counters of one agent's memory engine.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryStats {

    private String agentId;
    private int working;
    private int episodic;
    private int semantic;
    private int procedural;

    /** Items ever stored, including ones evicted or merged away since. */
    private long totalStored;

    private long evictions;
    private long promotions;
    private long merges;
    private long expirations;

    public int getTotal() {
        return working + episodic + semantic + procedural;
    }
}
