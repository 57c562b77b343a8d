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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lifetime counters reported by {@link AgentMemoryEngine#getStats()}.
 */
public class MemoryEngineCounters {

    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong promotions = new AtomicLong();
    private final AtomicLong merges = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public void addEvictions(long count) {
        evictions.addAndGet(count);
    }

    public void addPromotions(long count) {
        promotions.addAndGet(count);
    }

    public void addMerges(long count) {
        merges.addAndGet(count);
    }

    public void addExpirations(long count) {
        expirations.addAndGet(count);
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getPromotions() {
        return promotions.get();
    }

    public long getMerges() {
        return merges.get();
    }

    public long getExpirations() {
        return expirations.get();
    }
}
