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

import me.golemcore.memory.domain.model.MemoryItem;
import me.golemcore.memory.domain.model.MemoryRelation;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Shared lexical helpers: tokenization, token overlap scoring and tag matching.
 */
public final class MemoryTextSupport {

    private static final String TOKEN_SPLIT = "[^a-zа-я0-9_./#-]+";
    private static final int MIN_TOKEN_LENGTH = 3;

    private MemoryTextSupport() {
    }

    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split(TOKEN_SPLIT);
        for (String token : raw) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Jaccard index of the two token sets, {@code 0} when both are empty.
     */
    public static double jaccard(String left, String right) {
        Set<String> a = tokenize(left);
        Set<String> b = tokenize(right);
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / (double) union.size();
    }

    /**
     * Content plus every tag-like field of the item, space separated.
     */
    public static String buildSearchableText(MemoryItem item) {
        StringBuilder sb = new StringBuilder();
        append(sb, item.getContent());
        append(sb, item.getSource());
        append(sb, item.getEventType());
        appendAll(sb, item.getParticipants());
        append(sb, item.getCategory());
        if (item.getRelations() != null) {
            for (MemoryRelation relation : item.getRelations()) {
                if (relation != null) {
                    append(sb, relation.type());
                    append(sb, relation.target());
                }
            }
        }
        append(sb, item.getSkillName());
        appendAll(sb, item.getPrerequisites());
        appendAll(sb, item.getSteps());
        return sb.toString().trim();
    }

    /**
     * Whether the item's content or tags contain the query or share a token with
     * it. A blank query matches everything.
     */
    public static boolean matches(MemoryItem item, String query) {
        if (query == null || query.isBlank()) {
            return true;
        }
        String searchable = buildSearchableText(item).toLowerCase(Locale.ROOT);
        if (searchable.contains(query.trim().toLowerCase(Locale.ROOT))) {
            return true;
        }
        Set<String> itemTokens = tokenize(searchable);
        for (String token : tokenize(query)) {
            if (itemTokens.contains(token)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Share of query tokens found in the item, in [0, 1].
     */
    public static double lexicalRelevance(String query, MemoryItem item) {
        if (query == null || query.isBlank()) {
            return 0.0;
        }
        String searchable = buildSearchableText(item);
        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return searchable.toLowerCase(Locale.ROOT).contains(query.trim().toLowerCase(Locale.ROOT)) ? 1.0 : 0.0;
        }
        Set<String> contentTokens = tokenize(searchable);
        if (contentTokens.isEmpty()) {
            return 0.0;
        }
        int matches = 0;
        for (String token : queryTokens) {
            if (contentTokens.contains(token)) {
                matches++;
            }
        }
        return clamp((double) matches / (double) queryTokens.size());
    }

    public static double clamp(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }

    private static void append(StringBuilder sb, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(value).append(' ');
        }
    }

    private static void appendAll(StringBuilder sb, Collection<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            append(sb, value);
        }
    }
}
