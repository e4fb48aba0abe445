/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.persistence;

import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPatternStorage implements PatternStorage {

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();
    private final Map<String, Relationship> relationships = new ConcurrentHashMap<>();

    @Override
    public void savePattern(Pattern pattern) {
        patterns.put(pattern.id(), pattern);
    }

    @Override
    public Optional<Pattern> getPattern(String id) {
        return Optional.ofNullable(patterns.get(id));
    }

    @Override
    public List<Pattern> getPatternsByType(PatternType type) {
        return patterns.values().stream().filter(p -> p.type() == type).toList();
    }

    @Override
    public boolean deletePattern(String id) {
        return patterns.remove(id) != null;
    }

    @Override
    public void saveRelationship(Relationship relationship) {
        relationships.put(relationship.id(), relationship);
    }

    @Override
    public Optional<Relationship> getRelationship(String id) {
        return Optional.ofNullable(relationships.get(id));
    }

    @Override
    public boolean deleteRelationship(String id) {
        return relationships.remove(id) != null;
    }

    @Override
    public void clear() {
        patterns.clear();
        relationships.clear();
    }

    @Override
    public Snapshot loadAll() {
        return new Snapshot(new ArrayList<>(patterns.values()), new ArrayList<>(relationships.values()));
    }
}
