/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.storage;

import ai.evacortex.p3if.core.exceptions.DanglingReferenceException;
import ai.evacortex.p3if.core.exceptions.DuplicateIdException;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.storage.util.AutoLock;
import ai.evacortex.p3if.core.storage.util.ConcurrencyGuard;

import java.util.*;

/**
 * Primary relationship map plus the pattern-id → relationship-ids index.
 *
 * <p>References are resolved against {@link PatternStore} before anything is written, so a rejected
 * relationship leaves neither map nor index touched.</p>
 */
public class RelationshipStore {

    private final ConcurrencyGuard guard;
    private final PatternStore patterns;
    private final StoreListener listener;

    private final Map<String, Relationship> relationships = new LinkedHashMap<>();
    private final Map<String, Set<String>> byPattern = new HashMap<>();

    public RelationshipStore(ConcurrencyGuard guard, PatternStore patterns, StoreListener listener) {
        this.guard = guard;
        this.patterns = patterns;
        this.listener = listener;
    }

    public String add(Relationship rel) {
        Objects.requireNonNull(rel, "relationship must not be null");
        try (AutoLock ignored = guard.write()) {
            if (relationships.containsKey(rel.id())) {
                throw new DuplicateIdException("Relationship", rel.id());
            }
            for (Map.Entry<PatternType, String> slot : rel.slots().entrySet()) {
                requireResolvable(rel.id(), slot.getKey(), slot.getValue());
            }
            relationships.put(rel.id(), rel);
            index(rel);
            try {
                listener.relationshipSaved(rel);
            } catch (RuntimeException e) {
                unindex(rel);
                relationships.remove(rel.id());
                throw e;
            }
            return rel.id();
        }
    }

    public Optional<Relationship> get(String id) {
        try (AutoLock ignored = guard.read()) {
            return Optional.ofNullable(relationships.get(id));
        }
    }

    public boolean remove(String id) {
        try (AutoLock ignored = guard.write()) {
            Relationship removed = relationships.remove(id);
            if (removed == null) return false;
            unindex(removed);
            try {
                listener.relationshipRemoved(id);
            } catch (RuntimeException e) {
                relationships.put(id, removed);
                index(removed);
                throw e;
            }
            return true;
        }
    }

    public List<Relationship> getByPattern(String patternId) {
        try (AutoLock ignored = guard.read()) {
            Set<String> ids = byPattern.get(patternId);
            if (ids == null || ids.isEmpty()) return List.of();
            List<Relationship> out = new ArrayList<>(ids.size());
            for (String id : ids) {
                Relationship r = relationships.get(id);
                if (r != null) out.add(r);
            }
            return out;
        }
    }

    /**
     * Swaps a stored relationship for a rewritten copy with the same id, moving index entries for
     * every slot that changed. References in the copy must already be resolvable.
     */
    public void rewrite(Relationship updated) {
        try (AutoLock ignored = guard.write()) {
            Relationship existing = relationships.get(updated.id());
            if (existing == null) throw new IllegalStateException("No relationship to replace: " + updated.id());
            for (Map.Entry<PatternType, String> slot : updated.slots().entrySet()) {
                requireResolvable(updated.id(), slot.getKey(), slot.getValue());
            }
            unindex(existing);
            relationships.put(updated.id(), updated);
            index(updated);
            try {
                listener.relationshipSaved(updated);
            } catch (RuntimeException e) {
                unindex(updated);
                relationships.put(existing.id(), existing);
                index(existing);
                throw e;
            }
        }
    }

    public int referenceCount(String patternId) {
        try (AutoLock ignored = guard.read()) {
            Set<String> ids = byPattern.get(patternId);
            return ids == null ? 0 : ids.size();
        }
    }

    public List<Relationship> all() {
        try (AutoLock ignored = guard.read()) {
            return List.copyOf(relationships.values());
        }
    }

    public int size() {
        try (AutoLock ignored = guard.read()) {
            return relationships.size();
        }
    }

    /**
     * Index entries whose relationship is missing or no longer references the indexed pattern.
     */
    public Set<String> staleIndexEntries() {
        try (AutoLock ignored = guard.read()) {
            Set<String> stale = new TreeSet<>();
            for (Map.Entry<String, Set<String>> e : byPattern.entrySet()) {
                for (String relId : e.getValue()) {
                    Relationship r = relationships.get(relId);
                    if (r == null || !r.references(e.getKey())) stale.add(relId);
                }
            }
            return stale;
        }
    }

    public void clear() {
        try (AutoLock ignored = guard.write()) {
            relationships.clear();
            byPattern.clear();
        }
    }

    private void requireResolvable(String relId, PatternType slot, String patternId) {
        Optional<Pattern> target = patterns.get(patternId);
        if (target.isEmpty() || target.get().type() != slot) {
            throw new DanglingReferenceException(relId, slot, patternId);
        }
    }

    private void index(Relationship rel) {
        for (String patternId : rel.slots().values()) {
            byPattern.computeIfAbsent(patternId, k -> new LinkedHashSet<>()).add(rel.id());
        }
    }

    private void unindex(Relationship rel) {
        for (String patternId : rel.slots().values()) {
            Set<String> ids = byPattern.get(patternId);
            if (ids == null) continue;
            ids.remove(rel.id());
            if (ids.isEmpty()) byPattern.remove(patternId);
        }
    }
}
