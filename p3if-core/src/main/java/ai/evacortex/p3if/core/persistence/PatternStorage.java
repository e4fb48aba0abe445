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

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Pluggable persistence behind a framework store. Implementations receive every committed mutation
 * and must be safe for use from the mutating thread.
 */
public interface PatternStorage {

    void savePattern(Pattern pattern);

    Optional<Pattern> getPattern(String id);

    List<Pattern> getPatternsByType(PatternType type);

    boolean deletePattern(String id);

    void saveRelationship(Relationship relationship);

    Optional<Relationship> getRelationship(String id);

    boolean deleteRelationship(String id);

    void clear();

    /**
     * Everything currently persisted, for rehydrating a store.
     */
    Snapshot loadAll();

    /**
     * Runs {@code work}, which may call any mutator of this storage, as one unit. Implementations
     * that write to disk may defer writing until {@code work} returns. If {@code work} or the
     * deferred write fails, the storage is left as it was before the call and the failure is rethrown.
     * The default runs {@code work} directly, with every mutation applied as it happens.
     */
    default <T> T inBatch(Supplier<T> work) {
        return work.get();
    }

    record Snapshot(List<Pattern> patterns, List<Relationship> relationships) {
        public Snapshot {
            patterns = List.copyOf(patterns);
            relationships = List.copyOf(relationships);
        }
    }
}
