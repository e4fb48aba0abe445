/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.engine;

import ai.evacortex.p3if.core.exceptions.InvalidPatternException;
import ai.evacortex.p3if.core.exceptions.PatternNotFoundException;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.storage.PatternStore;
import ai.evacortex.p3if.core.storage.RelationshipStore;
import ai.evacortex.p3if.core.storage.util.AutoLock;
import ai.evacortex.p3if.core.storage.util.ConcurrencyGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Substitutes one pattern for another across every relationship that references it, keeping
 * relationship ids, scores and flags.
 */
public class DimensionSwapper {

    private static final Logger log = LoggerFactory.getLogger(DimensionSwapper.class);

    private final ConcurrencyGuard guard;
    private final PatternStore patterns;
    private final RelationshipStore relationships;

    public DimensionSwapper(ConcurrencyGuard guard, PatternStore patterns, RelationshipStore relationships) {
        this.guard = guard;
        this.patterns = patterns;
        this.relationships = relationships;
    }

    /**
     * Rewrites the {@code oldPattern.type()} slot of each relationship holding {@code oldPattern.id()}
     * to {@code newPattern.id()}. The old pattern stays registered.
     *
     * @return number of relationships rewritten
     * @throws PatternNotFoundException if {@code newPattern} is not registered
     * @throws InvalidPatternException  if the two patterns are of different types
     */
    public int hotSwap(Pattern oldPattern, Pattern newPattern) {
        Objects.requireNonNull(oldPattern, "oldPattern must not be null");
        Objects.requireNonNull(newPattern, "newPattern must not be null");

        try (AutoLock ignored = guard.write()) {
            Pattern registered = patterns.get(newPattern.id())
                    .orElseThrow(() -> new PatternNotFoundException(newPattern.id()));
            if (oldPattern.type() != newPattern.type() || registered.type() != oldPattern.type()) {
                throw new InvalidPatternException("cannot swap " + oldPattern.type().key() + " '"
                        + oldPattern.id() + "' for " + registered.type().key() + " '" + registered.id() + "'");
            }
            if (oldPattern.id().equals(newPattern.id())) return 0;

            PatternType slot = oldPattern.type();
            int updated = 0;
            for (Relationship rel : relationships.getByPattern(oldPattern.id())) {
                if (!oldPattern.id().equals(rel.slot(slot))) continue;
                relationships.rewrite(rel.withSlot(slot, newPattern.id()));
                updated++;
            }
            if (updated > 0) {
                log.info("Hot-swapped {} '{}' -> '{}' in {} relationship(s)",
                        slot.key(), oldPattern.id(), newPattern.id(), updated);
            }
            return updated;
        }
    }
}
