/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.engine;

import ai.evacortex.p3if.core.model.PatternType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pattern and relationship set supplied by another framework for {@link Multiplexer} to merge.
 *
 * <p>{@code undecodablePatterns} and {@code undecodableRelationships} hold one message per payload
 * item that could not be read at all. The multiplexer counts them as skipped and rejected.</p>
 */
public record ExternalFramework(
        Map<PatternType, List<ExternalPatternData>> patterns,
        List<ExternalRelationshipData> relationships,
        List<String> undecodablePatterns,
        List<String> undecodableRelationships
) {
    public ExternalFramework {
        Map<PatternType, List<ExternalPatternData>> copy = new EnumMap<>(PatternType.class);
        if (patterns != null) patterns.forEach((type, items) -> copy.put(type, List.copyOf(items)));
        patterns = copy;
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        undecodablePatterns = undecodablePatterns == null ? List.of() : List.copyOf(undecodablePatterns);
        undecodableRelationships = undecodableRelationships == null ? List.of() : List.copyOf(undecodableRelationships);
    }

    public ExternalFramework(Map<PatternType, List<ExternalPatternData>> patterns,
                             List<ExternalRelationshipData> relationships) {
        this(patterns, relationships, List.of(), List.of());
    }

    public static ExternalFramework ofPatterns(Map<PatternType, List<ExternalPatternData>> patterns) {
        return new ExternalFramework(patterns, List.of());
    }

    public int patternCount() {
        return patterns.values().stream().mapToInt(List::size).sum() + undecodablePatterns.size();
    }
}
