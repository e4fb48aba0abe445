/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.metrics;

import ai.evacortex.p3if.core.model.PatternType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record FrameworkMetrics(
        @JsonProperty("total_patterns") int totalPatterns,
        @JsonProperty("total_relationships") int totalRelationships,
        @JsonProperty("average_relationship_strength") double averageRelationshipStrength,
        @JsonProperty("average_confidence") double averageConfidence,
        @JsonProperty("domain_count") int domainCount,
        @JsonProperty("orphaned_patterns") int orphanedPatterns,
        @JsonProperty("deprecated_patterns") int deprecatedPatterns,
        @JsonProperty("validation_issues") int validationIssues,
        @JsonProperty("patterns_by_type") Map<PatternType, Integer> patternsByType,
        @JsonProperty("computed_at") Instant computedAt
) {
    public FrameworkMetrics {
        patternsByType = Map.copyOf(patternsByType);
    }
}
