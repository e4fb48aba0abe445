/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.engine;

import ai.evacortex.p3if.core.exceptions.OutOfRangeValueException;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.function.UnaryOperator;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExternalRelationshipData(
        @JsonProperty("id") String id,
        @JsonProperty("property_id") String propertyId,
        @JsonProperty("process_id") String processId,
        @JsonProperty("perspective_id") String perspectiveId,
        @JsonProperty("strength") Double strength,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("bidirectional") Boolean bidirectional,
        @JsonProperty("relationship_type") String relationshipType,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static ExternalRelationshipData of(String id, String propertyId, String processId,
                                              String perspectiveId, double strength) {
        return new ExternalRelationshipData(id, propertyId, processId, perspectiveId, strength,
                null, null, null, null);
    }

    /**
     * Builds the relationship, passing every populated slot through {@code remap} first.
     *
     * @throws OutOfRangeValueException on a missing strength or invalid scores
     */
    public Relationship toRelationship(UnaryOperator<String> remap) {
        if (strength == null) throw new OutOfRangeValueException("strength", Double.NaN);
        return Relationship.builder(strength)
                .id(id)
                .slot(PatternType.PROPERTY, propertyId == null ? null : remap.apply(propertyId))
                .slot(PatternType.PROCESS, processId == null ? null : remap.apply(processId))
                .slot(PatternType.PERSPECTIVE, perspectiveId == null ? null : remap.apply(perspectiveId))
                .confidence(confidence == null ? 1.0 : confidence)
                .bidirectional(bidirectional == null || bidirectional)
                .relationshipType(relationshipType)
                .metadata(metadata)
                .build();
    }
}
