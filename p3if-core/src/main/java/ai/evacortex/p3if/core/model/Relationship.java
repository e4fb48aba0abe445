/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.model;

import ai.evacortex.p3if.core.exceptions.OutOfRangeValueException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.*;

/**
 * A weighted link across up to three patterns, one per {@link PatternType} slot.
 *
 * <p>Strength and confidence are validated on construction, so an instance with an out-of-range
 * score can never reach a store.</p>
 */
public record Relationship(
        @JsonProperty("id") String id,
        @JsonProperty("property_id") String propertyId,
        @JsonProperty("process_id") String processId,
        @JsonProperty("perspective_id") String perspectiveId,
        @JsonProperty("strength") double strength,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("bidirectional") boolean bidirectional,
        @JsonProperty("relationship_type") String relationshipType,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public static final String DEFAULT_TYPE = "general";

    public Relationship {
        requireUnitInterval("strength", strength);
        requireUnitInterval("confidence", confidence);
        id = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
        propertyId = blankToNull(propertyId);
        processId = blankToNull(processId);
        perspectiveId = blankToNull(perspectiveId);
        relationshipType = (relationshipType == null || relationshipType.isBlank())
                ? DEFAULT_TYPE : relationshipType.strip();
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        createdAt = createdAt == null ? Instant.now() : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    @JsonCreator
    static Relationship fromJson(@JsonProperty("id") String id,
                                 @JsonProperty("property_id") String propertyId,
                                 @JsonProperty("process_id") String processId,
                                 @JsonProperty("perspective_id") String perspectiveId,
                                 @JsonProperty("strength") Double strength,
                                 @JsonProperty("confidence") Double confidence,
                                 @JsonProperty("bidirectional") Boolean bidirectional,
                                 @JsonProperty("relationship_type") String relationshipType,
                                 @JsonProperty("metadata") Map<String, Object> metadata,
                                 @JsonProperty("created_at") Instant createdAt,
                                 @JsonProperty("updated_at") Instant updatedAt) {
        if (strength == null) throw new OutOfRangeValueException("strength", Double.NaN);
        return new Relationship(id, propertyId, processId, perspectiveId, strength,
                confidence == null ? 1.0 : confidence,
                bidirectional == null || bidirectional,
                relationshipType, metadata, createdAt, updatedAt);
    }

    public static Builder builder(double strength) {
        return new Builder(strength);
    }

    /**
     * Returns the pattern id held in the slot for the given dimension, or {@code null}.
     */
    public String slot(PatternType type) {
        return switch (type) {
            case PROPERTY -> propertyId;
            case PROCESS -> processId;
            case PERSPECTIVE -> perspectiveId;
        };
    }

    /**
     * Returns a copy with one slot rewritten. Scores, flags and metadata are carried over unchanged.
     */
    public Relationship withSlot(PatternType type, String patternId) {
        return new Relationship(id,
                type == PatternType.PROPERTY ? patternId : propertyId,
                type == PatternType.PROCESS ? patternId : processId,
                type == PatternType.PERSPECTIVE ? patternId : perspectiveId,
                strength, confidence, bidirectional, relationshipType, metadata,
                createdAt, Instant.now());
    }

    /**
     * Populated slots in {@link PatternType} order.
     */
    public Map<PatternType, String> slots() {
        Map<PatternType, String> out = new EnumMap<>(PatternType.class);
        for (PatternType type : PatternType.values()) {
            String ref = slot(type);
            if (ref != null) out.put(type, ref);
        }
        return out;
    }

    public boolean references(String patternId) {
        return patternId != null && (patternId.equals(propertyId)
                || patternId.equals(processId)
                || patternId.equals(perspectiveId));
    }

    private static void requireUnitInterval(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new OutOfRangeValueException(field, value);
        }
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public static final class Builder {
        private final double strength;
        private String id;
        private String propertyId;
        private String processId;
        private String perspectiveId;
        private double confidence = 1.0;
        private boolean bidirectional = true;
        private String relationshipType = DEFAULT_TYPE;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(double strength) {
            this.strength = strength;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder property(String propertyId) {
            this.propertyId = propertyId;
            return this;
        }

        public Builder process(String processId) {
            this.processId = processId;
            return this;
        }

        public Builder perspective(String perspectiveId) {
            this.perspectiveId = perspectiveId;
            return this;
        }

        public Builder slot(PatternType type, String patternId) {
            return switch (type) {
                case PROPERTY -> property(patternId);
                case PROCESS -> process(patternId);
                case PERSPECTIVE -> perspective(patternId);
            };
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder bidirectional(boolean bidirectional) {
            this.bidirectional = bidirectional;
            return this;
        }

        public Builder relationshipType(String relationshipType) {
            this.relationshipType = relationshipType;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> entries) {
            if (entries != null) this.metadata.putAll(entries);
            return this;
        }

        public Relationship build() {
            return new Relationship(id, propertyId, processId, perspectiveId, strength, confidence,
                    bidirectional, relationshipType, metadata, null, null);
        }
    }
}
