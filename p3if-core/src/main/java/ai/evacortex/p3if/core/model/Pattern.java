/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.model;

import ai.evacortex.p3if.core.exceptions.InvalidPatternException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.*;

/**
 * An immutable, named unit of domain knowledge in one of the three {@link PatternType} dimensions.
 *
 * <p>All variants share the same fields; {@link #type()} is the variant tag. Copies produced by the
 * {@code with*} methods keep {@link #id()} and {@link #createdAt()} and refresh {@link #updatedAt()}.</p>
 */
public record Pattern(
        @JsonProperty("id") String id,
        @JsonProperty("type") PatternType type,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("domain") String domain,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("quality_score") double qualityScore,
        @JsonProperty("status") PatternStatus status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public Pattern {
        if (type == null) throw new InvalidPatternException("type is required");
        if (name == null || name.isBlank()) throw new InvalidPatternException("name must not be empty");
        if (Double.isNaN(qualityScore)) throw new InvalidPatternException("quality_score must be a number");
        id = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
        name = name.strip();
        tags = normalizeTags(tags);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        status = status == null ? PatternStatus.DRAFT : status;
        createdAt = createdAt == null ? Instant.now() : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    @JsonCreator
    static Pattern fromJson(@JsonProperty("id") String id,
                            @JsonProperty("type") PatternType type,
                            @JsonProperty("name") String name,
                            @JsonProperty("description") String description,
                            @JsonProperty("domain") String domain,
                            @JsonProperty("tags") Collection<String> tags,
                            @JsonProperty("metadata") Map<String, Object> metadata,
                            @JsonProperty("quality_score") Double qualityScore,
                            @JsonProperty("status") PatternStatus status,
                            @JsonProperty("created_at") Instant createdAt,
                            @JsonProperty("updated_at") Instant updatedAt) {
        return new Pattern(id, type, name, description, domain,
                tags == null ? null : new LinkedHashSet<>(tags), metadata,
                qualityScore == null ? 1.0 : qualityScore, status, createdAt, updatedAt);
    }

    public static Builder builder(PatternType type, String name) {
        return new Builder(type, name);
    }

    public static Pattern property(String name, String domain) {
        return builder(PatternType.PROPERTY, name).domain(domain).build();
    }

    public static Pattern process(String name, String domain) {
        return builder(PatternType.PROCESS, name).domain(domain).build();
    }

    public static Pattern perspective(String name, String domain) {
        return builder(PatternType.PERSPECTIVE, name).domain(domain).build();
    }

    public Pattern withDescription(String newDescription) {
        return new Pattern(id, type, name, newDescription, domain, tags, metadata,
                qualityScore, status, createdAt, Instant.now());
    }

    public Pattern withDomain(String newDomain) {
        return new Pattern(id, type, name, description, newDomain, tags, metadata,
                qualityScore, status, createdAt, Instant.now());
    }

    public Pattern withTags(Set<String> newTags) {
        return new Pattern(id, type, name, description, domain, newTags, metadata,
                qualityScore, status, createdAt, Instant.now());
    }

    public Pattern withStatus(PatternStatus newStatus) {
        return new Pattern(id, type, name, description, domain, tags, metadata,
                qualityScore, newStatus, createdAt, Instant.now());
    }

    public Pattern withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Pattern(id, type, name, description, domain, tags, copy,
                qualityScore, status, createdAt, Instant.now());
    }

    public boolean deprecated() {
        return status == PatternStatus.DEPRECATED;
    }

    private static Set<String> normalizeTags(Set<String> raw) {
        if (raw == null || raw.isEmpty()) return Set.of();
        Set<String> out = new LinkedHashSet<>();
        for (String tag : raw) {
            if (tag == null || tag.isBlank()) continue;
            out.add(tag.strip().toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(out);
    }

    public static final class Builder {
        private final PatternType type;
        private final String name;
        private String id;
        private String description;
        private String domain;
        private final Set<String> tags = new LinkedHashSet<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private double qualityScore = 1.0;
        private PatternStatus status = PatternStatus.DRAFT;

        private Builder(PatternType type, String name) {
            this.type = type;
            this.name = name;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder qualityScore(double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder status(PatternStatus status) {
            this.status = status;
            return this;
        }

        public Pattern build() {
            return new Pattern(id, type, name, description, domain, tags, metadata,
                    qualityScore, status, null, null);
        }
    }
}
