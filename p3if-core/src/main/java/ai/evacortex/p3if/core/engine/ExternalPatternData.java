/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.engine;

import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternStatus;
import ai.evacortex.p3if.core.model.PatternType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Loosely-typed pattern record coming from another framework. The dimension is supplied by the
 * enclosing {@link ExternalFramework} map key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExternalPatternData(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("domain") String domain,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("quality_score") Double qualityScore,
        @JsonProperty("status") PatternStatus status
) {
    public static ExternalPatternData of(String id, String name, String domain) {
        return new ExternalPatternData(id, name, null, domain, null, null, null, null);
    }

    public Pattern toPattern(PatternType type) {
        return new Pattern(id, type, name, description, domain,
                tags == null ? null : new LinkedHashSet<>(tags), metadata,
                qualityScore == null ? 1.0 : qualityScore, status, null, null);
    }
}
