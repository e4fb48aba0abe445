/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.io.codec;

import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.Relationship;

import java.time.Instant;
import java.util.List;

/**
 * Decoded export document. {@code exportedAt} and {@code schemaVersion} are {@code null} when the
 * document carried no {@code framework_metadata}.
 */
public record FrameworkDocument(
        List<Pattern> patterns,
        List<Relationship> relationships,
        Instant exportedAt,
        String schemaVersion
) {
    public FrameworkDocument {
        patterns = List.copyOf(patterns);
        relationships = List.copyOf(relationships);
    }
}
