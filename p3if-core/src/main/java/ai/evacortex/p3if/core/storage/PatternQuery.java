/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.storage;

import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternStatus;
import ai.evacortex.p3if.core.model.PatternType;

import java.util.Locale;
import java.util.Objects;

/**
 * Conjunctive pattern filter. A {@code null} criterion matches everything.
 */
public record PatternQuery(
        PatternType type,
        String domain,
        String tag,
        PatternStatus status,
        String nameContains
) {
    public static PatternQuery any() {
        return new PatternQuery(null, null, null, null, null);
    }

    public PatternQuery withType(PatternType t) {
        return new PatternQuery(t, domain, tag, status, nameContains);
    }

    public PatternQuery withDomain(String d) {
        return new PatternQuery(type, d, tag, status, nameContains);
    }

    public PatternQuery withTag(String t) {
        return new PatternQuery(type, domain, t, status, nameContains);
    }

    public PatternQuery withStatus(PatternStatus s) {
        return new PatternQuery(type, domain, tag, s, nameContains);
    }

    public PatternQuery withNameContaining(String n) {
        return new PatternQuery(type, domain, tag, status, n);
    }

    public boolean matches(Pattern p) {
        if (type != null && p.type() != type) return false;
        if (domain != null && !Objects.equals(domain, p.domain())) return false;
        if (tag != null && !p.tags().contains(tag.strip().toLowerCase(Locale.ROOT))) return false;
        if (status != null && p.status() != status) return false;
        return nameContains == null
                || p.name().toLowerCase(Locale.ROOT).contains(nameContains.toLowerCase(Locale.ROOT));
    }
}
