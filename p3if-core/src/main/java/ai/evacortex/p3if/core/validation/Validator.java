/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.validation;

import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.storage.PatternStore;
import ai.evacortex.p3if.core.storage.RelationshipStore;
import ai.evacortex.p3if.core.storage.util.AutoLock;
import ai.evacortex.p3if.core.storage.util.ConcurrencyGuard;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only structural checks over both stores. Results are never cached.
 */
public class Validator {

    static final int MIN_DESCRIPTION_LENGTH = 10;

    private final ConcurrencyGuard guard;
    private final PatternStore patterns;
    private final RelationshipStore relationships;

    public Validator(ConcurrencyGuard guard, PatternStore patterns, RelationshipStore relationships) {
        this.guard = guard;
        this.patterns = patterns;
        this.relationships = relationships;
    }

    public ValidationReport validateFramework() {
        List<ValidationIssue> issues = new ArrayList<>();
        try (AutoLock ignored = guard.read()) {
            for (Relationship rel : relationships.all()) {
                checkReferences(rel, issues);
                if (rel.slots().size() < 2) {
                    issues.add(new ValidationIssue("min_dimensions", Severity.WARNING, rel.id(),
                            "relationship connects " + rel.slots().size() + " dimension(s), expected at least 2"));
                }
            }
            for (Pattern p : patterns.all()) {
                String desc = p.description();
                if (desc == null || desc.strip().length() < MIN_DESCRIPTION_LENGTH) {
                    issues.add(new ValidationIssue("meaningful_description", Severity.INFO, p.id(),
                            "description shorter than " + MIN_DESCRIPTION_LENGTH + " characters"));
                }
            }
            for (String id : patterns.staleIndexEntries()) {
                issues.add(new ValidationIssue("pattern_index", Severity.ERROR, id,
                        "index entry without stored pattern"));
            }
            for (String id : relationships.staleIndexEntries()) {
                issues.add(new ValidationIssue("relationship_index", Severity.ERROR, id,
                        "pattern index entry does not match stored relationship"));
            }
        }
        return ValidationReport.of(issues);
    }

    private void checkReferences(Relationship rel, List<ValidationIssue> issues) {
        for (Map.Entry<PatternType, String> slot : rel.slots().entrySet()) {
            Optional<Pattern> target = patterns.get(slot.getValue());
            if (target.isEmpty()) {
                issues.add(new ValidationIssue("dangling_reference", Severity.ERROR, rel.id(),
                        slot.getKey().key() + "_id '" + slot.getValue() + "' does not exist"));
            } else if (target.get().type() != slot.getKey()) {
                issues.add(new ValidationIssue("slot_type_mismatch", Severity.ERROR, rel.id(),
                        slot.getKey().key() + "_id '" + slot.getValue() + "' names a "
                                + target.get().type().key()));
            }
        }
    }
}
