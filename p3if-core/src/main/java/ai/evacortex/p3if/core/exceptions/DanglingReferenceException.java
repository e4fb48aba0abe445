/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.exceptions;

import ai.evacortex.p3if.core.model.PatternType;

public class DanglingReferenceException extends RuntimeException {

    private final String relationshipId;
    private final PatternType slot;
    private final String patternId;

    public DanglingReferenceException(String relationshipId, PatternType slot, String patternId) {
        super("Relationship '" + relationshipId + "' references missing " + slot.key() + " '" + patternId + "'");
        this.relationshipId = relationshipId;
        this.slot = slot;
        this.patternId = patternId;
    }

    public String relationshipId() {
        return relationshipId;
    }

    public PatternType slot() {
        return slot;
    }

    public String patternId() {
        return patternId;
    }
}
