/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core;

import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;

/**
 * Fixtures for building small frameworks in tests.
 */
public class PatternTestUtils {

    public static Pattern property(String id, String name, String domain, String... tags) {
        return Pattern.builder(PatternType.PROPERTY, name).id(id).domain(domain).tags(tags).build();
    }

    public static Pattern process(String id, String name, String domain, String... tags) {
        return Pattern.builder(PatternType.PROCESS, name).id(id).domain(domain).tags(tags).build();
    }

    public static Pattern perspective(String id, String name, String domain, String... tags) {
        return Pattern.builder(PatternType.PERSPECTIVE, name).id(id).domain(domain).tags(tags).build();
    }

    public static Relationship link(String id, String propertyId, String processId, String perspectiveId,
                                    double strength, double confidence) {
        return Relationship.builder(strength)
                .id(id)
                .property(propertyId)
                .process(processId)
                .perspective(perspectiveId)
                .confidence(confidence)
                .build();
    }

    /**
     * Three security properties, two ops processes, one relationship p1 to r1 (0.8 / 0.9).
     */
    public static void populateSecurityScenario(FrameworkStore store) {
        store.addPattern(property("p1", "Confidentiality", "security"));
        store.addPattern(property("p2", "Integrity", "security"));
        store.addPattern(property("p3", "Availability", "security"));
        store.addPattern(process("r1", "Incident Response", "ops"));
        store.addPattern(process("r2", "Patch Management", "ops"));
        store.addRelationship(link("rel-1", "p1", "r1", null, 0.8, 0.9));
    }
}
