/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.store;

import ai.evacortex.p3if.core.FrameworkStore;
import ai.evacortex.p3if.core.exceptions.DanglingReferenceException;
import ai.evacortex.p3if.core.exceptions.DuplicateIdException;
import ai.evacortex.p3if.core.exceptions.InvalidPatternException;
import ai.evacortex.p3if.core.exceptions.PatternNotFoundException;
import ai.evacortex.p3if.core.metrics.FrameworkMetrics;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternStatus;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.storage.FrameworkStoreImpl;
import ai.evacortex.p3if.core.storage.PatternQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static ai.evacortex.p3if.core.PatternTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class FrameworkStoreImplTest {

    private FrameworkStore store;

    @BeforeEach
    void setUp() {
        store = new FrameworkStoreImpl();
    }

    @Test
    void testAddAndIndexes() {
        String id = store.addPattern(property("p1", "Confidentiality", "security", "CIA", "core"));
        assertEquals("p1", id);

        assertEquals(List.of("p1"), ids(store.getPatternsByType(PatternType.PROPERTY)));
        assertTrue(store.getPatternsByType(PatternType.PROCESS).isEmpty());
        assertEquals(List.of("p1"), ids(store.getPatternsByDomain("security")));
        assertEquals(List.of("p1"), ids(store.getPatternsByTag("cia")));
        assertEquals(List.of("p1"), ids(store.getPatternsByTag("CIA")));
        assertTrue(store.getPatternsByDomain("ops").isEmpty());
        assertTrue(store.getPattern("missing").isEmpty());
    }

    @Test
    void testDuplicatePatternIdLeavesStoreUntouched() {
        store.addPattern(property("p1", "Confidentiality", "security"));
        assertThrows(DuplicateIdException.class,
                () -> store.addPattern(process("p1", "Imposter", "ops")));

        assertEquals(1, store.allPatterns().size());
        assertEquals(PatternType.PROPERTY, store.getPattern("p1").orElseThrow().type());
        assertTrue(store.getPatternsByDomain("ops").isEmpty());
        assertTrue(store.getPatternsByType(PatternType.PROCESS).isEmpty());
    }

    @Test
    void testDanglingRelationshipIsAtomic() {
        store.addPattern(property("p1", "Confidentiality", "security"));

        DanglingReferenceException ex = assertThrows(DanglingReferenceException.class,
                () -> store.addRelationship(link("rel-1", "p1", "nope", null, 0.5, 1.0)));
        assertEquals(PatternType.PROCESS, ex.slot());
        assertEquals("nope", ex.patternId());

        assertTrue(store.getRelationship("rel-1").isEmpty());
        assertTrue(store.getRelationshipsByPattern("p1").isEmpty());
        assertTrue(store.allRelationships().isEmpty());
    }

    @Test
    void testSlotMustNameMatchingType() {
        store.addPattern(property("p1", "Confidentiality", "security"));
        store.addPattern(property("p2", "Integrity", "security"));

        assertThrows(DanglingReferenceException.class,
                () -> store.addRelationship(link("rel-1", "p1", "p2", null, 0.5, 1.0)));
        assertTrue(store.allRelationships().isEmpty());
    }

    @Test
    void testDuplicateRelationshipId() {
        populateSecurityScenario(store);
        assertThrows(DuplicateIdException.class,
                () -> store.addRelationship(link("rel-1", "p2", "r2", null, 0.1, 0.1)));
        assertEquals(1, store.allRelationships().size());
        assertTrue(store.getRelationshipsByPattern("p2").isEmpty());
    }

    @Test
    void testRemoveIsIdempotent() {
        store.addPattern(property("p1", "Confidentiality", "security"));
        assertTrue(store.removePattern("p1"));
        assertFalse(store.removePattern("p1"));
        assertFalse(store.removePattern("never-existed"));
        assertTrue(store.getPatternsByDomain("security").isEmpty());

        populateSecurityScenario(store);
        assertTrue(store.removeRelationship("rel-1"));
        assertFalse(store.removeRelationship("rel-1"));
    }

    @Test
    void testRemovePatternCascadesToRelationships() {
        populateSecurityScenario(store);
        store.addPattern(perspective("v1", "Auditor", "compliance"));
        store.addRelationship(link("rel-2", "p2", "r1", "v1", 0.4, 0.6));

        assertTrue(store.removePattern("r1"));

        assertTrue(store.allRelationships().isEmpty());
        assertTrue(store.getRelationshipsByPattern("p1").isEmpty());
        assertTrue(store.getRelationshipsByPattern("v1").isEmpty());
        assertTrue(store.validateFramework().valid());
    }

    @Test
    void testSecurityScenarioMetrics() {
        populateSecurityScenario(store);

        FrameworkMetrics m = store.getMetrics();
        assertEquals(5, m.totalPatterns());
        assertEquals(1, m.totalRelationships());
        assertEquals(2, m.domainCount());
        assertEquals(3, m.orphanedPatterns());
        assertEquals(0.8, m.averageRelationshipStrength(), 1e-12);
        assertEquals(0.9, m.averageConfidence(), 1e-12);
        assertEquals(3, m.patternsByType().get(PatternType.PROPERTY));
        assertEquals(2, m.patternsByType().get(PatternType.PROCESS));
        assertEquals(0, m.patternsByType().get(PatternType.PERSPECTIVE));
    }

    @Test
    void testEmptyStoreMetrics() {
        FrameworkMetrics m = store.getMetrics();
        assertEquals(0, m.totalPatterns());
        assertEquals(0.0, m.averageRelationshipStrength());
        assertEquals(0.0, m.averageConfidence());
        assertEquals(0, m.validationIssues());
    }

    @Test
    void testMetricsFollowMutations() {
        populateSecurityScenario(store);
        assertEquals(3, store.getMetrics().orphanedPatterns());

        store.addRelationship(link("rel-2", "p2", "r2", null, 0.2, 0.5));
        FrameworkMetrics m = store.getMetrics();
        assertEquals(2, m.totalRelationships());
        assertEquals(1, m.orphanedPatterns());
        assertEquals(0.5, m.averageRelationshipStrength(), 1e-12);

        store.updatePattern(store.getPattern("p3").orElseThrow().withStatus(PatternStatus.DEPRECATED));
        assertEquals(1, store.getMetrics().deprecatedPatterns());
    }

    @Test
    void testSearchIsCaseInsensitiveOverNameAndDescription() {
        store.addPattern(Pattern.builder(PatternType.PROCESS, "Threat Modeling")
                .id("a").description("Identify attack surfaces").build());
        store.addPattern(Pattern.builder(PatternType.PROCESS, "Code Review")
                .id("b").description("Peer review for THREATS").build());
        store.addPattern(Pattern.builder(PatternType.PROCESS, "Deployment").id("c").build());

        assertEquals(Set.of("a", "b"), Set.copyOf(ids(store.searchPatterns("threat"))));
        assertEquals(List.of("a"), ids(store.searchPatterns("ATTACK")));
        assertTrue(store.searchPatterns("nothing-like-this").isEmpty());
    }

    @Test
    void testFindPatternsCombinesFilters() {
        store.addPattern(property("p1", "Confidentiality", "security", "cia"));
        store.addPattern(property("p2", "Integrity", "security"));
        store.addPattern(process("r1", "Confidential Filing", "security", "cia"));

        PatternQuery query = PatternQuery.any().withType(PatternType.PROPERTY).withTag("cia");
        assertEquals(List.of("p1"), ids(store.findPatterns(query)));
        assertEquals(3, store.findPatterns(PatternQuery.any().withDomain("security")).size());
    }

    @Test
    void testUpdatePatternReindexes() {
        store.addPattern(property("p1", "Confidentiality", "security", "cia"));
        Pattern moved = store.getPattern("p1").orElseThrow().withDomain("privacy").withTags(Set.of("gdpr"));

        Pattern stored = store.updatePattern(moved);

        assertEquals("privacy", stored.domain());
        assertTrue(store.getPatternsByDomain("security").isEmpty());
        assertTrue(store.getPatternsByTag("cia").isEmpty());
        assertEquals(List.of("p1"), ids(store.getPatternsByDomain("privacy")));
        assertEquals(List.of("p1"), ids(store.getPatternsByTag("gdpr")));
        assertTrue(store.validateFramework().valid());
    }

    @Test
    void testUpdateKeepsCreationTimeAndRefreshesUpdateTime() {
        Instant created = Instant.parse("2020-01-01T00:00:00Z");
        Instant stale = Instant.parse("2021-01-01T00:00:00Z");
        store.addPattern(new Pattern("p1", PatternType.PROPERTY, "Confidentiality", null, "security",
                Set.of(), Map.of(), 1.0, PatternStatus.DRAFT, created, created));

        Pattern replacement = new Pattern("p1", PatternType.PROPERTY, "Confidentiality", "Data stays private",
                "security", Set.of(), Map.of(), 0.9, PatternStatus.VALIDATED, stale, stale);
        Instant before = Instant.now();
        Pattern stored = store.updatePattern(replacement);

        assertEquals(created, stored.createdAt());
        assertFalse(stored.updatedAt().isBefore(before));
        assertEquals("Data stays private", stored.description());
        assertEquals(PatternStatus.VALIDATED, stored.status());
        assertEquals(stored, store.getPattern("p1").orElseThrow());
    }

    @Test
    void testUpdateUnknownOrRetypedPattern() {
        assertThrows(PatternNotFoundException.class,
                () -> store.updatePattern(property("ghost", "Ghost", "x")));
        store.addPattern(property("p1", "Confidentiality", "security"));
        assertThrows(InvalidPatternException.class,
                () -> store.updatePattern(process("p1", "Confidentiality", "security")));
    }

    @Test
    void testHotSwapRewritesOnlyMatchingSlot() {
        populateSecurityScenario(store);
        store.addRelationship(link("rel-2", "p1", "r2", null, 0.3, 0.4));
        Pattern oldP = store.getPattern("p1").orElseThrow();
        Pattern newP = store.getPattern("p2").orElseThrow();
        Relationship before = store.getRelationship("rel-1").orElseThrow();

        int swapped = store.hotSwapDimension(oldP, newP);

        assertEquals(2, swapped);
        assertTrue(store.getRelationshipsByPattern("p1").isEmpty());
        assertEquals(Set.of("rel-1", "rel-2"),
                store.getRelationshipsByPattern("p2").stream().map(Relationship::id).collect(Collectors.toSet()));
        Relationship after = store.getRelationship("rel-1").orElseThrow();
        assertEquals("p2", after.propertyId());
        assertEquals("r1", after.processId());
        assertEquals(before.strength(), after.strength());
        assertEquals(before.confidence(), after.confidence());
        assertEquals(before.createdAt(), after.createdAt());
        assertTrue(store.getPattern("p1").isPresent(), "old pattern stays registered");
        assertTrue(store.validateFramework().valid());
    }

    @Test
    void testHotSwapPreconditions() {
        populateSecurityScenario(store);
        Pattern p1 = store.getPattern("p1").orElseThrow();
        Pattern r1 = store.getPattern("r1").orElseThrow();

        assertThrows(PatternNotFoundException.class,
                () -> store.hotSwapDimension(p1, property("unregistered", "Ghost", "security")));
        assertThrows(InvalidPatternException.class, () -> store.hotSwapDimension(p1, r1));
        assertEquals(0, store.hotSwapDimension(p1, p1));
        assertEquals(0, store.hotSwapDimension(store.getPattern("p3").orElseThrow(),
                store.getPattern("p2").orElseThrow()));
        assertEquals("p1", store.getRelationship("rel-1").orElseThrow().propertyId());
    }

    @Test
    void testClear() {
        populateSecurityScenario(store);
        store.clear();
        assertTrue(store.allPatterns().isEmpty());
        assertTrue(store.allRelationships().isEmpty());
        assertTrue(store.getPatternsByDomain("security").isEmpty());
        assertEquals(0, store.getMetrics().totalPatterns());
    }

    @Test
    void testCountsAndIndexedKeys() {
        populateSecurityScenario(store);
        store.addPattern(Pattern.property("Accountability", "security")
                .withDescription("Actions are traceable to a principal")
                .withTags(Set.of("Audit"))
                .withMetadata("source", "iso27001"));

        assertEquals(6, store.patternCount());
        assertEquals(1, store.relationshipCount());
        assertEquals(Set.of("security", "ops"), store.domains());
        assertEquals(Set.of("audit"), store.tags());

        PatternQuery query = PatternQuery.any().withNameContaining("ACCOUNT").withStatus(PatternStatus.DRAFT);
        Pattern found = store.findPatterns(query).get(0);
        assertEquals("iso27001", found.metadata().get("source"));
        assertEquals(1, store.searchPatterns("traceable").size());
    }

    private static List<String> ids(List<Pattern> patterns) {
        return patterns.stream().map(Pattern::id).toList();
    }
}
