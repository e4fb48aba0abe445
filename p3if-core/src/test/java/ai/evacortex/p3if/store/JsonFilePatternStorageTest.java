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
import ai.evacortex.p3if.core.config.FrameworkConfig;
import ai.evacortex.p3if.core.engine.ExternalPatternData;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.persistence.InMemoryPatternStorage;
import ai.evacortex.p3if.core.persistence.JsonFilePatternStorage;
import ai.evacortex.p3if.core.persistence.PatternStorage;
import ai.evacortex.p3if.core.storage.FrameworkStoreImpl;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static ai.evacortex.p3if.core.PatternTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class JsonFilePatternStorageTest {

    @TempDir Path tempDir;

    @Test
    void testStorageContract() {
        JsonFilePatternStorage storage = JsonFilePatternStorage.loadOrCreate(tempDir.resolve("p3if.json"));
        storage.savePattern(property("p1", "Confidentiality", "security"));
        storage.savePattern(process("r1", "Incident Response", "ops"));
        storage.saveRelationship(link("rel-1", "p1", "r1", null, 0.8, 0.9));

        assertTrue(Files.exists(storage.file()));
        assertEquals("Confidentiality", storage.getPattern("p1").orElseThrow().name());
        assertEquals(1, storage.getPatternsByType(PatternType.PROCESS).size());
        assertEquals(0.8, storage.getRelationship("rel-1").orElseThrow().strength(), 1e-12);

        assertTrue(storage.deleteRelationship("rel-1"));
        assertFalse(storage.deleteRelationship("rel-1"));
        assertTrue(storage.deletePattern("r1"));
        assertFalse(storage.deletePattern("r1"));
        assertTrue(storage.getPattern("r1").isEmpty());

        storage.clear();
        assertTrue(storage.loadAll().patterns().isEmpty());
    }

    @Test
    void testStoreWritesThroughAndReopens() {
        Path file = tempDir.resolve("framework.json");
        FrameworkConfig config = FrameworkConfig.defaults();

        FrameworkStore first = FrameworkStoreImpl.open(config, JsonFilePatternStorage.loadOrCreate(file));
        populateSecurityScenario(first);
        first.removePattern("p3");
        first.hotSwapDimension(first.getPattern("p1").orElseThrow(), first.getPattern("p2").orElseThrow());

        FrameworkStore reopened = FrameworkStoreImpl.open(config, JsonFilePatternStorage.loadOrCreate(file));

        assertEquals(4, reopened.allPatterns().size());
        assertTrue(reopened.getPattern("p3").isEmpty());
        Relationship rel = reopened.getRelationship("rel-1").orElseThrow();
        assertEquals("p2", rel.propertyId());
        assertEquals(0.9, rel.confidence(), 1e-12);
        assertEquals(2, reopened.getMetrics().orphanedPatterns());
        assertTrue(reopened.validateFramework().issues().stream().noneMatch(i -> i.rule().endsWith("_index")));
    }

    @Test
    void testCascadeRemovalReachesStorage() {
        InMemoryPatternStorage storage = new InMemoryPatternStorage();
        FrameworkStore store = FrameworkStoreImpl.open(FrameworkConfig.defaults(), storage);
        populateSecurityScenario(store);

        store.removePattern("r1");

        assertTrue(storage.getRelationship("rel-1").isEmpty());
        assertTrue(storage.getPattern("r1").isEmpty());
        assertEquals(4, storage.loadAll().patterns().size());

        store.clear();
        assertTrue(storage.loadAll().patterns().isEmpty());
    }

    @Test
    void testCorruptFileFallsBackToEmpty() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ this is not json");

        JsonFilePatternStorage storage = JsonFilePatternStorage.loadOrCreate(file);
        assertTrue(storage.loadAll().patterns().isEmpty());
        assertTrue(storage.loadAll().relationships().isEmpty());

        storage.savePattern(property("p1", "Confidentiality", "security"));
        assertEquals(1, JsonFilePatternStorage.loadOrCreate(file).loadAll().patterns().size());
    }

    @Test
    void testDanglingPersistedRelationshipIsSkippedOnLoad() {
        PatternStorage storage = new InMemoryPatternStorage();
        storage.savePattern(property("p1", "Confidentiality", "security"));
        storage.saveRelationship(link("orphan", "p1", "gone", null, 0.5, 0.5));

        FrameworkStore store = FrameworkStoreImpl.open(FrameworkConfig.defaults(), storage);

        assertEquals(1, store.allPatterns().size());
        assertTrue(store.allRelationships().isEmpty());
        assertTrue(store.validateFramework().valid());
    }

    @Test
    void testBatchWritesFileOnceAtTheEnd() {
        Path file = tempDir.resolve("batched.json");
        JsonFilePatternStorage storage = JsonFilePatternStorage.loadOrCreate(file);

        int saved = storage.inBatch(() -> {
            storage.savePattern(property("p1", "Confidentiality", "security"));
            storage.savePattern(process("r1", "Incident Response", "ops"));
            storage.saveRelationship(link("rel-1", "p1", "r1", null, 0.8, 0.9));
            assertFalse(Files.exists(file), "file must not be written inside a batch");
            return 3;
        });

        assertEquals(3, saved);
        assertTrue(Files.exists(file));
        assertEquals(2, JsonFilePatternStorage.loadOrCreate(file).loadAll().patterns().size());
    }

    @Test
    void testFailedBatchRestoresPreviousContent() {
        Path file = tempDir.resolve("restored.json");
        JsonFilePatternStorage storage = JsonFilePatternStorage.loadOrCreate(file);
        storage.savePattern(property("p1", "Confidentiality", "security"));

        assertThrows(IllegalStateException.class, () -> storage.inBatch(() -> {
            storage.deletePattern("p1");
            storage.savePattern(property("p2", "Integrity", "security"));
            throw new IllegalStateException("abort");
        }));

        assertTrue(storage.getPattern("p1").isPresent());
        assertTrue(storage.getPattern("p2").isEmpty());
        assertEquals(1, JsonFilePatternStorage.loadOrCreate(file).loadAll().patterns().size());
    }

    @Test
    void testUnwritableFileLeavesStoreUnchanged() throws Exception {
        Path blocked = tempDir.resolve("blocked.json");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("occupant"), "x");

        FrameworkStore store = FrameworkStoreImpl.open(FrameworkConfig.defaults(),
                JsonFilePatternStorage.loadOrCreate(blocked));

        assertThrows(UncheckedIOException.class,
                () -> store.addPattern(property("p1", "Confidentiality", "security")));
        assertEquals(0, store.patternCount());

        Map<PatternType, List<ExternalPatternData>> batch = Map.of(PatternType.PROCESS, List.of(
                ExternalPatternData.of("x1", "Triage", "ops"),
                ExternalPatternData.of("x2", "Escalation", "ops")));
        assertThrows(UncheckedIOException.class, () -> store.multiplexFrameworks(batch));
        assertEquals(0, store.patternCount());
        assertTrue(store.getPatternsByDomain("ops").isEmpty());
    }
}
