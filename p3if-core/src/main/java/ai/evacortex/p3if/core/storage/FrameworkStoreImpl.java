/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.storage;

import ai.evacortex.p3if.core.FrameworkStore;
import ai.evacortex.p3if.core.config.FrameworkConfig;
import ai.evacortex.p3if.core.engine.DimensionSwapper;
import ai.evacortex.p3if.core.engine.ExternalFramework;
import ai.evacortex.p3if.core.engine.MultiplexResult;
import ai.evacortex.p3if.core.engine.Multiplexer;
import ai.evacortex.p3if.core.exceptions.DanglingReferenceException;
import ai.evacortex.p3if.core.exceptions.DuplicateIdException;
import ai.evacortex.p3if.core.io.codec.FrameworkDocument;
import ai.evacortex.p3if.core.io.codec.FrameworkJsonCodec;
import ai.evacortex.p3if.core.metrics.FrameworkMetrics;
import ai.evacortex.p3if.core.metrics.MetricsCache;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.persistence.PatternStorage;
import ai.evacortex.p3if.core.storage.util.AutoLock;
import ai.evacortex.p3if.core.storage.util.ConcurrencyGuard;
import ai.evacortex.p3if.core.validation.ValidationReport;
import ai.evacortex.p3if.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

public class FrameworkStoreImpl implements FrameworkStore {

    private static final Logger log = LoggerFactory.getLogger(FrameworkStoreImpl.class);

    private final ConcurrencyGuard guard = new ConcurrencyGuard();
    private final PatternStorage storage;
    private final PatternStore patterns;
    private final RelationshipStore relationships;
    private final Validator validator;
    private final MetricsCache metrics;
    private final DimensionSwapper swapper;
    private final Multiplexer multiplexer;
    private final FrameworkJsonCodec codec = new FrameworkJsonCodec();

    private boolean hydrating;

    public FrameworkStoreImpl() {
        this(FrameworkConfig.defaults(), null);
    }

    public FrameworkStoreImpl(FrameworkConfig config) {
        this(config, null);
    }

    /**
     * @param storage optional persistence that receives every committed mutation; may be {@code null}
     */
    public FrameworkStoreImpl(FrameworkConfig config, PatternStorage storage) {
        this.storage = storage;
        StoreListener listener = new WriteThrough();
        this.patterns = new PatternStore(guard, listener);
        this.relationships = new RelationshipStore(guard, patterns, listener);
        this.validator = new Validator(guard, patterns, relationships);
        this.metrics = new MetricsCache(guard, patterns, relationships, validator, config.metricsTimeout());
        this.swapper = new DimensionSwapper(guard, patterns, relationships);
        this.multiplexer = new Multiplexer(guard, patterns, relationships);
    }

    /**
     * Creates a store attached to {@code storage} and loads everything it already holds.
     * Persisted relationships that no longer resolve are logged and left out.
     */
    public static FrameworkStoreImpl open(FrameworkConfig config, PatternStorage storage) {
        FrameworkStoreImpl store = new FrameworkStoreImpl(config, storage);
        store.hydrate(storage.loadAll());
        return store;
    }

    @Override
    public String addPattern(Pattern pattern) {
        return patterns.add(pattern);
    }

    @Override
    public Optional<Pattern> getPattern(String id) {
        return patterns.get(id);
    }

    @Override
    public List<Pattern> getPatternsByType(PatternType type) {
        return patterns.getByType(type);
    }

    @Override
    public List<Pattern> getPatternsByDomain(String domain) {
        return patterns.getByDomain(domain);
    }

    @Override
    public List<Pattern> getPatternsByTag(String tag) {
        return patterns.getByTag(tag);
    }

    @Override
    public Pattern updatePattern(Pattern pattern) {
        return patterns.update(pattern);
    }

    @Override
    public boolean removePattern(String id) {
        return composite(() -> {
            if (!patterns.contains(id)) return false;
            List<Relationship> dependents = relationships.getByPattern(id);
            for (Relationship rel : dependents) {
                relationships.remove(rel.id());
            }
            patterns.remove(id);
            if (!dependents.isEmpty()) {
                log.info("Removed pattern '{}' with {} dependent relationship(s)", id, dependents.size());
            }
            return true;
        });
    }

    @Override
    public List<Pattern> searchPatterns(String substring) {
        return patterns.search(substring);
    }

    @Override
    public List<Pattern> findPatterns(PatternQuery query) {
        return patterns.find(query);
    }

    @Override
    public List<Pattern> allPatterns() {
        return patterns.all();
    }

    @Override
    public String addRelationship(Relationship relationship) {
        return relationships.add(relationship);
    }

    @Override
    public Optional<Relationship> getRelationship(String id) {
        return relationships.get(id);
    }

    @Override
    public boolean removeRelationship(String id) {
        return relationships.remove(id);
    }

    @Override
    public List<Relationship> getRelationshipsByPattern(String patternId) {
        return relationships.getByPattern(patternId);
    }

    @Override
    public List<Relationship> allRelationships() {
        return relationships.all();
    }

    @Override
    public ValidationReport validateFramework() {
        return validator.validateFramework();
    }

    @Override
    public FrameworkMetrics getMetrics() {
        return metrics.getMetrics();
    }

    @Override
    public void invalidateMetrics() {
        metrics.invalidate();
    }

    @Override
    public int hotSwapDimension(Pattern oldPattern, Pattern newPattern) {
        return composite(() -> swapper.hotSwap(oldPattern, newPattern));
    }

    @Override
    public MultiplexResult multiplexFrameworks(ExternalFramework external) {
        return composite(() -> multiplexer.multiplex(external));
    }

    /**
     * Decodes a multiplex payload with {@link FrameworkJsonCodec#readExternal(String)} and merges it.
     */
    public MultiplexResult multiplexJson(String json) {
        return multiplexFrameworks(codec.readExternal(json));
    }

    @Override
    public String exportToJson() {
        try (AutoLock ignored = guard.read()) {
            return codec.export(patterns.all(), relationships.all());
        }
    }

    @Override
    public ImportSummary importFromJson(String json) {
        FrameworkDocument doc = codec.read(json);
        return composite(() -> {
            List<String> addedPatterns = new ArrayList<>();
            List<String> addedRelationships = new ArrayList<>();
            try {
                for (Pattern p : doc.patterns()) {
                    addedPatterns.add(patterns.add(p));
                }
                for (Relationship r : doc.relationships()) {
                    addedRelationships.add(relationships.add(r));
                }
            } catch (RuntimeException e) {
                undoImport(addedPatterns, addedRelationships, e);
                log.warn("Import rolled back after {} pattern(s) and {} relationship(s): {}",
                        addedPatterns.size(), addedRelationships.size(), e.getMessage());
                throw e;
            }
            log.info("Imported {} pattern(s) and {} relationship(s) (schema {})",
                    addedPatterns.size(), addedRelationships.size(), doc.schemaVersion());
            return new ImportSummary(addedPatterns.size(), addedRelationships.size());
        });
    }

    @Override
    public int patternCount() {
        return patterns.size();
    }

    @Override
    public int relationshipCount() {
        return relationships.size();
    }

    @Override
    public Set<String> domains() {
        return patterns.domains();
    }

    @Override
    public Set<String> tags() {
        return patterns.tags();
    }

    @Override
    public void clear() {
        try (AutoLock ignored = guard.write()) {
            if (storage != null) storage.clear();
            relationships.clear();
            patterns.clear();
            metrics.invalidate();
        }
    }

    /**
     * Runs a multi-step mutation under the write lock as a single storage batch. When the batch
     * fails, storage is back at its state before the call and the in-memory stores are reloaded
     * from it.
     */
    private <T> T composite(Supplier<T> work) {
        try (AutoLock ignored = guard.write()) {
            if (storage == null) return work.get();
            try {
                return storage.inBatch(work);
            } catch (RuntimeException e) {
                reload();
                throw e;
            }
        }
    }

    private void reload() {
        relationships.clear();
        patterns.clear();
        metrics.invalidate();
        hydrate(storage.loadAll());
    }

    private void undoImport(List<String> addedPatterns, List<String> addedRelationships, RuntimeException cause) {
        for (String id : addedRelationships) {
            try {
                relationships.remove(id);
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
        for (String id : addedPatterns) {
            try {
                patterns.remove(id);
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
    }

    private void hydrate(PatternStorage.Snapshot snapshot) {
        try (AutoLock ignored = guard.write()) {
            hydrating = true;
            try {
                snapshot.patterns().forEach(patterns::add);
                for (Relationship r : snapshot.relationships()) {
                    try {
                        relationships.add(r);
                    } catch (DanglingReferenceException | DuplicateIdException e) {
                        log.warn("Skipping persisted relationship: {}", e.getMessage());
                    }
                }
            } finally {
                hydrating = false;
            }
            log.info("Loaded {} pattern(s) and {} relationship(s) from storage",
                    patterns.size(), relationships.size());
        }
    }

    private final class WriteThrough implements StoreListener {

        @Override
        public void patternSaved(Pattern pattern) {
            metrics.invalidate();
            if (persisting()) storage.savePattern(pattern);
        }

        @Override
        public void patternRemoved(String patternId) {
            metrics.invalidate();
            if (persisting()) storage.deletePattern(patternId);
        }

        @Override
        public void relationshipSaved(Relationship relationship) {
            metrics.invalidate();
            if (persisting()) storage.saveRelationship(relationship);
        }

        @Override
        public void relationshipRemoved(String relationshipId) {
            metrics.invalidate();
            if (persisting()) storage.deleteRelationship(relationshipId);
        }

        private boolean persisting() {
            return storage != null && !hydrating;
        }
    }
}
