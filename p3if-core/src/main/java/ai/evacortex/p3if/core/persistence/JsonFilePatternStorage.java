/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.persistence;

import ai.evacortex.p3if.core.io.codec.JsonMappers;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.*;
import java.util.function.Supplier;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps the whole data set in one JSON file, rewritten after every change.
 *
 * <p>An unreadable file is logged and treated as empty; the broken file is left in place until the
 * next successful write replaces it.</p>
 */
public class JsonFilePatternStorage implements PatternStorage {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePatternStorage.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final Map<String, Relationship> relationships = new LinkedHashMap<>();
    private boolean batching;
    private boolean dirty;

    record FileContent(@JsonProperty("patterns") Map<String, Pattern> patterns,
                       @JsonProperty("relationships") Map<String, Relationship> relationships) {}

    public static JsonFilePatternStorage loadOrCreate(Path path) {
        JsonFilePatternStorage storage = new JsonFilePatternStorage(path);
        if (Files.exists(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                FileContent content = storage.mapper.readValue(in, FileContent.class);
                if (content.patterns() != null) storage.patterns.putAll(content.patterns());
                if (content.relationships() != null) storage.relationships.putAll(content.relationships());
            } catch (IOException | RuntimeException e) {
                log.warn("Unreadable storage file {}, starting empty: {}", path, e.getMessage());
                storage.patterns.clear();
                storage.relationships.clear();
            }
        }
        return storage;
    }

    private JsonFilePatternStorage(Path file) {
        this.file = file;
        this.mapper = JsonMappers.create();
    }

    @Override
    public void savePattern(Pattern pattern) {
        inBatch(() -> {
            patterns.put(pattern.id(), pattern);
            dirty = true;
            return null;
        });
    }

    @Override
    public Optional<Pattern> getPattern(String id) {
        rwLock.readLock().lock();
        try {
            return Optional.ofNullable(patterns.get(id));
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public List<Pattern> getPatternsByType(PatternType type) {
        rwLock.readLock().lock();
        try {
            return patterns.values().stream().filter(p -> p.type() == type).toList();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean deletePattern(String id) {
        return inBatch(() -> {
            if (patterns.remove(id) == null) return false;
            dirty = true;
            return true;
        });
    }

    @Override
    public void saveRelationship(Relationship relationship) {
        inBatch(() -> {
            relationships.put(relationship.id(), relationship);
            dirty = true;
            return null;
        });
    }

    @Override
    public Optional<Relationship> getRelationship(String id) {
        rwLock.readLock().lock();
        try {
            return Optional.ofNullable(relationships.get(id));
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean deleteRelationship(String id) {
        return inBatch(() -> {
            if (relationships.remove(id) == null) return false;
            dirty = true;
            return true;
        });
    }

    @Override
    public void clear() {
        inBatch(() -> {
            patterns.clear();
            relationships.clear();
            dirty = true;
            return null;
        });
    }

    @Override
    public Snapshot loadAll() {
        rwLock.readLock().lock();
        try {
            return new Snapshot(new ArrayList<>(patterns.values()), new ArrayList<>(relationships.values()));
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * Holds this storage's write lock for the whole of {@code work} and rewrites the file once at the
     * end. On failure the in-memory maps are restored to their state before the call; the file is
     * not touched unless the final write succeeds. Single mutations run as one-item batches.
     */
    @Override
    public <T> T inBatch(Supplier<T> work) {
        rwLock.writeLock().lock();
        try {
            if (batching) return work.get();
            Map<String, Pattern> patternsBefore = new LinkedHashMap<>(patterns);
            Map<String, Relationship> relationshipsBefore = new LinkedHashMap<>(relationships);
            batching = true;
            dirty = false;
            try {
                T result = work.get();
                if (dirty) flush();
                return result;
            } catch (RuntimeException e) {
                patterns.clear();
                patterns.putAll(patternsBefore);
                relationships.clear();
                relationships.putAll(relationshipsBefore);
                log.warn("Storage batch on {} discarded: {}", file, e.getMessage());
                throw e;
            } finally {
                batching = false;
                dirty = false;
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public Path file() {
        return file;
    }

    private void flush() {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            try (OutputStream out = Files.newOutputStream(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, new FileContent(patterns, relationships));
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush storage file " + file, e);
        }
    }
}
