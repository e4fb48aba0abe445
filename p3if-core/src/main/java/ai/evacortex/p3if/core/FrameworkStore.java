/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core;

import ai.evacortex.p3if.core.engine.ExternalFramework;
import ai.evacortex.p3if.core.engine.ExternalPatternData;
import ai.evacortex.p3if.core.engine.MultiplexResult;
import ai.evacortex.p3if.core.exceptions.*;
import ai.evacortex.p3if.core.metrics.FrameworkMetrics;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.storage.PatternQuery;
import ai.evacortex.p3if.core.validation.ValidationReport;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@code FrameworkStore} defines the contract of the in-memory P3IF engine: a store of
 * {@link Pattern}s in three fixed dimensions and the weighted {@link Relationship}s that link them.
 *
 * <p>Patterns are indexed by type, domain and tag; relationships are indexed by every pattern they
 * reference. Every reference inside a stored relationship resolves to a stored pattern of the
 * matching type, and every index agrees with its primary map after each completed mutation.</p>
 *
 * <p>Implementations must be thread-safe. All mutations, including the composite
 * {@link #hotSwapDimension(Pattern, Pattern)} and {@link #multiplexFrameworks(ExternalFramework)},
 * are serialized by one lock per store instance; reads never observe a partial update.</p>
 *
 * <p>Returned objects are immutable values, so callers can never alter stored state in place.</p>
 *
 * @see Pattern
 * @see Relationship
 * @see FrameworkMetrics
 */
public interface FrameworkStore {

    /**
     * Registers a pattern and indexes it by type, domain and tags.
     *
     * @return the pattern id
     * @throws DuplicateIdException if a pattern with the same id is already stored
     */
    String addPattern(Pattern pattern);

    Optional<Pattern> getPattern(String id);

    List<Pattern> getPatternsByType(PatternType type);

    List<Pattern> getPatternsByDomain(String domain);

    List<Pattern> getPatternsByTag(String tag);

    /**
     * Replaces a stored pattern with a new version carrying the same id and type.
     *
     * @throws PatternNotFoundException if no pattern has that id
     * @throws InvalidPatternException  if the type differs from the stored one
     */
    Pattern updatePattern(Pattern pattern);

    /**
     * Removes a pattern together with every relationship that references it.
     *
     * @return {@code false} if no pattern had that id; nothing changes in that case
     */
    boolean removePattern(String id);

    /**
     * Case-insensitive substring match over pattern names and descriptions.
     */
    List<Pattern> searchPatterns(String substring);

    List<Pattern> findPatterns(PatternQuery query);

    List<Pattern> allPatterns();

    /**
     * Registers a relationship after checking that each populated slot names a stored pattern of
     * that slot's type. A rejected relationship leaves the store untouched.
     *
     * @return the relationship id
     * @throws DuplicateIdException       if a relationship with the same id is already stored
     * @throws DanglingReferenceException if any populated slot does not resolve
     */
    String addRelationship(Relationship relationship);

    Optional<Relationship> getRelationship(String id);

    /**
     * @return {@code false} if no relationship had that id
     */
    boolean removeRelationship(String id);

    /**
     * Every relationship whose property, process or perspective slot equals {@code patternId}.
     */
    List<Relationship> getRelationshipsByPattern(String patternId);

    List<Relationship> allRelationships();

    /**
     * Runs every structural check over both stores. Never cached.
     */
    ValidationReport validateFramework();

    /**
     * Aggregate statistics, served from cache until the timeout elapses or a mutation happens.
     */
    FrameworkMetrics getMetrics();

    void invalidateMetrics();

    /**
     * Points every relationship that references {@code oldPattern} in its type's slot at
     * {@code newPattern} instead. {@code oldPattern} stays registered.
     *
     * @return number of relationships rewritten
     * @throws PatternNotFoundException if {@code newPattern} is not registered
     * @throws InvalidPatternException  if the patterns are of different types
     */
    int hotSwapDimension(Pattern oldPattern, Pattern newPattern);

    /**
     * Merges an external pattern and relationship set, counting failed items instead of aborting.
     */
    MultiplexResult multiplexFrameworks(ExternalFramework external);

    default MultiplexResult multiplexFrameworks(Map<PatternType, List<ExternalPatternData>> patterns) {
        return multiplexFrameworks(ExternalFramework.ofPatterns(patterns));
    }

    /**
     * Serializes all patterns and relationships into the exchange document.
     */
    String exportToJson();

    /**
     * Adds every pattern, then every relationship, of an exchange document. Either the whole
     * document is applied or, on the first rejected record, everything added so far is rolled back
     * and the failure is rethrown.
     *
     * @throws FrameworkImportException on malformed documents or checksum mismatch
     */
    ImportSummary importFromJson(String json);

    int patternCount();

    int relationshipCount();

    /**
     * Distinct non-null domains currently indexed.
     */
    Set<String> domains();

    /**
     * Distinct normalized tags currently indexed.
     */
    Set<String> tags();

    /**
     * Drops all patterns and relationships.
     */
    void clear();

    record ImportSummary(int patterns, int relationships) {}
}
