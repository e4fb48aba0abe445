/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.engine;

import ai.evacortex.p3if.core.exceptions.DanglingReferenceException;
import ai.evacortex.p3if.core.exceptions.DuplicateIdException;
import ai.evacortex.p3if.core.exceptions.InvalidPatternException;
import ai.evacortex.p3if.core.exceptions.OutOfRangeValueException;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.storage.PatternQuery;
import ai.evacortex.p3if.core.storage.PatternStore;
import ai.evacortex.p3if.core.storage.RelationshipStore;
import ai.evacortex.p3if.core.storage.util.AutoLock;
import ai.evacortex.p3if.core.storage.util.ConcurrencyGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Merges an {@link ExternalFramework} into the stores through the ordinary add operations.
 *
 * <p>Item failures are counted, never thrown: a duplicate id is a conflict, a (type, name, domain)
 * match with an existing pattern is a skip, and any relationship the store refuses is a rejection.
 * Payload items that could not be decoded count as skips and rejections the same way.
 * Relationship slots naming a skipped external pattern are redirected to the pattern it matched.</p>
 */
public class Multiplexer {

    private static final Logger log = LoggerFactory.getLogger(Multiplexer.class);

    private final ConcurrencyGuard guard;
    private final PatternStore patterns;
    private final RelationshipStore relationships;

    public Multiplexer(ConcurrencyGuard guard, PatternStore patterns, RelationshipStore relationships) {
        this.guard = guard;
        this.patterns = patterns;
        this.relationships = relationships;
    }

    public MultiplexResult multiplex(ExternalFramework external) {
        Objects.requireNonNull(external, "external must not be null");

        int integrated = 0;
        int skipped = 0;
        int conflicts = 0;
        int relIntegrated = 0;
        int relRejected = 0;
        List<String> failures = new ArrayList<>();
        Map<String, String> remap = new HashMap<>();

        skipped += external.undecodablePatterns().size();
        failures.addAll(external.undecodablePatterns());
        relRejected += external.undecodableRelationships().size();
        failures.addAll(external.undecodableRelationships());

        try (AutoLock ignored = guard.write()) {
            for (Map.Entry<PatternType, List<ExternalPatternData>> entry : external.patterns().entrySet()) {
                PatternType type = entry.getKey();
                for (ExternalPatternData item : entry.getValue()) {
                    Pattern candidate;
                    try {
                        candidate = item.toPattern(type);
                    } catch (InvalidPatternException e) {
                        skipped++;
                        failures.add(type.key() + " '" + item.id() + "': " + e.getMessage());
                        continue;
                    }

                    Optional<Pattern> twin = findIdentityMatch(candidate);
                    if (twin.isPresent()) {
                        skipped++;
                        if (item.id() != null && !item.id().equals(twin.get().id())) {
                            remap.put(item.id(), twin.get().id());
                        }
                        failures.add(type.key() + " '" + candidate.name() + "' matches existing '"
                                + twin.get().id() + "'");
                        continue;
                    }

                    try {
                        patterns.add(candidate);
                        integrated++;
                    } catch (DuplicateIdException e) {
                        conflicts++;
                        failures.add(e.getMessage());
                    }
                }
            }

            for (ExternalRelationshipData item : external.relationships()) {
                try {
                    Relationship rel = item.toRelationship(id -> remap.getOrDefault(id, id));
                    relationships.add(rel);
                    relIntegrated++;
                } catch (DanglingReferenceException | OutOfRangeValueException | DuplicateIdException e) {
                    relRejected++;
                    failures.add(e.getMessage());
                }
            }
        }

        MultiplexResult result = new MultiplexResult(integrated, skipped, conflicts,
                relIntegrated, relRejected, failures);
        log.info("Multiplexed {} external pattern(s): {} integrated, {} skipped, {} conflicts; "
                        + "relationships: {} integrated, {} rejected",
                external.patternCount(), integrated, skipped, conflicts, relIntegrated, relRejected);
        return result;
    }

    private Optional<Pattern> findIdentityMatch(Pattern candidate) {
        PatternQuery query = PatternQuery.any().withType(candidate.type()).withDomain(candidate.domain());
        for (Pattern existing : patterns.find(query)) {
            if (!Objects.equals(existing.domain(), candidate.domain())) continue;
            if (existing.name().equalsIgnoreCase(candidate.name())) return Optional.of(existing);
        }
        return Optional.empty();
    }
}
