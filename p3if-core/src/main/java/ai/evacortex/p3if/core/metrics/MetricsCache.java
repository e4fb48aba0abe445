/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.metrics;

import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import ai.evacortex.p3if.core.storage.PatternStore;
import ai.evacortex.p3if.core.storage.RelationshipStore;
import ai.evacortex.p3if.core.storage.util.AutoLock;
import ai.evacortex.p3if.core.storage.util.ConcurrencyGuard;
import ai.evacortex.p3if.core.validation.Validator;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregate statistics over both stores, cached per store instance.
 *
 * <p>The cached value expires after the configured timeout and is dropped immediately by
 * {@link #invalidate()}, which every successful mutation calls while holding the write lock.
 * Recomputation runs under the read side of the same lock, so it always sees both maps at
 * one consistent point.</p>
 */
public class MetricsCache {

    private static final Logger log = LoggerFactory.getLogger(MetricsCache.class);
    private static final String KEY = "metrics";

    private final ConcurrencyGuard guard;
    private final PatternStore patterns;
    private final RelationshipStore relationships;
    private final Validator validator;
    private final Cache<String, FrameworkMetrics> cache;
    private final AtomicLong computations = new AtomicLong();

    public MetricsCache(ConcurrencyGuard guard, PatternStore patterns, RelationshipStore relationships,
                        Validator validator, Duration timeout) {
        this(guard, patterns, relationships, validator, timeout, Ticker.systemTicker());
    }

    public MetricsCache(ConcurrencyGuard guard, PatternStore patterns, RelationshipStore relationships,
                        Validator validator, Duration timeout, Ticker ticker) {
        this.guard = guard;
        this.patterns = patterns;
        this.relationships = relationships;
        this.validator = validator;
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(timeout)
                .ticker(ticker)
                .build();
    }

    public FrameworkMetrics getMetrics() {
        FrameworkMetrics cached = cache.getIfPresent(KEY);
        if (cached != null) return cached;
        try (AutoLock ignored = guard.read()) {
            return cache.get(KEY, k -> compute());
        }
    }

    public void invalidate() {
        try (AutoLock ignored = guard.write()) {
            cache.invalidate(KEY);
        }
    }

    /**
     * Number of full recomputations performed so far.
     */
    public long computations() {
        return computations.get();
    }

    private FrameworkMetrics compute() {
        computations.incrementAndGet();
        List<Pattern> allPatterns = patterns.all();
        List<Relationship> allRelationships = relationships.all();

        Map<PatternType, Integer> byType = new EnumMap<>(PatternType.class);
        for (PatternType type : PatternType.values()) byType.put(type, 0);

        Set<String> domains = new HashSet<>();
        int orphaned = 0;
        int deprecated = 0;
        for (Pattern p : allPatterns) {
            byType.merge(p.type(), 1, Integer::sum);
            if (p.domain() != null) domains.add(p.domain());
            if (relationships.referenceCount(p.id()) == 0) orphaned++;
            if (p.deprecated()) deprecated++;
        }

        double strengthSum = 0.0;
        double confidenceSum = 0.0;
        for (Relationship r : allRelationships) {
            strengthSum += r.strength();
            confidenceSum += r.confidence();
        }
        int relCount = allRelationships.size();
        double avgStrength = relCount == 0 ? 0.0 : strengthSum / relCount;
        double avgConfidence = relCount == 0 ? 0.0 : confidenceSum / relCount;

        int issues = validator.validateFramework().issues().size();

        FrameworkMetrics metrics = new FrameworkMetrics(allPatterns.size(), relCount, avgStrength, avgConfidence,
                domains.size(), orphaned, deprecated, issues, byType, Instant.now());
        log.debug("Recomputed metrics: {} patterns, {} relationships, {} orphaned",
                metrics.totalPatterns(), metrics.totalRelationships(), metrics.orphanedPatterns());
        return metrics;
    }
}
