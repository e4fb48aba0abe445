/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.storage;

import ai.evacortex.p3if.core.exceptions.DuplicateIdException;
import ai.evacortex.p3if.core.exceptions.InvalidPatternException;
import ai.evacortex.p3if.core.exceptions.PatternNotFoundException;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.storage.util.AutoLock;
import ai.evacortex.p3if.core.storage.util.ConcurrencyGuard;

import java.time.Instant;
import java.util.*;

/**
 * Primary pattern map plus type, domain and tag indexes.
 *
 * <p>Index sets hold pattern ids only; lookups materialize from the primary map, so an id is
 * visible through an index exactly while its pattern is stored.</p>
 */
public class PatternStore {

    private final ConcurrencyGuard guard;
    private final StoreListener listener;

    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final Map<PatternType, Set<String>> byType = new EnumMap<>(PatternType.class);
    private final Map<String, Set<String>> byDomain = new HashMap<>();
    private final Map<String, Set<String>> byTag = new HashMap<>();

    public PatternStore(ConcurrencyGuard guard, StoreListener listener) {
        this.guard = guard;
        this.listener = listener;
        for (PatternType type : PatternType.values()) {
            byType.put(type, new LinkedHashSet<>());
        }
    }

    public String add(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        try (AutoLock ignored = guard.write()) {
            if (patterns.containsKey(pattern.id())) {
                throw new DuplicateIdException("Pattern", pattern.id());
            }
            patterns.put(pattern.id(), pattern);
            index(pattern);
            try {
                listener.patternSaved(pattern);
            } catch (RuntimeException e) {
                unindex(pattern);
                patterns.remove(pattern.id());
                throw e;
            }
            return pattern.id();
        }
    }

    /**
     * Replaces a stored pattern that has the same id and type, moving it between domain and tag
     * indexes as needed. The stored creation time is kept and the update time is set to now.
     */
    public Pattern update(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        try (AutoLock ignored = guard.write()) {
            Pattern existing = patterns.get(pattern.id());
            if (existing == null) throw new PatternNotFoundException(pattern.id());
            if (existing.type() != pattern.type()) {
                throw new InvalidPatternException("cannot change type of '" + pattern.id() + "' from "
                        + existing.type().key() + " to " + pattern.type().key());
            }
            Pattern stored = new Pattern(pattern.id(), pattern.type(), pattern.name(), pattern.description(),
                    pattern.domain(), pattern.tags(), pattern.metadata(), pattern.qualityScore(),
                    pattern.status(), existing.createdAt(), Instant.now());
            unindex(existing);
            patterns.put(stored.id(), stored);
            index(stored);
            try {
                listener.patternSaved(stored);
            } catch (RuntimeException e) {
                unindex(stored);
                patterns.put(existing.id(), existing);
                index(existing);
                throw e;
            }
            return stored;
        }
    }

    public Optional<Pattern> get(String id) {
        try (AutoLock ignored = guard.read()) {
            return Optional.ofNullable(patterns.get(id));
        }
    }

    public boolean contains(String id) {
        try (AutoLock ignored = guard.read()) {
            return patterns.containsKey(id);
        }
    }

    public List<Pattern> getByType(PatternType type) {
        try (AutoLock ignored = guard.read()) {
            return materialize(byType.get(type));
        }
    }

    public List<Pattern> getByDomain(String domain) {
        try (AutoLock ignored = guard.read()) {
            return materialize(byDomain.get(domain));
        }
    }

    public List<Pattern> getByTag(String tag) {
        if (tag == null) return List.of();
        try (AutoLock ignored = guard.read()) {
            return materialize(byTag.get(tag.strip().toLowerCase(Locale.ROOT)));
        }
    }

    public boolean remove(String id) {
        try (AutoLock ignored = guard.write()) {
            Pattern removed = patterns.remove(id);
            if (removed == null) return false;
            unindex(removed);
            try {
                listener.patternRemoved(id);
            } catch (RuntimeException e) {
                patterns.put(id, removed);
                index(removed);
                throw e;
            }
            return true;
        }
    }

    public List<Pattern> search(String substring) {
        if (substring == null) return List.of();
        String needle = substring.toLowerCase(Locale.ROOT);
        try (AutoLock ignored = guard.read()) {
            List<Pattern> out = new ArrayList<>();
            for (Pattern p : patterns.values()) {
                if (containsIgnoreCase(p.name(), needle) || containsIgnoreCase(p.description(), needle)) {
                    out.add(p);
                }
            }
            return out;
        }
    }

    public List<Pattern> find(PatternQuery query) {
        try (AutoLock ignored = guard.read()) {
            Collection<String> candidates = query.type() != null ? byType.get(query.type()) : patterns.keySet();
            List<Pattern> out = new ArrayList<>();
            for (String id : candidates) {
                Pattern p = patterns.get(id);
                if (p != null && query.matches(p)) out.add(p);
            }
            return out;
        }
    }

    public List<Pattern> all() {
        try (AutoLock ignored = guard.read()) {
            return List.copyOf(patterns.values());
        }
    }

    public int size() {
        try (AutoLock ignored = guard.read()) {
            return patterns.size();
        }
    }

    public Set<String> domains() {
        try (AutoLock ignored = guard.read()) {
            return Set.copyOf(byDomain.keySet());
        }
    }

    public Set<String> tags() {
        try (AutoLock ignored = guard.read()) {
            return Set.copyOf(byTag.keySet());
        }
    }

    /**
     * Index ids that no longer resolve in the primary map. Empty unless the indexes were corrupted.
     */
    public Set<String> staleIndexEntries() {
        try (AutoLock ignored = guard.read()) {
            Set<String> stale = new TreeSet<>();
            byType.values().forEach(ids -> collectStale(ids, stale));
            byDomain.values().forEach(ids -> collectStale(ids, stale));
            byTag.values().forEach(ids -> collectStale(ids, stale));
            return stale;
        }
    }

    public void clear() {
        try (AutoLock ignored = guard.write()) {
            patterns.clear();
            byType.values().forEach(Set::clear);
            byDomain.clear();
            byTag.clear();
        }
    }

    private void index(Pattern p) {
        byType.get(p.type()).add(p.id());
        if (p.domain() != null) {
            byDomain.computeIfAbsent(p.domain(), k -> new LinkedHashSet<>()).add(p.id());
        }
        for (String tag : p.tags()) {
            byTag.computeIfAbsent(tag, k -> new LinkedHashSet<>()).add(p.id());
        }
    }

    private void unindex(Pattern p) {
        byType.get(p.type()).remove(p.id());
        if (p.domain() != null) removeFrom(byDomain, p.domain(), p.id());
        for (String tag : p.tags()) {
            removeFrom(byTag, tag, p.id());
        }
    }

    private static void removeFrom(Map<String, Set<String>> index, String key, String id) {
        Set<String> ids = index.get(key);
        if (ids == null) return;
        ids.remove(id);
        if (ids.isEmpty()) index.remove(key);
    }

    private void collectStale(Set<String> ids, Set<String> stale) {
        for (String id : ids) {
            if (!patterns.containsKey(id)) stale.add(id);
        }
    }

    private List<Pattern> materialize(Set<String> ids) {
        if (ids == null || ids.isEmpty()) return List.of();
        List<Pattern> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Pattern p = patterns.get(id);
            if (p != null) out.add(p);
        }
        return out;
    }

    private static boolean containsIgnoreCase(String haystack, String lowerNeedle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
