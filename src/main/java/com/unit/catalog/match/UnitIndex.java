package com.unit.catalog.match;

import com.unit.catalog.store.UnitSummary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup tables over the stored units, built once per matching run.
 *
 * <p>Slugs are unique. Compact slugs and lowercased full names may collide; a colliding
 * key resolves to nothing rather than to an arbitrary unit.</p>
 */
public class UnitIndex {

    private final Map<String, UnitSummary> bySlug = new HashMap<>();
    private final Map<String, List<UnitSummary>> byCompactSlug = new HashMap<>();
    private final Map<String, List<UnitSummary>> byLowerName = new HashMap<>();

    public UnitIndex(Collection<UnitSummary> units) {
        for (UnitSummary unit : units) {
            bySlug.put(unit.slug(), unit);
            byCompactSlug.computeIfAbsent(MatchNames.compact(unit.slug()), k -> new ArrayList<>()).add(unit);
            byLowerName.computeIfAbsent(MatchNames.lower(unit.fullName()), k -> new ArrayList<>()).add(unit);
        }
    }

    public Optional<UnitSummary> bySlug(String slug) {
        return Optional.ofNullable(bySlug.get(slug));
    }

    public Optional<UnitSummary> byCompactSlug(String compactSlug) {
        return unique(byCompactSlug.get(compactSlug));
    }

    public Optional<UnitSummary> byFullName(String name) {
        return unique(byLowerName.get(MatchNames.lower(name)));
    }

    public int size() {
        return bySlug.size();
    }

    private static Optional<UnitSummary> unique(List<UnitSummary> candidates) {
        return candidates != null && candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }
}
