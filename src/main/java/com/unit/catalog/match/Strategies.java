package com.unit.catalog.match;

import com.unit.catalog.core.model.Slugs;
import com.unit.catalog.fetch.CatalogRecord;
import com.unit.catalog.store.UnitSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The built-in matching tiers, in the order {@link #standard(ManualOverrides)} chains them.
 */
public final class Strategies {

    private Strategies() {
    }

    public static List<MatchStrategy> standard(ManualOverrides overrides) {
        return List.of(
                new ManualOverrideStrategy(overrides),
                new ExactSlugStrategy(),
                new DualNameStrategy(),
                new NormalizedSlugStrategy(),
                new FullNameStrategy());
    }

    /**
     * External id looked up in the operator's override table.
     */
    public static final class ManualOverrideStrategy implements MatchStrategy {
        private final ManualOverrides overrides;

        public ManualOverrideStrategy(ManualOverrides overrides) {
            this.overrides = overrides;
        }

        @Override
        public String tier() {
            return "override";
        }

        @Override
        public Optional<UnitSummary> match(CatalogRecord record, UnitIndex index) {
            return overrides.target(record.externalId()).flatMap(index::bySlug);
        }
    }

    public static final class ExactSlugStrategy implements MatchStrategy {
        @Override
        public String tier() {
            return "exact_slug";
        }

        @Override
        public Optional<UnitSummary> match(CatalogRecord record, UnitIndex index) {
            return index.bySlug(Slugs.toSlug(record.name()));
        }
    }

    /**
     * Slugs of the two readings of a dual name, outer name first.
     */
    public static final class DualNameStrategy implements MatchStrategy {
        @Override
        public String tier() {
            return "dual_name";
        }

        @Override
        public Optional<UnitSummary> match(CatalogRecord record, UnitIndex index) {
            for (String alternative : MatchNames.dualNameAlternatives(record.name())) {
                Optional<UnitSummary> hit = index.bySlug(Slugs.toSlug(alternative));
                if (hit.isPresent()) {
                    return hit;
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Name without its trailing parenthetical, compared with case and punctuation removed.
     */
    public static final class NormalizedSlugStrategy implements MatchStrategy {
        @Override
        public String tier() {
            return "normalized_slug";
        }

        @Override
        public Optional<UnitSummary> match(CatalogRecord record, UnitIndex index) {
            Optional<UnitSummary> hit = index.byCompactSlug(MatchNames.compact(MatchNames.normalizeName(record.name())));
            return hit.isPresent() ? hit : index.byCompactSlug(MatchNames.compact(record.name()));
        }
    }

    /**
     * Case-insensitive full name, then its normalized and dual-name forms.
     */
    public static final class FullNameStrategy implements MatchStrategy {
        @Override
        public String tier() {
            return "full_name";
        }

        @Override
        public Optional<UnitSummary> match(CatalogRecord record, UnitIndex index) {
            List<String> candidates = new ArrayList<>();
            candidates.add(record.name());
            candidates.add(MatchNames.normalizeName(record.name()));
            candidates.addAll(MatchNames.dualNameAlternatives(record.name()));
            for (String candidate : candidates) {
                Optional<UnitSummary> hit = index.byFullName(candidate);
                if (hit.isPresent()) {
                    return hit;
                }
            }
            return Optional.empty();
        }
    }
}
