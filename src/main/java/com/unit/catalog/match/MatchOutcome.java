package com.unit.catalog.match;

import com.unit.catalog.fetch.CatalogRecord;
import com.unit.catalog.store.UnitSummary;

import java.util.Optional;

/**
 * Result of running the matching chain over one external record.
 *
 * @param record the external record
 * @param unit   the matched unit, null when unmatched
 * @param tier   the tier that matched, null when unmatched
 * @param reason why nothing matched, null when matched
 */
public record MatchOutcome(CatalogRecord record, UnitSummary unit, String tier, String reason) {

    public static MatchOutcome matched(CatalogRecord record, UnitSummary unit, String tier) {
        return new MatchOutcome(record, unit, tier, null);
    }

    public static MatchOutcome unmatched(CatalogRecord record, String reason) {
        return new MatchOutcome(record, null, null, reason);
    }

    public boolean isMatched() {
        return unit != null;
    }

    public Optional<UnitSummary> getUnit() {
        return Optional.ofNullable(unit);
    }
}
