package com.unit.catalog.match;

import com.unit.catalog.fetch.CatalogRecord;
import com.unit.catalog.store.UnitSummary;

import java.util.Optional;

/**
 * One tier of the matching chain. A tier either names exactly one stored unit or
 * declines; it never scores.
 */
public interface MatchStrategy {

    /**
     * Short tier name used in reports and metrics.
     */
    String tier();

    Optional<UnitSummary> match(CatalogRecord record, UnitIndex index);
}
