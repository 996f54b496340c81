package com.unit.catalog.store;

import com.unit.catalog.core.model.EquipmentCategory;
import com.unit.catalog.core.model.EquipmentStats;

import java.util.List;

/**
 * A persisted equipment entry with its current statistics.
 *
 * @param id                store id
 * @param slug              unique slug
 * @param name              display name
 * @param category          coarse category
 * @param stats             current statistics, components null when unknown
 * @param statsSource       provenance of the statistics, null when never enriched
 * @param ammoForId         parent weapon id for ammunition, null when unlinked
 * @param observedLocations locations this equipment has been placed in, empty when unknown
 */
public record EquipmentRow(
        long id,
        String slug,
        String name,
        EquipmentCategory category,
        EquipmentStats stats,
        String statsSource,
        Long ammoForId,
        List<String> observedLocations
) {
    public EquipmentRow {
        observedLocations = observedLocations != null ? List.copyOf(observedLocations) : List.of();
    }
}
