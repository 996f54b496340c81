package com.unit.catalog.merge;

import java.util.List;
import java.util.Set;

/**
 * Outcome of importing availability from stored detail pages.
 *
 * @param unitsImported   units whose availability was replaced
 * @param rowsWritten     availability rows written
 * @param unitsSkipped    units skipped because they already had availability
 * @param missingDetails  matched units with no stored detail page
 * @param factionsCreated factions created from external names
 * @param unmappedEras    era display names with no local era
 * @param failed          units whose import transaction failed, as {@code externalId: reason}
 */
public record AvailabilityResult(int unitsImported, int rowsWritten, int unitsSkipped, int missingDetails,
                                 int factionsCreated, Set<String> unmappedEras, List<String> failed) {

    public AvailabilityResult {
        unmappedEras = unmappedEras != null ? Set.copyOf(unmappedEras) : Set.of();
        failed = failed != null ? List.copyOf(failed) : List.of();
    }

    public static AvailabilityResult none() {
        return new AvailabilityResult(0, 0, 0, 0, 0, Set.of(), List.of());
    }
}
