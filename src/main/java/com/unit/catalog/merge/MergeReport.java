package com.unit.catalog.merge;

import com.unit.catalog.match.UnmatchedRecord;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one merge run.
 *
 * @param runId               run identifier, also present in the log context
 * @param records             distinct external records considered
 * @param matched             records matched to a stored unit
 * @param matchedByTier       matches per tier name
 * @param unitsUpdated        units with at least one merged field change
 * @param fieldChanges        merged value changes per field column
 * @param externalIdConflicts matches whose external id is already held by another unit
 * @param unmatched           records that cleared no tier
 * @param failed              unreadable listings and records whose merge transaction failed, with the reason
 * @param availability        availability import outcome
 * @param durationMillis      wall-clock duration
 */
public record MergeReport(
        String runId,
        int records,
        int matched,
        Map<String, Integer> matchedByTier,
        int unitsUpdated,
        Map<String, Integer> fieldChanges,
        int externalIdConflicts,
        List<UnmatchedRecord> unmatched,
        List<String> failed,
        AvailabilityResult availability,
        long durationMillis
) {
    public MergeReport {
        matchedByTier = matchedByTier != null ? Map.copyOf(matchedByTier) : Map.of();
        fieldChanges = fieldChanges != null ? Map.copyOf(fieldChanges) : Map.of();
        unmatched = unmatched != null ? List.copyOf(unmatched) : List.of();
        failed = failed != null ? List.copyOf(failed) : List.of();
        availability = availability != null ? availability : AvailabilityResult.none();
    }

    @Override
    public String toString() {
        return "MergeReport{runId=" + runId + ", records=" + records + ", matched=" + matched
                + ", byTier=" + matchedByTier + ", unitsUpdated=" + unitsUpdated
                + ", fieldChanges=" + fieldChanges + ", unmatched=" + unmatched.size()
                + ", failed=" + failed.size() + ", availabilityUnits=" + availability.unitsImported()
                + ", availabilityFailed=" + availability.failed().size()
                + ", duration=" + durationMillis + "ms}";
    }
}
