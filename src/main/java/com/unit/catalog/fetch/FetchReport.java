package com.unit.catalog.fetch;

import java.util.List;

/**
 * Outcome of one fetch run.
 *
 * @param partitionsFetched listing partitions fetched in this run
 * @param partitionsSkipped listing partitions already stored or permanently failed
 * @param detailsFetched    detail pages fetched in this run
 * @param detailsSkipped    detail pages already stored or permanently failed
 * @param externalIds       distinct external ids across all stored listings
 * @param failures          resources that failed in this run
 * @param durationMillis    wall-clock duration
 */
public record FetchReport(
        int partitionsFetched,
        int partitionsSkipped,
        int detailsFetched,
        int detailsSkipped,
        int externalIds,
        List<FetchFailure> failures,
        long durationMillis
) {
    public FetchReport {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return "FetchReport{partitions=" + partitionsFetched + " fetched/" + partitionsSkipped + " skipped"
                + ", details=" + detailsFetched + " fetched/" + detailsSkipped + " skipped"
                + ", ids=" + externalIds + ", failures=" + failures.size()
                + ", duration=" + durationMillis + "ms}";
    }
}
