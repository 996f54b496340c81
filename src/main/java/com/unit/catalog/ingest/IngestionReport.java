package com.unit.catalog.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of an ingestion run. Every rejected, failed or partially resolved unit is
 * listed by name; nothing is dropped silently.
 *
 * @param runId          run identifier, also present in the log MDC
 * @param unitFiles      unit files seen in the archive
 * @param parsed         files that parsed into a unit
 * @param created        units created
 * @param updated        units whose stored values changed
 * @param unchanged      units re-ingested without change
 * @param skipped        files skipped because the checkpoint lists them as committed
 * @param otherEntries   archive entries that are not unit files
 * @param rejected       files the parsers could not interpret
 * @param failed         units whose transaction failed and was rolled back
 * @param resolutionGaps construction labels with no matching alias
 * @param aborted        whether the run stopped early after reaching the error limit
 * @param durationMillis wall-clock duration
 */
public record IngestionReport(
        String runId,
        long unitFiles,
        long parsed,
        long created,
        long updated,
        long unchanged,
        long skipped,
        long otherEntries,
        List<EntryIssue> rejected,
        List<EntryIssue> failed,
        List<ResolutionGap> resolutionGaps,
        boolean aborted,
        long durationMillis
) {
    public IngestionReport {
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
        failed = failed != null ? List.copyOf(failed) : List.of();
        resolutionGaps = resolutionGaps != null ? List.copyOf(resolutionGaps) : List.of();
    }

    public long successCount() {
        return created + updated + unchanged;
    }

    public boolean hasErrors() {
        return !rejected.isEmpty() || !failed.isEmpty();
    }

    /**
     * A unit file that was rejected by its parser or failed to persist.
     *
     * @param entry    archive entry name
     * @param unitSlug unit slug, null when the file did not parse
     * @param reason   rejection reason or error message
     */
    public record EntryIssue(String entry, String unitSlug, String reason) {}

    /**
     * A construction label that was present but matched no alias.
     */
    public record ResolutionGap(String unitSlug, String category, String label) {}

    @Override
    public String toString() {
        return "IngestionReport{files=" + unitFiles +
                ", parsed=" + parsed +
                ", created=" + created +
                ", updated=" + updated +
                ", unchanged=" + unchanged +
                ", skipped=" + skipped +
                ", rejected=" + rejected.size() +
                ", failed=" + failed.size() +
                ", gaps=" + resolutionGaps.size() +
                (aborted ? ", aborted" : "") + '}';
    }

    /**
     * Thread-safe accumulator used while a run is in progress.
     */
    static final class Collector {
        private final String runId;
        private final long startNanos = System.nanoTime();
        private long unitFiles;
        private long parsed;
        private long created;
        private long updated;
        private long unchanged;
        private long skipped;
        private long otherEntries;
        private final List<EntryIssue> rejected = new ArrayList<>();
        private final List<EntryIssue> failed = new ArrayList<>();
        private final List<ResolutionGap> gaps = new ArrayList<>();
        private boolean aborted;

        Collector(String runId) {
            this.runId = runId;
        }

        synchronized long unitFile() {
            return ++unitFiles;
        }

        synchronized void otherEntry() {
            otherEntries++;
        }

        synchronized void skipped() {
            skipped++;
        }

        synchronized void rejected(String entry, String reason) {
            rejected.add(new EntryIssue(entry, null, reason));
        }

        synchronized void parsed() {
            parsed++;
        }

        synchronized int failed(String entry, String slug, String reason) {
            failed.add(new EntryIssue(entry, slug, reason));
            return failed.size();
        }

        synchronized void stored(UnitIngestResult result) {
            switch (result.status()) {
                case CREATED -> created++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
            result.gaps().forEach(gap ->
                    gaps.add(new ResolutionGap(result.slug(), gap.category().getKey(), gap.label())));
        }

        synchronized void abort() {
            aborted = true;
        }

        synchronized IngestionReport build() {
            return new IngestionReport(runId, unitFiles, parsed, created, updated, unchanged, skipped,
                    otherEntries, rejected, failed, gaps, aborted, (System.nanoTime() - startNanos) / 1_000_000);
        }
    }
}
