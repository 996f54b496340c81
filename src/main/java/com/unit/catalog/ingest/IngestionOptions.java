package com.unit.catalog.ingest;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Options for one ingestion run.
 */
public class IngestionOptions {

    private final String datasetVersion;
    private final int maxErrors;
    private final int workers;
    private final int progressInterval;
    private final long equipmentCacheSize;
    private final Path checkpointFile;
    private final Path reportFile;

    private IngestionOptions(Builder builder) {
        this.datasetVersion = builder.datasetVersion;
        this.maxErrors = builder.maxErrors;
        this.workers = builder.workers;
        this.progressInterval = builder.progressInterval;
        this.equipmentCacheSize = builder.equipmentCacheSize;
        this.checkpointFile = builder.checkpointFile;
        this.reportFile = builder.reportFile;
    }

    public static IngestionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Version label recorded in the dataset metadata row.
     */
    public String getDatasetVersion() {
        return datasetVersion;
    }

    /**
     * Number of per-unit failures after which the run stops; 0 means never stop.
     */
    public int getMaxErrors() {
        return maxErrors;
    }

    public int getWorkers() {
        return workers;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public long getEquipmentCacheSize() {
        return equipmentCacheSize;
    }

    public Optional<Path> getCheckpointFile() {
        return Optional.ofNullable(checkpointFile);
    }

    /**
     * File the run report is written to as JSON when the run completes.
     */
    public Optional<Path> getReportFile() {
        return Optional.ofNullable(reportFile);
    }

    @Override
    public String toString() {
        return "IngestionOptions{version=" + datasetVersion + ", maxErrors=" + maxErrors
                + ", workers=" + workers + ", checkpoint=" + checkpointFile + '}';
    }

    public static class Builder {
        private String datasetVersion = "unversioned";
        private int maxErrors = 0;
        private int workers = 1;
        private int progressInterval = 100;
        private long equipmentCacheSize = 100_000;
        private Path checkpointFile;
        private Path reportFile;

        public Builder datasetVersion(String datasetVersion) {
            this.datasetVersion = datasetVersion;
            return this;
        }

        public Builder maxErrors(int maxErrors) {
            this.maxErrors = maxErrors;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder equipmentCacheSize(long equipmentCacheSize) {
            this.equipmentCacheSize = equipmentCacheSize;
            return this;
        }

        public Builder checkpointFile(Path checkpointFile) {
            this.checkpointFile = checkpointFile;
            return this;
        }

        public Builder reportFile(Path reportFile) {
            this.reportFile = reportFile;
            return this;
        }

        public IngestionOptions build() {
            if (datasetVersion == null || datasetVersion.isBlank()) {
                throw new IllegalArgumentException("datasetVersion must not be blank");
            }
            if (maxErrors < 0) {
                throw new IllegalArgumentException("maxErrors must be >= 0");
            }
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be >= 1");
            }
            if (progressInterval < 1) {
                throw new IllegalArgumentException("progressInterval must be >= 1");
            }
            if (equipmentCacheSize < 1) {
                throw new IllegalArgumentException("equipmentCacheSize must be >= 1");
            }
            return new IngestionOptions(this);
        }
    }
}
