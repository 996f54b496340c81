package com.unit.catalog.merge;

import com.unit.catalog.core.model.FieldSource;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Options for merging external catalog data onto stored units.
 */
public class MergeOptions {

    private final FieldSource source;
    private final boolean force;
    private final boolean importAvailability;
    private final boolean forceAvailability;
    private final Path unmatchedFile;
    private final Path reportFile;

    private MergeOptions(Builder builder) {
        this.source = builder.source;
        this.force = builder.force;
        this.importAvailability = builder.importAvailability;
        this.forceAvailability = builder.forceAvailability;
        this.unmatchedFile = builder.unmatchedFile;
        this.reportFile = builder.reportFile;
    }

    public static MergeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Provenance tag written with every merged field.
     */
    public FieldSource getSource() {
        return source;
    }

    /**
     * Whether merged values replace values set by higher-priority sources.
     */
    public boolean isForce() {
        return force;
    }

    public boolean isImportAvailability() {
        return importAvailability;
    }

    /**
     * Whether units that already have availability rows are re-imported.
     */
    public boolean isForceAvailability() {
        return forceAvailability;
    }

    public Optional<Path> getUnmatchedFile() {
        return Optional.ofNullable(unmatchedFile);
    }

    public Optional<Path> getReportFile() {
        return Optional.ofNullable(reportFile);
    }

    @Override
    public String toString() {
        return "MergeOptions{source=" + source + ", force=" + force + ", availability=" + importAvailability
                + ", forceAvailability=" + forceAvailability + ", unmatchedFile=" + unmatchedFile + '}';
    }

    public static class Builder {
        private FieldSource source = FieldSource.CATALOG;
        private boolean force = false;
        private boolean importAvailability = true;
        private boolean forceAvailability = false;
        private Path unmatchedFile;
        private Path reportFile;

        public Builder source(FieldSource source) {
            this.source = source;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder importAvailability(boolean importAvailability) {
            this.importAvailability = importAvailability;
            return this;
        }

        public Builder forceAvailability(boolean forceAvailability) {
            this.forceAvailability = forceAvailability;
            return this;
        }

        public Builder unmatchedFile(Path unmatchedFile) {
            this.unmatchedFile = unmatchedFile;
            return this;
        }

        public Builder reportFile(Path reportFile) {
            this.reportFile = reportFile;
            return this;
        }

        public MergeOptions build() {
            if (source == null) {
                throw new IllegalArgumentException("source must not be null");
            }
            return new MergeOptions(this);
        }
    }
}
