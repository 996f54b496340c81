package com.unit.catalog.fetch;

import java.util.List;

/**
 * An inclusive tonnage range used to split listing queries below the upstream's
 * response-size ceiling.
 */
public record TonnagePartition(int minTons, int maxTons) {

    public static final List<TonnagePartition> DEFAULTS = List.of(
            new TonnagePartition(0, 25),
            new TonnagePartition(26, 35),
            new TonnagePartition(36, 45),
            new TonnagePartition(46, 55),
            new TonnagePartition(56, 65),
            new TonnagePartition(66, 75),
            new TonnagePartition(76, 85),
            new TonnagePartition(86, 100),
            new TonnagePartition(101, 200),
            new TonnagePartition(201, 999_999));

    public TonnagePartition {
        if (minTons < 0 || maxTons < minTons) {
            throw new IllegalArgumentException("Invalid tonnage range " + minTons + "-" + maxTons);
        }
    }

    /**
     * Parses {@code "min-max"}.
     */
    public static TonnagePartition parse(String range) {
        int dash = range.indexOf('-');
        if (dash <= 0) {
            throw new IllegalArgumentException("Tonnage range must look like min-max: " + range);
        }
        return new TonnagePartition(Integer.parseInt(range.substring(0, dash).trim()),
                Integer.parseInt(range.substring(dash + 1).trim()));
    }

    public String key() {
        return minTons + "-" + maxTons;
    }

    @Override
    public String toString() {
        return key();
    }
}
