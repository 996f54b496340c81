package com.unit.catalog.core.model;

/**
 * Where a provenance-tracked unit field got its value. Higher {@link #getPriority()} wins.
 */
public enum FieldSource {
    ARCHIVE("archive", 10),
    CATALOG("catalog", 20),
    MANUAL("manual", 30);

    private final String dbValue;
    private final int priority;

    FieldSource(String dbValue, int priority) {
        this.dbValue = dbValue;
        this.priority = priority;
    }

    public String getDbValue() {
        return dbValue;
    }

    public int getPriority() {
        return priority;
    }

    public boolean outranks(FieldSource other) {
        return other == null || priority > other.priority;
    }

    public static FieldSource fromDbValue(String value) {
        if (value == null) {
            return null;
        }
        for (FieldSource source : values()) {
            if (source.dbValue.equals(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown field source: " + value);
    }
}
