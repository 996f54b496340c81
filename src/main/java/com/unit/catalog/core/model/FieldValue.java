package com.unit.catalog.core.model;

/**
 * A field value together with the source that set it. Both are null for an unset field.
 */
public record FieldValue(Object value, FieldSource source) {

    public static final FieldValue EMPTY = new FieldValue(null, null);

    public static FieldValue of(Object value, FieldSource source) {
        return value == null ? EMPTY : new FieldValue(value, source);
    }

    public boolean isSet() {
        return value != null;
    }
}
