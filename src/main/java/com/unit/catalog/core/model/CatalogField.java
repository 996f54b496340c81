package com.unit.catalog.core.model;

/**
 * Unit fields that carry a provenance tag and can be enriched by the external catalog.
 * Each maps to a value column and a {@code *_source} column on the units table.
 */
public enum CatalogField {
    BATTLE_VALUE("bv", Integer.class),
    COST("cost", Long.class),
    ROLE("role", String.class),
    INTRO_YEAR("intro_year", Integer.class),
    ALTERNATE_NAME("clan_name", String.class);

    private final String column;
    private final Class<?> valueType;

    CatalogField(String column, Class<?> valueType) {
        this.column = column;
        this.valueType = valueType;
    }

    public String getColumn() {
        return column;
    }

    public String getSourceColumn() {
        return column + "_source";
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
