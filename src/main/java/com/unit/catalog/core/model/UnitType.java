package com.unit.catalog.core.model;

/**
 * Unit category. The database value is part of the chassis slug, so two chassis
 * sharing a name in different categories never collide.
 */
public enum UnitType {
    MECH("mech"),
    VEHICLE("vehicle"),
    FIGHTER("fighter"),
    OTHER("other");

    private final String dbValue;

    UnitType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }
}
