package com.unit.catalog.core.model;

import java.util.Locale;

/**
 * Technology base of a unit or piece of equipment.
 */
public enum TechBase {
    INNER_SPHERE("inner_sphere"),
    CLAN("clan"),
    MIXED("mixed"),
    PRIMITIVE("primitive");

    private final String dbValue;

    TechBase(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    /**
     * Derives the tech base from free text such as {@code "Clan"}, {@code "Mixed (IS Chassis)"}
     * or {@code "IS Level 2"}. Anything unrecognised is Inner Sphere.
     */
    public static TechBase fromText(String text) {
        if (text == null) {
            return INNER_SPHERE;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("clan") && !lower.contains("inner")) {
            return CLAN;
        }
        if (lower.contains("mixed")) {
            return MIXED;
        }
        if (lower.contains("primitive")) {
            return PRIMITIVE;
        }
        return INNER_SPHERE;
    }

    public static TechBase fromDbValue(String value) {
        for (TechBase techBase : values()) {
            if (techBase.dbValue.equals(value)) {
                return techBase;
            }
        }
        throw new IllegalArgumentException("Unknown tech base: " + value);
    }
}
