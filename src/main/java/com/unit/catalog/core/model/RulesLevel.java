package com.unit.catalog.core.model;

import java.util.Locale;

/**
 * Rules level of a unit or piece of equipment.
 */
public enum RulesLevel {
    INTRODUCTORY("introductory"),
    STANDARD("standard"),
    ADVANCED("advanced"),
    EXPERIMENTAL("experimental"),
    UNOFFICIAL("unofficial");

    private final String dbValue;

    RulesLevel(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    /**
     * Maps the numeric level used by line-oriented unit files.
     */
    public static RulesLevel fromLevel(int level) {
        return switch (level) {
            case 0 -> INTRODUCTORY;
            case 2 -> ADVANCED;
            case 3 -> EXPERIMENTAL;
            case 4, 5 -> UNOFFICIAL;
            default -> STANDARD;
        };
    }

    /**
     * Maps the type string used by tag files, e.g. {@code "IS Level 2"}.
     */
    public static RulesLevel fromTypeText(String text) {
        if (text == null) {
            return STANDARD;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("level 1")) {
            return STANDARD;
        }
        if (lower.contains("level 2")) {
            return ADVANCED;
        }
        if (lower.contains("level 3")) {
            return EXPERIMENTAL;
        }
        if (lower.contains("unofficial")) {
            return UNOFFICIAL;
        }
        return STANDARD;
    }
}
