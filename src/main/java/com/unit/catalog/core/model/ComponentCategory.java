package com.unit.catalog.core.model;

/**
 * The seven construction categories with a curated catalog of canonical types.
 *
 * <p>Gyro, cockpit and myomer are left out of unit files when they are standard, so a
 * missing label in those categories means "standard". The other four categories have no
 * such convention and an absent or unknown label stays unresolved.</p>
 */
public enum ComponentCategory {
    ENGINE("engine", false),
    ARMOR("armor", false),
    STRUCTURE("structure", false),
    HEAT_SINK("heatsink", false),
    GYRO("gyro", true),
    COCKPIT("cockpit", true),
    MYOMER("myomer", true);

    private final String key;
    private final boolean defaultsToStandard;

    ComponentCategory(String key, boolean defaultsToStandard) {
        this.key = key;
        this.defaultsToStandard = defaultsToStandard;
    }

    public String getKey() {
        return key;
    }

    /**
     * Whether an unresolved label in this category is filled with the standard entry.
     */
    public boolean defaultsToStandard() {
        return defaultsToStandard;
    }

    public static ComponentCategory fromKey(String key) {
        for (ComponentCategory category : values()) {
            if (category.key.equals(key)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown component category: " + key);
    }
}
