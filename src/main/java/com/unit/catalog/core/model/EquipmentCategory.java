package com.unit.catalog.core.model;

import java.util.Locale;

/**
 * Coarse equipment category, inferred from the equipment's display name.
 */
public enum EquipmentCategory {
    ENERGY_WEAPON("energy_weapon"),
    BALLISTIC_WEAPON("ballistic_weapon"),
    MISSILE_WEAPON("missile_weapon"),
    PHYSICAL_WEAPON("physical_weapon"),
    AMMUNITION("ammunition"),
    EQUIPMENT("equipment"),
    ARMOR("armor"),
    STRUCTURE("structure"),
    ENGINE("engine"),
    GYRO("gyro"),
    COCKPIT("cockpit"),
    ACTUATOR("actuator"),
    HEAT_SINK("heat_sink"),
    JUMP_JET("jump_jet"),
    TARGETING_COMPUTER("targeting_computer");

    private final String dbValue;

    EquipmentCategory(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public boolean isWeapon() {
        return this == ENERGY_WEAPON || this == BALLISTIC_WEAPON
                || this == MISSILE_WEAPON || this == PHYSICAL_WEAPON;
    }

    /**
     * Classifies equipment by keywords in its name. Order matters: ammunition is checked
     * before weapon keywords so {@code "IS Ammo AC/10"} is ammunition, not a ballistic weapon.
     */
    public static EquipmentCategory classify(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("ammo")) {
            return AMMUNITION;
        }
        if (lower.contains("heat sink")) {
            return HEAT_SINK;
        }
        if (lower.contains("jump jet")) {
            return JUMP_JET;
        }
        if (lower.contains("targeting computer")) {
            return TARGETING_COMPUTER;
        }
        if (lower.contains("gyro")) {
            return GYRO;
        }
        if (lower.contains("cockpit")) {
            return COCKPIT;
        }
        if (lower.contains("endo steel") || lower.contains("structure")) {
            return STRUCTURE;
        }
        if (lower.contains("ferro") || lower.contains("reactive armor") || lower.contains("stealth")) {
            return ARMOR;
        }
        if (lower.contains("engine")) {
            return ENGINE;
        }
        if (containsAny(lower, "laser", "ppc", "flamer", "plasma rifle")) {
            return ENERGY_WEAPON;
        }
        if (containsAny(lower, "lrm", "srm", "streak", "narc", "ams", "mml", "atm",
                "rocket", "arrow", "thunderbolt")) {
            return MISSILE_WEAPON;
        }
        if (containsAny(lower, "autocannon", "ac/", "gauss", "rifle", "lbx", "ultra", "rotary", "hag")) {
            return BALLISTIC_WEAPON;
        }
        if (containsAny(lower, "hatchet", "sword", "claws", "mace", "lance", "talons")) {
            return PHYSICAL_WEAPON;
        }
        return EQUIPMENT;
    }

    /**
     * Tech base of a piece of equipment from its name prefix ({@code CL...} or {@code Clan ...}).
     */
    public static TechBase techBaseOf(String name) {
        if (name.startsWith("CL") || name.toLowerCase(Locale.ROOT).startsWith("clan")) {
            return TechBase.CLAN;
        }
        return TechBase.INNER_SPHERE;
    }

    public static EquipmentCategory fromDbValue(String value) {
        for (EquipmentCategory category : values()) {
            if (category.dbValue.equals(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown equipment category: " + value);
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
