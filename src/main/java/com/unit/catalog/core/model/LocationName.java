package com.unit.catalog.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Body locations for mechs and vehicles.
 */
public enum LocationName {
    HEAD("head"),
    CENTER_TORSO("center_torso"),
    LEFT_TORSO("left_torso"),
    RIGHT_TORSO("right_torso"),
    LEFT_ARM("left_arm"),
    RIGHT_ARM("right_arm"),
    LEFT_LEG("left_leg"),
    RIGHT_LEG("right_leg"),
    FRONT("front"),
    REAR("rear"),
    LEFT_SIDE("left_side"),
    RIGHT_SIDE("right_side"),
    TURRET("turret"),
    BODY("body");

    private final String dbValue;

    LocationName(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    /**
     * Resolves a mech location written either in full ({@code "Left Arm"}) or as its
     * short code ({@code "LA"}).
     */
    public static Optional<LocationName> fromMechText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "left arm", "la" -> Optional.of(LEFT_ARM);
            case "right arm", "ra" -> Optional.of(RIGHT_ARM);
            case "left torso", "lt" -> Optional.of(LEFT_TORSO);
            case "right torso", "rt" -> Optional.of(RIGHT_TORSO);
            case "center torso", "ct" -> Optional.of(CENTER_TORSO);
            case "head", "hd" -> Optional.of(HEAD);
            case "left leg", "ll" -> Optional.of(LEFT_LEG);
            case "right leg", "rl" -> Optional.of(RIGHT_LEG);
            default -> Optional.empty();
        };
    }

    /**
     * Resolves the location prefix of a tag-file equipment block, e.g. {@code "Front"}
     * from {@code <Front Equipment>}.
     */
    public static Optional<LocationName> fromBlockPrefix(String prefix) {
        if (prefix == null) {
            return Optional.empty();
        }
        return switch (prefix.trim().toLowerCase(Locale.ROOT)) {
            case "front" -> Optional.of(FRONT);
            case "rear" -> Optional.of(REAR);
            case "right" -> Optional.of(RIGHT_SIDE);
            case "left" -> Optional.of(LEFT_SIDE);
            case "turret" -> Optional.of(TURRET);
            case "body" -> Optional.of(BODY);
            case "left arm" -> Optional.of(LEFT_ARM);
            case "right arm" -> Optional.of(RIGHT_ARM);
            default -> Optional.empty();
        };
    }

    public static LocationName fromDbValue(String value) {
        for (LocationName location : values()) {
            if (location.dbValue.equals(value)) {
                return location;
            }
        }
        throw new IllegalArgumentException("Unknown location: " + value);
    }
}
