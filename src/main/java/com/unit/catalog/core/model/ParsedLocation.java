package com.unit.catalog.core.model;

/**
 * Armor and structure allocation for one body location.
 *
 * @param location        the body location
 * @param armor           front armor points, or null if not given
 * @param rearArmor       rear armor points, or null if not given
 * @param structure       internal structure points, or null if not given
 */
public record ParsedLocation(LocationName location, Integer armor, Integer rearArmor, Integer structure) {

    public ParsedLocation {
        if (location == null) {
            throw new IllegalArgumentException("location must not be null");
        }
    }
}
