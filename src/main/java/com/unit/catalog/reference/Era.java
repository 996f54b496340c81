package com.unit.catalog.reference;

/**
 * A named period of the setting's timeline. {@code endYear} is null for the current era.
 */
public record Era(String slug, String name, int startYear, Integer endYear, String description) {

    public boolean contains(int year) {
        return year >= startYear && (endYear == null || year <= endYear);
    }
}
