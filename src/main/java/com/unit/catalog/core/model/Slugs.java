package com.unit.catalog.core.model;

/**
 * Slug derivation shared by every identity key in the catalog.
 *
 * <p>ASCII letters and digits are kept (lowercased); every run of other characters
 * becomes one hyphen; leading and trailing hyphens are dropped. The equipment identity
 * cache, the persistence layer's unique slug columns and the matcher all use this one
 * function, so they always agree on identity.</p>
 */
public final class Slugs {

    private Slugs() {
    }

    public static String toSlug(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder slug = new StringBuilder(text.length());
        boolean pendingHyphen = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean alphanumeric = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (alphanumeric) {
                if (pendingHyphen && slug.length() > 0) {
                    slug.append('-');
                }
                pendingHyphen = false;
                slug.append(Character.toLowerCase(c));
            } else {
                pendingHyphen = true;
            }
        }
        return slug.toString();
    }

    /**
     * Display name of a variant: chassis and model joined by a space, or the chassis alone.
     */
    public static String fullName(String chassis, String model) {
        if (model == null || model.isBlank()) {
            return chassis;
        }
        return chassis + " " + model;
    }

    public static String unitSlug(String chassis, String model) {
        return toSlug(fullName(chassis, model));
    }

    /**
     * Chassis slug, qualified by unit category so identical names in different
     * categories stay distinct.
     */
    public static String chassisSlug(String chassis, UnitType unitType) {
        return toSlug(chassis) + "-" + unitType.getDbValue();
    }
}
