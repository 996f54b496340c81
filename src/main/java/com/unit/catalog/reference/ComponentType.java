package com.unit.catalog.reference;

import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.RulesLevel;
import com.unit.catalog.core.model.TechBase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One canonical construction option within a category, e.g. the Clan XL engine.
 *
 * <p>{@code properties} holds the category-specific numeric columns (weight multiplier,
 * critical slots, points per ton, ...). They are stored for downstream rule engines and
 * not interpreted here.</p>
 *
 * @param category   construction category
 * @param slug       unique slug within the category
 * @param name       display name
 * @param techBase   technology base
 * @param rulesLevel rules level
 * @param introYear  introduction year, or null if unknown
 * @param properties category-specific column values, in column order
 * @param aliases    raw labels that denote this type
 */
public record ComponentType(
        ComponentCategory category,
        String slug,
        String name,
        TechBase techBase,
        RulesLevel rulesLevel,
        Integer introYear,
        Map<String, Object> properties,
        List<String> aliases
) {
    public ComponentType {
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be blank");
        }
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        aliases = List.copyOf(aliases);
    }
}
