package com.unit.catalog.fetch;

/**
 * One unit as listed by the external catalog.
 *
 * @param externalId  external catalog id
 * @param name        display name, possibly in dual form such as {@code Dasher (Fire Moth) A}
 * @param className   chassis class, null when absent
 * @param variant     variant designation, null when absent
 * @param tonnage     tonnage
 * @param battleValue battle value, null when the listing gives none or zero
 * @param cost        C-bill cost, null when the listing gives none or zero
 * @param rules       rules level label, null when absent
 * @param introYear   first four-digit year of the introduction date, null when absent
 * @param technology  tech base label, null when absent
 * @param role        tactical role, trimmed, null when absent
 * @param unitType    unit type label, null when absent
 */
public record CatalogRecord(
        int externalId,
        String name,
        String className,
        String variant,
        double tonnage,
        Integer battleValue,
        Long cost,
        String rules,
        Integer introYear,
        String technology,
        String role,
        String unitType
) {}
