package com.unit.catalog.store;

import com.unit.catalog.core.model.RulesLevel;
import com.unit.catalog.core.model.TechBase;

/**
 * Archive-owned scalar fields of a unit. Provenance-tracked fields are written separately.
 *
 * @param slug        unique unit slug
 * @param variant     variant designator, may be empty
 * @param fullName    chassis and variant joined
 * @param techBase    tech base
 * @param rulesLevel  rules level
 * @param tonnage     tonnage
 * @param sourceBook  originating source book, may be null
 * @param description free-text overview, may be null
 * @param externalId  external catalog id stated by the archive file, may be null
 */
public record UnitRecord(
        String slug,
        String variant,
        String fullName,
        TechBase techBase,
        RulesLevel rulesLevel,
        double tonnage,
        String sourceBook,
        String description,
        Integer externalId
) {}
