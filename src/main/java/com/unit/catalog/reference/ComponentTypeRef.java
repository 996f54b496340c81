package com.unit.catalog.reference;

import com.unit.catalog.core.model.ComponentCategory;

/**
 * A persisted canonical component type: its store id plus the identity it was seeded with.
 */
public record ComponentTypeRef(long id, ComponentCategory category, String slug) {}
