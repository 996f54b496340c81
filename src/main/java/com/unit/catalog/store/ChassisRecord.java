package com.unit.catalog.store;

import com.unit.catalog.core.model.TechBase;
import com.unit.catalog.core.model.UnitType;

/**
 * Values written when a chassis is first seen. An existing chassis is never rewritten.
 */
public record ChassisRecord(String slug, String name, UnitType unitType, TechBase techBase,
                            double tonnage, Integer introYear) {}
