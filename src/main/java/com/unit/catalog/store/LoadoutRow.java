package com.unit.catalog.store;

import com.unit.catalog.core.model.LocationName;

/**
 * One persisted equipment placement. {@code location} is null for unplaced gear.
 */
public record LoadoutRow(long equipmentId, LocationName location, int quantity, boolean rearFacing) {}
