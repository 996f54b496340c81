package com.unit.catalog.store;

/**
 * One (faction, era) availability pair of a unit.
 */
public record AvailabilityRow(long factionId, long eraId) {}
