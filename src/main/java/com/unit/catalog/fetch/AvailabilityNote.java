package com.unit.catalog.fetch;

/**
 * One faction that fielded a unit during one era, as printed on a detail page.
 * Availability is binary: a listed pair means available.
 */
public record AvailabilityNote(String eraName, String factionName) {}
