package com.unit.catalog.store;

/**
 * The identity columns of a persisted unit, as read by the matcher.
 */
public record UnitSummary(long id, String slug, String fullName, double tonnage, Integer externalId) {}
