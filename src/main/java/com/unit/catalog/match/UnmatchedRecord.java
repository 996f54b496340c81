package com.unit.catalog.match;

/**
 * An external record that cleared no matching tier, kept for manual curation.
 */
public record UnmatchedRecord(int externalId, String externalName, String computedSlug, double tonnage,
                              String reason) {}
