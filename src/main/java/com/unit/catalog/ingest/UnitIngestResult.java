package com.unit.catalog.ingest;

import com.unit.catalog.reference.ComponentResolution;
import com.unit.catalog.store.UpsertResult;

import java.util.List;

/**
 * Outcome of ingesting one parsed unit.
 *
 * @param unitId store id of the unit
 * @param slug   unit slug
 * @param status whether the unit row was created, updated or left unchanged
 * @param gaps   construction labels that matched no alias
 */
public record UnitIngestResult(long unitId, String slug, UpsertResult.Status status,
                               List<ComponentResolution> gaps) {
    public UnitIngestResult {
        gaps = gaps != null ? List.copyOf(gaps) : List.of();
    }
}
