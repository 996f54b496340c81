package com.unit.catalog.metrics;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.UnitType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. Used by default when no metrics
 * backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordUnitDuration(UnitType type, Duration duration) {
    }

    @Override
    public void incrementUnitOutcome(UnitType type, String outcome) {
    }

    @Override
    public void incrementParseRejected(String format) {
    }

    @Override
    public void incrementUnresolvedComponent(ComponentCategory category) {
    }

    @Override
    public void recordEquipmentCacheHit() {
    }

    @Override
    public void recordEquipmentCacheMiss() {
    }

    @Override
    public void incrementFetchRequest(String kind) {
    }

    @Override
    public void incrementFetchRetry(String kind) {
    }

    @Override
    public void incrementFetchPermanentFailure(String kind) {
    }

    @Override
    public void incrementMatched(String tier) {
    }

    @Override
    public void incrementUnmatched() {
    }

    @Override
    public void incrementFieldChanged(CatalogField field) {
    }
}
