package com.unit.catalog.metrics;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.UnitType;

import java.time.Duration;

/**
 * Interface for recording ingestion, fetch and reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works without any
 * metrics backend configured.
 */
public interface MetricsService {

    void recordUnitDuration(UnitType type, Duration duration);

    /**
     * @param outcome one of {@code created}, {@code updated}, {@code unchanged}, {@code failed}
     */
    void incrementUnitOutcome(UnitType type, String outcome);

    void incrementParseRejected(String format);

    void incrementUnresolvedComponent(ComponentCategory category);

    void recordEquipmentCacheHit();

    void recordEquipmentCacheMiss();

    void incrementFetchRequest(String kind);

    void incrementFetchRetry(String kind);

    void incrementFetchPermanentFailure(String kind);

    void incrementMatched(String tier);

    void incrementUnmatched();

    void incrementFieldChanged(CatalogField field);
}
