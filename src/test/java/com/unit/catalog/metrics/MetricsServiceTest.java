package com.unit.catalog.metrics;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.UnitType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordUnitDuration(UnitType.MECH, Duration.ofMillis(100));
                noOp.incrementUnitOutcome(UnitType.MECH, "created");
                noOp.incrementParseRejected("mtf");
                noOp.incrementUnresolvedComponent(ComponentCategory.ENGINE);
                noOp.recordEquipmentCacheHit();
                noOp.recordEquipmentCacheMiss();
                noOp.incrementFetchRequest("detail");
                noOp.incrementFetchRetry("detail");
                noOp.incrementFetchPermanentFailure("detail");
                noOp.incrementMatched("exact_slug");
                noOp.incrementUnmatched();
                noOp.incrementFieldChanged(CatalogField.BATTLE_VALUE);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record unit duration as timer per unit type")
        void recordUnitDuration() {
            metrics.recordUnitDuration(UnitType.MECH, Duration.ofMillis(15));
            metrics.recordUnitDuration(UnitType.MECH, Duration.ofMillis(25));
            metrics.recordUnitDuration(UnitType.VEHICLE, Duration.ofMillis(5));

            Timer mech = registry.find("catalog.unit.duration").tag("unitType", UnitType.MECH.getDbValue()).timer();
            assertNotNull(mech);
            assertEquals(2, mech.count());
            assertEquals(1, registry.find("catalog.unit.duration")
                    .tag("unitType", UnitType.VEHICLE.getDbValue()).timer().count());
        }

        @Test
        @DisplayName("Should count unit outcomes by type and outcome")
        void incrementUnitOutcome() {
            metrics.incrementUnitOutcome(UnitType.MECH, "created");
            metrics.incrementUnitOutcome(UnitType.MECH, "created");
            metrics.incrementUnitOutcome(UnitType.MECH, "failed");

            Counter created = registry.find("catalog.unit.outcome").tag("outcome", "created").counter();
            assertNotNull(created);
            assertEquals(2.0, created.count());
            assertEquals(1.0, registry.find("catalog.unit.outcome").tag("outcome", "failed").counter().count());
        }

        @Test
        @DisplayName("Should tag unresolved components by category key")
        void incrementUnresolvedComponent() {
            metrics.incrementUnresolvedComponent(ComponentCategory.HEAT_SINK);

            assertEquals(1.0, registry.find("catalog.component.unresolved")
                    .tag("category", "heatsink").counter().count());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void cacheCounters() {
            metrics.recordEquipmentCacheHit();
            metrics.recordEquipmentCacheHit();
            metrics.recordEquipmentCacheMiss();

            assertEquals(2.0, registry.find("catalog.equipment.cache.hit").counter().count());
            assertEquals(1.0, registry.find("catalog.equipment.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Should tag fetch counters by resource kind")
        void fetchCounters() {
            metrics.incrementFetchRequest("quicklist");
            metrics.incrementFetchRequest("detail");
            metrics.incrementFetchRetry("detail");
            metrics.incrementFetchPermanentFailure("detail");

            assertEquals(1.0, registry.find("catalog.fetch.request").tag("kind", "quicklist").counter().count());
            assertEquals(1.0, registry.find("catalog.fetch.retry").tag("kind", "detail").counter().count());
            assertEquals(1.0, registry.find("catalog.fetch.permanent_failure").tag("kind", "detail").counter().count());
        }

        @Test
        @DisplayName("Should count matches per tier and merged fields per column")
        void matchAndMergeCounters() {
            metrics.incrementMatched("override");
            metrics.incrementUnmatched();
            metrics.incrementFieldChanged(CatalogField.BATTLE_VALUE);
            metrics.incrementFieldChanged(CatalogField.BATTLE_VALUE);

            assertEquals(1.0, registry.find("catalog.match.matched").tag("tier", "override").counter().count());
            assertEquals(1.0, registry.find("catalog.match.unmatched").counter().count());
            assertEquals(2.0, registry.find("catalog.merge.field_changed").tag("field", "bv").counter().count());
        }
    }
}
