package com.unit.catalog.metrics;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.UnitType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code catalog.unit.duration}: Timer (tag: unitType)</li>
 *   <li>{@code catalog.unit.outcome}: Counter (tags: unitType, outcome)</li>
 *   <li>{@code catalog.parse.rejected}: Counter (tag: format)</li>
 *   <li>{@code catalog.component.unresolved}: Counter (tag: category)</li>
 *   <li>{@code catalog.equipment.cache.hit} and {@code .miss}: Counter</li>
 *   <li>{@code catalog.fetch.request}, {@code .retry}, {@code .permanent_failure}: Counter (tag: kind)</li>
 *   <li>{@code catalog.match.matched}: Counter (tag: tier)</li>
 *   <li>{@code catalog.match.unmatched}: Counter</li>
 *   <li>{@code catalog.merge.field_changed}: Counter (tag: field)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter unmatchedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("catalog.equipment.cache.hit")
                .description("Equipment identity cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("catalog.equipment.cache.miss")
                .description("Equipment identity cache misses")
                .register(registry);
        this.unmatchedCounter = Counter.builder("catalog.match.unmatched")
                .description("External catalog records that matched no unit")
                .register(registry);
    }

    @Override
    public void recordUnitDuration(UnitType type, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(type.name(), k ->
                Timer.builder("catalog.unit.duration")
                        .description("Duration of one unit's ingestion transaction")
                        .tag("unitType", type.getDbValue())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementUnitOutcome(UnitType type, String outcome) {
        counter("outcome:" + type.name() + ":" + outcome, () ->
                Counter.builder("catalog.unit.outcome")
                        .description("Units processed by outcome")
                        .tag("unitType", type.getDbValue())
                        .tag("outcome", outcome)
                        .register(registry)).increment();
    }

    @Override
    public void incrementParseRejected(String format) {
        counter("rejected:" + format, () ->
                Counter.builder("catalog.parse.rejected")
                        .description("Unit files the parsers could not interpret")
                        .tag("format", format)
                        .register(registry)).increment();
    }

    @Override
    public void incrementUnresolvedComponent(ComponentCategory category) {
        counter("unresolved:" + category.getKey(), () ->
                Counter.builder("catalog.component.unresolved")
                        .description("Component labels with no matching alias")
                        .tag("category", category.getKey())
                        .register(registry)).increment();
    }

    @Override
    public void recordEquipmentCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordEquipmentCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementFetchRequest(String kind) {
        fetchCounter("catalog.fetch.request", "Remote catalog requests issued", kind).increment();
    }

    @Override
    public void incrementFetchRetry(String kind) {
        fetchCounter("catalog.fetch.retry", "Remote catalog requests retried", kind).increment();
    }

    @Override
    public void incrementFetchPermanentFailure(String kind) {
        fetchCounter("catalog.fetch.permanent_failure", "Remote resources recorded as permanently failed", kind)
                .increment();
    }

    @Override
    public void incrementMatched(String tier) {
        counter("matched:" + tier, () ->
                Counter.builder("catalog.match.matched")
                        .description("External catalog records matched, by tier")
                        .tag("tier", tier)
                        .register(registry)).increment();
    }

    @Override
    public void incrementUnmatched() {
        unmatchedCounter.increment();
    }

    @Override
    public void incrementFieldChanged(CatalogField field) {
        counter("field:" + field.name(), () ->
                Counter.builder("catalog.merge.field_changed")
                        .description("Unit fields written by the catalog merge")
                        .tag("field", field.getColumn())
                        .register(registry)).increment();
    }

    private Counter fetchCounter(String name, String description, String kind) {
        return counter(name + ":" + kind, () ->
                Counter.builder(name)
                        .description(description)
                        .tag("kind", kind)
                        .register(registry));
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
