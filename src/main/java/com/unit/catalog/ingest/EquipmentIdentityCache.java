package com.unit.catalog.ingest;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.unit.catalog.metrics.MetricsService;
import com.unit.catalog.metrics.NoOpMetricsService;
import com.unit.catalog.store.CatalogSession;
import com.unit.catalog.store.EquipmentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-run map from equipment slug to equipment id.
 *
 * <p>The key is {@link EquipmentRecord#fromLabel(String)}'s slug, the same value the
 * store's unique equipment column holds, so one cache entry always corresponds to one
 * equipment row. Ids created inside a unit's transaction are held in a {@link Stage} and
 * only published once that transaction commits; a rolled-back unit leaves no entry for a
 * row that does not exist.</p>
 *
 * <p>Safe for concurrent workers: two workers that miss on the same slug both ask the
 * store, which converges on a single row. Use {@link #resolveAll} for a whole loadout so
 * those inserts happen in slug order.</p>
 */
public class EquipmentIdentityCache {
    private static final Logger log = LoggerFactory.getLogger(EquipmentIdentityCache.class);

    private final Cache<String, Long> committed;
    private final MetricsService metricsService;

    public EquipmentIdentityCache(long maximumSize, MetricsService metricsService) {
        this.committed = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public EquipmentIdentityCache() {
        this(100_000, null);
    }

    /**
     * Opens a stage for one unit's transaction.
     */
    public Stage stage() {
        return new Stage();
    }

    /**
     * Resolves an equipment label to its id, creating the equipment row on first sight.
     */
    public long resolve(CatalogSession session, String label, Stage stage) {
        EquipmentRecord equipment = EquipmentRecord.fromLabel(label);
        String key = equipment.slug();
        Long id = committed.getIfPresent(key);
        if (id == null) {
            id = stage.pending.get(key);
        }
        if (id != null) {
            metricsService.recordEquipmentCacheHit();
            return id;
        }
        metricsService.recordEquipmentCacheMiss();
        long created = session.findOrCreateEquipment(equipment);
        stage.pending.put(key, created);
        log.trace("equipment.resolved slug={} id={}", key, created);
        return created;
    }

    /**
     * Resolves a unit's labels in slug order, so concurrent transactions creating shared
     * equipment rows lock them in the same order.
     *
     * @return id per label, for every label given
     */
    public Map<String, Long> resolveAll(CatalogSession session, Collection<String> labels, Stage stage) {
        Map<String, String> bySlug = new TreeMap<>();
        for (String label : labels) {
            bySlug.putIfAbsent(EquipmentRecord.fromLabel(label).slug(), label);
        }
        Map<String, Long> idsBySlug = new HashMap<>();
        bySlug.forEach((slug, label) -> idsBySlug.put(slug, resolve(session, label, stage)));
        Map<String, Long> ids = new HashMap<>();
        for (String label : labels) {
            ids.put(label, idsBySlug.get(EquipmentRecord.fromLabel(label).slug()));
        }
        return ids;
    }

    /**
     * Makes a committed stage's ids visible to later units.
     */
    public void publish(Stage stage) {
        committed.putAll(stage.pending);
        stage.pending.clear();
    }

    public long size() {
        return committed.estimatedSize();
    }

    public Long peek(String slug) {
        return committed.getIfPresent(slug);
    }

    public long hitCount() {
        return committed.stats().hitCount();
    }

    public long missCount() {
        return committed.stats().missCount();
    }

    /**
     * Ids resolved inside one not-yet-committed transaction.
     */
    public static final class Stage {
        private final Map<String, Long> pending = new HashMap<>();

        private Stage() {
        }

        public int size() {
            return pending.size();
        }
    }
}
