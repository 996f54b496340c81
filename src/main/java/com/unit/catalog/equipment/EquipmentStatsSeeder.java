package com.unit.catalog.equipment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.unit.catalog.core.model.EquipmentStats;
import com.unit.catalog.store.CatalogSession;
import com.unit.catalog.store.CatalogStore;
import com.unit.catalog.store.EquipmentRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enriches equipment rows with combat statistics from a JSON seed file.
 *
 * <p>Seed entries use readable slugs such as {@code clan-er-large-laser} while archive
 * labels produce compact ones such as {@code clerlargelaser}. An entry is matched by its
 * own slug first and then through {@link #SLUG_ALIASES}. Without {@code force} only
 * unknown statistics are filled; with it the seed values replace the stored ones.</p>
 */
public class EquipmentStatsSeeder {
    private static final Logger log = LoggerFactory.getLogger(EquipmentStatsSeeder.class);

    public static final String SEED_SOURCE = "seed";

    static final Map<String, String> SLUG_ALIASES = Map.ofEntries(
            // Clan energy
            Map.entry("clan-er-large-laser", "clerlargelaser"),
            Map.entry("clan-er-medium-laser", "clermediumlaser"),
            Map.entry("clan-er-small-laser", "clersmalllaser"),
            Map.entry("clan-er-ppc", "clerppc"),
            Map.entry("clan-large-pulse-laser", "cllargepulselaser"),
            Map.entry("clan-medium-pulse-laser", "clmediumpulselaser"),
            Map.entry("clan-small-pulse-laser", "clsmallpulselaser"),
            Map.entry("clan-er-flamer", "clerflamer"),
            Map.entry("clan-plasma-cannon", "clplasmacannon"),
            // Inner Sphere pulse lasers
            Map.entry("pulse-large-laser", "islargepulselaser"),
            Map.entry("pulse-medium-laser", "ismediumpulselaser"),
            Map.entry("pulse-small-laser", "issmallpulselaser"),
            // Inner Sphere ballistic
            Map.entry("ultra-autocannon-2", "isultraac2"),
            Map.entry("ultra-autocannon-5", "isultraac5"),
            Map.entry("ultra-autocannon-10", "isultraac10"),
            Map.entry("ultra-autocannon-20", "isultraac20"),
            Map.entry("rotary-autocannon-5", "isrotaryac5"),
            Map.entry("light-autocannon-5", "light-ac-5"),
            // Clan ballistic
            Map.entry("clan-ultra-autocannon-2", "clultraac2"),
            Map.entry("clan-ultra-autocannon-5", "clultraac5"),
            Map.entry("clan-ultra-autocannon-10", "clultraac10"),
            Map.entry("clan-ultra-autocannon-20", "clultraac20"),
            Map.entry("clan-lb-2-x-ac", "cllbxac2"),
            Map.entry("clan-lb-5-x-ac", "cllbxac5"),
            Map.entry("clan-lb-10-x-ac", "cllbxac10"),
            Map.entry("clan-lb-20-x-ac", "cllbxac20"),
            Map.entry("clan-gauss-rifle", "clgaussrifle"),
            // Clan missiles
            Map.entry("clan-srm-2", "clsrm2"),
            Map.entry("clan-srm-4", "clsrm4"),
            Map.entry("clan-srm-6", "clsrm6"),
            Map.entry("clan-lrm-5", "cllrm5"),
            Map.entry("clan-lrm-10", "cllrm10"),
            Map.entry("clan-lrm-15", "cllrm15"),
            Map.entry("clan-lrm-20", "cllrm20"),
            Map.entry("clan-streak-srm-2", "clstreaksrm2"),
            Map.entry("clan-streak-srm-4", "clstreaksrm4"),
            Map.entry("clan-streak-srm-6", "clstreaksrm6"),
            Map.entry("clan-arrow-iv", "clarrowiv"),
            Map.entry("narc-missile-beacon", "narc"),
            // Electronics
            Map.entry("guardian-ecm-suite", "isguardianecmsuite"),
            Map.entry("clan-ecm-suite", "clecmsuite"),
            Map.entry("beagle-active-probe", "beagleactiveprobe"),
            Map.entry("clan-active-probe", "clactiveprobe"),
            Map.entry("clan-anti-missile-system", "clantimissilesystem"),
            Map.entry("targeting-computer", "istargeting-computer"),
            Map.entry("artemis-iv-fcs", "isartemisiv"),
            Map.entry("c3-master-computer", "isc3mastercomputer"),
            Map.entry("c3-slave-unit", "isc3slaveunit"));

    private final CatalogStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EquipmentStatsSeeder(CatalogStore store) {
        this(store, new ObjectMapper(), Clock.systemUTC());
    }

    public EquipmentStatsSeeder(CatalogStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public SeedResult seed(Path file, boolean force) {
        try (InputStream in = Files.newInputStream(file)) {
            return seed(in, force);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read equipment stats file " + file, e);
        }
    }

    public SeedResult seed(InputStream json, boolean force) {
        List<StatsSeedEntry> entries;
        try {
            entries = objectMapper.readValue(json, new TypeReference<List<StatsSeedEntry>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed equipment stats JSON", e);
        }
        log.info("equipment.seed.loaded entries={} force={}", entries.size(), force);
        return store.inTransaction(session -> apply(session, entries, force));
    }

    private SeedResult apply(CatalogSession session, List<StatsSeedEntry> entries, boolean force) {
        Map<String, EquipmentRow> bySlug = session.listEquipment().stream()
                .collect(Collectors.toMap(EquipmentRow::slug, Function.identity(), (a, b) -> a, HashMap::new));
        int updated = 0;
        int aliasHits = 0;
        int unchanged = 0;
        List<String> notFound = new ArrayList<>();

        for (StatsSeedEntry entry : entries) {
            if (entry.slug() == null || entry.slug().isBlank()) {
                log.warn("equipment.seed.entry.invalid reason=missing slug");
                continue;
            }
            EquipmentRow row = bySlug.get(entry.slug());
            if (row == null) {
                String alternate = SLUG_ALIASES.get(entry.slug());
                row = alternate != null ? bySlug.get(alternate) : null;
                if (row != null) {
                    aliasHits++;
                }
            }
            if (row == null) {
                log.warn("equipment.seed.notFound slug={}", entry.slug());
                notFound.add(entry.slug());
                continue;
            }

            EquipmentStats next = force ? entry.stats() : row.stats().fillFrom(entry.stats());
            String source = force || row.statsSource() == null ? SEED_SOURCE : row.statsSource();
            if (next.equals(row.stats()) && Objects.equals(source, row.statsSource())) {
                unchanged++;
                continue;
            }
            session.updateEquipmentStats(row.id(), next, source, clock.instant());
            updated++;
        }

        SeedResult result = new SeedResult(entries.size(), updated, aliasHits, unchanged, notFound);
        log.info("equipment.seed.completed result={}", result);
        return result;
    }
}
