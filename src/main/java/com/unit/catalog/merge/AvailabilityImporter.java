package com.unit.catalog.merge;

import com.unit.catalog.core.model.Slugs;
import com.unit.catalog.fetch.AvailabilityNote;
import com.unit.catalog.fetch.AvailabilityParser;
import com.unit.catalog.fetch.RawResponseStore;
import com.unit.catalog.reference.Faction;
import com.unit.catalog.store.AvailabilityRow;
import com.unit.catalog.store.CatalogSession;
import com.unit.catalog.store.CatalogStore;
import com.unit.catalog.store.CatalogStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Replaces each matched unit's (faction, era) availability with what its stored detail
 * page lists.
 *
 * <p>Each unit is handled in its own transaction. Factions named in external data but
 * unknown locally are created; eras that cannot be mapped are skipped and reported.
 * Units that already have availability are left alone unless forced.</p>
 */
public class AvailabilityImporter {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityImporter.class);

    private final CatalogStore store;
    private final RawResponseStore rawStore;
    private final AvailabilityParser parser;

    public AvailabilityImporter(CatalogStore store, RawResponseStore rawStore) {
        this(store, rawStore, new AvailabilityParser());
    }

    public AvailabilityImporter(CatalogStore store, RawResponseStore rawStore, AvailabilityParser parser) {
        this.store = store;
        this.rawStore = rawStore;
        this.parser = parser;
    }

    /**
     * @param unitsByExternalId matched units, external id to stored unit id
     */
    public AvailabilityResult importAll(Map<Integer, Long> unitsByExternalId, boolean force) {
        int imported = 0;
        int rows = 0;
        int skipped = 0;
        int missing = 0;
        int factionsCreated = 0;
        Set<String> unmappedEras = new TreeSet<>();
        List<String> failed = new ArrayList<>();

        for (Map.Entry<Integer, Long> match : unitsByExternalId.entrySet()) {
            int externalId = match.getKey();
            long unitId = match.getValue();
            Optional<String> html = rawStore.readDetail(externalId);
            if (html.isEmpty()) {
                missing++;
                continue;
            }
            List<AvailabilityNote> notes = parser.parse(html.get());
            if (notes.isEmpty()) {
                continue;
            }
            try {
                UnitOutcome outcome = store.inTransaction(session -> importUnit(session, unitId, notes, force));
                unmappedEras.addAll(outcome.unmappedEras());
                factionsCreated += outcome.factionsCreated();
                if (outcome.skipped()) {
                    skipped++;
                } else if (outcome.rows() > 0) {
                    imported++;
                    rows += outcome.rows();
                }
            } catch (CatalogStoreException e) {
                failed.add(externalId + ": " + e.getMessage());
                log.warn("availability.unit.failed externalId={} unitId={} error={}", externalId, unitId, e.getMessage());
            }
        }

        AvailabilityResult result = new AvailabilityResult(imported, rows, skipped, missing, factionsCreated,
                unmappedEras, failed);
        log.info("availability.completed units={} rows={} skipped={} missingDetails={} newFactions={} failed={} unmappedEras={}",
                imported, rows, skipped, missing, factionsCreated, failed.size(), unmappedEras);
        return result;
    }

    private UnitOutcome importUnit(CatalogSession session, long unitId, List<AvailabilityNote> notes, boolean force) {
        if (!force && session.countAvailability(unitId) > 0) {
            return new UnitOutcome(true, 0, 0, Set.of());
        }
        Set<AvailabilityRow> rows = new LinkedHashSet<>();
        Set<String> unmapped = new TreeSet<>();
        int created = 0;
        for (AvailabilityNote note : notes) {
            Optional<Long> eraId = CatalogNameMappings.eraSlug(note.eraName()).flatMap(session::findEraId);
            if (eraId.isEmpty()) {
                unmapped.add(note.eraName());
                continue;
            }
            Optional<String> mapped = CatalogNameMappings.factionSlug(note.factionName());
            String slug = mapped.orElseGet(() -> Slugs.toSlug(note.factionName()));
            Optional<Long> factionId = session.findFactionId(slug);
            if (factionId.isEmpty()) {
                String name = note.factionName().trim();
                factionId = Optional.of(session.ensureFaction(new Faction(slug, name, name,
                        CatalogNameMappings.inferFactionType(name), name.startsWith("Clan "))));
                created++;
                log.info("availability.faction.created name='{}' slug={}", name, slug);
            }
            rows.add(new AvailabilityRow(factionId.get(), eraId.get()));
        }
        if (!rows.isEmpty()) {
            session.replaceAvailability(unitId, rows);
        }
        return new UnitOutcome(false, rows.size(), created, unmapped);
    }

    private record UnitOutcome(boolean skipped, int rows, int factionsCreated, Set<String> unmappedEras) {}
}
