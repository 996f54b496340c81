package com.unit.catalog.store;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.EquipmentStats;
import com.unit.catalog.core.model.FieldValue;
import com.unit.catalog.core.model.LocationName;
import com.unit.catalog.core.model.MechAttributes;
import com.unit.catalog.core.model.ParsedLocation;
import com.unit.catalog.reference.AliasTable;
import com.unit.catalog.reference.ComponentResolution;
import com.unit.catalog.reference.ComponentType;
import com.unit.catalog.reference.ComponentTypeRef;
import com.unit.catalog.reference.Era;
import com.unit.catalog.reference.Faction;
import com.unit.catalog.reference.ReferenceCatalog;
import com.unit.catalog.reference.ResolvedComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory {@link CatalogStore} for tests and embedded use.
 *
 * <p>Transactions are serialized by a single lock. Writes are applied immediately and
 * compensated through an {@link UndoLog} if the transaction fails, so a failed unit never
 * leaves partial rows behind.</p>
 */
public class InMemoryCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogStore.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final InMemoryTable<EraRow> eras = new InMemoryTable<>("eras", r -> r.era().slug());
    private final InMemoryTable<FactionRow> factions = new InMemoryTable<>("factions", r -> r.faction().slug());
    private final InMemoryTable<MetadataRow> metadata = new InMemoryTable<>("dataset_metadata", MetadataRow::version);
    private final InMemoryTable<TypeRow> types = new InMemoryTable<>("component_types",
            r -> r.type().category().getKey() + ":" + r.type().slug());
    private final InMemoryTable<AliasRow> aliases = new InMemoryTable<>("component_type_aliases",
            r -> r.category().getKey() + ":" + r.alias());
    private final InMemoryTable<ChassisRow> chassis = new InMemoryTable<>("unit_chassis", r -> r.chassis().slug());
    private final InMemoryTable<UnitRow> units = new InMemoryTable<>("units", r -> r.unit().slug());
    private final InMemoryTable<LocationRow> locations = new InMemoryTable<>("unit_locations");
    private final InMemoryTable<EquipmentEntry> equipment = new InMemoryTable<>("equipment", r -> r.item().slug());
    private final InMemoryTable<LoadoutEntry> loadout = new InMemoryTable<>("unit_loadout");
    private final InMemoryTable<QuirkRow> quirks = new InMemoryTable<>("quirks", QuirkRow::slug);
    private final InMemoryTable<UnitQuirkRow> unitQuirks = new InMemoryTable<>("unit_quirks",
            r -> r.unitId() + ":" + r.quirkId());
    private final InMemoryTable<MechRow> mechData = new InMemoryTable<>("unit_mech_data",
            r -> String.valueOf(r.unitId()));
    private final InMemoryTable<AvailabilityEntry> availability = new InMemoryTable<>("unit_availability",
            r -> r.unitId() + ":" + r.row().factionId() + ":" + r.row().eraId());

    private final Map<String, InMemoryTable<?>> tablesByName = new HashMap<>();

    public InMemoryCatalogStore() {
        for (InMemoryTable<?> table : List.of(eras, factions, metadata, types, aliases, chassis, units,
                locations, equipment, loadout, quirks, unitQuirks, mechData, availability)) {
            tablesByName.put(table.name(), table);
        }
    }

    @Override
    public <T> T inTransaction(Function<CatalogSession, T> work) {
        lock.lock();
        try (UndoLog undo = new UndoLog()) {
            T result = work.apply(new Session(undo));
            undo.commit();
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of rows currently in the named table, e.g. {@code "equipment"}.
     */
    public int rowCount(String table) {
        InMemoryTable<?> t = tablesByName.get(table);
        if (t == null) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        lock.lock();
        try {
            return t.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        log.debug("store.closed kind=in-memory units={}", units.size());
    }

    private final class Session implements CatalogSession {
        private final UndoLog undo;

        Session(UndoLog undo) {
            this.undo = undo;
        }

        @Override
        public int seedEras(List<Era> eraList) {
            int inserted = 0;
            for (Era era : eraList) {
                if (eras.idOf(era.slug()).isEmpty()) {
                    eras.insert(id -> new EraRow(id, era), undo);
                    inserted++;
                }
            }
            return inserted;
        }

        @Override
        public int seedFactions(List<Faction> factionList) {
            int inserted = 0;
            for (Faction faction : factionList) {
                if (factions.idOf(faction.slug()).isEmpty()) {
                    factions.insert(id -> new FactionRow(id, faction), undo);
                    inserted++;
                }
            }
            return inserted;
        }

        @Override
        public void recordDatasetMetadata(String version, int referenceVersion) {
            metadata.idOf(version).ifPresent(id -> metadata.delete(id, undo));
            metadata.insert(id -> new MetadataRow(id, version, referenceVersion, Instant.now()), undo);
        }

        @Override
        public int seedReferenceCatalog(ReferenceCatalog catalog) {
            int inserted = 0;
            for (ComponentType type : catalog.allTypes()) {
                String typeKey = type.category().getKey() + ":" + type.slug();
                long typeId = types.idOf(typeKey)
                        .orElseGet(() -> types.insert(id -> new TypeRow(id, type), undo));
                for (String label : type.aliases()) {
                    String alias = AliasTable.normalize(label);
                    Optional<AliasRow> existing = aliases.byKey(type.category().getKey() + ":" + alias);
                    if (existing.isPresent()) {
                        if (existing.get().typeId() != typeId) {
                            throw new CatalogStoreException("alias '" + label + "' in " + type.category().getKey()
                                    + " is already bound to type id " + existing.get().typeId());
                        }
                        continue;
                    }
                    aliases.insert(id -> new AliasRow(id, type.category(), alias, label, typeId), undo);
                    inserted++;
                }
            }
            return inserted;
        }

        @Override
        public AliasTable loadAliasTable() {
            AliasTable table = new AliasTable();
            Map<Long, ComponentTypeRef> refs = new HashMap<>();
            for (TypeRow row : types.all()) {
                ComponentTypeRef ref = new ComponentTypeRef(row.id(), row.type().category(), row.type().slug());
                refs.put(row.id(), ref);
                table.addType(ref);
            }
            for (AliasRow row : aliases.all()) {
                table.add(row.alias(), refs.get(row.typeId()));
            }
            return table;
        }

        @Override
        public long findOrCreateChassis(ChassisRecord chassisRecord) {
            return chassis.idOf(chassisRecord.slug())
                    .orElseGet(() -> chassis.insert(id -> new ChassisRow(id, chassisRecord), undo));
        }

        @Override
        public UpsertResult upsertUnit(long chassisId, UnitRecord unitRecord) {
            Optional<Long> existingId = units.idOf(unitRecord.slug());
            if (existingId.isEmpty()) {
                Integer externalId = unitRecord.externalId() != null && externalIdFree(unitRecord.externalId(), -1)
                        ? unitRecord.externalId() : null;
                long id = units.insert(newId -> new UnitRow(newId, chassisId, unitRecord, externalId,
                        Map.of(), null), undo);
                return UpsertResult.created(id);
            }
            long id = existingId.get();
            UnitRow current = units.get(id).orElseThrow();
            Integer externalId = current.externalId();
            if (externalId == null && unitRecord.externalId() != null && externalIdFree(unitRecord.externalId(), id)) {
                externalId = unitRecord.externalId();
            }
            UnitRow next = new UnitRow(id, chassisId, unitRecord, externalId, current.fields(),
                    current.lastCatalogImportAt());
            if (next.equals(current)) {
                return UpsertResult.unchanged(id);
            }
            units.update(id, next, undo);
            return UpsertResult.updated(id);
        }

        private boolean externalIdFree(int externalId, long unitId) {
            return units.all().stream()
                    .noneMatch(u -> u.id() != unitId && Integer.valueOf(externalId).equals(u.externalId()));
        }

        @Override
        public void replaceLocations(long unitId, List<ParsedLocation> parsed) {
            requireUnit(unitId);
            locations.deleteWhere(r -> r.unitId() == unitId, undo);
            for (ParsedLocation location : parsed) {
                locations.insert(id -> new LocationRow(id, unitId, location), undo);
            }
        }

        @Override
        public long findOrCreateEquipment(EquipmentRecord equipmentRecord) {
            return equipment.idOf(equipmentRecord.slug())
                    .orElseGet(() -> equipment.insert(id -> new EquipmentEntry(id, equipmentRecord, EquipmentStats.EMPTY,
                            null, null, null, List.of()), undo));
        }

        @Override
        public void replaceLoadout(long unitId, List<LoadoutRow> rows) {
            requireUnit(unitId);
            loadout.deleteWhere(r -> r.unitId() == unitId, undo);
            for (LoadoutRow row : rows) {
                if (equipment.get(row.equipmentId()).isEmpty()) {
                    throw new CatalogStoreException("loadout references missing equipment " + row.equipmentId());
                }
                loadout.insert(id -> new LoadoutEntry(id, unitId, row), undo);
            }
        }

        @Override
        public void upsertQuirks(long unitId, List<String> quirkSlugs) {
            requireUnit(unitId);
            for (String slug : quirkSlugs) {
                long quirkId = quirks.idOf(slug)
                        .orElseGet(() -> quirks.insert(id -> new QuirkRow(id, slug), undo));
                if (unitQuirks.idOf(unitId + ":" + quirkId).isEmpty()) {
                    unitQuirks.insert(id -> new UnitQuirkRow(id, unitId, quirkId), undo);
                }
            }
        }

        @Override
        public void upsertMechData(long unitId, MechAttributes attributes, ResolvedComponents resolved) {
            requireUnit(unitId);
            Map<ComponentCategory, String> labels = new EnumMap<>(ComponentCategory.class);
            Map<ComponentCategory, Long> typeIds = new EnumMap<>(ComponentCategory.class);
            for (ComponentCategory category : ComponentCategory.values()) {
                if (attributes.getLabel(category) != null) {
                    labels.put(category, attributes.getLabel(category));
                }
                ComponentResolution resolution = resolved.get(category);
                if (resolution != null && resolution.typeId() != null) {
                    typeIds.put(category, resolution.typeId());
                }
            }
            StoredMechData data = new StoredMechData(attributes.getConfig(), attributes.isOmnimech(),
                    attributes.getEngineRating(), attributes.getWalkMp(), attributes.getJumpMp(),
                    attributes.getHeatSinkCount(), labels, typeIds);
            Optional<Long> existing = mechData.idOf(String.valueOf(unitId));
            if (existing.isPresent()) {
                mechData.update(existing.get(), new MechRow(existing.get(), unitId, data), undo);
            } else {
                mechData.insert(id -> new MechRow(id, unitId, data), undo);
            }
        }

        @Override
        public Optional<StoredMechData> findMechData(long unitId) {
            return mechData.byKey(String.valueOf(unitId)).map(MechRow::data);
        }

        @Override
        public List<ParsedLocation> locations(long unitId) {
            return locations.where(r -> r.unitId() == unitId).stream()
                    .map(LocationRow::location)
                    .collect(Collectors.toList());
        }

        @Override
        public List<LoadoutRow> loadout(long unitId) {
            return loadout.where(r -> r.unitId() == unitId).stream()
                    .map(LoadoutEntry::row)
                    .collect(Collectors.toList());
        }

        @Override
        public List<String> quirks(long unitId) {
            return unitQuirks.where(r -> r.unitId() == unitId).stream()
                    .map(r -> quirks.get(r.quirkId()).orElseThrow().slug())
                    .sorted()
                    .collect(Collectors.toList());
        }

        @Override
        public List<UnitSummary> listUnits() {
            return units.all().stream().map(InMemoryCatalogStore::summary).collect(Collectors.toList());
        }

        @Override
        public Optional<UnitSummary> findUnitBySlug(String slug) {
            return units.byKey(slug).map(InMemoryCatalogStore::summary);
        }

        @Override
        public Optional<UnitSummary> findUnitByExternalId(int externalId) {
            return units.all().stream()
                    .filter(u -> Integer.valueOf(externalId).equals(u.externalId()))
                    .findFirst()
                    .map(InMemoryCatalogStore::summary);
        }

        @Override
        public Map<CatalogField, FieldValue> loadCatalogFields(long unitId) {
            UnitRow row = requireUnit(unitId);
            Map<CatalogField, FieldValue> fields = new EnumMap<>(CatalogField.class);
            for (CatalogField field : CatalogField.values()) {
                fields.put(field, row.fields().getOrDefault(field, FieldValue.EMPTY));
            }
            return fields;
        }

        @Override
        public void writeCatalogFields(long unitId, Map<CatalogField, FieldValue> changes) {
            if (changes.isEmpty()) {
                return;
            }
            UnitRow row = requireUnit(unitId);
            Map<CatalogField, FieldValue> fields = new EnumMap<>(CatalogField.class);
            fields.putAll(row.fields());
            fields.putAll(changes);
            units.update(unitId, new UnitRow(unitId, row.chassisId(), row.unit(), row.externalId(),
                    Collections.unmodifiableMap(fields), row.lastCatalogImportAt()), undo);
        }

        @Override
        public void assignExternalId(long unitId, int externalId) {
            UnitRow row = requireUnit(unitId);
            if (!externalIdFree(externalId, unitId)) {
                throw new CatalogStoreException("external id " + externalId + " already assigned to another unit");
            }
            units.update(unitId, new UnitRow(unitId, row.chassisId(), row.unit(), externalId,
                    row.fields(), row.lastCatalogImportAt()), undo);
        }

        @Override
        public void stampCatalogImport(long unitId, Instant importedAt) {
            UnitRow row = requireUnit(unitId);
            units.update(unitId, new UnitRow(unitId, row.chassisId(), row.unit(), row.externalId(),
                    row.fields(), importedAt), undo);
        }

        @Override
        public Optional<Long> findEraId(String slug) {
            return eras.idOf(slug);
        }

        @Override
        public Optional<Long> findFactionId(String slug) {
            return factions.idOf(slug);
        }

        @Override
        public long ensureFaction(Faction faction) {
            return factions.idOf(faction.slug())
                    .orElseGet(() -> factions.insert(id -> new FactionRow(id, faction), undo));
        }

        @Override
        public int countAvailability(long unitId) {
            return availability.where(r -> r.unitId() == unitId).size();
        }

        @Override
        public void replaceAvailability(long unitId, Collection<AvailabilityRow> rows) {
            requireUnit(unitId);
            availability.deleteWhere(r -> r.unitId() == unitId, undo);
            for (AvailabilityRow row : new LinkedHashSet<>(rows)) {
                if (factions.get(row.factionId()).isEmpty() || eras.get(row.eraId()).isEmpty()) {
                    throw new CatalogStoreException("availability references a missing faction or era: " + row);
                }
                availability.insert(id -> new AvailabilityEntry(id, unitId, row), undo);
            }
        }

        @Override
        public List<EquipmentRow> listEquipment() {
            return equipment.all().stream()
                    .map(e -> new EquipmentRow(e.id(), e.item().slug(), e.item().name(), e.item().category(),
                            e.stats(), e.statsSource(), e.ammoForId(), e.observedLocations()))
                    .collect(Collectors.toList());
        }

        @Override
        public void updateEquipmentStats(long equipmentId, EquipmentStats stats, String source, Instant updatedAt) {
            EquipmentEntry e = requireEquipment(equipmentId);
            equipment.update(equipmentId, new EquipmentEntry(e.id(), e.item(), stats, source, updatedAt,
                    e.ammoForId(), e.observedLocations()), undo);
        }

        @Override
        public int refreshObservedLocations() {
            Map<Long, Set<String>> observed = new HashMap<>();
            for (LoadoutEntry entry : loadout.all()) {
                LocationName location = entry.row().location();
                if (location != null) {
                    observed.computeIfAbsent(entry.row().equipmentId(), k -> new TreeSet<>())
                            .add(location.getDbValue());
                }
            }
            for (EquipmentEntry e : List.copyOf(equipment.all())) {
                Set<String> locs = observed.get(e.id());
                List<String> next = locs == null ? List.of() : List.copyOf(locs);
                if (!next.equals(e.observedLocations())) {
                    equipment.update(e.id(), new EquipmentEntry(e.id(), e.item(), e.stats(), e.statsSource(),
                            e.statsUpdatedAt(), e.ammoForId(), next), undo);
                }
            }
            return observed.size();
        }

        @Override
        public void linkAmmo(long ammoId, long weaponId) {
            EquipmentEntry e = requireEquipment(ammoId);
            requireEquipment(weaponId);
            equipment.update(ammoId, new EquipmentEntry(e.id(), e.item(), e.stats(), e.statsSource(),
                    e.statsUpdatedAt(), weaponId, e.observedLocations()), undo);
        }

        private UnitRow requireUnit(long unitId) {
            return units.get(unitId).orElseThrow(() -> new CatalogStoreException("no unit with id " + unitId));
        }

        private EquipmentEntry requireEquipment(long equipmentId) {
            return equipment.get(equipmentId)
                    .orElseThrow(() -> new CatalogStoreException("no equipment with id " + equipmentId));
        }
    }

    private static UnitSummary summary(UnitRow row) {
        return new UnitSummary(row.id(), row.unit().slug(), row.unit().fullName(), row.unit().tonnage(),
                row.externalId());
    }

    private record EraRow(long id, Era era) {}

    private record FactionRow(long id, Faction faction) {}

    private record MetadataRow(long id, String version, int referenceVersion, Instant createdAt) {}

    private record TypeRow(long id, ComponentType type) {}

    private record AliasRow(long id, ComponentCategory category, String alias, String label, long typeId) {}

    private record ChassisRow(long id, ChassisRecord chassis) {}

    private record UnitRow(long id, long chassisId, UnitRecord unit, Integer externalId,
                           Map<CatalogField, FieldValue> fields, Instant lastCatalogImportAt) {}

    private record LocationRow(long id, long unitId, ParsedLocation location) {}

    private record EquipmentEntry(long id, EquipmentRecord item, EquipmentStats stats, String statsSource,
                                  Instant statsUpdatedAt, Long ammoForId, List<String> observedLocations) {}

    private record LoadoutEntry(long id, long unitId, LoadoutRow row) {}

    private record QuirkRow(long id, String slug) {}

    private record UnitQuirkRow(long id, long unitId, long quirkId) {}

    private record MechRow(long id, long unitId, StoredMechData data) {}

    private record AvailabilityEntry(long id, long unitId, AvailabilityRow row) {}
}
