package com.unit.catalog.store;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.EquipmentStats;
import com.unit.catalog.core.model.FieldValue;
import com.unit.catalog.core.model.MechAttributes;
import com.unit.catalog.core.model.ParsedLocation;
import com.unit.catalog.reference.AliasTable;
import com.unit.catalog.reference.Era;
import com.unit.catalog.reference.Faction;
import com.unit.catalog.reference.ReferenceCatalog;
import com.unit.catalog.reference.ResolvedComponents;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations available inside one store transaction. Every method either completes or
 * throws {@link CatalogStoreException}, which rolls the whole transaction back.
 */
public interface CatalogSession {

    // ========== Reference data ==========

    /**
     * @return number of eras inserted; existing slugs are left untouched
     */
    int seedEras(List<Era> eras);

    /**
     * @return number of factions inserted; existing slugs are left untouched
     */
    int seedFactions(List<Faction> factions);

    /**
     * Replaces the metadata row for {@code version}.
     */
    void recordDatasetMetadata(String version, int referenceVersion);

    /**
     * Inserts missing canonical types and aliases. An alias already bound to a different
     * canonical type is a conflict and fails the transaction.
     *
     * @return number of aliases inserted
     */
    int seedReferenceCatalog(ReferenceCatalog catalog);

    AliasTable loadAliasTable();

    // ========== Unit graph ==========

    long findOrCreateChassis(ChassisRecord chassis);

    UpsertResult upsertUnit(long chassisId, UnitRecord unit);

    void replaceLocations(long unitId, List<ParsedLocation> locations);

    /**
     * Returns the id of the equipment with {@code equipment.slug()}, creating it if absent.
     */
    long findOrCreateEquipment(EquipmentRecord equipment);

    void replaceLoadout(long unitId, List<LoadoutRow> rows);

    void upsertQuirks(long unitId, List<String> quirkSlugs);

    void upsertMechData(long unitId, MechAttributes attributes, ResolvedComponents resolved);

    Optional<StoredMechData> findMechData(long unitId);

    List<ParsedLocation> locations(long unitId);

    List<LoadoutRow> loadout(long unitId);

    List<String> quirks(long unitId);

    // ========== Matching and merge ==========

    List<UnitSummary> listUnits();

    Optional<UnitSummary> findUnitBySlug(String slug);

    Optional<UnitSummary> findUnitByExternalId(int externalId);

    Map<CatalogField, FieldValue> loadCatalogFields(long unitId);

    void writeCatalogFields(long unitId, Map<CatalogField, FieldValue> changes);

    void assignExternalId(long unitId, int externalId);

    void stampCatalogImport(long unitId, Instant importedAt);

    // ========== Availability ==========

    Optional<Long> findEraId(String slug);

    Optional<Long> findFactionId(String slug);

    /**
     * Returns the id of the faction with {@code faction.slug()}, creating it if absent.
     */
    long ensureFaction(Faction faction);

    int countAvailability(long unitId);

    void replaceAvailability(long unitId, Collection<AvailabilityRow> rows);

    // ========== Equipment enrichment ==========

    List<EquipmentRow> listEquipment();

    void updateEquipmentStats(long equipmentId, EquipmentStats stats, String source, Instant updatedAt);

    /**
     * Recomputes every equipment entry's observed locations from the loadout rows.
     *
     * @return number of equipment entries with at least one observed location
     */
    int refreshObservedLocations();

    void linkAmmo(long ammoId, long weaponId);
}
