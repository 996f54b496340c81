package com.unit.catalog.store;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.EquipmentCategory;
import com.unit.catalog.core.model.EquipmentStats;
import com.unit.catalog.core.model.FieldSource;
import com.unit.catalog.core.model.FieldValue;
import com.unit.catalog.core.model.LocationName;
import com.unit.catalog.core.model.MechAttributes;
import com.unit.catalog.core.model.ParsedLocation;
import com.unit.catalog.reference.AliasTable;
import com.unit.catalog.reference.ComponentType;
import com.unit.catalog.reference.ComponentTypeRef;
import com.unit.catalog.reference.Era;
import com.unit.catalog.reference.Faction;
import com.unit.catalog.reference.ReferenceCatalog;
import com.unit.catalog.reference.ResolvedComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed {@link CatalogStore}. One pooled connection per transaction, with
 * auto-commit off; find-or-create operations use {@code ON CONFLICT} so concurrent
 * transactions converge on the same row.
 */
public class JdbcCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogStore.class);

    static final String DEADLOCK_DETECTED = "40P01";
    static final String SERIALIZATION_FAILURE = "40001";

    private final DataSource dataSource;

    public JdbcCatalogStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public <T> T inTransaction(Function<CatalogSession, T> work) {
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                T result = work.apply(new JdbcSession(connection));
                connection.commit();
                return result;
            } catch (RuntimeException e) {
                rollback(connection, e);
                throw e;
            } catch (SQLException e) {
                rollback(connection, e);
                throw failure("commit failed", e);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("cannot obtain connection: " + e.getMessage(), e);
        }
    }

    /**
     * Maps a driver error to a store exception; deadlocks (40P01) and serialization
     * failures (40001) become {@link StoreConflictException}.
     */
    static CatalogStoreException failure(String what, SQLException e) {
        String message = what + ": " + e.getMessage();
        String state = e.getSQLState();
        if (DEADLOCK_DETECTED.equals(state) || SERIALIZATION_FAILURE.equals(state)) {
            return new StoreConflictException(message, e);
        }
        return new CatalogStoreException(message, e);
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
                log.info("store.closed kind=jdbc");
            } catch (Exception e) {
                throw new CatalogStoreException("failed to close data source", e);
            }
        }
    }

    static String labelColumn(ComponentCategory category) {
        return category == ComponentCategory.HEAT_SINK ? "heat_sink_type" : category.getKey() + "_type";
    }

    static String idColumn(ComponentCategory category) {
        return category.getKey() + "_type_id";
    }

    static String typeTable(ComponentCategory category) {
        return category.getKey() + "_types";
    }

    static String aliasTable(ComponentCategory category) {
        return category.getKey() + "_type_aliases";
    }

    private static final class JdbcSession implements CatalogSession {
        private final Connection connection;

        JdbcSession(Connection connection) {
            this.connection = connection;
        }

        // ========== Reference data ==========

        @Override
        public int seedEras(List<Era> eras) {
            int inserted = 0;
            for (Era era : eras) {
                inserted += update("""
                        INSERT INTO eras (slug, name, start_year, end_year, description)
                        VALUES (?, ?, ?, ?, ?)
                        ON CONFLICT (slug) DO NOTHING
                        """, era.slug(), era.name(), era.startYear(), era.endYear(), era.description());
            }
            return inserted;
        }

        @Override
        public int seedFactions(List<Faction> factions) {
            int inserted = 0;
            for (Faction faction : factions) {
                inserted += insertFaction(faction);
            }
            return inserted;
        }

        private int insertFaction(Faction faction) {
            return update("""
                    INSERT INTO factions (slug, name, short_name, faction_type, is_clan)
                    VALUES (?, ?, ?, ?, ?)
                    ON CONFLICT (slug) DO NOTHING
                    """, faction.slug(), faction.name(), faction.shortName(), faction.factionType(), faction.clan());
        }

        @Override
        public void recordDatasetMetadata(String version, int referenceVersion) {
            update("DELETE FROM dataset_metadata WHERE version = ?", version);
            update("""
                    INSERT INTO dataset_metadata (version, schema_version, reference_version, description)
                    VALUES (?, 1, ?, ?)
                    """, version, referenceVersion, "Imported from unit archive " + version);
        }

        @Override
        public int seedReferenceCatalog(ReferenceCatalog catalog) {
            int inserted = 0;
            for (ComponentType type : catalog.allTypes()) {
                long typeId = insertType(type);
                ComponentCategory category = type.category();
                for (String label : type.aliases()) {
                    String alias = AliasTable.normalize(label);
                    Optional<Long> existing = queryLong("SELECT " + idColumn(category) + " FROM "
                            + aliasTable(category) + " WHERE alias = ?", alias);
                    if (existing.isPresent()) {
                        if (existing.get() != typeId) {
                            throw new CatalogStoreException("alias '" + label + "' in " + category.getKey()
                                    + " is already bound to type id " + existing.get());
                        }
                        continue;
                    }
                    inserted += update("INSERT INTO " + aliasTable(category) + " (alias, label, "
                            + idColumn(category) + ") VALUES (?, ?, ?)", alias, label, typeId);
                }
            }
            return inserted;
        }

        private long insertType(ComponentType type) {
            String table = typeTable(type.category());
            List<String> columns = new ArrayList<>(List.of("slug", "name", "tech_base", "rules_level", "intro_year"));
            List<Object> values = new ArrayList<>(Arrays.asList(type.slug(), type.name(),
                    type.techBase().getDbValue(), type.rulesLevel().getDbValue(), type.introYear()));
            type.properties().forEach((column, value) -> {
                columns.add(column);
                values.add(value);
            });
            StringJoiner placeholders = new StringJoiner(", ");
            columns.forEach(c -> placeholders.add("?"));
            update("INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders
                    + ") ON CONFLICT (slug) DO NOTHING", values.toArray());
            return queryLong("SELECT id FROM " + table + " WHERE slug = ?", type.slug())
                    .orElseThrow(() -> new CatalogStoreException("type " + type.slug() + " missing after insert"));
        }

        @Override
        public AliasTable loadAliasTable() {
            AliasTable table = new AliasTable();
            for (ComponentCategory category : ComponentCategory.values()) {
                Map<Long, ComponentTypeRef> refs = new HashMap<>();
                for (Map<String, Object> row : query("SELECT id, slug FROM " + typeTable(category))) {
                    ComponentTypeRef ref = new ComponentTypeRef(toLong(row.get("id")), category,
                            (String) row.get("slug"));
                    refs.put(ref.id(), ref);
                    table.addType(ref);
                }
                for (Map<String, Object> row : query("SELECT alias, " + idColumn(category) + " AS type_id FROM "
                        + aliasTable(category))) {
                    table.add((String) row.get("alias"), refs.get(toLong(row.get("type_id"))));
                }
            }
            return table;
        }

        // ========== Unit graph ==========

        @Override
        public long findOrCreateChassis(ChassisRecord chassis) {
            update("""
                    INSERT INTO unit_chassis (slug, name, unit_type, tech_base, tonnage, intro_year)
                    VALUES (?, ?, ?, ?, ?, ?)
                    ON CONFLICT (slug) DO NOTHING
                    """, chassis.slug(), chassis.name(), chassis.unitType().getDbValue(),
                    chassis.techBase().getDbValue(), chassis.tonnage(), chassis.introYear());
            return queryLong("SELECT id FROM unit_chassis WHERE slug = ?", chassis.slug())
                    .orElseThrow(() -> new CatalogStoreException("chassis " + chassis.slug() + " missing after insert"));
        }

        @Override
        public UpsertResult upsertUnit(long chassisId, UnitRecord unit) {
            List<Map<String, Object>> rows = query("""
                    SELECT id, chassis_id, variant, full_name, tech_base, rules_level, tonnage,
                           source_book, description, mul_id
                    FROM units WHERE slug = ? FOR UPDATE
                    """, unit.slug());
            Integer externalId = unit.externalId();
            if (rows.isEmpty()) {
                if (externalId != null && findUnitByExternalId(externalId).isPresent()) {
                    externalId = null;
                }
                long id = queryLong("""
                        INSERT INTO units (slug, chassis_id, variant, full_name, tech_base, rules_level, tonnage,
                                           source_book, description, mul_id)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        RETURNING id
                        """, unit.slug(), chassisId, unit.variant(), unit.fullName(), unit.techBase().getDbValue(),
                        unit.rulesLevel().getDbValue(), unit.tonnage(), unit.sourceBook(), unit.description(),
                        externalId).orElseThrow();
                return UpsertResult.created(id);
            }
            Map<String, Object> current = rows.get(0);
            long id = toLong(current.get("id"));
            Integer currentExternalId = toInteger(current.get("mul_id"));
            boolean assignExternalId = currentExternalId == null && externalId != null
                    && findUnitByExternalId(externalId).isEmpty();
            boolean unchanged = toLong(current.get("chassis_id")) == chassisId
                    && Objects.equals(current.get("variant"), unit.variant())
                    && Objects.equals(current.get("full_name"), unit.fullName())
                    && Objects.equals(current.get("tech_base"), unit.techBase().getDbValue())
                    && Objects.equals(current.get("rules_level"), unit.rulesLevel().getDbValue())
                    && toDouble(current.get("tonnage")) == unit.tonnage()
                    && Objects.equals(current.get("source_book"), unit.sourceBook())
                    && Objects.equals(current.get("description"), unit.description())
                    && !assignExternalId;
            if (unchanged) {
                return UpsertResult.unchanged(id);
            }
            update("""
                    UPDATE units SET chassis_id = ?, variant = ?, full_name = ?, tech_base = ?, rules_level = ?,
                                     tonnage = ?, source_book = ?, description = ?, mul_id = ?, updated_at = NOW()
                    WHERE id = ?
                    """, chassisId, unit.variant(), unit.fullName(), unit.techBase().getDbValue(),
                    unit.rulesLevel().getDbValue(), unit.tonnage(), unit.sourceBook(), unit.description(),
                    assignExternalId ? externalId : currentExternalId, id);
            return UpsertResult.updated(id);
        }

        @Override
        public void replaceLocations(long unitId, List<ParsedLocation> locations) {
            update("DELETE FROM unit_locations WHERE unit_id = ?", unitId);
            List<Object[]> batch = new ArrayList<>();
            for (ParsedLocation location : locations) {
                batch.add(new Object[]{unitId, location.location().getDbValue(), location.armor(),
                        location.rearArmor(), location.structure()});
            }
            batch("""
                    INSERT INTO unit_locations (unit_id, location, armor_points, rear_armor, structure_points)
                    VALUES (?, ?, ?, ?, ?)
                    """, batch);
        }

        @Override
        public long findOrCreateEquipment(EquipmentRecord equipment) {
            update("""
                    INSERT INTO equipment (slug, name, category, tech_base)
                    VALUES (?, ?, ?, ?)
                    ON CONFLICT (slug) DO NOTHING
                    """, equipment.slug(), equipment.name(), equipment.category().getDbValue(),
                    equipment.techBase().getDbValue());
            return queryLong("SELECT id FROM equipment WHERE slug = ?", equipment.slug())
                    .orElseThrow(() -> new CatalogStoreException("equipment " + equipment.slug() + " missing after insert"));
        }

        @Override
        public void replaceLoadout(long unitId, List<LoadoutRow> rows) {
            update("DELETE FROM unit_loadout WHERE unit_id = ?", unitId);
            List<Object[]> batch = new ArrayList<>();
            for (LoadoutRow row : rows) {
                batch.add(new Object[]{unitId, row.equipmentId(),
                        row.location() == null ? null : row.location().getDbValue(),
                        row.quantity(), row.rearFacing()});
            }
            batch("""
                    INSERT INTO unit_loadout (unit_id, equipment_id, location, quantity, is_rear_facing)
                    VALUES (?, ?, ?, ?, ?)
                    """, batch);
        }

        @Override
        public void upsertQuirks(long unitId, List<String> quirkSlugs) {
            // sorted so concurrent units take the quirk row locks in one order
            for (String slug : new TreeSet<>(quirkSlugs)) {
                update("INSERT INTO quirks (slug, name) VALUES (?, ?) ON CONFLICT (slug) DO NOTHING", slug, slug);
                long quirkId = queryLong("SELECT id FROM quirks WHERE slug = ?", slug).orElseThrow();
                update("""
                        INSERT INTO unit_quirks (unit_id, quirk_id) VALUES (?, ?)
                        ON CONFLICT (unit_id, quirk_id) DO NOTHING
                        """, unitId, quirkId);
            }
        }

        @Override
        public void upsertMechData(long unitId, MechAttributes attributes, ResolvedComponents resolved) {
            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put("unit_id", unitId);
            columns.put("config", attributes.getConfig());
            columns.put("is_omnimech", attributes.isOmnimech());
            columns.put("engine_rating", attributes.getEngineRating());
            columns.put("walk_mp", attributes.getWalkMp());
            columns.put("jump_mp", attributes.getJumpMp());
            columns.put("heat_sink_count", attributes.getHeatSinkCount());
            for (ComponentCategory category : ComponentCategory.values()) {
                columns.put(labelColumn(category), attributes.getLabel(category));
                columns.put(idColumn(category), resolved.typeId(category));
            }
            StringJoiner placeholders = new StringJoiner(", ");
            StringJoiner assignments = new StringJoiner(", ");
            for (String column : columns.keySet()) {
                placeholders.add("?");
                if (!column.equals("unit_id")) {
                    assignments.add(column + " = EXCLUDED." + column);
                }
            }
            update("INSERT INTO unit_mech_data (" + String.join(", ", columns.keySet()) + ") VALUES ("
                    + placeholders + ") ON CONFLICT (unit_id) DO UPDATE SET " + assignments,
                    columns.values().toArray());
        }

        @Override
        public Optional<StoredMechData> findMechData(long unitId) {
            List<Map<String, Object>> rows = query("SELECT * FROM unit_mech_data WHERE unit_id = ?", unitId);
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            Map<String, Object> row = rows.get(0);
            Map<ComponentCategory, String> labels = new EnumMap<>(ComponentCategory.class);
            Map<ComponentCategory, Long> typeIds = new EnumMap<>(ComponentCategory.class);
            for (ComponentCategory category : ComponentCategory.values()) {
                if (row.get(labelColumn(category)) != null) {
                    labels.put(category, (String) row.get(labelColumn(category)));
                }
                if (row.get(idColumn(category)) != null) {
                    typeIds.put(category, toLong(row.get(idColumn(category))));
                }
            }
            return Optional.of(new StoredMechData((String) row.get("config"),
                    Boolean.TRUE.equals(row.get("is_omnimech")), toInteger(row.get("engine_rating")),
                    toInteger(row.get("walk_mp")), toInteger(row.get("jump_mp")),
                    toInteger(row.get("heat_sink_count")), labels, typeIds));
        }

        @Override
        public List<ParsedLocation> locations(long unitId) {
            return query("""
                    SELECT location, armor_points, rear_armor, structure_points
                    FROM unit_locations WHERE unit_id = ? ORDER BY id
                    """, unitId).stream()
                    .map(r -> new ParsedLocation(LocationName.fromDbValue((String) r.get("location")),
                            toInteger(r.get("armor_points")), toInteger(r.get("rear_armor")),
                            toInteger(r.get("structure_points"))))
                    .collect(Collectors.toList());
        }

        @Override
        public List<LoadoutRow> loadout(long unitId) {
            return query("""
                    SELECT equipment_id, location, quantity, is_rear_facing
                    FROM unit_loadout WHERE unit_id = ? ORDER BY id
                    """, unitId).stream()
                    .map(r -> new LoadoutRow(toLong(r.get("equipment_id")),
                            r.get("location") == null ? null : LocationName.fromDbValue((String) r.get("location")),
                            toInteger(r.get("quantity")), Boolean.TRUE.equals(r.get("is_rear_facing"))))
                    .collect(Collectors.toList());
        }

        @Override
        public List<String> quirks(long unitId) {
            return query("""
                    SELECT q.slug FROM unit_quirks uq JOIN quirks q ON q.id = uq.quirk_id
                    WHERE uq.unit_id = ? ORDER BY q.slug
                    """, unitId).stream()
                    .map(r -> (String) r.get("slug"))
                    .collect(Collectors.toList());
        }

        // ========== Matching and merge ==========

        private static final String UNIT_SUMMARY_COLUMNS = "id, slug, full_name, tonnage, mul_id";

        @Override
        public List<UnitSummary> listUnits() {
            return query("SELECT " + UNIT_SUMMARY_COLUMNS + " FROM units ORDER BY id").stream()
                    .map(JdbcSession::toSummary)
                    .collect(Collectors.toList());
        }

        @Override
        public Optional<UnitSummary> findUnitBySlug(String slug) {
            return query("SELECT " + UNIT_SUMMARY_COLUMNS + " FROM units WHERE slug = ?", slug).stream()
                    .findFirst().map(JdbcSession::toSummary);
        }

        @Override
        public Optional<UnitSummary> findUnitByExternalId(int externalId) {
            return query("SELECT " + UNIT_SUMMARY_COLUMNS + " FROM units WHERE mul_id = ?", externalId).stream()
                    .findFirst().map(JdbcSession::toSummary);
        }

        private static UnitSummary toSummary(Map<String, Object> row) {
            return new UnitSummary(toLong(row.get("id")), (String) row.get("slug"), (String) row.get("full_name"),
                    toDouble(row.get("tonnage")), toInteger(row.get("mul_id")));
        }

        @Override
        public Map<CatalogField, FieldValue> loadCatalogFields(long unitId) {
            StringJoiner select = new StringJoiner(", ");
            for (CatalogField field : CatalogField.values()) {
                select.add(field.getColumn()).add(field.getSourceColumn());
            }
            List<Map<String, Object>> rows = query("SELECT " + select + " FROM units WHERE id = ?", unitId);
            if (rows.isEmpty()) {
                throw new CatalogStoreException("no unit with id " + unitId);
            }
            Map<String, Object> row = rows.get(0);
            Map<CatalogField, FieldValue> fields = new EnumMap<>(CatalogField.class);
            for (CatalogField field : CatalogField.values()) {
                Object value = convert(row.get(field.getColumn()), field.getValueType());
                fields.put(field, FieldValue.of(value,
                        FieldSource.fromDbValue((String) row.get(field.getSourceColumn()))));
            }
            return fields;
        }

        @Override
        public void writeCatalogFields(long unitId, Map<CatalogField, FieldValue> changes) {
            if (changes.isEmpty()) {
                return;
            }
            StringJoiner assignments = new StringJoiner(", ");
            List<Object> params = new ArrayList<>();
            changes.forEach((field, value) -> {
                assignments.add(field.getColumn() + " = ?").add(field.getSourceColumn() + " = ?");
                params.add(value.value());
                params.add(value.source() == null ? null : value.source().getDbValue());
            });
            params.add(unitId);
            update("UPDATE units SET " + assignments + ", updated_at = NOW() WHERE id = ?", params.toArray());
        }

        @Override
        public void assignExternalId(long unitId, int externalId) {
            update("UPDATE units SET mul_id = ? WHERE id = ?", externalId, unitId);
        }

        @Override
        public void stampCatalogImport(long unitId, Instant importedAt) {
            update("UPDATE units SET last_catalog_import_at = ? WHERE id = ?", importedAt, unitId);
        }

        // ========== Availability ==========

        @Override
        public Optional<Long> findEraId(String slug) {
            return queryLong("SELECT id FROM eras WHERE slug = ?", slug);
        }

        @Override
        public Optional<Long> findFactionId(String slug) {
            return queryLong("SELECT id FROM factions WHERE slug = ?", slug);
        }

        @Override
        public long ensureFaction(Faction faction) {
            insertFaction(faction);
            return findFactionId(faction.slug())
                    .orElseThrow(() -> new CatalogStoreException("faction " + faction.slug() + " missing after insert"));
        }

        @Override
        public int countAvailability(long unitId) {
            return queryLong("SELECT COUNT(*) FROM unit_availability WHERE unit_id = ?", unitId)
                    .map(Long::intValue).orElse(0);
        }

        @Override
        public void replaceAvailability(long unitId, Collection<AvailabilityRow> rows) {
            update("DELETE FROM unit_availability WHERE unit_id = ?", unitId);
            List<Object[]> batch = new ArrayList<>();
            for (AvailabilityRow row : new LinkedHashSet<>(rows)) {
                batch.add(new Object[]{unitId, row.factionId(), row.eraId()});
            }
            batch("""
                    INSERT INTO unit_availability (unit_id, faction_id, era_id) VALUES (?, ?, ?)
                    ON CONFLICT (unit_id, faction_id, era_id) DO NOTHING
                    """, batch);
        }

        // ========== Equipment enrichment ==========

        @Override
        @SuppressWarnings("unchecked")
        public List<EquipmentRow> listEquipment() {
            return query("""
                    SELECT id, slug, name, category, tonnage, crits, damage, heat, range_min, range_short,
                           range_medium, range_long, bv, stats_source, ammo_for_id, observed_locations
                    FROM equipment ORDER BY id
                    """).stream()
                    .map(r -> new EquipmentRow(toLong(r.get("id")), (String) r.get("slug"), (String) r.get("name"),
                            EquipmentCategory.fromDbValue((String) r.get("category")),
                            new EquipmentStats(r.get("tonnage") == null ? null : toDouble(r.get("tonnage")),
                                    toInteger(r.get("crits")), (String) r.get("damage"), toInteger(r.get("heat")),
                                    toInteger(r.get("range_min")), toInteger(r.get("range_short")),
                                    toInteger(r.get("range_medium")), toInteger(r.get("range_long")),
                                    toInteger(r.get("bv"))),
                            (String) r.get("stats_source"),
                            r.get("ammo_for_id") == null ? null : toLong(r.get("ammo_for_id")),
                            (List<String>) r.get("observed_locations")))
                    .collect(Collectors.toList());
        }

        @Override
        public void updateEquipmentStats(long equipmentId, EquipmentStats stats, String source, Instant updatedAt) {
            update("""
                    UPDATE equipment SET tonnage = ?, crits = ?, damage = ?, heat = ?, range_min = ?, range_short = ?,
                                         range_medium = ?, range_long = ?, bv = ?, stats_source = ?, stats_updated_at = ?
                    WHERE id = ?
                    """, stats.tonnage(), stats.crits(), stats.damage(), stats.heat(), stats.rangeMin(),
                    stats.rangeShort(), stats.rangeMedium(), stats.rangeLong(), stats.bv(), source, updatedAt,
                    equipmentId);
        }

        @Override
        public int refreshObservedLocations() {
            int updated = update("""
                    UPDATE equipment e SET observed_locations = sub.locs
                    FROM (
                        SELECT ul.equipment_id, array_agg(DISTINCT ul.location ORDER BY ul.location) AS locs
                        FROM unit_loadout ul
                        WHERE ul.location IS NOT NULL
                        GROUP BY ul.equipment_id
                    ) sub
                    WHERE e.id = sub.equipment_id
                    """);
            update("""
                    UPDATE equipment SET observed_locations = NULL
                    WHERE observed_locations IS NOT NULL
                      AND id NOT IN (SELECT equipment_id FROM unit_loadout WHERE location IS NOT NULL)
                    """);
            return updated;
        }

        @Override
        public void linkAmmo(long ammoId, long weaponId) {
            update("UPDATE equipment SET ammo_for_id = ? WHERE id = ?", weaponId, ammoId);
        }

        // ========== JDBC helpers ==========

        private int update(String sql, Object... params) {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                bind(statement, params);
                return statement.executeUpdate();
            } catch (SQLException e) {
                throw failure("update failed", e);
            }
        }

        private void batch(String sql, List<Object[]> rows) {
            if (rows.isEmpty()) {
                return;
            }
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (Object[] row : rows) {
                    bind(statement, row);
                    statement.addBatch();
                }
                statement.executeBatch();
            } catch (SQLException e) {
                throw failure("batch failed", e);
            }
        }

        private List<Map<String, Object>> query(String sql, Object... params) {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                bind(statement, params);
                try (ResultSet rs = statement.executeQuery()) {
                    ResultSetMetaData meta = rs.getMetaData();
                    List<Map<String, Object>> rows = new ArrayList<>();
                    while (rs.next()) {
                        Map<String, Object> row = new HashMap<>();
                        for (int i = 1; i <= meta.getColumnCount(); i++) {
                            Object value = rs.getObject(i);
                            if (value instanceof Array array) {
                                value = List.of((Object[]) array.getArray());
                            }
                            row.put(meta.getColumnLabel(i), value);
                        }
                        rows.add(row);
                    }
                    return rows;
                }
            } catch (SQLException e) {
                throw failure("query failed", e);
            }
        }

        private Optional<Long> queryLong(String sql, Object... params) {
            List<Map<String, Object>> rows = query(sql, params);
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            Object value = rows.get(0).values().iterator().next();
            return value == null ? Optional.empty() : Optional.of(toLong(value));
        }

        private static void bind(PreparedStatement statement, Object[] params) throws SQLException {
            for (int i = 0; i < params.length; i++) {
                Object param = params[i];
                if (param instanceof Instant instant) {
                    statement.setTimestamp(i + 1, Timestamp.from(instant));
                } else {
                    statement.setObject(i + 1, param);
                }
            }
        }

        private static long toLong(Object value) {
            return ((Number) value).longValue();
        }

        private static Integer toInteger(Object value) {
            return value == null ? null : ((Number) value).intValue();
        }

        private static double toDouble(Object value) {
            return value instanceof BigDecimal decimal ? decimal.doubleValue() : ((Number) value).doubleValue();
        }

        private static Object convert(Object value, Class<?> type) {
            if (value == null || type == String.class) {
                return value;
            }
            if (type == Integer.class) {
                return ((Number) value).intValue();
            }
            if (type == Long.class) {
                return ((Number) value).longValue();
            }
            return value;
        }
    }
}
