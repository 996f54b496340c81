package com.unit.catalog.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.FieldSource;
import com.unit.catalog.core.model.FieldValue;
import com.unit.catalog.core.model.LocationName;
import com.unit.catalog.core.model.MechAttributes;
import com.unit.catalog.core.model.ParsedLoadoutEntry;
import com.unit.catalog.core.model.ParsedLocation;
import com.unit.catalog.core.model.ParsedUnit;
import com.unit.catalog.core.model.UnitType;
import com.unit.catalog.metrics.MicrometerMetricsService;
import com.unit.catalog.store.CatalogSession;
import com.unit.catalog.store.CatalogStore;
import com.unit.catalog.store.CatalogStoreException;
import com.unit.catalog.store.EquipmentRow;
import com.unit.catalog.store.InMemoryCatalogStore;
import com.unit.catalog.store.LoadoutRow;
import com.unit.catalog.store.StoreConflictException;
import com.unit.catalog.store.StoreUnavailableException;
import com.unit.catalog.store.StoredMechData;
import com.unit.catalog.store.UnitSummary;
import com.unit.catalog.store.UpsertResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("IngestionPipeline Tests")
class IngestionPipelineTest {

    private static final String DEMOLISHER = "<UnitType>\nTank\n</UnitType>\n<Name>\nDemolisher Heavy Tank\n</Name>\n"
            + "<Model>\n(Standard)\n</Model>\n<tonnage>\n80\n</tonnage>\n"
            + "<Front Equipment>\nAutocannon/20\n</Front Equipment>\n";

    private static final String LOCUST = "chassis:Locust\nmodel:LCT-1V\nmass:20\nConfig:Biped\n"
            + "engine:160 Fusion Engine\nheat sinks:10 Single\nstructure:IS Standard\narmor:Standard(Inner Sphere)\n"
            + "walk mp:8\nHD armor:8\nCT armor:10\n"
            + "Weapons:1\nMedium Laser, Center Torso\n";

    private static final String WARP_LOCUST = "chassis:Locust\nmodel:LCT-X\nmass:20\nConfig:Biped\n"
            + "engine:160 Warp Drive\n";

    private InMemoryCatalogStore store;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
    }

    private static ParsedUnit locust(String model, String... quirks) {
        ParsedUnit.Builder builder = ParsedUnit.builder()
                .chassis("Locust")
                .model(model)
                .unitType(UnitType.MECH)
                .tonnage(20)
                .introYear(2499)
                .addLocation(new ParsedLocation(LocationName.CENTER_TORSO, 10, 2, null))
                .addLoadout(new ParsedLoadoutEntry("Medium Laser", LocationName.CENTER_TORSO, 1, false))
                .addLoadout(new ParsedLoadoutEntry("Machine Gun", LocationName.LEFT_ARM, 1, false))
                .mechAttributes(MechAttributes.builder()
                        .engineRating(160)
                        .label(ComponentCategory.ENGINE, "Fusion Engine")
                        .label(ComponentCategory.HEAT_SINK, "Single")
                        .build());
        for (String quirk : quirks) {
            builder.addQuirk(quirk);
        }
        return builder.build();
    }

    private Path archive(Map<String, String> entries) throws IOException {
        Path zip = tempDir.resolve("units-" + System.nanoTime() + ".zip");
        try (OutputStream out = Files.newOutputStream(zip);
             ZipOutputStream zipOut = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zipOut.putNextEntry(new ZipEntry(entry.getKey()));
                zipOut.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zipOut.closeEntry();
            }
        }
        return zip;
    }

    /**
     * A store whose sessions throw when {@code upsertQuirks} receives the given quirk.
     */
    private static CatalogStore failingOnQuirk(CatalogStore delegate, String quirk) {
        return new CatalogStore() {
            @Override
            public <T> T inTransaction(Function<CatalogSession, T> work) {
                return delegate.inTransaction(session -> work.apply(failingSession(session, quirk)));
            }

            @Override
            public void close() {
                delegate.close();
            }
        };
    }

    private static CatalogSession failingSession(CatalogSession session, String quirk) {
        CatalogSession failing = mock(CatalogSession.class, delegatesTo(session));
        doThrow(new CatalogStoreException("constraint violated for quirk " + quirk))
                .when(failing).upsertQuirks(anyLong(), argThat(quirks -> quirks.contains(quirk)));
        return failing;
    }

    /**
     * A store whose transactions do all their writes, then lose a deadlock and roll back
     * while {@code conflicts} is positive.
     */
    private static CatalogStore conflicting(CatalogStore delegate, AtomicInteger conflicts) {
        return new CatalogStore() {
            @Override
            public <T> T inTransaction(Function<CatalogSession, T> work) {
                return delegate.inTransaction(session -> {
                    T result = work.apply(session);
                    if (conflicts.getAndDecrement() > 0) {
                        throw new StoreConflictException("deadlock detected", null);
                    }
                    return result;
                });
            }

            @Override
            public void close() {
                delegate.close();
            }
        };
    }

    @Nested
    @DisplayName("Single unit")
    class SingleUnit {

        @Test
        @DisplayName("Should persist the unit graph in one transaction")
        void persistsGraph() {
            IngestionPipeline pipeline = new IngestionPipeline(store);
            UnitIngestResult result = pipeline.ingest(locust("LCT-1V", "fast"));

            assertEquals(UpsertResult.Status.CREATED, result.status());
            assertEquals("locust-lct-1v", result.slug());
            assertTrue(result.gaps().isEmpty());

            store.execute(s -> {
                assertEquals(1, s.locations(result.unitId()).size());
                assertEquals(2, s.loadout(result.unitId()).size());
                assertEquals(List.of("fast"), s.quirks(result.unitId()));
                StoredMechData mech = s.findMechData(result.unitId()).orElseThrow();
                assertEquals(160, mech.engineRating());
                assertNotNull(mech.typeId(ComponentCategory.ENGINE));
                assertNotNull(mech.typeId(ComponentCategory.GYRO), "gyro defaults to standard");
                assertNull(mech.typeId(ComponentCategory.ARMOR), "absent armor stays unresolved");
                assertEquals(FieldValue.of(2499, FieldSource.ARCHIVE),
                        s.loadCatalogFields(result.unitId()).get(CatalogField.INTRO_YEAR));
            });
        }

        @Test
        @DisplayName("Re-ingesting identical input changes nothing")
        void idempotent() {
            IngestionPipeline pipeline = new IngestionPipeline(store);
            pipeline.ingest(locust("LCT-1V", "fast"));
            Map<String, Integer> before = rowCounts();

            UnitIngestResult again = pipeline.ingest(locust("LCT-1V", "fast"));

            assertEquals(UpsertResult.Status.UNCHANGED, again.status());
            assertEquals(before, rowCounts());
            assertEquals(1, store.inTransaction(CatalogSession::listUnits).size());
        }

        @Test
        @DisplayName("Archive intro year never replaces a catalog value")
        void introYearProvenance() {
            IngestionPipeline pipeline = new IngestionPipeline(store);
            long id = pipeline.ingest(locust("LCT-1V")).unitId();
            store.execute(s -> s.writeCatalogFields(id,
                    Map.of(CatalogField.INTRO_YEAR, FieldValue.of(2500, FieldSource.CATALOG))));

            UnitIngestResult again = pipeline.ingest(locust("LCT-1V"));

            assertEquals(UpsertResult.Status.UNCHANGED, again.status());
            assertEquals(FieldValue.of(2500, FieldSource.CATALOG),
                    store.inTransaction(s -> s.loadCatalogFields(id)).get(CatalogField.INTRO_YEAR));
        }

        @Test
        @DisplayName("Labels differing only in punctuation share one loadout row")
        void mergedLoadout() {
            ParsedUnit unit = ParsedUnit.builder().chassis("Hunchback").model("HBK-4G").tonnage(50)
                    .addLoadout(new ParsedLoadoutEntry("Medium Laser", LocationName.LEFT_ARM, 1, false))
                    .addLoadout(new ParsedLoadoutEntry("Medium-Laser", LocationName.LEFT_ARM, 2, false))
                    .build();
            long id = new IngestionPipeline(store).ingest(unit).unitId();

            List<LoadoutRow> rows = store.inTransaction(s -> s.loadout(id));
            assertEquals(1, rows.size());
            assertEquals(3, rows.get(0).quantity());
        }
    }

    @Nested
    @DisplayName("Equipment identity")
    class EquipmentIdentity {

        @Test
        @DisplayName("100 units sharing one weapon produce one equipment row and 100 loadout rows")
        void sharedEquipment() {
            IngestionPipeline pipeline = new IngestionPipeline(store);
            for (int i = 0; i < 100; i++) {
                pipeline.ingest(ParsedUnit.builder()
                        .chassis("Wasp").model("WSP-" + i).unitType(UnitType.MECH).tonnage(20)
                        .addLoadout(new ParsedLoadoutEntry("Medium Laser", LocationName.RIGHT_ARM, 1, false))
                        .build());
            }
            assertEquals(1, store.rowCount("equipment"));
            assertEquals(100, store.rowCount("unit_loadout"));
            assertEquals(100, store.rowCount("units"));
            assertEquals(1, store.rowCount("unit_chassis"));
        }

        @Test
        @DisplayName("Concurrent workers converge on one equipment row")
        void concurrentWorkers() throws IOException {
            Map<String, String> files = new LinkedHashMap<>();
            for (int i = 0; i < 40; i++) {
                files.put("mechs/Locust " + i + ".mtf", LOCUST.replace("LCT-1V", "LCT-" + i));
            }
            IngestionOptions options = IngestionOptions.builder().workers(4).build();

            IngestionReport report = new IngestionPipeline(store, options, null).run(archive(files));

            assertEquals(40, report.created());
            assertEquals(1, store.rowCount("equipment"));
            assertEquals(40, store.rowCount("unit_loadout"));
        }

        @Test
        @DisplayName("A unit that loses a deadlock is written again and cached ids match stored rows")
        void retriesAfterConflict() {
            AtomicInteger conflicts = new AtomicInteger();
            IngestionPipeline pipeline = new IngestionPipeline(conflicting(store, conflicts));
            pipeline.prepare();
            conflicts.set(1);

            UnitIngestResult result = pipeline.ingest(locust("LCT-1V"));

            assertEquals(UpsertResult.Status.CREATED, result.status());
            assertEquals(1, store.rowCount("units"));
            assertEquals(2, store.rowCount("equipment"));
            for (EquipmentRow row : store.inTransaction(CatalogSession::listEquipment)) {
                assertEquals(row.id(), pipeline.getEquipmentCache().peek(row.slug()));
            }
        }

        @Test
        @DisplayName("A unit that keeps losing deadlocks fails after one retry")
        void conflictRetriedOnce() {
            AtomicInteger conflicts = new AtomicInteger();
            IngestionPipeline pipeline = new IngestionPipeline(conflicting(store, conflicts));
            pipeline.prepare();
            conflicts.set(5);

            assertThrows(StoreConflictException.class, () -> pipeline.ingest(locust("LCT-1V")));

            assertEquals(3, conflicts.get());
            assertEquals(0, store.rowCount("units"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A failing unit rolls back and the rest of the batch is stored")
        void failureIsolation() throws IOException {
            CatalogStore failing = failingOnQuirk(store, "cursed");
            IngestionPipeline pipeline = new IngestionPipeline(failing);
            pipeline.ingest(locust("LCT-1V"));

            assertThrows(CatalogStoreException.class, () -> pipeline.ingest(locust("LCT-1E", "cursed")));

            assertTrue(store.inTransaction(s -> s.findUnitBySlug("locust-lct-1e")).isEmpty());
            assertEquals(1, store.rowCount("units"));
            assertEquals(1, store.rowCount("unit_locations"));

            pipeline.ingest(locust("LCT-1M"));
            assertEquals(2, store.rowCount("units"));
        }

        @Test
        @DisplayName("Run reports rejected and failed files and keeps going")
        void runReportsIssues() throws IOException {
            Map<String, String> files = new LinkedHashMap<>();
            files.put("mechs/Locust LCT-1V.mtf", LOCUST);
            files.put("mechs/Broken.mtf", "model:nothing\n");
            files.put("mechs/Cursed.mtf", LOCUST.replace("LCT-1V", "LCT-1E") + "quirk:cursed\n");
            files.put("vehicles/Demolisher.blk", DEMOLISHER);
            files.put("readme.txt", "not a unit");

            IngestionReport report = new IngestionPipeline(failingOnQuirk(store, "cursed")).run(archive(files));

            assertEquals(4, report.unitFiles());
            assertEquals(1, report.otherEntries());
            assertEquals(3, report.parsed());
            assertEquals(2, report.created());
            assertEquals(1, report.rejected().size());
            assertEquals("mechs/Broken.mtf", report.rejected().get(0).entry());
            assertEquals(1, report.failed().size());
            assertEquals("locust-lct-1e", report.failed().get(0).unitSlug());
            assertFalse(report.aborted());
            assertTrue(report.hasErrors());
        }

        @ParameterizedTest(name = "workers={0}")
        @ValueSource(ints = {1, 4})
        @DisplayName("A file with absurd quantities is rejected and later files are still stored")
        void badQuantitiesDoNotAbortRun(int workers) throws IOException {
            Map<String, String> files = new LinkedHashMap<>();
            files.put("mechs/a_overflow.mtf", "chassis:Locust\nmodel:LCT-X\nmass:20\nWeapons:2\n"
                    + "2147483647 Medium Laser, Center Torso\n1 Medium Laser, Center Torso\n");
            files.put("mechs/b_oversized.mtf", "chassis:Locust\nmodel:LCT-Y\nmass:20\nWeapons:1\n"
                    + "99999999999 Medium Laser, Center Torso\n");
            files.put("mechs/c_locust.mtf", LOCUST);
            IngestionOptions options = IngestionOptions.builder().workers(workers).build();

            IngestionReport report = new IngestionPipeline(store, options, null).run(archive(files));

            assertEquals(3, report.unitFiles());
            assertEquals(1, report.rejected().size());
            assertEquals("mechs/a_overflow.mtf", report.rejected().get(0).entry());
            assertEquals(2, report.created());
            assertTrue(store.inTransaction(s -> s.findUnitBySlug("locust-lct-1v")).isPresent());
            assertTrue(store.inTransaction(s -> s.findUnitBySlug("locust-lct-y")).isPresent());
        }

        @Test
        @DisplayName("Run stops once the error limit is reached")
        void maxErrors() throws IOException {
            Map<String, String> files = new LinkedHashMap<>();
            for (int i = 0; i < 5; i++) {
                files.put("mechs/Cursed " + i + ".mtf", LOCUST.replace("LCT-1V", "LCT-C" + i) + "quirk:cursed\n");
            }
            IngestionOptions options = IngestionOptions.builder().maxErrors(2).build();

            IngestionReport report = new IngestionPipeline(failingOnQuirk(store, "cursed"), options, null)
                    .run(archive(files));

            assertTrue(report.aborted());
            assertEquals(2, report.failed().size());
            assertEquals(2, report.unitFiles());
        }

        @Test
        @DisplayName("Unreadable archive is a setup failure")
        void unreadableArchive() throws IOException {
            Path notZip = Files.writeString(tempDir.resolve("units.zip"), "plain text");
            IngestionPipeline pipeline = new IngestionPipeline(store);
            assertThrows(IngestionSetupException.class, () -> pipeline.run(notZip));
            assertThrows(IngestionSetupException.class, () -> pipeline.run(tempDir.resolve("missing.zip")));
        }

        @Test
        @DisplayName("Unreachable store aborts the whole run")
        void storeUnavailable() throws IOException {
            CatalogStore down = new CatalogStore() {
                @Override
                public <T> T inTransaction(Function<CatalogSession, T> work) {
                    throw new StoreUnavailableException("connection refused", null);
                }

                @Override
                public void close() {
                }
            };
            Path zip = archive(Map.of("mechs/Locust.mtf", LOCUST));
            assertThrows(IngestionSetupException.class, () -> new IngestionPipeline(down).run(zip));
        }
    }

    @Nested
    @DisplayName("Runs")
    class Runs {

        @Test
        @DisplayName("Second run over the same archive reports every unit unchanged")
        void rerunUnchanged() throws IOException {
            Path zip = archive(Map.of("mechs/Locust.mtf", LOCUST, "vehicles/Demolisher.blk", DEMOLISHER));
            new IngestionPipeline(store).run(zip);
            Map<String, Integer> before = rowCounts();

            IngestionReport second = new IngestionPipeline(store).run(zip);

            assertEquals(2, second.unchanged());
            assertEquals(0, second.created());
            assertEquals(before, rowCounts());
        }

        @Test
        @DisplayName("Checkpoint lets a restarted run skip committed entries")
        void checkpointResume() throws IOException {
            Path zip = archive(Map.of("mechs/Locust.mtf", LOCUST, "vehicles/Demolisher.blk", DEMOLISHER));
            IngestionOptions options = IngestionOptions.builder()
                    .checkpointFile(tempDir.resolve("state/checkpoint.txt"))
                    .build();

            new IngestionPipeline(store, options, null).run(zip);
            IngestionReport resumed = new IngestionPipeline(store, options, null).run(zip);

            assertEquals(2, resumed.skipped());
            assertEquals(0, resumed.successCount());
            assertEquals(2, Files.readAllLines(tempDir.resolve("state/checkpoint.txt")).size());
        }

        @Test
        @DisplayName("Unknown construction labels are reported as resolution gaps")
        void resolutionGaps() throws IOException {
            Path zip = archive(Map.of("mechs/Locust X.mtf", WARP_LOCUST));
            IngestionReport report = new IngestionPipeline(store).run(zip);

            assertEquals(1, report.resolutionGaps().size());
            IngestionReport.ResolutionGap gap = report.resolutionGaps().get(0);
            assertEquals("locust-lct-x", gap.unitSlug());
            assertEquals("engine", gap.category());
            assertEquals("Warp Drive", gap.label());
        }

        @Test
        @DisplayName("Run writes its report and refreshes observed locations")
        void reportAndObservedLocations() throws IOException {
            Path reportFile = tempDir.resolve("reports/ingest.json");
            IngestionOptions options = IngestionOptions.builder().reportFile(reportFile).datasetVersion("test").build();
            Path zip = archive(Map.of("mechs/Locust.mtf", LOCUST));

            new IngestionPipeline(store, options, null).run(zip);

            JsonNode json = new ObjectMapper().readTree(reportFile.toFile());
            assertEquals(1, json.get("created").asInt());
            assertEquals(List.of("center_torso"),
                    store.inTransaction(CatalogSession::listEquipment).get(0).observedLocations());
        }

        @Test
        @DisplayName("Run without a configured report file writes one next to the archive")
        void defaultReportFile() throws IOException {
            Path zip = archive(Map.of("mechs/Locust.mtf", LOCUST, "mechs/Broken.mtf", "mass:20\n"));

            new IngestionPipeline(store).run(zip);

            Path reportFile = zip.resolveSibling(zip.getFileName() + IngestionPipeline.REPORT_SUFFIX);
            assertEquals(reportFile, IngestionPipeline.defaultReportFile(zip));
            JsonNode json = new ObjectMapper().readTree(reportFile.toFile());
            assertEquals(1, json.get("created").asInt());
            assertEquals(1, json.get("rejected").size());
        }

        @Test
        @DisplayName("Progress callback receives the completion event")
        void progress() throws IOException {
            List<String> messages = new ArrayList<>();
            IngestionOptions options = IngestionOptions.builder().progressInterval(1).build();
            Path zip = archive(Map.of("mechs/Locust.mtf", LOCUST));

            new IngestionPipeline(store, options, null).run(zip, (processed, total, message) -> messages.add(message));

            assertEquals("Processed 1 unit files", messages.get(0));
            assertEquals("Ingestion completed", messages.get(messages.size() - 1));
        }

        @Test
        @DisplayName("Run records unit outcomes in metrics")
        void metrics() throws IOException {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            Path zip = archive(Map.of("mechs/Locust.mtf", LOCUST, "mechs/Broken.mtf", "mass:20\n"));

            new IngestionPipeline(store, IngestionOptions.defaults(), new MicrometerMetricsService(registry)).run(zip);

            assertEquals(1.0, registry.get("catalog.unit.outcome").tag("outcome", "created").counter().count());
            assertEquals(1.0, registry.get("catalog.parse.rejected").tag("format", "mtf").counter().count());
        }
    }

    @Test
    @DisplayName("Reference data is seeded once and findable")
    void prepareSeedsReferenceData() {
        new IngestionPipeline(store).prepare();
        assertTrue(store.inTransaction(s -> s.findEraId("clan-invasion")).isPresent());
        assertTrue(store.inTransaction(s -> s.findFactionId("clan-wolf")).isPresent());
        List<UnitSummary> units = store.inTransaction(CatalogSession::listUnits);
        assertTrue(units.isEmpty());
        assertEquals(1, store.rowCount("dataset_metadata"));
    }

    private Map<String, Integer> rowCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String table : List.of("unit_chassis", "units", "unit_locations", "equipment", "unit_loadout",
                "quirks", "unit_quirks", "unit_mech_data")) {
            counts.put(table, store.rowCount(table));
        }
        return counts;
    }
}
