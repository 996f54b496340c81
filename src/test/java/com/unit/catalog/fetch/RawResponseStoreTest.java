package com.unit.catalog.fetch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RawResponseStore Tests")
class RawResponseStoreTest {

    @TempDir
    Path tempDir;

    private RawResponseStore store;

    @BeforeEach
    void setUp() {
        store = new RawResponseStore(tempDir.resolve("raw"));
    }

    @Test
    @DisplayName("Listings are stored per type and partition")
    void quickLists() {
        TonnagePartition light = new TonnagePartition(0, 25);
        assertFalse(store.hasQuickList(18, light));
        assertTrue(store.allQuickLists().isEmpty());

        store.writeQuickList(18, new TonnagePartition(26, 35), "[2]");
        store.writeQuickList(18, light, "[1]");

        assertTrue(store.hasQuickList(18, light));
        assertEquals("[1]", store.readQuickList(18, light).orElseThrow());
        assertTrue(Files.isRegularFile(tempDir.resolve("raw/quicklist/18/0-25.json")));
        assertEquals(List.of("[1]", "[2]"), store.allQuickLists());
        assertEquals("quicklist/18/0-25", RawResponseStore.quickListKey(18, light));
    }

    @Test
    @DisplayName("Detail pages are stored by external id without temporary leftovers")
    void details() throws IOException {
        store.writeDetail(140, "<html>atlas</html>");
        store.writeDetail(140, "<html>atlas v2</html>");

        assertTrue(store.hasDetail(140));
        assertEquals("<html>atlas v2</html>", store.readDetail(140).orElseThrow());
        assertTrue(store.readDetail(141).isEmpty());
        try (Stream<Path> files = Files.list(tempDir.resolve("raw/details"))) {
            assertEquals(List.of("140.html"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    @DisplayName("Failure ledger and manifest survive a reload")
    void ledgerAndManifest() {
        assertTrue(store.loadFailures().isEmpty());
        assertTrue(store.readManifest().isEmpty());

        Map<String, FetchFailure> failures = new LinkedHashMap<>();
        failures.put("details/3", new FetchFailure("details/3", true, 404, "not found", "2026-01-01T00:00:00Z"));
        store.saveFailures(failures);
        FetchManifest manifest = new FetchManifest("2026-01-01T00:00:00Z", "http://localhost", List.of(18),
                Map.of("18", 42), 40, 2, 42);
        store.writeManifest(manifest);

        RawResponseStore reopened = new RawResponseStore(tempDir.resolve("raw"));
        assertEquals(failures, reopened.loadFailures());
        assertEquals(manifest, reopened.readManifest().orElseThrow());
    }

    @Test
    @DisplayName("Partition ranges parse from text")
    void partitionParse() {
        assertEquals(new TonnagePartition(201, 999_999), TonnagePartition.parse("201-999999"));
        assertThrows(IllegalArgumentException.class, () -> TonnagePartition.parse("25"));
        assertThrows(IllegalArgumentException.class, () -> new TonnagePartition(50, 10));
    }
}
