package com.unit.catalog.merge;

import com.unit.catalog.core.model.ParsedUnit;
import com.unit.catalog.fetch.RawResponseStore;
import com.unit.catalog.ingest.IngestionPipeline;
import com.unit.catalog.store.CatalogSession;
import com.unit.catalog.store.CatalogStore;
import com.unit.catalog.store.CatalogStoreException;
import com.unit.catalog.store.InMemoryCatalogStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;

@DisplayName("AvailabilityImporter Tests")
class AvailabilityImporterTest {

    @TempDir
    Path tempDir;

    private InMemoryCatalogStore store;
    private RawResponseStore raw;
    private AvailabilityImporter importer;
    private long atlasId;

    /**
     * A detail page with one era panel listing the given factions.
     */
    static String detailPage(String era, String... factions) {
        return "<html><body>" + panel(era, factions) + "</body></html>";
    }

    private static String panel(String era, String... factions) {
        StringBuilder rows = new StringBuilder();
        for (String faction : factions) {
            rows.append("<tr><td><a href=\"/Faction\">").append(faction).append("</a></td></tr>");
        }
        return "<div class=\"panel panel-default\">"
                + "<div class=\"panel-heading\"><div class=\"media-body\"><a>" + era + " (2571 - 2780)</a></div></div>"
                + "<div class=\"panel-body\"><table><tbody>" + rows + "</tbody></table></div>"
                + "</div>";
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        atlasId = new IngestionPipeline(store).ingest(ParsedUnit.builder()
                .chassis("Atlas").model("AS7-D").tonnage(100).build()).unitId();
        raw = new RawResponseStore(tempDir.resolve("raw"));
        importer = new AvailabilityImporter(store, raw);
    }

    @Test
    @DisplayName("Maps external era and faction names to local rows")
    void importsRows() {
        raw.writeDetail(140, detailPage("Star League", "Star League", "Lyran Commonwealth", "Lyran Alliance"));

        AvailabilityResult result = importer.importAll(Map.of(140, atlasId), false);

        assertEquals(1, result.unitsImported());
        assertEquals(2, result.rowsWritten(), "Lyran names share one faction");
        assertEquals(0, result.factionsCreated());
        assertEquals(2, store.<Integer>inTransaction(s -> s.countAvailability(atlasId)));
    }

    @Test
    @DisplayName("Unknown factions are created and unknown eras reported")
    void unknownNames() {
        raw.writeDetail(140, "<html><body>" + panel("Star League", "Tortuga Dominions")
                + panel("Long Forgotten Age", "Clan Wolf") + "</body></html>");

        AvailabilityResult result = importer.importAll(Map.of(140, atlasId), false);

        assertEquals(1, result.factionsCreated());
        assertTrue(store.inTransaction(s -> s.findFactionId("tortuga-dominions")).isPresent());
        assertEquals(Set.of("Long Forgotten Age"), result.unmappedEras());
        assertEquals(1, result.rowsWritten());
    }

    @Test
    @DisplayName("Existing availability is kept unless forced")
    void skipUnlessForced() {
        raw.writeDetail(140, detailPage("Star League", "Lyran Commonwealth"));
        importer.importAll(Map.of(140, atlasId), false);
        raw.writeDetail(140, detailPage("Clan Invasion", "Clan Wolf", "Federated Suns"));

        AvailabilityResult skipped = importer.importAll(Map.of(140, atlasId), false);
        assertEquals(1, skipped.unitsSkipped());
        assertEquals(1, store.<Integer>inTransaction(s -> s.countAvailability(atlasId)));

        AvailabilityResult forced = importer.importAll(Map.of(140, atlasId), true);
        assertEquals(1, forced.unitsImported());
        assertEquals(2, store.<Integer>inTransaction(s -> s.countAvailability(atlasId)));
    }

    @Test
    @DisplayName("Units without a stored detail page are counted")
    void missingDetail() {
        AvailabilityResult result = importer.importAll(Map.of(999, atlasId), false);
        assertEquals(1, result.missingDetails());
        assertEquals(0, result.unitsImported());
    }

    @Test
    @DisplayName("A unit whose transaction fails is listed and the others are imported")
    void failedUnitReported() {
        long locustId = new IngestionPipeline(store).ingest(ParsedUnit.builder()
                .chassis("Locust").model("LCT-1V").tonnage(20).build()).unitId();
        raw.writeDetail(140, detailPage("Star League", "Lyran Commonwealth"));
        raw.writeDetail(141, detailPage("Star League", "Draconis Combine"));
        CatalogStore failing = spy(store);
        doAnswer(invocation -> {
            Function<CatalogSession, Object> work = invocation.getArgument(0);
            return store.inTransaction(session -> {
                CatalogSession rejecting = mock(CatalogSession.class, delegatesTo(session));
                doThrow(new CatalogStoreException("unique violation on unit_availability"))
                        .when(rejecting).replaceAvailability(eq(atlasId), anyCollection());
                return work.apply(rejecting);
            });
        }).when(failing).inTransaction(any());

        Map<Integer, Long> matches = new LinkedHashMap<>();
        matches.put(140, atlasId);
        matches.put(141, locustId);
        AvailabilityResult result = new AvailabilityImporter(failing, raw).importAll(matches, false);

        assertEquals(List.of("140: unique violation on unit_availability"), result.failed());
        assertEquals(1, result.unitsImported());
        assertEquals(0, store.<Integer>inTransaction(s -> s.countAvailability(atlasId)));
        assertEquals(1, store.<Integer>inTransaction(s -> s.countAvailability(locustId)));
    }

    @ParameterizedTest
    @CsvSource({
            "Clan Snow Raven, clan",
            "Tortuga Dominions, other",
            "Filtvelt Coalition Periphery, periphery",
            "Kell Hounds Mercenary, mercenary"
    })
    @DisplayName("Faction type is inferred from the name")
    void inferFactionType(String name, String type) {
        assertEquals(type, CatalogNameMappings.inferFactionType(name));
    }
}
