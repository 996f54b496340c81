package com.unit.catalog.fetch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogFetcher Tests")
class CatalogFetcherTest {

    @Mock
    CatalogFetchClient client;

    @TempDir
    Path tempDir;

    private RawResponseStore rawStore;
    private FetchConfig config;
    private CatalogFetcher fetcher;

    @BeforeEach
    void setUp() {
        rawStore = new RawResponseStore(tempDir.resolve("raw"));
        config = FetchConfig.builder().courtesyDelay(Duration.ZERO).build();
        fetcher = new CatalogFetcher(client, rawStore, config, new QuickListParser(),
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    /**
     * One unit per partition, with ids 1..10 in partition order.
     */
    private static String listing(TonnagePartition partition) {
        int id = TonnagePartition.DEFAULTS.indexOf(partition) + 1;
        return "{\"Units\":[{\"Id\":" + id + ",\"Name\":\"Unit " + id + "\",\"Tonnage\":" + partition.minTons() + "}]}";
    }

    @Test
    @DisplayName("Fetches every partition and every detail page")
    void fullRun() {
        when(client.fetchQuickList(eq(18), any())).thenAnswer(inv -> listing(inv.getArgument(1)));
        when(client.fetchDetail(anyInt())).thenAnswer(inv -> "<html>" + inv.getArgument(0) + "</html>");

        FetchReport report = fetcher.run();

        assertEquals(10, report.partitionsFetched());
        assertEquals(10, report.detailsFetched());
        assertEquals(10, report.externalIds());
        assertTrue(report.isComplete());
        assertEquals("<html>7</html>", rawStore.readDetail(7).orElseThrow());

        FetchManifest manifest = rawStore.readManifest().orElseThrow();
        assertEquals("2026-03-01T12:00:00Z", manifest.fetchedAt());
        assertEquals(10, manifest.quickListCounts().get("18"));
        assertEquals(10, manifest.totalExternalIds());
    }

    @Test
    @DisplayName("Restart after an interruption resumes at the first missing partition")
    void resume() {
        AtomicInteger calls = new AtomicInteger();
        when(client.fetchQuickList(eq(18), any())).thenAnswer(inv -> {
            if (calls.incrementAndGet() == 4) {
                throw new IllegalStateException("process killed");
            }
            return listing(inv.getArgument(1));
        });

        assertThrows(IllegalStateException.class, () -> fetcher.run(false, null));
        assertTrue(rawStore.hasQuickList(18, TonnagePartition.DEFAULTS.get(2)));
        assertFalse(rawStore.hasQuickList(18, TonnagePartition.DEFAULTS.get(3)));

        FetchReport resumed = fetcher.run(false, null);

        assertEquals(3, resumed.partitionsSkipped());
        assertEquals(7, resumed.partitionsFetched());
        assertEquals(10, resumed.externalIds());
        verify(client, times(11)).fetchQuickList(eq(18), any());
        verify(client, never()).fetchDetail(anyInt());
    }

    @Test
    @DisplayName("Permanent failures are skipped on restart while transient ones are retried")
    void failureLedger() {
        when(client.fetchQuickList(eq(18), any())).thenAnswer(inv -> listing(inv.getArgument(1)));
        when(client.fetchDetail(anyInt())).thenAnswer(inv -> {
            int id = inv.getArgument(0);
            if (id == 3) {
                throw FetchException.permanent("/Unit/Details/3", 404);
            }
            if (id == 5) {
                throw FetchException.retriesExhausted("/Unit/Details/5", 503, 3, null);
            }
            return "<html/>";
        });

        FetchReport first = fetcher.run();
        assertEquals(2, first.failures().size());
        assertEquals(8, first.detailsFetched());
        FetchFailure permanent = rawStore.loadFailures().get("details/3");
        assertTrue(permanent.permanent());
        assertEquals(404, permanent.status());
        assertFalse(rawStore.loadFailures().get("details/5").permanent());

        reset(client);
        when(client.fetchDetail(5)).thenReturn("<html>5</html>");

        FetchReport second = fetcher.run();

        assertEquals(10, second.partitionsSkipped());
        assertEquals(1, second.detailsFetched());
        assertEquals(9, second.detailsSkipped());
        assertTrue(second.isComplete());
        verify(client, never()).fetchDetail(3);
        assertFalse(rawStore.loadFailures().containsKey("details/5"));
        assertTrue(rawStore.loadFailures().containsKey("details/3"));
    }

    @Test
    @DisplayName("A malformed listing is moved aside and recorded while the run completes")
    void malformedListing() {
        TonnagePartition broken = TonnagePartition.DEFAULTS.get(0);
        String key = RawResponseStore.quickListKey(18, broken);
        when(client.fetchQuickList(eq(18), any())).thenAnswer(inv -> broken.equals(inv.getArgument(1))
                ? "<html>Service Unavailable</html>"
                : listing(inv.getArgument(1)));

        FetchReport report = fetcher.run(false, null);

        assertEquals(9, report.partitionsFetched());
        assertEquals(9, report.externalIds());
        assertEquals(1, report.failures().size());
        assertEquals(key, report.failures().get(0).resource());
        assertFalse(rawStore.hasQuickList(18, broken));
        assertTrue(Files.isRegularFile(rawStore.quickListPath(18, broken).resolveSibling(broken.key() + ".json.malformed")));
        FetchFailure recorded = rawStore.loadFailures().get(key);
        assertFalse(recorded.permanent());
        assertEquals(200, recorded.status());
        assertEquals(9, rawStore.readManifest().orElseThrow().totalExternalIds());

        reset(client);
        when(client.fetchQuickList(18, broken)).thenReturn(listing(broken));

        FetchReport retried = fetcher.run(false, null);

        assertEquals(1, retried.partitionsFetched());
        assertEquals(10, retried.externalIds());
        assertFalse(rawStore.loadFailures().containsKey(key));
    }

    @Test
    @DisplayName("Progress callback reports detail pages")
    void progress() {
        when(client.fetchQuickList(eq(18), any())).thenAnswer(inv -> listing(inv.getArgument(1)));
        when(client.fetchDetail(anyInt())).thenReturn("<html/>");
        List<String> messages = new ArrayList<>();

        fetcher.run(true, (processed, total, message) -> messages.add(processed + "/" + total));

        assertEquals(List.of("10/10"), messages);
    }
}
