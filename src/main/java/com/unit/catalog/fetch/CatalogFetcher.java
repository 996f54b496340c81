package com.unit.catalog.fetch;

import com.unit.catalog.ingest.ProgressCallback;
import com.unit.catalog.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Copies the external catalog into a {@link RawResponseStore}.
 *
 * <p>Listings are fetched partition by partition, then every detail page for the ids they
 * list. Each response is stored before it is parsed, and anything already stored is
 * skipped, so an interrupted run picks up at the first missing resource. Resources that
 * failed permanently in an earlier run are skipped as well; transient failures are tried
 * again. A listing body that is not valid JSON is moved aside and recorded as a transient
 * failure, so the next run fetches that partition again.</p>
 */
public class CatalogFetcher {
    private static final Logger log = LoggerFactory.getLogger(CatalogFetcher.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final CatalogFetchClient client;
    private final RawResponseStore rawStore;
    private final FetchConfig config;
    private final QuickListParser quickListParser;
    private final Clock clock;

    public CatalogFetcher(CatalogFetchClient client, RawResponseStore rawStore, FetchConfig config) {
        this(client, rawStore, config, new QuickListParser(), Clock.systemUTC());
    }

    public CatalogFetcher(CatalogFetchClient client, RawResponseStore rawStore, FetchConfig config,
                          QuickListParser quickListParser, Clock clock) {
        this.client = client;
        this.rawStore = rawStore;
        this.config = config;
        this.quickListParser = quickListParser;
        this.clock = clock;
    }

    public FetchReport run(boolean includeDetails, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long start = System.nanoTime();
        String runId = LogContext.generateRunId();
        Map<String, FetchFailure> ledger = rawStore.loadFailures();
        List<FetchFailure> failures = new ArrayList<>();
        Counts counts = new Counts();
        log.info("fetch.started root={} config={}", rawStore.getRoot(), config);

        Map<String, Integer> listingCounts = new LinkedHashMap<>();
        for (int unitType : config.getUnitTypes()) {
            for (TonnagePartition partition : config.getPartitions()) {
                String key = RawResponseStore.quickListKey(unitType, partition);
                try (LogContext ctx = LogContext.forFetch(runId, key)) {
                    if (rawStore.hasQuickList(unitType, partition) || isPermanent(ledger, key)) {
                        counts.partitionsSkipped++;
                        continue;
                    }
                    String json = client.fetchQuickList(unitType, partition);
                    rawStore.writeQuickList(unitType, partition, json);
                    int units;
                    try {
                        units = quickListParser.parse(json).size();
                    } catch (UncheckedIOException e) {
                        rawStore.quarantineQuickList(unitType, partition);
                        failures.add(recordFailure(ledger, key, new FetchFailure(key, false, 200,
                                "Malformed listing body: " + e.getCause().getMessage(), clock.instant().toString())));
                        client.courtesyPause();
                        continue;
                    }
                    ledger.remove(key);
                    counts.partitionsFetched++;
                    listingCounts.merge(String.valueOf(unitType), units, Integer::sum);
                    log.info("fetch.quicklist.stored type={} tons={} units={}", unitType, partition, units);
                    client.courtesyPause();
                } catch (FetchException e) {
                    failures.add(recordFailure(ledger, key, e));
                }
            }
        }

        TreeSet<Integer> ids = new TreeSet<>();
        QuickListParser.ParsedListings listings = quickListParser.parseAll(rawStore.storedQuickLists());
        listings.records().forEach(r -> ids.add(r.externalId()));
        log.info("fetch.ids total={} malformedListings={}", ids.size(), listings.malformed().size());

        if (includeDetails) {
            int seen = 0;
            for (int externalId : ids) {
                seen++;
                String key = RawResponseStore.detailKey(externalId);
                try (LogContext ctx = LogContext.forFetch(runId, key)) {
                    if (rawStore.hasDetail(externalId) || isPermanent(ledger, key)) {
                        counts.detailsSkipped++;
                    } else {
                        rawStore.writeDetail(externalId, client.fetchDetail(externalId));
                        ledger.remove(key);
                        counts.detailsFetched++;
                        client.courtesyPause();
                    }
                } catch (FetchException e) {
                    failures.add(recordFailure(ledger, key, e));
                }
                if (seen % PROGRESS_INTERVAL == 0 || seen == ids.size()) {
                    log.info("fetch.details.progress fetched={} skipped={} remaining={}",
                            counts.detailsFetched, counts.detailsSkipped, ids.size() - seen);
                    cb.onProgress(seen, ids.size(), "Processed " + seen + " detail pages");
                }
            }
        }

        rawStore.saveFailures(ledger);
        rawStore.writeManifest(new FetchManifest(clock.instant().toString(), config.getBaseUrl(),
                config.getUnitTypes(), listingCounts, counts.detailsFetched, counts.detailsSkipped, ids.size()));

        FetchReport report = new FetchReport(counts.partitionsFetched, counts.partitionsSkipped,
                counts.detailsFetched, counts.detailsSkipped, ids.size(), failures,
                (System.nanoTime() - start) / 1_000_000);
        log.info("fetch.completed report={}", report);
        return report;
    }

    public FetchReport run() {
        return run(true, ProgressCallback.NOOP);
    }

    private static boolean isPermanent(Map<String, FetchFailure> ledger, String key) {
        FetchFailure failure = ledger.get(key);
        return failure != null && failure.permanent();
    }

    private FetchFailure recordFailure(Map<String, FetchFailure> ledger, String key, FetchException e) {
        FetchFailure failure = recordFailure(ledger, key, new FetchFailure(key, !e.isTransient(), e.getStatusCode(),
                e.getMessage(), clock.instant().toString()));
        if (Thread.currentThread().isInterrupted()) {
            throw e;
        }
        return failure;
    }

    private FetchFailure recordFailure(Map<String, FetchFailure> ledger, String key, FetchFailure failure) {
        ledger.put(key, failure);
        rawStore.saveFailures(ledger);
        log.warn("fetch.failed resource={} permanent={} error={}", key, failure.permanent(), failure.reason());
        return failure;
    }

    private static final class Counts {
        int partitionsFetched;
        int partitionsSkipped;
        int detailsFetched;
        int detailsSkipped;
    }
}
