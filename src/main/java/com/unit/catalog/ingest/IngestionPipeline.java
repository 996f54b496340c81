package com.unit.catalog.ingest;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.FieldProvenance;
import com.unit.catalog.core.model.FieldSource;
import com.unit.catalog.core.model.FieldValue;
import com.unit.catalog.core.model.LocationName;
import com.unit.catalog.core.model.ParsedLoadoutEntry;
import com.unit.catalog.core.model.ParsedUnit;
import com.unit.catalog.logging.LogContext;
import com.unit.catalog.metrics.MetricsService;
import com.unit.catalog.metrics.NoOpMetricsService;
import com.unit.catalog.parse.ArchiveEntry;
import com.unit.catalog.parse.ParseOutcome;
import com.unit.catalog.parse.UnitArchiveReader;
import com.unit.catalog.reference.AliasResolver;
import com.unit.catalog.reference.AliasTable;
import com.unit.catalog.reference.ComponentResolution;
import com.unit.catalog.reference.ReferenceCatalog;
import com.unit.catalog.reference.ReferenceData;
import com.unit.catalog.reference.ResolvedComponents;
import com.unit.catalog.store.CatalogSession;
import com.unit.catalog.store.CatalogStore;
import com.unit.catalog.store.CatalogStoreException;
import com.unit.catalog.store.ChassisRecord;
import com.unit.catalog.store.LoadoutRow;
import com.unit.catalog.store.StoreConflictException;
import com.unit.catalog.store.StoreUnavailableException;
import com.unit.catalog.store.UnitRecord;
import com.unit.catalog.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Turns parsed units into persisted rows.
 *
 * <p>Each unit is written in its own transaction, in dependency order: chassis, unit,
 * locations, loadout, quirks, mechanical attributes. Shared equipment and quirk rows are
 * created in slug order so concurrent workers lock them consistently. A unit that fails is rolled back
 * and reported; the rest of the batch continues. Equipment identities are shared across
 * units through an {@link EquipmentIdentityCache} owned by this pipeline, so create one
 * pipeline per run.</p>
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    static final String REPORT_SUFFIX = ".report.json";

    private final CatalogStore store;
    private final IngestionOptions options;
    private final MetricsService metricsService;
    private final EquipmentIdentityCache equipmentCache;
    private final ReferenceCatalog referenceCatalog;
    private final String runId;
    private volatile AliasResolver aliasResolver;

    public IngestionPipeline(CatalogStore store, IngestionOptions options, MetricsService metricsService) {
        this(store, options, metricsService, ReferenceCatalog.standard());
    }

    public IngestionPipeline(CatalogStore store, IngestionOptions options, MetricsService metricsService,
                             ReferenceCatalog referenceCatalog) {
        this.store = store;
        this.options = options != null ? options : IngestionOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.referenceCatalog = referenceCatalog;
        this.equipmentCache = new EquipmentIdentityCache(this.options.getEquipmentCacheSize(), this.metricsService);
        this.runId = LogContext.generateRunId();
    }

    public IngestionPipeline(CatalogStore store) {
        this(store, IngestionOptions.defaults(), null);
    }

    /**
     * Seeds eras, factions, dataset metadata and the reference catalog, then loads the
     * alias table. Called automatically before the first unit; any failure is fatal.
     */
    public synchronized AliasResolver prepare() {
        if (aliasResolver != null) {
            return aliasResolver;
        }
        try {
            AliasTable table = store.inTransaction(session -> {
                int eras = session.seedEras(ReferenceData.ERAS);
                int factions = session.seedFactions(ReferenceData.FACTIONS);
                int aliases = session.seedReferenceCatalog(referenceCatalog);
                session.recordDatasetMetadata(options.getDatasetVersion(), ReferenceCatalog.VERSION);
                log.info("ingest.seeded eras={} factions={} aliases={} referenceVersion={}",
                        eras, factions, aliases, ReferenceCatalog.VERSION);
                return session.loadAliasTable();
            });
            aliasResolver = new AliasResolver(table);
            return aliasResolver;
        } catch (CatalogStoreException | IllegalStateException e) {
            throw new IngestionSetupException("Reference data seeding failed: " + e.getMessage(), e);
        }
    }

    /**
     * Ingests one parsed unit in a single transaction. A transaction that loses a
     * deadlock to a concurrent worker is run once more before the failure is reported.
     *
     * @throws CatalogStoreException if the transaction fails; nothing of the unit is persisted
     */
    public UnitIngestResult ingest(ParsedUnit unit) {
        AliasResolver resolver = prepare();
        long start = System.nanoTime();
        UnitIngestResult result;
        try {
            result = attempt(unit, resolver);
        } catch (StoreConflictException e) {
            log.info("ingest.unit.retry slug={} error={}", unit.getSlug(), e.getMessage());
            result = attempt(unit, resolver);
        }
        metricsService.recordUnitDuration(unit.getUnitType(), Duration.ofNanos(System.nanoTime() - start));
        metricsService.incrementUnitOutcome(unit.getUnitType(), result.status().name().toLowerCase(Locale.ROOT));
        result.gaps().forEach(gap -> metricsService.incrementUnresolvedComponent(gap.category()));
        log.debug("ingest.unit.stored slug={} id={} status={}", result.slug(), result.unitId(), result.status());
        return result;
    }

    private UnitIngestResult attempt(ParsedUnit unit, AliasResolver resolver) {
        EquipmentIdentityCache.Stage stage = equipmentCache.stage();
        UnitIngestResult result = store.inTransaction(session -> write(session, unit, resolver, stage));
        equipmentCache.publish(stage);
        return result;
    }

    private UnitIngestResult write(CatalogSession session, ParsedUnit unit, AliasResolver resolver,
                                   EquipmentIdentityCache.Stage stage) {
        long chassisId = session.findOrCreateChassis(new ChassisRecord(unit.getChassisSlug(), unit.getChassis(),
                unit.getUnitType(), unit.getTechBase(), unit.getTonnage(), unit.getIntroYear()));

        UpsertResult upsert = session.upsertUnit(chassisId, new UnitRecord(unit.getSlug(), unit.getModel(),
                unit.getFullName(), unit.getTechBase(), unit.getRulesLevel(), unit.getTonnage(),
                unit.getSource(), unit.getDescription(), unit.getExternalId().orElse(null)));
        long unitId = upsert.id();
        UpsertResult.Status status = upsert.status();

        FieldValue currentIntro = session.loadCatalogFields(unitId).get(CatalogField.INTRO_YEAR);
        Optional<FieldValue> introYear = FieldProvenance.decide(currentIntro, unit.getIntroYear(),
                FieldSource.ARCHIVE, false);
        if (introYear.isPresent()) {
            session.writeCatalogFields(unitId, Map.of(CatalogField.INTRO_YEAR, introYear.get()));
            if (status == UpsertResult.Status.UNCHANGED) {
                status = UpsertResult.Status.UPDATED;
            }
        }

        session.replaceLocations(unitId, unit.getLocations());
        session.replaceLoadout(unitId, loadoutRows(session, unit.getLoadout(), stage));
        session.upsertQuirks(unitId, unit.getQuirks());

        List<ComponentResolution> gaps = new ArrayList<>();
        if (unit.getMechAttributes().isPresent()) {
            ResolvedComponents resolved = resolver.resolveAll(unit.getMechAttributes().get());
            session.upsertMechData(unitId, unit.getMechAttributes().get(), resolved);
            gaps.addAll(resolved.gaps());
            for (ComponentResolution gap : gaps) {
                log.info("ingest.component.unresolved slug={} category={} label='{}'",
                        unit.getSlug(), gap.category().getKey(), gap.label());
            }
        }
        return new UnitIngestResult(unitId, unit.getSlug(), status, gaps);
    }

    /**
     * Resolves loadout labels to equipment ids. Labels that differ only in case or
     * punctuation share an equipment id, so their placements are merged.
     */
    private List<LoadoutRow> loadoutRows(CatalogSession session, List<ParsedLoadoutEntry> entries,
                                         EquipmentIdentityCache.Stage stage) {
        Map<String, Long> ids = equipmentCache.resolveAll(session,
                entries.stream().map(ParsedLoadoutEntry::equipment).toList(), stage);
        Map<LoadoutKey, Integer> quantities = new LinkedHashMap<>();
        for (ParsedLoadoutEntry entry : entries) {
            long equipmentId = ids.get(entry.equipment());
            quantities.merge(new LoadoutKey(equipmentId, entry.location(), entry.rearFacing()), entry.quantity(), Math::addExact);
        }
        List<LoadoutRow> rows = new ArrayList<>(quantities.size());
        quantities.forEach((key, quantity) ->
                rows.add(new LoadoutRow(key.equipmentId(), key.location(), quantity, key.rearFacing())));
        return rows;
    }

    private record LoadoutKey(long equipmentId, LocationName location, boolean rearFacing) {}

    /**
     * Ingests every unit file of an archive. The report is written to the configured
     * report file, or next to the archive when none is configured.
     *
     * @throws IngestionSetupException if the archive cannot be read or the store is unreachable
     */
    public IngestionReport run(Path archive, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        IngestionReport.Collector collector = new IngestionReport.Collector(runId);
        try (LogContext ctx = LogContext.forIngestion(runId);
             UnitArchiveReader reader = new UnitArchiveReader(archive);
             IngestionCheckpoint checkpoint = options.getCheckpointFile()
                     .map(IngestionCheckpoint::open)
                     .orElseGet(IngestionCheckpoint::disabled)) {
            log.info("ingest.started archive={} options={}", archive, options);
            prepare();
            RunState state = new RunState(collector, checkpoint, cb);
            if (options.getWorkers() == 1) {
                reader.forEachEntry(visitor(state, entry -> processEntry(entry, state)));
            } else {
                runConcurrently(reader, state);
            }
            state.rethrowFatal();
            int observed = store.inTransaction(CatalogSession::refreshObservedLocations);
            log.debug("ingest.observedLocations equipment={}", observed);
        } catch (StoreUnavailableException e) {
            throw new IngestionSetupException("Catalog store is unreachable: " + e.getMessage(), e);
        }
        IngestionReport report = collector.build();
        new ReportWriter().write(report, options.getReportFile().orElseGet(() -> defaultReportFile(archive)));
        cb.onProgress(report.unitFiles(), report.unitFiles(), "Ingestion completed");
        log.info("ingest.completed report={}", report);
        return report;
    }

    /**
     * {@code units.zip} reports to {@code units.zip.report.json} next to it.
     */
    static Path defaultReportFile(Path archive) {
        return archive.toAbsolutePath().resolveSibling(archive.getFileName() + REPORT_SUFFIX);
    }

    public IngestionReport run(Path archive) {
        return run(archive, ProgressCallback.NOOP);
    }

    private UnitArchiveReader.EntryVisitor visitor(RunState state, Consumer<ArchiveEntry> handler) {
        return new UnitArchiveReader.EntryVisitor() {
            @Override
            public boolean unitFile(ArchiveEntry entry) {
                if (state.stopped()) {
                    return false;
                }
                handler.accept(entry);
                return !state.stopped();
            }

            @Override
            public void skipped(String name) {
                state.collector.otherEntry();
            }
        };
    }

    private void runConcurrently(UnitArchiveReader reader, RunState state) {
        int workers = options.getWorkers();
        ExecutorService executor = Executors.newFixedThreadPool(workers, namedThreads());
        Semaphore inFlight = new Semaphore(workers * 2);
        try {
            reader.forEachEntry(visitor(state, entry -> {
                inFlight.acquireUninterruptibly();
                executor.execute(() -> {
                    try {
                        processEntry(entry, state);
                    } catch (RuntimeException e) {
                        log.error("ingest.worker.failed entry={} error={}", entry.name(), e.toString());
                        state.fail(e);
                    } finally {
                        inFlight.release();
                    }
                });
            }));
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.HOURS)) {
                    executor.shutdownNow();
                    throw new IngestionSetupException("Ingestion workers did not finish within an hour");
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
                throw new IngestionSetupException("Interrupted while waiting for ingestion workers", e);
            }
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "unit-ingest-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void processEntry(ArchiveEntry entry, RunState state) {
        if (state.stopped()) {
            return;
        }
        long seen = state.collector.unitFile();
        try (LogContext ctx = LogContext.forUnit(runId, entry.name())) {
            if (state.checkpoint.isCommitted(entry.name())) {
                state.collector.skipped();
                return;
            }
            ParseOutcome outcome = parse(entry);
            if (!outcome.isParsed()) {
                state.collector.rejected(entry.name(), outcome.getRejectionReason());
                metricsService.incrementParseRejected(entry.format().name().toLowerCase(Locale.ROOT));
                log.warn("ingest.unit.rejected entry={} reason={}", entry.name(), outcome.getRejectionReason());
                return;
            }
            ParsedUnit unit = outcome.getUnit().orElseThrow();
            state.collector.parsed();
            try {
                UnitIngestResult result = ingest(unit);
                state.collector.stored(result);
                state.checkpoint.markCommitted(entry.name());
            } catch (StoreUnavailableException e) {
                state.fail(e);
            } catch (RuntimeException e) {
                metricsService.incrementUnitOutcome(unit.getUnitType(), "failed");
                int failures = state.collector.failed(entry.name(), unit.getSlug(), e.getMessage());
                log.warn("ingest.unit.failed entry={} slug={} error={}", entry.name(), unit.getSlug(), e.getMessage());
                if (options.getMaxErrors() > 0 && failures >= options.getMaxErrors()) {
                    log.error("ingest.aborted failures={} maxErrors={}", failures, options.getMaxErrors());
                    state.collector.abort();
                    state.stop();
                }
            }
        } finally {
            if (seen % options.getProgressInterval() == 0) {
                state.callback.onProgress(seen, -1, "Processed " + seen + " unit files");
            }
        }
    }

    private static ParseOutcome parse(ArchiveEntry entry) {
        try {
            return entry.parse();
        } catch (RuntimeException e) {
            return ParseOutcome.rejected("unreadable unit file: " + e);
        }
    }

    public EquipmentIdentityCache getEquipmentCache() {
        return equipmentCache;
    }

    public String getRunId() {
        return runId;
    }

    private static final class RunState {
        private final IngestionReport.Collector collector;
        private final IngestionCheckpoint checkpoint;
        private final ProgressCallback callback;
        private final AtomicReference<RuntimeException> fatal = new AtomicReference<>();
        private volatile boolean stopped;

        RunState(IngestionReport.Collector collector, IngestionCheckpoint checkpoint, ProgressCallback callback) {
            this.collector = collector;
            this.checkpoint = checkpoint;
            this.callback = callback;
        }

        boolean stopped() {
            return stopped;
        }

        void stop() {
            stopped = true;
        }

        void fail(RuntimeException e) {
            fatal.compareAndSet(null, e);
            stopped = true;
        }

        void rethrowFatal() {
            RuntimeException e = fatal.get();
            if (e != null) {
                throw e;
            }
        }
    }
}
