package com.unit.catalog.merge;

import com.unit.catalog.core.model.CatalogField;
import com.unit.catalog.core.model.FieldProvenance;
import com.unit.catalog.core.model.FieldValue;
import com.unit.catalog.fetch.CatalogRecord;
import com.unit.catalog.fetch.QuickListParser;
import com.unit.catalog.fetch.RawResponseStore;
import com.unit.catalog.ingest.ReportWriter;
import com.unit.catalog.logging.LogContext;
import com.unit.catalog.match.CrossSourceMatcher;
import com.unit.catalog.match.MatchNames;
import com.unit.catalog.match.MatchOutcome;
import com.unit.catalog.match.UnitIndex;
import com.unit.catalog.match.UnmatchedListWriter;
import com.unit.catalog.match.UnmatchedRecord;
import com.unit.catalog.metrics.MetricsService;
import com.unit.catalog.metrics.NoOpMetricsService;
import com.unit.catalog.store.CatalogSession;
import com.unit.catalog.store.CatalogStore;
import com.unit.catalog.store.CatalogStoreException;
import com.unit.catalog.store.UnitSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Merges external catalog records onto the units they match.
 *
 * <p>Battle value, cost, role, introduction year and alternate name go through
 * {@link FieldProvenance}: a value set by a higher-priority source is kept unless the
 * merge is forced. Each matched record is merged in its own transaction, which also
 * records the external id and stamps the import time. Two records matching the same
 * unit are not both merged; the second is reported as unmatched.</p>
 */
public class CatalogMerger {
    private static final Logger log = LoggerFactory.getLogger(CatalogMerger.class);
    static final String UNMATCHED_FILE = "unmatched.csv";
    static final String REPORT_FILE = "merge-report.json";

    private final CatalogStore store;
    private final CrossSourceMatcher matcher;
    private final MergeOptions options;
    private final MetricsService metricsService;
    private final Clock clock;

    public CatalogMerger(CatalogStore store, CrossSourceMatcher matcher, MergeOptions options) {
        this(store, matcher, options, null, Clock.systemUTC());
    }

    public CatalogMerger(CatalogStore store, CrossSourceMatcher matcher, MergeOptions options,
                         MetricsService metricsService, Clock clock) {
        this.store = store;
        this.matcher = matcher;
        this.options = options != null ? options : MergeOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.clock = clock;
    }

    /**
     * Merges every listing stored in {@code rawStore} and, when enabled, imports
     * availability from its detail pages. Unless the options name other files, the
     * unmatched list and the report are written to {@code unmatched.csv} and
     * {@code merge-report.json} under the store's root.
     */
    public MergeReport run(RawResponseStore rawStore) {
        QuickListParser.ParsedListings listings = new QuickListParser().parseAll(rawStore.storedQuickLists());
        AvailabilityImporter availability = options.isImportAvailability()
                ? new AvailabilityImporter(store, rawStore) : null;
        List<String> unreadable = new ArrayList<>();
        listings.malformed().forEach(key -> unreadable.add(key + ": malformed listing JSON"));
        return merge(listings.records(), availability, unreadable, rawStore.getRoot());
    }

    /**
     * Merges {@code records} without importing availability. The unmatched list and the
     * report are written only where the options name a file.
     */
    public MergeReport merge(List<CatalogRecord> records) {
        return merge(records, null);
    }

    public MergeReport merge(List<CatalogRecord> records, AvailabilityImporter availabilityImporter) {
        return merge(records, availabilityImporter, List.of(), null);
    }

    /**
     * @param unreadable  listings that could not be parsed, reported as failures
     * @param outputDir   where the unmatched list and report go when the options name no file;
     *                    null keeps them in the returned report only
     */
    private MergeReport merge(List<CatalogRecord> records, AvailabilityImporter availabilityImporter,
                              List<String> unreadable, Path outputDir) {
        long start = System.nanoTime();
        String runId = LogContext.generateRunId();
        log.info("merge.started runId={} records={} options={}", runId, records.size(), options);

        UnitIndex index = new UnitIndex(store.inTransaction(CatalogSession::listUnits));
        List<MatchOutcome> outcomes = matcher.matchAll(records, index, runId);

        Map<String, Integer> byTier = new TreeMap<>();
        Map<String, Integer> fieldChanges = new TreeMap<>();
        Map<Long, Integer> claimedBy = new LinkedHashMap<>();
        Map<Integer, Long> matchedUnits = new LinkedHashMap<>();
        List<UnmatchedRecord> unmatched = new ArrayList<>();
        List<String> failed = new ArrayList<>(unreadable);
        int unitsUpdated = 0;
        int conflicts = 0;

        for (MatchOutcome outcome : outcomes) {
            CatalogRecord record = outcome.record();
            if (!outcome.isMatched()) {
                unmatched.add(CrossSourceMatcher.toUnmatched(outcome));
                continue;
            }
            UnitSummary unit = outcome.unit();
            Integer previous = claimedBy.putIfAbsent(unit.id(), record.externalId());
            if (previous != null) {
                unmatched.add(CrossSourceMatcher.toUnmatched(MatchOutcome.unmatched(record,
                        "unit " + unit.slug() + " already matched by external id " + previous)));
                continue;
            }
            byTier.merge(outcome.tier(), 1, Integer::sum);

            try (LogContext ctx = LogContext.forMatch(runId, record.externalId())) {
                UnitMerge merged = store.inTransaction(session -> mergeUnit(session, unit, record));
                matchedUnits.put(record.externalId(), unit.id());
                if (!merged.changedFields().isEmpty()) {
                    unitsUpdated++;
                }
                for (CatalogField field : merged.changedFields()) {
                    fieldChanges.merge(field.getColumn(), 1, Integer::sum);
                    metricsService.incrementFieldChanged(field);
                }
                if (merged.externalIdConflict()) {
                    conflicts++;
                }
            } catch (CatalogStoreException e) {
                failed.add(record.externalId() + ": " + e.getMessage());
                log.warn("merge.unit.failed externalId={} slug={} error={}", record.externalId(), unit.slug(), e.getMessage());
            }
        }

        int matched = byTier.values().stream().mapToInt(Integer::intValue).sum();
        log.info("merge.matched matched={} unmatched={} byTier={}", matched, unmatched.size(), byTier);
        outputFile(options.getUnmatchedFile(), outputDir, UNMATCHED_FILE)
                .ifPresent(file -> new UnmatchedListWriter().write(file, unmatched));

        AvailabilityResult availability = availabilityImporter != null
                ? availabilityImporter.importAll(matchedUnits, options.isForceAvailability())
                : AvailabilityResult.none();

        MergeReport report = new MergeReport(runId, records.size(), matched, byTier, unitsUpdated, fieldChanges,
                conflicts, unmatched, failed, availability, (System.nanoTime() - start) / 1_000_000);
        log.info("merge.completed report={}", report);
        outputFile(options.getReportFile(), outputDir, REPORT_FILE)
                .ifPresent(file -> new ReportWriter().write(report, file));
        return report;
    }

    private static Optional<Path> outputFile(Optional<Path> configured, Path outputDir, String defaultName) {
        if (configured.isPresent() || outputDir == null) {
            return configured;
        }
        return Optional.of(outputDir.resolve(defaultName));
    }

    private UnitMerge mergeUnit(CatalogSession session, UnitSummary unit, CatalogRecord record) {
        Map<CatalogField, FieldValue> current = session.loadCatalogFields(unit.id());
        Map<CatalogField, Object> incoming = new EnumMap<>(CatalogField.class);
        incoming.put(CatalogField.BATTLE_VALUE, record.battleValue());
        incoming.put(CatalogField.COST, record.cost());
        incoming.put(CatalogField.ROLE, record.role());
        incoming.put(CatalogField.INTRO_YEAR, record.introYear());
        incoming.put(CatalogField.ALTERNATE_NAME, MatchNames.alternateName(record.name()).orElse(null));

        Map<CatalogField, FieldValue> writes = new EnumMap<>(CatalogField.class);
        List<CatalogField> changed = new ArrayList<>();
        for (Map.Entry<CatalogField, Object> entry : incoming.entrySet()) {
            CatalogField field = entry.getKey();
            FieldValue before = current.getOrDefault(field, FieldValue.EMPTY);
            Optional<FieldValue> decision = FieldProvenance.decide(before, entry.getValue(),
                    options.getSource(), options.isForce());
            if (decision.isPresent()) {
                writes.put(field, decision.get());
                if (!Objects.equals(before.value(), decision.get().value())) {
                    changed.add(field);
                }
            } else if (entry.getValue() != null && !Objects.equals(before.value(), entry.getValue())) {
                log.debug("merge.field.kept externalId={} field={} current={} currentSource={}",
                        record.externalId(), field.getColumn(), before.value(), before.source());
            }
        }
        session.writeCatalogFields(unit.id(), writes);

        boolean conflict = false;
        Optional<UnitSummary> holder = session.findUnitByExternalId(record.externalId());
        if (holder.isPresent() && holder.get().id() != unit.id()) {
            conflict = true;
            log.warn("merge.externalId.conflict externalId={} heldBy={} matched={}",
                    record.externalId(), holder.get().slug(), unit.slug());
        } else if (holder.isEmpty()) {
            session.assignExternalId(unit.id(), record.externalId());
        }
        session.stampCatalogImport(unit.id(), clock.instant());
        return new UnitMerge(changed, conflict);
    }

    private record UnitMerge(List<CatalogField> changedFields, boolean externalIdConflict) {}
}
