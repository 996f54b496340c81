package com.unit.catalog.match;

import com.unit.catalog.core.model.Slugs;
import com.unit.catalog.fetch.CatalogRecord;
import com.unit.catalog.logging.LogContext;
import com.unit.catalog.metrics.MetricsService;
import com.unit.catalog.metrics.NoOpMetricsService;
import com.unit.catalog.store.UnitSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves external catalog records to stored units through an ordered list of
 * {@link MatchStrategy} tiers; the first tier that names a unit wins.
 */
public class CrossSourceMatcher {
    private static final Logger log = LoggerFactory.getLogger(CrossSourceMatcher.class);

    static final String NO_TIER_MATCHED = "no tier matched";

    private final List<MatchStrategy> strategies;
    private final ManualOverrides overrides;
    private final MetricsService metricsService;

    public CrossSourceMatcher(ManualOverrides overrides) {
        this(Strategies.standard(overrides), overrides, null);
    }

    public CrossSourceMatcher(List<MatchStrategy> strategies, ManualOverrides overrides, MetricsService metricsService) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one match strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.overrides = overrides != null ? overrides : ManualOverrides.empty();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public MatchOutcome match(CatalogRecord record, UnitIndex index) {
        for (MatchStrategy strategy : strategies) {
            Optional<UnitSummary> hit = strategy.match(record, index);
            if (hit.isPresent()) {
                metricsService.incrementMatched(strategy.tier());
                log.debug("match.hit externalId={} tier={} slug={}", record.externalId(), strategy.tier(), hit.get().slug());
                return MatchOutcome.matched(record, hit.get(), strategy.tier());
            }
        }
        metricsService.incrementUnmatched();
        String reason = overrides.target(record.externalId())
                .map(slug -> "override target '" + slug + "' not found; " + NO_TIER_MATCHED)
                .orElse(NO_TIER_MATCHED);
        log.debug("match.miss externalId={} name='{}' reason={}", record.externalId(), record.name(), reason);
        return MatchOutcome.unmatched(record, reason);
    }

    public List<MatchOutcome> matchAll(List<CatalogRecord> records, UnitIndex index, String runId) {
        return records.stream().map(record -> {
            try (LogContext ctx = LogContext.forMatch(runId, record.externalId())) {
                return match(record, index);
            }
        }).toList();
    }

    public static UnmatchedRecord toUnmatched(MatchOutcome outcome) {
        CatalogRecord record = outcome.record();
        return new UnmatchedRecord(record.externalId(), record.name(), Slugs.toSlug(record.name()),
                record.tonnage(), outcome.reason());
    }

    public List<MatchStrategy> getStrategies() {
        return strategies;
    }
}
