package com.unit.catalog.cdi;

import com.unit.catalog.api.UnitCatalog;
import com.unit.catalog.config.DataSourceConfig;
import com.unit.catalog.core.model.FieldSource;
import com.unit.catalog.fetch.FetchConfig;
import com.unit.catalog.ingest.IngestionOptions;
import com.unit.catalog.merge.MergeOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires a {@link UnitCatalog} from MicroProfile Config properties.
 *
 * <h2>Required configuration</h2>
 * <pre>
 * unit-catalog:
 *   datasource:
 *     jdbc-url: jdbc:postgresql://localhost:5432/units
 *     username: units
 *     password: secret
 * </pre>
 */
@ApplicationScoped
public class CatalogIngestionProducer {

    private static final Logger log = LoggerFactory.getLogger(CatalogIngestionProducer.class);

    // ── Database ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "unit-catalog.datasource.jdbc-url")
    String jdbcUrl;

    @Inject
    @ConfigProperty(name = "unit-catalog.datasource.username")
    Optional<String> username;

    @Inject
    @ConfigProperty(name = "unit-catalog.datasource.password")
    Optional<String> password;

    @Inject
    @ConfigProperty(name = "unit-catalog.datasource.max-pool-size", defaultValue = "10")
    int maxPoolSize;

    @Inject
    @ConfigProperty(name = "unit-catalog.datasource.min-idle", defaultValue = "2")
    int minIdle;

    @Inject
    @ConfigProperty(name = "unit-catalog.datasource.connection-timeout-millis", defaultValue = "5000")
    long connectionTimeoutMillis;

    @Inject
    @ConfigProperty(name = "unit-catalog.datasource.apply-schema", defaultValue = "true")
    boolean applySchema;

    // ── Ingestion ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "unit-catalog.ingest.dataset-version", defaultValue = "unversioned")
    String datasetVersion;

    @Inject
    @ConfigProperty(name = "unit-catalog.ingest.workers", defaultValue = "1")
    int workers;

    @Inject
    @ConfigProperty(name = "unit-catalog.ingest.max-errors", defaultValue = "0")
    int maxErrors;

    @Inject
    @ConfigProperty(name = "unit-catalog.ingest.equipment-cache-size", defaultValue = "100000")
    long equipmentCacheSize;

    @Inject
    @ConfigProperty(name = "unit-catalog.ingest.checkpoint-file")
    Optional<String> checkpointFile;

    @Inject
    @ConfigProperty(name = "unit-catalog.ingest.report-file")
    Optional<String> ingestReportFile;

    // ── External catalog ──────────────────────────────────────

    @Inject
    @ConfigProperty(name = "unit-catalog.fetch.base-url", defaultValue = FetchConfig.DEFAULT_BASE_URL)
    String fetchBaseUrl;

    @Inject
    @ConfigProperty(name = "unit-catalog.fetch.courtesy-delay-millis", defaultValue = "1000")
    long courtesyDelayMillis;

    @Inject
    @ConfigProperty(name = "unit-catalog.fetch.timeout-seconds", defaultValue = "30")
    int fetchTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "unit-catalog.fetch.max-retries", defaultValue = "3")
    int fetchMaxRetries;

    @Inject
    @ConfigProperty(name = "unit-catalog.fetch.unit-types", defaultValue = "18")
    List<Integer> unitTypes;

    // ── Merge ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "unit-catalog.merge.source", defaultValue = "catalog")
    String mergeSource;

    @Inject
    @ConfigProperty(name = "unit-catalog.merge.force", defaultValue = "false")
    boolean mergeForce;

    @Inject
    @ConfigProperty(name = "unit-catalog.merge.import-availability", defaultValue = "true")
    boolean importAvailability;

    @Inject
    @ConfigProperty(name = "unit-catalog.merge.unmatched-file")
    Optional<String> unmatchedFile;

    @Inject
    @ConfigProperty(name = "unit-catalog.merge.report-file")
    Optional<String> mergeReportFile;

    @Produces
    @ApplicationScoped
    public UnitCatalog unitCatalog() {
        log.info("catalog.producing jdbcUrl={} workers={}", jdbcUrl, workers);

        DataSourceConfig dataSource = DataSourceConfig.builder()
                .jdbcUrl(jdbcUrl)
                .username(username.orElse(null))
                .password(password.orElse(null))
                .maximumPoolSize(maxPoolSize)
                .minimumIdle(minIdle)
                .connectionTimeoutMillis(connectionTimeoutMillis)
                .applySchema(applySchema)
                .build();

        IngestionOptions.Builder ingest = IngestionOptions.builder()
                .datasetVersion(datasetVersion)
                .workers(workers)
                .maxErrors(maxErrors)
                .equipmentCacheSize(equipmentCacheSize);
        checkpointFile.map(Path::of).ifPresent(ingest::checkpointFile);
        ingestReportFile.map(Path::of).ifPresent(ingest::reportFile);

        FetchConfig fetch = FetchConfig.builder()
                .baseUrl(fetchBaseUrl)
                .courtesyDelay(Duration.ofMillis(courtesyDelayMillis))
                .requestTimeout(Duration.ofSeconds(fetchTimeoutSeconds))
                .maxRetries(fetchMaxRetries)
                .unitTypes(unitTypes)
                .build();

        MergeOptions.Builder merge = MergeOptions.builder()
                .source(FieldSource.fromDbValue(mergeSource))
                .force(mergeForce)
                .importAvailability(importAvailability);
        unmatchedFile.map(Path::of).ifPresent(merge::unmatchedFile);
        mergeReportFile.map(Path::of).ifPresent(merge::reportFile);

        return UnitCatalog.builder()
                .dataSource(dataSource)
                .ingestionOptions(ingest.build())
                .fetchConfig(fetch)
                .mergeOptions(merge.build())
                .build();
    }

    public void closeCatalog(@Disposes UnitCatalog catalog) {
        log.info("catalog.disposing");
        catalog.close();
    }
}
