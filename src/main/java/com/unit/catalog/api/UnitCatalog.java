package com.unit.catalog.api;

import com.unit.catalog.config.DataSourceConfig;
import com.unit.catalog.equipment.AmmoLinker;
import com.unit.catalog.equipment.EquipmentStatsSeeder;
import com.unit.catalog.equipment.SeedResult;
import com.unit.catalog.fetch.CatalogFetchClient;
import com.unit.catalog.fetch.CatalogFetcher;
import com.unit.catalog.fetch.FetchConfig;
import com.unit.catalog.fetch.FetchReport;
import com.unit.catalog.fetch.RawResponseStore;
import com.unit.catalog.ingest.IngestionOptions;
import com.unit.catalog.ingest.IngestionPipeline;
import com.unit.catalog.ingest.IngestionReport;
import com.unit.catalog.ingest.IngestionSetupException;
import com.unit.catalog.ingest.ProgressCallback;
import com.unit.catalog.match.CrossSourceMatcher;
import com.unit.catalog.match.ManualOverrides;
import com.unit.catalog.match.Strategies;
import com.unit.catalog.merge.CatalogMerger;
import com.unit.catalog.merge.MergeOptions;
import com.unit.catalog.merge.MergeReport;
import com.unit.catalog.metrics.MetricsService;
import com.unit.catalog.metrics.NoOpMetricsService;
import com.unit.catalog.reference.ReferenceCatalog;
import com.unit.catalog.store.CatalogStore;
import com.unit.catalog.store.CatalogStoreException;
import com.unit.catalog.store.JdbcCatalogStore;
import com.unit.catalog.store.SchemaInitializer;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Main entry point for building and reconciling the unit catalog.
 *
 * <p>Usage:</p>
 * <pre>
 * try (UnitCatalog catalog = UnitCatalog.builder()
 *         .dataSource(DataSourceConfig.builder().jdbcUrl("jdbc:postgresql://localhost/units").build())
 *         .build()) {
 *     IngestionReport ingest = catalog.ingest(Path.of("unitfiles.zip"));
 *     catalog.fetch(Path.of("data/catalog"));
 *     MergeReport merge = catalog.merge(Path.of("data/catalog"), ManualOverrides.load(Path.of("overrides.json")));
 * }
 * </pre>
 */
public class UnitCatalog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UnitCatalog.class);

    private final CatalogStore store;
    private final IngestionOptions ingestionOptions;
    private final FetchConfig fetchConfig;
    private final MergeOptions mergeOptions;
    private final MetricsService metricsService;
    private final ReferenceCatalog referenceCatalog;
    private final Clock clock;

    private UnitCatalog(Builder builder) {
        this.store = builder.store;
        this.ingestionOptions = builder.ingestionOptions;
        this.fetchConfig = builder.fetchConfig;
        this.mergeOptions = builder.mergeOptions;
        this.metricsService = builder.metricsService;
        this.referenceCatalog = builder.referenceCatalog;
        this.clock = builder.clock;
    }

    /**
     * Ingests every unit file of a zip archive. Each call uses a fresh equipment identity cache.
     */
    public IngestionReport ingest(Path archive, ProgressCallback callback) {
        return newPipeline().run(archive, callback);
    }

    public IngestionReport ingest(Path archive) {
        return ingest(archive, ProgressCallback.NOOP);
    }

    public IngestionPipeline newPipeline() {
        return new IngestionPipeline(store, ingestionOptions, metricsService, referenceCatalog);
    }

    /**
     * Copies the external catalog into {@code rawDirectory}, resuming where a previous run stopped.
     */
    public FetchReport fetch(Path rawDirectory, boolean includeDetails, ProgressCallback callback) {
        CatalogFetchClient client = new CatalogFetchClient(fetchConfig, metricsService);
        return new CatalogFetcher(client, new RawResponseStore(rawDirectory), fetchConfig)
                .run(includeDetails, callback);
    }

    public FetchReport fetch(Path rawDirectory) {
        return fetch(rawDirectory, true, ProgressCallback.NOOP);
    }

    /**
     * Matches the stored external listings against the catalog and merges what matched.
     */
    public MergeReport merge(Path rawDirectory, ManualOverrides overrides) {
        CrossSourceMatcher matcher = new CrossSourceMatcher(Strategies.standard(overrides), overrides, metricsService);
        return new CatalogMerger(store, matcher, mergeOptions, metricsService, clock)
                .run(new RawResponseStore(rawDirectory));
    }

    public SeedResult seedEquipmentStats(Path statsFile, boolean force) {
        return new EquipmentStatsSeeder(store).seed(statsFile, force);
    }

    public AmmoLinker.Result linkAmmo() {
        return new AmmoLinker(store).link();
    }

    public CatalogStore getStore() {
        return store;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    @Override
    public void close() {
        log.info("catalog.closing");
        store.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogStore store;
        private DataSourceConfig dataSourceConfig;
        private IngestionOptions ingestionOptions = IngestionOptions.defaults();
        private FetchConfig fetchConfig = FetchConfig.defaults();
        private MergeOptions mergeOptions = MergeOptions.defaults();
        private MetricsService metricsService;
        private ReferenceCatalog referenceCatalog;
        private Clock clock = Clock.systemUTC();

        /**
         * Uses an existing store. The catalog closes it on {@link UnitCatalog#close()}.
         */
        public Builder store(CatalogStore store) {
            this.store = store;
            return this;
        }

        /**
         * Opens a pooled PostgreSQL store from {@code config}.
         */
        public Builder dataSource(DataSourceConfig config) {
            this.dataSourceConfig = config;
            return this;
        }

        public Builder ingestionOptions(IngestionOptions ingestionOptions) {
            this.ingestionOptions = ingestionOptions;
            return this;
        }

        public Builder fetchConfig(FetchConfig fetchConfig) {
            this.fetchConfig = fetchConfig;
            return this;
        }

        public Builder mergeOptions(MergeOptions mergeOptions) {
            this.mergeOptions = mergeOptions;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder referenceCatalog(ReferenceCatalog referenceCatalog) {
            this.referenceCatalog = referenceCatalog;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public UnitCatalog build() {
            if (store == null && dataSourceConfig == null) {
                throw new IllegalStateException("Either store or dataSource must be provided");
            }
            if (store != null && dataSourceConfig != null) {
                throw new IllegalStateException("Provide either store or dataSource, not both");
            }
            if (metricsService == null) {
                metricsService = new NoOpMetricsService();
            }
            if (referenceCatalog == null) {
                referenceCatalog = ReferenceCatalog.standard();
            }
            if (store == null) {
                store = openJdbcStore(dataSourceConfig);
            }
            return new UnitCatalog(this);
        }

        private static CatalogStore openJdbcStore(DataSourceConfig config) {
            HikariDataSource dataSource;
            try {
                dataSource = config.createDataSource();
            } catch (RuntimeException e) {
                throw new IngestionSetupException("Catalog database is unreachable: " + e.getMessage(), e);
            }
            try {
                if (config.isApplySchema()) {
                    int statements = new SchemaInitializer(dataSource).apply();
                    log.info("catalog.schema.applied statements={}", statements);
                }
            } catch (CatalogStoreException e) {
                dataSource.close();
                throw new IngestionSetupException("Cannot apply catalog schema: " + e.getMessage(), e);
            }
            log.info("catalog.opened config={}", config);
            return new JdbcCatalogStore(dataSource);
        }
    }
}
