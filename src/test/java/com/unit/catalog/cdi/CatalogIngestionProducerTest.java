package com.unit.catalog.cdi;

import com.unit.catalog.api.UnitCatalog;
import com.unit.catalog.fetch.FetchConfig;
import com.unit.catalog.ingest.IngestionSetupException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("CatalogIngestionProducer Tests")
class CatalogIngestionProducerTest {

    private static CatalogIngestionProducer producer(String jdbcUrl) {
        CatalogIngestionProducer producer = new CatalogIngestionProducer();
        producer.jdbcUrl = jdbcUrl;
        producer.username = Optional.empty();
        producer.password = Optional.empty();
        producer.maxPoolSize = 2;
        producer.minIdle = 1;
        producer.connectionTimeoutMillis = 250;
        producer.applySchema = true;
        producer.datasetVersion = "test";
        producer.workers = 1;
        producer.maxErrors = 0;
        producer.equipmentCacheSize = 1000;
        producer.checkpointFile = Optional.empty();
        producer.ingestReportFile = Optional.empty();
        producer.fetchBaseUrl = FetchConfig.DEFAULT_BASE_URL;
        producer.courtesyDelayMillis = 1000;
        producer.fetchTimeoutSeconds = 30;
        producer.fetchMaxRetries = 3;
        producer.unitTypes = List.of(18);
        producer.mergeSource = "catalog";
        producer.mergeForce = false;
        producer.importAvailability = true;
        producer.unmatchedFile = Optional.empty();
        producer.mergeReportFile = Optional.empty();
        return producer;
    }

    @Test
    @DisplayName("Should fail setup when the database cannot be reached")
    void unreachableDatabase() {
        CatalogIngestionProducer producer = producer("jdbc:postgresql://127.0.0.1:1/units");
        assertThrows(IngestionSetupException.class, producer::unitCatalog);
    }

    @Test
    @DisplayName("Should reject an unknown merge source before connecting")
    void unknownMergeSource() {
        CatalogIngestionProducer producer = producer("jdbc:postgresql://127.0.0.1:1/units");
        producer.mergeSource = "rumour";
        assertThrows(IllegalArgumentException.class, producer::unitCatalog);
    }

    @Test
    @DisplayName("Should close the catalog on dispose")
    void disposeClosesCatalog() {
        UnitCatalog catalog = mock(UnitCatalog.class);
        producer("jdbc:postgresql://127.0.0.1:1/units").closeCatalog(catalog);
        verify(catalog).close();
    }
}
