package com.unit.catalog.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Summary written next to the raw responses after each fetch run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchManifest(
        @JsonProperty("fetched_at") String fetchedAt,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("types") List<Integer> types,
        @JsonProperty("quicklist_counts") Map<String, Integer> quickListCounts,
        @JsonProperty("detail_pages_fetched") int detailPagesFetched,
        @JsonProperty("detail_pages_skipped") int detailPagesSkipped,
        @JsonProperty("total_external_ids") int totalExternalIds
) {}
