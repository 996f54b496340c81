package com.unit.catalog.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A resource that could not be fetched.
 *
 * @param resource  resource key, such as {@code quicklist/18/0-25} or {@code details/1234}
 * @param permanent whether a later run should skip the resource
 * @param status    last HTTP status, -1 when none was received
 * @param reason    failure message
 * @param failedAt  ISO-8601 timestamp of the failure
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchFailure(
        @JsonProperty("resource") String resource,
        @JsonProperty("permanent") boolean permanent,
        @JsonProperty("status") int status,
        @JsonProperty("reason") String reason,
        @JsonProperty("failed_at") String failedAt
) {}
