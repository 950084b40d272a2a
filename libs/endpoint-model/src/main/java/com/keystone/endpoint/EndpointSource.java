package com.keystone.endpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ownership tag of an imported endpoint.
 *
 * @param sourceId   id of the registry endpoint that imported it
 * @param externalId the endpoint's service id inside that registry
 */
public record EndpointSource(
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("external_id") String externalId) {

    public EndpointSource {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be null or blank");
        }
    }
}
