package com.keystone.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.endpoint.ServiceType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of a GA4GH service registry listing ({@code GET <base>/services}).
 *
 * <p>{@code authentication} is a vendor extension: a list of camelCase auth entries, the first
 * being the primary one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryService(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") ServiceType type,
        @JsonProperty("url") String url,
        @JsonProperty("description") String description,
        @JsonProperty("organization") Organization organization,
        @JsonProperty("contactUrl") String contactUrl,
        @JsonProperty("documentationUrl") String documentationUrl,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("environment") String environment,
        @JsonProperty("version") String version,
        @JsonProperty("authentication") List<Map<String, Object>> authentication) {

    public RegistryService {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        if (authentication != null) {
            List<Map<String, Object>> copies = new ArrayList<>(authentication.size());
            for (Map<String, Object> entry : authentication) {
                copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(entry)));
            }
            authentication = Collections.unmodifiableList(copies);
        }
    }

    /** Minimal service, used where only the identity and location matter. */
    public static RegistryService of(String id, ServiceType type, String url) {
        return new RegistryService(id, null, type, url, null, null, null, null, null, null, null, null, null);
    }

    public RegistryService withAuthentication(List<Map<String, Object>> replacement) {
        return new RegistryService(id, name, type, url, description, organization, contactUrl,
                documentationUrl, createdAt, updatedAt, environment, version, replacement);
    }

    /**
     * Publishing organization.
     *
     * @param name organization name
     * @param url  organization home page
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Organization(@JsonProperty("name") String name, @JsonProperty("url") String url) {}
}
