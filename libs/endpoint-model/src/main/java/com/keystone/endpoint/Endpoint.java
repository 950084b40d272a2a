package com.keystone.endpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A remote service endpoint in a context's catalog.
 *
 * <p>Identity is the {@code id}, unique within one context. An endpoint without {@link #source()}
 * was added manually and is never removed by registry synchronization.
 *
 * @param id                      local unique id
 * @param url                     base URL
 * @param type                    GA4GH service type (nullable for manually added endpoints)
 * @param authentication          primary authentication config (nullable)
 * @param fallbackAuthentications further authentication configs tried after the primary
 * @param source                  ownership tag (null when added manually)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Endpoint(
        @JsonProperty("id") String id,
        @JsonProperty("url") String url,
        @JsonProperty("type") ServiceType type,
        @JsonProperty("authentication") Map<String, Object> authentication,
        @JsonProperty("fallback_authentications") List<Map<String, Object>> fallbackAuthentications,
        @JsonProperty("source") EndpointSource source) {

    /** Config key holding the authentication scheme. */
    public static final String AUTH_TYPE_KEY = "type";

    /** Scheme assumed when an authentication config does not name one. */
    public static final String DEFAULT_AUTH_TYPE = "oauth2";

    public Endpoint {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        authentication = authentication == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(authentication));
        if (fallbackAuthentications != null) {
            List<Map<String, Object>> copies = new ArrayList<>(fallbackAuthentications.size());
            for (Map<String, Object> fallback : fallbackAuthentications) {
                copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(fallback)));
            }
            fallbackAuthentications = Collections.unmodifiableList(copies);
        }
    }

    /** Creates a manually added endpoint without authentication. */
    public static Endpoint of(String id, String url, ServiceType type) {
        return new Endpoint(id, url, type, null, null, null);
    }

    /**
     * Returns the primary authentication config followed by the fallbacks, each as a new mutable
     * map. A legacy config nested under an {@code oauth2} key is unwrapped and typed
     * {@value #DEFAULT_AUTH_TYPE}.
     */
    @JsonIgnore
    public List<Map<String, Object>> authentications() {
        List<Map<String, Object>> result = new ArrayList<>();
        if (authentication != null) {
            result.add(unwrapLegacy(authentication));
        }
        if (fallbackAuthentications != null) {
            for (Map<String, Object> fallback : fallbackAuthentications) {
                result.add(unwrapLegacy(fallback));
            }
        }
        return result;
    }

    /** Returns true when this endpoint was imported by the given registry. */
    @JsonIgnore
    public boolean isOwnedBy(String registryId) {
        return source != null && Objects.equals(source.sourceId(), registryId);
    }

    @JsonIgnore
    public boolean isManual() {
        return source == null;
    }

    public Endpoint withId(String newId) {
        return new Endpoint(newId, url, type, authentication, fallbackAuthentications, source);
    }

    public Endpoint withSource(EndpointSource newSource) {
        return new Endpoint(id, url, type, authentication, fallbackAuthentications, newSource);
    }

    public Endpoint withAuthentication(Map<String, Object> primary, List<Map<String, Object>> fallbacks) {
        return new Endpoint(id, url, type, primary, fallbacks, source);
    }

    private static Map<String, Object> unwrapLegacy(Map<String, Object> config) {
        Object nested = config.get(DEFAULT_AUTH_TYPE);
        if (nested instanceof Map<?, ?> legacy) {
            Map<String, Object> converted = new LinkedHashMap<>();
            legacy.forEach((key, value) -> converted.put(String.valueOf(key), value));
            converted.put(AUTH_TYPE_KEY, DEFAULT_AUTH_TYPE);
            return converted;
        }
        return new LinkedHashMap<>(config);
    }
}
