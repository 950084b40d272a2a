package com.keystone.registry;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Settings for registry discovery and listing.
 *
 * <h2>Properties</h2>
 *
 * <pre>{@code
 * keystone.registry.discovery-base-paths=,service-registry/,api/service-registry/
 * keystone.registry.request-timeout=PT10S
 * keystone.registry.accept=application/json
 * }</pre>
 *
 * @param discoveryBasePaths paths probed, in order, under {@code https://<host>/} when only a
 *                           hostname is given; the empty path is the host root
 * @param requestTimeout     connect and read timeout of each request
 * @param accept             value of the {@code Accept} header sent with listing requests
 */
public record RegistryClientConfig(List<String> discoveryBasePaths, Duration requestTimeout, String accept) {

    public static final String PREFIX = "keystone.registry.";

    public static final List<String> DEFAULT_DISCOVERY_BASE_PATHS =
            List.of("", "service-registry/", "api/service-registry/");

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public static final String DEFAULT_ACCEPT = "application/json";

    public RegistryClientConfig {
        if (discoveryBasePaths == null || discoveryBasePaths.isEmpty()) {
            throw new IllegalArgumentException("discoveryBasePaths must not be null or empty");
        }
        for (String path : discoveryBasePaths) {
            if (path == null || path.startsWith("/") || (!path.isEmpty() && !path.endsWith("/"))) {
                throw new IllegalArgumentException(
                        "discovery base path must be relative and end with '/': " + path);
            }
        }
        discoveryBasePaths = List.copyOf(discoveryBasePaths);
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (accept == null || accept.isBlank()) {
            throw new IllegalArgumentException("accept must not be null or blank");
        }
    }

    public static RegistryClientConfig defaults() {
        return new RegistryClientConfig(DEFAULT_DISCOVERY_BASE_PATHS, DEFAULT_REQUEST_TIMEOUT, DEFAULT_ACCEPT);
    }

    /**
     * Binds the {@code keystone.registry.*} keys of the given properties. Missing keys keep their
     * default value; other keys are ignored.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static RegistryClientConfig fromProperties(Map<String, String> properties) {
        List<String> basePaths = DEFAULT_DISCOVERY_BASE_PATHS;
        String rawPaths = properties.get(PREFIX + "discovery-base-paths");
        if (rawPaths != null) {
            basePaths = new ArrayList<>();
            for (String path : Arrays.asList(rawPaths.split(",", -1))) {
                basePaths.add(path.trim());
            }
        }

        Duration timeout = DEFAULT_REQUEST_TIMEOUT;
        String rawTimeout = properties.get(PREFIX + "request-timeout");
        if (rawTimeout != null) {
            try {
                timeout = Duration.parse(rawTimeout.trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid " + PREFIX + "request-timeout: " + rawTimeout, e);
            }
        }

        String accept = properties.getOrDefault(PREFIX + "accept", DEFAULT_ACCEPT);
        return new RegistryClientConfig(basePaths, timeout, accept);
    }
}
