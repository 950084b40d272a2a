package com.keystone.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.keystone.registry.http.HttpFetcher;
import com.keystone.registry.http.HttpResponseData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the root URL of a service registry from a hostname or URL.
 *
 * <p>A URL starting with {@code http://} or {@code https://} is checked as is. A bare hostname is
 * tried under {@code https://<host>/} with each configured base path, in order; the first base
 * whose {@code services} listing looks like a registry wins.
 */
public class RegistryDiscovery {

    private static final Logger log = LoggerFactory.getLogger(RegistryDiscovery.class);

    private static final Pattern DIRECT_URL = Pattern.compile("^https?://.+", Pattern.CASE_INSENSITIVE);

    private final HttpFetcher fetcher;
    private final RegistryClientConfig config;

    public RegistryDiscovery(HttpFetcher fetcher, RegistryClientConfig config) {
        this.fetcher = fetcher;
        this.config = config;
    }

    public static boolean isDirectUrl(String hostOrUrl) {
        return hostOrUrl != null && DIRECT_URL.matcher(hostOrUrl).matches();
    }

    /**
     * Returns the host part of a hostname or URL, used as the default context name.
     */
    public static String hostnameOf(String hostOrUrl) {
        String rest = hostOrUrl;
        if (isDirectUrl(hostOrUrl)) {
            rest = hostOrUrl.substring(hostOrUrl.indexOf("://") + 3);
        }
        int end = rest.length();
        for (char delimiter : new char[] {'/', '?', '#'}) {
            int index = rest.indexOf(delimiter);
            if (index >= 0 && index < end) {
                end = index;
            }
        }
        return rest.substring(0, end);
    }

    /** Candidate root URLs for the given hostname or URL, in probing order. */
    public List<String> candidates(String hostOrUrl) {
        if (isDirectUrl(hostOrUrl)) {
            return List.of(withTrailingSlash(hostOrUrl));
        }
        String host = hostOrUrl.endsWith("/") ? hostOrUrl.substring(0, hostOrUrl.length() - 1) : hostOrUrl;
        List<String> candidates = new ArrayList<>();
        for (String basePath : config.discoveryBasePaths()) {
            candidates.add("https://" + host + "/" + basePath);
        }
        return candidates;
    }

    /**
     * Resolves the registry root URL (always ending with {@code /}).
     *
     * @throws InvalidServiceRegistryException if no candidate is a registry
     */
    public String discover(String hostOrUrl) {
        if (hostOrUrl == null || hostOrUrl.isBlank()) {
            throw new IllegalArgumentException("hostOrUrl must not be null or blank");
        }
        for (String candidate : candidates(hostOrUrl)) {
            Optional<String> root = checkRootUrl(candidate);
            if (root.isPresent()) {
                log.info("Found a service registry at {}", root.get());
                return root.get();
            }
        }
        if (isDirectUrl(hostOrUrl)) {
            throw new InvalidServiceRegistryException(hostOrUrl,
                    "The given URL (" + hostOrUrl + ") is not the root URL of a service registry.");
        }
        throw new InvalidServiceRegistryException(hostOrUrl,
                "Unable to find a service registry on " + hostOrUrl);
    }

    /**
     * Returns the candidate (with a trailing slash) if its {@code services} listing is a JSON
     * array of entries with an {@code id}, served with a JSON content type.
     */
    public Optional<String> checkRootUrl(String candidate) {
        String root = withTrailingSlash(candidate);
        String url = root + "services";
        HttpResponseData response;
        try {
            response = fetcher.get(url, Map.of("Accept", config.accept()));
        } catch (IOException e) {
            log.debug("{}: connection failed ({}), trying the next candidate", url, e.getMessage());
            return Optional.empty();
        }
        if (!response.isSuccessful()) {
            log.debug("{}: HTTP {}", url, response.status());
            return Optional.empty();
        }
        if (!response.isJson()) {
            log.debug("{}: not JSON ({})", url, response.header("Content-Type"));
            return Optional.empty();
        }
        return looksLikeListing(url, response.body()) ? Optional.of(root) : Optional.empty();
    }

    private static boolean looksLikeListing(String url, String body) {
        JsonNode tree;
        try {
            tree = ServiceRegistryClient.MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("{}: unreadable body ({})", url, e.getOriginalMessage());
            return false;
        }
        if (tree == null || !tree.isArray()) {
            log.debug("{}: body is not a JSON array", url);
            return false;
        }
        for (JsonNode entry : tree) {
            if (!entry.isObject() || !entry.hasNonNull("id")) {
                log.debug("{}: listing entry without id", url);
                return false;
            }
        }
        return true;
    }

    private static String withTrailingSlash(String url) {
        return url.endsWith("/") ? url : url + "/";
    }
}
