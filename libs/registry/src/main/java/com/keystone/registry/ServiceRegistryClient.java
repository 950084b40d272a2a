package com.keystone.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keystone.registry.http.HttpFetcher;
import com.keystone.registry.http.HttpResponseData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Reads the service listing of one GA4GH service registry.
 */
public class ServiceRegistryClient {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistryClient.class);

    static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<List<RegistryService>> SERVICE_LIST = new TypeReference<>() {};

    private final String baseUrl;
    private final HttpFetcher fetcher;
    private final RegistryClientConfig config;

    /**
     * @param baseUrl registry root URL; a trailing slash is added when missing
     */
    public ServiceRegistryClient(String baseUrl, HttpFetcher fetcher, RegistryClientConfig config) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be null or blank");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.fetcher = fetcher;
        this.config = config;
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String servicesUrl() {
        return baseUrl + "services";
    }

    /**
     * Fetches {@code <base>/services}.
     *
     * @throws ServiceListingException on connection failure, a non-2xx status or an unreadable body
     */
    public List<RegistryService> listServices() {
        String url = servicesUrl();
        HttpResponseData response;
        try {
            response = fetcher.get(url, Map.of("Accept", config.accept()));
        } catch (IOException e) {
            throw new ServiceListingException(url, "Unable to reach " + url + ": " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw new ServiceListingException(url, response.status(),
                    "Unable to list services from " + url + " (HTTP " + response.status() + ")");
        }
        try {
            List<RegistryService> services = MAPPER.readValue(response.body(), SERVICE_LIST);
            log.debug("Listed {} service(s) from {}", services.size(), url);
            return services;
        } catch (JsonProcessingException e) {
            throw new ServiceListingException(url, "Unexpected service listing from " + url + ": "
                    + e.getOriginalMessage(), e);
        }
    }
}
