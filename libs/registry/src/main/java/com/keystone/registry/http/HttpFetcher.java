package com.keystone.registry.http;

import java.io.IOException;
import java.util.Map;

/**
 * Minimal HTTP GET used by registry discovery and listing.
 */
@FunctionalInterface
public interface HttpFetcher {

    /**
     * Performs a GET request. Non-2xx responses are returned, not thrown.
     *
     * @throws IOException if no response could be obtained (connection refused, timeout, ...)
     */
    HttpResponseData get(String url, Map<String, String> headers) throws IOException;
}
