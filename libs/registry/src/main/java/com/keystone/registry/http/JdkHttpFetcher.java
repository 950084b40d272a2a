package com.keystone.registry.http;

import com.keystone.registry.RegistryClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link HttpFetcher} backed by {@link HttpClient}.
 */
public class JdkHttpFetcher implements HttpFetcher {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpFetcher.class);

    private final HttpClient client;
    private final RegistryClientConfig config;

    public JdkHttpFetcher(RegistryClientConfig config) {
        this.config = config;
        this.client = HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public HttpResponseData get(String url, Map<String, String> headers) throws IOException {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .timeout(config.requestTimeout())
                .GET();
        headers.forEach(request::header);

        log.debug("GET {}", url);
        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while requesting " + url, e);
        }

        Map<String, String> responseHeaders = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            if (!values.isEmpty()) {
                responseHeaders.put(name, values.get(0));
            }
        });
        log.debug("GET {} -> {}", url, response.statusCode());
        return new HttpResponseData(response.statusCode(), responseHeaders, response.body());
    }
}
