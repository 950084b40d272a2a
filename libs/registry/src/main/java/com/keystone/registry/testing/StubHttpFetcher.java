package com.keystone.registry.testing;

import com.keystone.registry.http.HttpFetcher;
import com.keystone.registry.http.HttpResponseData;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link HttpFetcher} answering from canned responses keyed by URL. Unknown URLs get a 404.
 * <p>
 * Lives in {@code src/main/java} so that other modules can use it from their tests.
 */
public final class StubHttpFetcher implements HttpFetcher {

    private static final String JSON = "application/json";

    private final Map<String, HttpResponseData> responses = new HashMap<>();
    private final Map<String, IOException> failures = new HashMap<>();
    private final List<String> requestedUrls = new ArrayList<>();

    /** Serves {@code body} with status 200 and a JSON content type. */
    public StubHttpFetcher respondJson(String url, String body) {
        return respond(url, 200, JSON, body);
    }

    public StubHttpFetcher respond(String url, int status, String contentType, String body) {
        failures.remove(url);
        responses.put(url, new HttpResponseData(status,
                contentType == null ? Map.of() : Map.of("Content-Type", contentType), body));
        return this;
    }

    /** Makes requests to {@code url} fail as if the connection was refused. */
    public StubHttpFetcher refuseConnection(String url) {
        responses.remove(url);
        failures.put(url, new ConnectException("Connection refused: " + url));
        return this;
    }

    @Override
    public HttpResponseData get(String url, Map<String, String> headers) throws IOException {
        requestedUrls.add(url);
        IOException failure = failures.get(url);
        if (failure != null) {
            throw failure;
        }
        HttpResponseData response = responses.get(url);
        return response != null ? response : new HttpResponseData(404, Map.of("Content-Type", "text/plain"), "Not Found");
    }

    /** URLs requested so far, in order. */
    public List<String> requestedUrls() {
        return List.copyOf(requestedUrls);
    }

    public int requestCount(String url) {
        return (int) requestedUrls.stream().filter(url::equals).count();
    }
}
