package com.keystone.registry.http;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Status, headers and body of an HTTP response. Header lookup ignores case.
 *
 * @param status  HTTP status code
 * @param headers response headers (first value per name)
 * @param body    response body as text (may be empty)
 */
public record HttpResponseData(int status, Map<String, String> headers, String body) {

    public HttpResponseData {
        Map<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            caseInsensitive.putAll(headers);
        }
        headers = Collections.unmodifiableMap(caseInsensitive);
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public String header(String name) {
        return headers.get(name);
    }

    /** Returns true when the media type of {@code Content-Type} is {@code application/json}. */
    public boolean isJson() {
        String contentType = header("Content-Type");
        if (contentType == null) {
            return false;
        }
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return mediaType.equals("application/json");
    }
}
