package com.keystone.endpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks an {@link Endpoint} for the fields every consumer relies on. Returns all errors at once.
 */
public final class EndpointValidator {

    private static final Pattern HTTP_URL = Pattern.compile("^https?://\\S+$");

    private EndpointValidator() {
        // utility class
    }

    public static ValidationResult validate(Endpoint endpoint) {
        var errors = new ArrayList<String>();

        if (!HTTP_URL.matcher(endpoint.url()).matches()) {
            errors.add("url must be an http(s) URL: " + endpoint.url());
        }
        if (endpoint.source() != null && isBlank(endpoint.source().externalId())) {
            errors.add("source.externalId must not be null or blank");
        }

        List<Map<String, Object>> authentications = endpoint.authentications();
        for (int i = 0; i < authentications.size(); i++) {
            Object type = authentications.get(i).get(Endpoint.AUTH_TYPE_KEY);
            if (type != null && !(type instanceof String)) {
                errors.add("authentications[" + i + "].type must be a string");
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
