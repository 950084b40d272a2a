package com.keystone.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unrecoverable state with structured diagnostic details.
 * <p>
 * {@link #getMessage()} appends the non-null details as JSON with sorted keys, e.g.
 * {@code Unable to refresh the access token ({"reason":"...","response":{"status":500}})}.
 */
public class InvalidStateException extends RuntimeException {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final String summary;
    private final Map<String, Object> details;

    public InvalidStateException(String summary, Map<String, ?> details) {
        super(summary);
        this.summary = summary;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String summary() {
        return summary;
    }

    public Map<String, Object> details() {
        return details;
    }

    @Override
    public String getMessage() {
        Map<String, Object> nonNull = new LinkedHashMap<>();
        details.forEach((key, value) -> {
            if (value != null) {
                nonNull.put(key, value);
            }
        });
        if (nonNull.isEmpty()) {
            return summary;
        }
        try {
            return summary + " (" + MAPPER.writeValueAsString(nonNull) + ")";
        } catch (JsonProcessingException e) {
            return summary;
        }
    }
}
