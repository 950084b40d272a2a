package com.keystone.observability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts credential material from authentication configs and session data before they are
 * logged or attached to events meant for display.
 * <p>
 * Default sensitive patterns: secret, access/refresh/id tokens, password, authorization, apikey,
 * credential. Nested
 * maps and lists are redacted recursively. Matching is case-insensitive and ignores underscores,
 * so {@code client_secret} and {@code clientSecret} are treated alike.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "secret", "accesstoken", "refreshtoken", "idtoken", "password",
            "authorization", "apikey", "credential"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /** Creates a redactor with the default sensitive field patterns. */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name fragments to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of the map with sensitive values replaced by {@value #REDACTED}. Null values
     * stay null so that absent credentials remain distinguishable. Null input yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value != null && isSensitive(key)) {
                result.put(key, REDACTED);
            } else {
                result.put(key, redactValue(value));
            }
        }
        return result;
    }

    /**
     * Checks whether a field name contains a sensitive pattern.
     *
     * @param fieldName the field name to check
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName.replace("_", "")).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>(map.size());
            map.forEach((key, item) -> nested.put(String.valueOf(key), item));
            return redact(nested);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        return value;
    }
}
