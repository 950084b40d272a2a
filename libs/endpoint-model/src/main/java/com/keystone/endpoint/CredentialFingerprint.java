package com.keystone.endpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic hash of an authentication config, used as the session deduplication key.
 * <p>
 * The config is normalized first: null-valued entries are dropped and a missing or blank
 * {@code type} becomes {@value Endpoint#DEFAULT_AUTH_TYPE}. The normalized map is written as JSON
 * with keys sorted at every level and hashed with SHA-256. Two configs that differ only in key
 * order, in null entries or in an omitted default type share one fingerprint.
 */
public final class CredentialFingerprint {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CredentialFingerprint() {
        // utility class
    }

    /**
     * Computes the fingerprint of an authentication config.
     *
     * @return lowercase hex SHA-256 digest
     */
    public static String of(Map<String, ?> authConfig) {
        return hash(normalize(authConfig));
    }

    /**
     * Returns a copy without null-valued entries and with the default scheme filled in.
     */
    public static Map<String, Object> normalize(Map<String, ?> authConfig) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (authConfig != null) {
            authConfig.forEach((key, value) -> {
                if (value != null) {
                    normalized.put(key, value);
                }
            });
        }
        Object type = normalized.get(Endpoint.AUTH_TYPE_KEY);
        if (type == null || type.toString().isBlank()) {
            normalized.put(Endpoint.AUTH_TYPE_KEY, Endpoint.DEFAULT_AUTH_TYPE);
        }
        return normalized;
    }

    /**
     * Hashes arbitrary content as sorted-key JSON without normalizing it.
     *
     * @throws FingerprintException if the content cannot be written as JSON
     */
    public static String hash(Object content) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(content);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json));
        } catch (JsonProcessingException e) {
            throw new FingerprintException("Failed to serialize authentication config", e);
        } catch (NoSuchAlgorithmException e) {
            throw new FingerprintException("SHA-256 is not available", e);
        }
    }

    /** Exception thrown when a fingerprint cannot be computed. */
    public static class FingerprintException extends RuntimeException {
        public FingerprintException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Returns the normalized, sorted-key JSON text that {@link #of(Map)} hashes. */
    public static String canonicalJson(Map<String, ?> authConfig) {
        try {
            return new String(MAPPER.writeValueAsBytes(normalize(authConfig)), StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new FingerprintException("Failed to serialize authentication config", e);
        }
    }
}
