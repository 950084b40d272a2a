package com.keystone.auth.oauth2;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.endpoint.CredentialFingerprint;

import java.util.Map;

/**
 * OAuth2 authentication config as found on an endpoint. Unknown keys are ignored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuth2Authentication(
        @JsonProperty("authorization_endpoint") String authorizationEndpoint,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("device_code_endpoint") String deviceCodeEndpoint,
        @JsonProperty("grant_type") String grantType,
        @JsonProperty("personal_access_endpoint") String personalAccessEndpoint,
        @JsonProperty("personal_access_email") String personalAccessEmail,
        @JsonProperty("personal_access_token") String personalAccessToken,
        @JsonProperty("redirect_url") String redirectUrl,
        @JsonProperty("resource_url") String resourceUrl,
        @JsonProperty("scope") String scope,
        @JsonProperty("token_endpoint") String tokenEndpoint,
        @JsonProperty("type") String type) {

    public static final String TYPE = "oauth2";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public OAuth2Authentication {
        if (type == null || type.isBlank()) {
            type = TYPE;
        }
    }

    /**
     * Reads a config map.
     *
     * @throws OAuth2MisconfigurationException if a known key holds a value of the wrong shape
     */
    public static OAuth2Authentication fromMap(Map<String, ?> config) {
        try {
            return MAPPER.convertValue(config, OAuth2Authentication.class);
        } catch (IllegalArgumentException e) {
            throw new OAuth2MisconfigurationException("Invalid OAuth2 configuration: " + e.getMessage(), e);
        }
    }

    /** Returns the known keys with non-null values. */
    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, MAP_TYPE);
    }

    /** Fingerprint of {@link #toMap()}; the session id of this config. */
    public String contentHash() {
        return CredentialFingerprint.of(toMap());
    }

    /** Returns true when the named snake_case field is set and not blank. */
    public boolean hasField(String name) {
        Object value = toMap().get(name);
        return value != null && !value.toString().isBlank();
    }
}
