package com.keystone.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token material of one established session.
 *
 * @param modelVersion    layout version of the stored record
 * @param configHash      fingerprint of the authentication config the session was issued for
 * @param accessToken     access token
 * @param refreshToken    refresh token (nullable)
 * @param scope           space-separated granted scopes (nullable)
 * @param tokenType       token type, usually "Bearer"
 * @param issuedAt        issue time, epoch seconds (UTC)
 * @param validUntil      expiry time, epoch seconds (UTC)
 * @param handlerAuthInfo authentication config used to obtain the session, needed for refresh
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionInfo(
        @JsonProperty("model_version") int modelVersion,
        @JsonProperty("config_hash") String configHash,
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("scope") String scope,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("issued_at") long issuedAt,
        @JsonProperty("valid_until") long validUntil,
        @JsonProperty("handler_auth_info") Map<String, Object> handlerAuthInfo) {

    /** Layout version written by this library. */
    public static final int CURRENT_MODEL_VERSION = 4;

    /** Oldest layout that carries enough information for a token refresh. */
    public static final int MIN_REFRESHABLE_MODEL_VERSION = 3;

    public SessionInfo {
        if (tokenType == null || tokenType.isBlank()) {
            throw new IllegalArgumentException("tokenType must not be null or blank");
        }
        handlerAuthInfo = handlerAuthInfo == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(handlerAuthInfo));
    }

    /** Returns true while {@code now} is not past {@link #validUntil()}. */
    public boolean isValid(Instant now) {
        return now.getEpochSecond() <= validUntil;
    }

    /** Returns true when the refresh token is present and not blank. */
    @JsonIgnore
    public boolean hasUsableRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /** Returns a copy carrying the given refresh token. */
    public SessionInfo withRefreshToken(String newRefreshToken) {
        return new SessionInfo(modelVersion, configHash, accessToken, newRefreshToken, scope, tokenType,
                issuedAt, validUntil, handlerAuthInfo);
    }

    @Override
    public String toString() {
        return "SessionInfo{modelVersion=" + modelVersion
                + ", configHash=" + configHash
                + ", scope=" + scope
                + ", tokenType=" + tokenType
                + ", issuedAt=" + issuedAt
                + ", validUntil=" + validUntil
                + ", refreshToken=" + (hasUsableRefreshToken() ? "[REDACTED]" : "none")
                + "}";
    }
}
