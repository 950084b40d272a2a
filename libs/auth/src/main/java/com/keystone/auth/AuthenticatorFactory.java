package com.keystone.auth;

import com.keystone.endpoint.CredentialFingerprint;
import com.keystone.endpoint.Endpoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the {@link Authenticator} for one authentication config.
 */
@FunctionalInterface
public interface AuthenticatorFactory {

    /**
     * @throws UnsupportedAuthenticationInformationException if no authenticator handles the scheme
     */
    Authenticator create(Map<String, Object> authInfo);

    /**
     * Collects the distinct authentication configs of the given endpoints, one per fingerprint,
     * sorted by {@code resource_url} (or {@code type} when there is none).
     */
    static List<Map<String, Object>> uniqueAuthInfo(List<Endpoint> endpoints) {
        Map<String, Map<String, Object>> unique = new LinkedHashMap<>();
        for (Endpoint endpoint : endpoints) {
            for (Map<String, Object> authInfo : endpoint.authentications()) {
                unique.put(CredentialFingerprint.of(authInfo), authInfo);
            }
        }
        List<Map<String, Object>> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparing(AuthenticatorFactory::sortKey));
        return sorted;
    }

    private static String sortKey(Map<String, Object> authInfo) {
        Object resourceUrl = authInfo.get("resource_url");
        if (resourceUrl != null && !resourceUrl.toString().isBlank()) {
            return resourceUrl.toString();
        }
        return String.valueOf(CredentialFingerprint.normalize(authInfo).get(Endpoint.AUTH_TYPE_KEY));
    }
}
