package com.keystone.registry;

import com.keystone.endpoint.Endpoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts registry services into endpoints.
 */
public final class ServiceInfoParser {

    /** Registry auth key to endpoint auth config key, in output order. */
    private static final Map<String, String> AUTH_KEYS = new LinkedHashMap<>();

    static {
        AUTH_KEYS.put("authorizationUrl", "authorization_endpoint");
        AUTH_KEYS.put("clientId", "client_id");
        AUTH_KEYS.put("clientSecret", "client_secret");
        AUTH_KEYS.put("deviceCodeUrl", "device_code_endpoint");
        AUTH_KEYS.put("grantType", "grant_type");
        AUTH_KEYS.put("redirectUrl", "redirect_url");
        AUTH_KEYS.put("resource", "resource_url");
        AUTH_KEYS.put("scope", "scope");
        AUTH_KEYS.put("accessTokenUrl", "token_endpoint");
    }

    private ServiceInfoParser() {
        // utility class
    }

    /**
     * Builds an endpoint from a service. The first auth entry becomes the primary authentication,
     * the others the fallbacks. The result carries no ownership tag.
     *
     * @param endpointId local id; the service id when null
     */
    public static Endpoint toEndpoint(RegistryService service, String endpointId) {
        List<Map<String, Object>> configs = new ArrayList<>();
        if (service.authentication() != null) {
            for (Map<String, Object> entry : service.authentication()) {
                configs.add(toAuthConfig(entry));
            }
        }
        Map<String, Object> primary = configs.isEmpty() ? null : configs.get(0);
        List<Map<String, Object>> fallbacks = configs.size() > 1 ? configs.subList(1, configs.size()) : null;
        return new Endpoint(endpointId == null ? service.id() : endpointId,
                service.url(), service.type(), primary, fallbacks, null);
    }

    /**
     * Translates one registry auth entry. The result is always typed {@code oauth2}; keys absent
     * from the entry are left out.
     */
    public static Map<String, Object> toAuthConfig(Map<String, Object> entry) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(Endpoint.AUTH_TYPE_KEY, Endpoint.DEFAULT_AUTH_TYPE);
        AUTH_KEYS.forEach((registryKey, configKey) -> {
            Object value = entry.get(registryKey);
            if (value != null) {
                config.put(configKey, value);
            }
        });
        return config;
    }
}
