package com.keystone.registry;

import com.keystone.endpoint.CredentialFingerprint;
import com.keystone.endpoint.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges the {@code resource} and {@code scope} of OAuth2 auth entries that are otherwise
 * identical, so that a single login covers every resource of a listing.
 *
 * <p>Entries are grouped by the fingerprint of everything but {@code resource} and {@code scope}.
 * Within a group every entry gets the space-joined, sorted resource URLs and the space-joined,
 * sorted union of scopes. An entry without a scope asks for all scopes; if any resource of the
 * group does, the merged scope is null. Entries that are not OAuth2 or have no {@code resource}
 * are left as they are.
 */
public final class AuthInfoMerger {

    private static final Logger log = LoggerFactory.getLogger(AuthInfoMerger.class);

    static final String RESOURCE = "resource";
    static final String SCOPE = "scope";

    private AuthInfoMerger() {
        // utility class
    }

    public static List<RegistryService> merge(List<RegistryService> services) {
        Map<String, Group> groups = new LinkedHashMap<>();
        List<List<Map<String, Object>>> rewritten = new ArrayList<>();

        for (RegistryService service : services) {
            List<Map<String, Object>> entries = new ArrayList<>();
            if (service.authentication() != null) {
                for (Map<String, Object> original : service.authentication()) {
                    Map<String, Object> entry = new LinkedHashMap<>(original);
                    entries.add(entry);
                    if (!isMergeable(service, entry)) {
                        continue;
                    }
                    groups.computeIfAbsent(groupKey(entry), k -> new Group()).members.add(entry);
                }
            }
            rewritten.add(entries);
        }

        groups.values().forEach(Group::apply);

        List<RegistryService> merged = new ArrayList<>(services.size());
        for (int i = 0; i < services.size(); i++) {
            RegistryService service = services.get(i);
            merged.add(service.authentication() == null ? service : service.withAuthentication(rewritten.get(i)));
        }
        return merged;
    }

    private static boolean isMergeable(RegistryService service, Map<String, Object> entry) {
        Object type = entry.get(Endpoint.AUTH_TYPE_KEY);
        if (type != null && !Endpoint.DEFAULT_AUTH_TYPE.equals(type)) {
            log.warn("S/{}: auth entry skipped from merging as it is not OAuth2", service.id());
            return false;
        }
        if (entry.get(RESOURCE) == null) {
            log.warn("S/{}: auth entry skipped from merging as the resource URL is not specified", service.id());
            return false;
        }
        return true;
    }

    private static String groupKey(Map<String, Object> entry) {
        Map<String, Object> rest = new LinkedHashMap<>(entry);
        rest.remove(RESOURCE);
        rest.remove(SCOPE);
        return CredentialFingerprint.of(rest);
    }

    private static final class Group {

        private final List<Map<String, Object>> members = new ArrayList<>();

        void apply() {
            Set<String> resources = new TreeSet<>();
            Set<String> scopes = new TreeSet<>();
            boolean allScopes = false;
            for (Map<String, Object> member : members) {
                resources.add(String.valueOf(member.get(RESOURCE)));
                Object scope = member.get(SCOPE);
                if (scope == null || String.valueOf(scope).isBlank()) {
                    allScopes = true;
                } else {
                    for (String item : String.valueOf(scope).trim().split("\\s+")) {
                        scopes.add(item);
                    }
                }
            }
            String mergedResource = String.join(" ", resources);
            String mergedScope = allScopes ? null : String.join(" ", scopes);
            for (Map<String, Object> member : members) {
                member.put(RESOURCE, mergedResource);
                member.put(SCOPE, mergedScope);
            }
        }
    }
}
