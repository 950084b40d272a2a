package com.keystone.auth.oauth2;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Picks the grant flow for an OAuth2 config: the first registered adapter whose required fields
 * are all set. Registration order is the preference order.
 */
public final class OAuth2AdapterFactory {

    private final List<Registration> registrations = new ArrayList<>();

    /**
     * Registered grant flow.
     *
     * @param name           flow name, for logging
     * @param requiredFields snake_case config fields that must be set
     * @param constructor    creates the adapter for a compatible config
     */
    public record Registration(String name, List<String> requiredFields,
                               Function<OAuth2Authentication, OAuth2Adapter> constructor) {

        public Registration {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be null or blank");
            }
            if (constructor == null) {
                throw new IllegalArgumentException("constructor must not be null");
            }
            requiredFields = List.copyOf(requiredFields);
        }

        public boolean isCompatibleWith(OAuth2Authentication authInfo) {
            return requiredFields.stream().allMatch(authInfo::hasField);
        }
    }

    public OAuth2AdapterFactory register(String name, List<String> requiredFields,
                                         Function<OAuth2Authentication, OAuth2Adapter> constructor) {
        registrations.add(new Registration(name, requiredFields, constructor));
        return this;
    }

    public List<Registration> registrations() {
        return List.copyOf(registrations);
    }

    /** Returns a new adapter for the first compatible registration. */
    public Optional<OAuth2Adapter> getFrom(OAuth2Authentication authInfo) {
        return registrations.stream()
                .filter(registration -> registration.isCompatibleWith(authInfo))
                .findFirst()
                .map(registration -> registration.constructor().apply(authInfo));
    }
}
