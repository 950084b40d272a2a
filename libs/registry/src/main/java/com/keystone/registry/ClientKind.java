package com.keystone.registry;

import com.keystone.endpoint.ServiceType;

import java.util.List;

/**
 * A kind of data service client, keyed by its short type in {@code Context#defaults()}.
 *
 * @param shortType      key used in the context defaults
 * @param supportedTypes service types the client can talk to
 */
public record ClientKind(String shortType, List<ServiceType> supportedTypes) {

    public static final ServiceType SERVICE_REGISTRY_V1_0 = ServiceType.parse("org.ga4gh:service-registry:1.0.0");

    public static final List<ClientKind> DATA_SERVICES = List.of(
            new ClientKind("collections", List.of(
                    ServiceType.parse("com.dnastack:collection-service:1.0.0"),
                    ServiceType.parse("com.dnastack.explorer:collection-service:1.0.0"))),
            new ClientKind("data_connect", List.of(ServiceType.parse("org.ga4gh:data-connect:1.0.0"))),
            new ClientKind("drs", List.of(ServiceType.parse("org.ga4gh:drs:1.1.0"))),
            new ClientKind("ewes-service", List.of(ServiceType.parse("com.dnastack.workbench:ewes-service:1.0.0"))),
            new ClientKind("workflow-service", List.of(ServiceType.parse("com.dnastack.workbench:workflow-service:1.0.0"))));

    public ClientKind {
        if (shortType == null || shortType.isBlank()) {
            throw new IllegalArgumentException("shortType must not be null or blank");
        }
        supportedTypes = List.copyOf(supportedTypes);
    }

    public boolean supports(ServiceType type) {
        return type != null && supportedTypes.contains(type);
    }
}
