package com.keystone.registry;

import com.keystone.endpoint.Context;
import com.keystone.endpoint.Endpoint;
import com.keystone.endpoint.EndpointSource;
import com.keystone.endpoint.EndpointValidator;
import com.keystone.endpoint.ValidationResult;
import com.keystone.events.EventBus;
import com.keystone.registry.http.HttpFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Imports the services of GA4GH service registries into a context and keeps them in sync.
 *
 * <p>Synchronization is scoped to one registry. Every listed service is classified against the
 * endpoints this registry imported earlier:
 * <ul>
 *   <li>{@code add}: no endpoint with its id exists yet</li>
 *   <li>{@code update}: this registry owns an endpoint with its id and the content changed</li>
 *   <li>{@code keep}: this registry owns an endpoint with its id and nothing changed</li>
 *   <li>{@code remove}: an endpoint owned by this registry is no longer listed</li>
 * </ul>
 * Manual endpoints and endpoints of other registries are never touched; a listed service whose id
 * is taken by one of them is skipped, and so is a service that fails {@link EndpointValidator}
 * (an earlier import of it is kept). One {@code endpoint-sync} event is dispatched per classified
 * endpoint, listed services first in listing order, then removals. The endpoint list of the
 * context is then replaced in one step.
 *
 * <p>Outside isolation mode imported ids are {@code <registryId>:<serviceId>}, which keeps the
 * imports of several registries apart. In isolation mode they are the bare service ids.
 */
public class RegistrySynchronizer {

    private static final Logger log = LoggerFactory.getLogger(RegistrySynchronizer.class);

    public static final String EVENT_ENDPOINT_SYNC = "endpoint-sync";

    public static final String DETAIL_ACTION = "action";
    public static final String DETAIL_ENDPOINT = "endpoint";
    public static final String DETAIL_REGISTRY_ID = "registry_id";

    private final Context context;
    private final HttpFetcher fetcher;
    private final RegistryClientConfig config;
    private final EventBus events;
    private boolean inIsolation;

    public RegistrySynchronizer(Context context, HttpFetcher fetcher, RegistryClientConfig config) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        this.context = context;
        this.fetcher = fetcher;
        this.config = config;
        this.events = new EventBus(getClass().getSimpleName(), List.of(EVENT_ENDPOINT_SYNC));
    }

    public EventBus events() {
        return events;
    }

    public void setInIsolation(boolean inIsolation) {
        this.inIsolation = inIsolation;
    }

    public boolean isInIsolation() {
        return inIsolation;
    }

    /** Registry endpoints of the context, in catalog order. */
    public List<Endpoint> registryEndpoints() {
        return context.endpoints().stream()
                .filter(e -> ClientKind.SERVICE_REGISTRY_V1_0.equals(e.type()))
                .collect(Collectors.toList());
    }

    /**
     * Adds a registry endpoint and runs its first synchronization.
     *
     * @return the operations applied, starting with the addition of the registry itself
     * @throws EndpointAlreadyExistsException  if the id is taken or the URL is already registered
     * @throws InvalidServiceRegistryException if the URL does not serve a service listing
     */
    public List<SyncOperation> addRegistryAndImportEndpoints(String registryId, String registryUrl) {
        if (context.findEndpoint(registryId).isPresent()) {
            throw new EndpointAlreadyExistsException("id = " + registryId, List.of(registryId));
        }
        List<String> sameUrl = registryEndpoints().stream()
                .filter(e -> e.url().equals(registryUrl))
                .map(Endpoint::id)
                .collect(Collectors.toList());
        if (!sameUrl.isEmpty()) {
            throw new EndpointAlreadyExistsException("This URL (" + registryUrl + ") has already been registered "
                    + "locally with the following ID(s): " + String.join(", ", sameUrl), sameUrl);
        }

        Endpoint registry = Endpoint.of(registryId, registryUrl, ClientKind.SERVICE_REGISTRY_V1_0);
        try {
            for (RegistryService service : clientFor(registry).listServices()) {
                log.debug("Detected service: {}", service.id());
            }
        } catch (ServiceListingException e) {
            throw new InvalidServiceRegistryException(registryUrl,
                    "Unable to use " + registryUrl + " as a service registry: " + e.getMessage(), e);
        }

        context.endpoints().add(registry);
        SyncOperation added = new SyncOperation(SyncAction.ADD, registry);
        dispatch(registryId, added);

        List<SyncOperation> operations = new ArrayList<>();
        operations.add(added);
        operations.addAll(synchronizeWith(registry));
        return operations;
    }

    /**
     * Re-imports the listing of a registry already in the context.
     *
     * @throws RegistryNotFoundException if no registry endpoint has the id
     * @throws ServiceListingException   if the listing cannot be fetched
     */
    public List<SyncOperation> synchronizeEndpoints(String registryId) {
        Endpoint registry = registryEndpoints().stream()
                .filter(e -> e.id().equals(registryId))
                .findFirst()
                .orElseThrow(() -> new RegistryNotFoundException(registryId));
        return synchronizeWith(registry);
    }

    /**
     * Removes a registry endpoint together with every endpoint it imported.
     *
     * @return the removed endpoints
     */
    public List<Endpoint> removeEndpointsAssociatedTo(String registryId) {
        List<Endpoint> retained = new ArrayList<>();
        List<Endpoint> removed = new ArrayList<>();
        for (Endpoint endpoint : context.endpoints()) {
            if (endpoint.id().equals(registryId) || endpoint.isOwnedBy(registryId)) {
                removed.add(endpoint);
                dispatch(registryId, new SyncOperation(SyncAction.REMOVE, endpoint));
            } else {
                retained.add(endpoint);
            }
        }
        context.replaceEndpoints(retained);
        updateDefaults();
        log.info("R/{}: removed {} endpoint(s)", registryId, removed.size());
        return removed;
    }

    public List<Endpoint> listEndpointsAssociatedTo(String registryId) {
        return context.endpoints().stream()
                .filter(e -> e.isOwnedBy(registryId))
                .collect(Collectors.toList());
    }

    /**
     * Classifies a listing against the current catalog without changing anything.
     */
    public List<SyncOperation> plan(Endpoint registry, List<RegistryService> listing) {
        Map<String, Endpoint> local = new LinkedHashMap<>();
        for (Endpoint endpoint : context.endpoints()) {
            local.put(endpoint.id(), endpoint);
        }

        List<SyncOperation> operations = new ArrayList<>();
        Set<String> listed = new HashSet<>();
        for (RegistryService service : AuthInfoMerger.merge(listing)) {
            String id = inIsolation ? service.id() : registry.id() + ":" + service.id();
            if (!listed.add(id)) {
                log.warn("R/{}: S/{}: skipped as the id {} is listed more than once", registry.id(), service.id(), id);
                continue;
            }
            Endpoint candidate = ServiceInfoParser.toEndpoint(service, id)
                    .withSource(new EndpointSource(registry.id(), service.id()));
            Endpoint existing = local.get(id);
            ValidationResult validation = EndpointValidator.validate(candidate);
            if (!validation.valid()) {
                log.warn("R/{}: S/{}: skipped as invalid: {}", registry.id(), service.id(), validation.errors());
                if (existing != null && existing.isOwnedBy(registry.id())) {
                    operations.add(new SyncOperation(SyncAction.KEEP, existing));
                }
                continue;
            }
            if (existing == null) {
                operations.add(new SyncOperation(SyncAction.ADD, candidate));
            } else if (!existing.isOwnedBy(registry.id())) {
                log.warn("R/{}: S/{}: skipped as the id {} belongs to {}", registry.id(), service.id(), id,
                        existing.isManual() ? "a manually added endpoint" : "registry " + existing.source().sourceId());
            } else if (existing.equals(candidate)) {
                operations.add(new SyncOperation(SyncAction.KEEP, existing));
            } else {
                operations.add(new SyncOperation(SyncAction.UPDATE, candidate));
            }
        }

        for (Endpoint endpoint : local.values()) {
            if (endpoint.isOwnedBy(registry.id()) && !listed.contains(endpoint.id())) {
                operations.add(new SyncOperation(SyncAction.REMOVE, endpoint));
            }
        }
        return operations;
    }

    private List<SyncOperation> synchronizeWith(Endpoint registry) {
        List<RegistryService> listing = clientFor(registry).listServices();
        List<SyncOperation> operations = plan(registry, listing);

        Map<String, SyncOperation> byId = new LinkedHashMap<>();
        for (SyncOperation operation : operations) {
            byId.put(operation.endpoint().id(), operation);
            dispatch(registry.id(), operation);
        }

        List<Endpoint> rebuilt = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        for (Endpoint endpoint : context.endpoints()) {
            SyncOperation operation = byId.get(endpoint.id());
            if (operation == null) {
                rebuilt.add(endpoint);
            } else if (operation.action().retains()) {
                rebuilt.add(operation.endpoint());
            }
            placed.add(endpoint.id());
        }
        for (SyncOperation operation : operations) {
            if (operation.action() == SyncAction.ADD && placed.add(operation.endpoint().id())) {
                rebuilt.add(operation.endpoint());
            }
        }
        context.replaceEndpoints(rebuilt);
        updateDefaults();

        if (log.isInfoEnabled()) {
            Map<SyncAction, Long> counts = operations.stream()
                    .collect(Collectors.groupingBy(SyncOperation::action, LinkedHashMap::new, Collectors.counting()));
            log.info("R/{}: synchronized {} service(s): {}", registry.id(), listing.size(), counts);
        }
        return operations;
    }

    /**
     * Drops a default whose endpoint is gone and sets one for each client kind that has exactly
     * one endpoint.
     */
    private void updateDefaults() {
        Map<String, String> defaults = context.defaults();
        for (ClientKind kind : ClientKind.DATA_SERVICES) {
            List<String> similar = context.endpoints().stream()
                    .filter(e -> kind.supports(e.type()))
                    .map(Endpoint::id)
                    .collect(Collectors.toList());

            String current = defaults.get(kind.shortType());
            if (current != null && !similar.contains(current)) {
                defaults.remove(kind.shortType());
                log.debug("The default \"{}\" endpoint ({}) is no longer available and has been unset",
                        kind.shortType(), current);
            }
            if (!defaults.containsKey(kind.shortType())) {
                if (similar.size() == 1) {
                    defaults.put(kind.shortType(), similar.get(0));
                } else if (!similar.isEmpty()) {
                    log.info("The default \"{}\" endpoint is not set as there are {} candidates: {}",
                            kind.shortType(), similar.size(), String.join(", ", similar));
                }
            }
        }
    }

    private ServiceRegistryClient clientFor(Endpoint registry) {
        return new ServiceRegistryClient(registry.url(), fetcher, config);
    }

    private void dispatch(String registryId, SyncOperation operation) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(DETAIL_ACTION, operation.action().wireValue());
        details.put(DETAIL_ENDPOINT, operation.endpoint());
        details.put(DETAIL_REGISTRY_ID, registryId);
        events.dispatch(EVENT_ENDPOINT_SYNC, details);
    }
}
