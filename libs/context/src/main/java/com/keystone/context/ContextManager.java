package com.keystone.context;

import com.keystone.auth.AuthenticatorFactory;
import com.keystone.auth.SessionManager;
import com.keystone.endpoint.Context;
import com.keystone.endpoint.ContextMetadata;
import com.keystone.endpoint.Endpoint;
import com.keystone.endpoint.EndpointRepository;
import com.keystone.events.Event;
import com.keystone.events.EventBus;
import com.keystone.observability.EventMetrics;
import com.keystone.observability.SpanHelper;
import com.keystone.registry.ClientKind;
import com.keystone.registry.RegistryClientConfig;
import com.keystone.registry.RegistryDiscovery;
import com.keystone.registry.RegistrySynchronizer;
import com.keystone.registry.http.HttpFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point that switches between contexts and keeps them in sync with their registries.
 *
 * <p>{@link #use} resolves a registry from a hostname or URL, synchronizes every registry of the
 * context, makes it the current context and, unless told otherwise, authenticates every session
 * of its endpoints. Registry sync notifications are re-dispatched as {@code context-sync} and the
 * session events of each context are relayed to this manager's bus, so a caller subscribes once.
 */
public class ContextManager {

    private static final Logger log = LoggerFactory.getLogger(ContextManager.class);

    public static final String CONTEXT_SYNC = "context-sync";
    public static final String AUTH_DISABLED = "auth-disabled";

    /** Session events relayed from the per-context {@link SessionManager}. */
    public static final List<String> RELAYED_SESSION_EVENT_TYPES = List.of(
            SessionManager.AUTH_BEGIN, SessionManager.AUTH_END,
            SessionManager.NO_REFRESH_TOKEN, SessionManager.REFRESH_SKIPPED,
            SessionManager.REVOKE_BEGIN, SessionManager.REVOKE_END,
            SessionManager.USER_VERIFICATION_REQUIRED,
            SessionManager.USER_VERIFICATION_OK, SessionManager.USER_VERIFICATION_FAILED);

    public static final List<String> EVENT_TYPES;

    static {
        List<String> types = new ArrayList<>();
        types.add(CONTEXT_SYNC);
        types.add(AUTH_DISABLED);
        types.addAll(RELAYED_SESSION_EVENT_TYPES);
        EVENT_TYPES = List.copyOf(types);
    }

    private final ContextStore store;
    private final HttpFetcher fetcher;
    private final RegistryClientConfig registryConfig;
    private final AuthenticatorFactory authenticatorFactory;
    private final SpanHelper spans;
    private final RegistryDiscovery discovery;
    private final EventBus events = new EventBus("ContextManager", EVENT_TYPES);
    private final Map<String, SessionManager> sessionManagers = new HashMap<>();

    public ContextManager(ContextStore store,
                          HttpFetcher fetcher,
                          RegistryClientConfig registryConfig,
                          AuthenticatorFactory authenticatorFactory,
                          SpanHelper spans) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (authenticatorFactory == null) {
            throw new IllegalArgumentException("authenticatorFactory must not be null");
        }
        this.store = store;
        this.fetcher = fetcher;
        this.registryConfig = registryConfig == null ? RegistryClientConfig.defaults() : registryConfig;
        this.authenticatorFactory = authenticatorFactory;
        this.spans = spans == null ? SpanHelper.noop() : spans;
        this.discovery = new RegistryDiscovery(fetcher, this.registryConfig);
    }

    public EventBus events() {
        return events;
    }

    /**
     * Counts {@code auth-end} and {@code revoke-end} by result and {@code context-sync} by action.
     */
    public void bindMetrics(EventMetrics metrics) {
        metrics.countEvents(events, SessionManager.AUTH_END, "keystone.auth.sessions", "result");
        metrics.countEvents(events, SessionManager.REVOKE_END, "keystone.auth.revocations", "result");
        metrics.countEvents(events, CONTEXT_SYNC, "keystone.registry.sync", RegistrySynchronizer.DETAIL_ACTION);
    }

    /**
     * Creates an empty context.
     *
     * @throws ContextAlreadyExistsException if the name is taken
     */
    public void add(String contextName) {
        if (store.contains(contextName)) {
            throw new ContextAlreadyExistsException(contextName);
        }
        store.save(contextName, new Context());
    }

    /**
     * @throws ContextNotFoundException if no context has the name
     */
    public void remove(String contextName) {
        Optional<Context> context = store.load(contextName);
        store.unset(contextName);
        context.map(c -> sessionManagers.remove(c.guid())).ifPresent(SessionManager::dispose);
    }

    public void rename(String oldName, String newName) {
        store.rename(oldName, newName);
    }

    public List<ContextMetadata> list() {
        return store.list();
    }

    public Optional<Context> currentContext() {
        return store.currentContext();
    }

    /**
     * Switches to the context of a registry, creating it on first use.
     *
     * @param registryHostnameOrUrl a hostname to probe, or the root URL of a registry
     * @param contextName           context name; the registry hostname when null
     * @param noAuth                skip authentication and dispatch {@code auth-disabled} instead
     * @return the endpoints of the context
     * @throws com.keystone.registry.InvalidServiceRegistryException if no registry is found for a new context
     */
    public EndpointRepository use(String registryHostnameOrUrl, String contextName, boolean noAuth) {
        if (registryHostnameOrUrl == null || registryHostnameOrUrl.isBlank()) {
            throw new IllegalArgumentException("registryHostnameOrUrl must not be null or blank");
        }
        String name = contextName != null ? contextName : RegistryDiscovery.hostnameOf(registryHostnameOrUrl);
        if (name.isBlank()) {
            throw new IllegalArgumentException("The name of the context cannot be blank");
        }
        log.debug("C/{}: begin the sync procedure (given: {})", name, registryHostnameOrUrl);

        Context context = store.load(name).orElse(null);
        if (context == null) {
            String registryUrl = discovery.discover(registryHostnameOrUrl);
            context = new Context();
            context.endpoints().add(Endpoint.of(name, registryUrl, ClientKind.SERVICE_REGISTRY_V1_0));
            store.save(name, context);
            log.info("C/{}: created with the registry {}", name, registryUrl);
        }

        synchronize(name, context);

        store.setCurrentContextName(name);
        store.save(name, context);

        if (noAuth) {
            log.debug("C/{}: authentication disabled", name);
            events.dispatch(AUTH_DISABLED, Event.empty());
        } else {
            sessionManagerFor(context).initiateAuthentications(null, false, false);
        }
        return new EndpointRepository(context.endpoints());
    }

    /**
     * Returns the session manager of a context, creating it on first call. Its events are relayed
     * to this manager's bus.
     *
     * @throws ContextNotFoundException if no context has the name
     */
    public SessionManager sessions(String contextName) {
        Context context = store.load(contextName).orElseThrow(() -> new ContextNotFoundException(contextName));
        return sessionManagerFor(context);
    }

    private void synchronize(String name, Context context) {
        RegistrySynchronizer synchronizer = new RegistrySynchronizer(context, fetcher, registryConfig);
        synchronizer.events().on(RegistrySynchronizer.EVENT_ENDPOINT_SYNC, this::onEndpointSync);

        List<Endpoint> registries = synchronizer.registryEndpoints();
        synchronizer.setInIsolation(registries.size() <= 1);
        if (registries.isEmpty()) {
            log.warn("C/{}: no service registries are registered", name);
        }
        log.debug("C/{}: {} endpoint(s), {} active registr{}", name, context.endpoints().size(),
                registries.size(), registries.size() == 1 ? "y" : "ies");

        for (Endpoint registry : registries) {
            log.debug("C/{}: syncing {}", name, registry.url());
            synchronizer.synchronizeEndpoints(registry.id());
        }
    }

    private void onEndpointSync(Event event) {
        events.dispatch(CONTEXT_SYNC, event);
    }

    private SessionManager sessionManagerFor(Context context) {
        return sessionManagers.computeIfAbsent(context.guid(), guid -> {
            SessionManager manager = new SessionManager(() -> endpointsOf(guid), authenticatorFactory, spans);
            for (String type : RELAYED_SESSION_EVENT_TYPES) {
                manager.events().relay(events, type);
            }
            return manager;
        });
    }

    /** Reads the endpoints of the stored context with the given guid, whatever its current name. */
    private List<Endpoint> endpointsOf(String guid) {
        for (ContextMetadata metadata : store.list()) {
            Optional<Context> context = store.load(metadata.name());
            if (context.isPresent() && context.get().guid().equals(guid)) {
                return context.get().endpoints();
            }
        }
        return List.of();
    }
}
