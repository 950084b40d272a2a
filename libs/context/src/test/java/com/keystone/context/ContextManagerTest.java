package com.keystone.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.auth.AuthenticatorFactory;
import com.keystone.auth.SessionManager;
import com.keystone.auth.testing.FakeAuthenticator;
import com.keystone.endpoint.Context;
import com.keystone.endpoint.ContextMetadata;
import com.keystone.endpoint.Endpoint;
import com.keystone.endpoint.EndpointRepository;
import com.keystone.events.testing.RecordingEventHandler;
import com.keystone.observability.EventMetrics;
import com.keystone.observability.SpanHelper;
import com.keystone.registry.ClientKind;
import com.keystone.registry.InvalidServiceRegistryException;
import com.keystone.registry.RegistryClientConfig;
import com.keystone.registry.testing.StubHttpFetcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ContextManager")
class ContextManagerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InMemoryContextStore store;
    private StubHttpFetcher fetcher;
    private List<FakeAuthenticator> fakes;
    private ContextManager manager;
    private RecordingEventHandler recorder;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore();
        fetcher = new StubHttpFetcher();
        fakes = new ArrayList<>();
        AuthenticatorFactory factory = authInfo -> {
            FakeAuthenticator fake = new FakeAuthenticator(authInfo);
            fakes.add(fake);
            return fake;
        };
        manager = new ContextManager(store, fetcher, RegistryClientConfig.defaults(), factory, SpanHelper.noop());
        recorder = new RecordingEventHandler().attachToAll(manager.events());
    }

    private static Map<String, Object> service(String id, String artifact, String version, String url, String resource) {
        Map<String, Object> auth = new LinkedHashMap<>();
        auth.put("clientId", "cli");
        auth.put("grantType", "client_credentials");
        auth.put("accessTokenUrl", "https://auth.example/token");
        auth.put("resource", resource);

        Map<String, Object> service = new LinkedHashMap<>();
        service.put("id", id);
        service.put("type", Map.of("group", "org.ga4gh", "artifact", artifact, "version", version));
        service.put("url", url);
        service.put("authentication", List.of(auth));
        return service;
    }

    private void publish(String listingUrl) throws JsonProcessingException {
        fetcher.respondJson(listingUrl, MAPPER.writeValueAsString(List.of(
                service("drs-1", "drs", "1.1.0", "https://drs.example/", "https://drs.example/"),
                service("dc-1", "data-connect", "1.0.0", "https://dc.example/", "https://dc.example/"))));
    }

    private static List<String> ids(EndpointRepository repository) {
        return repository.all().stream().map(Endpoint::id).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("use")
    class Use {

        @Test
        @DisplayName("discovers the registry, imports its services, selects the context and authenticates once per session")
        void firstUse() throws JsonProcessingException {
            publish("https://viral.example/api/service-registry/services");

            EndpointRepository repository = manager.use("viral.example", null, false);

            assertThat(ids(repository)).containsExactly("viral.example", "drs-1", "dc-1");
            assertThat(repository.get("viral.example")).get()
                    .satisfies(e -> {
                        assertThat(e.url()).isEqualTo("https://viral.example/api/service-registry/");
                        assertThat(e.type()).isEqualTo(ClientKind.SERVICE_REGISTRY_V1_0);
                    });
            assertThat(manager.list()).containsExactly(new ContextMetadata("viral.example", true));
            assertThat(recorder.types()).containsExactly(
                    ContextManager.CONTEXT_SYNC, ContextManager.CONTEXT_SYNC,
                    SessionManager.AUTH_BEGIN, SessionManager.AUTH_END);
            assertThat(fakes).singleElement().satisfies(fake -> assertThat(fake.authenticateCalls()).isEqualTo(1));
        }

        @Test
        @DisplayName("dispatches auth-disabled instead of authenticating when asked to")
        void noAuth() throws JsonProcessingException {
            publish("https://viral.example/services");

            manager.use("viral.example", "work", true);

            assertThat(recorder.types()).endsWith(ContextManager.AUTH_DISABLED)
                    .doesNotContain(SessionManager.AUTH_BEGIN);
            assertThat(fakes).isEmpty();
            assertThat(manager.currentContext()).isPresent();
            assertThat(store.currentContextName()).contains("work");
        }

        @Test
        @DisplayName("re-synchronizes an existing context without probing again and does not prompt twice")
        void secondUse() throws JsonProcessingException {
            publish("https://viral.example/services");
            manager.use("viral.example", null, false);
            int requestsBefore = fetcher.requestedUrls().size();
            recorder.reset();

            manager.use("viral.example", null, false);

            assertThat(fetcher.requestedUrls().subList(requestsBefore, fetcher.requestedUrls().size()))
                    .containsExactly("https://viral.example/services");
            assertThat(recorder.ofType(ContextManager.CONTEXT_SYNC))
                    .extracting(e -> e.details().get("action"))
                    .containsExactly("keep", "keep");
            assertThat(recorder.ofType(SessionManager.AUTH_END))
                    .extracting(e -> e.details().get("result"))
                    .containsExactly("unchanged");
            assertThat(fakes).singleElement().satisfies(fake -> assertThat(fake.authenticateCalls()).isEqualTo(1));
        }

        @Test
        @DisplayName("prefixes imported ids when the context has several registries")
        void severalRegistries() throws JsonProcessingException {
            publish("https://viral.example/services");
            publish("https://other.example/services");
            manager.use("viral.example", null, true);
            Context context = store.load("viral.example").orElseThrow();
            context.endpoints().add(Endpoint.of("other", "https://other.example/", ClientKind.SERVICE_REGISTRY_V1_0));

            EndpointRepository repository = manager.use("viral.example", null, true);

            assertThat(ids(repository)).contains("viral.example:drs-1", "other:drs-1", "other:dc-1");
            assertThat(ids(repository)).doesNotContain("drs-1", "dc-1");
        }

        @Test
        @DisplayName("fails for a URL that is not a registry root and creates no context")
        void invalidUrl() {
            assertThatThrownBy(() -> manager.use("https://viral.example/foo", null, false))
                    .isInstanceOf(InvalidServiceRegistryException.class);
            assertThat(manager.list()).isEmpty();
        }

        @Test
        @DisplayName("relays user verification requests from the sessions")
        void relaysVerification() throws JsonProcessingException {
            manager = new ContextManager(store, fetcher, RegistryClientConfig.defaults(),
                    authInfo -> new FakeAuthenticator(authInfo).withVerificationUrl("https://verify.example/device"),
                    SpanHelper.noop());
            recorder = new RecordingEventHandler().attachToAll(manager.events());
            publish("https://viral.example/services");

            manager.use("viral.example", null, false);

            assertThat(recorder.ofType(SessionManager.USER_VERIFICATION_REQUIRED))
                    .singleElement()
                    .satisfies(e -> assertThat(e.details()).containsEntry("url", "https://verify.example/device"));
        }
    }

    @Nested
    @DisplayName("sessions")
    class Sessions {

        @Test
        @DisplayName("revokes through the context's session manager and relays the revoke events")
        void revokeRelayed() throws JsonProcessingException {
            publish("https://viral.example/services");
            manager.use("viral.example", null, false);
            recorder.reset();

            List<String> affected = manager.sessions("viral.example").revoke(List.of("drs-1"), () -> true);

            assertThat(affected).containsExactly("drs-1", "dc-1");
            assertThat(recorder.types()).containsExactly(SessionManager.REVOKE_BEGIN, SessionManager.REVOKE_END);
        }

        @Test
        @DisplayName("fails for an unknown context")
        void unknownContext() {
            assertThatThrownBy(() -> manager.sessions("nowhere")).isInstanceOf(ContextNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("context catalog")
    class Catalog {

        @Test
        @DisplayName("adds, renames and removes contexts")
        void lifecycle() {
            manager.add("a");
            manager.add("b");
            manager.rename("a", "c");
            manager.remove("b");

            assertThat(manager.list()).containsExactly(new ContextMetadata("c", false));
        }

        @Test
        @DisplayName("refuses to add a context twice")
        void duplicateAdd() {
            manager.add("a");

            assertThatThrownBy(() -> manager.add("a")).isInstanceOf(ContextAlreadyExistsException.class);
        }

        @Test
        @DisplayName("refuses to remove an unknown context")
        void unknownRemove() {
            assertThatThrownBy(() -> manager.remove("missing"))
                    .isInstanceOf(ContextNotFoundException.class)
                    .hasMessageContaining("missing");
        }
    }

    @Test
    @DisplayName("counts sync actions and authentication results")
    void metrics() throws JsonProcessingException {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        manager.bindMetrics(new EventMetrics(registry, "test"));
        publish("https://viral.example/services");

        manager.use("viral.example", null, false);

        assertThat(registry.get("keystone.registry.sync").tag("action", "add").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("keystone.auth.sessions").tag("result", "authenticated").counter().count()).isEqualTo(1.0);
    }
}
