package com.keystone.registry;

import com.keystone.registry.testing.StubHttpFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.keystone.registry.Listings.json;
import static com.keystone.registry.Listings.service;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RegistryDiscovery")
class RegistryDiscoveryTest {

    private static final String LISTING = json(List.of(service("drs-1", "org.ga4gh:drs:1.1.0", "https://drs.example/")));

    private StubHttpFetcher fetcher;
    private RegistryDiscovery discovery;

    @BeforeEach
    void setUp() {
        fetcher = new StubHttpFetcher();
        discovery = new RegistryDiscovery(fetcher, RegistryClientConfig.defaults());
    }

    @Nested
    @DisplayName("with a hostname")
    class Hostname {

        @Test
        @DisplayName("probes the base paths in order and stops at the first registry")
        void probesInOrder() {
            fetcher.respondJson("https://viral.example/api/service-registry/services", LISTING);
            fetcher.respondJson("https://viral.example/service-registry/services", LISTING);

            assertThat(discovery.discover("viral.example")).isEqualTo("https://viral.example/service-registry/");
            assertThat(fetcher.requestedUrls()).containsExactly(
                    "https://viral.example/services",
                    "https://viral.example/service-registry/services");
        }

        @Test
        @DisplayName("treats a refused connection as a miss")
        void connectionFailureMeansNext() {
            fetcher.refuseConnection("https://viral.example/services");
            fetcher.respondJson("https://viral.example/api/service-registry/services", LISTING);

            assertThat(discovery.discover("viral.example")).isEqualTo("https://viral.example/api/service-registry/");
        }

        @Test
        @DisplayName("rejects candidates that are not JSON, not an array or lack ids")
        void rejectsLookalikes() {
            fetcher.respond("https://viral.example/services", 200, "text/html", LISTING);
            fetcher.respondJson("https://viral.example/service-registry/services", json(Map.of("id", "x")));
            fetcher.respondJson("https://viral.example/api/service-registry/services", json(List.of(Map.of("name", "x"))));

            assertThatThrownBy(() -> discovery.discover("viral.example"))
                    .isInstanceOf(InvalidServiceRegistryException.class)
                    .hasMessageContaining("viral.example");
        }

        @Test
        @DisplayName("accepts a JSON content type with parameters")
        void contentTypeWithCharset() {
            fetcher.respond("https://viral.example/services", 200, "application/json; charset=utf-8", LISTING);

            assertThat(discovery.discover("viral.example")).isEqualTo("https://viral.example/");
        }
    }

    @Nested
    @DisplayName("with a URL")
    class DirectUrl {

        @Test
        @DisplayName("checks only the given URL and adds a trailing slash")
        void singleCandidate() {
            fetcher.respondJson("http://localhost:8080/registry/services", LISTING);

            assertThat(discovery.discover("http://localhost:8080/registry")).isEqualTo("http://localhost:8080/registry/");
            assertThat(fetcher.requestedUrls()).containsExactly("http://localhost:8080/registry/services");
        }

        @Test
        @DisplayName("fails when the URL is not a registry root")
        void notARoot() {
            assertThatThrownBy(() -> discovery.discover("https://viral.example/foo"))
                    .isInstanceOf(InvalidServiceRegistryException.class)
                    .hasMessageContaining("not the root URL")
                    .extracting(e -> ((InvalidServiceRegistryException) e).getTarget())
                    .isEqualTo("https://viral.example/foo");
        }
    }

    @Test
    @DisplayName("extracts the hostname from a hostname or URL")
    void hostname() {
        assertThat(RegistryDiscovery.hostnameOf("viral.example")).isEqualTo("viral.example");
        assertThat(RegistryDiscovery.hostnameOf("https://viral.example/api/service-registry/")).isEqualTo("viral.example");
        assertThat(RegistryDiscovery.hostnameOf("http://localhost:8080?x=1")).isEqualTo("localhost:8080");
    }
}
