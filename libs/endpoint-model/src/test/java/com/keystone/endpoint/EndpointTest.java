package com.keystone.endpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Endpoint")
class EndpointTest {

    private static final ServiceType DRS = ServiceType.parse("org.ga4gh:drs:1.1.0");

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects a blank id")
        void blankId() {
            assertThatThrownBy(() -> Endpoint.of(" ", "https://x", DRS))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("id");
        }

        @Test
        @DisplayName("rejects a null url")
        void nullUrl() {
            assertThatThrownBy(() -> Endpoint.of("e1", null, DRS))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("url");
        }

        @Test
        @DisplayName("is manual without a source")
        void manual() {
            var endpoint = Endpoint.of("e1", "https://x", DRS);
            assertThat(endpoint.isManual()).isTrue();
            assertThat(endpoint.isOwnedBy("reg")).isFalse();
        }

        @Test
        @DisplayName("is owned by the registry named in its source")
        void owned() {
            var endpoint = Endpoint.of("e1", "https://x", DRS).withSource(new EndpointSource("reg", "svc"));
            assertThat(endpoint.isOwnedBy("reg")).isTrue();
            assertThat(endpoint.isOwnedBy("other")).isFalse();
        }
    }

    @Nested
    @DisplayName("authentications()")
    class Authentications {

        @Test
        @DisplayName("lists the primary config before the fallbacks")
        void order() {
            var endpoint = Endpoint.of("e1", "https://x", DRS).withAuthentication(
                    Map.of("client_id", "primary"),
                    List.of(Map.of("client_id", "fb1"), Map.of("client_id", "fb2")));

            assertThat(endpoint.authentications())
                    .extracting(m -> m.get("client_id"))
                    .containsExactly("primary", "fb1", "fb2");
        }

        @Test
        @DisplayName("unwraps the legacy nested oauth2 form")
        void legacy() {
            var endpoint = Endpoint.of("e1", "https://x", DRS)
                    .withAuthentication(Map.of("oauth2", Map.of("client_id", "cli")), null);

            assertThat(endpoint.authentications()).containsExactly(Map.of("client_id", "cli", "type", "oauth2"));
        }

        @Test
        @DisplayName("copies the legacy entries with their keys as strings, in order")
        void legacyCopy() {
            Map<Object, Object> nested = new LinkedHashMap<>();
            nested.put("client_id", "cli");
            nested.put(42, "answer");
            var endpoint = Endpoint.of("e1", "https://x", DRS)
                    .withAuthentication(Map.of("oauth2", nested), null);

            assertThat(endpoint.authentications()).singleElement().satisfies(config ->
                    assertThat(config.keySet()).containsExactly("client_id", "42", "type"));
        }

        @Test
        @DisplayName("is empty when there is no authentication")
        void none() {
            assertThat(Endpoint.of("e1", "https://x", DRS).authentications()).isEmpty();
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("reads snake_case fields")
        void reads() throws Exception {
            String json = """
                    {"id":"e1","url":"https://x",
                     "type":{"group":"org.ga4gh","artifact":"drs","version":"1.1.0"},
                     "authentication":{"client_id":"cli"},
                     "fallback_authentications":[{"client_id":"fb"}],
                     "source":{"source_id":"reg","external_id":"svc"}}
                    """;

            Endpoint endpoint = new ObjectMapper().readValue(json, Endpoint.class);

            assertThat(endpoint.type()).isEqualTo(DRS);
            assertThat(endpoint.source()).isEqualTo(new EndpointSource("reg", "svc"));
            assertThat(endpoint.authentications()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("ServiceType")
    class ServiceTypes {

        @Test
        @DisplayName("parses and prints group:artifact:version")
        void parse() {
            assertThat(DRS.group()).isEqualTo("org.ga4gh");
            assertThat(DRS.artifact()).isEqualTo("drs");
            assertThat(DRS).hasToString("org.ga4gh:drs:1.1.0");
        }

        @Test
        @DisplayName("compares artifacts without the version")
        void sameArtifact() {
            assertThat(DRS.isSameArtifact(ServiceType.parse("org.ga4gh:drs:1.2.0"))).isTrue();
            assertThat(DRS.isSameArtifact(ServiceType.parse("org.ga4gh:wes:1.1.0"))).isFalse();
        }

        @Test
        @DisplayName("rejects text without three parts")
        void malformed() {
            assertThatThrownBy(() -> ServiceType.parse("org.ga4gh:drs"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
