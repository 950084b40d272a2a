package com.keystone.endpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Context and EndpointRepository")
class ContextTest {

    private static final ServiceType DRS = ServiceType.parse("org.ga4gh:drs:1.1.0");
    private static final ServiceType WES = ServiceType.parse("org.ga4gh:wes:1.0.0");

    @Test
    @DisplayName("finds endpoints by id and replaces the list in place")
    void findAndReplace() {
        var context = new Context();
        context.endpoints().add(Endpoint.of("a", "https://a", DRS));

        assertThat(context.findEndpoint("a")).isPresent();
        assertThat(context.findEndpoint("b")).isEmpty();

        context.replaceEndpoints(List.of(Endpoint.of("b", "https://b", WES)));
        assertThat(context.endpoints()).extracting(Endpoint::id).containsExactly("b");
    }

    @Test
    @DisplayName("survives a JSON round trip with its guid")
    void json() throws Exception {
        var mapper = new ObjectMapper();
        var context = new Context("g-1", List.of(Endpoint.of("a", "https://a", DRS)), Map.of("drs", "a"));

        Context read = mapper.readValue(mapper.writeValueAsString(context), Context.class);

        assertThat(read.guid()).isEqualTo("g-1");
        assertThat(read.endpoints()).containsExactlyElementsOf(context.endpoints());
        assertThat(read.defaults()).containsEntry("drs", "a");
    }

    @Test
    @DisplayName("repository filters by artifact")
    void repository() {
        var repository = new EndpointRepository(List.of(
                Endpoint.of("a", "https://a", DRS),
                Endpoint.of("b", "https://b", WES),
                Endpoint.of("c", "https://c", ServiceType.parse("org.ga4gh:drs:1.2.0"))));

        assertThat(repository.ofArtifact(DRS)).extracting(Endpoint::id).containsExactly("a", "c");
        assertThat(repository.get("b")).map(Endpoint::url).contains("https://b");
        assertThat(repository.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("validator reports every problem at once")
    void validator() {
        var endpoint = new Endpoint("a", "ftp://a", DRS,
                Map.of("type", 5), null, new EndpointSource("reg", " "));

        ValidationResult result = EndpointValidator.validate(endpoint);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(3);
        assertThat(EndpointValidator.validate(Endpoint.of("a", "https://a", DRS)).valid()).isTrue();
    }
}
