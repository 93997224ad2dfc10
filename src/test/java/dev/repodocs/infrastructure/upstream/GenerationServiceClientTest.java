package dev.repodocs.infrastructure.upstream;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.repodocs.config.UpstreamProperties;
import dev.repodocs.domain.valueobject.RawChunk;
import dev.repodocs.exception.UpstreamException;
import dev.repodocs.exception.UpstreamTimeoutException;
import dev.repodocs.relay.UpstreamStream;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class GenerationServiceClientTest {

    private static final String EVENTS = "event: progress\ndata: {\"progress\":10,\"message\":\"Cloning\"}\n\n"
            + "event: done\ndata: {\"docs\":{\"title\":\"X\"}}\n\n";

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private CircuitBreaker circuitBreaker;
    private GenerationServiceClient client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        WebClient webClient = WebClient.builder().baseUrl(wmInfo.getHttpBaseUrl()).build();
        UpstreamProperties properties = new UpstreamProperties(URI.create(wmInfo.getHttpBaseUrl()),
                Duration.ofSeconds(1), Duration.ofMillis(800), Duration.ofMillis(800));
        circuitBreaker = CircuitBreaker.ofDefaults("generation-service");
        client = new GenerationServiceClient(webClient, objectMapper, properties, circuitBreaker);
    }

    private static String drain(UpstreamStream stream) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Optional<RawChunk> next;
        while ((next = stream.next()).isPresent()) next.get().appendTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("streams the upstream event stream byte for byte")
    void streamsEvents() {
        stubFor(post(urlPathEqualTo("/generate"))
                .withHeader("Accept", containing("text/event-stream"))
                .withRequestBody(equalToJson("""
                        {"repo_url":"https://github.com/octocat/hello-world","doc_type":"readme","stream":true}
                        """))
                .willReturn(aResponse().withHeader("Content-Type", "text/event-stream").withBody(EVENTS)));

        UpstreamStream stream = client.openStream(
                new GenerationRequest("https://github.com/octocat/hello-world", "readme", null));

        assertThat(drain(stream)).isEqualTo(EVENTS);
    }

    @Test
    @DisplayName("forwards the auth token for private repositories")
    void forwardsAuthToken() {
        stubFor(post(urlPathEqualTo("/generate"))
                .withRequestBody(matchingJsonPath("$.auth_token", equalTo("gho_secret")))
                .willReturn(aResponse().withHeader("Content-Type", "text/event-stream").withBody(EVENTS)));

        UpstreamStream stream = client.openStream(
                new GenerationRequest("https://github.com/acme/private", null, "gho_secret"));

        assertThat(drain(stream)).isEqualTo(EVENTS);
    }

    @Test
    @DisplayName("fails the open with the upstream status on an error reply")
    void errorStatus() {
        stubFor(post(urlPathEqualTo("/generate")).willReturn(serverError()));

        assertThatThrownBy(() -> client.openStream(new GenerationRequest("https://github.com/a/b", null, null)))
                .isInstanceOfSatisfying(UpstreamException.class, e -> assertThat(e.getStatus()).isEqualTo(500));
    }

    @Test
    @DisplayName("fails the open with a timeout when upstream is too slow")
    void slowUpstream() {
        stubFor(post(urlPathEqualTo("/generate"))
                .willReturn(aResponse().withFixedDelay(3000).withBody(EVENTS)));

        assertThatThrownBy(() -> client.openStream(new GenerationRequest("https://github.com/a/b", null, null)))
                .isInstanceOf(UpstreamTimeoutException.class);
    }

    @Test
    @DisplayName("rejects calls while the circuit is open")
    void circuitOpen() {
        circuitBreaker.transitionToOpenState();

        assertThatThrownBy(() -> client.openStream(new GenerationRequest("https://github.com/a/b", null, null)))
                .isInstanceOf(CallNotPermittedException.class);
        assertThatThrownBy(() -> client.generate(new GenerationRequest("https://github.com/a/b", null, null)))
                .isInstanceOf(CallNotPermittedException.class);
    }

    @Test
    @DisplayName("returns the JSON reply of a non-streaming generation")
    void generateJson() {
        stubFor(post(urlPathEqualTo("/generate"))
                .withRequestBody(notContaining("\"stream\""))
                .willReturn(okJson("{\"docs\":{\"title\":\"X\"},\"repo_name\":\"b\"}")));

        JsonNode reply = client.generate(new GenerationRequest("https://github.com/a/b", "auto", null));

        assertThat(reply.get("docs")).isEqualTo(objectMapper.readTree("{\"title\":\"X\"}"));
    }

    @Test
    @DisplayName("sends current docs and prompt to refine")
    void refine() {
        stubFor(post(urlPathEqualTo("/refine"))
                .withRequestBody(equalToJson("""
                        {"current_docs":{"title":"X"},"prompt":"shorter intro","repo_name":"b"}
                        """))
                .willReturn(okJson("{\"docs\":{\"title\":\"X2\"}}")));

        JsonNode reply = client.refine(objectMapper.readTree("{\"title\":\"X\"}"), "shorter intro", "b");

        assertThat(reply.get("docs")).isEqualTo(objectMapper.readTree("{\"title\":\"X2\"}"));
    }

    @Test
    @DisplayName("maps a slow refine to a timeout")
    void refineTimeout() {
        stubFor(post(urlPathEqualTo("/refine")).willReturn(okJson("{}").withFixedDelay(3000)));

        assertThatThrownBy(() -> client.refine(objectMapper.createObjectNode(), "p", "b"))
                .isInstanceOf(UpstreamTimeoutException.class);
    }

    @Test
    @DisplayName("maps an error reply from refine to an upstream failure")
    void refineError() {
        stubFor(post(urlPathEqualTo("/refine")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.refine(objectMapper.createObjectNode(), "p", "b"))
                .isInstanceOfSatisfying(UpstreamException.class, e -> assertThat(e.getStatus()).isEqualTo(503));
    }
}
