package dev.repodocs.service;

import dev.repodocs.domain.valueobject.Slug;
import dev.repodocs.dto.request.GenerateRequest;
import dev.repodocs.exception.UpstreamException;
import dev.repodocs.infrastructure.upstream.GenerationRequest;
import dev.repodocs.infrastructure.upstream.GenerationServiceClient;
import dev.repodocs.relay.PersistenceGateway;
import dev.repodocs.relay.RelayTee;
import dev.repodocs.relay.ScriptedUpstreamStream;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GenerationServiceTest {

    private static final String REPO_URL = "https://github.com/acme/widgets";

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private GenerationServiceClient client;
    private PersistenceGateway persistence;
    private GenerationService service;

    @BeforeEach
    void setUp() {
        client = mock(GenerationServiceClient.class);
        persistence = mock(PersistenceGateway.class);
        service = new GenerationService(client, persistence, objectMapper, new SimpleMeterRegistry());
    }

    private static GenerateRequest generate(String repoUrl) {
        return new GenerateRequest(repoUrl, "readme", null, "gho_token", null, null, null);
    }

    @Nested
    @DisplayName("openRelay")
    class OpenRelay {

        @Test
        @DisplayName("builds a passthrough relay for anonymous callers")
        void anonymousPassthrough() {
            when(client.openStream(any())).thenReturn(ScriptedUpstreamStream.of());

            RelayTee relay = service.openRelay(generate(REPO_URL), Optional.empty());

            assertThat(relay.isPersisting()).isFalse();
            verify(client).openStream(new GenerationRequest(REPO_URL, "readme", "gho_token"));
        }

        @Test
        @DisplayName("builds a persisting relay for verified owners")
        void ownerPersists() {
            when(client.openStream(any())).thenReturn(ScriptedUpstreamStream.of());

            assertThat(service.openRelay(generate(REPO_URL), Optional.of("owner-42")).isPersisting()).isTrue();
        }

        @Test
        @DisplayName("lets upstream open failures propagate")
        void openFailure() {
            when(client.openStream(any())).thenThrow(new UpstreamException("refused"));

            assertThatThrownBy(() -> service.openRelay(generate(REPO_URL), Optional.empty()))
                    .isInstanceOf(UpstreamException.class);
        }

        @Test
        @DisplayName("rejects a request without repo_url before calling upstream")
        void requiresRepoUrl() {
            assertThatThrownBy(() -> service.openRelay(generate(" "), Optional.empty()))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(client);
        }
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("persists an owner's docs and appends the slug")
        void appendsSlug() {
            JsonNode reply = objectMapper.readTree("{\"docs\":{\"title\":\"W\"}}");
            when(client.generate(any())).thenReturn(reply);
            when(persistence.upsert(eq("owner-42"), eq(REPO_URL), eq("widgets"), any(JsonNode.class)))
                    .thenReturn(new Slug("widgets-owner-42"));

            JsonNode result = service.generate(generate(REPO_URL), Optional.of("owner-42"));

            assertThat(result.get("slug")).isEqualTo(objectMapper.readTree("\"widgets-owner-42\""));
            assertThat(result.get("docs")).isEqualTo(objectMapper.readTree("{\"title\":\"W\"}"));
        }

        @Test
        @DisplayName("mirrors the reply unchanged for anonymous callers")
        void anonymousMirrors() {
            JsonNode reply = objectMapper.readTree("{\"docs\":{\"title\":\"W\"}}");
            when(client.generate(any())).thenReturn(reply);

            JsonNode result = service.generate(generate(REPO_URL), Optional.empty());

            assertThat(result).isEqualTo(objectMapper.readTree("{\"docs\":{\"title\":\"W\"}}"));
            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("mirrors an upstream error reply without persisting")
        void errorReply() {
            when(client.generate(any())).thenReturn(objectMapper.readTree("{\"error\":\"Clone failed\"}"));

            JsonNode result = service.generate(generate(REPO_URL), Optional.of("owner-42"));

            assertThat(result).isEqualTo(objectMapper.readTree("{\"error\":\"Clone failed\"}"));
            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("returns the reply without slug when persisting fails")
        void persistenceFailure() {
            when(client.generate(any())).thenReturn(objectMapper.readTree("{\"docs\":{}}"));
            when(persistence.upsert(anyString(), anyString(), anyString(), any(JsonNode.class)))
                    .thenThrow(new IllegalStateException("db down"));

            JsonNode result = service.generate(generate(REPO_URL), Optional.of("owner-42"));

            assertThat(result.get("slug")).isNull();
            assertThat(result.get("docs")).isNotNull();
        }
    }

    @Nested
    @DisplayName("refine")
    class Refine {

        @Test
        @DisplayName("forwards current docs and prompt")
        void forwards() {
            JsonNode docs = objectMapper.readTree("{\"title\":\"W\"}");
            JsonNode reply = objectMapper.readTree("{\"docs\":{\"title\":\"W2\"}}");
            when(client.refine(docs, "shorter", "widgets")).thenReturn(reply);

            JsonNode result = service.refine(new GenerateRequest(null, null, "widgets", null, "refine", docs, "shorter"));

            assertThat(result).isSameAs(reply);
        }

        @Test
        @DisplayName("requires current docs and a prompt")
        void validates() {
            assertThatThrownBy(() -> service.refine(new GenerateRequest(null, null, "w", null, "refine", null, "p")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.refine(new GenerateRequest(null, null, "w", null, "refine",
                    objectMapper.createObjectNode(), " ")))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(client);
        }
    }
}
