package dev.repodocs.infrastructure.upstream;

import dev.repodocs.config.UpstreamProperties;
import dev.repodocs.relay.UpstreamStream;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.time.Duration;

/**
 * Client for the generation service (the agent that clones, parses and writes the docs).
 *
 * <p>The WebClient is the application-wide connection pool to that service, injected rather
 * than created here, so tests point the client at a fake upstream. Every call goes through
 * the {@code generation-service} circuit breaker. Nothing is retried: a generation is
 * expensive and not guaranteed idempotent upstream.
 */
@Component
public class GenerationServiceClient {

    private static final Logger log = LoggerFactory.getLogger(GenerationServiceClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final UpstreamProperties properties;
    private final CircuitBreaker circuitBreaker;

    public GenerationServiceClient(WebClient webClient, ObjectMapper objectMapper,
                                   UpstreamProperties properties, CircuitBreaker circuitBreaker) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * Opens the streaming generation call. Returns once upstream has produced its first
     * chunk (or closed empty); failures before that point are thrown from here.
     */
    public UpstreamStream openStream(GenerationRequest request) {
        log.info("Opening generation stream for {}", request.repoUrl());
        Flux<byte[]> body = webClient.post()
                .uri("/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(objectMapper.writeValueAsString(generateBody(request, true)))
                .exchangeToFlux(response -> response.statusCode().is2xxSuccessful()
                        ? response.bodyToFlux(byte[].class)
                        : response.createException().flatMapMany(Flux::error))
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
        return ReactiveUpstreamStream.open(body, properties.generateTimeout());
    }

    /** Non-streaming generation. Returns upstream's JSON reply, {@code {docs, ...}} or {@code {error}}. */
    public JsonNode generate(GenerationRequest request) {
        log.info("Requesting generation for {}", request.repoUrl());
        return postJson("/generate", generateBody(request, false), properties.generateTimeout());
    }

    public JsonNode refine(JsonNode currentDocs, String prompt, String repoName) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("current_docs", currentDocs);
        body.put("prompt", prompt);
        body.put("repo_name", repoName);
        log.info("Requesting refinement for {}", repoName);
        return postJson("/refine", body, properties.refineTimeout());
    }

    private ObjectNode generateBody(GenerationRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("repo_url", request.repoUrl());
        body.put("doc_type", request.docType());
        if (request.authToken() != null) body.put("auth_token", request.authToken());
        if (stream) body.put("stream", true);
        return body;
    }

    private JsonNode postJson(String path, JsonNode body, Duration deadline) {
        try {
            String raw = webClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsString(body))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(deadline)
                    .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                    .block();
            return raw == null || raw.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(raw);
        } catch (RuntimeException e) {
            throw UpstreamErrors.translate(Exceptions.unwrap(e), deadline);
        }
    }
}
