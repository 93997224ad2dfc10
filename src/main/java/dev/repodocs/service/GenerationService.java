package dev.repodocs.service;

import dev.repodocs.domain.valueobject.GenerationSession;
import dev.repodocs.domain.valueobject.Slug;
import dev.repodocs.dto.request.GenerateRequest;
import dev.repodocs.infrastructure.upstream.GenerationRequest;
import dev.repodocs.infrastructure.upstream.GenerationServiceClient;
import dev.repodocs.relay.CompletionHandler;
import dev.repodocs.relay.PersistenceGateway;
import dev.repodocs.relay.RelayTee;
import dev.repodocs.relay.TerminalFrameScanner;
import dev.repodocs.relay.UpstreamStream;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Entry point for both generation paths.
 *
 * <p>The streaming path only wires a relay together; it is run later on the response's
 * async thread. Whether it persists is decided here, once, from the session: anonymous
 * sessions get a passthrough relay with no scanner or completion handler at all.
 */
@Service
public class GenerationService {
    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final GenerationServiceClient client;
    private final PersistenceGateway persistence;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public GenerationService(GenerationServiceClient client, PersistenceGateway persistence,
                             ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.client = client;
        this.persistence = persistence;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Opens the upstream stream and returns a relay ready to run. Upstream failures before
     * the first byte are thrown from here, while the HTTP status can still be chosen.
     */
    public RelayTee openRelay(GenerateRequest request, Optional<String> owner) {
        GenerationSession session = sessionFor(request, owner);
        UpstreamStream upstream = client.openStream(upstreamRequest(request));
        if (!session.requiresPersistence()) {
            log.info("Opened passthrough relay for {}", session.repoName());
            return RelayTee.passthrough(upstream, meterRegistry);
        }
        log.info("Opened persisting relay for {}", session.repoName());
        return RelayTee.persisting(upstream,
                new TerminalFrameScanner(objectMapper),
                new CompletionHandler(persistence, objectMapper, session),
                meterRegistry);
    }

    /**
     * Non-streaming generation. Mirrors upstream's reply; an owned request whose reply carries
     * docs is persisted and the reply gains a {@code slug} field.
     */
    public JsonNode generate(GenerateRequest request, Optional<String> owner) {
        GenerationSession session = sessionFor(request, owner);
        JsonNode reply = client.generate(upstreamRequest(request));
        if (!session.requiresPersistence() || !(reply instanceof ObjectNode body)) return reply;

        JsonNode docs = body.get("docs");
        if (docs == null || docs.isNull()) return reply;
        try {
            Slug slug = persistence.upsert(session.ownerIdentity(), session.repoUrl(), session.repoName(), docs);
            body.put("slug", slug.value());
        } catch (RuntimeException e) {
            log.error("Persisting docs for {} failed: {}", session.repoName(), e.getMessage(), e);
        }
        return body;
    }

    public JsonNode refine(GenerateRequest request) {
        if (request.currentDocs() == null || request.currentDocs().isNull()) {
            throw new IllegalArgumentException("current_docs is required for refine");
        }
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw new IllegalArgumentException("prompt is required for refine");
        }
        String repoName = request.repoName() != null ? request.repoName() : "";
        return client.refine(request.currentDocs(), request.prompt(), repoName);
    }

    private static GenerationSession sessionFor(GenerateRequest request, Optional<String> owner) {
        if (request.repoUrl() == null || request.repoUrl().isBlank()) {
            throw new IllegalArgumentException("repo_url is required");
        }
        return new GenerationSession(owner.orElse(null), request.repoUrl(), request.repoName());
    }

    private static GenerationRequest upstreamRequest(GenerateRequest request) {
        return new GenerationRequest(request.repoUrl(), request.docType(), request.authToken());
    }
}
