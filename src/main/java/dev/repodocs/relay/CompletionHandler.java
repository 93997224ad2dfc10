package dev.repodocs.relay;

import dev.repodocs.domain.enums.FrameKind;
import dev.repodocs.domain.valueobject.GenerationSession;
import dev.repodocs.domain.valueobject.RawChunk;
import dev.repodocs.domain.valueobject.Slug;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Persists the result of a finished generation and tells the client about it.
 *
 * <p>One instance per relay lifetime. It fires at most once: a second terminal frame in the
 * same stream is logged and ignored. Every failure stays in here. A persistence failure
 * only shows up on the client as the absence of the "saved" frame.
 */
public class CompletionHandler {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    static final String RESULT_FIELD = "docs";

    private final PersistenceGateway gateway;
    private final ObjectMapper objectMapper;
    private final GenerationSession session;
    private final AtomicBoolean fired = new AtomicBoolean(false);

    public CompletionHandler(PersistenceGateway gateway, ObjectMapper objectMapper, GenerationSession session) {
        if (!session.requiresPersistence()) {
            throw new IllegalArgumentException("CompletionHandler needs an owned session");
        }
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.session = session;
    }

    /**
     * Persists {@code payload.docs} and appends a "saved" frame to the sink.
     *
     * @return the slug written, or empty when nothing was persisted
     */
    public Optional<Slug> onTerminalFrame(JsonNode payload, OutboundSink sink) {
        if (!fired.compareAndSet(false, true)) {
            log.warn("Ignoring additional done frame for {}", session.repoName());
            return Optional.empty();
        }

        JsonNode docs = payload.get(RESULT_FIELD);
        if (docs == null || docs.isNull()) {
            log.info("Done frame for {} carries no {} field, nothing to persist", session.repoName(), RESULT_FIELD);
            return Optional.empty();
        }

        Slug slug;
        try {
            slug = gateway.upsert(session.ownerIdentity(), session.repoUrl(), session.repoName(), docs);
        } catch (RuntimeException e) {
            log.error("Persisting docs for {} failed: {}", session.repoName(), e.getMessage(), e);
            return Optional.empty();
        }
        log.info("Persisted docs for {} as {}", session.repoName(), slug);

        try {
            sink.write(RawChunk.wrap(savedFrame(slug).encode()));
        } catch (IOException e) {
            log.info("Client left before the saved frame for {} could be written", slug);
        }
        return Optional.of(slug);
    }

    private Frame savedFrame(Slug slug) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("slug", slug.value());
        body.put("repoName", session.repoName());
        return new Frame(FrameKind.SAVED, objectMapper.writeValueAsString(body));
    }
}
