package dev.repodocs.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.repodocs.dto.request.GenerateRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Calls the relay's stream endpoint and drives a {@link GenerationTracker} from the reply.
 *
 * <p>An event-stream reply is fed chunk by chunk into a {@link StreamConsumer}. Anything else
 * (an error status, or a JSON body) goes through the JSON fallback: {@code error} or a problem
 * {@code detail} fails the generation, {@code docs} completes it. Disposing the returned
 * subscription cancels the HTTP exchange and puts the tracker back to IDLE.
 */
public class GenerationStreamClient {

    private static final Logger log = LoggerFactory.getLogger(GenerationStreamClient.class);

    static final String STREAM_PATH = "/api/generate/stream";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public GenerationStreamClient(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    public Mono<Void> stream(GenerateRequest request, GenerationTracker tracker) {
        return stream(request, null, null, tracker);
    }

    /**
     * @param ownerId        asserted owner, or null for an anonymous generation
     * @param ownerSignature {@code sha256=<hex>} HMAC of ownerId
     */
    public Mono<Void> stream(GenerateRequest request, String ownerId, String ownerSignature,
                             GenerationTracker tracker) {
        return Mono.defer(() -> {
            tracker.start();
            return exchange(request, ownerId, ownerSignature, tracker)
                    .doOnError(e -> {
                        log.warn("Generation request failed: {}", e.getMessage());
                        tracker.requestFailed(e.getMessage());
                    })
                    .doOnCancel(tracker::cancel);
        });
    }

    private Mono<Void> exchange(GenerateRequest request, String ownerId, String ownerSignature,
                                GenerationTracker tracker) {
        StreamConsumer consumer = new StreamConsumer(objectMapper, tracker);
        return webClient.post()
                .uri(STREAM_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_JSON, MediaType.APPLICATION_PROBLEM_JSON)
                .headers(h -> {
                    if (ownerId != null) {
                        h.set("X-Owner-Id", ownerId);
                        if (ownerSignature != null) h.set("X-Owner-Signature", ownerSignature);
                    }
                })
                .bodyValue(objectMapper.writeValueAsString(request))
                .exchangeToMono(response -> {
                    if (isEventStream(response)) {
                        tracker.streamOpened();
                        return response.bodyToFlux(byte[].class)
                                .doOnNext(consumer::feed)
                                .then(Mono.<Void>fromRunnable(() -> {
                                    consumer.finish();
                                    tracker.streamClosed();
                                }));
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .doOnNext(body -> fallback(response.statusCode(), body, tracker))
                            .then();
                });
    }

    private static boolean isEventStream(ClientResponse response) {
        return response.statusCode().is2xxSuccessful()
                && response.headers().contentType()
                        .map(MediaType.TEXT_EVENT_STREAM::isCompatibleWith)
                        .orElse(false);
    }

    private void fallback(HttpStatusCode status, String body, GenerationTracker tracker) {
        JsonReply reply = parse(body);
        if (reply.error() != null) {
            tracker.requestFailed(reply.error());
        } else if (!status.is2xxSuccessful()) {
            tracker.requestFailed(reply.detail() != null ? reply.detail() : "Request failed with status " + status.value());
        } else if (reply.docs() != null && !reply.docs().isNull()) {
            tracker.completedWithoutStream(reply.docs(), reply.slug());
        } else {
            tracker.requestFailed("Unexpected response from relay");
        }
    }

    private JsonReply parse(String body) {
        if (body.isBlank()) return JsonReply.EMPTY;
        try {
            return objectMapper.readValue(body, JsonReply.class);
        } catch (JacksonException e) {
            log.debug("Relay reply is not JSON: {}", e.getMessage());
            return JsonReply.EMPTY;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JsonReply(String error, String detail, JsonNode docs, String slug) {
        static final JsonReply EMPTY = new JsonReply(null, null, null, null);
    }
}
