package dev.repodocs.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.repodocs.domain.enums.FrameKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Incremental decoder for the relay's event stream.
 *
 * <p>Chunks may split lines, and UTF-8 sequences, anywhere: bytes are buffered until a LF
 * and only then decoded. A blank line closes the frame, which is dispatched and then
 * cleared, whatever its kind. Unknown kinds are ignored; a frame whose payload does not parse
 * is dropped and decoding carries on with the next one.
 *
 * <p>Not thread-safe. Feed it from one subscriber.
 */
public class StreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(StreamConsumer.class);

    private static final String EVENT_FIELD = "event:";
    private static final String DATA_FIELD = "data:";

    private final ObjectMapper objectMapper;
    private final FrameListener listener;
    private final DecoderState state = new DecoderState();

    public StreamConsumer(ObjectMapper objectMapper, FrameListener listener) {
        this.objectMapper = objectMapper;
        this.listener = listener;
    }

    public void feed(byte[] chunk) {
        for (byte b : chunk) {
            if (b == '\n') {
                onLine(state.takeLine());
            } else {
                state.appendToLine(b);
            }
        }
    }

    /**
     * End of stream. A trailing line without LF is still read, but a frame that was never
     * closed by a blank line is discarded.
     */
    public void finish() {
        if (state.hasPartialLine()) onLine(state.takeLine());
        if (state.hasFrame()) {
            log.debug("Discarding unterminated '{}' frame at end of stream", state.pendingKind());
            state.clearFrame();
        }
    }

    private void onLine(String line) {
        if (line.isEmpty()) {
            if (state.hasFrame()) dispatch(state.pendingKind(), state.data());
            state.clearFrame();
        } else if (line.startsWith(EVENT_FIELD)) {
            state.pendingKind(line.substring(EVENT_FIELD.length()).trim());
        } else if (line.startsWith(DATA_FIELD)) {
            String value = line.substring(DATA_FIELD.length());
            state.appendData(value.startsWith(" ") ? value.substring(1) : value);
        }
        // comments (":") and other fields carry nothing for us
    }

    private void dispatch(String kind, String data) {
        Optional<FrameKind> frameKind = FrameKind.fromWire(kind);
        if (frameKind.isEmpty()) {
            log.debug("Ignoring frame of unknown kind '{}'", kind);
            return;
        }
        try {
            JsonNode payload = objectMapper.readTree(data);
            if (payload == null || !payload.isObject()) {
                log.debug("Dropping {} frame: payload is not an object", kind);
                return;
            }
            switch (frameKind.get()) {
                case PROGRESS -> {
                    ProgressPayload p = objectMapper.treeToValue(payload, ProgressPayload.class);
                    listener.onProgress(p.progress() != null ? p.progress() : 0, p.message());
                }
                case DONE -> {
                    JsonNode docs = payload.get("docs");
                    if (docs == null || docs.isNull()) {
                        log.debug("Dropping done frame without docs");
                        return;
                    }
                    listener.onDone(docs);
                }
                case ERROR -> {
                    ErrorPayload p = objectMapper.treeToValue(payload, ErrorPayload.class);
                    listener.onError(p.error() != null ? p.error() : "Generation failed");
                }
                case SAVED -> {
                    SavedPayload p = objectMapper.treeToValue(payload, SavedPayload.class);
                    if (p.slug() == null || p.slug().isBlank()) {
                        log.debug("Dropping saved frame without slug");
                        return;
                    }
                    listener.onSaved(p.slug(), p.repoName());
                }
            }
        } catch (JacksonException e) {
            log.debug("Dropping malformed {} frame: {}", kind, e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProgressPayload(Integer progress, String message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorPayload(String error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SavedPayload(String slug, String repoName) {}
}
