package dev.repodocs.client;

import dev.repodocs.domain.enums.StreamState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;

/**
 * Client-side view of one generation, driven by the {@link StreamConsumer} and by the
 * transport.
 *
 * <pre>
 *  IDLE ──start──▶ REQUESTING ──streamOpened──▶ STREAMING ──streamClosed──▶ COMPLETED
 *                      │                            │
 *                      └──requestFailed──▶ FAILED ◀─┴──error frame / transport failure
 * </pre>
 *
 * <p>A "done" frame stores the result but does not end streaming: a "saved" frame may still
 * follow and marks the generation as persisted. A stream that closes without a result ends
 * COMPLETED with {@link Snapshot#noResult()} set, not FAILED. Cancelling returns to IDLE
 * without recording an error. Frames arriving outside STREAMING are ignored.
 */
public class GenerationTracker implements FrameListener {

    private static final Logger log = LoggerFactory.getLogger(GenerationTracker.class);

    private StreamState state = StreamState.IDLE;
    private int progress;
    private String message;
    private JsonNode result;
    private String error;
    private String slug;
    private boolean persisted;

    public record Snapshot(StreamState state, int progress, String message, JsonNode result,
                           String error, String slug, boolean persisted) {
        public boolean noResult() {
            return state == StreamState.COMPLETED && result == null;
        }
    }

    public synchronized void start() {
        if (state == StreamState.REQUESTING || state == StreamState.STREAMING) {
            throw new IllegalStateException("Generation already in progress");
        }
        reset();
        state = StreamState.REQUESTING;
    }

    public synchronized void streamOpened() {
        if (state != StreamState.REQUESTING) return;
        state = StreamState.STREAMING;
    }

    public synchronized void streamClosed() {
        if (state != StreamState.STREAMING) return;
        state = StreamState.COMPLETED;
        if (result == null) log.info("Stream closed without a result");
    }

    /** The relay answered with JSON instead of a stream and that JSON carried docs. */
    public synchronized void completedWithoutStream(JsonNode docs, String slug) {
        if (state != StreamState.REQUESTING) return;
        this.result = docs;
        this.progress = 100;
        if (slug != null && !slug.isBlank()) {
            this.slug = slug;
            this.persisted = true;
        }
        state = StreamState.COMPLETED;
    }

    public synchronized void requestFailed(String message) {
        if (state != StreamState.REQUESTING && state != StreamState.STREAMING) return;
        this.error = message;
        state = StreamState.FAILED;
    }

    public synchronized void cancel() {
        if (state == StreamState.IDLE) return;
        log.info("Generation cancelled in state {}", state);
        reset();
    }

    @Override
    public synchronized void onProgress(int progress, String message) {
        if (state != StreamState.STREAMING) return;
        this.progress = progress;
        this.message = message;
    }

    @Override
    public synchronized void onDone(JsonNode docs) {
        if (state != StreamState.STREAMING) return;
        this.result = docs;
        this.progress = 100;
    }

    @Override
    public synchronized void onError(String message) {
        if (state != StreamState.STREAMING) return;
        this.error = message;
        state = StreamState.FAILED;
    }

    @Override
    public synchronized void onSaved(String slug, String repoName) {
        if (state != StreamState.STREAMING) return;
        this.slug = slug;
        this.persisted = true;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(state, progress, message, result, error, slug, persisted);
    }

    public synchronized StreamState state() {
        return state;
    }

    private void reset() {
        state = StreamState.IDLE;
        progress = 0;
        message = null;
        result = null;
        error = null;
        slug = null;
        persisted = false;
    }
}
