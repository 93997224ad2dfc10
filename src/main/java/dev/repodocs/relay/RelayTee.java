package dev.repodocs.relay;

import dev.repodocs.domain.valueobject.RawChunk;
import dev.repodocs.exception.UpstreamException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forwards one upstream generation stream to one caller.
 *
 * <p>Termination protocol:
 * <pre>
 *  1. Each chunk is written (and flushed) to the sink before anything else happens to it
 *  2. Persisting relays also copy the chunk into the accumulation buffer
 *  3. Upstream closes normally → scan for the done frame → CompletionHandler (may append "saved")
 *  4. Upstream fails, or the caller cancels → accumulation dropped, no persistence
 *  5. The sink is closed exactly once, after step 3 has finished or failed
 * </pre>
 *
 * <p>Whether a relay persists is fixed at construction: {@link #passthrough} relays have no
 * buffer, no scanner and no completion handler at all.
 */
public final class RelayTee {

    private static final Logger log = LoggerFactory.getLogger(RelayTee.class);

    static final String TIMER = "repodocs.relay.duration";

    private final UpstreamStream upstream;
    private final TerminalFrameScanner scanner;
    private final CompletionHandler completion;
    private final ByteArrayOutputStream accumulation;
    private final MeterRegistry meterRegistry;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private volatile long forwardedBytes;

    private RelayTee(UpstreamStream upstream, TerminalFrameScanner scanner,
                     CompletionHandler completion, MeterRegistry meterRegistry) {
        this.upstream = upstream;
        this.scanner = scanner;
        this.completion = completion;
        this.accumulation = completion != null ? new ByteArrayOutputStream() : null;
        this.meterRegistry = meterRegistry;
    }

    public static RelayTee passthrough(UpstreamStream upstream, MeterRegistry meterRegistry) {
        return new RelayTee(upstream, null, null, meterRegistry);
    }

    public static RelayTee persisting(UpstreamStream upstream, TerminalFrameScanner scanner,
                                      CompletionHandler completion, MeterRegistry meterRegistry) {
        if (scanner == null || completion == null) {
            throw new IllegalArgumentException("persisting relay needs a scanner and a completion handler");
        }
        return new RelayTee(upstream, scanner, completion, meterRegistry);
    }

    public boolean isPersisting() {
        return completion != null;
    }

    /**
     * Runs the relay to the end on the calling thread. Returns once the sink has been closed.
     */
    public RelayOutcome run(OutboundSink sink) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Relay already ran");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        RelayOutcome outcome = RelayOutcome.CANCELLED;
        try {
            outcome = forwardAll(sink);
            if (outcome == RelayOutcome.COMPLETED && completion != null) {
                outcome = complete(sink);
            }
            return outcome;
        } finally {
            finished.set(true);
            upstream.close();
            closeSink(sink);
            sample.stop(Timer.builder(TIMER)
                    .description("Relay lifetime from upstream open to outbound close")
                    .tag("outcome", outcome.tag())
                    .register(meterRegistry));
            log.info("Relay finished: outcome={}, forwardedBytes={}", outcome, forwardedBytes);
        }
    }

    /**
     * Caller-initiated cancellation. Tears down the upstream read; the running relay closes
     * the sink and skips persistence. No-op once the relay has finished.
     */
    public void cancel() {
        if (finished.get()) return;
        if (cancelled.compareAndSet(false, true)) {
            log.info("Relay cancelled after {} bytes", forwardedBytes);
            upstream.close();
        }
    }

    private RelayOutcome forwardAll(OutboundSink sink) {
        try {
            Optional<RawChunk> next;
            while (!cancelled.get() && (next = upstream.next()).isPresent()) {
                RawChunk chunk = next.get();
                sink.write(chunk);
                forwardedBytes += chunk.length();
                if (accumulation != null) {
                    chunk.appendTo(accumulation);
                }
            }
        } catch (UpstreamException e) {
            if (cancelled.get()) return RelayOutcome.CANCELLED;
            // interrupted by the async request timing out or failing
            if (Thread.currentThread().isInterrupted()) {
                cancelled.set(true);
                log.info("Relay thread interrupted after {} bytes", forwardedBytes);
                return RelayOutcome.CANCELLED;
            }
            log.warn("Upstream failed after {} bytes: {}", forwardedBytes, e.getMessage());
            return RelayOutcome.UPSTREAM_FAILED;
        } catch (IOException e) {
            log.info("Caller went away after {} bytes: {}", forwardedBytes, e.getMessage());
            cancelled.set(true);
            return RelayOutcome.CANCELLED;
        }
        return cancelled.get() ? RelayOutcome.CANCELLED : RelayOutcome.COMPLETED;
    }

    private RelayOutcome complete(OutboundSink sink) {
        try {
            Optional<JsonNode> payload = scanner.findTerminalPayload(accumulation.toString(StandardCharsets.UTF_8));
            if (payload.isEmpty()) {
                log.info("Upstream closed without a done frame, nothing to persist");
                return RelayOutcome.COMPLETED;
            }
            return completion.onTerminalFrame(payload.get(), sink).isPresent()
                    ? RelayOutcome.PERSISTED
                    : RelayOutcome.COMPLETED;
        } catch (RuntimeException e) {
            log.error("Completion handling failed", e);
            return RelayOutcome.COMPLETED;
        }
    }

    private static void closeSink(OutboundSink sink) {
        try {
            sink.close();
        } catch (IOException e) {
            log.debug("Closing outbound sink failed: {}", e.getMessage());
        }
    }
}
