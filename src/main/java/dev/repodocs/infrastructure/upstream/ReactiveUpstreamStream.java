package dev.repodocs.infrastructure.upstream;

import dev.repodocs.domain.valueobject.RawChunk;
import dev.repodocs.exception.UpstreamException;
import dev.repodocs.exception.UpstreamTimeoutException;
import dev.repodocs.relay.UpstreamStream;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges a reactive response body into the blocking {@link UpstreamStream} the relay reads.
 *
 * <p>Demand is one chunk at a time: the next chunk is requested only after the relay has
 * taken the previous one, so a slow caller slows the upstream read instead of filling memory.
 * The deadline covers the whole relay lifetime, measured from {@link #open}.
 */
public final class ReactiveUpstreamStream implements UpstreamStream {

    private final BlockingDeque<Signal> signals = new LinkedBlockingDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ChunkSubscriber subscriber = new ChunkSubscriber();
    private final Duration deadline;
    private final long deadlineNanos;
    private boolean finished;

    private ReactiveUpstreamStream(Duration deadline) {
        this.deadline = deadline;
        this.deadlineNanos = System.nanoTime() + deadline.toNanos();
    }

    /**
     * Subscribes and waits for the first signal, so a failure before any byte arrives
     * (refused connection, error status, deadline) is thrown here rather than mid-relay.
     *
     * @throws UpstreamException if the body fails before producing a chunk
     * @throws io.github.resilience4j.circuitbreaker.CallNotPermittedException if the circuit is open
     */
    public static ReactiveUpstreamStream open(Flux<byte[]> body, Duration deadline) {
        ReactiveUpstreamStream stream = new ReactiveUpstreamStream(deadline);
        body.subscribe(stream.subscriber);
        Signal first = stream.await();
        if (first instanceof Failure failure) {
            stream.close();
            throw failure.error();
        }
        stream.signals.offerFirst(first);
        return stream;
    }

    @Override
    public Optional<RawChunk> next() {
        if (finished || closed.get()) return Optional.empty();
        Signal signal = await();
        if (signal instanceof Chunk chunk) {
            subscriber.requestNext();
            return Optional.of(chunk.chunk());
        }
        finished = true;
        if (signal instanceof Failure failure) {
            if (closed.get()) return Optional.empty();
            throw UpstreamErrors.translate(failure.error());
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            subscriber.dispose();
            signals.offer(End.CLOSED);
        }
    }

    private Signal await() {
        try {
            long remaining = deadlineNanos - System.nanoTime();
            Signal signal = remaining > 0 ? signals.poll(remaining, TimeUnit.NANOSECONDS) : signals.poll();
            if (signal == null) {
                subscriber.dispose();
                return new Failure(new UpstreamTimeoutException(deadline));
            }
            return signal;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscriber.dispose();
            return new Failure(new UpstreamException("Interrupted while reading upstream", e));
        }
    }

    private interface Signal {}

    private record Chunk(RawChunk chunk) implements Signal {}

    private record Failure(RuntimeException error) implements Signal {}

    private enum End implements Signal { COMPLETE, CLOSED }

    private final class ChunkSubscriber extends BaseSubscriber<byte[]> {

        @Override
        protected void hookOnSubscribe(Subscription subscription) {
            request(1);
        }

        @Override
        protected void hookOnNext(byte[] value) {
            signals.offer(new Chunk(RawChunk.wrap(value)));
        }

        @Override
        protected void hookOnComplete() {
            signals.offer(End.COMPLETE);
        }

        @Override
        protected void hookOnError(Throwable throwable) {
            signals.offer(new Failure(UpstreamErrors.translate(throwable, deadline)));
        }

        void requestNext() {
            request(1);
        }
    }
}
