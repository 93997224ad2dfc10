package dev.repodocs.relay;

import dev.repodocs.domain.valueobject.RawChunk;

import java.util.Optional;

/**
 * Ordered byte chunks from the generation service, read one at a time.
 */
public interface UpstreamStream extends AutoCloseable {

    /**
     * Blocks until the next chunk is available.
     *
     * @return the next chunk, or empty once upstream closed normally or this stream was closed locally
     * @throws dev.repodocs.exception.UpstreamException on transport failure or when the deadline elapses
     */
    Optional<RawChunk> next();

    /**
     * Releases the connection. Idempotent, callable from any thread; a blocked {@link #next()}
     * returns promptly.
     */
    @Override
    void close();
}
