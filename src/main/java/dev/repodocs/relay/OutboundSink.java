package dev.repodocs.relay;

import dev.repodocs.domain.valueobject.RawChunk;

import java.io.Closeable;
import java.io.IOException;

/**
 * Where relayed bytes go. Every write is flushed before it returns.
 * An IOException from {@link #write} means the caller has gone away.
 */
public interface OutboundSink extends Closeable {

    void write(RawChunk chunk) throws IOException;

    @Override
    void close() throws IOException;
}
