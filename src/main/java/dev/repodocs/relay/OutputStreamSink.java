package dev.repodocs.relay;

import dev.repodocs.domain.valueobject.RawChunk;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Sink over a servlet response stream. Closing flushes and stops further writes; the
 * stream itself belongs to the container, which completes the response afterwards.
 */
public class OutputStreamSink implements OutboundSink {

    private final OutputStream out;
    private boolean closed;

    public OutputStreamSink(OutputStream out) {
        this.out = out;
    }

    @Override
    public void write(RawChunk chunk) throws IOException {
        if (closed) throw new IOException("Sink already closed");
        chunk.writeTo(out);
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        out.flush();
    }
}
