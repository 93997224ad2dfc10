package dev.repodocs.domain.valueobject;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * An opaque byte segment exactly as the transport delivered it. No alignment with
 * line or frame boundaries is implied.
 */
public final class RawChunk {

    private final byte[] bytes;

    private RawChunk(byte[] bytes) {
        this.bytes = bytes;
    }

    /** Takes ownership of the array; the caller must not modify it afterwards. */
    public static RawChunk wrap(byte[] bytes) {
        return new RawChunk(bytes);
    }

    public int length() {
        return bytes.length;
    }

    public void writeTo(OutputStream out) throws IOException {
        out.write(bytes);
    }

    public void appendTo(ByteArrayOutputStream buffer) {
        buffer.write(bytes, 0, bytes.length);
    }
}
