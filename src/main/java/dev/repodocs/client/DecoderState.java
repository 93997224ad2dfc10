package dev.repodocs.client;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Carry-over between reads: the unterminated tail of the last chunk, the kind of the frame
 * being assembled, and its data lines so far. Exclusive to one stream.
 */
final class DecoderState {

    private final ByteArrayOutputStream partialLine = new ByteArrayOutputStream();
    private final StringBuilder data = new StringBuilder();
    private String pendingKind = "";
    private boolean hasData;

    void appendToLine(byte b) {
        partialLine.write(b);
    }

    /** Completes the buffered line, dropping a CR that preceded the LF. */
    String takeLine() {
        String line = partialLine.toString(StandardCharsets.UTF_8);
        partialLine.reset();
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    boolean hasPartialLine() {
        return partialLine.size() > 0;
    }

    String pendingKind() {
        return pendingKind;
    }

    void pendingKind(String kind) {
        this.pendingKind = kind;
    }

    void appendData(String line) {
        if (hasData) data.append('\n');
        data.append(line);
        hasData = true;
    }

    boolean hasFrame() {
        return hasData || !pendingKind.isEmpty();
    }

    String data() {
        return data.toString();
    }

    void clearFrame() {
        pendingKind = "";
        data.setLength(0);
        hasData = false;
    }
}
