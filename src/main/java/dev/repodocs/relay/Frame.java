package dev.repodocs.relay;

import dev.repodocs.domain.enums.FrameKind;

import java.nio.charset.StandardCharsets;

/**
 * One unit of the relay wire protocol: {@code event: <kind>\ndata: <json>\n\n}.
 * The data is a single-line JSON document.
 */
public record Frame(FrameKind kind, String data) {

    public Frame {
        if (kind == null) throw new IllegalArgumentException("kind required");
        if (data == null || data.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("data must be a single line");
        }
    }

    public byte[] encode() {
        return ("event: " + kind.wireName() + "\ndata: " + data + "\n\n").getBytes(StandardCharsets.UTF_8);
    }
}
