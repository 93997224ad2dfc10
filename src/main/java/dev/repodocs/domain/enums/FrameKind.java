package dev.repodocs.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Event kinds of the relay wire protocol. SAVED is never produced upstream; the relay
 * synthesizes it after persisting a result.
 */
public enum FrameKind {
    PROGRESS, DONE, ERROR, SAVED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FrameKind> fromWire(String kind) {
        if (kind == null) return Optional.empty();
        for (FrameKind k : values()) {
            if (k.wireName().equals(kind)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
