package dev.repodocs.relay;

import java.util.Locale;

public enum RelayOutcome {
    /** Upstream closed normally; nothing was persisted. */
    COMPLETED,
    /** Upstream closed normally and a "saved" frame was appended. */
    PERSISTED,
    UPSTREAM_FAILED,
    CANCELLED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
