package dev.repodocs.domain.enums;

/**
 * Client-side lifecycle of one generation: IDLE → REQUESTING → STREAMING → COMPLETED | FAILED.
 * REQUESTING → FAILED when the relay answers without an event stream.
 */
public enum StreamState {
    IDLE, REQUESTING, STREAMING, COMPLETED, FAILED
}
