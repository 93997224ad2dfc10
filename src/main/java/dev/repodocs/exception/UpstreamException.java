package dev.repodocs.exception;

/**
 * The generation service could not be reached or answered with a failure status.
 * Raised before any byte is forwarded, or while reading a relay that is already streaming.
 */
public class UpstreamException extends RuntimeException {

    private final int status;

    public UpstreamException(String message) {
        this(message, 0, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public UpstreamException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /** Upstream HTTP status, or 0 when the failure happened below HTTP. */
    public int getStatus() {
        return status;
    }
}
