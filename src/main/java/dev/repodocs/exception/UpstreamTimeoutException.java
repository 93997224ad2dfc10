package dev.repodocs.exception;

import java.time.Duration;

/**
 * The relay deadline elapsed before the generation service finished.
 */
public class UpstreamTimeoutException extends UpstreamException {

    public UpstreamTimeoutException(Duration deadline) {
        super("Generation service did not finish within " + deadline);
    }
}
