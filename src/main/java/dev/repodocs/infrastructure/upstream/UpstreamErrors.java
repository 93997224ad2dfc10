package dev.repodocs.infrastructure.upstream;

import dev.repodocs.exception.UpstreamException;
import dev.repodocs.exception.UpstreamTimeoutException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient and Reactor failures onto the relay's upstream exceptions.
 */
final class UpstreamErrors {

    private UpstreamErrors() {}

    static UpstreamException translate(Throwable error) {
        if (error instanceof UpstreamException upstream) return upstream;
        if (error instanceof WebClientResponseException response) {
            return new UpstreamException("Generation service answered " + response.getStatusCode().value(),
                    response.getStatusCode().value(), response);
        }
        if (error instanceof WebClientRequestException request) {
            return new UpstreamException("Generation service unreachable: " + request.getMostSpecificCause().getMessage(), request);
        }
        return new UpstreamException("Generation service call failed: " + error.getMessage(), error);
    }

    /**
     * Like {@link #translate} but keeps timeouts and open-circuit rejections distinguishable.
     */
    static RuntimeException translate(Throwable error, Duration deadline) {
        if (error instanceof CallNotPermittedException rejected) return rejected;
        if (error instanceof TimeoutException) return new UpstreamTimeoutException(deadline);
        return translate(error);
    }
}
