package dev.repodocs.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Global exception handler using RFC 7807 Problem Details.
 *
 * <p>Only failures that happen before a relay response is committed end up here; once the
 * event stream is flowing, the status line has already been sent and the relay handles
 * its own failures. Internal exception messages are logged, not returned, except for the
 * upstream ones, which only describe the generation service's reply.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Invalid Request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Request body is not valid JSON.", "bad-request", "Invalid Request");
    }

    @ExceptionHandler(OwnerAuthenticationException.class)
    public ProblemDetail handleOwnerAuthentication(OwnerAuthenticationException ex) {
        log.warn("Owner assertion rejected: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Owner identity could not be verified.",
                "unauthorized", "Unauthorized");
    }

    @ExceptionHandler(ProjectNotFoundException.class)
    public ProblemDetail handleNotFound(ProjectNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found", "Not Found");
    }

    @ExceptionHandler(UpstreamTimeoutException.class)
    public ProblemDetail handleUpstreamTimeout(UpstreamTimeoutException ex) {
        log.warn("Upstream timed out: {}", ex.getMessage());
        return problem(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), "upstream-timeout", "Gateway Timeout");
    }

    @ExceptionHandler(UpstreamException.class)
    public ProblemDetail handleUpstream(UpstreamException ex) {
        log.warn("Upstream failure: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_GATEWAY, ex.getMessage(), "upstream", "Bad Gateway");
        if (ex.getStatus() > 0) {
            problem.setProperty("upstreamStatus", ex.getStatus());
        }
        return problem;
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Generation service temporarily unavailable. Please retry later.",
                "service-unavailable", "Service Unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.",
                "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://repodocs.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
