package dev.repodocs.controller;

import dev.repodocs.relay.RelayTee;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.async.CallableProcessingInterceptor;

import java.util.concurrent.Callable;

/**
 * Ties a streaming relay to its servlet async request: a timeout, a container error (client
 * disconnect) or completion cancels the relay, which closes the upstream read.
 * Cancelling a relay that already finished does nothing.
 */
class RelayCancellingInterceptor implements CallableProcessingInterceptor {
    private static final Logger log = LoggerFactory.getLogger(RelayCancellingInterceptor.class);

    static final String KEY = RelayCancellingInterceptor.class.getName();

    private final RelayTee relay;

    RelayCancellingInterceptor(RelayTee relay) {
        this.relay = relay;
    }

    @Override
    public <T> Object handleTimeout(NativeWebRequest request, Callable<T> task) {
        log.info("Streaming request timed out, cancelling relay");
        relay.cancel();
        return RESULT_NONE;
    }

    @Override
    public <T> Object handleError(NativeWebRequest request, Callable<T> task, Throwable t) {
        log.info("Streaming request failed, cancelling relay: {}", t.getMessage());
        relay.cancel();
        return RESULT_NONE;
    }

    @Override
    public <T> void afterCompletion(NativeWebRequest request, Callable<T> task) {
        relay.cancel();
    }
}
