package dev.repodocs.controller;

import dev.repodocs.dto.request.GenerateRequest;
import dev.repodocs.infrastructure.dashboard.OwnerSignatureVerifier;
import dev.repodocs.relay.OutputStreamSink;
import dev.repodocs.relay.RelayTee;
import dev.repodocs.service.GenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.async.WebAsyncUtils;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import tools.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Generation endpoints called by the dashboard.
 *
 * <p>The stream endpoint opens upstream before returning, so an upstream that fails up front
 * gets a proper error status. After that the status line is committed and the relay owns
 * the response. The async request's timeout, error and completion callbacks cancel the relay.
 */
@RestController
@RequestMapping("/api/generate")
public class GenerateController {
    private static final Logger log = LoggerFactory.getLogger(GenerateController.class);

    static final String OWNER_HEADER = "X-Owner-Id";
    static final String SIGNATURE_HEADER = "X-Owner-Signature";

    private final GenerationService generationService;
    private final OwnerSignatureVerifier ownerVerifier;

    public GenerateController(GenerationService generationService, OwnerSignatureVerifier ownerVerifier) {
        this.generationService = generationService;
        this.ownerVerifier = ownerVerifier;
    }

    @PostMapping("/stream")
    public ResponseEntity<StreamingResponseBody> stream(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerId,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody GenerateRequest request,
            NativeWebRequest webRequest) {
        Optional<String> owner = ownerVerifier.resolveOwner(ownerId, signature);
        RelayTee relay = generationService.openRelay(request, owner);
        log.info("Streaming generation for {} (persisting={})", request.repoUrl(), relay.isPersisting());
        WebAsyncUtils.getAsyncManager(webRequest)
                .registerCallableInterceptor(RelayCancellingInterceptor.KEY, new RelayCancellingInterceptor(relay));

        StreamingResponseBody body = out -> relay.run(new OutputStreamSink(out));
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header("Connection", "keep-alive")
                .header("X-Accel-Buffering", "no")
                .body(body);
    }

    @PostMapping
    public ResponseEntity<JsonNode> generate(
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerId,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody GenerateRequest request) {
        Optional<String> owner = ownerVerifier.resolveOwner(ownerId, signature);
        if (request.isRefine()) {
            return ResponseEntity.ok(generationService.refine(request));
        }
        return ResponseEntity.ok(generationService.generate(request, owner));
    }
}
