package com.linlay.agentgateway.service;

import com.linlay.agentgateway.dispatch.AgentClient;
import com.linlay.agentgateway.dispatch.DispatchTable;
import com.linlay.agentgateway.dispatch.DownstreamTarget;
import com.linlay.agentgateway.model.BinaryPayload;
import com.linlay.agentgateway.model.Capability;
import com.linlay.agentgateway.model.api.ChatEnvelope;
import com.linlay.agentgateway.model.api.ChatRequest;
import com.linlay.agentgateway.model.api.DocumentEnvelope;
import com.linlay.agentgateway.security.CallerPrincipal;
import com.linlay.agentgateway.service.AccessGate.ChatCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Request pipeline: validate, pick the target, make one downstream call, normalise the answer.
 */
@Service
public class ChatGatewayService {

    private static final Logger log = LoggerFactory.getLogger(ChatGatewayService.class);

    private final AccessGate accessGate;
    private final UploadValidator uploadValidator;
    private final DispatchTable dispatchTable;
    private final AgentClient agentClient;
    private final ResponseNormalizer normalizer;
    private final GatewayCallLogger callLogger;

    public ChatGatewayService(
            AccessGate accessGate,
            UploadValidator uploadValidator,
            DispatchTable dispatchTable,
            AgentClient agentClient,
            ResponseNormalizer normalizer,
            GatewayCallLogger callLogger
    ) {
        this.accessGate = accessGate;
        this.uploadValidator = uploadValidator;
        this.dispatchTable = dispatchTable;
        this.agentClient = agentClient;
        this.normalizer = normalizer;
        this.callLogger = callLogger;
    }

    public Mono<ChatEnvelope> chat(Capability capability, ChatRequest request, CallerPrincipal caller) {
        return Mono.defer(() -> {
            ChatCommand command = accessGate.admit(capability, request, caller);
            DownstreamTarget target = dispatchTable.target(capability);
            String traceId = callLogger.generateTraceId();
            long startNanos = System.nanoTime();

            log.info("[{}] Dispatching capability={}, role={}, uri={}, message={}",
                    traceId, capability.key(), command.role().value(), target.uri(),
                    callLogger.describePayload(command.message()));

            return agentClient.postJson(target, requestBody(command))
                    .map(body -> normalizer.normalize(capability, body))
                    .doOnSuccess(envelope -> {
                        if (envelope != null) {
                            log.info("[{}] Agent answered capability={}, success={}, elapsedMs={}",
                                    traceId, capability.key(), envelope.success(), callLogger.elapsedMs(startNanos));
                        }
                    })
                    .switchIfEmpty(Mono.error(() -> GatewayException.downstreamError(capability, null)))
                    .doOnError(GatewayException.class, ex -> logFailure(traceId, capability, ex, startNanos))
                    .doOnCancel(() -> log.info("[{}] Caller cancelled, aborted downstream call capability={}, elapsedMs={}",
                            traceId, capability.key(), callLogger.elapsedMs(startNanos)));
        });
    }

    public Mono<DocumentEnvelope> analyzeDocument(FilePart file) {
        Capability capability = Capability.DOCUMENT_UNDERSTANDING;
        return Mono.defer(() -> {
            DownstreamTarget target = dispatchTable.target(capability);
            String traceId = callLogger.generateTraceId();
            long startNanos = System.nanoTime();

            return uploadValidator.read(file)
                    .timeout(target.timeout())
                    .onErrorMap(TimeoutException.class, ex -> new GatewayException(
                            ErrorKind.DOWNSTREAM_TIMEOUT, "File upload timeout", ex))
                    .flatMap(payload -> relay(traceId, target, payload))
                    .doOnError(GatewayException.class, ex -> logFailure(traceId, capability, ex, startNanos))
                    .doOnCancel(() -> log.info("[{}] Caller cancelled, aborted document relay elapsedMs={}",
                            traceId, callLogger.elapsedMs(startNanos)));
        });
    }

    private Mono<DocumentEnvelope> relay(String traceId, DownstreamTarget target, BinaryPayload payload) {
        long startNanos = System.nanoTime();
        log.info("[{}] Relaying document capability={}, filename={}, mimeType={}, sizeBytes={}, uri={}",
                traceId, target.capability().key(), payload.filename(), payload.mimeType(), payload.sizeBytes(),
                target.uri());
        return agentClient.postFile(target, payload)
                .map(normalizer::normalizeDocument)
                .switchIfEmpty(Mono.error(() -> GatewayException.downstreamError(target.capability(), null)))
                .doOnSuccess(envelope -> log.info("[{}] Document agent answered success={}, alerts={}, elapsedMs={}",
                        traceId, envelope.success(), envelope.alerts().size(), callLogger.elapsedMs(startNanos)));
    }

    private Map<String, Object> requestBody(ChatCommand command) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", command.message());
        switch (command.capability()) {
            case STRUCTURED_QUERY, SMART_ROUTE -> body.put("user_role", command.role().value());
            case RETRIEVAL -> {
            }
            case DOCUMENT_UNDERSTANDING -> throw new IllegalStateException(
                    "document-understanding is relayed as multipart, not JSON");
        }
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    private void logFailure(String traceId, Capability capability, GatewayException ex, long startNanos) {
        if (ex.kind().status().is5xxServerError() || ex.kind() == ErrorKind.DOWNSTREAM_TIMEOUT) {
            log.warn("[{}] Dispatch failed capability={}, kind={}, elapsedMs={}, cause={}",
                    traceId, capability.key(), ex.kind(), callLogger.elapsedMs(startNanos),
                    ex.getCause() == null ? ex.getMessage() : ex.getCause().toString());
        } else {
            log.info("[{}] Request rejected capability={}, kind={}, reason={}",
                    traceId, capability.key(), ex.kind(), ex.getMessage());
        }
    }
}
