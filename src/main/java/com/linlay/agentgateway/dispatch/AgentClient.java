package com.linlay.agentgateway.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentgateway.model.BinaryPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Performs exactly one logical outbound call per inbound request. Every call is bounded by the
 * target's timeout; cancelling the returned {@link Mono} cancels the exchange.
 */
@Component
public class AgentClient {

    private static final Logger log = LoggerFactory.getLogger(AgentClient.class);

    private final WebClient webClient;

    public AgentClient(WebClient agentWebClient) {
        this.webClient = agentWebClient;
    }

    public Mono<JsonNode> postJson(DownstreamTarget target, Map<String, Object> body) {
        Mono<JsonNode> call = webClient.post()
                .uri(target.uri())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class);
        return guard(target, call);
    }

    public Mono<JsonNode> postFile(DownstreamTarget target, BinaryPayload payload) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new ByteArrayResource(payload.bytes()), MediaType.parseMediaType(payload.mimeType()))
                .filename(payload.filename());

        Mono<JsonNode> call = webClient.post()
                .uri(target.uri())
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .retrieve()
                .bodyToMono(JsonNode.class);
        return guard(target, call);
    }

    /**
     * Health check. Any non-2xx status, connection problem or timeout surfaces as an error signal.
     */
    public Mono<JsonNode> checkHealth(URI uri, Duration timeout) {
        return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout);
    }

    private Mono<JsonNode> guard(DownstreamTarget target, Mono<JsonNode> call) {
        DispatchPolicy policy = target.policy();
        Mono<JsonNode> bounded = call.timeout(policy.timeout());
        if (policy.maxRetries() > 0) {
            bounded = bounded.retryWhen(Retry.fixedDelay(policy.maxRetries(), policy.backoff())
                    .filter(DownstreamFailures::isUnreachable)
                    .doBeforeRetry(signal -> log.warn(
                            "Retrying downstream call capability={}, attempt={}, cause={}",
                            target.capability().key(),
                            signal.totalRetries() + 1,
                            signal.failure().toString()
                    ))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
        }
        return bounded.onErrorMap(ex -> DownstreamFailures.classify(target.capability(), ex));
    }
}
