package com.linlay.agentgateway.controller;

import com.linlay.agentgateway.model.Capability;
import com.linlay.agentgateway.model.api.ChatEnvelope;
import com.linlay.agentgateway.model.api.ChatRequest;
import com.linlay.agentgateway.model.api.DocumentEnvelope;
import com.linlay.agentgateway.model.api.HealthReport;
import com.linlay.agentgateway.security.AccessGateWebFilter;
import com.linlay.agentgateway.security.CallerPrincipal;
import com.linlay.agentgateway.service.ChatGatewayService;
import com.linlay.agentgateway.service.HealthAggregator;
import jakarta.validation.Valid;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/chat")
public class ChatController {

    private final ChatGatewayService chatGatewayService;
    private final HealthAggregator healthAggregator;

    public ChatController(ChatGatewayService chatGatewayService, HealthAggregator healthAggregator) {
        this.chatGatewayService = chatGatewayService;
        this.healthAggregator = healthAggregator;
    }

    /**
     * {@code POST /chat} is kept as an alias of the database route for older clients.
     */
    @PostMapping({"", "/database"})
    public Mono<ChatEnvelope> database(
            @Valid @RequestBody(required = false) ChatRequest request,
            @RequestAttribute(name = AccessGateWebFilter.PRINCIPAL_ATTR, required = false) CallerPrincipal caller
    ) {
        return chatGatewayService.chat(Capability.STRUCTURED_QUERY, request, caller);
    }

    @PostMapping("/rag")
    public Mono<ChatEnvelope> rag(
            @Valid @RequestBody(required = false) ChatRequest request,
            @RequestAttribute(name = AccessGateWebFilter.PRINCIPAL_ATTR, required = false) CallerPrincipal caller
    ) {
        return chatGatewayService.chat(Capability.RETRIEVAL, request, caller);
    }

    @PostMapping("/smart")
    public Mono<ChatEnvelope> smart(
            @Valid @RequestBody(required = false) ChatRequest request,
            @RequestAttribute(name = AccessGateWebFilter.PRINCIPAL_ATTR, required = false) CallerPrincipal caller
    ) {
        return chatGatewayService.chat(Capability.SMART_ROUTE, request, caller);
    }

    @PostMapping("/ocr")
    public Mono<DocumentEnvelope> ocr(@RequestPart(value = "file", required = false) FilePart file) {
        return chatGatewayService.analyzeDocument(file);
    }

    @RequestMapping(value = "/health", method = {RequestMethod.GET, RequestMethod.POST})
    public Mono<HealthReport> health() {
        return healthAggregator.check();
    }
}
