package com.linlay.agentgateway.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentgateway.config.AppAuthProperties;
import com.linlay.agentgateway.model.api.ChatEnvelope;
import com.linlay.agentgateway.service.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Credential check for every {@code /chat} route except health. Runs before the body is read,
 * so a rejected request never reaches a downstream agent.
 */
@Component
public class AccessGateWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessGateWebFilter.class);

    public static final String PRINCIPAL_ATTR = "GATEWAY_CALLER_PRINCIPAL";

    private static final String AUTH_PREFIX = "Bearer ";
    private static final String GATED_PATH = "/chat";
    private static final String HEALTH_PATH = "/chat/health";

    private final AppAuthProperties authProperties;
    private final TokenVerifier tokenVerifier;
    private final ObjectMapper objectMapper;

    public AccessGateWebFilter(AppAuthProperties authProperties, TokenVerifier tokenVerifier, ObjectMapper objectMapper) {
        this.authProperties = authProperties;
        this.tokenVerifier = tokenVerifier;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!authProperties.isEnabled()) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        if (!isGated(path)) {
            return chain.filter(exchange);
        }

        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
            return chain.filter(exchange);
        }

        String token = resolveBearerToken(exchange);
        if (token == null) {
            log.info("Rejected request path={}, reason=missing-or-malformed-authorization", path);
            return writeUnauthorized(exchange);
        }
        CallerPrincipal principal = tokenVerifier.verify(token).orElse(null);
        if (principal == null) {
            log.info("Rejected request path={}, reason=token-not-verified", path);
            return writeUnauthorized(exchange);
        }

        log.debug("Accepted caller path={}, subject={}", path, principal.subject());
        exchange.getAttributes().put(PRINCIPAL_ATTR, principal);
        return chain.filter(exchange);
    }

    private boolean isGated(String path) {
        if (!StringUtils.hasText(path)) {
            return false;
        }
        String normalized = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
        if (HEALTH_PATH.equals(normalized)) {
            return false;
        }
        return normalized.equals(GATED_PATH) || normalized.startsWith(GATED_PATH + "/");
    }

    private String resolveBearerToken(ServerWebExchange exchange) {
        String authorization = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authorization)) {
            return null;
        }
        if (!authorization.startsWith(AUTH_PREFIX)) {
            return null;
        }
        String token = authorization.substring(AUTH_PREFIX.length()).trim();
        return StringUtils.hasText(token) ? token : null;
    }

    private Mono<Void> writeUnauthorized(ServerWebExchange exchange) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ChatEnvelope.failure(ErrorKind.UNAUTHENTICATED.name(), "Unauthorized"));
        } catch (JsonProcessingException ex) {
            body = "{\"success\":false,\"response\":\"Unauthorized\"}".getBytes(StandardCharsets.UTF_8);
        }
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }
}
