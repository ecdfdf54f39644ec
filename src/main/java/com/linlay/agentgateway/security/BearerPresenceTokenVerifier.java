package com.linlay.agentgateway.security;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Placeholder scheme: any non-blank bearer token is accepted. The token content is not inspected.
 */
@Component
@ConditionalOnProperty(prefix = "agent.auth", name = "mode", havingValue = "bearer", matchIfMissing = true)
public class BearerPresenceTokenVerifier implements TokenVerifier {

    @Override
    public Optional<CallerPrincipal> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        return Optional.of(CallerPrincipal.anonymous());
    }
}
