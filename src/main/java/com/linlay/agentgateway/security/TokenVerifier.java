package com.linlay.agentgateway.security;

import java.util.Optional;

/**
 * Turns a bearer token into a caller identity. Implementations are swapped through
 * {@code agent.auth.mode} without touching dispatch code.
 */
public interface TokenVerifier {

    Optional<CallerPrincipal> verify(String token);
}
