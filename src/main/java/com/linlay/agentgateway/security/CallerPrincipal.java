package com.linlay.agentgateway.security;

import com.linlay.agentgateway.model.Role;

import java.time.Instant;

/**
 * Verified caller. {@code role} is only set when the credential itself carries one.
 */
public record CallerPrincipal(
        String subject,
        Role role,
        Instant issuedAt,
        Instant expiresAt
) {

    public static CallerPrincipal anonymous() {
        return new CallerPrincipal("anonymous", null, Instant.now(), null);
    }
}
