package com.linlay.agentgateway.service;

import com.linlay.agentgateway.model.Capability;
import com.linlay.agentgateway.model.Role;
import com.linlay.agentgateway.model.api.ChatRequest;
import com.linlay.agentgateway.security.CallerPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Admission of inbound chat requests after field validation. Credentials are checked earlier by
 * {@link com.linlay.agentgateway.security.AccessGateWebFilter}; role semantics are left to the agents.
 */
@Component
public class AccessGate {

    private static final Logger log = LoggerFactory.getLogger(AccessGate.class);

    static final String MESSAGE_REQUIRED = "Message is required";

    /**
     * Resolves the role hint: the request's {@code user_role} first, then the role carried by the
     * caller's credential, then {@link Role#DEFAULT}.
     */
    public ChatCommand admit(Capability capability, ChatRequest request, CallerPrincipal caller) {
        if (request == null) {
            log.info("Rejected request capability={}, reason=missing-body", capability.key());
            throw GatewayException.invalidInput(MESSAGE_REQUIRED);
        }

        Role role = resolveRole(capability, request.userRole(), caller);
        log.debug("Accepted request capability={}, role={}, messageLength={}",
                capability.key(), role.value(), request.message() == null ? 0 : request.message().length());
        return new ChatCommand(capability, request.message(), role);
    }

    private Role resolveRole(Capability capability, String rawRole, CallerPrincipal caller) {
        if (!StringUtils.hasText(rawRole)) {
            return caller != null && caller.role() != null ? caller.role() : Role.DEFAULT;
        }
        return Role.parse(rawRole).orElseThrow(() -> {
            log.info("Rejected request capability={}, reason=unknown-role", capability.key());
            return GatewayException.invalidInput("Invalid user_role. Expected one of: employee, manager, admin");
        });
    }

    public record ChatCommand(
            Capability capability,
            String message,
            Role role
    ) {
    }
}
