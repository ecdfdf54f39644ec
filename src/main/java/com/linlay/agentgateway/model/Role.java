package com.linlay.agentgateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Coarse access-level hint forwarded to agents that do their own authorization.
 */
public enum Role {

    EMPLOYEE("employee"),
    MANAGER("manager"),
    ADMIN("admin");

    public static final Role DEFAULT = EMPLOYEE;

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<Role> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.value.equals(normalized))
                .findFirst();
    }
}
