package com.linlay.agentgateway.model.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ChatRequest(
        @NotBlank(message = "Message is required")
        String message,
        @JsonProperty("user_role")
        @JsonAlias("role")
        String userRole
) {
}
