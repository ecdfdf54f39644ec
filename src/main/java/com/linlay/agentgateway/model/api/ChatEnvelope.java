package com.linlay.agentgateway.model.api;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.linlay.agentgateway.model.metadata.AgentMetadata;

import java.time.Instant;
import java.util.Map;

/**
 * Uniform answer shape for every text capability. Metadata, when present, is flattened into
 * the top-level object under the agent's field names ({@code sql_info}, {@code sources}, ...).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "response", "timestamp", "error"})
public record ChatEnvelope(
        boolean success,
        String response,
        String timestamp,
        String error,
        @JsonIgnore
        AgentMetadata metadata
) {

    public static ChatEnvelope of(boolean success, String response, String timestamp, AgentMetadata metadata) {
        return new ChatEnvelope(success, response, timestamp, null, metadata);
    }

    public static ChatEnvelope failure(String error, String response) {
        return new ChatEnvelope(false, response, Instant.now().toString(), error, null);
    }

    @JsonAnyGetter
    public Map<String, Object> metadataFields() {
        return metadata == null ? Map.of() : metadata.fields();
    }
}
