package com.linlay.agentgateway.model.metadata;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code sqlInfo} is the typed view used by the gateway; {@code source} is the agent's block as
 * received and is what callers see, so fields the typed view does not model survive untouched.
 */
public record StructuredQueryMetadata(SqlInfo sqlInfo, JsonNode source) implements AgentMetadata {

    public StructuredQueryMetadata {
        Objects.requireNonNull(sqlInfo, "sqlInfo");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("sql_info", source);
        return fields;
    }
}
