package com.linlay.agentgateway.model.metadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing decision of the smart agent plus whichever of the database and retrieval blocks it
 * chose to return. Either block may be {@code null}.
 */
public record SmartRouteMetadata(
        String agentUsed,
        RoutingInfo routing,
        StructuredQueryMetadata database,
        RetrievalMetadata retrieval
) implements AgentMetadata {

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (agentUsed != null) {
            fields.put("agent_used", agentUsed);
        }
        if (routing != null) {
            fields.put("routing_info", routing);
        }
        if (database != null) {
            fields.putAll(database.fields());
        }
        if (retrieval != null) {
            fields.putAll(retrieval.fields());
        }
        return fields;
    }
}
