package com.linlay.agentgateway.model.metadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RetrievalMetadata(List<RetrievalSource> sources) implements AgentMetadata {

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (sources != null) {
            fields.put("sources", sources);
        }
        return fields;
    }
}
