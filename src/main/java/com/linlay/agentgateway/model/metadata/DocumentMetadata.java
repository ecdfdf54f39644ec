package com.linlay.agentgateway.model.metadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DocumentMetadata(
        String extractedText,
        String analysis,
        List<String> recommendations,
        List<String> alerts
) implements AgentMetadata {

    public DocumentMetadata {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("extracted_text", extractedText == null ? "" : extractedText);
        fields.put("analysis", analysis == null ? "" : analysis);
        fields.put("recommendations", recommendations);
        fields.put("alerts", alerts);
        return fields;
    }
}
