package com.linlay.agentgateway.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.linlay.agentgateway.model.metadata.DocumentMetadata;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "extracted_text", "analysis", "recommendations", "alerts", "timestamp", "error"})
public record DocumentEnvelope(
        boolean success,
        @JsonProperty("extracted_text")
        String extractedText,
        String analysis,
        List<String> recommendations,
        List<String> alerts,
        String timestamp,
        String error
) {

    public static DocumentEnvelope of(boolean success, DocumentMetadata metadata, String timestamp, String error) {
        return new DocumentEnvelope(
                success,
                metadata.extractedText() == null ? "" : metadata.extractedText(),
                metadata.analysis() == null ? "" : metadata.analysis(),
                metadata.recommendations(),
                metadata.alerts(),
                timestamp,
                error
        );
    }
}
