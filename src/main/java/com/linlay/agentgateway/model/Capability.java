package com.linlay.agentgateway.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Logical operation a caller asks for; the dispatch key.
 */
public enum Capability {

    STRUCTURED_QUERY("structured-query", "Agent", "agent", "/chat", 30_000L),
    RETRIEVAL("retrieval", "RAG", "RAG agent", "/rag", 30_000L),
    SMART_ROUTE("smart-route", "Smart agent", "smart agent", "/smart", 30_000L),
    DOCUMENT_UNDERSTANDING("document-understanding", "OCR", "OCR agent", "/ocr", 120_000L);

    private final String key;
    private final String serviceLabel;
    private final String agentLabel;
    private final String defaultPath;
    private final long defaultTimeoutMs;

    Capability(String key, String serviceLabel, String agentLabel, String defaultPath, long defaultTimeoutMs) {
        this.key = key;
        this.serviceLabel = serviceLabel;
        this.agentLabel = agentLabel;
        this.defaultPath = defaultPath;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public String key() {
        return key;
    }

    /**
     * Name used in caller-facing messages, e.g. "RAG service is unavailable".
     */
    public String serviceLabel() {
        return serviceLabel;
    }

    public String agentLabel() {
        return agentLabel;
    }

    public String defaultPath() {
        return defaultPath;
    }

    public long defaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public static Optional<Capability> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(capability -> capability.key.equals(normalized))
                .findFirst();
    }
}
