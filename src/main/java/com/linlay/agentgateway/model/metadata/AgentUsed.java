package com.linlay.agentgateway.model.metadata;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AgentUsed {

    DATABASE("database", true, false),
    RAG("rag", false, true),
    BOTH("both", true, true);

    private final String value;
    private final boolean database;
    private final boolean retrieval;

    AgentUsed(String value, boolean database, boolean retrieval) {
        this.value = value;
        this.database = database;
        this.retrieval = retrieval;
    }

    public String value() {
        return value;
    }

    public boolean expectsDatabase() {
        return database;
    }

    public boolean expectsRetrieval() {
        return retrieval;
    }

    public static Optional<AgentUsed> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(agentUsed -> agentUsed.value.equals(normalized))
                .findFirst();
    }
}
