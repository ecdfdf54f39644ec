package com.linlay.agentgateway.model.metadata;

import java.util.Map;

/**
 * Agent-specific details attached to a chat envelope. One variant per capability.
 * {@link #fields()} returns the variant under the agent's own wire names so the envelope
 * can flatten them next to {@code success} and {@code response}.
 */
public sealed interface AgentMetadata
        permits StructuredQueryMetadata, RetrievalMetadata, SmartRouteMetadata, DocumentMetadata {

    Map<String, Object> fields();
}
