package com.linlay.agentgateway.model.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Why the smart agent picked the agent(s) it did.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingInfo(
        String agent,
        Number confidence,
        String reasoning
) {
}
