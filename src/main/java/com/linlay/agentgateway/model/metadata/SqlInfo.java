package com.linlay.agentgateway.model.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SqlInfo(
        @JsonProperty("queries_executed")
        List<QueryExecution> queriesExecuted,
        @JsonProperty("total_execution_time")
        Number totalExecutionTime,
        @JsonProperty("queries_count")
        Number queriesCount
) {
}
