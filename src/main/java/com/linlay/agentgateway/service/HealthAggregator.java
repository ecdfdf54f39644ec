package com.linlay.agentgateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentgateway.dispatch.AgentClient;
import com.linlay.agentgateway.dispatch.DispatchTable;
import com.linlay.agentgateway.model.api.HealthReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Gateway liveness combined with one bounded health check of the agent service. Check failures are
 * reported to callers only as {@code down}; the cause goes to the log.
 */
@Service
public class HealthAggregator {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    static final String UP = "up";
    static final String DOWN = "down";
    private static final Set<String> HEALTHY_STATUSES = Set.of("healthy", "up", "ok");

    private final AgentClient agentClient;
    private final DispatchTable dispatchTable;

    public HealthAggregator(AgentClient agentClient, DispatchTable dispatchTable) {
        this.agentClient = agentClient;
        this.dispatchTable = dispatchTable;
    }

    public Mono<HealthReport> check() {
        return agentClient.checkHealth(dispatchTable.healthUri(), dispatchTable.healthTimeout())
                .map(this::fromHealthBody)
                .defaultIfEmpty(report(HealthReport.HEALTHY, UP))
                .onErrorResume(ex -> {
                    log.warn("Downstream health check failed uri={}, timeoutMs={}, cause={}",
                            dispatchTable.healthUri(), dispatchTable.healthTimeout().toMillis(), ex.toString());
                    return Mono.just(report(HealthReport.UNHEALTHY, DOWN));
                });
    }

    private HealthReport fromHealthBody(JsonNode body) {
        String observed = body == null ? null : body.path("status").asText(null);
        if (!StringUtils.hasText(observed)) {
            return report(HealthReport.HEALTHY, UP);
        }
        boolean healthy = HEALTHY_STATUSES.contains(observed.trim().toLowerCase(Locale.ROOT));
        if (!healthy) {
            log.info("Downstream reports status={}", observed);
        }
        return report(healthy ? HealthReport.HEALTHY : HealthReport.UNHEALTHY, observed);
    }

    private HealthReport report(String status, String downstream) {
        return new HealthReport(status, new HealthReport.Services(UP, downstream), Instant.now().toString());
    }
}
