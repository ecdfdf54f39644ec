package com.linlay.agentgateway.model.api;

public record HealthReport(
        String status,
        Services services,
        String timestamp
) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public record Services(
            String gateway,
            String downstream
    ) {
    }
}
