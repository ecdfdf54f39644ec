package com.linlay.agentgateway.dispatch;

import java.time.Duration;

/**
 * Resilience settings for one capability. The timeout bounds each attempt; retries only cover
 * connection failures, where the agent never saw the request.
 */
public record DispatchPolicy(
        Duration timeout,
        int maxRetries,
        Duration backoff
) {

    public DispatchPolicy {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        backoff = backoff == null || backoff.isNegative() ? Duration.ZERO : backoff;
    }
}
