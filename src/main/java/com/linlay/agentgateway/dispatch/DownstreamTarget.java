package com.linlay.agentgateway.dispatch;

import com.linlay.agentgateway.model.Capability;

import java.net.URI;
import java.time.Duration;

public record DownstreamTarget(
        Capability capability,
        String baseUrl,
        String path,
        DispatchPolicy policy
) {

    public URI uri() {
        return join(baseUrl, path);
    }

    public Duration timeout() {
        return policy.timeout();
    }

    static URI join(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String suffix = path == null || path.isEmpty() ? "" : (path.startsWith("/") ? path : "/" + path);
        return URI.create(base + suffix);
    }
}
