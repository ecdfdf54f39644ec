package com.linlay.agentgateway.service;

import com.linlay.agentgateway.config.GatewayLogProperties;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Trace ids, timings and payload rendering for dispatch logs. Message bodies are only rendered
 * when payload logging is switched on.
 */
@Component
public class GatewayCallLogger {

    private final boolean payload;
    private final boolean maskSensitive;
    private final int maxPayloadChars;

    public GatewayCallLogger(GatewayLogProperties properties) {
        this.payload = properties != null && properties.isPayload();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
        this.maxPayloadChars = properties == null ? 200 : properties.getMaxPayloadChars();
    }

    public String generateTraceId() {
        return "gw-" + UUID.randomUUID().toString().replace("-", "");
    }

    public long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    public String describePayload(String text) {
        int length = text == null ? 0 : text.length();
        if (!payload) {
            return "<redacted length=" + length + ">";
        }
        return GatewayLogSanitizer.truncate(GatewayLogSanitizer.maskText(text, maskSensitive), maxPayloadChars);
    }
}
