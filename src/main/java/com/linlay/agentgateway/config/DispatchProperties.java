package com.linlay.agentgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Downstream agent addresses and budgets, keyed by capability name
 * ({@code structured-query}, {@code retrieval}, {@code smart-route}, {@code document-understanding}).
 * A capability without its own {@code base-url} falls back to {@link #getBaseUrl()}.
 */
@ConfigurationProperties(prefix = "agent.dispatch")
public class DispatchProperties {

    private String baseUrl = "http://localhost:8000";
    private String healthUrl;
    private long healthTimeoutMs = 3000;
    private long connectTimeoutMs = 2000;
    private Map<String, CapabilityConfig> capabilities = new LinkedHashMap<>();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getHealthUrl() {
        return healthUrl;
    }

    public void setHealthUrl(String healthUrl) {
        this.healthUrl = healthUrl;
    }

    public long getHealthTimeoutMs() {
        return healthTimeoutMs;
    }

    public void setHealthTimeoutMs(long healthTimeoutMs) {
        this.healthTimeoutMs = healthTimeoutMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public Map<String, CapabilityConfig> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(Map<String, CapabilityConfig> capabilities) {
        this.capabilities = capabilities == null ? new LinkedHashMap<>() : capabilities;
    }

    public CapabilityConfig getCapability(String key) {
        return capabilities.get(key);
    }

    public static class CapabilityConfig {
        public static final long DEFAULT_BACKOFF_MS = 500;

        private String baseUrl;
        private String path;
        private Long timeoutMs;
        private int maxRetries = 0;
        private long backoffMs = DEFAULT_BACKOFF_MS;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBackoffMs() {
            return backoffMs;
        }

        public void setBackoffMs(long backoffMs) {
            this.backoffMs = backoffMs;
        }
    }
}
