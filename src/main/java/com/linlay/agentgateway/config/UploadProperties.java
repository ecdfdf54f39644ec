package com.linlay.agentgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "agent.upload")
public class UploadProperties {

    public static final long DEFAULT_MAX_SIZE_BYTES = 10L * 1024 * 1024;

    private long maxSizeBytes = DEFAULT_MAX_SIZE_BYTES;
    private List<String> allowedTypes = new ArrayList<>(List.of(
            "application/pdf",
            "image/png",
            "image/jpeg",
            "image/jpg"
    ));

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }

    public void setMaxSizeBytes(long maxSizeBytes) {
        this.maxSizeBytes = maxSizeBytes;
    }

    public List<String> getAllowedTypes() {
        return allowedTypes;
    }

    public void setAllowedTypes(List<String> allowedTypes) {
        this.allowedTypes = allowedTypes == null ? new ArrayList<>() : allowedTypes;
    }
}
