package com.linlay.agentgateway.dispatch;

import com.linlay.agentgateway.config.DispatchProperties;
import com.linlay.agentgateway.model.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Capability to downstream address, path and budget. Built once from {@link DispatchProperties}
 * and read without locking afterwards.
 */
@Component
public class DispatchTable {

    private static final Logger log = LoggerFactory.getLogger(DispatchTable.class);
    private static final String DEFAULT_HEALTH_PATH = "/health";

    private final Map<Capability, DownstreamTarget> targets;
    private final URI healthUri;
    private final Duration healthTimeout;

    public DispatchTable(DispatchProperties properties) {
        for (String key : properties.getCapabilities().keySet()) {
            if (Capability.fromKey(key).isEmpty()) {
                throw new UnknownCapabilityException(key);
            }
        }

        Map<Capability, DownstreamTarget> resolved = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            DownstreamTarget target = resolve(capability, properties);
            resolved.put(capability, target);
            log.info("Dispatch target capability={}, uri={}, timeoutMs={}, maxRetries={}",
                    capability.key(), target.uri(), target.timeout().toMillis(), target.policy().maxRetries());
        }
        this.targets = Collections.unmodifiableMap(resolved);
        this.healthUri = resolveHealthUri(properties);
        this.healthTimeout = Duration.ofMillis(Math.max(100L, properties.getHealthTimeoutMs()));
    }

    public DownstreamTarget target(Capability capability) {
        DownstreamTarget target = capability == null ? null : targets.get(capability);
        if (target == null) {
            throw new UnknownCapabilityException(capability == null ? "null" : capability.key());
        }
        return target;
    }

    public DownstreamTarget target(String capabilityKey) {
        return target(Capability.fromKey(capabilityKey)
                .orElseThrow(() -> new UnknownCapabilityException(capabilityKey)));
    }

    public Map<Capability, DownstreamTarget> targets() {
        return targets;
    }

    public URI healthUri() {
        return healthUri;
    }

    public Duration healthTimeout() {
        return healthTimeout;
    }

    private DownstreamTarget resolve(Capability capability, DispatchProperties properties) {
        DispatchProperties.CapabilityConfig config = properties.getCapability(capability.key());
        String baseUrl = config != null && StringUtils.hasText(config.getBaseUrl())
                ? config.getBaseUrl().trim()
                : properties.getBaseUrl();
        if (!StringUtils.hasText(baseUrl)) {
            throw new UnknownCapabilityException(capability.key());
        }
        String path = config != null && StringUtils.hasText(config.getPath())
                ? config.getPath().trim()
                : capability.defaultPath();
        long timeoutMs = config != null && config.getTimeoutMs() != null
                ? config.getTimeoutMs()
                : capability.defaultTimeoutMs();
        int maxRetries = config == null ? 0 : config.getMaxRetries();
        long backoffMs = config == null ? DispatchProperties.CapabilityConfig.DEFAULT_BACKOFF_MS : config.getBackoffMs();

        DispatchPolicy policy;
        try {
            policy = new DispatchPolicy(Duration.ofMillis(timeoutMs), maxRetries, Duration.ofMillis(backoffMs));
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid dispatch policy for capability " + capability.key(), ex);
        }
        DownstreamTarget target = new DownstreamTarget(capability, baseUrl.trim(), path, policy);
        try {
            target.uri();
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid downstream URL for capability " + capability.key(), ex);
        }
        return target;
    }

    private URI resolveHealthUri(DispatchProperties properties) {
        if (StringUtils.hasText(properties.getHealthUrl())) {
            return URI.create(properties.getHealthUrl().trim());
        }
        String base = properties.getBaseUrl();
        if (!StringUtils.hasText(base)) {
            base = targets.get(Capability.STRUCTURED_QUERY).baseUrl();
        }
        return DownstreamTarget.join(base.trim(), DEFAULT_HEALTH_PATH);
    }
}
