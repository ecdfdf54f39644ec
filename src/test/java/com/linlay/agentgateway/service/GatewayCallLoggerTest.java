package com.linlay.agentgateway.service;

import com.linlay.agentgateway.config.GatewayLogProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayCallLoggerTest {

    @Test
    void shouldRedactPayloadByDefault() {
        GatewayCallLogger logger = new GatewayCallLogger(new GatewayLogProperties());

        assertThat(logger.describePayload("my salary is 5000")).isEqualTo("<redacted length=17>");
        assertThat(logger.describePayload(null)).isEqualTo("<redacted length=0>");
    }

    @Test
    void shouldMaskAndTruncateWhenPayloadLoggingEnabled() {
        GatewayLogProperties properties = new GatewayLogProperties();
        properties.setPayload(true);
        properties.setMaxPayloadChars(40);
        GatewayCallLogger logger = new GatewayCallLogger(properties);

        String described = logger.describePayload("{\"password\":\"hunter2\",\"note\":\"" + "x".repeat(100) + "\"}");

        assertThat(described).doesNotContain("hunter2");
        assertThat(described).startsWith("{\"password\":\"***\"");
        assertThat(described).endsWith("chars)");
    }

    @Test
    void shouldGeneratePrefixedTraceIds() {
        GatewayCallLogger logger = new GatewayCallLogger(new GatewayLogProperties());

        String first = logger.generateTraceId();

        assertThat(first).startsWith("gw-").hasSize(35);
        assertThat(logger.generateTraceId()).isNotEqualTo(first);
    }
}
