package com.linlay.agentgateway.service;

import com.linlay.agentgateway.model.Capability;

/**
 * A classified request failure. The message is safe to show to callers.
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    public GatewayException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static GatewayException invalidInput(String message) {
        return new GatewayException(ErrorKind.INVALID_INPUT, message);
    }

    public static GatewayException unavailable(Capability capability, Throwable cause) {
        return new GatewayException(
                ErrorKind.DOWNSTREAM_UNAVAILABLE,
                capability.serviceLabel() + " service is unavailable",
                cause
        );
    }

    public static GatewayException timeout(Capability capability, Throwable cause) {
        return new GatewayException(
                ErrorKind.DOWNSTREAM_TIMEOUT,
                capability.serviceLabel() + " service timeout",
                cause
        );
    }

    public static GatewayException downstreamError(Capability capability, Throwable cause) {
        return new GatewayException(
                ErrorKind.DOWNSTREAM_ERROR,
                "Failed to communicate with " + capability.agentLabel(),
                cause
        );
    }

    public ErrorKind kind() {
        return kind;
    }
}
