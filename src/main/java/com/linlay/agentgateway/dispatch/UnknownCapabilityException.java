package com.linlay.agentgateway.dispatch;

/**
 * A capability has no downstream target. Raised while the table is built, so a broken
 * configuration stops the application instead of failing requests.
 */
public class UnknownCapabilityException extends IllegalStateException {

    public UnknownCapabilityException(String capability) {
        super("No downstream target configured for capability: " + capability);
    }
}
