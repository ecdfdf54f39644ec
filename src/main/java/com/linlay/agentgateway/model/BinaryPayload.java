package com.linlay.agentgateway.model;

/**
 * An uploaded file that passed validation. Lives only for the request that carried it.
 */
public record BinaryPayload(
        String filename,
        String mimeType,
        long sizeBytes,
        byte[] bytes
) {
}
