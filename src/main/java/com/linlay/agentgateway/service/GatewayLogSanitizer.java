package com.linlay.agentgateway.service;

import java.util.regex.Pattern;

/**
 * Masks bearer tokens and JSON secret fields in text that is about to be logged.
 */
public final class GatewayLogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|refresh[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");

    private GatewayLogSanitizer() {
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null || text.isEmpty() || !maskSensitive) {
            return text == null ? "" : text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        return BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...(" + text.length() + " chars)";
    }
}
