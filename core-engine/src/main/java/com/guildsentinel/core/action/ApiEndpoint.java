package com.guildsentinel.core.action;

/**
 * Outbound call kinds. Each has its own circuit breaker.
 */
public enum ApiEndpoint {
    MUTE("mute"),
    DELETE_MESSAGE("delete"),
    WARN("warn");

    private final String label;

    ApiEndpoint(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
