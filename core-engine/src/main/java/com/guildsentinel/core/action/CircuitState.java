package com.guildsentinel.core.action;

/**
 * States of an {@link EndpointBreaker}.
 */
public enum CircuitState {
    /** Calls pass through; transient failures are counted. */
    CLOSED,
    /** Calls fail fast until the cool-down elapses. */
    OPEN,
    /** One trial call is allowed to test recovery. */
    HALF_OPEN
}
