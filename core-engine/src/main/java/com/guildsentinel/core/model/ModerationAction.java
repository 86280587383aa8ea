package com.guildsentinel.core.model;

/**
 * Verdict of the decision engine, ordered by severity.
 */
public enum ModerationAction {
    NONE,
    WARN,
    MUTE;

    public boolean isActionable() {
        return this != NONE;
    }
}
