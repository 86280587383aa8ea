package com.guildsentinel.core.model;

/**
 * Lifecycle of a single message through the pipeline.
 *
 * <pre>
 *   INTAKE → EVALUATED → DECIDED → (ESCALATED) → TERMINAL
 * </pre>
 *
 * <ul>
 * <li>{@code INTAKE}: accepted but never evaluated (dropped, retracted,
 * exempt, quarantined, or failed while recording the window)</li>
 * <li>{@code EVALUATED}: rules ran and the combined score reached no band</li>
 * <li>{@code DECIDED}: a warn or first-offense mute was decided</li>
 * <li>{@code ESCALATED}: a repeat-offense mute was decided</li>
 * <li>{@code TERMINAL}: the executor's outcome is attached</li>
 * </ul>
 */
public enum DecisionStage {
    INTAKE,
    EVALUATED,
    DECIDED,
    ESCALATED,
    TERMINAL
}
