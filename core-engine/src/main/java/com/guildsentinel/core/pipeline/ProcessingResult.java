package com.guildsentinel.core.pipeline;

import com.guildsentinel.core.model.AuditLogEntry;
import com.guildsentinel.core.model.Decision;
import com.guildsentinel.core.model.DecisionStage;

/**
 * Final state of one submitted message.
 */
public final class ProcessingResult {

    public enum Status {
        /** Decided, executed (if actionable) and audited as configured. */
        PROCESSED,
        /** Rejected at intake because the worker queue was full. */
        DROPPED,
        /** Deleted upstream before evaluation started. */
        RETRACTED,
        /** Author's partition is quarantined after an internal failure. */
        QUARANTINED,
        /** Author holds an exempt role. */
        EXEMPT,
        /** This event hit a partition-fatal failure. */
        FAILED
    }

    private final Status status;
    private final Decision decision;
    private final AuditLogEntry auditEntry;
    private final String detail;

    private ProcessingResult(Status status, Decision decision, AuditLogEntry auditEntry, String detail) {
        this.status = status;
        this.decision = decision;
        this.auditEntry = auditEntry;
        this.detail = detail;
    }

    public static ProcessingResult processed(Decision decision, AuditLogEntry auditEntry) {
        return new ProcessingResult(Status.PROCESSED, decision, auditEntry, null);
    }

    public static ProcessingResult skipped(Status status, String detail) {
        if (status == Status.PROCESSED) {
            throw new IllegalArgumentException("Use processed() for PROCESSED results");
        }
        return new ProcessingResult(status, null, null, detail);
    }

    public Status getStatus() {
        return status;
    }

    /** Terminal decision, or {@code null} when the event was not evaluated. */
    public Decision getDecision() {
        return decision;
    }

    /**
     * Furthest stage the message reached; {@link DecisionStage#INTAKE} when
     * it was never evaluated.
     */
    public DecisionStage getStage() {
        return decision != null ? decision.getStage() : DecisionStage.INTAKE;
    }

    /** Audit entry written for this event, or {@code null} when none was. */
    public AuditLogEntry getAuditEntry() {
        return auditEntry;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "ProcessingResult{status=" + status
                + (decision != null ? ", action=" + decision.getAction() : "")
                + (detail != null ? ", detail='" + detail + '\'' : "")
                + '}';
    }
}
