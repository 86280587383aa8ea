package com.guildsentinel.core.audit;

import com.guildsentinel.core.model.AuditLogEntry;
import com.guildsentinel.core.model.ModerationAction;

import java.time.Instant;

/**
 * Optional filters for {@link AuditLog#query}. Unset fields match everything.
 */
public final class AuditQuery {

    private static final AuditQuery ALL = new AuditQuery(null, null, null);

    private final String userId;
    private final ModerationAction action;
    private final Instant since;

    private AuditQuery(String userId, ModerationAction action, Instant since) {
        this.userId = userId;
        this.action = action;
        this.since = since;
    }

    public static AuditQuery all() {
        return ALL;
    }

    public static AuditQuery forUser(String userId) {
        return new AuditQuery(userId, null, null);
    }

    public static AuditQuery forAction(ModerationAction action) {
        return new AuditQuery(null, action, null);
    }

    public AuditQuery withUser(String userId) {
        return new AuditQuery(userId, action, since);
    }

    public AuditQuery withAction(ModerationAction action) {
        return new AuditQuery(userId, action, since);
    }

    /** Keep entries at or after {@code since}. */
    public AuditQuery withSince(Instant since) {
        return new AuditQuery(userId, action, since);
    }

    public boolean matches(AuditLogEntry entry) {
        if (userId != null && !userId.equals(entry.getUserId())) {
            return false;
        }
        if (action != null && action != entry.getAction()) {
            return false;
        }
        return since == null || (entry.getTimestamp() != null && !entry.getTimestamp().isBefore(since));
    }

    public String getUserId() {
        return userId;
    }

    public ModerationAction getAction() {
        return action;
    }

    public Instant getSince() {
        return since;
    }

    @Override
    public String toString() {
        return "AuditQuery{userId=" + userId + ", action=" + action + ", since=" + since + '}';
    }
}
