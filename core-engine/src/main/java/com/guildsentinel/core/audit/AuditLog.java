package com.guildsentinel.core.audit;

import com.guildsentinel.core.model.AuditLogEntry;

import java.util.List;

/**
 * Durable, append-only record of moderation decisions.
 *
 * @since 1.0.0
 */
public interface AuditLog {

    /**
     * Persist an entry. Once this returns the entry survives a restart.
     *
     * @param entry entry to store; must carry a guild id
     * @throws AuditWriteException if the entry could not be persisted
     */
    void append(AuditLogEntry entry);

    /**
     * Entries of one guild matching the filters, newest first.
     *
     * @param guildId guild to read
     * @param filters optional user / action filters
     * @param limit   maximum number of entries; must be positive
     * @return at most {@code limit} entries in reverse chronological order
     */
    List<AuditLogEntry> query(String guildId, AuditQuery filters, int limit);
}
