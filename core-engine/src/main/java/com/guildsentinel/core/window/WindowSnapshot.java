package com.guildsentinel.core.window;

import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.PartitionKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable copy of a {@link UserWindow} taken at append time.
 *
 * <p>
 * Entries are in arrival order. When the snapshot was produced by
 * {@link WindowStore#record}, the last entry is the message being evaluated
 * and {@link #getLatestEvent()} returns its full event.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowSnapshot {

    private final PartitionKey key;
    private final List<WindowEntry> entries;
    private final MessageEvent latestEvent;
    private final Instant takenAt;

    public WindowSnapshot(PartitionKey key, List<WindowEntry> entries, MessageEvent latestEvent, Instant takenAt) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.entries = Collections.unmodifiableList(entries);
        this.latestEvent = latestEvent;
        this.takenAt = Objects.requireNonNull(takenAt, "takenAt must not be null");
    }

    public PartitionKey getKey() {
        return key;
    }

    public List<WindowEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return the most recently arrived entry, if any
     */
    public Optional<WindowEntry> latest() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    /**
     * @return the event that produced this snapshot, or {@code null} for a
     *         read-only snapshot
     */
    public MessageEvent getLatestEvent() {
        return latestEvent;
    }

    public Instant getTakenAt() {
        return takenAt;
    }

    /**
     * Count entries strictly newer than {@code takenAt - window}.
     *
     * @param window trailing sub-window
     * @return number of messages in it
     */
    public int countWithin(Duration window) {
        Instant cutoff = takenAt.minus(window);
        int count = 0;
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).getTimestamp().isAfter(cutoff)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "WindowSnapshot{key=" + key + ", size=" + entries.size() + ", takenAt=" + takenAt + '}';
    }
}
