package com.guildsentinel.core.window;

import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.PartitionKey;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Bounded recent-message history of one (guild, user).
 *
 * <p>
 * Entries are kept in arrival order, so the newest arrival is always last.
 * Events from different channels may arrive out of timestamp order, so the
 * age bound is applied to every entry, not only the first.
 * </p>
 *
 * <p>
 * Not thread-safe; {@link WindowStore} confines every access to the owning
 * map entry's lock.
 * </p>
 */
final class UserWindow {

    private final int maxMessages;
    private final Duration maxAge;
    private final Deque<WindowEntry> entries = new ArrayDeque<>();

    UserWindow(int maxMessages, Duration maxAge) {
        this.maxMessages = maxMessages;
        this.maxAge = maxAge;
    }

    void append(WindowEntry entry) {
        entries.addLast(entry);
        while (entries.size() > maxMessages) {
            entries.pollFirst();
        }
    }

    /**
     * Drop entries whose age at {@code now} has reached the age bound.
     *
     * @return number of entries removed
     */
    int evict(Instant now) {
        Instant cutoff = now.minus(maxAge);
        int before = entries.size();
        entries.removeIf(e -> !e.getTimestamp().isAfter(cutoff));
        return before - entries.size();
    }

    /**
     * Check the bounds after a mutation.
     *
     * @throws PartitionFailureException if a bound is violated
     */
    void verify(PartitionKey key, Instant now) {
        if (entries.size() > maxMessages) {
            throw new PartitionFailureException(key,
                    "window holds " + entries.size() + " entries, bound is " + maxMessages);
        }
        Instant cutoff = now.minus(maxAge);
        for (WindowEntry entry : entries) {
            if (!entry.getTimestamp().isAfter(cutoff)) {
                throw new PartitionFailureException(key,
                        "window retains entry " + entry.getMessageId() + " older than " + maxAge);
            }
        }
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    int size() {
        return entries.size();
    }

    WindowSnapshot snapshot(PartitionKey key, MessageEvent latest, Instant takenAt) {
        return new WindowSnapshot(key, new ArrayList<>(entries), latest, takenAt);
    }
}
