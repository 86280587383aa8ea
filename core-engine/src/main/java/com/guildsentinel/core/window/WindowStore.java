package com.guildsentinel.core.window;

import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.PartitionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sliding-window store keyed by (guild, user).
 *
 * <h3>Concurrency</h3>
 * <p>
 * Windows live in a {@link ConcurrentHashMap}; every mutation of one window
 * runs inside {@code compute}/{@code computeIfPresent} for its key, which
 * serialises writers of that key only. Snapshots are copied under the same
 * lock, so evaluators read them without holding anything.
 * </p>
 *
 * <h3>Bounds</h3>
 * <p>
 * A window keeps at most {@code maxMessages} entries and nothing whose age
 * has reached {@code maxAge}, whichever bound is hit first. Windows are
 * created lazily on first record and removed by {@link #evictExpired} once
 * empty.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowStore {

    private static final Logger LOG = LoggerFactory.getLogger(WindowStore.class);

    private final ConcurrentMap<PartitionKey, UserWindow> windows = new ConcurrentHashMap<>();
    private final int maxMessages;
    private final Duration maxAge;
    private final Fingerprinter fingerprinter;

    /**
     * @param maxMessages   count bound per window; must be &gt;= 1
     * @param maxAge        age bound per window; must be positive
     * @param fingerprinter content fingerprinter
     */
    public WindowStore(int maxMessages, Duration maxAge, Fingerprinter fingerprinter) {
        if (maxMessages < 1) {
            throw new IllegalArgumentException("maxMessages must be >= 1, got: " + maxMessages);
        }
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive, got: " + maxAge);
        }
        this.maxMessages = maxMessages;
        this.maxAge = maxAge;
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter must not be null");
    }

    /**
     * Append an event to its author's window and return a snapshot that
     * includes it.
     *
     * @param event inbound message
     * @return snapshot taken at the event's receive time
     * @throws PartitionFailureException if the window violates its bounds
     */
    public WindowSnapshot record(MessageEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        PartitionKey key = event.partitionKey();
        Instant now = event.getReceivedAt();
        WindowEntry entry = new WindowEntry(event.getMessageId(), event.getChannelId(), now,
                fingerprinter.fingerprint(event));

        WindowSnapshot[] result = new WindowSnapshot[1];
        windows.compute(key, (k, window) -> {
            UserWindow w = window != null ? window : new UserWindow(maxMessages, maxAge);
            w.append(entry);
            w.evict(now);
            w.verify(k, now);
            result[0] = w.snapshot(k, event, now);
            return w;
        });
        return result[0];
    }

    /**
     * Read-only snapshot at {@code now}, after applying age eviction.
     *
     * @param key partition
     * @param now evaluation instant
     * @return snapshot, empty if the user has no window
     */
    public WindowSnapshot snapshot(PartitionKey key, Instant now) {
        WindowSnapshot[] result = new WindowSnapshot[1];
        windows.computeIfPresent(key, (k, w) -> {
            w.evict(now);
            result[0] = w.snapshot(k, null, now);
            return w.isEmpty() ? null : w;
        });
        return result[0] != null ? result[0] : new WindowSnapshot(key, List.of(), null, now);
    }

    /**
     * Evict aged entries from every window and drop windows left empty.
     *
     * @param now sweep instant
     * @return number of windows removed
     */
    public int evictExpired(Instant now) {
        AtomicInteger removed = new AtomicInteger();
        for (PartitionKey key : windows.keySet()) {
            windows.computeIfPresent(key, (k, w) -> {
                w.evict(now);
                if (w.isEmpty()) {
                    removed.incrementAndGet();
                    return null;
                }
                return w;
            });
        }
        if (removed.get() > 0) {
            LOG.debug("Evicted {} idle window(s), {} remain", removed.get(), windows.size());
        }
        return removed.get();
    }

    /**
     * Forget one partition entirely.
     *
     * @param key partition to clear
     */
    public void clear(PartitionKey key) {
        windows.remove(key);
    }

    /**
     * @return number of live windows
     */
    public int size() {
        return windows.size();
    }

    public int getMaxMessages() {
        return maxMessages;
    }

    public Duration getMaxAge() {
        return maxAge;
    }
}
