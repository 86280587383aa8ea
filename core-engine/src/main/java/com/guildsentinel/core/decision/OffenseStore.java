package com.guildsentinel.core.decision;

import com.guildsentinel.core.model.PartitionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-(guild, user) offense records.
 *
 * <p>
 * Each key is updated inside its own map-entry lock, so two partitions never
 * contend with each other.
 * </p>
 *
 * @since 1.0.0
 */
public class OffenseStore {

    private static final Logger LOG = LoggerFactory.getLogger(OffenseStore.class);

    private final ConcurrentMap<PartitionKey, OffenseRecord> records = new ConcurrentHashMap<>();

    /**
     * @return current record, or {@code null}
     */
    public OffenseRecord peek(PartitionKey key) {
        return records.get(key);
    }

    /**
     * Plan and commit a mute atomically for one key.
     *
     * @param key    partition
     * @param now    instant of the offending message
     * @param base   guild's base mute duration
     * @param policy escalation policy
     * @return the committed escalation
     */
    public EscalationPolicy.Escalation escalate(PartitionKey key, Instant now, Duration base,
            EscalationPolicy policy) {
        EscalationPolicy.Escalation[] result = new EscalationPolicy.Escalation[1];
        records.compute(key, (k, prior) -> {
            result[0] = policy.plan(prior, now, base);
            return result[0].getNext();
        });
        return result[0];
    }

    /**
     * Drop records whose escalation window has elapsed.
     *
     * @param now    sweep instant
     * @param policy policy that defines the window
     * @return number of records removed
     */
    public int evictExpired(Instant now, EscalationPolicy policy) {
        AtomicInteger removed = new AtomicInteger();
        for (PartitionKey key : records.keySet()) {
            records.computeIfPresent(key, (k, record) -> {
                if (policy.isActive(record, now)) {
                    return record;
                }
                removed.incrementAndGet();
                return null;
            });
        }
        if (removed.get() > 0) {
            LOG.debug("Evicted {} expired offense record(s)", removed.get());
        }
        return removed.get();
    }

    public void clear(PartitionKey key) {
        records.remove(key);
    }

    public int size() {
        return records.size();
    }
}
