package com.guildsentinel.core.window;

import com.guildsentinel.core.model.PartitionKey;

/**
 * Internal invariant violation confined to one (guild, user) partition.
 *
 * <p>
 * The pipeline quarantines the partition and keeps serving every other one.
 * </p>
 *
 * @since 1.0.0
 */
public class PartitionFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient PartitionKey key;

    public PartitionFailureException(PartitionKey key, String message) {
        super("Partition " + key + " failed: " + message);
        this.key = key;
    }

    public PartitionKey getKey() {
        return key;
    }
}
