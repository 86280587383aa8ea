package com.guildsentinel.core.model;

import java.util.Objects;

/**
 * Identity of one independent unit of mutable state: a user inside a guild.
 *
 * @since 1.0.0
 */
public final class PartitionKey {

    private final String guildId;
    private final String userId;

    public PartitionKey(String guildId, String userId) {
        this.guildId = Objects.requireNonNull(guildId, "guildId must not be null");
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
    }

    public String getGuildId() {
        return guildId;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PartitionKey that)) {
            return false;
        }
        return guildId.equals(that.guildId) && userId.equals(that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(guildId, userId);
    }

    @Override
    public String toString() {
        return guildId + "/" + userId;
    }
}
