package com.guildsentinel.core.decision;

import com.guildsentinel.core.model.PartitionKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OffenseStore}.
 */
class OffenseStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
    private static final PartitionKey KEY = new PartitionKey("g1", "u1");

    private final OffenseStore store = new OffenseStore();
    private final EscalationPolicy policy = EscalationPolicy.defaults();

    @Test
    @DisplayName("Should commit the planned record on escalate")
    void shouldCommit() {
        store.escalate(KEY, T0, Duration.ofHours(6), policy);
        EscalationPolicy.Escalation second = store.escalate(KEY, T0.plusSeconds(60), Duration.ofHours(6), policy);

        assertThat(second.getDuration()).isEqualTo(Duration.ofHours(12));
        assertThat(store.peek(KEY)).isEqualTo(new OffenseRecord(2, T0.plusSeconds(60)));
    }

    @Test
    @DisplayName("Should drop records whose window has elapsed")
    void shouldEvictExpired() {
        store.escalate(KEY, T0, Duration.ofHours(6), policy);
        store.escalate(new PartitionKey("g1", "u2"), T0.plus(Duration.ofHours(20)), Duration.ofHours(6), policy);

        int removed = store.evictExpired(T0.plus(Duration.ofHours(25)), policy);

        assertThat(removed).isEqualTo(1);
        assertThat(store.peek(KEY)).isNull();
        assertThat(store.size()).isEqualTo(1);
    }
}
