package ch.sbb.pulse.registry;

import ch.sbb.pulse.config.MonitorProperties;
import ch.sbb.pulse.store.InMemoryProbeResultStore;
import ch.sbb.pulse.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static ch.sbb.pulse.support.ProbeResults.error;
import static ch.sbb.pulse.support.ProbeResults.success;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProbeRetentionJob")
class ProbeRetentionJobTest {
    
    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
    
    @Test
    @DisplayName("Should delete probes older than the retention period")
    void shouldPurgeExpiredProbes() {
        InMemoryProbeResultStore store = new InMemoryProbeResultStore();
        store.insert(success("a", NOW.minus(Duration.ofDays(31)), 100));
        store.insert(error("b", NOW.minus(Duration.ofDays(45))));
        store.insert(success("a", NOW.minus(Duration.ofDays(29)), 100));
        MonitorProperties properties = new MonitorProperties();
        
        int removed = new ProbeRetentionJob(store, properties, new MutableClock(NOW)).purgeExpiredProbes();
        
        assertThat(removed).isEqualTo(2);
        assertThat(store.queryRecent("a", 10)).hasSize(1);
        assertThat(store.queryRecent("b", 10)).isEmpty();
    }
}
