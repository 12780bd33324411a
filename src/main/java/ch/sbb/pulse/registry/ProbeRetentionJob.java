package ch.sbb.pulse.registry;

import ch.sbb.pulse.config.MonitorProperties;
import ch.sbb.pulse.store.ProbeResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes probe results past the retention period.
 */
@Component
public class ProbeRetentionJob {
    
    private static final Logger log = LoggerFactory.getLogger(ProbeRetentionJob.class);
    
    private final ProbeResultStore resultStore;
    private final MonitorProperties properties;
    private final Clock clock;
    
    public ProbeRetentionJob(ProbeResultStore resultStore, MonitorProperties properties, Clock clock) {
        this.resultStore = resultStore;
        this.properties = properties;
        this.clock = clock;
    }
    
    /**
     * Runs daily at midnight UTC unless configured otherwise.
     * 
     * @return number of deleted probe results
     */
    @Scheduled(cron = "${pulse.monitor.retention.cron:0 0 0 * * *}", zone = "UTC")
    public int purgeExpiredProbes() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getRetention().getProbeDays()));
        int removed = resultStore.purgeOlderThan(cutoff);
        log.info("Cleaned up {} probe records older than {}", removed, cutoff);
        return removed;
    }
}
