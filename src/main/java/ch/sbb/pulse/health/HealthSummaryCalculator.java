package ch.sbb.pulse.health;

import ch.sbb.pulse.model.Baseline;
import ch.sbb.pulse.model.HealthSummary;
import ch.sbb.pulse.model.HealthSummary.HealthStatus;
import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.ProbeResult;
import ch.sbb.pulse.store.BaselineStore;
import ch.sbb.pulse.store.IncidentStore;
import ch.sbb.pulse.store.ProbeResultStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Derives an endpoint's health summary from the last 24 hours of probes.
 */
@Component
public class HealthSummaryCalculator {
    
    static final Duration WINDOW = Duration.ofHours(24);
    
    private final ProbeResultStore resultStore;
    private final BaselineStore baselineStore;
    private final IncidentStore incidentStore;
    private final Clock clock;
    
    public HealthSummaryCalculator(ProbeResultStore resultStore,
                                   BaselineStore baselineStore,
                                   IncidentStore incidentStore,
                                   Clock clock) {
        this.resultStore = resultStore;
        this.baselineStore = baselineStore;
        this.incidentStore = incidentStore;
        this.clock = clock;
    }
    
    /**
     * Summarize an endpoint's health.
     * 
     * @param endpointId the endpoint ID
     * @param latest the probe result that triggered the refresh
     * @return the summary
     */
    public HealthSummary summarize(String endpointId, ProbeResult latest) {
        List<ProbeResult> window = resultStore.queryWindow(endpointId, clock.instant().minus(WINDOW));
        Optional<Baseline> baseline = baselineStore.get(endpointId);
        
        long total = window.size();
        long successes = window.stream().filter(ProbeResult::isSuccess).count();
        OptionalDouble avgLatency = window.stream()
            .filter(result -> result.latencyMs() != null)
            .mapToDouble(ProbeResult::latencyMs)
            .average();
        
        double successRate = total > 0 ? (double) successes / total : 0;
        HealthStatus status = classify(total, successRate, avgLatency, baseline);
        int reliabilityScore = (int) Math.round(successRate * 100);
        
        Instant lastIncidentAt = incidentStore.listByEndpoint(endpointId).stream()
            .findFirst()
            .map(Incident::startedAt)
            .orElse(null);
        
        return new HealthSummary(
            endpointId,
            status,
            reliabilityScore,
            latest.latencyMs(),
            baseline.map(Baseline::avgLatencyMs).orElse(null),
            total > 0 ? 1 - successRate : 0,
            latest.timestamp(),
            lastIncidentAt,
            reliabilityScore
        );
    }
    
    static HealthStatus classify(long total, double successRate, OptionalDouble avgLatency,
                                 Optional<Baseline> baseline) {
        if (total == 0) {
            return HealthStatus.UNKNOWN;
        }
        if (successRate < 0.5) {
            return HealthStatus.DOWN;
        }
        if (successRate < 0.95) {
            return HealthStatus.DEGRADED;
        }
        if (baseline.isPresent() && avgLatency.isPresent()
                && avgLatency.getAsDouble() > baseline.get().p95LatencyMs()) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }
}
