package ch.sbb.pulse.detection;

import ch.sbb.pulse.model.Baseline;
import ch.sbb.pulse.model.DegradationThresholds;
import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.IncidentSeverity;
import ch.sbb.pulse.model.IncidentStatus;
import ch.sbb.pulse.model.IncidentType;
import ch.sbb.pulse.model.ProbeResult;
import ch.sbb.pulse.store.BaselineStore;
import ch.sbb.pulse.store.IncidentStore;
import ch.sbb.pulse.store.ProbeResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Detects endpoint degradation from the last 15 minutes of probes.
 * 
 * <p>Detection needs a baseline. It returns a new, unsaved incident when a threshold is
 * reached and the endpoint has no open incident; the caller stores it through the
 * incident lifecycle manager, which performs the atomic insert.</p>
 */
@Service
public class DegradationDetector {
    
    private static final Logger log = LoggerFactory.getLogger(DegradationDetector.class);
    
    static final Duration WINDOW = Duration.ofMinutes(15);
    
    private final BaselineStore baselineStore;
    private final ProbeResultStore resultStore;
    private final IncidentStore incidentStore;
    private final Clock clock;
    
    public DegradationDetector(BaselineStore baselineStore,
                               ProbeResultStore resultStore,
                               IncidentStore incidentStore,
                               Clock clock) {
        this.baselineStore = baselineStore;
        this.resultStore = resultStore;
        this.incidentStore = incidentStore;
        this.clock = clock;
    }
    
    /**
     * Check one endpoint for degradation.
     * 
     * @param endpointId the endpoint ID
     * @param endpointName the name used in the incident title
     * @param thresholds the thresholds for this check
     * @return a new active incident, or empty if nothing needs to be opened
     */
    public Optional<Incident> checkForDegradation(String endpointId, String endpointName,
                                                  DegradationThresholds thresholds) {
        Optional<Baseline> baseline = baselineStore.get(endpointId);
        if (baseline.isEmpty()) {
            log.debug("No baseline for endpoint {}, skipping degradation check", endpointId);
            return Optional.empty();
        }
        
        Instant now = clock.instant();
        List<ProbeResult> recent = new ArrayList<>(resultStore.queryWindow(endpointId, now.minus(WINDOW)));
        if (recent.isEmpty()) {
            return Optional.empty();
        }
        Collections.reverse(recent);
        
        DegradationMetrics metrics = DegradationMetrics.of(recent, baseline.get().avgLatencyMs());
        if (!metrics.trips(thresholds)) {
            return Optional.empty();
        }
        
        Optional<Incident> open = incidentStore.getOpen(endpointId);
        if (open.isPresent()) {
            log.debug("Endpoint {} degraded but incident {} is already open", endpointId, open.get().id());
            return Optional.empty();
        }
        
        IncidentType type = determineType(metrics.errorRate(), metrics.timeouts() > 0);
        IncidentSeverity severity = determineSeverity(metrics.errorRate(), metrics.latencyRatio(),
            metrics.consecutiveFailures());
        
        log.info("Degradation detected for {}: type={}, severity={}, errorRate={}, latencyRatio={}",
            endpointName, type, severity, metrics.errorRate(), metrics.latencyRatio());
        
        return Optional.of(Incident.builder()
            .id(UUID.randomUUID().toString())
            .endpointId(endpointId)
            .type(type)
            .severity(severity)
            .status(IncidentStatus.ACTIVE)
            .startedAt(now)
            .title(title(endpointName, type))
            .description(description(type, metrics.errorRate(), metrics.latencyRatio(),
                baseline.get().avgLatencyMs(), metrics.avgLatencyMs()))
            .createdAt(now)
            .updatedAt(now)
            .build());
    }
    
    /**
     * Checks in order: outage, timeouts, error rate, otherwise a latency spike.
     */
    static IncidentType determineType(double errorRate, boolean hasTimeouts) {
        if (errorRate >= 0.9) {
            return IncidentType.COMPLETE_OUTAGE;
        }
        if (hasTimeouts && errorRate > 0.3) {
            return IncidentType.TIMEOUT;
        }
        if (errorRate > 0.1) {
            return IncidentType.HIGH_ERROR_RATE;
        }
        return IncidentType.LATENCY_SPIKE;
    }
    
    static IncidentSeverity determineSeverity(double errorRate, double latencyRatio, int consecutiveFailures) {
        if (errorRate >= 0.9 || consecutiveFailures >= 5) {
            return IncidentSeverity.CRITICAL;
        }
        if (errorRate >= 0.5 || latencyRatio >= 3) {
            return IncidentSeverity.MAJOR;
        }
        return IncidentSeverity.MINOR;
    }
    
    static String title(String endpointName, IncidentType type) {
        return switch (type) {
            case COMPLETE_OUTAGE -> endpointName + " is down";
            case TIMEOUT -> endpointName + " experiencing timeouts";
            case HIGH_ERROR_RATE -> endpointName + " has high error rate";
            case LATENCY_SPIKE -> endpointName + " latency spike detected";
        };
    }
    
    static String description(IncidentType type, double errorRate, double latencyRatio,
                              double baselineLatencyMs, double currentLatencyMs) {
        String errorPct = String.format(Locale.ROOT, "%.1f", errorRate * 100);
        return switch (type) {
            case COMPLETE_OUTAGE -> "All requests are failing. Error rate: " + errorPct + "%";
            case TIMEOUT -> "Requests are timing out. Error rate: " + errorPct + "%";
            case HIGH_ERROR_RATE -> "Error rate has increased to " + errorPct + "%";
            case LATENCY_SPIKE -> String.format(Locale.ROOT, "Latency increased from %.0fms to %.0fms (%.1fx baseline)",
                baselineLatencyMs, currentLatencyMs, latencyRatio);
        };
    }
}
