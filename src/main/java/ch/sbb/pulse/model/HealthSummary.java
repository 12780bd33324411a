package ch.sbb.pulse.model;

import java.time.Instant;

/**
 * Short-lived health view of an endpoint, recomputed after every probe and held in the health cache.
 */
public record HealthSummary(
    String endpointId,
    HealthStatus status,
    int reliabilityScore,
    Double currentLatencyMs,
    Double baselineLatencyMs,
    double errorRate,
    Instant lastProbeAt,
    Instant lastIncidentAt,
    int uptimePercentage
) {
    
    /**
     * Health status enumeration.
     */
    public enum HealthStatus {
        HEALTHY,
        DEGRADED,
        DOWN,
        UNKNOWN
    }
}
