package ch.sbb.pulse.model;

import java.time.Instant;

/**
 * Immutable snapshot of an endpoint's reliability score. Every calculation appends one.
 */
public record ReliabilityScore(
    String id,
    String endpointId,
    int score,
    Components components,
    Trend trend,
    Instant calculatedAt
) {
    
    /**
     * Component scores, each in [0, 100].
     */
    public record Components(
        double uptime,
        double latency,
        double errorRate,
        double incidentHistory
    ) {
    }
}
