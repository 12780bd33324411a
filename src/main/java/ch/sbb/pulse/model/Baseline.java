package ch.sbb.pulse.model;

import java.time.Instant;

/**
 * Latency baseline of one endpoint, computed from its recent successful probes.
 * 
 * <p>There is at most one baseline per endpoint; a new calculation replaces the previous one.</p>
 */
public record Baseline(
    String id,
    String endpointId,
    double avgLatencyMs,
    double p50LatencyMs,
    double p95LatencyMs,
    double p99LatencyMs,
    double stdDeviation,
    int sampleCount,
    Instant calculatedAt
) {
}
