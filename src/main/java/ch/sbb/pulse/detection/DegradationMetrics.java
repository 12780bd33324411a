package ch.sbb.pulse.detection;

import ch.sbb.pulse.model.DegradationThresholds;
import ch.sbb.pulse.model.ProbeOutcome;
import ch.sbb.pulse.model.ProbeResult;

import java.util.List;
import java.util.Objects;

/**
 * Metrics of a short probe window, compared against an endpoint's baseline.
 *
 * @param totalProbes probes in the window
 * @param errorRate share of probes that did not succeed
 * @param timeouts probes that timed out
 * @param avgLatencyMs mean latency of successful probes, 0 if none
 * @param latencyRatio average latency divided by the baseline average, 1 if the baseline average is 0
 * @param consecutiveFailures failures counted from the newest probe back to the first success
 */
public record DegradationMetrics(
    int totalProbes,
    double errorRate,
    int timeouts,
    double avgLatencyMs,
    double latencyRatio,
    int consecutiveFailures
) {
    
    /**
     * Compute metrics over probes ordered newest first.
     */
    public static DegradationMetrics of(List<ProbeResult> newestFirst, double baselineAvgLatencyMs) {
        int total = newestFirst.size();
        long failures = newestFirst.stream().filter(result -> !result.isSuccess()).count();
        long timeouts = newestFirst.stream().filter(result -> result.outcome() == ProbeOutcome.TIMEOUT).count();
        double errorRate = total > 0 ? (double) failures / total : 0;
        
        double avgLatency = newestFirst.stream()
            .filter(ProbeResult::isSuccess)
            .map(ProbeResult::latencyMs)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average()
            .orElse(0);
        double latencyRatio = baselineAvgLatencyMs > 0 ? avgLatency / baselineAvgLatencyMs : 1;
        
        int consecutiveFailures = 0;
        for (ProbeResult result : newestFirst) {
            if (result.isSuccess()) {
                break;
            }
            consecutiveFailures++;
        }
        
        return new DegradationMetrics(total, errorRate, (int) timeouts, avgLatency, latencyRatio, consecutiveFailures);
    }
    
    /**
     * Whether any threshold is reached.
     */
    public boolean trips(DegradationThresholds thresholds) {
        return latencyRatio >= thresholds.latencyMultiplier()
            || errorRate >= thresholds.errorRateThreshold()
            || consecutiveFailures >= thresholds.consecutiveFailures();
    }
}
