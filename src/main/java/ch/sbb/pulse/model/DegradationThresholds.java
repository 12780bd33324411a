package ch.sbb.pulse.model;

/**
 * Thresholds that trip degradation detection. Passed into every detection call.
 *
 * @param latencyMultiplier trip when average latency reaches this multiple of the baseline average
 * @param errorRateThreshold trip when the error rate (0-1) reaches this value
 * @param consecutiveFailures trip after this many failures in a row, newest first
 */
public record DegradationThresholds(
    double latencyMultiplier,
    double errorRateThreshold,
    int consecutiveFailures
) {
    
    public static final DegradationThresholds DEFAULT = new DegradationThresholds(2.0, 0.10, 3);
    
    public DegradationThresholds {
        if (latencyMultiplier <= 0) {
            throw new IllegalArgumentException("Latency multiplier must be positive: " + latencyMultiplier);
        }
        if (errorRateThreshold < 0 || errorRateThreshold > 1) {
            throw new IllegalArgumentException("Error rate threshold must be within [0, 1]: " + errorRateThreshold);
        }
        if (consecutiveFailures < 1) {
            throw new IllegalArgumentException("Consecutive failures must be at least 1: " + consecutiveFailures);
        }
    }
}
