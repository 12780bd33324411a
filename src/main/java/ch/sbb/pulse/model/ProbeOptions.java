package ch.sbb.pulse.model;

import java.time.Duration;

/**
 * Per-probe settings: the hard deadline and the region label stamped on the result.
 */
public record ProbeOptions(Duration timeout, String region) {
    
    public ProbeOptions {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Probe timeout must be positive: " + timeout);
        }
        region = region != null ? region : "global";
    }
}
