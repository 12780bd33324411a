package ch.sbb.pulse.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of one probe against an endpoint.
 * 
 * <p>Latency is present only on success, the status code only when a response arrived,
 * and the error message only when the probe did not succeed.</p>
 */
public record ProbeResult(
    String id,
    String endpointId,
    Instant timestamp,
    ProbeOutcome outcome,
    Double latencyMs,
    Integer statusCode,
    String errorMessage,
    String region
) {
    
    public static final String TIMEOUT_MESSAGE = "Request timed out";
    
    public boolean isSuccess() {
        return outcome == ProbeOutcome.SUCCESS;
    }
    
    public static ProbeResult success(String endpointId, Instant timestamp, double latencyMs,
                                      int statusCode, String region) {
        return new ProbeResult(UUID.randomUUID().toString(), endpointId, timestamp,
            ProbeOutcome.SUCCESS, latencyMs, statusCode, null, region);
    }
    
    public static ProbeResult error(String endpointId, Instant timestamp, Integer statusCode,
                                    String errorMessage, String region) {
        return new ProbeResult(UUID.randomUUID().toString(), endpointId, timestamp,
            ProbeOutcome.ERROR, null, statusCode, errorMessage, region);
    }
    
    public static ProbeResult timeout(String endpointId, Instant timestamp, String region) {
        return new ProbeResult(UUID.randomUUID().toString(), endpointId, timestamp,
            ProbeOutcome.TIMEOUT, null, null, TIMEOUT_MESSAGE, region);
    }
}
