package ch.sbb.pulse.store;

import ch.sbb.pulse.model.ReliabilityScore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of reliability score snapshots.
 */
public interface ReliabilityScoreStore {
    
    void append(ReliabilityScore score);
    
    /**
     * @return the most recent snapshot calculated at or before the given instant
     */
    Optional<ReliabilityScore> latestAtOrBefore(String endpointId, Instant instant);
    
    /**
     * @return all snapshots of the endpoint, oldest first
     */
    List<ReliabilityScore> history(String endpointId);
}
