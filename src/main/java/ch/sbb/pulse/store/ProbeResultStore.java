package ch.sbb.pulse.store;

import ch.sbb.pulse.model.ProbeResult;

import java.time.Instant;
import java.util.List;

/**
 * Storage for probe results.
 */
public interface ProbeResultStore {
    
    void insert(ProbeResult result);
    
    /**
     * @return results of the endpoint with {@code timestamp >= since}, oldest first
     */
    List<ProbeResult> queryWindow(String endpointId, Instant since);
    
    /**
     * @return at most {@code limit} most recent results of the endpoint, newest first, regardless of age
     */
    List<ProbeResult> queryRecent(String endpointId, int limit);
    
    /**
     * Delete results older than the cutoff.
     * 
     * @return number of deleted results
     */
    int purgeOlderThan(Instant cutoff);
}
