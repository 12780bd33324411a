package ch.sbb.pulse.store;

import ch.sbb.pulse.model.Baseline;

import java.util.Optional;

/**
 * Storage for latency baselines, one per endpoint.
 */
public interface BaselineStore {
    
    Optional<Baseline> get(String endpointId);
    
    /**
     * Insert the baseline or replace the existing one for the same endpoint.
     */
    void upsert(Baseline baseline);
}
