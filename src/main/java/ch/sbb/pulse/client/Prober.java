package ch.sbb.pulse.client;

import ch.sbb.pulse.model.Endpoint;
import ch.sbb.pulse.model.ProbeOptions;
import ch.sbb.pulse.model.ProbeResult;

/**
 * Executes one bounded check of an endpoint.
 */
public interface Prober {
    
    /**
     * Probe the endpoint once. Never throws: network failures and deadline expiry are
     * returned as classified results. Persisting the result is the caller's job.
     * 
     * @param endpoint the endpoint to probe
     * @param options deadline and region
     * @return the classified result
     */
    ProbeResult probe(Endpoint endpoint, ProbeOptions options);
}
