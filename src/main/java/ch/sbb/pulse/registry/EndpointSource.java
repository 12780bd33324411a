package ch.sbb.pulse.registry;

import ch.sbb.pulse.model.Endpoint;

import java.util.List;

/**
 * Read access to the endpoints that should be monitored.
 */
public interface EndpointSource {
    
    /**
     * @return all endpoints whose active flag is set
     */
    List<Endpoint> listActive();
}
