package ch.sbb.pulse.registry;

import ch.sbb.pulse.model.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of monitored endpoints.
 * 
 * <p>Provides thread-safe registration, unregistration, and lookup. Endpoints are owned by
 * the registry; the monitoring pipeline only reads them.</p>
 */
public class EndpointRegistry implements EndpointSource {
    
    private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);
    
    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();
    
    /**
     * Register an endpoint, replacing any previous registration with the same id.
     * 
     * @param endpoint the endpoint
     */
    public void register(Endpoint endpoint) {
        endpoints.put(endpoint.id(), endpoint);
        log.info("Registered endpoint: {} at {} {}", endpoint.name(), endpoint.method(), endpoint.url());
    }
    
    /**
     * Unregister an endpoint.
     * 
     * @param endpointId the endpoint ID
     */
    public void unregister(String endpointId) {
        Endpoint endpoint = endpoints.remove(endpointId);
        if (endpoint != null) {
            log.info("Unregistered endpoint: {}", endpoint.name());
        }
    }
    
    /**
     * Get all registered endpoints, ordered by id.
     * 
     * @return list of all endpoints
     */
    public List<Endpoint> listEndpoints() {
        List<Endpoint> all = new ArrayList<>(endpoints.values());
        all.sort(Comparator.comparing(Endpoint::id));
        return all;
    }
    
    @Override
    public List<Endpoint> listActive() {
        return listEndpoints().stream()
            .filter(Endpoint::active)
            .toList();
    }
    
    /**
     * Get an endpoint by ID.
     * 
     * @param endpointId the endpoint ID
     * @return the endpoint, if registered
     */
    public Optional<Endpoint> getEndpoint(String endpointId) {
        return Optional.ofNullable(endpoints.get(endpointId));
    }
}
