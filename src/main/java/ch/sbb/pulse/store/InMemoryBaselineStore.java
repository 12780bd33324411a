package ch.sbb.pulse.store;

import ch.sbb.pulse.model.Baseline;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory baseline store with one entry per endpoint.
 */
@Repository
public class InMemoryBaselineStore implements BaselineStore {
    
    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();
    
    @Override
    public Optional<Baseline> get(String endpointId) {
        return Optional.ofNullable(baselines.get(endpointId));
    }
    
    @Override
    public void upsert(Baseline baseline) {
        baselines.put(baseline.endpointId(), baseline);
    }
}
