package ch.sbb.pulse.store;

import ch.sbb.pulse.model.ReliabilityScore;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory reliability score history.
 */
@Repository
public class InMemoryReliabilityScoreStore implements ReliabilityScoreStore {
    
    private final Map<String, List<ReliabilityScore>> scoresByEndpoint = new ConcurrentHashMap<>();
    
    @Override
    public void append(ReliabilityScore score) {
        scoresByEndpoint.computeIfAbsent(score.endpointId(), k -> Collections.synchronizedList(new ArrayList<>()))
            .add(score);
    }
    
    @Override
    public Optional<ReliabilityScore> latestAtOrBefore(String endpointId, Instant instant) {
        return history(endpointId).stream()
            .filter(score -> !score.calculatedAt().isAfter(instant))
            .reduce((first, second) -> second);
    }
    
    @Override
    public List<ReliabilityScore> history(String endpointId) {
        List<ReliabilityScore> scores = scoresByEndpoint.get(endpointId);
        if (scores == null) {
            return List.of();
        }
        List<ReliabilityScore> copy;
        synchronized (scores) {
            copy = new ArrayList<>(scores);
        }
        copy.sort(Comparator.comparing(ReliabilityScore::calculatedAt));
        return copy;
    }
}
