package ch.sbb.pulse.store;

import ch.sbb.pulse.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory probe result store, keyed by endpoint.
 * 
 * <p>Each endpoint's results are kept ordered by timestamp, so window and recency queries
 * only touch the entries they return. Results with equal timestamps keep their insertion
 * order.</p>
 */
@Repository
public class InMemoryProbeResultStore implements ProbeResultStore {
    
    private static final Logger log = LoggerFactory.getLogger(InMemoryProbeResultStore.class);
    
    private final Map<String, NavigableMap<ResultKey, ProbeResult>> resultsByEndpoint = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    
    @Override
    public void insert(ProbeResult result) {
        resultsByEndpoint.computeIfAbsent(result.endpointId(), k -> new ConcurrentSkipListMap<>())
            .put(new ResultKey(result.timestamp(), sequence.incrementAndGet()), result);
        log.debug("Stored probe result {} for endpoint {}: {}", result.id(), result.endpointId(), result.outcome());
    }
    
    @Override
    public List<ProbeResult> queryWindow(String endpointId, Instant since) {
        NavigableMap<ResultKey, ProbeResult> results = resultsByEndpoint.get(endpointId);
        if (results == null) {
            return List.of();
        }
        return List.copyOf(results.tailMap(ResultKey.first(since), true).values());
    }
    
    @Override
    public List<ProbeResult> queryRecent(String endpointId, int limit) {
        NavigableMap<ResultKey, ProbeResult> results = resultsByEndpoint.get(endpointId);
        if (results == null) {
            return List.of();
        }
        return results.descendingMap().values().stream()
            .limit(limit)
            .toList();
    }
    
    @Override
    public int purgeOlderThan(Instant cutoff) {
        ResultKey bound = ResultKey.first(cutoff);
        int removed = 0;
        for (NavigableMap<ResultKey, ProbeResult> results : resultsByEndpoint.values()) {
            Iterator<ResultKey> expired = results.headMap(bound, false).keySet().iterator();
            while (expired.hasNext()) {
                expired.next();
                expired.remove();
                removed++;
            }
        }
        return removed;
    }
    
    /**
     * Orders results by timestamp, then by insertion.
     */
    private record ResultKey(Instant timestamp, long sequence) implements Comparable<ResultKey> {
        
        private static final Comparator<ResultKey> ORDER =
            Comparator.comparing(ResultKey::timestamp).thenComparingLong(ResultKey::sequence);
        
        /**
         * Sorts before every stored key with the same timestamp.
         */
        static ResultKey first(Instant timestamp) {
            return new ResultKey(timestamp, Long.MIN_VALUE);
        }
        
        @Override
        public int compareTo(ResultKey other) {
            return ORDER.compare(this, other);
        }
    }
}
