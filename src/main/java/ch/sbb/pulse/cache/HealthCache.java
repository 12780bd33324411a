package ch.sbb.pulse.cache;

import ch.sbb.pulse.config.MonitorProperties;
import ch.sbb.pulse.model.HealthSummary;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory cache of endpoint health summaries using Caffeine.
 * 
 * <p>Every entry carries its own time-to-live. Cache failures are logged and never reach
 * the probe round.</p>
 */
@Service
public class HealthCache {
    
    private static final Logger log = LoggerFactory.getLogger(HealthCache.class);
    
    private final Cache<String, Entry> cache;
    private final MonitorProperties properties;
    
    public HealthCache(MonitorProperties properties) {
        this.properties = properties;
        this.cache = Caffeine.newBuilder()
            .maximumSize(properties.getHealth().getCacheMaxSize())
            .expireAfter(new PerEntryExpiry())
            .build();
    }
    
    /**
     * Cache a health summary with TTL.
     * 
     * @param endpointId the endpoint ID
     * @param summary the health summary
     * @param ttl the time-to-live
     */
    public void put(String endpointId, HealthSummary summary, Duration ttl) {
        try {
            cache.put(key(endpointId), new Entry(summary, ttl));
            log.debug("Cached health for endpoint: {} with TTL: {}", endpointId, ttl);
        } catch (Exception e) {
            log.warn("Failed to cache health for endpoint {}: {}", endpointId, e.getMessage());
        }
    }
    
    /**
     * Cache a health summary with the configured default TTL.
     */
    public void put(String endpointId, HealthSummary summary) {
        put(endpointId, summary, getDefaultTtl());
    }
    
    /**
     * Get cached health summary.
     * 
     * @param endpointId the endpoint ID
     * @return the cached summary, if present and not expired
     */
    public Optional<HealthSummary> get(String endpointId) {
        Entry entry = cache.getIfPresent(key(endpointId));
        if (entry == null) {
            log.debug("Health cache miss for endpoint: {}", endpointId);
            return Optional.empty();
        }
        return Optional.of(entry.summary());
    }
    
    public void invalidate(String endpointId) {
        cache.invalidate(key(endpointId));
    }
    
    public Duration getDefaultTtl() {
        return properties.getHealth().getCacheTtl();
    }
    
    private static String key(String endpointId) {
        return "health:" + endpointId;
    }
    
    private record Entry(HealthSummary summary, Duration ttl) {
    }
    
    private static final class PerEntryExpiry implements Expiry<String, Entry> {
        
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }
        
        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }
        
        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
