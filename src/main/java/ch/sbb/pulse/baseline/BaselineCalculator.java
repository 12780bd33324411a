package ch.sbb.pulse.baseline;

import ch.sbb.pulse.config.MonitorProperties;
import ch.sbb.pulse.model.Baseline;
import ch.sbb.pulse.model.Endpoint;
import ch.sbb.pulse.model.ProbeResult;
import ch.sbb.pulse.registry.EndpointSource;
import ch.sbb.pulse.store.BaselineStore;
import ch.sbb.pulse.store.ProbeResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Calculates and stores latency baselines.
 * 
 * <p>A baseline summarizes the successful probe latencies of a trailing window (seven days
 * by default): mean, nearest-rank p50/p95/p99 and population standard deviation. Fewer than
 * {@value #MIN_SAMPLES} samples is the normal warm-up state of a new endpoint; the previous
 * baseline, if any, is then left as it is.</p>
 */
@Service
public class BaselineCalculator {
    
    private static final Logger log = LoggerFactory.getLogger(BaselineCalculator.class);
    
    public static final int MIN_SAMPLES = 10;
    public static final int DEFAULT_WINDOW_HOURS = 168;
    
    private final ProbeResultStore resultStore;
    private final BaselineStore baselineStore;
    private final EndpointSource endpointSource;
    private final MonitorProperties properties;
    private final Clock clock;
    
    public BaselineCalculator(ProbeResultStore resultStore,
                              BaselineStore baselineStore,
                              EndpointSource endpointSource,
                              MonitorProperties properties,
                              Clock clock) {
        this.resultStore = resultStore;
        this.baselineStore = baselineStore;
        this.endpointSource = endpointSource;
        this.properties = properties;
        this.clock = clock;
    }
    
    /**
     * Calculate the baseline over the default window.
     */
    public Optional<Baseline> calculateBaseline(String endpointId) {
        return calculateBaseline(endpointId, DEFAULT_WINDOW_HOURS);
    }
    
    /**
     * Calculate the endpoint's baseline and replace the stored one.
     * 
     * @param endpointId the endpoint ID
     * @param windowHours how many hours of history to use
     * @return the new baseline, or empty if there are not enough samples
     */
    public Optional<Baseline> calculateBaseline(String endpointId, int windowHours) {
        Instant now = clock.instant();
        List<Double> latencies = resultStore.queryWindow(endpointId, now.minus(Duration.ofHours(windowHours)))
            .stream()
            .filter(ProbeResult::isSuccess)
            .map(ProbeResult::latencyMs)
            .filter(Objects::nonNull)
            .sorted()
            .toList();
        
        if (latencies.size() < MIN_SAMPLES) {
            log.debug("Not enough data for baseline of endpoint {}: {} samples", endpointId, latencies.size());
            return Optional.empty();
        }
        
        double mean = latencies.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        Baseline baseline = new Baseline(
            UUID.randomUUID().toString(),
            endpointId,
            mean,
            percentile(latencies, 50),
            percentile(latencies, 95),
            percentile(latencies, 99),
            standardDeviation(latencies, mean),
            latencies.size(),
            now
        );
        
        baselineStore.upsert(baseline);
        return Optional.of(baseline);
    }
    
    /**
     * Recalculate baselines for all active endpoints.
     * 
     * <p>Runs at a fixed rate configured in application.yml (default: 1h).</p>
     * 
     * @return how many baselines were updated and how many endpoints were skipped
     */
    @Scheduled(fixedRateString = "${pulse.monitor.baseline.interval:PT1H}",
               initialDelayString = "${pulse.monitor.baseline.interval:PT1H}")
    public RecalculationResult recalculateAllBaselines() {
        int windowHours = (int) properties.getBaseline().getWindow().toHours();
        int updated = 0;
        int skipped = 0;
        
        for (Endpoint endpoint : endpointSource.listActive()) {
            try {
                Optional<Baseline> baseline = calculateBaseline(endpoint.id(), windowHours);
                if (baseline.isPresent()) {
                    log.info("Updated baseline for {}: avg={}ms, p95={}ms", endpoint.name(),
                        Math.round(baseline.get().avgLatencyMs()), Math.round(baseline.get().p95LatencyMs()));
                    updated++;
                } else {
                    log.info("Skipped baseline for {}: not enough data", endpoint.name());
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.error("Error calculating baseline for endpoint {}: {}", endpoint.id(), e.getMessage(), e);
                skipped++;
            }
        }
        
        log.info("Baseline recalculation complete. Updated: {}, Skipped: {}", updated, skipped);
        return new RecalculationResult(updated, skipped);
    }
    
    /**
     * Nearest-rank percentile: {@code ceil(p/100 * n) - 1}, clamped to the list bounds.
     * 
     * @param sorted values in ascending order
     * @param p percentile in [0, 100]
     * @return the value at the percentile, 0 for an empty list
     */
    public static double percentile(List<Double> sorted, double p) {
        if (sorted.isEmpty()) {
            return 0;
        }
        int index = (int) Math.ceil(p / 100 * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }
    
    /**
     * Population standard deviation (divides by n).
     */
    public static double standardDeviation(List<Double> values, double mean) {
        if (values.isEmpty()) {
            return 0;
        }
        double sumOfSquares = 0;
        for (double value : values) {
            sumOfSquares += (value - mean) * (value - mean);
        }
        return Math.sqrt(sumOfSquares / values.size());
    }
    
    public record RecalculationResult(int updated, int skipped) {
    }
}
