package ch.sbb.pulse.scoring;

import ch.sbb.pulse.model.Baseline;
import ch.sbb.pulse.model.Endpoint;
import ch.sbb.pulse.model.ProbeOutcome;
import ch.sbb.pulse.model.ProbeResult;
import ch.sbb.pulse.model.ReliabilityScore;
import ch.sbb.pulse.model.ReliabilityScore.Components;
import ch.sbb.pulse.model.Trend;
import ch.sbb.pulse.registry.EndpointSource;
import ch.sbb.pulse.store.BaselineStore;
import ch.sbb.pulse.store.IncidentStore;
import ch.sbb.pulse.store.ProbeResultStore;
import ch.sbb.pulse.store.ReliabilityScoreStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Calculates a 0-100 reliability score for each endpoint.
 * 
 * <p>Score composition:</p>
 * <ul>
 *   <li>Uptime: 40% weight</li>
 *   <li>Latency against baseline: 30% weight</li>
 *   <li>Error rate: 20% weight</li>
 *   <li>Incident history: 10% weight</li>
 * </ul>
 * 
 * <p>Every calculation is stored as a new snapshot; the trend compares against the latest
 * snapshot that is at least a day old.</p>
 */
@Service
public class ReliabilityScorer {
    
    private static final Logger log = LoggerFactory.getLogger(ReliabilityScorer.class);
    
    private static final double UPTIME_WEIGHT = 0.4;
    private static final double LATENCY_WEIGHT = 0.3;
    private static final double ERROR_RATE_WEIGHT = 0.2;
    private static final double INCIDENT_WEIGHT = 0.1;
    
    static final double DEFAULT_BASELINE_LATENCY_MS = 500;
    static final int TREND_THRESHOLD = 5;
    
    private static final Duration PROBE_WINDOW = Duration.ofHours(24);
    private static final Duration TREND_LOOKBACK = Duration.ofHours(24);
    
    private final ProbeResultStore resultStore;
    private final BaselineStore baselineStore;
    private final IncidentStore incidentStore;
    private final ReliabilityScoreStore scoreStore;
    private final EndpointSource endpointSource;
    private final Clock clock;
    
    public ReliabilityScorer(ProbeResultStore resultStore,
                             BaselineStore baselineStore,
                             IncidentStore incidentStore,
                             ReliabilityScoreStore scoreStore,
                             EndpointSource endpointSource,
                             Clock clock) {
        this.resultStore = resultStore;
        this.baselineStore = baselineStore;
        this.incidentStore = incidentStore;
        this.scoreStore = scoreStore;
        this.endpointSource = endpointSource;
        this.clock = clock;
    }
    
    /**
     * Calculate, store and return the endpoint's current reliability score.
     * 
     * @param endpointId the endpoint ID
     * @return the new snapshot
     */
    public ReliabilityScore calculateReliabilityScore(String endpointId) {
        Instant now = clock.instant();
        
        List<ProbeResult> window = resultStore.queryWindow(endpointId, now.minus(PROBE_WINDOW));
        long total = window.size();
        long successes = window.stream().filter(ProbeResult::isSuccess).count();
        long errors = window.stream().filter(result -> result.outcome() == ProbeOutcome.ERROR).count();
        double avgLatency = window.stream()
            .filter(ProbeResult::isSuccess)
            .map(ProbeResult::latencyMs)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average()
            .orElse(0);
        double baselineLatency = baselineStore.get(endpointId)
            .map(Baseline::avgLatencyMs)
            .orElse(DEFAULT_BASELINE_LATENCY_MS);
        
        long last7Days = incidentStore.countStartedSince(endpointId, now.minus(Duration.ofDays(7)));
        long last30Days = incidentStore.countStartedSince(endpointId, now.minus(Duration.ofDays(30)));
        
        Components components = new Components(
            uptimeScore(total, successes),
            latencyScore(avgLatency, baselineLatency),
            errorRateScore(total, errors),
            incidentScore(last7Days, last30Days)
        );
        int overall = overallScore(components);
        
        Optional<ReliabilityScore> previous = scoreStore.latestAtOrBefore(endpointId, now.minus(TREND_LOOKBACK));
        Trend trend = determineTrend(overall, previous.map(ReliabilityScore::score).orElse(null));
        
        ReliabilityScore score = new ReliabilityScore(UUID.randomUUID().toString(), endpointId, overall,
            components, trend, now);
        scoreStore.append(score);
        
        log.debug("Reliability score for endpoint {}: {} ({})", endpointId, overall, trend);
        return score;
    }
    
    /**
     * Score all active endpoints.
     * 
     * <p>Runs at a fixed rate configured in application.yml (default: 1h).</p>
     */
    @Scheduled(fixedRateString = "${pulse.monitor.scoring.interval:PT1H}",
               initialDelayString = "${pulse.monitor.scoring.interval:PT1H}")
    public List<ReliabilityScore> calculateAllReliabilityScores() {
        List<ReliabilityScore> scores = new ArrayList<>();
        for (Endpoint endpoint : endpointSource.listActive()) {
            try {
                scores.add(calculateReliabilityScore(endpoint.id()));
            } catch (RuntimeException e) {
                log.error("Error scoring endpoint {}: {}", endpoint.id(), e.getMessage(), e);
            }
        }
        log.info("Calculated reliability scores for {} endpoints", scores.size());
        return scores;
    }
    
    static double uptimeScore(long total, long successes) {
        if (total == 0) {
            return 100;
        }
        return clamp((double) successes / total * 100);
    }
    
    static double latencyScore(double avgLatency, double baselineLatency) {
        if (avgLatency == 0 || baselineLatency == 0) {
            return 0;
        }
        double ratio = avgLatency / baselineLatency;
        if (ratio <= 1.0) return 100;
        if (ratio <= 1.2) return 90;
        if (ratio <= 1.5) return 75;
        if (ratio <= 2.0) return 50;
        if (ratio <= 3.0) return 25;
        return 0;
    }
    
    static double errorRateScore(long total, long errors) {
        if (total == 0) {
            return 100;
        }
        double errorRate = (double) errors / total;
        if (errorRate == 0) return 100;
        if (errorRate <= 0.01) return 90;
        if (errorRate <= 0.05) return 75;
        if (errorRate <= 0.1) return 50;
        if (errorRate <= 0.25) return 25;
        return 0;
    }
    
    /**
     * Incidents of the last week weigh 2, older ones within 30 days weigh 0.5.
     */
    static double incidentScore(long last7Days, long last30Days) {
        double weight = last7Days * 2 + (last30Days - last7Days) * 0.5;
        if (weight == 0) return 100;
        if (weight <= 1) return 80;
        if (weight <= 3) return 60;
        if (weight <= 5) return 40;
        return 20;
    }
    
    static int overallScore(Components components) {
        return (int) Math.round(components.uptime() * UPTIME_WEIGHT
            + components.latency() * LATENCY_WEIGHT
            + components.errorRate() * ERROR_RATE_WEIGHT
            + components.incidentHistory() * INCIDENT_WEIGHT);
    }
    
    static Trend determineTrend(int current, Integer previous) {
        if (previous == null) {
            return Trend.STABLE;
        }
        int diff = current - previous;
        if (diff >= TREND_THRESHOLD) {
            return Trend.IMPROVING;
        }
        if (diff <= -TREND_THRESHOLD) {
            return Trend.DECLINING;
        }
        return Trend.STABLE;
    }
    
    private static double clamp(double score) {
        return Math.min(100, Math.max(0, score));
    }
}
