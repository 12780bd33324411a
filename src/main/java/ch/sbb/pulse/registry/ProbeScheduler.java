package ch.sbb.pulse.registry;

import ch.sbb.pulse.cache.HealthCache;
import ch.sbb.pulse.client.Prober;
import ch.sbb.pulse.config.MonitorProperties;
import ch.sbb.pulse.detection.DegradationDetector;
import ch.sbb.pulse.health.HealthSummaryCalculator;
import ch.sbb.pulse.incident.IncidentLifecycleManager;
import ch.sbb.pulse.model.DegradationThresholds;
import ch.sbb.pulse.model.Endpoint;
import ch.sbb.pulse.model.HealthSummary;
import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.ProbeOptions;
import ch.sbb.pulse.model.ProbeResult;
import ch.sbb.pulse.notification.NotificationDispatcher;
import ch.sbb.pulse.notification.NotificationKind;
import ch.sbb.pulse.store.ProbeResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduled probe rounds over all active endpoints.
 * 
 * <p>Each round probes every active endpoint on the probe round executor, whose pool size
 * caps how many endpoints are in flight at once. Per endpoint the result is stored, the
 * cached health summary refreshed, degradation checked and then recovery checked. A failure in one
 * endpoint's processing is logged and counted; the other endpoints are unaffected.</p>
 */
@Component
public class ProbeScheduler {
    
    private static final Logger log = LoggerFactory.getLogger(ProbeScheduler.class);
    
    private final EndpointRegistry registry;
    private final Prober prober;
    private final ProbeResultStore resultStore;
    private final HealthSummaryCalculator healthCalculator;
    private final HealthCache healthCache;
    private final DegradationDetector degradationDetector;
    private final IncidentLifecycleManager lifecycleManager;
    private final NotificationDispatcher notificationDispatcher;
    private final MonitorProperties properties;
    private final ExecutorService roundExecutor;
    
    public ProbeScheduler(EndpointRegistry registry,
                          Prober prober,
                          ProbeResultStore resultStore,
                          HealthSummaryCalculator healthCalculator,
                          HealthCache healthCache,
                          DegradationDetector degradationDetector,
                          IncidentLifecycleManager lifecycleManager,
                          NotificationDispatcher notificationDispatcher,
                          MonitorProperties properties,
                          @Qualifier("probeRoundExecutor") ExecutorService roundExecutor) {
        this.registry = registry;
        this.prober = prober;
        this.resultStore = resultStore;
        this.healthCalculator = healthCalculator;
        this.healthCache = healthCache;
        this.degradationDetector = degradationDetector;
        this.lifecycleManager = lifecycleManager;
        this.notificationDispatcher = notificationDispatcher;
        this.properties = properties;
        this.roundExecutor = roundExecutor;
    }
    
    /**
     * Probe all active endpoints.
     * 
     * <p>Runs at a fixed rate configured in application.yml (default: 60s).</p>
     * 
     * @return counters of the round
     */
    @Scheduled(fixedRateString = "${pulse.monitor.probe.interval:PT1M}")
    public ProbeRoundResult runProbeRound() {
        List<Endpoint> endpoints = registry.listActive();
        log.info("Probe round starting for {} active endpoints", endpoints.size());
        
        DegradationThresholds thresholds = properties.getDetection().toThresholds();
        AtomicInteger probed = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();
        
        List<Future<?>> tasks = new ArrayList<>();
        for (Endpoint endpoint : endpoints) {
            try {
                tasks.add(roundExecutor.submit(() -> {
                    if (processEndpoint(endpoint, thresholds)) {
                        probed.incrementAndGet();
                    } else {
                        errors.incrementAndGet();
                    }
                }));
            } catch (RejectedExecutionException e) {
                errors.incrementAndGet();
                log.error("Could not schedule probe of endpoint {}: {}", endpoint.id(), e.getMessage());
            }
        }
        
        for (Future<?> task : tasks) {
            try {
                task.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for probe round to finish");
                break;
            } catch (ExecutionException e) {
                errors.incrementAndGet();
                log.error("Unexpected failure in probe task: {}", e.getCause().getMessage(), e.getCause());
            }
        }
        
        ProbeRoundResult result = new ProbeRoundResult(probed.get(), errors.get());
        log.info("Probe round complete. Probed: {}, Errors: {}", result.probed(), result.errors());
        return result;
    }
    
    /**
     * Manually probe a single registered endpoint outside the schedule.
     * 
     * @param endpointId the endpoint ID
     * @return true if the endpoint was probed and processed without error
     */
    public boolean probeEndpoint(String endpointId) {
        Optional<Endpoint> endpoint = registry.getEndpoint(endpointId);
        if (endpoint.isEmpty()) {
            log.warn("Cannot probe: endpoint not found: {}", endpointId);
            return false;
        }
        return processEndpoint(endpoint.get(), properties.getDetection().toThresholds());
    }
    
    /**
     * Probe one endpoint and run the downstream pipeline.
     * 
     * @return false if storing or processing the result failed
     */
    private boolean processEndpoint(Endpoint endpoint, DegradationThresholds thresholds) {
        ProbeResult result = prober.probe(endpoint, new ProbeOptions(endpoint.timeout(), properties.getProbe().getRegion()));
        
        try {
            resultStore.insert(result);
            
            HealthSummary health = healthCalculator.summarize(endpoint.id(), result);
            healthCache.put(endpoint.id(), health);
            
            // detection before recovery: the resolving probe must still see the incident open
            Optional<Incident> detected = degradationDetector.checkForDegradation(endpoint.id(), endpoint.name(), thresholds);
            if (detected.isPresent() && lifecycleManager.openIncident(detected.get())) {
                notificationDispatcher.dispatch(detected.get(), endpoint.name(), NotificationKind.ALERT);
            }
            
            lifecycleManager.recover(endpoint.id()).ifPresent(resolved ->
                notificationDispatcher.dispatch(resolved, endpoint.name(), NotificationKind.RECOVERY));
            
            log.debug("Probed {}: {} ({}ms)", endpoint.name(), result.outcome(),
                result.latencyMs() != null ? Math.round(result.latencyMs()) : "-");
            return true;
        } catch (RuntimeException e) {
            log.error("Error processing probe of endpoint {}: {}", endpoint.name(), e.getMessage(), e);
            return false;
        }
    }
}
