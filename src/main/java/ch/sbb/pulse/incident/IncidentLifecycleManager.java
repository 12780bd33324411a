package ch.sbb.pulse.incident;

import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.IncidentSeverity;
import ch.sbb.pulse.model.IncidentStatus;
import ch.sbb.pulse.model.IncidentTimelineEntry;
import ch.sbb.pulse.model.ProbeResult;
import ch.sbb.pulse.store.IncidentFilter;
import ch.sbb.pulse.store.IncidentStore;
import ch.sbb.pulse.store.IncidentWriteOutcome;
import ch.sbb.pulse.store.ProbeResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Manages incident state transitions, severity updates, automatic recovery and merging.
 * 
 * <p>Manual status changes follow {@link IncidentTransitions}. Automatic recovery resolves
 * an open incident directly, whatever its current status.</p>
 */
@Service
public class IncidentLifecycleManager {
    
    private static final Logger log = LoggerFactory.getLogger(IncidentLifecycleManager.class);
    
    static final int RECOVERY_PROBES = 5;
    static final int DEFAULT_STATS_DAYS = 30;
    static final String DETECTED_MESSAGE = "Incident detected automatically";
    static final String RECOVERED_MESSAGE = "Endpoint has recovered. All recent probes successful.";
    
    private final IncidentStore incidentStore;
    private final ProbeResultStore resultStore;
    private final Clock clock;
    
    public IncidentLifecycleManager(IncidentStore incidentStore, ProbeResultStore resultStore, Clock clock) {
        this.incidentStore = incidentStore;
        this.resultStore = resultStore;
        this.clock = clock;
    }
    
    /**
     * Store a newly detected incident with its first timeline entry, unless the endpoint
     * already has an open incident.
     * 
     * @param incident the detected incident
     * @return true if the incident was stored
     */
    public boolean openIncident(Incident incident) {
        IncidentTimelineEntry detected = IncidentTimelineEntry.of(incident.id(), IncidentStatus.ACTIVE,
            DETECTED_MESSAGE, incident.createdAt());
        boolean inserted = incidentStore.insertIfNoneOpen(incident, detected);
        if (inserted) {
            log.info("Opened incident {} for endpoint {}: {}", incident.id(), incident.endpointId(), incident.title());
        } else {
            log.debug("Endpoint {} already has an open incident, dropped {}", incident.endpointId(), incident.id());
        }
        return inserted;
    }
    
    /**
     * Move an incident to a new status.
     * 
     * <p>{@code resolvedAt} is set when moving to resolved and left untouched otherwise,
     * including when a resolved incident is reopened.</p>
     * 
     * @param incidentId the incident ID
     * @param newStatus the target status
     * @param message the timeline message
     * @return the operation result
     */
    public IncidentOperationResult updateStatus(String incidentId, IncidentStatus newStatus, String message) {
        Optional<Incident> current = incidentStore.get(incidentId);
        if (current.isEmpty()) {
            return IncidentOperationResult.notFound();
        }
        
        Incident incident = current.get();
        if (!IncidentTransitions.isValidTransition(incident.status(), newStatus)) {
            log.warn("Rejected transition of incident {} from {} to {}", incidentId, incident.status(), newStatus);
            return IncidentOperationResult.invalidTransition(incident.status(), newStatus);
        }
        
        Instant now = clock.instant();
        Instant resolvedAt = newStatus == IncidentStatus.RESOLVED ? now : null;
        Incident updated = incident.withStatus(newStatus, resolvedAt, now);
        IncidentTimelineEntry entry = IncidentTimelineEntry.of(incidentId, newStatus, message, now);
        
        IncidentWriteOutcome outcome = incidentStore.replace(incident, updated, entry);
        return switch (outcome) {
            case APPLIED -> {
                log.info("Incident {} moved from {} to {}", incidentId, incident.status(), newStatus);
                yield IncidentOperationResult.ok();
            }
            case NOT_FOUND -> IncidentOperationResult.notFound();
            case STALE -> IncidentOperationResult.failure(IncidentError.CONCURRENT_MODIFICATION,
                "Incident " + incidentId + " was modified concurrently");
            case OPEN_INCIDENT_EXISTS -> IncidentOperationResult.failure(IncidentError.OPEN_INCIDENT_EXISTS,
                "Endpoint " + incident.endpointId() + " already has an open incident");
        };
    }
    
    /**
     * Change the severity of an open incident.
     * 
     * @param incidentId the incident ID
     * @param newSeverity the new severity
     * @param reason why the severity changed
     * @return the operation result
     */
    public IncidentOperationResult updateSeverity(String incidentId, IncidentSeverity newSeverity, String reason) {
        Instant now = clock.instant();
        IncidentTimelineEntry entry = IncidentTimelineEntry.of(incidentId, IncidentStatus.IDENTIFIED,
            "Severity updated to " + newSeverity.name().toLowerCase(Locale.ROOT) + ": " + reason, now);
        
        if (!incidentStore.updateSeverityIfOpen(incidentId, newSeverity, now, entry)) {
            return IncidentOperationResult.notFoundOrResolved();
        }
        log.info("Incident {} severity updated to {}", incidentId, newSeverity);
        return IncidentOperationResult.ok();
    }
    
    /**
     * Resolve the endpoint's open incident if its {@value #RECOVERY_PROBES} most recent
     * probes all succeeded.
     * 
     * @param endpointId the endpoint ID
     * @return true if an incident was resolved
     */
    public boolean checkForRecovery(String endpointId) {
        return recover(endpointId).isPresent();
    }
    
    /**
     * Same as {@link #checkForRecovery(String)}, returning the resolved incident.
     */
    public Optional<Incident> recover(String endpointId) {
        Optional<Incident> open = incidentStore.getOpen(endpointId);
        if (open.isEmpty()) {
            return Optional.empty();
        }
        
        List<ProbeResult> recent = resultStore.queryRecent(endpointId, RECOVERY_PROBES);
        boolean recovered = recent.size() >= RECOVERY_PROBES && recent.stream().allMatch(ProbeResult::isSuccess);
        if (!recovered) {
            return Optional.empty();
        }
        
        Incident incident = open.get();
        Instant now = clock.instant();
        Incident resolved = incident.withStatus(IncidentStatus.RESOLVED, now, now);
        IncidentTimelineEntry entry = IncidentTimelineEntry.of(incident.id(), IncidentStatus.RESOLVED,
            RECOVERED_MESSAGE, now);
        
        IncidentWriteOutcome outcome = incidentStore.replace(incident, resolved, entry);
        if (outcome != IncidentWriteOutcome.APPLIED) {
            log.debug("Automatic recovery of incident {} skipped: {}", incident.id(), outcome);
            return Optional.empty();
        }
        log.info("Incident {} for endpoint {} resolved automatically", incident.id(), endpointId);
        return Optional.of(resolved);
    }
    
    /**
     * Merge secondary incidents into a primary one. Each secondary's timeline is moved to
     * the primary and the secondary is deleted.
     * 
     * @param primaryId the incident that remains
     * @param secondaryIds the incidents to fold into it
     * @return the operation result
     */
    public IncidentOperationResult mergeIncidents(String primaryId, List<String> secondaryIds) {
        if (incidentStore.get(primaryId).isEmpty()) {
            return IncidentOperationResult.notFound();
        }
        
        int merged = 0;
        for (String secondaryId : secondaryIds) {
            if (primaryId.equals(secondaryId)) {
                continue;
            }
            if (incidentStore.mergeInto(primaryId, secondaryId)) {
                merged++;
            } else {
                log.warn("Cannot merge incident {} into {}: not found", secondaryId, primaryId);
            }
        }
        
        incidentStore.appendTimeline(IncidentTimelineEntry.of(primaryId, IncidentStatus.IDENTIFIED,
            "Merged " + merged + " related incident(s)", clock.instant()));
        log.info("Merged {} incident(s) into {}", merged, primaryId);
        return IncidentOperationResult.ok();
    }
    
    public Optional<IncidentDetails> getIncidentWithTimeline(String incidentId) {
        return incidentStore.get(incidentId)
            .map(incident -> new IncidentDetails(incident, incidentStore.timeline(incidentId)));
    }
    
    public Optional<Incident> getOpenIncident(String endpointId) {
        return incidentStore.getOpen(endpointId);
    }
    
    public List<Incident> listIncidents(IncidentFilter filter) {
        return incidentStore.list(filter);
    }
    
    public IncidentStats getIncidentStats() {
        return getIncidentStats(DEFAULT_STATS_DAYS);
    }
    
    /**
     * Summarize incidents created in the last {@code daysBack} days, across all endpoints.
     * 
     * <p>Reopened incidents keep their earlier resolution time and count towards the
     * average resolution time while being active.</p>
     * 
     * @param daysBack length of the look-back period in days
     * @return counts by status and severity, and the average resolution time
     */
    public IncidentStats getIncidentStats(int daysBack) {
        Instant since = clock.instant().minus(Duration.ofDays(daysBack));
        List<Incident> incidents = incidentStore.listCreatedSince(since);
        
        Map<IncidentSeverity, Long> bySeverity = new EnumMap<>(IncidentSeverity.class);
        for (IncidentSeverity severity : IncidentSeverity.values()) {
            bySeverity.put(severity, 0L);
        }
        long active = 0;
        for (Incident incident : incidents) {
            bySeverity.merge(incident.severity(), 1L, Long::sum);
            if (incident.isOpen()) {
                active++;
            }
        }
        
        OptionalDouble avgResolutionTimeMs = incidents.stream()
            .filter(incident -> incident.resolvedAt() != null)
            .mapToLong(incident -> Duration.between(incident.startedAt(), incident.resolvedAt()).toMillis())
            .average();
        
        return new IncidentStats(incidents.size(), active, incidents.size() - active, bySeverity,
            avgResolutionTimeMs.isPresent() ? avgResolutionTimeMs.getAsDouble() : null);
    }
}
