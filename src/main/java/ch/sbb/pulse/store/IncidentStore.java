package ch.sbb.pulse.store;

import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.IncidentSeverity;
import ch.sbb.pulse.model.IncidentTimelineEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for incidents and their timelines.
 * 
 * <p>Implementations guarantee that at most one incident per endpoint has a status other
 * than resolved. Every write that could break this rule is a single guarded operation.</p>
 */
public interface IncidentStore {
    
    Optional<Incident> get(String incidentId);
    
    /**
     * @return the endpoint's open (non-resolved) incident, if any
     */
    Optional<Incident> getOpen(String endpointId);
    
    /**
     * Insert the incident together with its first timeline entry, unless the endpoint
     * already has an open incident.
     * 
     * @return true if inserted
     */
    boolean insertIfNoneOpen(Incident incident, IncidentTimelineEntry initialEntry);
    
    /**
     * Replace an incident and append a timeline entry, provided the stored incident still
     * equals {@code expected}. Any write since {@code expected} was read makes this
     * {@link IncidentWriteOutcome#STALE}.
     */
    IncidentWriteOutcome replace(Incident expected, Incident updated, IncidentTimelineEntry entry);
    
    /**
     * Change the severity of an open incident and append a timeline entry.
     * 
     * @return false if the incident does not exist or is resolved
     */
    boolean updateSeverityIfOpen(String incidentId, IncidentSeverity severity, Instant now,
                                 IncidentTimelineEntry entry);
    
    void appendTimeline(IncidentTimelineEntry entry);
    
    /**
     * @return the incident's timeline, oldest first
     */
    List<IncidentTimelineEntry> timeline(String incidentId);
    
    /**
     * Move all timeline entries of the secondary incident to the primary one and delete
     * the secondary incident, as one step.
     * 
     * @return false if the secondary incident does not exist
     */
    boolean mergeInto(String primaryId, String secondaryId);
    
    /**
     * @return incidents of the endpoint, most recently started first
     */
    List<Incident> listByEndpoint(String endpointId);
    
    /**
     * @return incidents matching the filter, most recently started first
     */
    List<Incident> list(IncidentFilter filter);
    
    /**
     * @return number of incidents of the endpoint started at or after {@code since}
     */
    long countStartedSince(String endpointId, Instant since);
    
    /**
     * @return incidents of all endpoints created at or after {@code since}, most recently started first
     */
    List<Incident> listCreatedSince(Instant since);
}
