package ch.sbb.pulse.store;

import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.IncidentSeverity;
import ch.sbb.pulse.model.IncidentTimelineEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory incident store.
 * 
 * <p>All writes run under the store's monitor, which makes each of them atomic the way a
 * database transaction would. {@code openByEndpoint} plays the role of a unique index on
 * the endpoint id of non-resolved incidents.</p>
 */
@Repository
public class InMemoryIncidentStore implements IncidentStore {
    
    private static final Logger log = LoggerFactory.getLogger(InMemoryIncidentStore.class);
    
    private static final Comparator<Incident> NEWEST_STARTED_FIRST =
        Comparator.comparing(Incident::startedAt).reversed();
    
    private final Map<String, Incident> incidents = new HashMap<>();
    private final Map<String, String> openByEndpoint = new HashMap<>();
    private final Map<String, List<IncidentTimelineEntry>> timelines = new HashMap<>();
    
    @Override
    public synchronized Optional<Incident> get(String incidentId) {
        return Optional.ofNullable(incidents.get(incidentId));
    }
    
    @Override
    public synchronized Optional<Incident> getOpen(String endpointId) {
        String incidentId = openByEndpoint.get(endpointId);
        return incidentId != null ? Optional.ofNullable(incidents.get(incidentId)) : Optional.empty();
    }
    
    @Override
    public synchronized boolean insertIfNoneOpen(Incident incident, IncidentTimelineEntry initialEntry) {
        if (incident.isOpen() && openByEndpoint.containsKey(incident.endpointId())) {
            log.debug("Rejected incident {}: endpoint {} already has open incident {}",
                incident.id(), incident.endpointId(), openByEndpoint.get(incident.endpointId()));
            return false;
        }
        incidents.put(incident.id(), incident);
        if (incident.isOpen()) {
            openByEndpoint.put(incident.endpointId(), incident.id());
        }
        timelines.computeIfAbsent(incident.id(), k -> new ArrayList<>()).add(initialEntry);
        return true;
    }
    
    @Override
    public synchronized IncidentWriteOutcome replace(Incident expected, Incident updated, IncidentTimelineEntry entry) {
        Incident current = incidents.get(expected.id());
        if (current == null) {
            return IncidentWriteOutcome.NOT_FOUND;
        }
        if (!current.equals(expected)) {
            return IncidentWriteOutcome.STALE;
        }
        String openId = openByEndpoint.get(updated.endpointId());
        if (updated.isOpen() && openId != null && !openId.equals(updated.id())) {
            return IncidentWriteOutcome.OPEN_INCIDENT_EXISTS;
        }
        
        incidents.put(updated.id(), updated);
        if (updated.isOpen()) {
            openByEndpoint.put(updated.endpointId(), updated.id());
        } else {
            openByEndpoint.remove(updated.endpointId(), updated.id());
        }
        timelines.computeIfAbsent(updated.id(), k -> new ArrayList<>()).add(entry);
        return IncidentWriteOutcome.APPLIED;
    }
    
    @Override
    public synchronized boolean updateSeverityIfOpen(String incidentId, IncidentSeverity severity, Instant now,
                                                     IncidentTimelineEntry entry) {
        Incident current = incidents.get(incidentId);
        if (current == null || !current.isOpen()) {
            return false;
        }
        incidents.put(incidentId, current.withSeverity(severity, now));
        timelines.computeIfAbsent(incidentId, k -> new ArrayList<>()).add(entry);
        return true;
    }
    
    @Override
    public synchronized void appendTimeline(IncidentTimelineEntry entry) {
        timelines.computeIfAbsent(entry.incidentId(), k -> new ArrayList<>()).add(entry);
    }
    
    @Override
    public synchronized List<IncidentTimelineEntry> timeline(String incidentId) {
        List<IncidentTimelineEntry> entries = new ArrayList<>(timelines.getOrDefault(incidentId, List.of()));
        entries.sort(Comparator.comparing(IncidentTimelineEntry::timestamp));
        return entries;
    }
    
    @Override
    public synchronized boolean mergeInto(String primaryId, String secondaryId) {
        Incident secondary = incidents.remove(secondaryId);
        if (secondary == null) {
            return false;
        }
        openByEndpoint.remove(secondary.endpointId(), secondaryId);
        
        List<IncidentTimelineEntry> moved = timelines.remove(secondaryId);
        if (moved != null) {
            List<IncidentTimelineEntry> target = timelines.computeIfAbsent(primaryId, k -> new ArrayList<>());
            moved.forEach(entry -> target.add(entry.reparentTo(primaryId)));
        }
        return true;
    }
    
    @Override
    public synchronized List<Incident> listByEndpoint(String endpointId) {
        return select(incident -> incident.endpointId().equals(endpointId));
    }
    
    @Override
    public synchronized List<Incident> list(IncidentFilter filter) {
        return select(incident -> (filter.endpointId() == null || filter.endpointId().equals(incident.endpointId()))
                && (filter.status() == null || filter.status() == incident.status()))
            .stream()
            .skip(filter.offset())
            .limit(filter.limit())
            .toList();
    }
    
    @Override
    public synchronized long countStartedSince(String endpointId, Instant since) {
        return incidents.values().stream()
            .filter(incident -> incident.endpointId().equals(endpointId))
            .filter(incident -> !incident.startedAt().isBefore(since))
            .count();
    }
    
    @Override
    public synchronized List<Incident> listCreatedSince(Instant since) {
        return select(incident -> !incident.createdAt().isBefore(since));
    }
    
    private List<Incident> select(Predicate<Incident> predicate) {
        return incidents.values().stream()
            .filter(predicate)
            .sorted(NEWEST_STARTED_FIRST)
            .toList();
    }
}
