package ch.sbb.pulse.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only entry in an incident's timeline.
 */
public record IncidentTimelineEntry(
    String id,
    String incidentId,
    IncidentStatus status,
    String message,
    Instant timestamp
) {
    
    public static IncidentTimelineEntry of(String incidentId, IncidentStatus status, String message,
                                           Instant timestamp) {
        return new IncidentTimelineEntry(UUID.randomUUID().toString(), incidentId, status, message, timestamp);
    }
    
    /**
     * Move this entry to another incident. Used when incidents are merged.
     */
    public IncidentTimelineEntry reparentTo(String newIncidentId) {
        return new IncidentTimelineEntry(id, newIncidentId, status, message, timestamp);
    }
}
