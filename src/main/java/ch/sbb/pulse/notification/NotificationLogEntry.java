package ch.sbb.pulse.notification;

import ch.sbb.pulse.model.Incident;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of one dispatched notification and whether it was delivered.
 */
public record NotificationLogEntry(
    String id,
    String incidentId,
    String endpointId,
    NotificationKind kind,
    boolean success,
    String error,
    Instant sentAt
) {
    
    public static NotificationLogEntry of(Incident incident, NotificationKind kind, NotificationResult result,
                                          Instant sentAt) {
        return new NotificationLogEntry(UUID.randomUUID().toString(), incident.id(), incident.endpointId(), kind,
            result.success(), result.error(), sentAt);
    }
}
