package ch.sbb.pulse.notification;

import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.IncidentSeverity;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Push message built from an incident.
 * 
 * <p>Alerts are graded by severity; recovery notices are always passive. Messages of one
 * endpoint share a thread id, and messages of one incident share a collapse id so that a
 * recovery replaces its alert.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationPayload(
    String type,
    String title,
    String subtitle,
    String body,
    String sound,
    String threadId,
    String collapseId,
    String interruptionLevel,
    Double relevanceScore,
    int priority,
    String incidentId,
    String endpointId
) {
    
    public static NotificationPayload forAlert(Incident incident, String endpointName) {
        String title = switch (incident.severity()) {
            case CRITICAL -> "Critical Alert";
            case MAJOR -> "Major Issue";
            case MINOR -> "Minor Issue";
        };
        String interruptionLevel = switch (incident.severity()) {
            case CRITICAL -> "critical";
            case MAJOR -> "time-sensitive";
            case MINOR -> "active";
        };
        double relevanceScore = switch (incident.severity()) {
            case CRITICAL -> 1.0;
            case MAJOR -> 0.8;
            case MINOR -> 0.5;
        };
        boolean critical = incident.severity() == IncidentSeverity.CRITICAL;
        
        return new NotificationPayload(
            "incident_alert",
            title,
            endpointName,
            incident.title(),
            critical ? "critical.caf" : "default",
            threadId(incident),
            collapseId(incident),
            interruptionLevel,
            relevanceScore,
            critical ? 10 : 5,
            incident.id(),
            incident.endpointId()
        );
    }
    
    public static NotificationPayload forRecovery(Incident incident, String endpointName) {
        return new NotificationPayload(
            "recovery",
            "Recovered",
            endpointName,
            incident.title() + " has been resolved",
            "default",
            threadId(incident),
            collapseId(incident),
            "passive",
            null,
            5,
            incident.id(),
            incident.endpointId()
        );
    }
    
    private static String threadId(Incident incident) {
        return "incident-" + incident.endpointId();
    }
    
    private static String collapseId(Incident incident) {
        return "incident-" + incident.id();
    }
}
