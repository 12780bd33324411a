package ch.sbb.pulse.notification;

import ch.sbb.pulse.model.Incident;

/**
 * Delivers incident alerts and recovery notices. Transport and credentials live behind
 * this interface.
 */
public interface Notifier {
    
    NotificationResult send(Incident incident, String endpointName, NotificationKind kind);
}
