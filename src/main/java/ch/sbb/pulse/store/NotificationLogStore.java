package ch.sbb.pulse.store;

import ch.sbb.pulse.notification.NotificationLogEntry;

import java.util.List;

/**
 * Storage for notification delivery records.
 */
public interface NotificationLogStore {
    
    void append(NotificationLogEntry entry);
    
    /**
     * @return entries for the incident, oldest first
     */
    List<NotificationLogEntry> listByIncident(String incidentId);
}
