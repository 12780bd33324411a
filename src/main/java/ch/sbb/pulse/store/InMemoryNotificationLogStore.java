package ch.sbb.pulse.store;

import ch.sbb.pulse.notification.NotificationLogEntry;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory notification log in append order.
 */
@Repository
public class InMemoryNotificationLogStore implements NotificationLogStore {
    
    private final ConcurrentLinkedQueue<NotificationLogEntry> entries = new ConcurrentLinkedQueue<>();
    
    @Override
    public void append(NotificationLogEntry entry) {
        entries.add(entry);
    }
    
    @Override
    public List<NotificationLogEntry> listByIncident(String incidentId) {
        return entries.stream()
            .filter(entry -> incidentId.equals(entry.incidentId()))
            .toList();
    }
}
