package ch.sbb.pulse.notification;

import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.store.NotificationLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Sends incident notifications with retry.
 * 
 * <p>A failed send (an exception or an unsuccessful result) is retried with exponential
 * backoff. Once attempts are exhausted the failure is logged and returned; it never
 * propagates to the caller. The final result of every dispatch is written to the
 * notification log.</p>
 */
@Service
public class NotificationDispatcher {
    
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
    
    private final Notifier notifier;
    private final RetryTemplate retryTemplate;
    private final NotificationLogStore logStore;
    private final Clock clock;
    
    public NotificationDispatcher(Notifier notifier, RetryTemplate notificationRetryTemplate,
                                  NotificationLogStore logStore, Clock clock) {
        this.notifier = notifier;
        this.retryTemplate = notificationRetryTemplate;
        this.logStore = logStore;
        this.clock = clock;
    }
    
    /**
     * Send a notification about an incident.
     * 
     * @param incident the incident
     * @param endpointName the endpoint's display name
     * @param kind alert or recovery
     * @return the final result
     */
    public NotificationResult dispatch(Incident incident, String endpointName, NotificationKind kind) {
        NotificationResult result = send(incident, endpointName, kind);
        record(incident, kind, result);
        return result;
    }
    
    private NotificationResult send(Incident incident, String endpointName, NotificationKind kind) {
        return retryTemplate.execute(context -> {
            NotificationResult result = notifier.send(incident, endpointName, kind);
            if (!result.success()) {
                throw new NotificationFailedException(result.error());
            }
            log.debug("Sent {} notification for incident {} (attempt {})", kind, incident.id(),
                context.getRetryCount() + 1);
            return result;
        }, context -> {
            Throwable cause = context.getLastThrowable();
            String error = cause != null ? cause.getMessage() : "unknown error";
            log.warn("Giving up on {} notification for incident {} after {} attempts: {}", kind, incident.id(),
                context.getRetryCount(), error);
            return NotificationResult.failed(error);
        });
    }
    
    private void record(Incident incident, NotificationKind kind, NotificationResult result) {
        try {
            logStore.append(NotificationLogEntry.of(incident, kind, result, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to log {} notification for incident {}: {}", kind, incident.id(), e.getMessage(), e);
        }
    }
    
    /**
     * Raised inside the retry callback when the notifier reports a failure.
     */
    static class NotificationFailedException extends RuntimeException {
        NotificationFailedException(String message) {
            super(message);
        }
    }
}
