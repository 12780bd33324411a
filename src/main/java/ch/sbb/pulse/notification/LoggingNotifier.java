package ch.sbb.pulse.notification;

import ch.sbb.pulse.model.Incident;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Notifier that renders the push payload as JSON and writes it to the log.
 * 
 * <p>Used until a push transport is wired in.</p>
 */
@Component
public class LoggingNotifier implements Notifier {
    
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);
    
    private final ObjectMapper objectMapper;
    
    public LoggingNotifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    @Override
    public NotificationResult send(Incident incident, String endpointName, NotificationKind kind) {
        NotificationPayload payload = switch (kind) {
            case ALERT -> NotificationPayload.forAlert(incident, endpointName);
            case RECOVERY -> NotificationPayload.forRecovery(incident, endpointName);
        };
        try {
            log.info("Notification [{}] for endpoint {}: {}", kind, incident.endpointId(),
                objectMapper.writeValueAsString(payload));
            return NotificationResult.sent();
        } catch (JsonProcessingException e) {
            log.warn("Failed to render notification for incident {}: {}", incident.id(), e.getMessage());
            return NotificationResult.failed(e.getMessage());
        }
    }
}
