package ch.sbb.pulse.notification;

import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.IncidentSeverity;
import ch.sbb.pulse.model.IncidentStatus;
import ch.sbb.pulse.model.IncidentType;
import ch.sbb.pulse.store.InMemoryNotificationLogStore;
import ch.sbb.pulse.store.NotificationLogStore;
import ch.sbb.pulse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationDispatcher")
class NotificationDispatcherTest {
    
    private static final String NAME = "Checkout API";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    
    @Mock
    private Notifier notifier;
    
    @Mock
    private NotificationLogStore failingLogStore;
    
    private RetryTemplate retryTemplate;
    private InMemoryNotificationLogStore logStore;
    private MutableClock clock;
    private NotificationDispatcher dispatcher;
    private Incident incident;
    
    @BeforeEach
    void setUp() {
        retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(3));
        retryTemplate.setBackOffPolicy(new NoBackOffPolicy());
        logStore = new InMemoryNotificationLogStore();
        clock = new MutableClock(NOW);
        dispatcher = new NotificationDispatcher(notifier, retryTemplate, logStore, clock);
        
        incident = Incident.builder()
            .id("inc-1").endpointId("ep-1").type(IncidentType.COMPLETE_OUTAGE)
            .severity(IncidentSeverity.CRITICAL).status(IncidentStatus.ACTIVE)
            .startedAt(NOW).title("Checkout API is down").description("All requests are failing")
            .createdAt(NOW).updatedAt(NOW).build();
    }
    
    @Test
    @DisplayName("Should send once when the notifier succeeds")
    void shouldSendOnce() {
        when(notifier.send(incident, NAME, NotificationKind.ALERT)).thenReturn(NotificationResult.sent());
        
        NotificationResult result = dispatcher.dispatch(incident, NAME, NotificationKind.ALERT);
        
        assertThat(result.success()).isTrue();
        verify(notifier, times(1)).send(incident, NAME, NotificationKind.ALERT);
    }
    
    @Test
    @DisplayName("Should retry an unsuccessful send")
    void shouldRetryUnsuccessfulSend() {
        when(notifier.send(incident, NAME, NotificationKind.RECOVERY))
            .thenReturn(NotificationResult.failed("503 from push gateway"))
            .thenThrow(new IllegalStateException("connection reset"))
            .thenReturn(NotificationResult.sent());
        
        NotificationResult result = dispatcher.dispatch(incident, NAME, NotificationKind.RECOVERY);
        
        assertThat(result.success()).isTrue();
        verify(notifier, times(3)).send(incident, NAME, NotificationKind.RECOVERY);
    }
    
    @Test
    @DisplayName("Should return the last failure once attempts are exhausted")
    void shouldGiveUpAfterMaxAttempts() {
        when(notifier.send(incident, NAME, NotificationKind.ALERT))
            .thenReturn(NotificationResult.failed("invalid device token"));
        
        NotificationResult result = dispatcher.dispatch(incident, NAME, NotificationKind.ALERT);
        
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("invalid device token");
        verify(notifier, times(3)).send(incident, NAME, NotificationKind.ALERT);
    }
    
    @Test
    @DisplayName("Should not propagate notifier exceptions")
    void shouldContainExceptions() {
        when(notifier.send(incident, NAME, NotificationKind.ALERT))
            .thenThrow(new IllegalStateException("push gateway unreachable"));
        
        NotificationResult result = dispatcher.dispatch(incident, NAME, NotificationKind.ALERT);
        
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("push gateway unreachable");
    }
    
    @Test
    @DisplayName("Should log the delivered notification once")
    void shouldLogDelivery() {
        when(notifier.send(incident, NAME, NotificationKind.RECOVERY))
            .thenReturn(NotificationResult.failed("503 from push gateway"))
            .thenReturn(NotificationResult.sent());
        
        dispatcher.dispatch(incident, NAME, NotificationKind.RECOVERY);
        
        assertThat(logStore.listByIncident("inc-1")).singleElement().satisfies(entry -> {
            assertThat(entry.endpointId()).isEqualTo("ep-1");
            assertThat(entry.kind()).isEqualTo(NotificationKind.RECOVERY);
            assertThat(entry.success()).isTrue();
            assertThat(entry.error()).isNull();
            assertThat(entry.sentAt()).isEqualTo(NOW);
        });
    }
    
    @Test
    @DisplayName("Should log the error of an undelivered notification")
    void shouldLogFailure() {
        when(notifier.send(incident, NAME, NotificationKind.ALERT))
            .thenReturn(NotificationResult.failed("invalid device token"));
        
        dispatcher.dispatch(incident, NAME, NotificationKind.ALERT);
        
        assertThat(logStore.listByIncident("inc-1")).singleElement().satisfies(entry -> {
            assertThat(entry.kind()).isEqualTo(NotificationKind.ALERT);
            assertThat(entry.success()).isFalse();
            assertThat(entry.error()).isEqualTo("invalid device token");
        });
        assertThat(logStore.listByIncident("other")).isEmpty();
    }
    
    @Test
    @DisplayName("Should return the result when the notification log fails")
    void shouldContainLogFailure() {
        NotificationDispatcher withFailingLog = new NotificationDispatcher(notifier, retryTemplate, failingLogStore, clock);
        when(notifier.send(incident, NAME, NotificationKind.ALERT)).thenReturn(NotificationResult.sent());
        doThrow(new IllegalStateException("log unavailable")).when(failingLogStore).append(any(NotificationLogEntry.class));
        
        NotificationResult result = withFailingLog.dispatch(incident, NAME, NotificationKind.ALERT);
        
        assertThat(result.success()).isTrue();
        verify(notifier, times(1)).send(incident, NAME, NotificationKind.ALERT);
    }
}
