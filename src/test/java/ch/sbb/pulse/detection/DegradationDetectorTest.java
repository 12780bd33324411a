package ch.sbb.pulse.detection;

import ch.sbb.pulse.model.Baseline;
import ch.sbb.pulse.model.DegradationThresholds;
import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.IncidentSeverity;
import ch.sbb.pulse.model.IncidentStatus;
import ch.sbb.pulse.model.IncidentTimelineEntry;
import ch.sbb.pulse.model.IncidentType;
import ch.sbb.pulse.store.InMemoryBaselineStore;
import ch.sbb.pulse.store.InMemoryIncidentStore;
import ch.sbb.pulse.store.InMemoryProbeResultStore;
import ch.sbb.pulse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static ch.sbb.pulse.support.ProbeResults.error;
import static ch.sbb.pulse.support.ProbeResults.success;
import static ch.sbb.pulse.support.ProbeResults.timeout;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DegradationDetector")
class DegradationDetectorTest {
    
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String ENDPOINT = "ep-1";
    private static final String NAME = "Checkout API";
    
    private InMemoryProbeResultStore resultStore;
    private InMemoryBaselineStore baselineStore;
    private InMemoryIncidentStore incidentStore;
    private DegradationDetector detector;
    
    @BeforeEach
    void setUp() {
        resultStore = new InMemoryProbeResultStore();
        baselineStore = new InMemoryBaselineStore();
        incidentStore = new InMemoryIncidentStore();
        detector = new DegradationDetector(baselineStore, resultStore, incidentStore, new MutableClock(NOW));
    }
    
    private void baseline(double avg, double p95) {
        baselineStore.upsert(new Baseline("b-1", ENDPOINT, avg, avg, p95, p95, 5, 100, NOW.minus(Duration.ofHours(1))));
    }
    
    private Instant minutesAgo(int minutes) {
        return NOW.minus(Duration.ofMinutes(minutes));
    }
    
    private Optional<Incident> check() {
        return detector.checkForDegradation(ENDPOINT, NAME, DegradationThresholds.DEFAULT);
    }
    
    @Nested
    @DisplayName("Guards")
    class GuardTests {
        
        @Test
        @DisplayName("Should not detect without a baseline")
        void shouldSkipWithoutBaseline() {
            for (int i = 0; i < 5; i++) {
                resultStore.insert(error(ENDPOINT, minutesAgo(i)));
            }
            
            assertThat(check()).isEmpty();
        }
        
        @Test
        @DisplayName("Should not detect without recent probes")
        void shouldSkipWithoutRecentProbes() {
            baseline(100, 150);
            for (int i = 0; i < 5; i++) {
                resultStore.insert(error(ENDPOINT, minutesAgo(30 + i)));
            }
            
            assertThat(check()).isEmpty();
        }
        
        @Test
        @DisplayName("Should not detect a healthy endpoint")
        void shouldIgnoreHealthyEndpoint() {
            baseline(100, 150);
            for (int i = 0; i < 10; i++) {
                resultStore.insert(success(ENDPOINT, minutesAgo(i), 110));
            }
            
            assertThat(check()).isEmpty();
        }
        
        @Test
        @DisplayName("Should not detect while an incident is open")
        void shouldSkipWhenIncidentOpen() {
            baseline(100, 150);
            for (int i = 0; i < 5; i++) {
                resultStore.insert(error(ENDPOINT, minutesAgo(i)));
            }
            Incident open = Incident.builder()
                .id("inc-open").endpointId(ENDPOINT).type(IncidentType.HIGH_ERROR_RATE)
                .severity(IncidentSeverity.MAJOR).status(IncidentStatus.INVESTIGATING)
                .startedAt(minutesAgo(20)).title("t").description("d")
                .createdAt(minutesAgo(20)).updatedAt(minutesAgo(20)).build();
            incidentStore.insertIfNoneOpen(open,
                IncidentTimelineEntry.of(open.id(), IncidentStatus.ACTIVE, "detected", minutesAgo(20)));
            
            assertThat(check()).isEmpty();
        }
    }
    
    @Nested
    @DisplayName("Detection")
    class DetectionTests {
        
        @Test
        @DisplayName("Should classify partial timeouts as a minor timeout incident")
        void shouldDetectTimeouts() {
            baseline(100, 150);
            for (int i = 9; i >= 4; i--) {
                resultStore.insert(success(ENDPOINT, minutesAgo(i), 100));
            }
            for (int i = 3; i >= 0; i--) {
                resultStore.insert(timeout(ENDPOINT, minutesAgo(i)));
            }
            
            Optional<Incident> incident = check();
            
            assertThat(incident).isPresent();
            assertThat(incident.get().type()).isEqualTo(IncidentType.TIMEOUT);
            assertThat(incident.get().severity()).isEqualTo(IncidentSeverity.MINOR);
            assertThat(incident.get().status()).isEqualTo(IncidentStatus.ACTIVE);
            assertThat(incident.get().startedAt()).isEqualTo(NOW);
            assertThat(incident.get().resolvedAt()).isNull();
            assertThat(incident.get().title()).isEqualTo("Checkout API experiencing timeouts");
            assertThat(incident.get().description()).isEqualTo("Requests are timing out. Error rate: 40.0%");
        }
        
        @Test
        @DisplayName("Should describe a latency spike in whole milliseconds")
        void shouldDetectLatencySpike() {
            baseline(120, 150);
            for (int i = 0; i < 10; i++) {
                resultStore.insert(success(ENDPOINT, minutesAgo(i), 360));
            }
            
            Optional<Incident> incident = check();
            
            assertThat(incident).isPresent();
            assertThat(incident.get().type()).isEqualTo(IncidentType.LATENCY_SPIKE);
            assertThat(incident.get().severity()).isEqualTo(IncidentSeverity.MAJOR);
            assertThat(incident.get().title()).isEqualTo("Checkout API latency spike detected");
            assertThat(incident.get().description())
                .isEqualTo("Latency increased from 120ms to 360ms (3.0x baseline)");
        }
        
        @Test
        @DisplayName("Should report a complete outage as critical")
        void shouldDetectOutage() {
            baseline(100, 150);
            for (int i = 0; i < 6; i++) {
                resultStore.insert(error(ENDPOINT, minutesAgo(i)));
            }
            
            Optional<Incident> incident = check();
            
            assertThat(incident).isPresent();
            assertThat(incident.get().type()).isEqualTo(IncidentType.COMPLETE_OUTAGE);
            assertThat(incident.get().severity()).isEqualTo(IncidentSeverity.CRITICAL);
            assertThat(incident.get().title()).isEqualTo("Checkout API is down");
            assertThat(incident.get().description()).isEqualTo("All requests are failing. Error rate: 100.0%");
        }
        
        @Test
        @DisplayName("Should trip on consecutive failures below the error rate threshold")
        void shouldTripOnConsecutiveFailures() {
            baseline(100, 150);
            for (int i = 14; i >= 3; i--) {
                resultStore.insert(success(ENDPOINT, NOW.minusSeconds(i * 30L), 100));
            }
            for (int i = 2; i >= 0; i--) {
                resultStore.insert(error(ENDPOINT, NOW.minusSeconds(i * 30L)));
            }
            // 3 failures out of 40 probes keeps the error rate under 10%
            for (int i = 0; i < 25; i++) {
                resultStore.insert(success(ENDPOINT, minutesAgo(14).minusSeconds(i), 100));
            }
            
            Optional<Incident> incident = check();
            
            assertThat(incident).isPresent();
            assertThat(incident.get().type()).isEqualTo(IncidentType.LATENCY_SPIKE);
            assertThat(incident.get().severity()).isEqualTo(IncidentSeverity.MINOR);
        }
        
        @Test
        @DisplayName("Should use the thresholds passed in")
        void shouldHonorThresholds() {
            baseline(100, 150);
            for (int i = 0; i < 10; i++) {
                resultStore.insert(success(ENDPOINT, minutesAgo(i), 250));
            }
            
            assertThat(detector.checkForDegradation(ENDPOINT, NAME, new DegradationThresholds(3.0, 0.1, 3))).isEmpty();
            assertThat(detector.checkForDegradation(ENDPOINT, NAME, new DegradationThresholds(2.5, 0.1, 3))).isPresent();
        }
    }
    
    @Nested
    @DisplayName("Classification rules")
    class ClassificationTests {
        
        @Test
        @DisplayName("Should pick type in priority order")
        void shouldDetermineType() {
            assertThat(DegradationDetector.determineType(0.9, true)).isEqualTo(IncidentType.COMPLETE_OUTAGE);
            assertThat(DegradationDetector.determineType(0.31, true)).isEqualTo(IncidentType.TIMEOUT);
            assertThat(DegradationDetector.determineType(0.3, true)).isEqualTo(IncidentType.HIGH_ERROR_RATE);
            assertThat(DegradationDetector.determineType(0.5, false)).isEqualTo(IncidentType.HIGH_ERROR_RATE);
            assertThat(DegradationDetector.determineType(0.1, false)).isEqualTo(IncidentType.LATENCY_SPIKE);
        }
        
        @Test
        @DisplayName("Should grade severity")
        void shouldDetermineSeverity() {
            assertThat(DegradationDetector.determineSeverity(0.2, 1.0, 5)).isEqualTo(IncidentSeverity.CRITICAL);
            assertThat(DegradationDetector.determineSeverity(0.9, 1.0, 0)).isEqualTo(IncidentSeverity.CRITICAL);
            assertThat(DegradationDetector.determineSeverity(0.5, 1.0, 0)).isEqualTo(IncidentSeverity.MAJOR);
            assertThat(DegradationDetector.determineSeverity(0.0, 3.0, 0)).isEqualTo(IncidentSeverity.MAJOR);
            assertThat(DegradationDetector.determineSeverity(0.4, 2.9, 4)).isEqualTo(IncidentSeverity.MINOR);
        }
    }
}
