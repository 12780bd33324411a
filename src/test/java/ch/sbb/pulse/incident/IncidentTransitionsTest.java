package ch.sbb.pulse.incident;

import ch.sbb.pulse.model.IncidentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IncidentTransitions")
class IncidentTransitionsTest {
    
    @ParameterizedTest(name = "{0} -> {1} allowed: {2}")
    @CsvSource({
        "ACTIVE, INVESTIGATING, true",
        "ACTIVE, IDENTIFIED, true",
        "ACTIVE, RESOLVED, true",
        "ACTIVE, MONITORING, false",
        "ACTIVE, ACTIVE, false",
        "INVESTIGATING, IDENTIFIED, true",
        "INVESTIGATING, MONITORING, true",
        "INVESTIGATING, RESOLVED, true",
        "INVESTIGATING, ACTIVE, false",
        "IDENTIFIED, MONITORING, true",
        "IDENTIFIED, RESOLVED, true",
        "IDENTIFIED, INVESTIGATING, false",
        "IDENTIFIED, ACTIVE, false",
        "MONITORING, RESOLVED, true",
        "MONITORING, ACTIVE, true",
        "MONITORING, IDENTIFIED, false",
        "RESOLVED, ACTIVE, true",
        "RESOLVED, INVESTIGATING, false",
        "RESOLVED, RESOLVED, false"
    })
    void shouldFollowTransitionTable(IncidentStatus from, IncidentStatus to, boolean allowed) {
        assertThat(IncidentTransitions.isValidTransition(from, to)).isEqualTo(allowed);
    }
}
