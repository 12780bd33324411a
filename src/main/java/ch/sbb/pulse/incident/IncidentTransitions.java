package ch.sbb.pulse.incident;

import ch.sbb.pulse.model.IncidentStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed incident status transitions.
 */
public final class IncidentTransitions {
    
    private static final Map<IncidentStatus, Set<IncidentStatus>> ALLOWED = new EnumMap<>(IncidentStatus.class);
    
    static {
        ALLOWED.put(IncidentStatus.ACTIVE,
            EnumSet.of(IncidentStatus.INVESTIGATING, IncidentStatus.IDENTIFIED, IncidentStatus.RESOLVED));
        ALLOWED.put(IncidentStatus.INVESTIGATING,
            EnumSet.of(IncidentStatus.IDENTIFIED, IncidentStatus.MONITORING, IncidentStatus.RESOLVED));
        ALLOWED.put(IncidentStatus.IDENTIFIED,
            EnumSet.of(IncidentStatus.MONITORING, IncidentStatus.RESOLVED));
        // an issue can recur while monitoring, and a resolved incident can be reopened
        ALLOWED.put(IncidentStatus.MONITORING,
            EnumSet.of(IncidentStatus.RESOLVED, IncidentStatus.ACTIVE));
        ALLOWED.put(IncidentStatus.RESOLVED,
            EnumSet.of(IncidentStatus.ACTIVE));
    }
    
    private IncidentTransitions() {
    }
    
    public static boolean isValidTransition(IncidentStatus from, IncidentStatus to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }
}
