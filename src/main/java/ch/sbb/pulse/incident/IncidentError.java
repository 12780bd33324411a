package ch.sbb.pulse.incident;

/**
 * Reasons an incident operation can be rejected.
 */
public enum IncidentError {
    NOT_FOUND,
    NOT_FOUND_OR_RESOLVED,
    INVALID_TRANSITION,
    CONCURRENT_MODIFICATION,
    OPEN_INCIDENT_EXISTS
}
