package ch.sbb.pulse.store;

/**
 * Outcome of a guarded incident write.
 */
public enum IncidentWriteOutcome {
    /** The write was applied. */
    APPLIED,
    /** No incident with the given id exists. */
    NOT_FOUND,
    /** The incident was modified since it was read. */
    STALE,
    /** The write would leave two open incidents for one endpoint. */
    OPEN_INCIDENT_EXISTS
}
