package ch.sbb.pulse.model;

/**
 * Incident lifecycle status. Every status except {@link #RESOLVED} counts as open.
 */
public enum IncidentStatus {
    ACTIVE,
    INVESTIGATING,
    IDENTIFIED,
    MONITORING,
    RESOLVED;
    
    public boolean isOpen() {
        return this != RESOLVED;
    }
}
