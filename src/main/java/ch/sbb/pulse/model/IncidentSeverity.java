package ch.sbb.pulse.model;

public enum IncidentSeverity {
    MINOR,
    MAJOR,
    CRITICAL
}
