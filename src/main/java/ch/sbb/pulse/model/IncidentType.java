package ch.sbb.pulse.model;

public enum IncidentType {
    LATENCY_SPIKE,
    HIGH_ERROR_RATE,
    TIMEOUT,
    COMPLETE_OUTAGE
}
