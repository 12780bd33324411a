package ch.sbb.pulse.model;

/**
 * Classification of a single probe attempt.
 */
public enum ProbeOutcome {
    SUCCESS,
    ERROR,
    TIMEOUT
}
