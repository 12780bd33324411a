package ch.sbb.pulse.model;

public enum Trend {
    IMPROVING,
    STABLE,
    DECLINING
}
