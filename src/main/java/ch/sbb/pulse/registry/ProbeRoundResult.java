package ch.sbb.pulse.registry;

/**
 * Counters of one probe round.
 *
 * @param probed endpoints whose probe result was stored and processed
 * @param errors endpoints whose storage or downstream processing failed
 */
public record ProbeRoundResult(int probed, int errors) {
}
