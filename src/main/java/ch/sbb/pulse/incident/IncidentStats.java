package ch.sbb.pulse.incident;

import ch.sbb.pulse.model.IncidentSeverity;

import java.util.Map;

/**
 * Incident counts over a look-back period.
 * 
 * @param total incidents created in the period
 * @param active those not yet resolved
 * @param resolved those resolved
 * @param bySeverity count per severity, every severity present
 * @param avgResolutionTimeMs mean time from start to resolution of incidents with a
 *                            resolution time, or null if there are none
 */
public record IncidentStats(
    long total,
    long active,
    long resolved,
    Map<IncidentSeverity, Long> bySeverity,
    Double avgResolutionTimeMs
) {
}
