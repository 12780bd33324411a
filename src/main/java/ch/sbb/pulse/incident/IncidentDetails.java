package ch.sbb.pulse.incident;

import ch.sbb.pulse.model.Incident;
import ch.sbb.pulse.model.IncidentTimelineEntry;

import java.util.List;

/**
 * An incident with its timeline, oldest entry first.
 */
public record IncidentDetails(Incident incident, List<IncidentTimelineEntry> timeline) {
}
