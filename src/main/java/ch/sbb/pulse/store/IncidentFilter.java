package ch.sbb.pulse.store;

import ch.sbb.pulse.model.IncidentStatus;

/**
 * Filter for incident listings. Null fields match everything.
 */
public record IncidentFilter(
    String endpointId,
    IncidentStatus status,
    int limit,
    int offset
) {
    
    public static final int DEFAULT_LIMIT = 20;
    
    public IncidentFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        if (offset < 0) {
            offset = 0;
        }
    }
    
    public static IncidentFilter all() {
        return new IncidentFilter(null, null, DEFAULT_LIMIT, 0);
    }
    
    public static IncidentFilter byStatus(IncidentStatus status) {
        return new IncidentFilter(null, status, DEFAULT_LIMIT, 0);
    }
}
