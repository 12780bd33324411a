package ch.sbb.pulse.incident;

import ch.sbb.pulse.model.IncidentStatus;

/**
 * Result of an incident lifecycle operation.
 * 
 * <p>Rejections are returned, not thrown. For {@link IncidentError#INVALID_TRANSITION} the
 * rejected from/to pair is included.</p>
 */
public record IncidentOperationResult(
    boolean success,
    IncidentError error,
    String message,
    IncidentStatus from,
    IncidentStatus to
) {
    
    public static IncidentOperationResult ok() {
        return new IncidentOperationResult(true, null, null, null, null);
    }
    
    public static IncidentOperationResult notFound() {
        return failure(IncidentError.NOT_FOUND, "Incident not found");
    }
    
    public static IncidentOperationResult notFoundOrResolved() {
        return failure(IncidentError.NOT_FOUND_OR_RESOLVED, "Incident not found or already resolved");
    }
    
    public static IncidentOperationResult invalidTransition(IncidentStatus from, IncidentStatus to) {
        return new IncidentOperationResult(false, IncidentError.INVALID_TRANSITION,
            "Invalid transition from " + from + " to " + to, from, to);
    }
    
    public static IncidentOperationResult failure(IncidentError error, String message) {
        return new IncidentOperationResult(false, error, message, null, null);
    }
}
