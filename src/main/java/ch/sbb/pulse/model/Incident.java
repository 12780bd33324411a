package ch.sbb.pulse.model;

import java.time.Instant;

/**
 * A tracked degradation of one endpoint, from detection to resolution.
 * 
 * <p>Immutable record; status and severity changes produce new instances that the
 * incident store persists.</p>
 */
public record Incident(
    String id,
    String endpointId,
    IncidentType type,
    IncidentSeverity severity,
    IncidentStatus status,
    Instant startedAt,
    Instant resolvedAt,
    String title,
    String description,
    Instant createdAt,
    Instant updatedAt
) {
    
    public boolean isOpen() {
        return status.isOpen();
    }
    
    /**
     * Create a copy with a new status. {@code resolvedAt} is only replaced when a non-null
     * value is given, so reopening keeps the previous resolution time.
     */
    public Incident withStatus(IncidentStatus newStatus, Instant newResolvedAt, Instant now) {
        return new Incident(id, endpointId, type, severity, newStatus, startedAt,
            newResolvedAt != null ? newResolvedAt : resolvedAt, title, description, createdAt, now);
    }
    
    public Incident withSeverity(IncidentSeverity newSeverity, Instant now) {
        return new Incident(id, endpointId, type, newSeverity, status, startedAt, resolvedAt,
            title, description, createdAt, now);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String id;
        private String endpointId;
        private IncidentType type;
        private IncidentSeverity severity;
        private IncidentStatus status = IncidentStatus.ACTIVE;
        private Instant startedAt;
        private Instant resolvedAt;
        private String title;
        private String description;
        private Instant createdAt;
        private Instant updatedAt;
        
        public Builder id(String id) {
            this.id = id;
            return this;
        }
        
        public Builder endpointId(String endpointId) {
            this.endpointId = endpointId;
            return this;
        }
        
        public Builder type(IncidentType type) {
            this.type = type;
            return this;
        }
        
        public Builder severity(IncidentSeverity severity) {
            this.severity = severity;
            return this;
        }
        
        public Builder status(IncidentStatus status) {
            this.status = status;
            return this;
        }
        
        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }
        
        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }
        
        public Builder title(String title) {
            this.title = title;
            return this;
        }
        
        public Builder description(String description) {
            this.description = description;
            return this;
        }
        
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }
        
        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }
        
        public Incident build() {
            return new Incident(id, endpointId, type, severity, status, startedAt, resolvedAt,
                title, description, createdAt, updatedAt);
        }
    }
}
