package ch.sbb.pulse.model;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Represents a monitored HTTP endpoint.
 * 
 * <p>Immutable record owned by the endpoint registry. The monitoring pipeline only reads it.</p>
 */
public record Endpoint(
    String id,
    String name,
    String url,
    String method,
    Map<String, String> headers,
    String body,
    Duration probeInterval,
    Duration timeout,
    Set<Integer> expectedStatusCodes,
    boolean active
) {
    
    public static final Set<Integer> DEFAULT_EXPECTED_STATUS_CODES = Set.of(200, 201, 204);
    
    /**
     * Compact constructor for validation and defaults.
     */
    public Endpoint {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Endpoint id cannot be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Endpoint url cannot be null or blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Endpoint timeout must be positive: " + timeout);
        }
        name = name != null ? name : id;
        method = method != null ? method.toUpperCase() : "GET";
        headers = headers != null ? Map.copyOf(new LinkedHashMap<>(headers)) : Map.of();
        expectedStatusCodes = expectedStatusCodes != null && !expectedStatusCodes.isEmpty()
            ? Set.copyOf(expectedStatusCodes)
            : DEFAULT_EXPECTED_STATUS_CODES;
    }
    
    /**
     * Whether a request body should be attached for this endpoint's method.
     */
    public boolean sendsBody() {
        return body != null && !"GET".equals(method) && !"HEAD".equals(method);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String id;
        private String name;
        private String url;
        private String method = "GET";
        private Map<String, String> headers = Map.of();
        private String body;
        private Duration probeInterval = Duration.ofMinutes(5);
        private Duration timeout = Duration.ofSeconds(10);
        private Set<Integer> expectedStatusCodes = DEFAULT_EXPECTED_STATUS_CODES;
        private boolean active = true;
        
        public Builder id(String id) {
            this.id = id;
            return this;
        }
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder url(String url) {
            this.url = url;
            return this;
        }
        
        public Builder method(String method) {
            this.method = method;
            return this;
        }
        
        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }
        
        public Builder body(String body) {
            this.body = body;
            return this;
        }
        
        public Builder probeInterval(Duration probeInterval) {
            this.probeInterval = probeInterval;
            return this;
        }
        
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }
        
        public Builder expectedStatusCodes(Set<Integer> expectedStatusCodes) {
            this.expectedStatusCodes = expectedStatusCodes;
            return this;
        }
        
        public Builder active(boolean active) {
            this.active = active;
            return this;
        }
        
        public Endpoint build() {
            return new Endpoint(id, name, url, method, headers, body, probeInterval, timeout,
                expectedStatusCodes, active);
        }
    }
}
