package ch.sbb.pulse.config;

import ch.sbb.pulse.model.DegradationThresholds;
import ch.sbb.pulse.model.Endpoint;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the monitor.
 */
@ConfigurationProperties(prefix = "pulse.monitor")
public class MonitorProperties {
    
    private ProbeConfig probe = new ProbeConfig();
    private DetectionConfig detection = new DetectionConfig();
    private BaselineConfig baseline = new BaselineConfig();
    private HealthConfig health = new HealthConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private RetentionConfig retention = new RetentionConfig();
    private NotificationConfig notification = new NotificationConfig();
    private List<EndpointConfig> endpoints = new ArrayList<>();
    
    // Getters and setters
    public ProbeConfig getProbe() { return probe; }
    public void setProbe(ProbeConfig probe) { this.probe = probe; }
    
    public DetectionConfig getDetection() { return detection; }
    public void setDetection(DetectionConfig detection) { this.detection = detection; }
    
    public BaselineConfig getBaseline() { return baseline; }
    public void setBaseline(BaselineConfig baseline) { this.baseline = baseline; }
    
    public HealthConfig getHealth() { return health; }
    public void setHealth(HealthConfig health) { this.health = health; }
    
    public ScoringConfig getScoring() { return scoring; }
    public void setScoring(ScoringConfig scoring) { this.scoring = scoring; }
    
    public RetentionConfig getRetention() { return retention; }
    public void setRetention(RetentionConfig retention) { this.retention = retention; }
    
    public NotificationConfig getNotification() { return notification; }
    public void setNotification(NotificationConfig notification) { this.notification = notification; }
    
    public List<EndpointConfig> getEndpoints() { return endpoints; }
    public void setEndpoints(List<EndpointConfig> endpoints) { this.endpoints = endpoints; }
    
    /**
     * Probe round configuration.
     */
    public static class ProbeConfig {
        private Duration interval = Duration.ofMinutes(1);
        private int concurrency = 10;
        private String region = "global";
        private Duration defaultTimeout = Duration.ofSeconds(10);
        
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        
        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
        
        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
    }
    
    /**
     * Degradation detection thresholds.
     */
    public static class DetectionConfig {
        private double latencyMultiplier = DegradationThresholds.DEFAULT.latencyMultiplier();
        private double errorRateThreshold = DegradationThresholds.DEFAULT.errorRateThreshold();
        private int consecutiveFailures = DegradationThresholds.DEFAULT.consecutiveFailures();
        
        public double getLatencyMultiplier() { return latencyMultiplier; }
        public void setLatencyMultiplier(double latencyMultiplier) { this.latencyMultiplier = latencyMultiplier; }
        
        public double getErrorRateThreshold() { return errorRateThreshold; }
        public void setErrorRateThreshold(double errorRateThreshold) { this.errorRateThreshold = errorRateThreshold; }
        
        public int getConsecutiveFailures() { return consecutiveFailures; }
        public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }
        
        /**
         * Snapshot the configured values as an immutable threshold set.
         */
        public DegradationThresholds toThresholds() {
            return new DegradationThresholds(latencyMultiplier, errorRateThreshold, consecutiveFailures);
        }
    }
    
    /**
     * Baseline calculation configuration.
     */
    public static class BaselineConfig {
        private Duration window = Duration.ofHours(168);
        private Duration interval = Duration.ofHours(1);
        
        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }
    
    /**
     * Health summary cache configuration.
     */
    public static class HealthConfig {
        private Duration cacheTtl = Duration.ofMinutes(5);
        private int cacheMaxSize = 10000;
        
        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
        
        public int getCacheMaxSize() { return cacheMaxSize; }
        public void setCacheMaxSize(int cacheMaxSize) { this.cacheMaxSize = cacheMaxSize; }
    }
    
    /**
     * Reliability scoring schedule.
     */
    public static class ScoringConfig {
        private Duration interval = Duration.ofHours(1);
        
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }
    
    /**
     * Probe history retention.
     */
    public static class RetentionConfig {
        private int probeDays = 30;
        private String cron = "0 0 0 * * *";
        
        public int getProbeDays() { return probeDays; }
        public void setProbeDays(int probeDays) { this.probeDays = probeDays; }
        
        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }
    }
    
    /**
     * Notification dispatch configuration.
     */
    public static class NotificationConfig {
        private RetryConfig retry = new RetryConfig();
        
        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }
    }
    
    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private Duration backoffDelay = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        
        public Duration getBackoffDelay() { return backoffDelay; }
        public void setBackoffDelay(Duration backoffDelay) { this.backoffDelay = backoffDelay; }
        
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }
    
    /**
     * Pre-configured endpoint.
     */
    public static class EndpointConfig {
        private String id;
        private String name;
        private String url;
        private String method = "GET";
        private Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private Duration probeInterval = Duration.ofMinutes(5);
        private Duration timeout;
        private Set<Integer> expectedStatusCodes = new LinkedHashSet<>(Endpoint.DEFAULT_EXPECTED_STATUS_CODES);
        private boolean active = true;
        
        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        
        public String getMethod() { return method; }
        public void setMethod(String method) { this.method = method; }
        
        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }
        
        public String getBody() { return body; }
        public void setBody(String body) { this.body = body; }
        
        public Duration getProbeInterval() { return probeInterval; }
        public void setProbeInterval(Duration probeInterval) { this.probeInterval = probeInterval; }
        
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        
        public Set<Integer> getExpectedStatusCodes() { return expectedStatusCodes; }
        public void setExpectedStatusCodes(Set<Integer> expectedStatusCodes) { this.expectedStatusCodes = expectedStatusCodes; }
        
        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }
        
        /**
         * Convert to an endpoint, falling back to the given timeout when none is configured.
         */
        public Endpoint toEndpoint(Duration defaultTimeout) {
            return Endpoint.builder()
                .id(id)
                .name(name)
                .url(url)
                .method(method)
                .headers(headers)
                .body(body)
                .probeInterval(probeInterval)
                .timeout(timeout != null ? timeout : defaultTimeout)
                .expectedStatusCodes(expectedStatusCodes)
                .active(active)
                .build();
        }
    }
}
