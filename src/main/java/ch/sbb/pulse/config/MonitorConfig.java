package ch.sbb.pulse.config;

import ch.sbb.pulse.config.MonitorProperties.EndpointConfig;
import ch.sbb.pulse.registry.EndpointRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Configuration for notification retries and the pre-configured endpoint registry.
 */
@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfig {
    
    private static final Logger log = LoggerFactory.getLogger(MonitorConfig.class);
    
    private final MonitorProperties properties;
    
    public MonitorConfig(MonitorProperties properties) {
        this.properties = properties;
    }
    
    /**
     * Create RetryTemplate bean with exponential backoff for notification dispatch.
     */
    @Bean
    public RetryTemplate notificationRetryTemplate() {
        MonitorProperties.RetryConfig retry = properties.getNotification().getRetry();
        RetryTemplate retryTemplate = new RetryTemplate();
        
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy();
        retryPolicy.setMaxAttempts(retry.getMaxAttempts());
        retryTemplate.setRetryPolicy(retryPolicy);
        
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(retry.getBackoffDelay().toMillis());
        backOffPolicy.setMultiplier(retry.getBackoffMultiplier());
        retryTemplate.setBackOffPolicy(backOffPolicy);
        
        log.info("Created notification RetryTemplate with max attempts: {}, backoff delay: {}, multiplier: {}",
            retry.getMaxAttempts(), retry.getBackoffDelay(), retry.getBackoffMultiplier());
        
        return retryTemplate;
    }
    
    /**
     * Initialize endpoint registry with pre-configured endpoints.
     */
    @Bean
    public EndpointRegistry endpointRegistry() {
        EndpointRegistry registry = new EndpointRegistry();
        
        // Register pre-configured endpoints from YAML
        for (EndpointConfig config : properties.getEndpoints()) {
            registry.register(config.toEndpoint(properties.getProbe().getDefaultTimeout()));
        }
        
        log.info("Initialized EndpointRegistry with {} pre-configured endpoints", properties.getEndpoints().size());
        
        return registry;
    }
}
