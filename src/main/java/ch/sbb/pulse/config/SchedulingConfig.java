package ch.sbb.pulse.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for probe rounds and the clock shared by all time windows.
 */
@Configuration
public class SchedulingConfig {
    
    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    /**
     * Workers that run the per-endpoint pipeline. The pool size caps how many endpoints
     * are probed at the same time.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService probeRoundExecutor(MonitorProperties properties) {
        int concurrency = properties.getProbe().getConcurrency();
        if (concurrency < 1) {
            throw new IllegalArgumentException("Probe concurrency must be at least 1: " + concurrency);
        }
        log.info("Created probe round executor with concurrency limit: {}", concurrency);
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("probe-round-"));
    }
    
    /**
     * Threads that carry the HTTP exchange of a probe so the caller can enforce its deadline.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService probeIoExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("probe-io-"));
    }
}
