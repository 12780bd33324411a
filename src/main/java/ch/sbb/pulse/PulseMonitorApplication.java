package ch.sbb.pulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Pulse monitor.
 * 
 * <p>Probes registered HTTP endpoints on a schedule, keeps a latency baseline per endpoint,
 * opens incidents when an endpoint degrades, resolves them when it recovers, and scores
 * each endpoint's reliability.</p>
 */
@SpringBootApplication
@EnableScheduling
public class PulseMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PulseMonitorApplication.class, args);
    }
}
