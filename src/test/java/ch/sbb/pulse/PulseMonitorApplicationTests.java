package ch.sbb.pulse;

import ch.sbb.pulse.client.HttpProber;
import ch.sbb.pulse.notification.LoggingNotifier;
import ch.sbb.pulse.registry.EndpointRegistry;
import ch.sbb.pulse.registry.ProbeScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "pulse.monitor.probe.concurrency=3",
    "pulse.monitor.endpoints[0].id=status",
    "pulse.monitor.endpoints[0].url=https://status.example.com/health",
    "pulse.monitor.endpoints[0].active=false"
})
class PulseMonitorApplicationTests {
    
    @Autowired
    private ApplicationContext context;
    
    @Test
    void contextLoads() {
        assertThat(context.getBean(ProbeScheduler.class)).isNotNull();
        assertThat(context.getBean(HttpProber.class)).isNotNull();
        assertThat(context.getBean(LoggingNotifier.class)).isNotNull();
        assertThat(context.getBean(EndpointRegistry.class).getEndpoint("status")).isPresent();
    }
}
