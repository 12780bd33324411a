package ch.sbb.pulse.registry;

import ch.sbb.pulse.config.MonitorProperties;
import ch.sbb.pulse.model.Endpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EndpointRegistry")
class EndpointRegistryTest {
    
    private EndpointRegistry registry;
    
    @BeforeEach
    void setUp() {
        registry = new EndpointRegistry();
    }
    
    @Test
    @DisplayName("Should list active endpoints ordered by id")
    void shouldListActiveEndpoints() {
        registry.register(Endpoint.builder().id("b").url("https://b.example.com").build());
        registry.register(Endpoint.builder().id("a").url("https://a.example.com").build());
        registry.register(Endpoint.builder().id("c").url("https://c.example.com").active(false).build());
        
        assertThat(registry.listActive()).extracting(Endpoint::id).containsExactly("a", "b");
        assertThat(registry.listEndpoints()).hasSize(3);
    }
    
    @Test
    @DisplayName("Should replace and unregister endpoints")
    void shouldReplaceAndUnregister() {
        registry.register(Endpoint.builder().id("a").url("https://old.example.com").build());
        registry.register(Endpoint.builder().id("a").url("https://new.example.com").build());
        
        assertThat(registry.getEndpoint("a")).map(Endpoint::url).contains("https://new.example.com");
        
        registry.unregister("a");
        
        assertThat(registry.getEndpoint("a")).isEmpty();
    }
    
    @Test
    @DisplayName("Should apply endpoint defaults")
    void shouldApplyDefaults() {
        Endpoint endpoint = Endpoint.builder().id("a").url("https://a.example.com").method("head").build();
        
        assertThat(endpoint.name()).isEqualTo("a");
        assertThat(endpoint.method()).isEqualTo("HEAD");
        assertThat(endpoint.expectedStatusCodes()).containsExactlyInAnyOrder(200, 201, 204);
        assertThat(endpoint.sendsBody()).isFalse();
    }
    
    @Test
    @DisplayName("Should reject an endpoint without url or with a non-positive timeout")
    void shouldValidateEndpoint() {
        assertThatThrownBy(() -> Endpoint.builder().id("a").build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Endpoint.builder().id("a").url("https://a.example.com").timeout(Duration.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("Should build endpoints from configuration with the default timeout")
    void shouldConvertConfiguredEndpoint() {
        MonitorProperties.EndpointConfig config = new MonitorProperties.EndpointConfig();
        config.setId("status");
        config.setName("Status API");
        config.setUrl("https://status.example.com");
        config.setExpectedStatusCodes(Set.of(200));
        
        Endpoint endpoint = config.toEndpoint(Duration.ofSeconds(7));
        
        assertThat(endpoint.timeout()).isEqualTo(Duration.ofSeconds(7));
        assertThat(endpoint.expectedStatusCodes()).containsExactly(200);
        assertThat(endpoint.active()).isTrue();
    }
}
