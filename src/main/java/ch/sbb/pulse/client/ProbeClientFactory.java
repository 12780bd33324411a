package ch.sbb.pulse.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and caches one {@link RestTemplate} per probe timeout.
 * 
 * <p>Connect and read timeouts of each client equal the probe timeout, so an abandoned
 * exchange also ends on its own. Status codes are never treated as errors here.</p>
 */
@Component
public class ProbeClientFactory {
    
    private static final Logger log = LoggerFactory.getLogger(ProbeClientFactory.class);
    
    private final Map<Duration, RestTemplate> clients = new ConcurrentHashMap<>();
    
    /**
     * Get or create the client for a timeout.
     * 
     * @param timeout the probe timeout
     * @return the client
     */
    public RestTemplate forTimeout(Duration timeout) {
        return clients.computeIfAbsent(timeout, this::createClient);
    }
    
    private RestTemplate createClient(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        
        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.setErrorHandler(new PassThroughErrorHandler());
        
        log.info("Created probe client with connect/read timeout: {}", timeout);
        
        return restTemplate;
    }
    
    /**
     * Lets every response through to the response extractor.
     */
    static final class PassThroughErrorHandler implements ResponseErrorHandler {
        
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }
        
        @Override
        public void handleError(ClientHttpResponse response) {
            throw new IllegalStateException("Probe responses are classified by the prober");
        }
    }
}
