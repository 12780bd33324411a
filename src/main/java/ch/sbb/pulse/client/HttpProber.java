package ch.sbb.pulse.client;

import ch.sbb.pulse.model.Endpoint;
import ch.sbb.pulse.model.ProbeOptions;
import ch.sbb.pulse.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP prober backed by {@link org.springframework.web.client.RestTemplate}.
 * 
 * <p>The exchange runs on the probe I/O executor while the calling thread waits on its
 * {@link Future} for at most the probe timeout. Whatever happens, the future is cancelled
 * on the way out, which interrupts an exchange that is still running and releases its
 * connection.</p>
 */
@Service
public class HttpProber implements Prober {
    
    private static final Logger log = LoggerFactory.getLogger(HttpProber.class);
    
    static final String USER_AGENT = "PulseMonitor-Probe/1.0";
    
    private final ProbeClientFactory clientFactory;
    private final ExecutorService ioExecutor;
    private final Clock clock;
    
    public HttpProber(ProbeClientFactory clientFactory,
                      @Qualifier("probeIoExecutor") ExecutorService ioExecutor,
                      Clock clock) {
        this.clientFactory = clientFactory;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
    }
    
    @Override
    public ProbeResult probe(Endpoint endpoint, ProbeOptions options) {
        Instant timestamp = clock.instant();
        
        Future<ProbeResult> exchange;
        try {
            exchange = ioExecutor.submit(() -> exchange(endpoint, options, timestamp));
        } catch (RejectedExecutionException e) {
            log.warn("Probe of endpoint {} rejected: {}", endpoint.id(), e.getMessage());
            return ProbeResult.error(endpoint.id(), timestamp, null, "Probe rejected: " + e.getMessage(),
                options.region());
        }
        
        try {
            return exchange.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Probe of endpoint {} timed out after {}", endpoint.id(), options.timeout());
            return ProbeResult.timeout(endpoint.id(), timestamp, options.region());
        } catch (ExecutionException e) {
            return classifyFailure(endpoint, options, timestamp, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.error(endpoint.id(), timestamp, null, "Probe interrupted", options.region());
        } finally {
            exchange.cancel(true);
        }
    }
    
    /**
     * Send the request and classify the response. Latency is measured up to the moment
     * the response headers are available.
     */
    private ProbeResult exchange(Endpoint endpoint, ProbeOptions options, Instant timestamp) {
        URI uri = URI.create(endpoint.url());
        HttpMethod method = HttpMethod.valueOf(endpoint.method());
        long start = System.nanoTime();
        
        log.debug("Probing endpoint {} at {} {}", endpoint.id(), method, uri);
        
        return clientFactory.forTimeout(options.timeout()).execute(uri, method,
            request -> writeRequest(endpoint, request),
            response -> {
                double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
                int status = response.getStatusCode().value();
                if (endpoint.expectedStatusCodes().contains(status)) {
                    return ProbeResult.success(endpoint.id(), timestamp, latencyMs, status, options.region());
                }
                return ProbeResult.error(endpoint.id(), timestamp, status, "Unexpected status: " + status,
                    options.region());
            });
    }
    
    private void writeRequest(Endpoint endpoint, ClientHttpRequest request) throws IOException {
        HttpHeaders headers = request.getHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        // custom headers may override the default
        endpoint.headers().forEach(headers::set);
        
        if (endpoint.sendsBody()) {
            request.getBody().write(endpoint.body().getBytes(StandardCharsets.UTF_8));
        }
    }
    
    private ProbeResult classifyFailure(Endpoint endpoint, ProbeOptions options, Instant timestamp, Throwable cause) {
        if (isTimeout(cause)) {
            log.debug("Probe of endpoint {} hit the client timeout: {}", endpoint.id(), cause.getMessage());
            return ProbeResult.timeout(endpoint.id(), timestamp, options.region());
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.debug("Probe of endpoint {} failed: {}", endpoint.id(), message);
        return ProbeResult.error(endpoint.id(), timestamp, null, message, options.region());
    }
    
    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
