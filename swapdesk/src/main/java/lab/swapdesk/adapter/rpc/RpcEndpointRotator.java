package lab.swapdesk.adapter.rpc;

import lab.swapdesk.common.NetworkTimeoutException;
import lab.swapdesk.common.RpcUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Round-robin endpoint selection with backoff between attempts.
 * Read-only calls fail over freely; broadcasts only fail over while the request provably never left.
 */
@Slf4j
public class RpcEndpointRotator {

    private final String name;
    private final List<String> endpoints;
    private final AtomicInteger index;
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(String name, List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required for " + name);
        }
        this.name = name;
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String getNextEndpoint() {
        int i = index.getAndIncrement() % endpoints.size();
        if (i < 0) {
            i += endpoints.size();
        }
        return endpoints.get(i);
    }

    /**
     * Runs an idempotent call, moving to the next endpoint on transient failures.
     * Gives up with {@link RpcUnavailableException} after every attempt failed.
     */
    public <T> T call(String operation, Function<String, T> call) {
        int attempts = Math.max(retryPolicy.maxAttempts(), endpoints.size());
        List<String> tried = new ArrayList<>();
        RestClientException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            String endpoint = getNextEndpoint();
            tried.add(endpoint);
            try {
                return call.apply(endpoint);
            } catch (RestClientException e) {
                if (!HttpFailures.transientFailure(e)) {
                    throw e;
                }
                last = e;
                log.warn("event=rpc.call.retry rpc={} op={} endpoint={} attempt={} error={}",
                        name, operation, endpoint, attempt + 1, e.getMessage());
                if (attempt + 1 < attempts) {
                    pause(retryPolicy.backoffMs(attempt));
                }
            }
        }
        throw new RpcUnavailableException(
                "%s unavailable for %s after %d attempts".formatted(name, operation, tried.size()), tried, last);
    }

    /**
     * Runs a non-idempotent call. Only failures that happened before the request was delivered move on to
     * the next endpoint; anything ambiguous surfaces as {@link NetworkTimeoutException} with
     * {@code possiblyDelivered = true}.
     */
    public <T> T submit(String operation, Function<String, T> call) {
        int attempts = Math.max(retryPolicy.maxAttempts(), endpoints.size());
        List<String> tried = new ArrayList<>();
        RestClientException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            String endpoint = getNextEndpoint();
            tried.add(endpoint);
            try {
                return call.apply(endpoint);
            } catch (RestClientException e) {
                if (HttpFailures.neverSent(e) || e instanceof HttpClientErrorException.TooManyRequests) {
                    last = e;
                    log.warn("event=rpc.submit.not_sent rpc={} op={} endpoint={} attempt={} error={}",
                            name, operation, endpoint, attempt + 1, e.getMessage());
                    if (attempt + 1 < attempts) {
                        pause(retryPolicy.backoffMs(attempt));
                    }
                    continue;
                }
                if (e instanceof ResourceAccessException || e instanceof HttpServerErrorException) {
                    log.warn("event=rpc.submit.ambiguous rpc={} op={} endpoint={} error={}",
                            name, operation, endpoint, e.getMessage());
                    throw new NetworkTimeoutException(
                            "%s did not confirm %s; the request may have been delivered".formatted(name, operation),
                            true, e);
                }
                throw e;
            }
        }
        throw new RpcUnavailableException(
                "%s unreachable for %s after %d attempts".formatted(name, operation, tried.size()), tried, last);
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    private static void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcUnavailableException("interrupted while waiting to retry");
        }
    }
}
