package fun.fengwk.msh.core.facade.search.transport;

import fun.fengwk.msh.core.facade.search.exception.AuthenticationException;
import fun.fengwk.msh.core.facade.search.exception.SearchCancelledException;
import fun.fengwk.msh.core.facade.search.exception.SearchProviderException;
import fun.fengwk.msh.core.facade.search.exception.TransientNetworkException;
import fun.fengwk.msh.core.facade.search.exception.VendorRateLimitedException;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Outbound HTTP for a single provider: token bucket pacing, per attempt timeout and
 * linear retry on network failures.
 *
 * <p>Well-formed error responses are never retried. 401/403 become
 * {@link AuthenticationException}, 429 becomes {@link VendorRateLimitedException} so the
 * executor can move on to another provider.
 *
 * <p>Waiting for a rate limiter permit is bounded only by the cancellation signal.
 *
 * @author fengwk
 */
@Slf4j
public class RateLimitedTransport {

    private static final int MAX_ERROR_BODY_LENGTH = 512;

    /**
     * Permit waits end on cancellation, not on a deadline.
     */
    private static final Duration PERMIT_WAIT = Duration.ofDays(365);

    private final String providerName;
    private final HttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final Duration requestTimeout;
    private final int maxAttempts;

    public RateLimitedTransport(String providerName, HttpClient httpClient, TransportSettings settings) {
        this.providerName = providerName;
        this.httpClient = httpClient;
        this.requestTimeout = settings.getRequestTimeout();
        this.maxAttempts = Math.max(1, settings.getMaxAttempts());

        long refreshNanos = Math.max(1L, (long) (Duration.ofSeconds(1).toNanos() / settings.getRateLimit()));
        RateLimiterConfig rateLimiterConfig = RateLimiterConfig.custom()
            .limitForPeriod(1)
            .limitRefreshPeriod(Duration.ofNanos(refreshNanos))
            .timeoutDuration(PERMIT_WAIT)
            .build();
        this.rateLimiter = RateLimiter.of("search-" + providerName, rateLimiterConfig);

        long baseDelayMs = settings.getRetryBaseDelay().toMillis();
        IntervalFunction retryInterval = IntervalFunction.of(baseDelayMs, previous -> previous + baseDelayMs);
        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(retryInterval)
            .retryExceptions(IOException.class)
            .build();
        this.retry = Retry.of("search-" + providerName, retryConfig);
        this.retry.getEventPublisher().onRetry(event ->
            log.warn("retrying search request, provider={}, attempt={}, delay={}, error={}",
                providerName, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                describe(event.getLastThrowable())));
    }

    /**
     * Send the request and return the body of a 2xx response.
     *
     * @throws SearchProviderException on an error response or once retries are exhausted
     * @throws SearchCancelledException when the signal fires during any wait
     */
    public String execute(HttpRequest.Builder requestBuilder, SearchCancellation cancellation) {
        HttpRequest request = requestBuilder.timeout(requestTimeout).build();
        CheckedSupplier<HttpResponse<String>> send = Retry.decorateCheckedSupplier(retry, () -> {
            cancellation.throwIfCancelled();
            acquirePermit(cancellation);
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        });

        HttpResponse<String> response;
        try (SearchCancellation.Registration ignored = cancellation.interruptOnCancel()) {
            response = send.get();
        } catch (SearchCancelledException ex) {
            throw ex;
        } catch (Throwable ex) {
            throw translate(ex, request, cancellation);
        }
        return handleResponse(response);
    }

    public String getProviderName() {
        return providerName;
    }

    private RuntimeException translate(Throwable error, HttpRequest request, SearchCancellation cancellation) {
        // an interrupted retry wait may surface as an arbitrary runtime exception
        if (cancellation.isCancelled()) {
            return new SearchCancelledException(cancellation.getReason(), error);
        }
        if (error instanceof InterruptedException) {
            return cancellation.cancelledByInterrupt((InterruptedException) error);
        }
        if (error instanceof IOException) {
            log.warn("search request failed, provider={}, attempts={}, uri={}, error={}",
                providerName, maxAttempts, request.uri().getPath(), describe(error));
            return new TransientNetworkException(
                String.format("request failed after %d attempts: %s", maxAttempts, describe(error)), error);
        }
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        return new SearchProviderException("search request failed: " + describe(error), error);
    }

    private void acquirePermit(SearchCancellation cancellation) {
        if (rateLimiter.acquirePermission()) {
            return;
        }
        if (cancellation.isCancelled()) {
            throw new SearchCancelledException(cancellation.getReason());
        }
        throw new SearchCancelledException("interrupted");
    }

    private String handleResponse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            log.debug("search request successful, provider={}, status={}, size={}",
                providerName, status, response.body() == null ? 0 : response.body().length());
            return response.body();
        }

        String body = abbreviate(response.body());
        log.warn("search request rejected, provider={}, status={}, body={}", providerName, status, body);
        switch (status) {
            case 401:
                throw new AuthenticationException("authentication failed: invalid API key");
            case 403:
                throw new AuthenticationException("access forbidden: check your API key and subscription plan");
            case 429:
                throw new VendorRateLimitedException("rate limit exceeded: please wait before making more requests");
            default:
                throw new SearchProviderException(
                    String.format("API request failed with status %d: %s", status, body));
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return error.getClass().getSimpleName() + ": " + message;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.trim();
        if (trimmed.length() <= MAX_ERROR_BODY_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }

}
