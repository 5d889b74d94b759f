package fun.fengwk.msh.core.facade.search.transport;

import fun.fengwk.msh.core.facade.search.SearchProperties;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Configuration for one provider transport.
 *
 * @author fengwk
 */
@Data
@Builder
public class TransportSettings {

    /**
     * Requests per second, one token per {@code 1 / rateLimit} seconds with a burst of 1.
     */
    @Builder.Default
    private double rateLimit = SearchProperties.DEFAULT_RATE_LIMIT;

    /**
     * Timeout of a single attempt.
     */
    @Builder.Default
    private Duration requestTimeout = Duration.ofMillis(SearchProperties.DEFAULT_REQUEST_TIMEOUT_MS);

    /**
     * Max attempts for connection and timeout failures.
     */
    @Builder.Default
    private int maxAttempts = SearchProperties.DEFAULT_MAX_ATTEMPTS;

    /**
     * Retry delay is {@code attempt * retryBaseDelay}.
     */
    @Builder.Default
    private Duration retryBaseDelay = Duration.ofMillis(SearchProperties.DEFAULT_RETRY_BASE_DELAY_MS);

    public static TransportSettings of(SearchProperties properties, String providerName) {
        return TransportSettings.builder()
            .rateLimit(properties.resolveRateLimit(providerName))
            .requestTimeout(properties.getRequestTimeout())
            .maxAttempts(properties.getMaxAttempts())
            .retryBaseDelay(properties.getRetryBaseDelay())
            .build();
    }

}
