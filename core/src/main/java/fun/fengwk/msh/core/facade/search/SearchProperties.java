package fun.fengwk.msh.core.facade.search;

import fun.fengwk.msh.core.facade.search.provider.ProviderSelector;
import jakarta.annotation.PostConstruct;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Search orchestration configuration.
 *
 * <p>Legacy environment variables ({@code INTERNET_SEARCH_*}) override the bound values once at
 * startup. Invalid or non-positive values fall back to the defaults.
 *
 * @author fengwk
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "msh.search")
public class SearchProperties {

    public static final String MAX_PARALLEL_ENV = "INTERNET_SEARCH_MAX_PARALLEL";
    public static final String RATE_LIMIT_ENV = "INTERNET_SEARCH_RATE_LIMIT";

    public static final int DEFAULT_MAX_PARALLEL = 3;
    public static final long DEFAULT_FALLBACK_BASE_DELAY_MS = 1000;
    public static final double DEFAULT_RATE_LIMIT = 1.0;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30000;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 100;
    public static final int DEFAULT_COUNT = 5;

    /**
     * Max number of queries executed concurrently per request.
     */
    private int maxParallel = DEFAULT_MAX_PARALLEL;

    /**
     * Base delay between fallback attempts, multiplied by the attempt index.
     */
    private long fallbackBaseDelayMs = DEFAULT_FALLBACK_BASE_DELAY_MS;

    /**
     * Provider fallback order, most reliable first.
     */
    private List<String> providerPriority = new ArrayList<>(ProviderSelector.DEFAULT_PRIORITY);

    /**
     * Requests per second allowed for each provider.
     */
    private double rateLimit = DEFAULT_RATE_LIMIT;

    /**
     * Per provider requests per second, keyed by provider name.
     */
    private Map<String, Double> providerRateLimits = new LinkedHashMap<>();

    /**
     * Timeout of a single HTTP attempt.
     */
    private long requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;

    /**
     * Max attempts for connection and timeout failures.
     */
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    /**
     * Base delay between transport retries, multiplied by the attempt number.
     */
    private long retryBaseDelayMs = DEFAULT_RETRY_BASE_DELAY_MS;

    /**
     * Result count applied when the request does not specify one.
     */
    private int defaultCount = DEFAULT_COUNT;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Function<String, String> environment = System::getenv;

    @PostConstruct
    public void init() {
        applyEnvironment(environment);
    }

    /**
     * Normalize bound values and apply environment overrides.
     */
    public void applyEnvironment(Function<String, String> environment) {
        this.environment = environment;
        maxParallel = positiveOrDefault("max-parallel", maxParallel, DEFAULT_MAX_PARALLEL);
        fallbackBaseDelayMs = positiveOrDefault("fallback-base-delay-ms", fallbackBaseDelayMs, DEFAULT_FALLBACK_BASE_DELAY_MS);
        requestTimeoutMs = positiveOrDefault("request-timeout-ms", requestTimeoutMs, DEFAULT_REQUEST_TIMEOUT_MS);
        maxAttempts = positiveOrDefault("max-attempts", maxAttempts, DEFAULT_MAX_ATTEMPTS);
        retryBaseDelayMs = positiveOrDefault("retry-base-delay-ms", retryBaseDelayMs, DEFAULT_RETRY_BASE_DELAY_MS);
        defaultCount = positiveOrDefault("default-count", defaultCount, DEFAULT_COUNT);
        rateLimit = rateLimit > 0 ? rateLimit : DEFAULT_RATE_LIMIT;

        String maxParallelEnv = environment.apply(MAX_PARALLEL_ENV);
        if (maxParallelEnv != null && !maxParallelEnv.isBlank()) {
            maxParallel = parsePositiveInt(MAX_PARALLEL_ENV, maxParallelEnv, DEFAULT_MAX_PARALLEL);
        }
        String rateLimitEnv = environment.apply(RATE_LIMIT_ENV);
        if (rateLimitEnv != null && !rateLimitEnv.isBlank()) {
            rateLimit = parsePositiveDouble(RATE_LIMIT_ENV, rateLimitEnv, DEFAULT_RATE_LIMIT);
        }
    }

    /**
     * Requests per second for a provider: provider env, provider property, then the global limit.
     */
    public double resolveRateLimit(String providerName) {
        String envName = "INTERNET_SEARCH_" + providerName.toUpperCase(Locale.ROOT) + "_RATE_LIMIT";
        String envValue = environment.apply(envName);
        if (envValue != null && !envValue.isBlank()) {
            return parsePositiveDouble(envName, envValue, rateLimit);
        }
        Double configured = providerRateLimits.get(providerName);
        if (configured != null && configured > 0) {
            return configured;
        }
        return rateLimit;
    }

    public Duration getFallbackBaseDelay() {
        return Duration.ofMillis(fallbackBaseDelayMs);
    }

    public Duration getRequestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public Duration getRetryBaseDelay() {
        return Duration.ofMillis(retryBaseDelayMs);
    }

    private static int positiveOrDefault(String name, int value, int defaultValue) {
        if (value > 0) {
            return value;
        }
        log.warn("invalid search config, name={}, value={}, fallback={}", name, value, defaultValue);
        return defaultValue;
    }

    private static long positiveOrDefault(String name, long value, long defaultValue) {
        if (value > 0) {
            return value;
        }
        log.warn("invalid search config, name={}, value={}, fallback={}", name, value, defaultValue);
        return defaultValue;
    }

    private static int parsePositiveInt(String name, String value, int defaultValue) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            log.warn("invalid search env, name={}, value={}, fallback={}", name, value, defaultValue);
            return defaultValue;
        }
        if (parsed <= 0) {
            log.warn("invalid search env, name={}, value={}, fallback={}", name, value, defaultValue);
            return defaultValue;
        }
        return parsed;
    }

    private static double parsePositiveDouble(String name, String value, double defaultValue) {
        double parsed;
        try {
            parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            log.warn("invalid search env, name={}, value={}, fallback={}", name, value, defaultValue);
            return defaultValue;
        }
        if (!(parsed > 0) || Double.isInfinite(parsed)) {
            log.warn("invalid search env, name={}, value={}, fallback={}", name, value, defaultValue);
            return defaultValue;
        }
        return parsed;
    }

}
