package fun.fengwk.msh.core.facade.search;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SearchProperties tests.
 *
 * @author fengwk
 */
class SearchPropertiesTest {

    @Test
    void shouldApplyEnvironmentOverrides() {
        SearchProperties properties = new SearchProperties();
        properties.applyEnvironment(Map.of(
            "INTERNET_SEARCH_MAX_PARALLEL", "5",
            "INTERNET_SEARCH_RATE_LIMIT", "2.5",
            "INTERNET_SEARCH_BRAVE_RATE_LIMIT", "0.5")::get);

        assertThat(properties.getMaxParallel()).isEqualTo(5);
        assertThat(properties.getRateLimit()).isEqualTo(2.5);
        assertThat(properties.resolveRateLimit("brave")).isEqualTo(0.5);
        assertThat(properties.resolveRateLimit("kagi")).isEqualTo(2.5);
    }

    @Test
    void shouldFallBackToDefaultsOnInvalidEnvironment() {
        SearchProperties properties = new SearchProperties();
        properties.setMaxParallel(7);
        properties.applyEnvironment(Map.of(
            "INTERNET_SEARCH_MAX_PARALLEL", "abc",
            "INTERNET_SEARCH_RATE_LIMIT", "-1",
            "INTERNET_SEARCH_GOOGLE_RATE_LIMIT", "zero")::get);

        assertThat(properties.getMaxParallel()).isEqualTo(SearchProperties.DEFAULT_MAX_PARALLEL);
        assertThat(properties.getRateLimit()).isEqualTo(SearchProperties.DEFAULT_RATE_LIMIT);
        assertThat(properties.resolveRateLimit("google")).isEqualTo(SearchProperties.DEFAULT_RATE_LIMIT);
    }

    @Test
    void shouldNormalizeNonPositiveProperties() {
        SearchProperties properties = new SearchProperties();
        properties.setMaxParallel(0);
        properties.setFallbackBaseDelayMs(-5);
        properties.setRateLimit(0);
        properties.setMaxAttempts(-1);
        properties.getProviderRateLimits().put("searxng", 4.0);
        properties.applyEnvironment(name -> null);

        assertThat(properties.getMaxParallel()).isEqualTo(3);
        assertThat(properties.getFallbackBaseDelay().toMillis()).isEqualTo(1000);
        assertThat(properties.getRateLimit()).isEqualTo(1.0);
        assertThat(properties.getMaxAttempts()).isEqualTo(3);
        assertThat(properties.resolveRateLimit("searxng")).isEqualTo(4.0);
    }

}
