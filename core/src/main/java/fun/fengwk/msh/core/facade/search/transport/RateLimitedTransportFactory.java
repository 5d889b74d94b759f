package fun.fengwk.msh.core.facade.search.transport;

import fun.fengwk.msh.core.facade.search.SearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;

/**
 * Creates the transport owned by each provider.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitedTransportFactory {

    private final HttpClient searchHttpClient;
    private final SearchProperties searchProperties;

    public RateLimitedTransport create(String providerName) {
        TransportSettings settings = TransportSettings.of(searchProperties, providerName);
        log.info("search transport created, provider={}, rateLimit={}, timeoutMs={}, maxAttempts={}",
            providerName, settings.getRateLimit(), settings.getRequestTimeout().toMillis(), settings.getMaxAttempts());
        return new RateLimitedTransport(providerName, searchHttpClient, settings);
    }

}
