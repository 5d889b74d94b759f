package fun.fengwk.msh.core.configuration;

import fun.fengwk.msh.core.facade.search.SearchProperties;
import fun.fengwk.msh.core.facade.search.provider.ProviderSelector;
import fun.fengwk.msh.core.facade.search.provider.SearchProvider;
import fun.fengwk.msh.core.facade.search.provider.SearchProviderRegistry;
import fun.fengwk.msh.core.facade.search.runtime.ParallelQueryDispatcher;
import fun.fengwk.msh.core.facade.search.runtime.SearchAggregator;
import fun.fengwk.msh.core.facade.search.runtime.SingleQueryExecutor;
import fun.fengwk.msh.core.facade.search.security.ResultContentScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Search engine wiring.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
public class SearchConfiguration {

    @Bean
    public HttpClient searchHttpClient(HttpClientProxyProperties proxyProperties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL);
        ProxySelector proxySelector = proxyProperties.buildProxySelector();
        if (proxySelector != null) {
            builder.proxy(proxySelector);
        }
        return builder.build();
    }

    @Bean
    public SearchProviderRegistry searchProviderRegistry(List<SearchProvider> providers) {
        SearchProviderRegistry registry = new SearchProviderRegistry(providers);
        log.info("search providers registered, providers={}, available={}",
            registry.getProviders().stream().map(SearchProvider::getName).collect(Collectors.toList()),
            registry.getProviders().stream().filter(SearchProvider::isAvailable)
                .map(SearchProvider::getName).collect(Collectors.toList()));
        return registry;
    }

    @Bean
    public ProviderSelector providerSelector(SearchProviderRegistry registry, SearchProperties searchProperties) {
        return new ProviderSelector(registry, searchProperties.getProviderPriority());
    }

    @Bean
    public SingleQueryExecutor singleQueryExecutor(ResultContentScanner resultContentScanner,
                                                   SearchProperties searchProperties) {
        return new SingleQueryExecutor(resultContentScanner, searchProperties.getFallbackBaseDelay());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutorService(SearchProperties searchProperties) {
        AtomicInteger idGen = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("msh-search-worker-" + idGen.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(searchProperties.getMaxParallel(), threadFactory);
    }

    @Bean
    public ParallelQueryDispatcher parallelQueryDispatcher(ExecutorService searchExecutorService,
                                                           SearchProperties searchProperties) {
        return new ParallelQueryDispatcher(searchExecutorService, searchProperties.getMaxParallel());
    }

    @Bean
    public SearchAggregator searchAggregator() {
        return new SearchAggregator();
    }

}
