package fun.fengwk.msh.core.facade.search.provider;

import fun.fengwk.msh.core.facade.search.model.SearchType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Orders the providers to try for a search type.
 *
 * @author fengwk
 */
@Slf4j
public class ProviderSelector {

    /**
     * Most capable/reliable first.
     */
    public static final List<String> DEFAULT_PRIORITY = List.of("brave", "google", "kagi", "searxng", "duckduckgo");

    private final SearchProviderRegistry registry;
    private final List<String> priority;

    public ProviderSelector(SearchProviderRegistry registry, List<String> priority) {
        this.registry = registry;
        this.priority = priority == null || priority.isEmpty() ? DEFAULT_PRIORITY : List.copyOf(priority);
    }

    /**
     * Select candidates in the order they should be tried.
     *
     * <p>An explicit provider yields at most that provider, fallback is disabled.
     * Otherwise qualifying providers follow the priority list, then any remaining
     * qualifying provider in registration order.
     *
     * @param requestedProvider explicit provider name, blank means automatic
     * @return ordered candidates, empty when none can serve the type
     */
    public List<SearchProvider> select(SearchType type, String requestedProvider) {
        if (requestedProvider != null && !requestedProvider.isBlank()) {
            Optional<SearchProvider> provider = registry.find(requestedProvider.trim());
            if (provider.isPresent() && qualifies(provider.get(), type)) {
                return List.of(provider.get());
            }
            log.debug("requested provider cannot serve search, provider={}, type={}", requestedProvider, type);
            return List.of();
        }

        List<SearchProvider> candidates = new ArrayList<>();
        for (SearchProvider provider : availableProviders()) {
            if (provider.supports(type)) {
                candidates.add(provider);
            }
        }
        return candidates;
    }

    /**
     * Available providers, priority order first then registration order.
     */
    public List<SearchProvider> availableProviders() {
        Set<SearchProvider> ordered = new LinkedHashSet<>();
        for (String name : priority) {
            registry.find(name)
                .filter(SearchProvider::isAvailable)
                .ifPresent(ordered::add);
        }
        for (SearchProvider provider : registry.getProviders()) {
            if (provider.isAvailable()) {
                ordered.add(provider);
            }
        }
        return new ArrayList<>(ordered);
    }

    /**
     * First available provider by priority, used as the advertised default.
     */
    public Optional<String> defaultProviderName() {
        return availableProviders().stream().findFirst().map(SearchProvider::getName);
    }

    private static boolean qualifies(SearchProvider provider, SearchType type) {
        return provider.isAvailable() && provider.supports(type);
    }

}
