package fun.fengwk.msh.core.facade.search.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of registered providers, fixed at startup.
 *
 * @author fengwk
 */
public class SearchProviderRegistry {

    private final Map<String, SearchProvider> providers;

    public SearchProviderRegistry(List<SearchProvider> providers) {
        Map<String, SearchProvider> byName = new LinkedHashMap<>();
        for (SearchProvider provider : providers) {
            SearchProvider previous = byName.putIfAbsent(provider.getName(), provider);
            if (previous != null) {
                throw new IllegalStateException("duplicate search provider: " + provider.getName());
            }
        }
        this.providers = Collections.unmodifiableMap(byName);
    }

    public Optional<SearchProvider> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(name));
    }

    /**
     * Providers in registration order.
     */
    public Collection<SearchProvider> getProviders() {
        return providers.values();
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }

}
