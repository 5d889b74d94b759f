package fun.fengwk.msh.core.facade.search.provider;

import fun.fengwk.msh.core.facade.search.exception.SearchProviderException;
import fun.fengwk.msh.core.facade.search.model.SearchQuery;
import fun.fengwk.msh.core.facade.search.model.SearchResultItem;
import fun.fengwk.msh.core.facade.search.model.SearchType;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable provider for engine tests.
 *
 * @author fengwk
 */
public class FakeSearchProvider implements SearchProvider {

    private final String name;
    private final Set<SearchType> supportedTypes;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean available = true;
    private volatile Behavior behavior = (type, query, cancellation) -> List.of(
        SearchResultItem.builder()
            .title(query.getText() + " title")
            .url("https://example.com/" + query.getText().replace(' ', '-'))
            .description(query.getText() + " description")
            .build());

    public FakeSearchProvider(String name, SearchType... types) {
        this.name = name;
        this.supportedTypes = types.length == 0 ? EnumSet.of(SearchType.WEB) : EnumSet.of(types[0], types);
    }

    public static FakeSearchProvider failing(String name, String message) {
        FakeSearchProvider provider = new FakeSearchProvider(name);
        provider.setBehavior((type, query, cancellation) -> {
            throw new SearchProviderException(message);
        });
        return provider;
    }

    public FakeSearchProvider setBehavior(Behavior behavior) {
        this.behavior = behavior;
        return this;
    }

    public FakeSearchProvider setAvailable(boolean available) {
        this.available = available;
        return this;
    }

    public int getCalls() {
        return calls.get();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Set<SearchType> getSupportedTypes() {
        return supportedTypes;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public List<SearchResultItem> search(SearchType type, SearchQuery query, SearchCancellation cancellation) {
        calls.incrementAndGet();
        return behavior.search(type, query, cancellation);
    }

    @FunctionalInterface
    public interface Behavior {

        List<SearchResultItem> search(SearchType type, SearchQuery query, SearchCancellation cancellation);

    }

}
