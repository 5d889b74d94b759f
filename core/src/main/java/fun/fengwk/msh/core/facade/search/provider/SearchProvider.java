package fun.fengwk.msh.core.facade.search.provider;

import fun.fengwk.msh.core.facade.search.exception.SearchProviderException;
import fun.fengwk.msh.core.facade.search.model.SearchQuery;
import fun.fengwk.msh.core.facade.search.model.SearchResultItem;
import fun.fengwk.msh.core.facade.search.model.SearchType;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;

import java.util.List;
import java.util.Set;

/**
 * Pluggable search backend.
 *
 * @author fengwk
 */
public interface SearchProvider {

    /**
     * Unique provider name, e.g. brave.
     */
    String getName();

    /**
     * Search types this provider can serve.
     */
    Set<SearchType> getSupportedTypes();

    /**
     * Whether the required credentials/config are present.
     *
     * <p>Evaluated on every request, must not perform I/O.
     */
    boolean isAvailable();

    /**
     * Execute one query.
     *
     * <p>Callers only pass a type from {@link #getSupportedTypes()}.
     *
     * @return results in provider order, empty when nothing matched
     * @throws SearchProviderException when the backend cannot answer
     */
    List<SearchResultItem> search(SearchType type, SearchQuery query, SearchCancellation cancellation);

    default boolean supports(SearchType type) {
        return getSupportedTypes().contains(type);
    }

}
