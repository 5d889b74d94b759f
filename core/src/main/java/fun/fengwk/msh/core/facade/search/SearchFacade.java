package fun.fengwk.msh.core.facade.search;

import fun.fengwk.msh.core.facade.search.model.SearchRequest;
import fun.fengwk.msh.core.facade.search.model.SearchResponse;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;

/**
 * @author fengwk
 */
public interface SearchFacade {

    /**
     * Execute every query of the request with provider fallback.
     */
    default SearchResponse search(SearchRequest request) {
        return search(request, new SearchCancellation());
    }

    /**
     * Execute every query of the request, aborting once {@code cancellation} fires.
     */
    SearchResponse search(SearchRequest request, SearchCancellation cancellation);

}
