package fun.fengwk.msh.core.facade.search.impl;

import fun.fengwk.msh.core.facade.search.SearchFacade;
import fun.fengwk.msh.core.facade.search.exception.CapabilityException;
import fun.fengwk.msh.core.facade.search.exception.SearchRequestValidationException;
import fun.fengwk.msh.core.facade.search.model.QueryOutcome;
import fun.fengwk.msh.core.facade.search.model.SearchQuery;
import fun.fengwk.msh.core.facade.search.model.SearchRequest;
import fun.fengwk.msh.core.facade.search.model.SearchResponse;
import fun.fengwk.msh.core.facade.search.model.SearchType;
import fun.fengwk.msh.core.facade.search.provider.ProviderSelector;
import fun.fengwk.msh.core.facade.search.provider.SearchProvider;
import fun.fengwk.msh.core.facade.search.runtime.ParallelQueryDispatcher;
import fun.fengwk.msh.core.facade.search.runtime.SearchAggregator;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;
import fun.fengwk.msh.core.facade.search.runtime.SingleQueryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchFacadeImpl implements SearchFacade {

    private final ProviderSelector providerSelector;
    private final SingleQueryExecutor singleQueryExecutor;
    private final ParallelQueryDispatcher parallelQueryDispatcher;
    private final SearchAggregator searchAggregator;

    @Override
    public SearchResponse search(SearchRequest request, SearchCancellation cancellation) {
        validate(request);

        SearchType type = request.getType() == null ? SearchType.WEB : request.getType();
        String requestedProvider = request.getProvider() == null || request.getProvider().isBlank()
            ? null
            : request.getProvider().trim();
        boolean explicit = requestedProvider != null;

        // Fail fast before any I/O, the chain is reselected per query below.
        if (providerSelector.select(type, requestedProvider).isEmpty()) {
            throw new CapabilityException("no available providers support search type: " + type);
        }

        // Without a count every provider applies the default within its own limits.
        Integer count = request.getCount();
        Map<String, Object> params = normalizeParams(request.getParams());
        List<SearchQuery> queries = new ArrayList<>(request.getQueries().size());
        for (String text : request.getQueries()) {
            queries.add(SearchQuery.builder()
                .text(text)
                .count(count)
                .params(params)
                .build());
        }

        long start = System.currentTimeMillis();
        List<QueryOutcome> outcomes = parallelQueryDispatcher.dispatch(queries, (query, signal) -> {
            List<SearchProvider> candidates = providerSelector.select(type, requestedProvider);
            return singleQueryExecutor.execute(type, query, candidates, explicit, signal);
        }, cancellation);

        SearchResponse response = searchAggregator.aggregate(outcomes);
        log.info("search completed, type={}, provider={}, total={}, successful={}, failed={}, elapsedMs={}",
            type, requestedProvider, response.getSummary().getTotal(), response.getSummary().getSuccessful(),
            response.getSummary().getFailed(), System.currentTimeMillis() - start);
        return response;
    }

    private static void validate(SearchRequest request) {
        if (request == null || request.getQueries() == null) {
            throw new SearchRequestValidationException("missing required parameter 'query'");
        }
        if (request.getQueries().isEmpty()) {
            throw new SearchRequestValidationException("'query' array cannot be empty");
        }
        List<String> queries = request.getQueries();
        for (int i = 0; i < queries.size(); i++) {
            String query = queries.get(i);
            if (query == null || query.isBlank()) {
                throw new SearchRequestValidationException(
                    String.format("query at index %d must be a non-empty string", i));
            }
        }
    }

    private static Map<String, Object> normalizeParams(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (key != null && value != null) {
                normalized.put(key, value);
            }
        });
        return Collections.unmodifiableMap(normalized);
    }

}
