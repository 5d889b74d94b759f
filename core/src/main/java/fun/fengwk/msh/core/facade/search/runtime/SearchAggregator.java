package fun.fengwk.msh.core.facade.search.runtime;

import fun.fengwk.msh.core.facade.search.exception.AllQueriesFailedException;
import fun.fengwk.msh.core.facade.search.model.QueryOutcome;
import fun.fengwk.msh.core.facade.search.model.SearchResponse;
import fun.fengwk.msh.core.facade.search.model.SearchSummary;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Summarises per-query outcomes, partial failure is reported inside the response.
 *
 * @author fengwk
 */
public class SearchAggregator {

    /**
     * @throws AllQueriesFailedException when no query succeeded
     */
    public SearchResponse aggregate(List<QueryOutcome> outcomes) {
        int successful = 0;
        int failed = 0;
        for (QueryOutcome outcome : outcomes) {
            if (outcome.isSuccessful()) {
                successful++;
            } else {
                failed++;
            }
        }

        if (successful == 0 && failed > 0) {
            String message = outcomes.stream()
                .map(outcome -> outcome.getQuery() + ": " + outcome.getError())
                .collect(Collectors.joining("; "));
            throw new AllQueriesFailedException("all queries failed: " + message, outcomes);
        }

        return SearchResponse.builder()
            .searches(List.copyOf(outcomes))
            .summary(SearchSummary.builder()
                .total(outcomes.size())
                .successful(successful)
                .failed(failed)
                .build())
            .build();
    }

}
