package fun.fengwk.msh.core.facade.search.runtime;

import fun.fengwk.msh.core.facade.search.exception.AllQueriesFailedException;
import fun.fengwk.msh.core.facade.search.model.QueryOutcome;
import fun.fengwk.msh.core.facade.search.model.SearchResponse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SearchAggregator tests.
 *
 * @author fengwk
 */
class SearchAggregatorTest {

    private final SearchAggregator aggregator = new SearchAggregator();

    @Test
    void shouldSummarisePartialFailure() {
        List<QueryOutcome> outcomes = List.of(
            QueryOutcome.success("a", "brave", List.of()),
            QueryOutcome.failure("b", "search failed: brave: boom"),
            QueryOutcome.success("c", "google", List.of()));

        SearchResponse response = aggregator.aggregate(outcomes);

        assertThat(response.getSearches()).containsExactlyElementsOf(outcomes);
        assertThat(response.getSummary().getTotal()).isEqualTo(3);
        assertThat(response.getSummary().getSuccessful()).isEqualTo(2);
        assertThat(response.getSummary().getFailed()).isEqualTo(1);
    }

    @Test
    void shouldThrowWhenEveryQueryFailed() {
        List<QueryOutcome> outcomes = List.of(
            QueryOutcome.failure("a", "e1"),
            QueryOutcome.failure("b", "e2"));

        assertThatThrownBy(() -> aggregator.aggregate(outcomes))
            .isInstanceOf(AllQueriesFailedException.class)
            .hasMessage("all queries failed: a: e1; b: e2")
            .satisfies(ex -> assertThat(((AllQueriesFailedException) ex).getOutcomes()).hasSize(2));
    }

}
