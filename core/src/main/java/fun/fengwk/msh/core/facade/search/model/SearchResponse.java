package fun.fengwk.msh.core.facade.search.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregated response of a multi-query search.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchResponse {

    /**
     * One outcome per query, in request order.
     */
    List<QueryOutcome> searches;

    /**
     * Success and failure counts over {@link #searches}.
     */
    SearchSummary summary;

}
