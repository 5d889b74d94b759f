package fun.fengwk.msh.core.facade.search.exception;

import fun.fengwk.msh.core.facade.search.model.QueryOutcome;

import java.util.List;

/**
 * No provider answered any query of the batch.
 *
 * @author fengwk
 */
public class AllQueriesFailedException extends RuntimeException {

    private final List<QueryOutcome> outcomes;

    public AllQueriesFailedException(String message, List<QueryOutcome> outcomes) {
        super(message);
        this.outcomes = List.copyOf(outcomes);
    }

    public List<QueryOutcome> getOutcomes() {
        return outcomes;
    }

}
