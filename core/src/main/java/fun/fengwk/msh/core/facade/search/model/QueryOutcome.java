package fun.fengwk.msh.core.facade.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of running the provider fallback chain for one query.
 *
 * @author fengwk
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class QueryOutcome {

    /**
     * Query text as supplied by the caller.
     */
    String query;

    /**
     * Results in provider order, empty on zero hits or on failure.
     */
    @Builder.Default
    @JsonInclude(JsonInclude.Include.ALWAYS)
    List<SearchResultItem> results = List.of();

    /**
     * Name of the provider which answered.
     */
    String provider;

    /**
     * Error message, set only when no provider could answer.
     */
    String error;

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null || error.isBlank();
    }

    public static QueryOutcome success(String query, String provider, List<SearchResultItem> results) {
        return QueryOutcome.builder()
            .query(query)
            .provider(provider)
            .results(results == null ? List.of() : List.copyOf(results))
            .build();
    }

    public static QueryOutcome failure(String query, String error) {
        return QueryOutcome.builder()
            .query(query)
            .error(error)
            .build();
    }

}
