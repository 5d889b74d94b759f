package fun.fengwk.msh.core.facade.search.model;

import lombok.Builder;
import lombok.Value;

/**
 * @author fengwk
 */
@Value
@Builder
public class SearchSummary {

    int total;

    int successful;

    int failed;

}
