package fun.fengwk.msh.core.facade.search.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Single normalized search result.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class SearchResultItem {

    /**
     * Result title.
     */
    String title;

    /**
     * Result URL.
     */
    String url;

    /**
     * Result snippet/description.
     */
    String description;

    /**
     * Provider specific extras, e.g. age, duration, coordinates.
     */
    @Builder.Default
    Map<String, Object> metadata = Map.of();

}
