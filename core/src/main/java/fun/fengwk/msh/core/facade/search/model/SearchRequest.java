package fun.fengwk.msh.core.facade.search.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search request input.
 *
 * @author fengwk
 */
@Data
public class SearchRequest {

    /**
     * Search type, default web.
     */
    private SearchType type = SearchType.WEB;

    /**
     * One or more independent queries, executed in parallel.
     */
    private List<String> queries = new ArrayList<>();

    /**
     * Explicit provider name, disables fallback when set.
     */
    private String provider;

    /**
     * Max number of results per query.
     */
    private Integer count;

    /**
     * Provider specific parameters shared by every query.
     */
    private Map<String, Object> params = new LinkedHashMap<>();

}
