package fun.fengwk.msh.core.facade.search.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One query of a search request, with the provider specific parameters it carries.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchQuery {

    /**
     * Query text.
     */
    String text;

    /**
     * Requested result count, {@code null} lets the provider choose.
     */
    Integer count;

    /**
     * Provider specific parameters, e.g. freshness, pageno, language.
     */
    @Builder.Default
    Map<String, Object> params = Map.of();

    /**
     * Read a string parameter.
     */
    public String getString(String name) {
        Object value = params.get(name);
        if (value == null) {
            return null;
        }
        return String.valueOf(value);
    }

    /**
     * Read an integer parameter, accepting numbers and numeric strings.
     *
     * @throws IllegalArgumentException when the parameter is not numeric
     */
    public Integer getInteger(String name) {
        Object value = params.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return (int) Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a number, got " + text, ex);
        }
    }

}
