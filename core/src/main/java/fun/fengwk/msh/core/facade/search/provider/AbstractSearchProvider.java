package fun.fengwk.msh.core.facade.search.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.facade.search.exception.CapabilityException;
import fun.fengwk.msh.core.facade.search.exception.SearchProviderException;
import fun.fengwk.msh.core.facade.search.model.SearchQuery;
import fun.fengwk.msh.core.facade.search.model.SearchResultItem;
import fun.fengwk.msh.core.facade.search.model.SearchType;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;
import fun.fengwk.msh.core.facade.search.transport.RateLimitedTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Base of the JSON API providers: type check, argument helpers and response parsing.
 *
 * @author fengwk
 */
@Slf4j
public abstract class AbstractSearchProvider implements SearchProvider {

    protected static final String USER_AGENT = "my-search-hub/1.0";

    protected final RateLimitedTransport transport;
    protected final ObjectMapper objectMapper;
    private final int defaultCount;

    protected AbstractSearchProvider(RateLimitedTransport transport, ObjectMapper objectMapper, int defaultCount) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.defaultCount = defaultCount;
    }

    @Override
    public List<SearchResultItem> search(SearchType type, SearchQuery query, SearchCancellation cancellation) {
        if (!supports(type)) {
            throw new CapabilityException("unsupported search type for " + getName() + ": " + type);
        }
        List<SearchResultItem> results = doSearch(type, query, cancellation);
        log.debug("search provider answered, provider={}, type={}, query={}, results={}",
            getName(), type, query.getText(), results.size());
        return results;
    }

    /**
     * Execute a query of a supported type.
     */
    protected abstract List<SearchResultItem> doSearch(SearchType type, SearchQuery query, SearchCancellation cancellation);

    /**
     * Requested count checked against the vendor limits, or the configured default clamped into them.
     *
     * @param label search kind used in the error message, e.g. "web search"
     */
    protected int resolveCount(SearchQuery query, int max, String label) {
        Integer count = query.getCount();
        if (count == null) {
            return Math.max(1, Math.min(defaultCount, max));
        }
        if (count < 1 || count > max) {
            throw new SearchProviderException(
                String.format("count must be between 1 and %d for %s, got %d", max, label, count));
        }
        return count;
    }

    /**
     * Optional non-negative integer parameter.
     */
    protected int resolveNonNegative(SearchQuery query, String name, int defaultValue) {
        Integer value = readInteger(query, name);
        if (value == null) {
            return defaultValue;
        }
        if (value < 0) {
            throw new SearchProviderException(String.format("%s must be >= 0, got %d", name, value));
        }
        return value;
    }

    protected Integer readInteger(SearchQuery query, String name) {
        try {
            return query.getInteger(name);
        } catch (IllegalArgumentException ex) {
            throw new SearchProviderException(ex.getMessage(), ex);
        }
    }

    protected JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw new SearchProviderException("empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new SearchProviderException("failed to parse response: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Extract string value from JSON node.
     */
    protected static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    protected static void putIfText(Map<String, Object> metadata, String key, String value) {
        if (hasText(value)) {
            metadata.put(key, value);
        }
    }

    protected static void putIfPositive(Map<String, Object> metadata, String key, int value) {
        if (value > 0) {
            metadata.put(key, value);
        }
    }

}
