package fun.fengwk.msh.core.facade.search.searxng;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.facade.search.SearchProperties;
import fun.fengwk.msh.core.facade.search.model.SearchQuery;
import fun.fengwk.msh.core.facade.search.model.SearchResultItem;
import fun.fengwk.msh.core.facade.search.model.SearchType;
import fun.fengwk.msh.core.facade.search.provider.AbstractSearchProvider;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;
import fun.fengwk.msh.core.facade.search.transport.RateLimitedTransportFactory;
import fun.fengwk.msh.core.utils.QueryStrings;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SearXNG provider, every type except local maps to a SearXNG category.
 *
 * @author fengwk
 */
@Component
public class SearxngSearchProvider extends AbstractSearchProvider {

    public static final String NAME = "searxng";

    private static final String SEARCH_PATH = "/search";
    private static final Set<String> TIME_RANGES = Set.of("day", "month", "year");
    private static final Set<String> SAFESEARCH_LEVELS = Set.of("0", "1", "2");

    private final SearxngProperties properties;

    public SearxngSearchProvider(SearxngProperties properties,
                                 RateLimitedTransportFactory transportFactory,
                                 ObjectMapper objectMapper,
                                 SearchProperties searchProperties) {
        super(transportFactory.create(NAME), objectMapper, searchProperties.getDefaultCount());
        this.properties = properties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<SearchType> getSupportedTypes() {
        return EnumSet.of(SearchType.WEB, SearchType.IMAGE, SearchType.NEWS, SearchType.VIDEO);
    }

    @Override
    public boolean isAvailable() {
        String baseUrl = properties.getBaseUrl();
        if (!hasText(baseUrl)) {
            return false;
        }
        try {
            String scheme = URI.create(baseUrl.trim()).getScheme();
            return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    @Override
    protected List<SearchResultItem> doSearch(SearchType type, SearchQuery query, SearchCancellation cancellation) {
        Integer pagenoValue = readInteger(query, "pageno");
        int pageno = pagenoValue == null || pagenoValue < 1 ? 1 : pagenoValue;

        String timeRange = query.getString("time_range");
        if (timeRange != null && !TIME_RANGES.contains(timeRange)) {
            timeRange = null;
        }
        String language = query.getString("language");
        if (!hasText(language)) {
            language = "all";
        }
        String safesearch = normalizeSafesearch(query.getParams().get("safesearch"));

        Map<String, String> form = new LinkedHashMap<>();
        form.put("q", query.getText());
        form.put("format", "json");
        form.put("pageno", String.valueOf(pageno));
        form.put("categories", category(type));
        if (timeRange != null) {
            form.put("time_range", timeRange);
        }
        if (!"all".equals(language)) {
            form.put("language", language);
        }
        form.put("safesearch", safesearch);

        JsonNode root = readTree(transport.execute(buildRequest(form), cancellation));

        int limit = query.getCount() == null ? Integer.MAX_VALUE : Math.max(1, query.getCount());
        List<SearchResultItem> results = new ArrayList<>();
        for (JsonNode node : root.path("results")) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("category", type.getValue());
            if (!"all".equals(language)) {
                metadata.put("language", language);
            }
            if (timeRange != null) {
                metadata.put("time_range", timeRange);
            }
            results.add(SearchResultItem.builder()
                .title(textOrNull(node.get("title")))
                .url(textOrNull(node.get("url")))
                .description(textOrNull(node.get("content")))
                .metadata(metadata)
                .build());
            if (results.size() >= limit) {
                break;
            }
        }
        return results;
    }

    private HttpRequest.Builder buildRequest(Map<String, String> form) {
        boolean useGet = !"POST".equalsIgnoreCase(properties.getMethod());
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(QueryStrings.buildUri(properties.getBaseUrl(), SEARCH_PATH, useGet ? form : null))
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT);

        if (hasText(properties.getUsername()) && hasText(properties.getPassword())) {
            String credentials = properties.getUsername() + ":" + properties.getPassword();
            builder.header("Authorization",
                "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }

        if (useGet) {
            builder.GET();
        } else {
            builder.header("Content-Type", "application/x-www-form-urlencoded")
                .POST(BodyPublishers.ofString(QueryStrings.encode(form)));
        }
        return builder;
    }

    private static String category(SearchType type) {
        switch (type) {
            case IMAGE:
                return "images";
            case NEWS:
                return "news";
            case VIDEO:
                return "videos";
            default:
                return "general";
        }
    }

    private static String normalizeSafesearch(Object value) {
        if (value == null) {
            return "0";
        }
        String text = value instanceof Number number ? String.valueOf(number.intValue()) : String.valueOf(value).trim();
        return SAFESEARCH_LEVELS.contains(text) ? text : "0";
    }

}
