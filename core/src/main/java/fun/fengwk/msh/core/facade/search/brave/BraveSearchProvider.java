package fun.fengwk.msh.core.facade.search.brave;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.facade.search.SearchProperties;
import fun.fengwk.msh.core.facade.search.exception.SearchProviderException;
import fun.fengwk.msh.core.facade.search.model.SearchQuery;
import fun.fengwk.msh.core.facade.search.model.SearchResultItem;
import fun.fengwk.msh.core.facade.search.model.SearchType;
import fun.fengwk.msh.core.facade.search.provider.AbstractSearchProvider;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;
import fun.fengwk.msh.core.facade.search.transport.RateLimitedTransportFactory;
import fun.fengwk.msh.core.utils.HtmlTexts;
import fun.fengwk.msh.core.utils.QueryStrings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brave Search API provider, serves every search type.
 *
 * <p>Local search enriches location hits with POI details and descriptions and falls back
 * to a web search when Brave returns no locations.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BraveSearchProvider extends AbstractSearchProvider {

    public static final String NAME = "brave";

    private static final int MAX_COUNT = 20;
    private static final int MAX_IMAGE_COUNT = 3;

    private final BraveProperties properties;

    public BraveSearchProvider(BraveProperties properties,
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
        return EnumSet.allOf(SearchType.class);
    }

    @Override
    public boolean isAvailable() {
        return hasText(properties.getApiKey());
    }

    @Override
    protected List<SearchResultItem> doSearch(SearchType type, SearchQuery query, SearchCancellation cancellation) {
        switch (type) {
            case WEB:
                return webSearch(query, cancellation);
            case IMAGE:
                return imageSearch(query, cancellation);
            case NEWS:
                return newsSearch(query, cancellation);
            case VIDEO:
                return videoSearch(query, cancellation);
            case LOCAL:
                return localSearch(query, cancellation);
            default:
                throw new SearchProviderException("unsupported search type for brave: " + type);
        }
    }

    private List<SearchResultItem> webSearch(SearchQuery query, SearchCancellation cancellation) {
        int count = resolveCount(query, MAX_COUNT, "web search");
        int offset = resolveNonNegative(query, "offset", 0);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query.getText());
        params.put("count", String.valueOf(count));
        params.put("offset", String.valueOf(offset));
        putFreshness(params, query);

        JsonNode root = get("/web/search", params, cancellation);
        return mapWebResults(root.path("web").path("results"), null);
    }

    private List<SearchResultItem> imageSearch(SearchQuery query, SearchCancellation cancellation) {
        int count = resolveCount(query, MAX_IMAGE_COUNT, "image search");

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query.getText());
        params.put("count", String.valueOf(count));

        JsonNode root = get("/images/search", params, cancellation);
        List<SearchResultItem> results = new ArrayList<>();
        for (JsonNode node : root.path("results")) {
            JsonNode props = node.path("properties");
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("imageURL", props.path("url").asText(""));
            putIfText(metadata, "format", textOrNull(props.get("format")));
            putIfPositive(metadata, "width", props.path("width").asInt(0));
            putIfPositive(metadata, "height", props.path("height").asInt(0));

            String title = HtmlTexts.clean(textOrNull(node.get("title")));
            results.add(SearchResultItem.builder()
                .title(title)
                .url(textOrNull(node.get("url")))
                .description("Image: " + (title == null ? "" : title))
                .metadata(metadata)
                .build());
        }
        return results;
    }

    private List<SearchResultItem> newsSearch(SearchQuery query, SearchCancellation cancellation) {
        int count = resolveCount(query, MAX_COUNT, "news search");

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query.getText());
        params.put("count", String.valueOf(count));
        putFreshness(params, query);

        JsonNode root = get("/news/search", params, cancellation);
        return mapWebResults(root.path("results"), null);
    }

    private List<SearchResultItem> videoSearch(SearchQuery query, SearchCancellation cancellation) {
        int count = resolveCount(query, MAX_COUNT, "video search");

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query.getText());
        params.put("count", String.valueOf(count));
        putFreshness(params, query);

        JsonNode root = get("/videos/search", params, cancellation);
        List<SearchResultItem> results = new ArrayList<>();
        for (JsonNode node : root.path("results")) {
            JsonNode video = node.path("video");
            Map<String, Object> metadata = new LinkedHashMap<>();
            putIfText(metadata, "duration", textOrNull(video.get("duration")));
            JsonNode views = video.get("views");
            if (views != null && !views.isNull()) {
                metadata.put("views", views.isNumber() ? views.numberValue() : views.asText());
            }
            putIfText(metadata, "creator", textOrNull(video.get("creator")));

            String title = HtmlTexts.clean(textOrNull(node.get("title")));
            results.add(SearchResultItem.builder()
                .title(title)
                .url(textOrNull(node.get("url")))
                .description("Video: " + (title == null ? "" : title))
                .metadata(metadata)
                .build());
        }
        return results;
    }

    private List<SearchResultItem> localSearch(SearchQuery query, SearchCancellation cancellation) {
        int count = resolveCount(query, MAX_COUNT, "local search");

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query.getText());
        params.put("count", String.valueOf(count));
        params.put("result_filter", "locations");

        JsonNode root = get("/web/search", params, cancellation);
        JsonNode locations = root.path("locations").path("results");
        if (locations.isArray() && !locations.isEmpty()) {
            return mapLocations(locations, count, cancellation);
        }

        log.info("no brave location results, falling back to web search, query={}", query.getText());
        Map<String, String> webParams = new LinkedHashMap<>();
        webParams.put("q", query.getText());
        webParams.put("count", String.valueOf(count));
        webParams.put("offset", "0");
        JsonNode web;
        try {
            web = get("/web/search", webParams, cancellation);
        } catch (SearchProviderException ex) {
            throw new SearchProviderException(
                "local search found no results and fallback web search failed: " + ex.getMessage(), ex);
        }
        return mapWebResults(web.path("web").path("results"), "internet_search_fallback");
    }

    private List<SearchResultItem> mapLocations(JsonNode locations, int count, SearchCancellation cancellation) {
        List<String> ids = new ArrayList<>();
        for (JsonNode location : locations) {
            String id = textOrNull(location.get("id"));
            if (hasText(id)) {
                ids.add(id);
            }
            if (ids.size() >= count) {
                break;
            }
        }

        Map<String, JsonNode> pois = new HashMap<>();
        Map<String, String> descriptions = new HashMap<>();
        if (!ids.isEmpty()) {
            JsonNode poiRoot = fetchLocalDetails("/local/pois", ids, cancellation);
            if (poiRoot != null) {
                int i = 0;
                for (JsonNode poi : poiRoot.path("results")) {
                    if (i >= ids.size()) {
                        break;
                    }
                    pois.put(ids.get(i++), poi);
                }
            }
            JsonNode descRoot = fetchLocalDetails("/local/descriptions", ids, cancellation);
            if (descRoot != null) {
                for (JsonNode desc : descRoot.path("results")) {
                    String id = textOrNull(desc.get("id"));
                    String text = textOrNull(desc.get("description"));
                    if (id != null && hasText(text)) {
                        descriptions.put(id, text);
                    }
                }
            }
        }

        List<SearchResultItem> results = new ArrayList<>();
        for (JsonNode location : locations) {
            if (results.size() >= count) {
                break;
            }
            String id = textOrNull(location.get("id"));
            Map<String, Object> metadata = new LinkedHashMap<>();
            JsonNode poi = id == null ? null : pois.get(id);
            if (poi != null) {
                putIfText(metadata, "address", textOrNull(poi.get("address")));
                putIfText(metadata, "phone", textOrNull(poi.get("phone_number")));
                double rating = poi.path("rating").asDouble(0);
                if (rating > 0) {
                    metadata.put("rating", rating);
                }
                putIfPositive(metadata, "reviewCount", poi.path("review_count").asInt(0));
                putIfText(metadata, "website", textOrNull(poi.get("website")));
                JsonNode hours = poi.get("hours");
                if (hours != null && hours.isObject() && !hours.isEmpty()) {
                    metadata.put("hours", objectMapper.convertValue(hours, Map.class));
                }
            }
            JsonNode coordinates = location.get("coordinates");
            if (coordinates != null && coordinates.isArray() && coordinates.size() >= 2) {
                List<Double> values = new ArrayList<>();
                coordinates.forEach(c -> values.add(c.asDouble()));
                metadata.put("coordinates", values);
            }

            String description = textOrNull(location.get("description"));
            if (id != null && descriptions.containsKey(id)) {
                description = descriptions.get(id);
            }
            results.add(SearchResultItem.builder()
                .title(HtmlTexts.clean(textOrNull(location.get("title"))))
                .url(textOrNull(location.get("url")))
                .description(HtmlTexts.clean(description))
                .metadata(metadata)
                .build());
        }
        return results;
    }

    /**
     * POI and description lookups only enrich the result, their failure is not fatal.
     */
    private JsonNode fetchLocalDetails(String path, List<String> ids, SearchCancellation cancellation) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            params.put("ids[" + i + "]", ids.get(i));
        }
        try {
            return get(path, params, cancellation);
        } catch (SearchProviderException ex) {
            log.warn("failed to fetch brave local details, path={}, error={}", path, ex.getMessage());
            return null;
        }
    }

    private List<SearchResultItem> mapWebResults(JsonNode nodes, String fallback) {
        List<SearchResultItem> results = new ArrayList<>();
        for (JsonNode node : nodes) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (fallback != null) {
                metadata.put("fallback", fallback);
            }
            putIfText(metadata, "age", textOrNull(node.get("age")));
            results.add(SearchResultItem.builder()
                .title(HtmlTexts.clean(textOrNull(node.get("title"))))
                .url(textOrNull(node.get("url")))
                .description(HtmlTexts.clean(textOrNull(node.get("description"))))
                .metadata(metadata)
                .build());
        }
        return results;
    }

    private JsonNode get(String path, Map<String, String> params, SearchCancellation cancellation) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(QueryStrings.buildUri(properties.getBaseUrl(), path, params))
            .header("Accept", "application/json")
            .header("X-Subscription-Token", properties.getApiKey())
            .header("User-Agent", USER_AGENT)
            .GET();
        return readTree(transport.execute(builder, cancellation));
    }

    private static void putFreshness(Map<String, String> params, SearchQuery query) {
        String freshness = query.getString("freshness");
        if (hasText(freshness)) {
            params.put("freshness", freshness.trim());
        }
    }

}
