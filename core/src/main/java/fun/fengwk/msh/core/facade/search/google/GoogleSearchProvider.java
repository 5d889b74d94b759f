package fun.fengwk.msh.core.facade.search.google;

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

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Google Custom Search JSON API provider, web and image search.
 *
 * @author fengwk
 */
@Component
public class GoogleSearchProvider extends AbstractSearchProvider {

    public static final String NAME = "google";

    private static final int MAX_COUNT = 10;

    private final GoogleProperties properties;

    public GoogleSearchProvider(GoogleProperties properties,
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
        return EnumSet.of(SearchType.WEB, SearchType.IMAGE);
    }

    @Override
    public boolean isAvailable() {
        return hasText(properties.getApiKey()) && hasText(properties.getSearchId());
    }

    @Override
    protected List<SearchResultItem> doSearch(SearchType type, SearchQuery query, SearchCancellation cancellation) {
        boolean image = type == SearchType.IMAGE;
        int count = resolveCount(query, MAX_COUNT, image ? "Google image search" : "Google search");
        int start = resolveNonNegative(query, "start", 0);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("key", properties.getApiKey());
        params.put("cx", properties.getSearchId());
        params.put("q", query.getText());
        params.put("num", String.valueOf(count));
        if (start > 0) {
            params.put("start", String.valueOf(start));
        }
        if (image) {
            params.put("searchType", "image");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(QueryStrings.buildUri(properties.getBaseUrl(), "", params))
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .GET();
        JsonNode root = readTree(transport.execute(builder, cancellation));

        List<SearchResultItem> results = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String title = textOrNull(item.get("title"));
            String snippet = textOrNull(item.get("snippet"));
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (image) {
                JsonNode imageNode = item.path("image");
                putIfText(metadata, "imageURL", textOrNull(imageNode.get("contextLink")));
                putIfPositive(metadata, "height", imageNode.path("height").asInt(0));
                putIfPositive(metadata, "width", imageNode.path("width").asInt(0));
                putIfText(metadata, "thumbnailURL", textOrNull(imageNode.get("thumbnailLink")));
                if (!hasText(snippet)) {
                    snippet = "Image: " + (title == null ? "" : title);
                }
            } else {
                putIfText(metadata, "displayLink", textOrNull(item.get("displayLink")));
            }
            results.add(SearchResultItem.builder()
                .title(title)
                .url(textOrNull(item.get("link")))
                .description(snippet)
                .metadata(metadata)
                .build());
        }
        return results;
    }

}
