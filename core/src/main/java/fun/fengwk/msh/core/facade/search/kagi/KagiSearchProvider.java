package fun.fengwk.msh.core.facade.search.kagi;

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
import org.springframework.stereotype.Component;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kagi Search API provider, web search only.
 *
 * @author fengwk
 */
@Component
public class KagiSearchProvider extends AbstractSearchProvider {

    public static final String NAME = "kagi";

    private static final int MAX_COUNT = 25;

    /**
     * Result type of a search hit, other types are related searches.
     */
    private static final int SEARCH_RESULT_TYPE = 0;

    private final KagiProperties properties;

    public KagiSearchProvider(KagiProperties properties,
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
        return EnumSet.of(SearchType.WEB);
    }

    @Override
    public boolean isAvailable() {
        return hasText(properties.getApiKey());
    }

    @Override
    protected List<SearchResultItem> doSearch(SearchType type, SearchQuery query, SearchCancellation cancellation) {
        int limit = resolveCount(query, MAX_COUNT, "Kagi search");

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query.getText());
        params.put("limit", String.valueOf(limit));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(QueryStrings.buildUri(properties.getBaseUrl(), "/search", params))
            .header("Accept", "application/json")
            .header("Authorization", "Bot " + properties.getApiKey())
            .header("User-Agent", USER_AGENT)
            .GET();
        JsonNode root = readTree(transport.execute(builder, cancellation));

        JsonNode errors = root.path("error");
        if (errors.isArray() && !errors.isEmpty()) {
            JsonNode first = errors.get(0);
            throw new SearchProviderException(String.format("Kagi API error %d: %s",
                first.path("code").asInt(0), first.path("msg").asText("")));
        }

        List<SearchResultItem> results = new ArrayList<>();
        for (JsonNode node : root.path("data")) {
            if (node.path("t").asInt(-1) != SEARCH_RESULT_TYPE) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("rank", node.path("rank").asInt(0));
            putIfText(metadata, "published", textOrNull(node.get("published")));
            JsonNode thumbnail = node.get("thumbnail");
            if (thumbnail != null && thumbnail.isObject()) {
                Map<String, Object> thumbnailInfo = new LinkedHashMap<>();
                thumbnailInfo.put("url", thumbnail.path("url").asText(""));
                putIfPositive(thumbnailInfo, "width", thumbnail.path("width").asInt(0));
                putIfPositive(thumbnailInfo, "height", thumbnail.path("height").asInt(0));
                metadata.put("thumbnail", thumbnailInfo);
            }
            results.add(SearchResultItem.builder()
                .title(HtmlTexts.clean(textOrNull(node.get("title"))))
                .url(textOrNull(node.get("url")))
                .description(HtmlTexts.clean(textOrNull(node.get("snippet"))))
                .metadata(metadata)
                .build());
        }
        return results;
    }

}
