package fun.fengwk.msh.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.facade.search.SearchFacade;
import fun.fengwk.msh.core.facade.search.exception.SearchRequestValidationException;
import fun.fengwk.msh.core.facade.search.model.SearchRequest;
import fun.fengwk.msh.core.facade.search.model.SearchResponse;
import fun.fengwk.msh.core.facade.search.model.SearchType;
import fun.fengwk.msh.core.facade.search.provider.ProviderSelector;
import fun.fengwk.msh.core.facade.search.provider.SearchProvider;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * MCP ToolSpecification of internet_search, the description reflects the providers available at startup.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SearchToolSpecificationConfiguration {

    static final String TOOL_NAME = "internet_search";

    /**
     * Arguments copied into the provider specific parameters.
     */
    private static final List<String> PROVIDER_PARAMS = List.of(
        "offset", "freshness", "start", "pageno", "time_range", "language", "safesearch");

    @Bean
    public List<McpServerFeatures.SyncToolSpecification> searchToolSpecifications(SearchFacade searchFacade,
                                                                                 ProviderSelector providerSelector,
                                                                                 ObjectMapper objectMapper) {
        return List.of(
            McpServerFeatures.SyncToolSpecification.builder()
                .tool(buildTool(providerSelector))
                .callHandler((exchange, request) -> handleSearch(request, searchFacade, objectMapper))
                .build()
        );
    }

    static McpSchema.Tool buildTool(ProviderSelector providerSelector) {
        List<SearchProvider> providers = providerSelector.availableProviders();
        List<String> providerNames = providers.stream().map(SearchProvider::getName).collect(Collectors.toList());
        Set<SearchType> types = EnumSet.noneOf(SearchType.class);
        providers.forEach(provider -> types.addAll(provider.getSupportedTypes()));
        List<String> typeNames = types.stream().map(SearchType::getValue).collect(Collectors.toList());
        String defaultProvider = providerSelector.defaultProviderName().orElse("none");

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("type", enumProperty("string", "Search type. Optional, default web.", typeNames));
        properties.put("query", arrayProperty("One or more search queries to execute. Multiple queries run in parallel."));
        properties.put("provider", enumProperty("string",
            "Search provider to use, disables fallback to other providers. Optional, default " + defaultProvider + ".",
            providerNames));
        properties.put("count", property("number", "Number of results per query (limits vary by provider & type)."));
        if (providerNames.contains("brave")) {
            properties.put("offset", property("number", "Pagination offset (Brave web search only)."));
            properties.put("freshness", property("string", "Time filter for Brave (pd/pw/pm/py or custom range YYYY-MM-DDtoYYYY-MM-DD)."));
        }
        if (providerNames.contains("google")) {
            properties.put("start", property("number", "Start index for Google search pagination."));
        }
        if (providerNames.contains("searxng")) {
            properties.put("pageno", property("number", "Page number for SearXNG (starts at 1)."));
            properties.put("time_range", enumProperty("string", "Time range for SearXNG.", List.of("day", "month", "year")));
            properties.put("language", property("string", "Language code for SearXNG (e.g. all, en, fr, de)."));
            properties.put("safesearch", enumProperty("string",
                "Safe search filter for SearXNG (0: none, 1: moderate, 2: strict).", List.of("0", "1", "2")));
        }

        McpSchema.JsonSchema inputSchema = new McpSchema.JsonSchema(
            "object",
            properties,
            List.of("query"),
            false,
            null,
            null
        );

        return McpSchema.Tool.builder()
            .name(TOOL_NAME)
            .description(String.format("""
                Search the internet for information and links. Supports multiple queries executed in parallel.

                Available Providers: [%s]
                Default Provider: %s
                Search Types: [%s]
                Usage:
                - Required input: query (array of strings)
                - When a provider fails the next available provider is tried, unless provider is set
                Output:
                - JSON with one entry per query (results or error) and a summary of successful/failed queries
                %s""", String.join(", ", providerNames), defaultProvider, String.join(", ", typeNames),
                usageNotes(providerNames.size())))
            .inputSchema(inputSchema)
            .build();
    }

    static String usageNotes(int providerCount) {
        boolean multiple = providerCount > 1;
        StringBuilder notes = new StringBuilder("Common Patterns:\n");
        notes.append("- Use count to control result volume, more results give more context but higher latency\n");
        if (multiple) {
            notes.append("- Fallback is automatic when no provider is requested, specify a provider to disable fallback\n");
        }
        notes.append("Troubleshooting:\n");
        notes.append("- No results: try different search terms, reduce specificity or check the query for typos\n");
        notes.append("- Provider not available: check its settings, BRAVE_API_KEY for Brave, ")
            .append("GOOGLE_SEARCH_API_KEY and GOOGLE_SEARCH_ID for Google, KAGI_API_KEY for Kagi, ")
            .append("SEARXNG_BASE_URL for SearXNG\n");
        if (multiple) {
            notes.append("- Search type not supported by chosen provider: omit provider to use the default selection\n");
            notes.append("- Rate limit errors: other providers are tried automatically, if all fail wait before retrying ")
                .append("or specify a provider to bypass fallback\n");
            notes.append("- Which provider answered: see the 'provider' field of each search entry\n");
        } else {
            notes.append("- Rate limit errors: wait before retrying, limits vary by provider and search type\n");
        }
        return notes.toString();
    }

    static McpSchema.CallToolResult handleSearch(McpSchema.CallToolRequest request,
                                                 SearchFacade searchFacade,
                                                 ObjectMapper objectMapper) {
        try {
            Map<String, Object> arguments = request.arguments() == null ? Map.of() : request.arguments();
            SearchRequest searchRequest = parseRequest(arguments);
            SearchResponse response = searchFacade.search(searchRequest);
            return McpSchema.CallToolResult.builder()
                .addTextContent(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response))
                .isError(false)
                .build();
        } catch (Exception ex) {
            log.warn("internet_search tool call failed, error={}", ex.getMessage(), ex);
            return McpSchema.CallToolResult.builder()
                .addTextContent("error: " + ex.getMessage())
                .isError(true)
                .build();
        }
    }

    static SearchRequest parseRequest(Map<String, Object> arguments) {
        SearchRequest request = new SearchRequest();

        String typeValue = toString(arguments.get("type"));
        SearchType type = SearchType.of(typeValue);
        if (type == null) {
            throw new SearchRequestValidationException("unsupported search type: " + typeValue);
        }
        request.setType(type);
        request.setQueries(parseQueries(arguments));
        request.setProvider(toString(arguments.get("provider")));
        request.setCount(toInteger("count", arguments.get("count")));

        for (String name : PROVIDER_PARAMS) {
            Object value = arguments.get(name);
            if (value != null) {
                request.getParams().put(name, value);
            }
        }
        return request;
    }

    private static List<String> parseQueries(Map<String, Object> arguments) {
        if (!arguments.containsKey("query") || arguments.get("query") == null) {
            throw new SearchRequestValidationException(
                "missing required parameter 'query'. Provide search terms as an array (e.g., {\"query\": [\"golang best practices\"]})");
        }
        Object raw = arguments.get("query");
        if (!(raw instanceof List<?> items)) {
            throw new SearchRequestValidationException(
                "'query' must be an array of strings (e.g., {\"query\": [\"search term\"]})");
        }
        if (items.isEmpty()) {
            throw new SearchRequestValidationException("'query' array cannot be empty");
        }
        List<String> queries = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (!(item instanceof String s) || s.isBlank()) {
                throw new SearchRequestValidationException(
                    String.format("query at index %d must be a non-empty string", i));
            }
            queries.add(s);
        }
        return queries;
    }

    private static String toString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        return String.valueOf(value);
    }

    private static Integer toInteger(String name, Object value) {
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
            throw new SearchRequestValidationException(name + " must be a number, got " + text);
        }
    }

    private static Map<String, Object> property(String type, String description) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", type);
        property.put("description", description);
        return property;
    }

    private static Map<String, Object> enumProperty(String type, String description, List<String> values) {
        Map<String, Object> property = property(type, description);
        if (!values.isEmpty()) {
            property.put("enum", values);
        }
        return property;
    }

    private static Map<String, Object> arrayProperty(String description) {
        Map<String, Object> property = property("array", description);
        property.put("items", Map.of("type", "string"));
        return property;
    }

}
