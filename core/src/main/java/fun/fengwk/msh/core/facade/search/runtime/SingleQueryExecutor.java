package fun.fengwk.msh.core.facade.search.runtime;

import fun.fengwk.msh.core.facade.search.exception.SearchCancelledException;
import fun.fengwk.msh.core.facade.search.exception.SecurityBlockedException;
import fun.fengwk.msh.core.facade.search.model.QueryOutcome;
import fun.fengwk.msh.core.facade.search.model.SearchQuery;
import fun.fengwk.msh.core.facade.search.model.SearchResultItem;
import fun.fengwk.msh.core.facade.search.model.SearchType;
import fun.fengwk.msh.core.facade.search.provider.SearchProvider;
import fun.fengwk.msh.core.facade.search.security.ResultContentScanner;
import fun.fengwk.msh.core.facade.search.security.ScanAction;
import fun.fengwk.msh.core.facade.search.security.ScanResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one query through its ordered provider candidates until one answers.
 *
 * <p>Never throws for provider failures, the terminal state is always reported
 * through {@link QueryOutcome#getError()}.
 *
 * @author fengwk
 */
@Slf4j
public class SingleQueryExecutor {

    public static final String SECURITY_WARNING_KEY = "security_warning";

    private final ResultContentScanner scanner;
    private final Duration fallbackBaseDelay;

    public SingleQueryExecutor(ResultContentScanner scanner, Duration fallbackBaseDelay) {
        this.scanner = scanner;
        this.fallbackBaseDelay = fallbackBaseDelay;
    }

    /**
     * @param candidates providers in the order they should be tried
     * @param explicit whether the caller picked the provider, disables fallback
     */
    public QueryOutcome execute(SearchType type, SearchQuery query, List<SearchProvider> candidates,
                                boolean explicit, SearchCancellation cancellation) {
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            if (cancellation.isCancelled()) {
                return QueryOutcome.failure(query.getText(), "search cancelled: " + cancellation.getReason());
            }
            if (i > 0) {
                try {
                    cancellation.sleep(fallbackBaseDelay.multipliedBy(i));
                } catch (SearchCancelledException ex) {
                    return QueryOutcome.failure(query.getText(), "search cancelled during fallback: " + ex.getMessage());
                }
            }

            SearchProvider provider = candidates.get(i);
            List<SearchResultItem> results;
            try {
                log.debug("trying search provider, provider={}, type={}, query={}, attempt={}",
                    provider.getName(), type, query.getText(), i + 1);
                results = provider.search(type, query, cancellation);
            } catch (SearchCancelledException ex) {
                return QueryOutcome.failure(query.getText(), "search cancelled: " + ex.getMessage());
            } catch (SecurityBlockedException ex) {
                log.warn("search blocked by provider, provider={}, query={}, error={}",
                    provider.getName(), query.getText(), ex.getMessage());
                return QueryOutcome.failure(query.getText(),
                    "search result blocked by security policy: " + ex.getMessage());
            } catch (RuntimeException ex) {
                log.warn("search provider failed, provider={}, query={}, error={}",
                    provider.getName(), query.getText(), ex.getMessage());
                errors.add(provider.getName() + ": " + ex.getMessage());
                if (explicit) {
                    break;
                }
                continue;
            }

            return screen(query, provider, results == null ? List.of() : results);
        }

        return QueryOutcome.failure(query.getText(), describeFailure(errors));
    }

    private QueryOutcome screen(SearchQuery query, SearchProvider provider, List<SearchResultItem> results) {
        List<SearchResultItem> screened = new ArrayList<>(results.size());
        for (SearchResultItem item : results) {
            ScanResult verdict = scan(item, provider.getName());
            if (verdict.getAction() == ScanAction.BLOCK) {
                log.warn("search result blocked, provider={}, query={}, url={}, reason={}",
                    provider.getName(), query.getText(), item.getUrl(), verdict.getMessage());
                return QueryOutcome.failure(query.getText(),
                    "search result blocked by security policy: " + verdict.getMessage());
            }
            if (verdict.getAction() == ScanAction.WARN) {
                Map<String, Object> metadata = new LinkedHashMap<>(item.getMetadata());
                metadata.put(SECURITY_WARNING_KEY, verdict.getMessage());
                item = item.toBuilder().metadata(metadata).build();
            }
            screened.add(item);
        }
        return QueryOutcome.success(query.getText(), provider.getName(), screened);
    }

    private ScanResult scan(SearchResultItem item, String providerName) {
        String content = join(item.getTitle(), item.getDescription());
        try {
            ScanResult verdict = scanner.scan(content, providerName);
            return verdict == null ? ScanResult.allowed() : verdict;
        } catch (RuntimeException ex) {
            log.warn("search result scan failed, provider={}, url={}, error={}",
                providerName, item.getUrl(), ex.getMessage(), ex);
            return ScanResult.allowed();
        }
    }

    private static String join(String title, String description) {
        if (title == null) {
            return description == null ? "" : description;
        }
        return description == null ? title : title + " " + description;
    }

    private static String describeFailure(List<String> errors) {
        if (errors.isEmpty()) {
            return "no providers could complete the search";
        }
        if (errors.size() == 1) {
            return "search failed: " + errors.get(0);
        }
        return "all providers failed: " + String.join("; ", errors);
    }

}
