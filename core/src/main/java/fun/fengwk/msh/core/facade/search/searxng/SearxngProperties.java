package fun.fengwk.msh.core.facade.search.searxng;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SearXNG configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search.searxng")
public class SearxngProperties {

    /**
     * SearXNG base url, the provider is unavailable while blank.
     */
    private String baseUrl = "";

    /**
     * Basic auth username, used together with {@link #password}.
     */
    private String username = "";

    /**
     * Basic auth password.
     */
    private String password = "";

    /**
     * Request method: GET/POST.
     */
    private String method = "GET";

}
