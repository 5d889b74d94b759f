package fun.fengwk.msh.core.facade.search.brave;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Brave Search API configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search.brave")
public class BraveProperties {

    /**
     * Brave Search API base url.
     */
    private String baseUrl = "https://api.search.brave.com/res/v1";

    /**
     * Subscription token, the provider is unavailable while blank.
     */
    private String apiKey = "";

}
