package fun.fengwk.msh.core.facade.search.google;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Google Custom Search configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search.google")
public class GoogleProperties {

    /**
     * Custom Search JSON API endpoint.
     */
    private String baseUrl = "https://www.googleapis.com/customsearch/v1";

    /**
     * API key.
     */
    private String apiKey = "";

    /**
     * Programmable search engine id (cx).
     */
    private String searchId = "";

}
