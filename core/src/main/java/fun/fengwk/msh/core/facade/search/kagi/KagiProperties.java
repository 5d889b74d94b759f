package fun.fengwk.msh.core.facade.search.kagi;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Kagi Search API configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search.kagi")
public class KagiProperties {

    /**
     * Kagi API base url.
     */
    private String baseUrl = "https://kagi.com/api/v0";

    /**
     * Bot token.
     */
    private String apiKey = "";

}
