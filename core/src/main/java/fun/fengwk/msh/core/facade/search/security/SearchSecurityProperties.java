package fun.fengwk.msh.core.facade.search.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Result content security configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search.security")
public class SearchSecurityProperties {

    /**
     * Whether result content is scanned.
     */
    private boolean enabled = false;

    /**
     * Regexes which block the whole query when a result matches.
     */
    private List<String> blockPatterns = new ArrayList<>();

    /**
     * Regexes which only annotate the matching result with a warning.
     */
    private List<String> warnPatterns = new ArrayList<>();

}
