package fun.fengwk.msh.core.facade.search.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex based scanner, block patterns take precedence over warn patterns.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class PatternResultContentScanner implements ResultContentScanner {

    private final boolean enabled;
    private final List<Pattern> blockPatterns;
    private final List<Pattern> warnPatterns;

    public PatternResultContentScanner(SearchSecurityProperties properties) {
        this.enabled = properties.isEnabled();
        this.blockPatterns = compile(properties.getBlockPatterns());
        this.warnPatterns = compile(properties.getWarnPatterns());
        if (enabled) {
            log.info("search result scanning enabled, blockPatterns={}, warnPatterns={}",
                blockPatterns.size(), warnPatterns.size());
        }
    }

    @Override
    public ScanResult scan(String content, String providerName) {
        if (!enabled || content == null || content.isEmpty()) {
            return ScanResult.allowed();
        }
        for (Pattern pattern : blockPatterns) {
            if (pattern.matcher(content).find()) {
                return ScanResult.builder()
                    .action(ScanAction.BLOCK)
                    .message("content from " + providerName + " matched block pattern " + pattern.pattern())
                    .build();
            }
        }
        for (Pattern pattern : warnPatterns) {
            if (pattern.matcher(content).find()) {
                return ScanResult.builder()
                    .action(ScanAction.WARN)
                    .message("content matched warn pattern " + pattern.pattern())
                    .build();
            }
        }
        return ScanResult.allowed();
    }

    private static List<Pattern> compile(List<String> regexes) {
        if (regexes == null) {
            return List.of();
        }
        return regexes.stream()
            .filter(regex -> regex != null && !regex.isBlank())
            .map(PatternResultContentScanner::compileOne)
            .toList();
    }

    private static Pattern compileOne(String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("invalid security pattern: " + regex, ex);
        }
    }

}
