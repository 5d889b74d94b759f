package fun.fengwk.msh.core.facade.search.security;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PatternResultContentScanner tests.
 *
 * @author fengwk
 */
class PatternResultContentScannerTest {

    @Test
    void shouldAllowEverythingWhenDisabled() {
        SearchSecurityProperties properties = new SearchSecurityProperties();
        properties.setBlockPatterns(List.of("malware"));

        ScanResult result = new PatternResultContentScanner(properties).scan("free malware download", "brave");

        assertThat(result.getAction()).isEqualTo(ScanAction.ALLOW);
    }

    @Test
    void shouldPreferBlockOverWarn() {
        SearchSecurityProperties properties = enabled(List.of("malware"), List.of("download"));

        ScanResult result = new PatternResultContentScanner(properties).scan("Free MALWARE download", "brave");

        assertThat(result.getAction()).isEqualTo(ScanAction.BLOCK);
        assertThat(result.getMessage()).isEqualTo("content from brave matched block pattern malware");
    }

    @Test
    void shouldWarnOnWarnPattern() {
        SearchSecurityProperties properties = enabled(List.of("malware"), List.of("crypto\\s+giveaway"));

        ScanResult result = new PatternResultContentScanner(properties).scan("huge Crypto  Giveaway today", "google");

        assertThat(result.getAction()).isEqualTo(ScanAction.WARN);
        assertThat(result.getMessage()).isEqualTo("content matched warn pattern crypto\\s+giveaway");
    }

    @Test
    void shouldAllowCleanContent() {
        SearchSecurityProperties properties = enabled(List.of("malware"), List.of("giveaway"));

        assertThat(new PatternResultContentScanner(properties).scan("golang best practices", "kagi").getAction())
            .isEqualTo(ScanAction.ALLOW);
    }

    @Test
    void shouldRejectInvalidPattern() {
        SearchSecurityProperties properties = enabled(List.of("(unclosed"), List.of());

        assertThatThrownBy(() -> new PatternResultContentScanner(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("invalid security pattern: (unclosed");
    }

    private static SearchSecurityProperties enabled(List<String> block, List<String> warn) {
        SearchSecurityProperties properties = new SearchSecurityProperties();
        properties.setEnabled(true);
        properties.setBlockPatterns(block);
        properties.setWarnPatterns(warn);
        return properties;
    }

}
