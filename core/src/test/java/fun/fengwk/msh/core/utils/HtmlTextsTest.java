package fun.fengwk.msh.core.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HtmlTexts tests.
 *
 * @author fengwk
 */
class HtmlTextsTest {

    @Test
    void shouldStripTagsAndDecodeEntities() {
        assertThat(HtmlTexts.clean("<strong>Go</strong> &amp; Rust")).isEqualTo("Go & Rust");
    }

    @Test
    void shouldStripEscapedMarkup() {
        assertThat(HtmlTexts.clean("&lt;strong&gt;Spring&lt;/strong&gt; AI &#39;MCP&#39;")).isEqualTo("Spring AI 'MCP'");
    }

    @Test
    void shouldCollapseWhitespace() {
        assertThat(HtmlTexts.clean("  multi\n  line\ttext ")).isEqualTo("multi line text");
    }

    @Test
    void shouldKeepNullAndEmpty() {
        assertThat(HtmlTexts.clean(null)).isNull();
        assertThat(HtmlTexts.clean("")).isEmpty();
    }

}
