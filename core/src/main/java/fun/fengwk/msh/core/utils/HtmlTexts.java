package fun.fengwk.msh.core.utils;

import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;

/**
 * Plain text helpers for vendor snippets which carry HTML markup.
 *
 * @author fengwk
 */
public final class HtmlTexts {

    private HtmlTexts() {
    }

    /**
     * Decode HTML entities, strip tags and collapse whitespace.
     *
     * <p>Entities are decoded before tags are stripped, so escaped markup such as
     * {@code &lt;strong&gt;} is removed as well.
     */
    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String decoded = Parser.unescapeEntities(text, false);
        return Jsoup.parse(decoded).text();
    }

}
