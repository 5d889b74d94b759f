package fun.fengwk.msh.core.utils;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * URL query/form encoding.
 *
 * @author fengwk
 */
public final class QueryStrings {

    private QueryStrings() {
    }

    /**
     * Encode parameters as {@code application/x-www-form-urlencoded}, skipping null keys and values.
     */
    public static String encode(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            joiner.add(encodeComponent(entry.getKey()) + "=" + encodeComponent(entry.getValue()));
        }
        return joiner.toString();
    }

    /**
     * Join base url and path, appending the encoded query string when present.
     */
    public static URI buildUri(String baseUrl, String path, Map<String, String> params) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String queryString = params == null ? "" : encode(params);
        if (queryString.isEmpty()) {
            return URI.create(base + path);
        }
        return URI.create(base + path + "?" + queryString);
    }

    private static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

}
