package fun.fengwk.msh.core.configuration;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Proxy configuration for the search HttpClient.
 *
 * @author fengwk
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "msh.http.proxy")
public class HttpClientProxyProperties {

    /**
     * HTTP proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpProxy;

    /**
     * HTTPS proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpsProxy;

    /**
     * Build the selector routing http and https requests to their proxies.
     *
     * @return selector, or {@code null} when no proxy is configured
     */
    public ProxySelector buildProxySelector() {
        Proxy http = parseProxy(httpProxy);
        Proxy https = parseProxy(httpsProxy);
        if (http == null && https == null) {
            return null;
        }
        if (http != null) {
            log.info("http proxy configured: {}", httpProxy);
        }
        if (https != null) {
            log.info("https proxy configured: {}", httpsProxy);
        }
        return new SchemeProxySelector(http, https);
    }

    static Proxy parseProxy(String proxyStr) {
        if (proxyStr == null || proxyStr.isBlank()) {
            return null;
        }
        try {
            String uriStr = proxyStr.trim();
            if (!uriStr.contains("://")) {
                uriStr = "http://" + uriStr;
            }
            URI uri = new URI(uriStr);
            String scheme = uri.getScheme();
            Proxy.Type type = scheme != null && scheme.toLowerCase(Locale.ROOT).startsWith("socks")
                ? Proxy.Type.SOCKS
                : Proxy.Type.HTTP;
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null) {
                throw new IllegalArgumentException("invalid proxy: " + proxyStr);
            }
            if (port == -1) {
                port = 80;
            }
            return new Proxy(type, InetSocketAddress.createUnresolved(host, port));
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyStr, ex);
        }
    }

    private static class SchemeProxySelector extends ProxySelector {

        private final Proxy http;
        private final Proxy https;

        SchemeProxySelector(Proxy http, Proxy https) {
            this.http = http;
            this.https = https;
        }

        @Override
        public List<Proxy> select(URI uri) {
            Proxy proxy = "https".equalsIgnoreCase(uri.getScheme()) ? (https != null ? https : http) : http;
            return List.of(proxy == null ? Proxy.NO_PROXY : proxy);
        }

        @Override
        public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
            log.warn("proxy connect failed, uri={}, proxy={}, error={}", uri, sa, ioe.getMessage());
        }

    }

}
