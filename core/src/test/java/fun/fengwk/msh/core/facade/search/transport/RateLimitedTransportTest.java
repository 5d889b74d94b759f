package fun.fengwk.msh.core.facade.search.transport;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.msh.core.facade.search.exception.AuthenticationException;
import fun.fengwk.msh.core.facade.search.exception.SearchCancelledException;
import fun.fengwk.msh.core.facade.search.exception.SearchProviderException;
import fun.fengwk.msh.core.facade.search.exception.TransientNetworkException;
import fun.fengwk.msh.core.facade.search.exception.VendorRateLimitedException;
import fun.fengwk.msh.core.facade.search.runtime.SearchCancellation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RateLimitedTransport tests.
 *
 * @author fengwk
 */
class RateLimitedTransportTest {

    private final HttpClient httpClient = HttpClient.newHttpClient();

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldReturnBodyOfSuccessfulResponse() throws Exception {
        server = startServer(exchange -> write(exchange, 200, "{\"ok\":true}"));

        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient, fastSettings().build());
        String body = transport.execute(request(baseUrl(server) + "/search"), new SearchCancellation());

        assertThat(body).isEqualTo("{\"ok\":true}");
    }

    @Test
    void shouldRetryConnectFailuresUpToMaxAttempts() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient, fastSettings().build());

        assertThatThrownBy(() -> transport.execute(request("http://127.0.0.1:" + closedPort + "/search"), new SearchCancellation()))
            .isInstanceOf(TransientNetworkException.class)
            .hasMessageStartingWith("request failed after 3 attempts");
    }

    @Test
    void shouldRetryTimeoutThenSucceed() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        server = startServer(exchange -> {
            if (calls.incrementAndGet() == 1) {
                sleepQuietly(1000);
            }
            write(exchange, 200, "ok");
        });

        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient,
            fastSettings().requestTimeout(Duration.ofMillis(200)).build());
        String body = transport.execute(request(baseUrl(server) + "/search"), new SearchCancellation());

        assertThat(body).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void shouldSendThreeAttemptsWhenFirstTwoTimeOut() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        server = startServer(exchange -> {
            if (calls.incrementAndGet() <= 2) {
                sleepQuietly(1000);
            }
            write(exchange, 200, "third");
        });

        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient,
            fastSettings().requestTimeout(Duration.ofMillis(200)).build());
        String body = transport.execute(request(baseUrl(server) + "/search"), new SearchCancellation());

        assertThat(body).isEqualTo("third");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void shouldGiveUpAfterMaxAttemptsOfTimeouts() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        server = startServer(exchange -> {
            calls.incrementAndGet();
            sleepQuietly(1000);
            write(exchange, 200, "late");
        });

        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient,
            fastSettings().requestTimeout(Duration.ofMillis(200)).build());

        assertThatThrownBy(() -> transport.execute(request(baseUrl(server) + "/search"), new SearchCancellation()))
            .isInstanceOf(TransientNetworkException.class)
            .hasMessageStartingWith("request failed after 3 attempts");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void shouldNotRetryAuthenticationAndRateLimitResponses() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        server = startServer(exchange -> {
            calls.incrementAndGet();
            String path = exchange.getRequestURI().getPath();
            int status = path.endsWith("401") ? 401 : path.endsWith("403") ? 403 : path.endsWith("429") ? 429 : 500;
            write(exchange, status, "{\"error\":\"nope\"}");
        });
        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient, fastSettings().build());

        assertThatThrownBy(() -> transport.execute(request(baseUrl(server) + "/s401"), new SearchCancellation()))
            .isInstanceOf(AuthenticationException.class)
            .hasMessage("authentication failed: invalid API key");
        assertThatThrownBy(() -> transport.execute(request(baseUrl(server) + "/s403"), new SearchCancellation()))
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("access forbidden");
        assertThatThrownBy(() -> transport.execute(request(baseUrl(server) + "/s429"), new SearchCancellation()))
            .isInstanceOf(VendorRateLimitedException.class)
            .hasMessageContaining("rate limit exceeded");
        assertThatThrownBy(() -> transport.execute(request(baseUrl(server) + "/s500"), new SearchCancellation()))
            .isExactlyInstanceOf(SearchProviderException.class)
            .hasMessage("API request failed with status 500: {\"error\":\"nope\"}");
        assertThat(calls.get()).isEqualTo(4);
    }

    @Test
    void shouldSpaceRequestsByRateLimit() throws Exception {
        server = startServer(exchange -> write(exchange, 200, "ok"));
        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient,
            fastSettings().rateLimit(5).build());

        long start = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            transport.execute(request(baseUrl(server) + "/search"), new SearchCancellation());
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        // 5 rps: the 2nd and 3rd request each wait ~200ms for a token.
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(300));
    }

    @Test
    void shouldAbortRateLimiterWaitOnCancel() throws Exception {
        server = startServer(exchange -> write(exchange, 200, "ok"));
        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient,
            fastSettings().rateLimit(0.1).build());
        transport.execute(request(baseUrl(server) + "/search"), new SearchCancellation());

        SearchCancellation cancellation = new SearchCancellation();
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<Throwable> future = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            try {
                transport.execute(request(baseUrl(server) + "/search"), cancellation);
                return null;
            } catch (RuntimeException ex) {
                return ex;
            }
        });

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        cancellation.cancel("caller gone");

        Throwable error = future.get(5, TimeUnit.SECONDS);
        assertThat(error).isInstanceOf(SearchCancelledException.class).hasMessage("caller gone");
    }

    @Test
    void shouldKeepWaitingForPermitUntilCancelled() throws Exception {
        server = startServer(exchange -> write(exchange, 200, "ok"));
        // one token every 50s
        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient,
            fastSettings().rateLimit(0.02).build());
        transport.execute(request(baseUrl(server) + "/search"), new SearchCancellation());

        SearchCancellation cancellation = new SearchCancellation();
        CompletableFuture<Throwable> future = CompletableFuture.supplyAsync(() -> {
            try {
                transport.execute(request(baseUrl(server) + "/search"), cancellation);
                return null;
            } catch (RuntimeException ex) {
                return ex;
            }
        });

        Thread.sleep(1500);
        assertThat(future).isNotDone();
        cancellation.cancel("caller gone");

        Throwable error = future.get(5, TimeUnit.SECONDS);
        assertThat(error).isInstanceOf(SearchCancelledException.class).hasMessage("caller gone");
    }

    @Test
    void shouldAbortRetryDelayOnCancel() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient,
            fastSettings().retryBaseDelay(Duration.ofSeconds(10)).build());

        SearchCancellation cancellation = new SearchCancellation();
        CompletableFuture<Throwable> future = CompletableFuture.supplyAsync(() -> {
            try {
                transport.execute(request("http://127.0.0.1:" + closedPort + "/search"), cancellation);
                return null;
            } catch (RuntimeException ex) {
                return ex;
            }
        });

        Thread.sleep(500);
        long start = System.nanoTime();
        cancellation.cancel("caller gone");

        Throwable error = future.get(5, TimeUnit.SECONDS);
        assertThat(error).isInstanceOf(SearchCancelledException.class).hasMessage("caller gone");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
    }

    @Test
    void shouldAbortInFlightRequestOnCancel() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        server = startServer(exchange -> {
            received.countDown();
            sleepQuietly(5000);
            write(exchange, 200, "late");
        });
        RateLimitedTransport transport = new RateLimitedTransport("test", httpClient, fastSettings().build());

        SearchCancellation cancellation = new SearchCancellation();
        CompletableFuture<Throwable> future = CompletableFuture.supplyAsync(() -> {
            try {
                transport.execute(request(baseUrl(server) + "/search"), cancellation);
                return null;
            } catch (RuntimeException ex) {
                return ex;
            }
        });

        assertThat(received.await(5, TimeUnit.SECONDS)).isTrue();
        long start = System.nanoTime();
        cancellation.cancel("caller gone");

        Throwable error = future.get(5, TimeUnit.SECONDS);
        assertThat(error).isInstanceOf(SearchCancelledException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
    }

    private static TransportSettings.TransportSettingsBuilder fastSettings() {
        return TransportSettings.builder()
            .rateLimit(1000)
            .requestTimeout(Duration.ofSeconds(5))
            .maxAttempts(3)
            .retryBaseDelay(Duration.ofMillis(10));
    }

    private static HttpRequest.Builder request(String url) {
        return HttpRequest.newBuilder().uri(URI.create(url)).GET();
    }

    private static HttpServer startServer(HttpHandler handler) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/", handler);
        server.start();
        return server;
    }

    private static String baseUrl(HttpServer server) {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

}
