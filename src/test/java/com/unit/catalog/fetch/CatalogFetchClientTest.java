package com.unit.catalog.fetch;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.unit.catalog.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogFetchClient Tests")
class CatalogFetchClientTest {

    private HttpServer server;
    private final Deque<Reply> replies = new ArrayDeque<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();
    private SimpleMeterRegistry registry;

    private record Reply(int status, String body, String retryAfter) {}

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private synchronized void handle(HttpExchange exchange) throws IOException {
        requests.add(exchange.getRequestURI().toString());
        Reply reply = replies.isEmpty() ? new Reply(200, "{}", null) : replies.poll();
        if (reply.retryAfter() != null) {
            exchange.getResponseHeaders().add("Retry-After", reply.retryAfter());
        }
        byte[] body = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(reply.status(), body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private void reply(int status, String body) {
        replies.add(new Reply(status, body, null));
    }

    private CatalogFetchClient client(int maxRetries) {
        FetchConfig config = FetchConfig.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/")
                .maxRetries(maxRetries)
                .requestTimeout(Duration.ofSeconds(5))
                .courtesyDelay(Duration.ofMillis(1000))
                .build();
        return new CatalogFetchClient(config, null, sleeps::add, () -> 0.5, new MicrometerMetricsService(registry));
    }

    private double counter(String name) {
        return registry.get(name).counter().count();
    }

    @Nested
    @DisplayName("Success")
    class Success {

        @Test
        @DisplayName("Listing request carries type and tonnage range")
        void quickListUrl() {
            reply(200, "{\"Units\":[]}");

            String body = client(3).fetchQuickList(18, new TonnagePartition(26, 35));

            assertEquals("{\"Units\":[]}", body);
            assertEquals(List.of("/Unit/QuickList?Types=18&MinTons=26&MaxTons=35"), requests);
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("Detail request targets the unit page")
        void detailUrl() {
            reply(200, "<html></html>");
            assertEquals("<html></html>", client(3).fetchDetail(140));
            assertEquals(List.of("/Unit/Details/140"), requests);
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("Rate limiting waits for Retry-After before retrying")
        void rateLimited() {
            replies.add(new Reply(429, "slow down", "7"));
            reply(200, "ok");

            assertEquals("ok", client(3).fetchDetail(1));
            assertEquals(List.of(Duration.ofSeconds(7)), sleeps);
            assertEquals(1.0, counter("catalog.fetch.retry"));
            assertEquals(2.0, counter("catalog.fetch.request"));
        }

        @Test
        @DisplayName("Retry-After is capped")
        void retryAfterCapped() {
            replies.add(new Reply(429, "", "600"));
            reply(200, "ok");

            client(3).fetchDetail(1);
            assertEquals(List.of(Duration.ofSeconds(60)), sleeps);
        }

        @Test
        @DisplayName("Server errors back off along the schedule")
        void serverErrors() {
            reply(500, "boom");
            reply(503, "boom");
            reply(200, "ok");

            assertEquals("ok", client(3).fetchDetail(1));
            assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(5)), sleeps);
        }

        @Test
        @DisplayName("Gives up after the retry budget as a transient failure")
        void exhausted() {
            for (int i = 0; i < 3; i++) {
                reply(500, "boom");
            }

            FetchException e = assertThrows(FetchException.class, () -> client(2).fetchDetail(1));
            assertTrue(e.isTransient());
            assertEquals(500, e.getStatusCode());
            assertEquals(3, requests.size());
        }
    }

    @Test
    @DisplayName("Client errors fail permanently without retry")
    void permanent() {
        reply(404, "missing");

        FetchException e = assertThrows(FetchException.class, () -> client(3).fetchDetail(9));
        assertFalse(e.isTransient());
        assertEquals(404, e.getStatusCode());
        assertEquals(1, requests.size());
        assertTrue(sleeps.isEmpty());
        assertEquals(1.0, counter("catalog.fetch.permanent_failure"));
    }

    @Test
    @DisplayName("Courtesy pause sleeps the jittered delay")
    void courtesyPause() {
        CatalogFetchClient client = client(3);
        client.courtesyPause();
        assertEquals(List.of(Duration.ofMillis(1000)), sleeps);

        CatalogFetchClient noDelay = new CatalogFetchClient(FetchConfig.builder()
                .courtesyDelay(Duration.ZERO).build(), null, sleeps::add, () -> 0.0, null);
        noDelay.courtesyPause();
        assertEquals(1, sleeps.size());
    }

    @Test
    @DisplayName("Jitter stays within the configured band")
    void jitter() {
        FetchConfig config = FetchConfig.builder().jitter(0.3).build();
        assertEquals(Duration.ofMillis(700),
                new CatalogFetchClient(config, null, sleeps::add, () -> 0.0, null).jittered(Duration.ofSeconds(1)));
        assertEquals(Duration.ofMillis(1300),
                new CatalogFetchClient(config, null, sleeps::add, () -> 1.0, null).jittered(Duration.ofSeconds(1)));
    }
}
