package com.ledgerpilot.budget.remote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerpilot.budget.config.LedgerpilotProperties;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

/**
 * Exercises the transport against an embedded HttpServer.
 */
class BudgetApiClientTest {

    static HttpServer server;
    static int port;
    static final Map<String, String> lastRequest = new ConcurrentHashMap<>();

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/v1/budgets", exchange -> {
            lastRequest.put("authorization", String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            lastRequest.put("query", String.valueOf(exchange.getRequestURI().getRawQuery()));
            respond(exchange, 200, "{\"data\":{\"budgets\":[{\"id\":\"b1\",\"name\":\"Household\"}]}}");
        });
        server.createContext("/v1/missing", exchange ->
                respond(exchange, 404, "{\"error\":{\"id\":\"404.2\",\"name\":\"resource_not_found\",\"detail\":\"Resource not found\"}}"));
        server.createContext("/v1/plain-error", exchange -> respond(exchange, 500, "oops"));
        server.createContext("/v1/garbage", exchange -> respond(exchange, 200, "{not json"));
        server.createContext("/v1/patch", exchange -> {
            lastRequest.put("method", exchange.getRequestMethod());
            lastRequest.put("body", new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"data\":{\"transaction_ids\":[\"t1\"]}}");
        });
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private BudgetApiClient newClient(String baseUrl) {
        var props = new LedgerpilotProperties(
                new LedgerpilotProperties.Remote(baseUrl, "secret-token", Duration.ofSeconds(2), Duration.ofSeconds(5)),
                null,
                null
        );
        return new BudgetApiClient(props, new ObjectMapper());
    }

    @Test
    void getSendsBearerTokenAndParsesJson() {
        JsonNode body = newClient("http://localhost:" + port + "/v1/").request(HttpMethod.GET, "/budgets?include_accounts=false");

        assertThat(body.path("data").path("budgets").get(0).path("name").asText()).isEqualTo("Household");
        assertThat(lastRequest).containsEntry("authorization", "Bearer secret-token");
        assertThat(lastRequest).containsEntry("query", "include_accounts=false");
    }

    @Test
    void errorResponseKeepsStatusAndDetail() {
        var client = newClient("http://localhost:" + port + "/v1");

        assertThatThrownBy(() -> client.request(HttpMethod.GET, "/missing"))
                .isInstanceOfSatisfying(RemoteApiException.class, ex -> {
                    assertThat(ex.status()).isEqualTo(404);
                    assertThat(ex.detail()).isEqualTo("Resource not found");
                    assertThat(ex.rawBody()).contains("resource_not_found");
                });
    }

    @Test
    void nonJsonErrorBodyFallsBackToGenericDetail() {
        var client = newClient("http://localhost:" + port + "/v1");

        assertThatThrownBy(() -> client.request(HttpMethod.GET, "/plain-error"))
                .isInstanceOfSatisfying(RemoteApiException.class, ex -> {
                    assertThat(ex.status()).isEqualTo(500);
                    assertThat(ex.detail()).isEqualTo("Request failed with status 500");
                });
    }

    @Test
    void malformedSuccessBodyIsBadGateway() {
        var client = newClient("http://localhost:" + port + "/v1");

        assertThatThrownBy(() -> client.request(HttpMethod.GET, "/garbage"))
                .isInstanceOfSatisfying(RemoteApiException.class, ex -> assertThat(ex.status()).isEqualTo(502));
    }

    @Test
    void patchSendsJsonBody() {
        var client = newClient("http://localhost:" + port + "/v1");

        JsonNode body = client.request(HttpMethod.PATCH, "/patch", Map.of("transactions", java.util.List.of(Map.of("id", "t1"))));

        assertThat(body.path("data").path("transaction_ids").get(0).asText()).isEqualTo("t1");
        assertThat(lastRequest).containsEntry("method", "PATCH");
        assertThat(lastRequest.get("body")).contains("\"id\":\"t1\"");
    }

    @Test
    void unreachableServerHasNoStatus() throws IOException {
        int closedPort;
        try (var socket = new java.net.ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        var client = newClient("http://localhost:" + closedPort + "/v1");

        assertThatThrownBy(() -> client.request(HttpMethod.GET, "/budgets"))
                .isInstanceOfSatisfying(RemoteApiException.class,
                        ex -> assertThat(ex.status()).isEqualTo(RemoteApiException.NO_RESPONSE));
    }
}
