package io.waterbalance.license.registry;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.waterbalance.license.LicenseRecord;
import io.waterbalance.license.LicenseStatus;
import io.waterbalance.license.LicenseTier;
import io.waterbalance.license.hardware.HardwareFingerprint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HttpRegistryClient} against an in-process HTTP server.
 */
class HttpRegistryClientTest {

    private static final String KEY = "WB-STD-2026-ABCD-1234";
    private static final String API_KEY = "registry-secret-key";

    private static final String ROWS = """
        [
          {"license_key": "license_key", "status": "status"},
          {"license_key": "WB-OTHER-0000-0000", "status": "active"},
          {"license_key": "WB-STD-2026-ABCD-1234", "status": "Active", "expiry_date": "2027-01-31T00:00:00Z",
           "hw_component_1": "AA11", "hw_component_2": "bb22", "hw_component_3": "cc33",
           "licensee_name": "Jane Owner", "licensee_email": "jane@minesite.example",
           "license_tier": "Premium Annual", "transfer_count": "2.0", "notes": "paid by invoice"}
        ]
        """;

    private HttpServer server;
    private ExecutorService serverExecutor;
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private volatile Responder responder = exchange -> respond(exchange, 200, ROWS);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            requests.add(new Recorded(exchange.getRequestMethod(), exchange.getRequestURI(),
                exchange.getRequestHeaders().getFirst("X-API-Key"), body));
            responder.handle(exchange);
        });
        server.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        server.stop(0);
        serverExecutor.shutdownNow();
        serverExecutor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private URI url(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    private HttpRegistryClient client() {
        return new HttpRegistryClient(url("/registry"), url("/webhook"), API_KEY, Duration.ofSeconds(2));
    }

    private static LicenseRecord record() {
        return new LicenseRecord(KEY, LicenseStatus.ACTIVE, LicenseTier.STANDARD,
            new HardwareFingerprint("aa11", "bb22", "cc33"), "Jane Owner", "jane@minesite.example",
            null, 1, Instant.EPOCH, Instant.EPOCH, null, null, null, 0, null);
    }

    @Test
    @DisplayName("fetch returns the row for the key and sends the key and API key")
    void fetch_found_parsesRow() throws Exception {
        Optional<RemoteRecord> row = client().fetch(KEY);

        assertTrue(row.isPresent());
        RemoteRecord r = row.get();
        assertEquals(LicenseStatus.ACTIVE, r.status());
        assertEquals(LicenseTier.PREMIUM, r.tier());
        assertEquals(LocalDate.of(2027, 1, 31), r.expiryDate());
        assertEquals(new HardwareFingerprint("aa11", "bb22", "cc33"), r.bindings());
        assertEquals("jane@minesite.example", r.licenseeEmail());
        assertEquals(2, r.transferCount());
        assertEquals("paid by invoice", r.notes());

        Recorded request = requests.get(0);
        assertEquals("GET", request.method());
        assertTrue(request.uri().getQuery().contains("license_key=" + KEY));
        assertEquals(API_KEY, request.apiKey());
    }

    @Test
    @DisplayName("fetch of a key the registry does not list is empty")
    void fetch_missing_empty() throws Exception {
        assertTrue(client().fetch("WB-NOPE-0000-0000").isEmpty());
    }

    @Test
    @DisplayName("fetch treats 404 as not found")
    void fetch_404_empty() throws Exception {
        responder = exchange -> respond(exchange, 404, "");

        assertTrue(client().fetch(KEY).isEmpty());
    }

    @Test
    @DisplayName("fetch fails as unavailable on a server error")
    void fetch_500_unavailable() {
        responder = exchange -> respond(exchange, 500, "boom");

        assertThrows(RegistryUnavailableException.class, () -> client().fetch(KEY));
    }

    @Test
    @DisplayName("fetch fails as unavailable on a malformed body")
    void fetch_malformed_unavailable() {
        responder = exchange -> respond(exchange, 200, "<html>maintenance</html>");

        assertThrows(RegistryUnavailableException.class, () -> client().fetch(KEY));
    }

    @Test
    @DisplayName("fetch fails as unavailable when the request times out")
    void fetch_timeout_unavailable() {
        responder = exchange -> {
            try {
                Thread.sleep(1500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, ROWS);
        };
        HttpRegistryClient slow = new HttpRegistryClient(url("/registry"), null, null, Duration.ofMillis(200));

        assertThrows(RegistryUnavailableException.class, () -> slow.fetch(KEY));
    }

    @Test
    @DisplayName("fetch fails as unavailable when nothing listens")
    void fetch_connectionRefused_unavailable() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        URI dead = URI.create("http://127.0.0.1:" + closed.getAddress().getPort() + "/registry");
        closed.stop(0);

        HttpRegistryClient client = new HttpRegistryClient(dead, null, null, Duration.ofSeconds(1));

        assertThrows(RegistryUnavailableException.class, () -> client.fetch(KEY));
    }

    @Test
    @DisplayName("fetch without a configured registry fails as unavailable")
    void fetch_notConfigured_unavailable() {
        HttpRegistryClient client = new HttpRegistryClient(null, null, null, null);

        assertThrows(RegistryUnavailableException.class, () -> client.fetch(KEY));
    }

    @Test
    @DisplayName("fetchAll reads a wrapped record list and skips header rows")
    void fetchAll_wrapped_skipsHeader() throws Exception {
        responder = exchange -> respond(exchange, 200, "{\"records\": " + ROWS + "}");

        List<RemoteRecord> rows = client().fetchAll();

        assertEquals(2, rows.size());
        assertEquals("WB-OTHER-0000-0000", rows.get(0).key());
        assertFalse(rows.get(0).hasBinding());
    }

    @Test
    @DisplayName("parseRow is lenient about aliases and bad values")
    void parseRow_lenient() {
        JsonObject row = JsonParser.parseString("""
            {"license_key": "K-1", "status": "", "hw1": "n", "hw2": "c", "hw3": "b",
             "expiry_date": "soon", "transfer_count": "many", "license_tier": "Trial"}
            """).getAsJsonObject();

        RemoteRecord r = HttpRegistryClient.parseRow(row);

        assertEquals(LicenseStatus.PENDING, r.status());
        assertEquals(LicenseTier.TRIAL, r.tier());
        assertEquals(new HardwareFingerprint("n", "c", "b"), r.bindings());
        assertNull(r.expiryDate());
        assertEquals(0, r.transferCount());
    }

    @Test
    @DisplayName("post sends the update to the webhook and reports acknowledgement")
    void post_acknowledged_true() throws Exception {
        responder = exchange -> respond(exchange, 200, "OK");

        boolean ok = client().post(RegistryUpdate.transfer(record(), "203.0.113.7")).get(5, TimeUnit.SECONDS);

        assertTrue(ok);
        Recorded request = requests.get(0);
        assertEquals("POST", request.method());
        assertEquals("/webhook", request.uri().getPath());
        assertEquals(API_KEY, request.apiKey());

        JsonObject body = JsonParser.parseString(request.body()).getAsJsonObject();
        assertEquals(KEY, body.get("license_key").getAsString());
        assertEquals("aa11", body.get("hw1").getAsString());
        assertEquals("active", body.get("status").getAsString());
        assertEquals("standard", body.get("license_tier").getAsString());
        assertTrue(body.get("is_transfer").getAsBoolean());
        assertEquals("203.0.113.7", body.get("source_ip").getAsString());
    }

    @Test
    @DisplayName("post reports a rejection without retrying")
    void post_errorBody_falseNoRetry() throws Exception {
        responder = exchange -> respond(exchange, 200, "ERROR: unknown license");

        assertFalse(client().post(RegistryUpdate.activation(record())).get(5, TimeUnit.SECONDS));
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("post retries a server error exactly once")
    void post_serverError_retriedOnce() throws Exception {
        responder = exchange -> respond(exchange, 503, "busy");

        assertFalse(client().post(RegistryUpdate.activation(record())).get(5, TimeUnit.SECONDS));
        assertEquals(2, requests.size());
    }

    @Test
    @DisplayName("post without a webhook completes with false")
    void post_noWebhook_false() throws Exception {
        HttpRegistryClient client = new HttpRegistryClient(url("/registry"), null, null, null);

        assertFalse(client.post(RegistryUpdate.activation(record())).get(5, TimeUnit.SECONDS));
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("toString masks the API key")
    void toString_masksApiKey() {
        assertFalse(client().toString().contains(API_KEY));
    }

    ///// ==== Helper classes

    @FunctionalInterface
    private interface Responder {
        void handle(HttpExchange exchange) throws IOException;
    }

    private record Recorded(String method, URI uri, String apiKey, String body) {}

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
