package io.waterbalance.license.registry;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.waterbalance.license.LicenseRecord;
import io.waterbalance.license.LicenseStatus;
import io.waterbalance.license.LicenseTier;
import io.waterbalance.license.hardware.HardwareFingerprint;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Registry client over plain HTTP.
 *
 * <p>Reads are {@code GET} requests against the registry URL, which answers
 * with a JSON array of rows (or an object wrapping one in {@code records}).
 * A keyed lookup adds {@code ?license_key=...}; rows are still filtered by key
 * locally, since the registry may ignore the parameter and return every row.
 *
 * <p>Row columns: {@code license_key, status, expiry_date, hw_component_1,
 * hw_component_2, hw_component_3, licensee_name, licensee_email,
 * license_tier, transfer_count, notes}.
 *
 * <p>Writes are {@code POST} requests of a {@link RegistryUpdate} to the
 * webhook URL. The webhook answers {@code 200} with a text body; a body
 * starting with {@code ERROR} is a rejection.
 */
public class HttpRegistryClient implements RemoteRegistryClient {

    private static final Logger LOG = Logger.getLogger(HttpRegistryClient.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final int MAX_POST_ATTEMPTS = 2;
    private static final Gson GSON = new Gson();

    private final URI registryUrl;
    private final URI webhookUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;

    /**
     * @param registryUrl read endpoint (null = not configured, every read fails as unavailable)
     * @param webhookUrl write endpoint (null = updates are dropped)
     * @param apiKey optional value for the {@code X-API-Key} header
     * @param timeout connect and request timeout
     */
    public HttpRegistryClient(URI registryUrl, URI webhookUrl, String apiKey, Duration timeout) {
        this.registryUrl = registryUrl;
        this.webhookUrl = webhookUrl;
        this.apiKey = apiKey;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(this.timeout)
            .build();
    }

    @Override
    public Optional<RemoteRecord> fetch(String licenseKey) throws RegistryUnavailableException {
        String wanted = licenseKey.trim();
        URI uri = withQuery("license_key=" + URLEncoder.encode(wanted, StandardCharsets.UTF_8));

        HttpResponse<String> response = get(uri);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireOk(response);

        for (RemoteRecord row : parseRows(response.body())) {
            if (row.key().equals(wanted)) {
                return Optional.of(row);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<RemoteRecord> fetchAll() throws RegistryUnavailableException {
        HttpResponse<String> response = get(requireRegistryUrl());
        requireOk(response);
        List<RemoteRecord> rows = parseRows(response.body());
        LOG.fine("Registry returned " + rows.size() + " license rows");
        return rows;
    }

    @Override
    public CompletableFuture<Boolean> post(RegistryUpdate update) {
        if (webhookUrl == null) {
            LOG.fine("No registry webhook configured; dropping " + update);
            return CompletableFuture.completedFuture(false);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(webhookUrl)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(GSON.toJson(update)))
            .timeout(timeout);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("X-API-Key", apiKey);
        }

        return attemptPost(builder.build(), update, 1);
    }

    private CompletableFuture<Boolean> attemptPost(HttpRequest request, RegistryUpdate update, int attempt) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .handle((response, error) -> classify(response, error, update, attempt))
            .thenCompose(outcome -> {
                if (outcome == PostOutcome.RETRYABLE && attempt < MAX_POST_ATTEMPTS) {
                    return attemptPost(request, update, attempt + 1);
                }
                return CompletableFuture.completedFuture(outcome == PostOutcome.ACKNOWLEDGED);
            });
    }

    private PostOutcome classify(HttpResponse<String> response, Throwable error, RegistryUpdate update, int attempt) {
        if (error != null) {
            LOG.warning("Registry update " + update + " failed (attempt " + attempt + "): " + error.getMessage());
            return PostOutcome.RETRYABLE;
        }
        int status = response.statusCode();
        String body = response.body() != null ? response.body().trim() : "";
        if (status >= 500) {
            LOG.warning("Registry update " + update + " failed (HTTP " + status + ", attempt " + attempt + ")");
            return PostOutcome.RETRYABLE;
        }
        if (status / 100 != 2 || body.toUpperCase(Locale.ROOT).startsWith("ERROR")) {
            LOG.warning("Registry rejected " + update + " (HTTP " + status + "): " + body);
            return PostOutcome.REJECTED;
        }
        LOG.fine("Registry acknowledged " + update);
        return PostOutcome.ACKNOWLEDGED;
    }

    private HttpResponse<String> get(URI uri) throws RegistryUnavailableException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .header("Accept", "application/json")
            .GET()
            .timeout(timeout);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("X-API-Key", apiKey);
        }

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RegistryUnavailableException("Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryUnavailableException("Request interrupted", e);
        }
    }

    private static void requireOk(HttpResponse<String> response) throws RegistryUnavailableException {
        if (response.statusCode() != 200) {
            throw new RegistryUnavailableException("Registry request failed (HTTP " + response.statusCode() + ")");
        }
    }

    private URI requireRegistryUrl() throws RegistryUnavailableException {
        if (registryUrl == null) {
            throw new RegistryUnavailableException("License registry URL not configured");
        }
        return registryUrl;
    }

    private URI withQuery(String query) throws RegistryUnavailableException {
        String base = requireRegistryUrl().toString();
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    static List<RemoteRecord> parseRows(String body) throws RegistryUnavailableException {
        JsonElement root;
        try {
            root = JsonParser.parseString(body == null ? "" : body);
        } catch (JsonParseException e) {
            throw new RegistryUnavailableException("Malformed registry response: " + e.getMessage(), e);
        }

        JsonArray rows;
        if (root.isJsonArray()) {
            rows = root.getAsJsonArray();
        } else if (root.isJsonObject() && root.getAsJsonObject().has("records")
                && root.getAsJsonObject().get("records").isJsonArray()) {
            rows = root.getAsJsonObject().getAsJsonArray("records");
        } else if (root.isJsonObject()) {
            rows = new JsonArray();
            rows.add(root);
        } else {
            throw new RegistryUnavailableException("Unexpected registry response shape");
        }

        List<RemoteRecord> result = new ArrayList<>();
        for (JsonElement element : rows) {
            if (!element.isJsonObject()) {
                continue;
            }
            RemoteRecord row = parseRow(element.getAsJsonObject());
            if (row != null) {
                result.add(row);
            }
        }
        return result;
    }

    static RemoteRecord parseRow(JsonObject row) {
        String key = text(row, "license_key");
        if (key.isEmpty() || key.equalsIgnoreCase("license_key") || key.equalsIgnoreCase("key")) {
            return null;
        }

        HardwareFingerprint bindings = new HardwareFingerprint(
            text(row, "hw_component_1", "hw1"),
            text(row, "hw_component_2", "hw2"),
            text(row, "hw_component_3", "hw3")
        );

        return new RemoteRecord(
            key,
            LicenseStatus.fromRegistry(text(row, "status")),
            LicenseTier.fromRegistry(nullIfEmpty(text(row, "license_tier", "tier"))),
            parseDate(text(row, "expiry_date")),
            bindings,
            text(row, "licensee_name"),
            text(row, "licensee_email"),
            parseCount(text(row, "transfer_count")),
            text(row, "notes")
        );
    }

    private static String text(JsonObject row, String... names) {
        for (String name : names) {
            JsonElement value = row.get(name);
            if (value != null && !value.isJsonNull() && value.isJsonPrimitive()) {
                String s = value.getAsString().trim();
                if (!s.isEmpty()) {
                    return s;
                }
            }
        }
        return "";
    }

    private static LocalDate parseDate(String value) {
        if (value.length() < 10) {
            return null;
        }
        try {
            // Spreadsheet exports sometimes carry a time part
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            LOG.fine("Ignoring unparseable expiry date '" + value + "'");
            return null;
        }
    }

    private static int parseCount(String value) {
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            LOG.fine("Ignoring unparseable transfer count '" + value + "'");
            return 0;
        }
    }

    private static String nullIfEmpty(String value) {
        return value.isEmpty() ? null : value;
    }

    private enum PostOutcome {
        ACKNOWLEDGED,
        REJECTED,
        RETRYABLE
    }

    @Override
    public String toString() {
        return "HttpRegistryClient[" + registryUrl + ", key=" + LicenseRecord.maskKey(apiKey) + "]";
    }
}
