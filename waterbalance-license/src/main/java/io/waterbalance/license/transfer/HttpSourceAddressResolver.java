package io.waterbalance.license.transfer;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Resolves the public address through a plain-text echo endpoint, falling
 * back to the local host address when no endpoint is configured or it fails.
 */
public class HttpSourceAddressResolver implements SourceAddressResolver {

    private static final Logger LOG = Logger.getLogger(HttpSourceAddressResolver.class.getName());

    private static final int MAX_ADDRESS_LENGTH = 64;

    private final URI lookupUrl;
    private final Duration timeout;
    private final HttpClient httpClient;

    /**
     * @param lookupUrl endpoint answering with the caller's address as text (null = local address only)
     * @param timeout request timeout
     */
    public HttpSourceAddressResolver(URI lookupUrl, Duration timeout) {
        this.lookupUrl = lookupUrl;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public String resolve() {
        if (lookupUrl != null) {
            String remote = lookupPublicAddress();
            if (remote != null) {
                return remote;
            }
        }
        return localAddress();
    }

    private String lookupPublicAddress() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(lookupUrl)
            .GET()
            .timeout(timeout)
            .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            String body = response.body() != null ? response.body().trim() : "";
            if (response.statusCode() == 200 && !body.isEmpty() && body.length() <= MAX_ADDRESS_LENGTH) {
                return body;
            }
            LOG.fine("Address lookup returned HTTP " + response.statusCode() + ", using local address");
        } catch (IOException e) {
            LOG.fine("Address lookup failed: " + e.getMessage() + ", using local address");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.fine("Address lookup interrupted, using local address");
        }
        return null;
    }

    static String localAddress() {
        try {
            return InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            LOG.fine("Could not determine local address: " + e.getMessage());
            return UNKNOWN;
        }
    }
}
