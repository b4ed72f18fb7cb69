package fr.lapetina.tr064.infrastructure.http;

import fr.lapetina.tr064.domain.error.ResourceUnavailableException;
import fr.lapetina.tr064.domain.error.RouterAuthorizationException;
import fr.lapetina.tr064.domain.error.RouterConnectionException;
import fr.lapetina.tr064.infrastructure.discovery.DocumentFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP client for communicating with the router.
 *
 * Uses java.net.http.HttpClient synchronously: one request at a time per caller,
 * no retries. Handles digest authentication when a password is configured.
 */
public class RouterHttpClient implements DocumentFetcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterHttpClient.class);

    public static final int HTTP_PORT = 49000;
    public static final int HTTPS_PORT = 49443;

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final AtomicReference<Credentials> credentials;
    private final DigestAuthenticator authenticator;

    public RouterHttpClient(
            String baseUrl,
            Credentials credentials,
            Duration connectTimeout,
            Duration requestTimeout,
            SSLContext sslContext,
            DigestAuthenticator authenticator
    ) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.requestTimeout = requestTimeout;
        this.credentials = new AtomicReference<>(credentials);
        this.authenticator = authenticator;

        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1);
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }
        this.httpClient = builder.build();
    }

    public RouterHttpClient(String baseUrl, Credentials credentials) {
        this(baseUrl, credentials, Duration.ofSeconds(10), Duration.ofSeconds(30), null, new DigestAuthenticator());
    }

    /**
     * Builds the base URL from a router address. A scheme, path or port already present
     * in the address is dropped; the scheme follows {@code useTls} and a missing port
     * falls back to the protocol default.
     */
    public static String buildBaseUrl(String address, Integer port, boolean useTls) {
        int effectivePort = port != null ? port : (useTls ? HTTPS_PORT : HTTP_PORT);
        return (useTls ? "https" : "http") + "://" + hostOf(address) + ":" + effectivePort;
    }

    /**
     * Builds the base URL of the router's web interface, which listens on the
     * standard HTTP(S) port unless {@code port} is given.
     */
    public static String buildWebBaseUrl(String address, Integer port, boolean useTls) {
        String base = (useTls ? "https" : "http") + "://" + hostOf(address);
        return port != null ? base + ":" + port : base;
    }

    /**
     * Extracts the host from an address that may carry a scheme, a port or a path,
     * e.g. "192.168.178.1" for "http://192.168.178.1:49000/".
     */
    public static String hostOf(String address) {
        String host = address == null ? "" : address.trim();
        int schemeEnd = host.indexOf("://");
        if (schemeEnd >= 0) {
            host = host.substring(schemeEnd + 3);
        }
        int pathStart = host.indexOf('/');
        if (pathStart >= 0) {
            host = host.substring(0, pathStart);
        }
        if (host.startsWith("[")) {
            int end = host.indexOf(']');
            return end >= 0 ? host.substring(0, end + 1) : host;
        }
        int portStart = host.indexOf(':');
        if (portStart >= 0 && portStart == host.lastIndexOf(':')) {
            host = host.substring(0, portStart);
        }
        return host;
    }

    /**
     * Fetches a document (descriptor, action schema) by GET.
     *
     * @param location absolute URL or path relative to the base URL
     * @return the document body
     * @throws ResourceUnavailableException if the router answers with an HTML page
     * @throws RouterAuthorizationException if the router rejects the credentials
     * @throws RouterConnectionException    on transport failure or unexpected status
     */
    @Override
    public String fetch(String location) {
        URI uri = resolve(location);
        RouterResponse response = send(uri, "GET", Map.of(), null);

        if (response.statusCode() == 401) {
            throw new RouterAuthorizationException("Access denied to " + uri + " (HTTP 401)");
        }
        if (response.isHtml()) {
            log.debug("Resource answered with HTML: uri={}, status={}", uri, response.statusCode());
            throw new ResourceUnavailableException("Resource not available: " + uri);
        }
        if (!response.isSuccess()) {
            throw new RouterConnectionException("Unexpected HTTP status " + response.statusCode()
                    + " for " + uri);
        }
        return response.body();
    }

    /**
     * Posts a body to a path below the base URL and returns whatever the router answers.
     */
    public RouterResponse post(String path, Map<String, String> headers, String body) {
        return send(resolve(path), "POST", headers, body);
    }

    private RouterResponse send(URI uri, String method, Map<String, String> headers, String body) {
        Instant startTime = Instant.now();
        try {
            HttpResponse<String> response = httpClient.send(
                    buildRequest(uri, method, headers, body), HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == 401 && renewChallenge(response)) {
                log.debug("Digest challenge received, retrying: uri={}", uri);
                response = httpClient.send(
                        buildRequest(uri, method, headers, body), HttpResponse.BodyHandlers.ofString());
            }

            log.debug("Router answered: method={}, uri={}, status={}, latencyMs={}",
                    method, uri, response.statusCode(), Duration.between(startTime, Instant.now()).toMillis());

            return new RouterResponse(
                    response.statusCode(),
                    response.headers().firstValue("Content-Type").orElse(null),
                    response.body());

        } catch (HttpConnectTimeoutException e) {
            log.error("Connection timeout: uri={}, error={}", uri, e.getMessage());
            throw new RouterConnectionException("Connection to " + uri + " timed out", e);
        } catch (HttpTimeoutException e) {
            log.error("Request timeout: uri={}, error={}", uri, e.getMessage());
            throw new RouterConnectionException("Request to " + uri + " timed out", e);
        } catch (IOException e) {
            log.error("Router connection error: uri={}, errorType={}, error={}",
                    uri, e.getClass().getSimpleName(), e.getMessage());
            throw new RouterConnectionException("Unable to connect to " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RouterConnectionException("Interrupted while calling " + uri, e);
        }
    }

    private HttpRequest buildRequest(URI uri, String method, Map<String, String> headers, String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout);
        headers.forEach(builder::header);

        authenticator.authorization(method, authorizationUri(uri), credentials.get())
                .ifPresent(value -> builder.header("Authorization", value));

        if (body != null) {
            builder.method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private boolean renewChallenge(HttpResponse<String> response) {
        if (!credentials.get().hasPassword()) {
            return false;
        }
        List<String> challenges = response.headers().allValues("WWW-Authenticate");
        for (String header : challenges) {
            DigestChallenge challenge = DigestChallenge.parse(header);
            if (challenge != null) {
                authenticator.challenge(challenge);
                return true;
            }
        }
        log.warn("Authentication required but no digest challenge offered: headers={}", challenges);
        return false;
    }

    private static String authorizationUri(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        return uri.getRawQuery() != null ? path + "?" + uri.getRawQuery() : path;
    }

    URI resolve(String location) {
        String url = location.startsWith("http://") || location.startsWith("https://")
                ? location
                : baseUrl + (location.startsWith("/") ? "" : "/") + location;
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new RouterConnectionException("Invalid location '" + location + "': " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Credentials getCredentials() {
        return credentials.get();
    }

    /**
     * Replaces the credentials used for subsequent requests.
     */
    public void setCredentials(Credentials newCredentials) {
        Credentials previous = credentials.getAndSet(newCredentials);
        if (!previous.user().equals(newCredentials.user())) {
            log.info("Router user changed: {} -> {}", previous.user(), newCredentials.user());
        }
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }
}
