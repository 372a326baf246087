package io.github.vaultjwt.client;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lightweight HTTP client wrapper for the HashiCorp Vault REST API.
 *
 * <p>This class provides a thin wrapper around {@link HttpClient}. It handles:
 * <ul>
 *   <li>Token-based authentication via the X-Vault-Token header</li>
 *   <li>Request/response JSON serialization</li>
 *   <li>Error response parsing</li>
 *   <li>KV v2 quirks (404 responses that still carry metadata, LIST via {@code ?list=true})</li>
 * </ul>
 *
 * <p>The client holds no token of its own. Every authenticated call takes the
 * token to present, so callers always send the session token that is current
 * at call time.
 *
 * <p>The client is designed to be injectable/mockable for unit testing.
 */
public class VaultHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(VaultHttpClient.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String HEADER_VAULT_TOKEN = "X-Vault-Token";
    private static final String CONTENT_TYPE_JSON = "application/json";
    private static final String UI_SUFFIX = "/ui";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    /**
     * Creates a new VaultHttpClient with default settings.
     *
     * @param baseUrl the Vault server URL (e.g., "https://vault:8200")
     */
    public VaultHttpClient(String baseUrl) {
        this(baseUrl, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * Creates a new VaultHttpClient with a custom request timeout.
     *
     * @param baseUrl        the Vault server URL
     * @param requestTimeout timeout for individual requests
     */
    public VaultHttpClient(String baseUrl, Duration requestTimeout) {
        this(buildHttpClient(), baseUrl, requestTimeout);
    }

    /**
     * Creates a new VaultHttpClient with an injected HttpClient (for testing).
     *
     * @param httpClient     the HTTP client to use
     * @param baseUrl        the Vault server URL
     * @param requestTimeout timeout for individual requests
     */
    public VaultHttpClient(HttpClient httpClient, String baseUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.baseUrl = normalizeUrl(Preconditions.requireNonBlank(baseUrl, "Vault address"));
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
    }

    static HttpClient buildHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Strips a trailing slash and a trailing {@code /ui}, so the address copied
     * from the Vault web UI works as well.
     */
    static String normalizeUrl(String url) {
        String normalized = url.trim();
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.endsWith(UI_SUFFIX)) {
            normalized = normalized.substring(0, normalized.length() - UI_SUFFIX.length());
        }
        return normalized;
    }

    /**
     * Percent-encodes each segment of a hierarchical secret path, keeping the slashes.
     *
     * @param path the path, e.g. {@code apps/billing/db password}
     * @return the encoded path, e.g. {@code apps/billing/db%20password}
     */
    public static String encodePath(String path) {
        String[] segments = path.split("/", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return sb.toString();
    }

    /**
     * Reads a logical path.
     *
     * @param path  API path starting with {@code /v1/}
     * @param token the token to present
     * @return the response; null on a 404 without data; a 404 response when Vault
     *         still returned data (KV v2 soft-deleted or destroyed versions)
     * @throws VaultException on transport failures or other non-2xx status codes
     */
    public VaultResponse read(String path, String token) throws VaultException {
        HttpRequest request = buildRequest(path, token).GET().build();
        HttpResponse<String> response = send(request);

        if (response.statusCode() == 404) {
            VaultResponse parsed = VaultResponse.fromJson(404, response.body());
            return parsed.getData() != null ? parsed : null;
        }
        return toVaultResponse(response);
    }

    /**
     * Lists the children of a logical path.
     *
     * @param path  API path starting with {@code /v1/}
     * @param token the token to present
     * @return the response, or null if nothing exists under the path
     * @throws VaultException on transport failures or other non-2xx status codes
     */
    public VaultResponse list(String path, String token) throws VaultException {
        HttpRequest request = buildRequest(path + "?list=true", token).GET().build();
        HttpResponse<String> response = send(request);

        if (response.statusCode() == 404) {
            return null;
        }
        return toVaultResponse(response);
    }

    /**
     * POSTs a JSON body to a logical path.
     *
     * @param path  API path starting with {@code /v1/}
     * @param body  the request body, serialized as JSON
     * @param token the token to present
     * @return the response
     * @throws VaultException on transport failures or non-2xx status codes
     */
    public VaultResponse write(String path, Object body, String token) throws VaultException {
        HttpRequest request = buildRequest(path, token)
                .header("Content-Type", CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtil.toJson(body)))
                .build();
        return toVaultResponse(send(request));
    }

    /**
     * Sends a DELETE to a logical path.
     *
     * @param path  API path starting with {@code /v1/}
     * @param token the token to present
     * @return the response (usually empty, status 204)
     * @throws VaultException on transport failures or non-2xx status codes
     */
    public VaultResponse delete(String path, String token) throws VaultException {
        HttpRequest request = buildRequest(path, token).DELETE().build();
        return toVaultResponse(send(request));
    }

    /**
     * POSTs without authentication (for auth method logins).
     *
     * @param path API path starting with {@code /v1/}
     * @param body the request body
     * @return the response
     * @throws VaultException on transport failures or non-2xx status codes
     */
    public VaultResponse postUnauthenticated(String path, Map<String, Object> body)
            throws VaultException {
        return write(path, body, null);
    }

    /**
     * Renews the given token.
     *
     * @param token            the token to renew
     * @param incrementSeconds the requested lease extension
     * @return the renewal response, with the new lease in {@code auth}
     * @throws VaultException if the renewal is rejected or the request fails
     */
    public VaultResponse renewSelf(String token, long incrementSeconds) throws VaultException {
        return write("/v1/auth/token/renew-self", Map.of("increment", incrementSeconds), token);
    }

    private HttpRequest.Builder buildRequest(String path, String token) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout);

        if (token != null && !token.isBlank()) {
            builder.header(HEADER_VAULT_TOKEN, token);
        }

        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) throws TransportException {
        logger.debug("Vault request: {} {}", request.method(), request.uri());

        try {
            HttpResponse<String> response = httpClient.send(
                    request, HttpResponse.BodyHandlers.ofString());

            String body = response.body();
            logger.debug("Vault response: {} ({})", response.statusCode(),
                    body != null ? body.length() + " bytes" : "empty");

            return response;

        } catch (IOException e) {
            throw new TransportException("Connection to Vault failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Vault request interrupted", e);
        }
    }

    private VaultResponse toVaultResponse(HttpResponse<String> response)
            throws UnexpectedStatusException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw UnexpectedStatusException.fromResponse(status, response.body());
        }
        return VaultResponse.fromJson(status, response.body());
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }
}
