package io.github.vaultjwt.auth;

import io.github.vaultjwt.client.AuthDeniedException;
import io.github.vaultjwt.client.DecodeException;
import io.github.vaultjwt.client.JsonUtil;
import io.github.vaultjwt.client.Preconditions;
import io.github.vaultjwt.client.TransportException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains access tokens from an OpenID Connect provider (Keycloak) using the
 * OAuth2 client-credentials grant.
 *
 * <p>Each call performs exactly one token request against
 * {@code {endpoint}/auth/realms/{realm}/protocol/openid-connect/token}.
 * There is no caching and no retry; the session lifecycle decides when to ask
 * again.
 */
public class IdentityTokenSource {

    private static final Logger logger = LoggerFactory.getLogger(IdentityTokenSource.class);

    private static final String CONTENT_TYPE_FORM = "application/x-www-form-urlencoded";
    private static final String GRANT_TYPE = "client_credentials";

    private final HttpClient httpClient;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Duration requestTimeout;
    private final Clock clock;

    /**
     * Creates a token source.
     *
     * @param httpClient     the HTTP client to use
     * @param authEndpoint   base address of the identity provider, e.g. {@code http://keycloak:8080}
     * @param realm          the realm (tenant) issuing the token
     * @param clientId       the confidential client id
     * @param clientSecret   the client secret
     * @param requestTimeout timeout for the token request
     * @param clock          clock used to stamp the request time
     */
    public IdentityTokenSource(HttpClient httpClient, String authEndpoint, String realm,
                               String clientId, String clientSecret, Duration requestTimeout,
                               Clock clock) {
        Preconditions.requireNonBlank(authEndpoint, "Auth endpoint");
        Preconditions.requireNonBlank(realm, "Auth realm");
        this.httpClient = httpClient;
        this.tokenUrl = stripTrailingSlash(authEndpoint)
                + "/auth/realms/" + realm + "/protocol/openid-connect/token";
        this.clientId = Preconditions.requireNonBlank(clientId, "Client ID");
        this.clientSecret = Preconditions.requireNonBlank(clientSecret, "Client secret");
        this.requestTimeout = requestTimeout;
        this.clock = clock;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Requests a fresh access token.
     *
     * @return the token, stamped with the time the request was sent
     * @throws AuthDeniedException if the identity provider answers with anything but 200
     * @throws TransportException  if the identity provider cannot be reached
     * @throws DecodeException     if the response has no access token
     */
    public IdentityToken fetchToken() throws AuthDeniedException, TransportException, DecodeException {
        Instant requestTime = clock.instant();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .timeout(requestTimeout)
                .header("Content-Type", CONTENT_TYPE_FORM)
                .POST(HttpRequest.BodyPublishers.ofString(formBody()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            logger.error("Token request to {} failed: {}", tokenUrl, e.getMessage());
            throw new TransportException("Connection to identity provider failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Identity provider request interrupted", e);
        }

        if (response.statusCode() != 200) {
            logger.error("Identity provider denied token request: {} {}",
                    response.statusCode(), response.body());
            throw new AuthDeniedException(
                    "Identity provider denied access (status " + response.statusCode() + ")",
                    response.statusCode());
        }

        IdentityToken token = JsonUtil.parse(response.body(), IdentityToken.class);
        if (token == null || token.getAccessToken() == null || token.getAccessToken().isBlank()) {
            throw new DecodeException("Identity provider response missing 'access_token'",
                    response.statusCode());
        }

        logger.debug("Obtained identity token for client '{}' (expires in {}s)",
                clientId, token.getExpiresIn());
        return token.withRequestTime(requestTime);
    }

    private String formBody() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("grant_type", GRANT_TYPE);
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getClientId() {
        return clientId;
    }
}
