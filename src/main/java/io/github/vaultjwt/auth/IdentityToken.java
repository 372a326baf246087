package io.github.vaultjwt.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;

/**
 * Access token issued by the identity provider's token endpoint.
 *
 * <p>Short-lived: it is handed to the Vault login call and dropped. The request
 * time is the moment the token request was sent, so {@link #getExpiresAt()} is
 * a conservative estimate.
 */
public final class IdentityToken {

    private final String accessToken;
    private final long expiresIn;
    private final long refreshExpiresIn;
    private final String refreshToken;
    private final String tokenType;
    private final Instant requestTime;

    @JsonCreator
    IdentityToken(@JsonProperty("access_token") String accessToken,
                  @JsonProperty("expires_in") long expiresIn,
                  @JsonProperty("refresh_expires_in") long refreshExpiresIn,
                  @JsonProperty("refresh_token") String refreshToken,
                  @JsonProperty("token_type") String tokenType) {
        this(accessToken, expiresIn, refreshExpiresIn, refreshToken, tokenType, null);
    }

    public IdentityToken(String accessToken, long expiresIn, long refreshExpiresIn,
                         String refreshToken, String tokenType, Instant requestTime) {
        this.accessToken = accessToken;
        this.expiresIn = expiresIn;
        this.refreshExpiresIn = refreshExpiresIn;
        this.refreshToken = refreshToken;
        this.tokenType = tokenType;
        this.requestTime = requestTime;
    }

    IdentityToken withRequestTime(Instant requestTime) {
        return new IdentityToken(accessToken, expiresIn, refreshExpiresIn, refreshToken, tokenType,
                requestTime);
    }

    public String getAccessToken() {
        return accessToken;
    }

    /** Nominal lifetime in seconds, as reported by the identity provider. */
    public long getExpiresIn() {
        return expiresIn;
    }

    public long getRefreshExpiresIn() {
        return refreshExpiresIn;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public Instant getRequestTime() {
        return requestTime;
    }

    @JsonIgnore
    public Instant getExpiresAt() {
        return requestTime != null ? requestTime.plus(Duration.ofSeconds(expiresIn)) : null;
    }

    @Override
    public String toString() {
        return "IdentityToken{tokenType='" + tokenType + "', expiresIn=" + expiresIn
                + ", requestTime=" + requestTime + '}';
    }
}
