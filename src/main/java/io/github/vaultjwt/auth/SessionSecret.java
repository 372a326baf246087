package io.github.vaultjwt.auth;

import io.github.vaultjwt.client.DecodeException;
import io.github.vaultjwt.client.VaultResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Vault session credential: the client token plus its lease.
 *
 * <p>Immutable. A renewal or a fresh login yields a new instance, which is
 * what lets readers pick up the current token through a single reference
 * without locking.
 */
public final class SessionSecret {

    private final String clientToken;
    private final String accessor;
    private final boolean renewable;
    private final long leaseDurationSeconds;
    private final List<String> policies;
    private final Instant issuedAt;

    public SessionSecret(String clientToken, String accessor, boolean renewable,
                         long leaseDurationSeconds, List<String> policies, Instant issuedAt) {
        this.clientToken = clientToken;
        this.accessor = accessor;
        this.renewable = renewable;
        this.leaseDurationSeconds = leaseDurationSeconds;
        this.policies = policies != null ? List.copyOf(policies) : Collections.emptyList();
        this.issuedAt = issuedAt;
    }

    /**
     * Builds a session from the {@code auth} block of a login or renew-self response.
     *
     * @param response the Vault response
     * @param clock    clock used to stamp the issue time
     * @return the session
     * @throws DecodeException if the response has no {@code auth.client_token}
     */
    public static SessionSecret fromResponse(VaultResponse response, Clock clock)
            throws DecodeException {
        Map<String, Object> auth = response.getAuth();
        if (auth == null) {
            throw new DecodeException("Vault response missing 'auth' field", response.getStatus());
        }

        String clientToken = response.getAuthString("client_token");
        if (clientToken == null || clientToken.isBlank()) {
            throw new DecodeException("Vault response missing 'client_token'", response.getStatus());
        }

        List<String> policies = new ArrayList<>();
        Object policiesObj = auth.get("policies");
        if (policiesObj instanceof List) {
            for (Object policy : (List<?>) policiesObj) {
                if (policy != null) {
                    policies.add(policy.toString());
                }
            }
        }

        return new SessionSecret(
                clientToken,
                response.getAuthString("accessor"),
                response.getAuthBoolean("renewable"),
                response.getAuthLong("lease_duration", 0),
                policies,
                clock.instant());
    }

    public String getClientToken() {
        return clientToken;
    }

    public String getAccessor() {
        return accessor;
    }

    public boolean isRenewable() {
        return renewable;
    }

    public long getLeaseDurationSeconds() {
        return leaseDurationSeconds;
    }

    public List<String> getPolicies() {
        return policies;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return issuedAt.plus(Duration.ofSeconds(leaseDurationSeconds));
    }

    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(getExpiresAt());
    }

    // Never print the token itself.
    @Override
    public String toString() {
        return "SessionSecret{accessor='" + accessor + "', renewable=" + renewable
                + ", leaseDurationSeconds=" + leaseDurationSeconds
                + ", policies=" + policies + ", issuedAt=" + issuedAt + '}';
    }
}
