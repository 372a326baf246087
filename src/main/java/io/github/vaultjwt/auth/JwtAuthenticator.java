package io.github.vaultjwt.auth;

import io.github.vaultjwt.client.AuthDeniedException;
import io.github.vaultjwt.client.Preconditions;
import io.github.vaultjwt.client.UnexpectedStatusException;
import io.github.vaultjwt.client.VaultException;
import io.github.vaultjwt.client.VaultHttpClient;
import io.github.vaultjwt.client.VaultResponse;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticator for the Vault JWT auth method.
 *
 * <p>Each login fetches a fresh access token from the identity provider with
 * the client-credentials grant and presents it to
 * {@code /v1/auth/{mount}/login} together with the configured role:
 * <pre>{@code
 * { "role": "<vault role>", "jwt": "<access token>" }
 * }</pre>
 *
 * <p>Because the identity token is requested anew on every call, this
 * authenticator can always re-authenticate after the Vault session reaches
 * its max TTL.
 *
 * @see VaultAuthenticator
 * @see IdentityTokenSource
 */
public class JwtAuthenticator implements VaultAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticator.class);

    public static final String DEFAULT_MOUNT_PATH = "jwt";

    private final IdentityTokenSource tokenSource;
    private final String role;
    private final String mountPath;
    private final Clock clock;

    /**
     * Creates a JWT authenticator.
     *
     * @param tokenSource source of identity provider access tokens
     * @param role        the Vault JWT role to log in as
     * @param mountPath   the mount path of the JWT auth method
     * @param clock       clock used to stamp the session issue time
     */
    public JwtAuthenticator(IdentityTokenSource tokenSource, String role, String mountPath,
                            Clock clock) {
        this.tokenSource = tokenSource;
        this.role = Preconditions.requireNonBlank(role, "Vault role");
        this.mountPath = Preconditions.requireNonBlank(mountPath, "Auth mount path");
        this.clock = clock;
    }

    @Override
    public String getMountPath() {
        return mountPath;
    }

    @Override
    public SessionSecret login(VaultHttpClient client) throws VaultException {
        IdentityToken identityToken = tokenSource.fetchToken();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("role", role);
        body.put("jwt", identityToken.getAccessToken());

        VaultResponse response;
        try {
            response = client.postUnauthenticated("/v1/auth/" + mountPath + "/login", body);
        } catch (UnexpectedStatusException e) {
            int status = e.getHttpStatusCode();
            if (status >= 400 && status < 500) {
                throw new AuthDeniedException(
                        "Vault JWT login denied for role '" + role + "': " + e.getMessage(), status, e);
            }
            throw e;
        }

        SessionSecret session = SessionSecret.fromResponse(response, clock);
        logger.info("JWT login successful for role '{}' at auth/{} (lease {}s, renewable: {})",
                role, mountPath, session.getLeaseDurationSeconds(), session.isRenewable());
        return session;
    }

    public String getRole() {
        return role;
    }
}
