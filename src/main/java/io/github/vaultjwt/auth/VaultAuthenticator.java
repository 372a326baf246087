package io.github.vaultjwt.auth;

import io.github.vaultjwt.client.VaultException;
import io.github.vaultjwt.client.VaultHttpClient;

/**
 * Pluggable Vault login capability.
 *
 * <p>An authenticator knows how to obtain credentials for one auth method and
 * exchange them for a Vault session. It holds no session itself: every call to
 * {@link #login(VaultHttpClient)} returns a new {@link SessionSecret} and the
 * caller owns it.
 *
 * <h2>Token Lifecycle</h2>
 * <ol>
 *   <li>{@link #login(VaultHttpClient)} - called once at client construction</li>
 *   <li>Token renewal - handled by the session's renewal watcher</li>
 *   <li>{@link #login(VaultHttpClient)} again - called whenever the lease can no
 *       longer be renewed (max TTL reached, token revoked, renewal failed)</li>
 * </ol>
 *
 * <p>Implementations must therefore fetch fresh credentials on every call.
 *
 * @see JwtAuthenticator
 */
public interface VaultAuthenticator {

    /**
     * Returns the mount path of the auth method, e.g. {@code jwt}.
     *
     * <p>Used for logging and to build the login path.
     *
     * @return the mount path
     */
    String getMountPath();

    /**
     * Logs in to Vault and returns the new session.
     *
     * @param client the Vault HTTP client to send the login request with
     * @return the new session
     * @throws VaultException if credentials cannot be obtained or Vault rejects them
     */
    SessionSecret login(VaultHttpClient client) throws VaultException;
}
