package io.github.vaultjwt;

import io.github.vaultjwt.auth.IdentityTokenSource;
import io.github.vaultjwt.auth.JwtAuthenticator;
import io.github.vaultjwt.client.ConfigurationException;
import io.github.vaultjwt.client.VaultException;
import io.github.vaultjwt.client.VaultHttpClient;
import io.github.vaultjwt.kv.SecretStore;
import io.github.vaultjwt.session.SessionManager;
import io.github.vaultjwt.session.TokenLifetimeWatcher;
import java.io.Closeable;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vault KV v2 client that authenticates with identity provider tokens and
 * keeps its Vault session alive on its own.
 *
 * <p>Creation performs the initial JWT login and fails if it cannot. From then
 * on a background thread renews the Vault token and logs in again whenever the
 * token reaches its max TTL or a renewal fails. {@link #secrets()} always uses
 * whatever token is current.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (VaultJwtClient client = VaultJwtClient.create(VaultJwtConfig.fromParams(params))) {
 *     client.secrets().write("db", Map.of("password", "s3cr3t"));
 *     Map<String, Object> db = client.secrets().read("db");
 * }
 * }</pre>
 */
public class VaultJwtClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(VaultJwtClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final SessionManager sessionManager;
    private final SecretStore secretStore;

    VaultJwtClient(SessionManager sessionManager, SecretStore secretStore) {
        this.sessionManager = sessionManager;
        this.secretStore = secretStore;
    }

    /**
     * Creates a client from parameters and the process environment.
     *
     * @param params configuration parameters, see {@link VaultJwtConfig}
     * @return the connected client
     * @throws VaultException if the initial login fails
     */
    public static VaultJwtClient create(Map<String, String> params) throws VaultException {
        return create(VaultJwtConfig.fromParams(params));
    }

    /**
     * Creates a client, logs in and starts the session lifecycle.
     *
     * @param config the client configuration
     * @return the connected client
     * @throws ConfigurationException if Vault issues a non-renewable token
     * @throws VaultException         if the initial login fails
     */
    public static VaultJwtClient create(VaultJwtConfig config) throws VaultException {
        return create(config, Clock.systemUTC());
    }

    static VaultJwtClient create(VaultJwtConfig config, Clock clock) throws VaultException {
        logger.debug("Initializing VaultJwtClient: {}", config);

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        VaultHttpClient vaultClient = new VaultHttpClient(
                httpClient, config.getVaultAddr(), config.getRequestTimeout());

        IdentityTokenSource tokenSource = new IdentityTokenSource(
                httpClient,
                config.getAuthEndpoint(),
                config.getAuthRealm(),
                config.getClientId(),
                config.getClientSecret(),
                config.getRequestTimeout(),
                clock);

        JwtAuthenticator authenticator = new JwtAuthenticator(
                tokenSource, config.getVaultRole(), config.getAuthMount(), clock);

        SessionManager sessionManager = SessionManager.start(
                vaultClient,
                authenticator,
                TokenLifetimeWatcher.factory(vaultClient, config.getRenewalIncrementSeconds(), clock),
                config.getReloginInitialBackoff(),
                config.getReloginMaxBackoff());

        SecretStore secretStore = new SecretStore(
                vaultClient, config.getEngine(), sessionManager::currentToken);

        logger.info("VaultJwtClient initialized. Vault: {}, Role: {}, Auth: {}, Engine: {}",
                vaultClient.getBaseUrl(), config.getVaultRole(), config.getAuthMount(),
                secretStore.getEngine());
        return new VaultJwtClient(sessionManager, secretStore);
    }

    /**
     * Returns the KV v2 operations, bound to the live session.
     *
     * @return the secret store
     */
    public SecretStore secrets() {
        return secretStore;
    }

    /**
     * Returns the session lifecycle, for diagnostics.
     *
     * @return the session manager
     */
    public SessionManager session() {
        return sessionManager;
    }

    /**
     * Stops token renewal and re-login. Secret operations made afterwards use
     * the last token, which stops working once its lease runs out.
     */
    @Override
    public void close() {
        sessionManager.close();
        logger.info("VaultJwtClient closed");
    }
}
