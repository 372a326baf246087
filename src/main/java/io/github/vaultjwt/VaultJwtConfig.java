package io.github.vaultjwt;

import io.github.vaultjwt.auth.JwtAuthenticator;
import io.github.vaultjwt.client.Preconditions;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Settings of a {@link VaultJwtClient}.
 *
 * <p>Built either with {@link #builder()} or from a flat parameter map with
 * {@link #fromParams(Map)}. Each parameter is resolved in this order:
 * <ol>
 *   <li>the parameter map</li>
 *   <li>the environment variable, where one exists</li>
 *   <li>the default, where one exists</li>
 * </ol>
 *
 * <p>Parameters:
 * <ul>
 *   <li>{@code vault-addr} / {@code VAULT_ADDR} - Vault server URL (required)</li>
 *   <li>{@code vault-role} / {@code VAULT_ROLE} - JWT role to log in as (required)</li>
 *   <li>{@code auth-endpoint} / {@code AUTH_ENDPOINT} - identity provider base URL (required)</li>
 *   <li>{@code auth-realm} / {@code AUTH_REALM} - identity provider realm (required)</li>
 *   <li>{@code auth-client-id} / {@code AUTH_CLIENT_ID} - confidential client id (required)</li>
 *   <li>{@code auth-client-secret} / {@code AUTH_CLIENT_SECRET} - client secret (required)</li>
 *   <li>{@code vault-engine} / {@code VAULT_ENGINE} - KV v2 mount path (required)</li>
 *   <li>{@code auth-mount} / {@code VAULT_AUTH_MOUNT} - JWT auth mount path (default: jwt)</li>
 *   <li>{@code renewal-increment-seconds} - lease extension per renewal (default: 3600)</li>
 *   <li>{@code request-timeout-seconds} - timeout of each HTTP request (default: 30)</li>
 *   <li>{@code relogin-initial-backoff-ms} - first retry delay after a failed re-login (default: 1000)</li>
 *   <li>{@code relogin-max-backoff-ms} - upper bound of the re-login retry delay (default: 60000)</li>
 * </ul>
 */
public final class VaultJwtConfig {

    // Environment variable names
    static final String ENV_VAULT_ADDR = "VAULT_ADDR";
    static final String ENV_VAULT_ROLE = "VAULT_ROLE";
    static final String ENV_AUTH_ENDPOINT = "AUTH_ENDPOINT";
    static final String ENV_AUTH_REALM = "AUTH_REALM";
    static final String ENV_AUTH_CLIENT_ID = "AUTH_CLIENT_ID";
    static final String ENV_AUTH_CLIENT_SECRET = "AUTH_CLIENT_SECRET";
    static final String ENV_VAULT_ENGINE = "VAULT_ENGINE";
    static final String ENV_VAULT_AUTH_MOUNT = "VAULT_AUTH_MOUNT";

    // Parameter names
    static final String PARAM_VAULT_ADDR = "vault-addr";
    static final String PARAM_VAULT_ROLE = "vault-role";
    static final String PARAM_AUTH_ENDPOINT = "auth-endpoint";
    static final String PARAM_AUTH_REALM = "auth-realm";
    static final String PARAM_AUTH_CLIENT_ID = "auth-client-id";
    static final String PARAM_AUTH_CLIENT_SECRET = "auth-client-secret";
    static final String PARAM_VAULT_ENGINE = "vault-engine";
    static final String PARAM_AUTH_MOUNT = "auth-mount";
    static final String PARAM_RENEWAL_INCREMENT_SECONDS = "renewal-increment-seconds";
    static final String PARAM_REQUEST_TIMEOUT_SECONDS = "request-timeout-seconds";
    static final String PARAM_RELOGIN_INITIAL_BACKOFF_MS = "relogin-initial-backoff-ms";
    static final String PARAM_RELOGIN_MAX_BACKOFF_MS = "relogin-max-backoff-ms";

    // Defaults
    static final long DEFAULT_RENEWAL_INCREMENT_SECONDS = 3600L;
    static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 30L;
    static final long DEFAULT_RELOGIN_INITIAL_BACKOFF_MS = 1000L;
    static final long DEFAULT_RELOGIN_MAX_BACKOFF_MS = 60000L;

    private final String vaultAddr;
    private final String vaultRole;
    private final String authEndpoint;
    private final String authRealm;
    private final String clientId;
    private final String clientSecret;
    private final String engine;
    private final String authMount;
    private final long renewalIncrementSeconds;
    private final Duration requestTimeout;
    private final Duration reloginInitialBackoff;
    private final Duration reloginMaxBackoff;

    private VaultJwtConfig(Builder builder) {
        this.vaultAddr = Preconditions.requireNonBlank(builder.vaultAddr, "Vault address");
        this.vaultRole = Preconditions.requireNonBlank(builder.vaultRole, "Vault role");
        this.authEndpoint = Preconditions.requireNonBlank(builder.authEndpoint, "Auth endpoint");
        this.authRealm = Preconditions.requireNonBlank(builder.authRealm, "Auth realm");
        this.clientId = Preconditions.requireNonBlank(builder.clientId, "Client ID");
        this.clientSecret = Preconditions.requireNonBlank(builder.clientSecret, "Client secret");
        this.engine = Preconditions.requireNonBlank(builder.engine, "Secret engine");
        this.authMount = Preconditions.requireNonBlank(builder.authMount, "Auth mount path");
        this.renewalIncrementSeconds = Preconditions.requirePositive(
                builder.renewalIncrementSeconds, "Renewal increment");
        this.requestTimeout = requirePositive(builder.requestTimeout, "Request timeout");
        this.reloginInitialBackoff = requirePositive(builder.reloginInitialBackoff, "Initial re-login backoff");
        this.reloginMaxBackoff = requirePositive(builder.reloginMaxBackoff, "Maximum re-login backoff");
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the configuration from parameters, falling back to the process environment.
     *
     * @param params configuration parameters
     * @return the configuration
     * @throws IllegalArgumentException if a required value is missing or a value is invalid
     */
    public static VaultJwtConfig fromParams(Map<String, String> params) {
        return fromParams(params, System::getenv);
    }

    /**
     * Resolves the configuration from parameters, falling back to the given environment.
     *
     * @param params configuration parameters
     * @param env    environment variable lookup
     * @return the configuration
     * @throws IllegalArgumentException if a required value is missing or a value is invalid
     */
    public static VaultJwtConfig fromParams(Map<String, String> params, Function<String, String> env) {
        return builder()
                .vaultAddr(require(params, env, PARAM_VAULT_ADDR, ENV_VAULT_ADDR, "Vault address"))
                .vaultRole(require(params, env, PARAM_VAULT_ROLE, ENV_VAULT_ROLE, "Vault role"))
                .authEndpoint(require(params, env, PARAM_AUTH_ENDPOINT, ENV_AUTH_ENDPOINT, "auth endpoint"))
                .authRealm(require(params, env, PARAM_AUTH_REALM, ENV_AUTH_REALM, "auth realm"))
                .clientId(require(params, env, PARAM_AUTH_CLIENT_ID, ENV_AUTH_CLIENT_ID, "client ID"))
                .clientSecret(require(params, env, PARAM_AUTH_CLIENT_SECRET, ENV_AUTH_CLIENT_SECRET,
                        "client secret"))
                .engine(require(params, env, PARAM_VAULT_ENGINE, ENV_VAULT_ENGINE, "secret engine"))
                .authMount(getConfig(params, env, PARAM_AUTH_MOUNT, ENV_VAULT_AUTH_MOUNT,
                        JwtAuthenticator.DEFAULT_MOUNT_PATH))
                .renewalIncrementSeconds(parsePositive(params, PARAM_RENEWAL_INCREMENT_SECONDS,
                        DEFAULT_RENEWAL_INCREMENT_SECONDS))
                .requestTimeout(Duration.ofSeconds(parsePositive(params, PARAM_REQUEST_TIMEOUT_SECONDS,
                        DEFAULT_REQUEST_TIMEOUT_SECONDS)))
                .reloginInitialBackoff(Duration.ofMillis(parsePositive(params, PARAM_RELOGIN_INITIAL_BACKOFF_MS,
                        DEFAULT_RELOGIN_INITIAL_BACKOFF_MS)))
                .reloginMaxBackoff(Duration.ofMillis(parsePositive(params, PARAM_RELOGIN_MAX_BACKOFF_MS,
                        DEFAULT_RELOGIN_MAX_BACKOFF_MS)))
                .build();
    }

    private static String require(Map<String, String> params, Function<String, String> env,
                                  String paramName, String envName, String description) {
        String value = getConfig(params, env, paramName, envName, null);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Missing required configuration: " + description + ". "
                            + "Set " + envName + " environment variable or "
                            + paramName + " parameter.");
        }
        return value;
    }

    private static long parsePositive(Map<String, String> params, String paramName, long defaultValue) {
        String raw = getConfig(params, name -> null, paramName, null, String.valueOf(defaultValue));
        try {
            long value = Long.parseLong(raw.trim());
            if (value <= 0) {
                throw new NumberFormatException("non-positive value");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid " + paramName + " value: '" + raw + "'. Must be a positive integer.");
        }
    }

    private static String getConfig(Map<String, String> params, Function<String, String> env,
                                     String paramName, String envName, String defaultValue) {
        // Explicit parameter first
        String value = params.get(paramName);
        if (value != null && !value.isBlank()) {
            return value;
        }

        // Then the environment
        if (envName != null) {
            value = env.apply(envName);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }

        return defaultValue;
    }

    public String getVaultAddr() {
        return vaultAddr;
    }

    public String getVaultRole() {
        return vaultRole;
    }

    public String getAuthEndpoint() {
        return authEndpoint;
    }

    public String getAuthRealm() {
        return authRealm;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getEngine() {
        return engine;
    }

    public String getAuthMount() {
        return authMount;
    }

    public long getRenewalIncrementSeconds() {
        return renewalIncrementSeconds;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getReloginInitialBackoff() {
        return reloginInitialBackoff;
    }

    public Duration getReloginMaxBackoff() {
        return reloginMaxBackoff;
    }

    @Override
    public String toString() {
        return "VaultJwtConfig{vaultAddr='" + vaultAddr + "', vaultRole='" + vaultRole
                + "', authEndpoint='" + authEndpoint + "', authRealm='" + authRealm
                + "', clientId='" + clientId + "', engine='" + engine
                + "', authMount='" + authMount + "', renewalIncrementSeconds=" + renewalIncrementSeconds
                + ", requestTimeout=" + requestTimeout + '}';
    }

    /**
     * Builder for {@link VaultJwtConfig}. Optional settings start at their defaults.
     */
    public static final class Builder {

        private String vaultAddr;
        private String vaultRole;
        private String authEndpoint;
        private String authRealm;
        private String clientId;
        private String clientSecret;
        private String engine;
        private String authMount = JwtAuthenticator.DEFAULT_MOUNT_PATH;
        private long renewalIncrementSeconds = DEFAULT_RENEWAL_INCREMENT_SECONDS;
        private Duration requestTimeout = Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
        private Duration reloginInitialBackoff = Duration.ofMillis(DEFAULT_RELOGIN_INITIAL_BACKOFF_MS);
        private Duration reloginMaxBackoff = Duration.ofMillis(DEFAULT_RELOGIN_MAX_BACKOFF_MS);

        private Builder() {
        }

        public Builder vaultAddr(String vaultAddr) {
            this.vaultAddr = vaultAddr;
            return this;
        }

        public Builder vaultRole(String vaultRole) {
            this.vaultRole = vaultRole;
            return this;
        }

        public Builder authEndpoint(String authEndpoint) {
            this.authEndpoint = authEndpoint;
            return this;
        }

        public Builder authRealm(String authRealm) {
            this.authRealm = authRealm;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder engine(String engine) {
            this.engine = engine;
            return this;
        }

        public Builder authMount(String authMount) {
            this.authMount = authMount;
            return this;
        }

        public Builder renewalIncrementSeconds(long renewalIncrementSeconds) {
            this.renewalIncrementSeconds = renewalIncrementSeconds;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder reloginInitialBackoff(Duration reloginInitialBackoff) {
            this.reloginInitialBackoff = reloginInitialBackoff;
            return this;
        }

        public Builder reloginMaxBackoff(Duration reloginMaxBackoff) {
            this.reloginMaxBackoff = reloginMaxBackoff;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if a required value is missing or a value is invalid
         */
        public VaultJwtConfig build() {
            return new VaultJwtConfig(this);
        }
    }
}
