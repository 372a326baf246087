package io.github.vaultjwt.client;

/**
 * Raised when Vault hands out a session that this client cannot keep alive,
 * which points at a Vault-side misconfiguration (for example a JWT role that
 * issues non-renewable tokens). Never retried.
 */
public class ConfigurationException extends VaultException {

    public ConfigurationException(String message) {
        super(message, 0);
    }
}
