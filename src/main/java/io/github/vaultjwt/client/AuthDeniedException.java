package io.github.vaultjwt.client;

/**
 * Raised when the identity provider or the Vault login endpoint rejects the
 * presented credentials (client credentials, JWT or role binding).
 */
public class AuthDeniedException extends VaultException {

    public AuthDeniedException(String message, int httpStatusCode) {
        super(message, httpStatusCode);
    }

    public AuthDeniedException(String message, int httpStatusCode, Throwable cause) {
        super(message, httpStatusCode, cause);
    }
}
