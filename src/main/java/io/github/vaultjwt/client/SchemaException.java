package io.github.vaultjwt.client;

/**
 * Raised when a Vault response parses as JSON but does not have the shape the
 * KV v2 API documents (missing {@code data} object, non-string key list, ...).
 */
public class SchemaException extends VaultException {

    public SchemaException(String message, int httpStatusCode) {
        super(message, httpStatusCode);
    }

    public SchemaException(String message, int httpStatusCode, Throwable cause) {
        super(message, httpStatusCode, cause);
    }
}
