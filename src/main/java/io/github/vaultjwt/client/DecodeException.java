package io.github.vaultjwt.client;

/**
 * Raised when a payload cannot be converted: a malformed login response, or
 * secret data that does not fit the requested Java type.
 */
public class DecodeException extends VaultException {

    public DecodeException(String message, int httpStatusCode) {
        super(message, httpStatusCode);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, 0, cause);
    }
}
