package io.github.vaultjwt.client;

/**
 * Raised when a request never produced an HTTP response: connection refused,
 * DNS failure, timeout or an interrupted call. Always carries status 0.
 */
public class TransportException extends VaultException {

    public TransportException(String message, Throwable cause) {
        super(message, 0, cause);
    }
}
