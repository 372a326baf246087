package io.github.vaultjwt.client;

/**
 * Raised when Vault answers with a status code outside the 2xx range.
 */
public class UnexpectedStatusException extends VaultException {

    public UnexpectedStatusException(String message, int httpStatusCode) {
        super(message, httpStatusCode);
    }

    /**
     * Creates an exception from an HTTP error response, using the Vault
     * {@code errors} array as message where present.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body (may contain JSON error details)
     * @return a new UnexpectedStatusException with parsed error message
     */
    public static UnexpectedStatusException fromResponse(int statusCode, String body) {
        return new UnexpectedStatusException(describeResponse(statusCode, body), statusCode);
    }
}
