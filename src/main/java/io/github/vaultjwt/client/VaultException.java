package io.github.vaultjwt.client;

import java.util.List;

/**
 * Base exception for every failure raised by the Vault JWT client.
 *
 * <p>Carries the HTTP status code of the response that caused the failure.
 * Status code 0 means no response was received (connection failure,
 * interrupted request) or the failure happened on the client side.
 *
 * @see TransportException
 * @see AuthDeniedException
 * @see UnexpectedStatusException
 */
public class VaultException extends Exception {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final int httpStatusCode;

    /**
     * Creates a new VaultException.
     *
     * @param message        the error message
     * @param httpStatusCode the HTTP status code (0 for client-side errors)
     */
    public VaultException(String message, int httpStatusCode) {
        super(message);
        this.httpStatusCode = httpStatusCode;
    }

    /**
     * Creates a new VaultException with a cause.
     *
     * @param message        the error message
     * @param httpStatusCode the HTTP status code
     * @param cause          the underlying cause
     */
    public VaultException(String message, int httpStatusCode, Throwable cause) {
        super(message, cause);
        this.httpStatusCode = httpStatusCode;
    }

    /**
     * Gets the HTTP status code from the response.
     *
     * @return the status code, or 0 if the request failed before receiving a response
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    /**
     * Builds a readable message from an error response body.
     *
     * <p>Vault error bodies look like {@code {"errors": ["message1", "message2"]}};
     * the messages are joined with {@code "; "}. Anything else is reported as the
     * status code followed by the (truncated) body.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body, may be null
     * @return the message
     */
    public static String describeResponse(int statusCode, String body) {
        if (body == null || body.isBlank()) {
            return "Vault returned status " + statusCode;
        }

        List<String> errors = JsonUtil.parseErrors(body);
        if (errors != null && !errors.isEmpty()) {
            return String.join("; ", errors);
        }

        String truncated = body.length() > MAX_BODY_IN_MESSAGE
                ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..."
                : body;
        return "Vault returned status " + statusCode + ": " + truncated;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "message='" + getMessage() + '\'' +
                ", httpStatusCode=" + httpStatusCode +
                '}';
    }
}
