package io.github.vaultjwt.client;

/**
 * Raised when a key, or the requested version of it, has no readable data.
 * Soft-deleted and destroyed versions are reported the same way.
 */
public class SecretNotFoundException extends VaultException {

    private final String key;

    public SecretNotFoundException(String key, String message) {
        super(message, 404);
        this.key = key;
    }

    /**
     * Returns the secret key that could not be read.
     *
     * @return the key
     */
    public String getKey() {
        return key;
    }
}
