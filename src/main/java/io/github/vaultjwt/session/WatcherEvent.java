package io.github.vaultjwt.session;

import io.github.vaultjwt.auth.SessionSecret;
import io.github.vaultjwt.client.VaultException;

/**
 * Event emitted by a {@link RenewalWatcher}.
 *
 * <p>A watcher emits any number of {@code RENEWED} events followed by exactly
 * one {@code DONE} event. {@code DONE} carries an error when the watcher
 * failed, and none when the lease simply cannot be extended any further.
 */
public final class WatcherEvent {

    public enum Type {
        RENEWED,
        DONE
    }

    private final Type type;
    private final SessionSecret secret;
    private final VaultException error;

    private WatcherEvent(Type type, SessionSecret secret, VaultException error) {
        this.type = type;
        this.secret = secret;
        this.error = error;
    }

    public static WatcherEvent renewed(SessionSecret secret) {
        return new WatcherEvent(Type.RENEWED, secret, null);
    }

    public static WatcherEvent done(VaultException error) {
        return new WatcherEvent(Type.DONE, null, error);
    }

    public Type getType() {
        return type;
    }

    /** The replacement session, for {@code RENEWED} events. */
    public SessionSecret getSecret() {
        return secret;
    }

    /** The failure that stopped the watcher, or null on a clean max-TTL expiry. */
    public VaultException getError() {
        return error;
    }

    @Override
    public String toString() {
        return "WatcherEvent{" + type + (error != null ? ", error=" + error.getMessage() : "") + '}';
    }
}
