package io.github.vaultjwt.session;

/**
 * States of the session lifecycle loop.
 *
 * <pre>
 * LOGGING_IN -> WATCHING -> (RENEWAL_FAILED | LEASE_EXPIRED) -> LOGGING_IN -> ...
 * </pre>
 *
 * <p>The cycle only ends in {@link #STOPPED}, when the owning client is closed.
 */
public enum SessionState {

    /** A login request is in flight (or waiting for its backoff to elapse). */
    LOGGING_IN,

    /** A renewal watcher is keeping the current token alive. */
    WATCHING,

    /** The watcher gave up because a renewal request failed. */
    RENEWAL_FAILED,

    /** The token reached its max TTL and cannot be extended any further. */
    LEASE_EXPIRED,

    /** The lifecycle loop has exited. */
    STOPPED
}
