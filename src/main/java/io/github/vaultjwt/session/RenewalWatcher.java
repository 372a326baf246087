package io.github.vaultjwt.session;

import io.github.vaultjwt.auth.SessionSecret;
import java.util.concurrent.BlockingQueue;

/**
 * Background task that keeps one session's lease alive.
 *
 * <p>A watcher is bound to a single session for its whole life. It reports
 * progress as {@link WatcherEvent}s on the queue it was created with and never
 * emits anything after {@link #stop()} returns.
 *
 * @see TokenLifetimeWatcher
 */
public interface RenewalWatcher {

    /**
     * Starts watching. Returns immediately; the work happens in the background.
     */
    void start();

    /**
     * Stops watching and releases the watcher's thread. Safe to call more than once.
     */
    void stop();

    /**
     * Creates a watcher for a session.
     */
    @FunctionalInterface
    interface Factory {

        /**
         * @param session the session to keep alive
         * @param events  the queue to report renewals and completion on
         * @return a watcher that has not been started yet
         */
        RenewalWatcher create(SessionSecret session, BlockingQueue<WatcherEvent> events);
    }
}
