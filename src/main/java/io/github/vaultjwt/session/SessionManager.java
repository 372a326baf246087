package io.github.vaultjwt.session;

import io.github.vaultjwt.auth.SessionSecret;
import io.github.vaultjwt.auth.VaultAuthenticator;
import io.github.vaultjwt.client.ConfigurationException;
import io.github.vaultjwt.client.VaultException;
import io.github.vaultjwt.client.VaultHttpClient;
import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the Vault session and keeps it alive for as long as the client is open.
 *
 * <p>{@link #start} logs in once and refuses non-renewable sessions. It then
 * hands the session to a supervising thread that loops forever:
 * <ol>
 *   <li>start a {@link RenewalWatcher} for the current session</li>
 *   <li>swap in every renewed session the watcher reports</li>
 *   <li>when the watcher is done (max TTL reached or renewal failed), stop it
 *       and log in again, backing off exponentially while logins fail or
 *       fresh sessions end without a single successful renewal</li>
 * </ol>
 *
 * <p>The supervising thread is the only writer of the current session. Readers
 * go through {@link #currentToken()}, a single volatile read, so secret
 * operations never lock and never see a half-updated session.
 *
 * <p>{@link #close()} stops the loop and the active watcher. It does not
 * interrupt requests that are already in flight on other threads.
 */
public class SessionManager implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private static final String THREAD_NAME = "vault-session-lifecycle";
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final VaultHttpClient client;
    private final VaultAuthenticator authenticator;
    private final RenewalWatcher.Factory watcherFactory;
    private final long initialBackoffMillis;
    private final long maxBackoffMillis;

    private final AtomicReference<SessionSecret> current = new AtomicReference<>();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.LOGGING_IN);
    private final ExecutorService supervisor;

    private volatile boolean running;
    private volatile Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

    // Only touched from the supervising thread.
    private int consecutiveFailures;

    private SessionManager(VaultHttpClient client, VaultAuthenticator authenticator,
                           RenewalWatcher.Factory watcherFactory, Duration initialBackoff,
                           Duration maxBackoff, SessionSecret initialSession) {
        this.client = client;
        this.authenticator = authenticator;
        this.watcherFactory = watcherFactory;
        this.initialBackoffMillis = initialBackoff.toMillis();
        this.maxBackoffMillis = Math.max(maxBackoff.toMillis(), initialBackoffMillis);
        this.current.set(initialSession);
        this.supervisor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Logs in and starts the session lifecycle.
     *
     * @param client         the Vault client used for logins
     * @param authenticator  the login capability
     * @param watcherFactory creates the renewal watcher for each session
     * @param initialBackoff delay before the first retry of a failed re-login
     * @param maxBackoff     upper bound of the re-login retry delay
     * @return the running session manager
     * @throws ConfigurationException if Vault issues a non-renewable session
     * @throws VaultException         if the initial login fails
     */
    public static SessionManager start(VaultHttpClient client, VaultAuthenticator authenticator,
                                       RenewalWatcher.Factory watcherFactory,
                                       Duration initialBackoff, Duration maxBackoff)
            throws VaultException {
        SessionSecret initial = authenticator.login(client);
        if (!initial.isRenewable()) {
            throw new ConfigurationException(
                    "Vault issued a non-renewable token for auth/" + authenticator.getMountPath()
                            + "; the session could not be kept alive. Check the role's token settings.");
        }

        SessionManager manager = new SessionManager(
                client, authenticator, watcherFactory, initialBackoff, maxBackoff, initial);
        manager.running = true;
        manager.supervisor.execute(manager::supervise);
        return manager;
    }

    /**
     * Returns the token of the current session, or null if there is none.
     *
     * @return the client token to present on the next request
     */
    public String currentToken() {
        SessionSecret session = current.get();
        return session != null ? session.getClientToken() : null;
    }

    public SessionSecret currentSession() {
        return current.get();
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return running;
    }

    void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Stops the lifecycle loop and its renewal watcher. The state reads
     * {@link SessionState#STOPPED} once the loop has actually exited.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        supervisor.shutdownNow();
        try {
            if (supervisor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                // The loop may have been cancelled before it ever ran
                state.set(SessionState.STOPPED);
            } else {
                logger.warn("Vault session lifecycle did not stop within {}ms, it stops on its own",
                        shutdownTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Supervising loop ---

    private void supervise() {
        logger.info("Vault session lifecycle started (auth/{})", authenticator.getMountPath());
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                SessionSecret session = current.get();
                if (session == null) {
                    logger.error("No Vault session to watch, logging in again");
                } else {
                    watchUntilDone(session);
                }
                if (!running) {
                    break;
                }
                loginUntilSuccessful();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state.set(SessionState.STOPPED);
            logger.info("Vault session lifecycle stopped");
        }
    }

    private void watchUntilDone(SessionSecret session) throws InterruptedException {
        BlockingQueue<WatcherEvent> events = new LinkedBlockingQueue<>();
        RenewalWatcher watcher;
        try {
            watcher = watcherFactory.create(session, events);
            watcher.start();
        } catch (RuntimeException e) {
            state.set(SessionState.RENEWAL_FAILED);
            consecutiveFailures++;
            logger.error("Cannot start Vault token renewal: {}", e.getMessage(), e);
            return;
        }
        state.set(SessionState.WATCHING);

        boolean renewedOnce = false;
        try {
            while (true) {
                WatcherEvent event = events.take();
                if (event.getType() == WatcherEvent.Type.RENEWED) {
                    current.set(event.getSecret());
                    renewedOnce = true;
                    consecutiveFailures = 0;
                    logger.info("Successfully renewed Vault token (lease {}s)",
                            event.getSecret().getLeaseDurationSeconds());
                    continue;
                }

                // A session that never renewed is a failed cycle, so the next login backs off
                if (!renewedOnce) {
                    consecutiveFailures++;
                }
                VaultException error = event.getError();
                if (error != null) {
                    state.set(SessionState.RENEWAL_FAILED);
                    logger.warn("Vault token renewal failed: {}. Re-attempting login.", error.getMessage());
                } else {
                    state.set(SessionState.LEASE_EXPIRED);
                    logger.info("Vault token can no longer be renewed. Re-attempting login.");
                }
                return;
            }
        } finally {
            watcher.stop();
        }
    }

    private void loginUntilSuccessful() throws InterruptedException {
        while (running) {
            if (consecutiveFailures > 0) {
                long delay = calculateBackoff(consecutiveFailures);
                logger.warn("Retrying Vault login in {}ms", delay);
                TimeUnit.MILLISECONDS.sleep(delay);
            }

            state.set(SessionState.LOGGING_IN);
            try {
                SessionSecret fresh = authenticator.login(client);
                current.set(fresh);
                if (!fresh.isRenewable()) {
                    logger.error("Vault issued a non-renewable token, please check the Vault role configuration");
                }
                return;
            } catch (VaultException | RuntimeException e) {
                consecutiveFailures++;
                logger.error("Vault login failed (attempt {}): {}", consecutiveFailures, e.getMessage());
            }
        }
    }

    long calculateBackoff(int failures) {
        // 1x, 2x, 4x, ... the initial delay, capped at the maximum
        int shift = Math.min(failures - 1, 30);
        long delay = initialBackoffMillis * (1L << shift);
        if (delay <= 0 || delay > maxBackoffMillis) {
            return maxBackoffMillis;
        }
        return delay;
    }
}
