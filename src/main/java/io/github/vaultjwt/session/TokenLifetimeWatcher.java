package io.github.vaultjwt.session;

import io.github.vaultjwt.auth.SessionSecret;
import io.github.vaultjwt.client.ConfigurationException;
import io.github.vaultjwt.client.VaultException;
import io.github.vaultjwt.client.VaultHttpClient;
import io.github.vaultjwt.client.VaultResponse;
import java.time.Clock;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renewal watcher that follows Vault's token TTL protocol.
 *
 * <p>The token is renewed through {@code auth/token/renew-self} right after
 * {@link #start()}, then again after two thirds of each returned lease. A grace
 * period of one tenth of the lease is recalculated whenever the lease grows.
 * Once the token's max TTL caps the lease so that the next sleep would end
 * inside the grace period, the watcher reports {@code DONE} without an error
 * so the owner can log in again while the current token is still valid.
 *
 * <p>Each watcher runs on its own single daemon thread.
 */
public class TokenLifetimeWatcher implements RenewalWatcher {

    private static final Logger logger = LoggerFactory.getLogger(TokenLifetimeWatcher.class);

    private static final String THREAD_NAME = "vault-token-renewal";

    private final VaultHttpClient client;
    private final long incrementSeconds;
    private final BlockingQueue<WatcherEvent> events;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final AtomicBoolean finished = new AtomicBoolean();

    // Only touched from the scheduler thread.
    private SessionSecret session;
    private long priorLeaseMillis;
    private long graceMillis;

    private volatile boolean stopped;

    /**
     * Creates a watcher.
     *
     * @param client           the Vault client used for renew-self requests
     * @param session          the session to keep alive
     * @param incrementSeconds the lease extension requested on each renewal
     * @param events           the queue to report on
     * @param scheduler        the executor renewals are scheduled on; shut down by {@link #stop()}
     * @param clock            clock used to stamp renewed sessions
     */
    public TokenLifetimeWatcher(VaultHttpClient client, SessionSecret session, long incrementSeconds,
                                BlockingQueue<WatcherEvent> events,
                                ScheduledExecutorService scheduler, Clock clock) {
        this.client = client;
        this.session = session;
        this.incrementSeconds = incrementSeconds;
        this.events = events;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Returns a factory producing watchers that each own a fresh daemon thread.
     *
     * @param client           the Vault client used for renew-self requests
     * @param incrementSeconds the lease extension requested on each renewal
     * @param clock            clock used to stamp renewed sessions
     * @return the factory
     */
    public static RenewalWatcher.Factory factory(VaultHttpClient client, long incrementSeconds,
                                                 Clock clock) {
        return (session, events) -> new TokenLifetimeWatcher(
                client, session, incrementSeconds, events, newScheduler(), clock);
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start() {
        if (!session.isRenewable()) {
            finish(new ConfigurationException("Token is not renewable, please check the Vault role configuration"));
            return;
        }
        scheduler.schedule(this::renew, 0, TimeUnit.MILLISECONDS);
    }

    @Override
    public void stop() {
        stopped = true;
        scheduler.shutdownNow();
    }

    void renew() {
        if (stopped) {
            return;
        }

        SessionSecret renewed;
        try {
            VaultResponse response = client.renewSelf(session.getClientToken(), incrementSeconds);
            renewed = SessionSecret.fromResponse(response, clock);
        } catch (VaultException e) {
            finish(e);
            return;
        } catch (RuntimeException e) {
            finish(new VaultException("Token renewal failed: " + e.getMessage(), 0, e));
            return;
        }

        session = renewed;
        emit(WatcherEvent.renewed(renewed));

        if (!renewed.isRenewable()) {
            logger.debug("Renewed token is no longer renewable");
            finish(null);
            return;
        }

        long leaseMillis = TimeUnit.SECONDS.toMillis(renewed.getLeaseDurationSeconds());
        if (leaseMillis > priorLeaseMillis) {
            graceMillis = leaseMillis / 10;
        }
        priorLeaseMillis = leaseMillis;

        long sleepMillis = leaseMillis * 2 / 3;
        if (leaseMillis <= graceMillis || leaseMillis - sleepMillis <= graceMillis) {
            logger.debug("Token lease of {}ms is within the {}ms grace period", leaseMillis, graceMillis);
            finish(null);
            return;
        }

        logger.debug("Next token renewal in {}ms (lease {}ms)", sleepMillis, leaseMillis);
        if (!stopped) {
            scheduler.schedule(this::renew, sleepMillis, TimeUnit.MILLISECONDS);
        }
    }

    private void emit(WatcherEvent event) {
        if (!stopped) {
            events.offer(event);
        }
    }

    private void finish(VaultException error) {
        if (finished.compareAndSet(false, true)) {
            emit(WatcherEvent.done(error));
        }
    }

    long getGraceMillis() {
        return graceMillis;
    }
}
