package io.github.vaultjwt.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.vaultjwt.auth.SessionSecret;
import io.github.vaultjwt.auth.VaultAuthenticator;
import io.github.vaultjwt.client.AuthDeniedException;
import io.github.vaultjwt.client.ConfigurationException;
import io.github.vaultjwt.client.TransportException;
import io.github.vaultjwt.client.UnexpectedStatusException;
import io.github.vaultjwt.client.VaultHttpClient;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SessionManager.
 */
class SessionManagerTest {

    private static final Duration INITIAL_BACKOFF = Duration.ofMillis(10);
    private static final Duration MAX_BACKOFF = Duration.ofMillis(40);

    private VaultHttpClient client;
    private VaultAuthenticator authenticator;
    private RecordingWatcherFactory watchers;
    private SessionManager manager;

    @BeforeEach
    void setUp() {
        client = mock(VaultHttpClient.class);
        authenticator = mock(VaultAuthenticator.class);
        when(authenticator.getMountPath()).thenReturn("jwt");
        watchers = new RecordingWatcherFactory();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    static SessionSecret session(String token, boolean renewable) {
        return new SessionSecret(token, "acc-" + token, renewable, 3600, List.of("default"), Instant.now());
    }

    static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5 seconds");
            }
            Thread.sleep(5);
        }
    }

    private SessionManager start() throws Exception {
        manager = SessionManager.start(client, authenticator, watchers, INITIAL_BACKOFF, MAX_BACKOFF);
        return manager;
    }

    // --- Construction ---

    @Test
    void start_withNonRenewableSession_throwsConfigurationException() throws Exception {
        when(authenticator.login(client)).thenReturn(session("hvs.fixed", false));

        assertThatThrownBy(this::start)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("non-renewable");

        Thread.sleep(50);
        assertThat(watchers.count()).isZero();
        verify(authenticator, times(1)).login(client);
    }

    @Test
    void start_withLoginFailure_propagatesError() throws Exception {
        when(authenticator.login(client)).thenThrow(new AuthDeniedException("denied", 403));

        assertThatThrownBy(this::start).isInstanceOf(AuthDeniedException.class);
        assertThat(watchers.count()).isZero();
    }

    @Test
    void start_withRenewableSession_watchesInitialSession() throws Exception {
        when(authenticator.login(client)).thenReturn(session("hvs.1", true));

        start();

        assertThat(manager.currentToken()).isEqualTo("hvs.1");
        assertThat(manager.isRunning()).isTrue();
        waitUntil(() -> watchers.count() == 1 && watchers.get(0).started);
        waitUntil(() -> manager.getState() == SessionState.WATCHING);
        assertThat(watchers.get(0).session.getClientToken()).isEqualTo("hvs.1");
    }

    // --- Lifecycle ---

    @Test
    void renewedEvent_swapsCurrentSession() throws Exception {
        when(authenticator.login(client)).thenReturn(session("hvs.1", true));
        start();
        waitUntil(() -> watchers.count() == 1);

        SessionSecret renewed = session("hvs.1-renewed", true);
        watchers.get(0).emit(WatcherEvent.renewed(renewed));

        waitUntil(() -> manager.currentSession() == renewed);
        assertThat(manager.currentToken()).isEqualTo("hvs.1-renewed");
        assertThat(watchers.count()).isEqualTo(1);
    }

    @Test
    void doneWithoutError_logsInAgainAndWatchesNewSession() throws Exception {
        when(authenticator.login(client))
                .thenReturn(session("hvs.1", true))
                .thenReturn(session("hvs.2", true));
        start();
        waitUntil(() -> watchers.count() == 1);

        watchers.get(0).emit(WatcherEvent.done(null));

        waitUntil(() -> watchers.count() == 2);
        assertThat(watchers.get(0).stopped).isTrue();
        assertThat(watchers.get(1).session.getClientToken()).isEqualTo("hvs.2");
        assertThat(manager.currentToken()).isEqualTo("hvs.2");
        verify(authenticator, times(2)).login(client);
    }

    @Test
    void doneWithError_logsInAgain() throws Exception {
        when(authenticator.login(client))
                .thenReturn(session("hvs.1", true))
                .thenReturn(session("hvs.2", true));
        start();
        waitUntil(() -> watchers.count() == 1);

        watchers.get(0).emit(WatcherEvent.done(new UnexpectedStatusException("permission denied", 403)));

        waitUntil(() -> "hvs.2".equals(manager.currentToken()));
        waitUntil(() -> watchers.count() == 2);
        assertThat(watchers.get(0).stopped).isTrue();
    }

    @Test
    void failedRelogin_isRetriedUntilItSucceeds() throws Exception {
        when(authenticator.login(client))
                .thenReturn(session("hvs.1", true))
                .thenThrow(new TransportException("connection refused", new IOException()))
                .thenThrow(new AuthDeniedException("identity provider down", 503))
                .thenReturn(session("hvs.2", true));
        start();
        waitUntil(() -> watchers.count() == 1);

        watchers.get(0).emit(WatcherEvent.done(null));

        waitUntil(() -> "hvs.2".equals(manager.currentToken()));
        waitUntil(() -> watchers.count() == 2);
        verify(authenticator, times(4)).login(client);
        assertThat(manager.isRunning()).isTrue();
    }

    @Test
    void reloginYieldingNonRenewableSession_installsItAndKeepsGoing() throws Exception {
        when(authenticator.login(client))
                .thenReturn(session("hvs.1", true))
                .thenReturn(session("hvs.fixed", false))
                .thenReturn(session("hvs.3", true));
        start();
        waitUntil(() -> watchers.count() == 1);

        watchers.get(0).emit(WatcherEvent.done(null));
        waitUntil(() -> watchers.count() == 2);
        assertThat(manager.currentToken()).isEqualTo("hvs.fixed");

        watchers.get(1).emit(WatcherEvent.done(new ConfigurationException("Token is not renewable")));
        waitUntil(() -> "hvs.3".equals(manager.currentToken()));
    }

    @Test
    void watcherFactoryFailure_logsInAgainAfterBackoff() throws Exception {
        when(authenticator.login(client))
                .thenReturn(session("hvs.1", true))
                .thenReturn(session("hvs.2", true));
        RenewalWatcher.Factory failingOnce = new RenewalWatcher.Factory() {
            private boolean failed;

            @Override
            public RenewalWatcher create(SessionSecret session, BlockingQueue<WatcherEvent> events) {
                if (!failed) {
                    failed = true;
                    throw new IllegalStateException("no threads left");
                }
                return watchers.create(session, events);
            }
        };
        manager = SessionManager.start(client, authenticator, failingOnce, INITIAL_BACKOFF, MAX_BACKOFF);

        waitUntil(() -> watchers.count() == 1);
        assertThat(watchers.get(0).session.getClientToken()).isEqualTo("hvs.2");
    }

    @Test
    void renewalRejectedForEveryFreshSession_backsOffBetweenLogins() throws Exception {
        AtomicInteger logins = new AtomicInteger();
        when(authenticator.login(client)).thenAnswer(invocation ->
                session("hvs." + logins.incrementAndGet(), true));
        RenewalWatcher.Factory rejecting = (session, events) -> {
            RecordingWatcherFactory.RecordingWatcher watcher =
                    (RecordingWatcherFactory.RecordingWatcher) watchers.create(session, events);
            watcher.emit(WatcherEvent.done(new UnexpectedStatusException("permission denied", 403)));
            return watcher;
        };
        manager = SessionManager.start(client, authenticator, rejecting,
                Duration.ofMillis(100), Duration.ofSeconds(1));

        Thread.sleep(1000);

        // 100 + 200 + 400 ms of backoff leaves room for at most four logins
        assertThat(logins.get()).isBetween(2, 5);
    }

    @Test
    void renewedSession_resetsBackoffForNextRelogin() throws Exception {
        when(authenticator.login(client))
                .thenReturn(session("hvs.1", true))
                .thenReturn(session("hvs.2", true))
                .thenReturn(session("hvs.3", true));
        manager = SessionManager.start(client, authenticator, watchers,
                Duration.ofMillis(1000), Duration.ofSeconds(30));
        waitUntil(() -> watchers.count() == 1);

        // Fails without ever renewing, then the next session renews and ends cleanly
        watchers.get(0).emit(WatcherEvent.done(new UnexpectedStatusException("permission denied", 403)));
        waitUntil(() -> watchers.count() == 2);
        watchers.get(1).emit(WatcherEvent.renewed(session("hvs.2-renewed", true)));
        waitUntil(() -> "hvs.2-renewed".equals(manager.currentToken()));

        long before = System.nanoTime();
        watchers.get(1).emit(WatcherEvent.done(null));
        waitUntil(() -> watchers.count() == 3);

        // Without the reset this re-login would wait two seconds
        assertThat(Duration.ofNanos(System.nanoTime() - before)).isLessThan(Duration.ofMillis(900));
        assertThat(manager.currentToken()).isEqualTo("hvs.3");
    }

    // --- Shutdown ---

    @Test
    void close_stopsLoopAndActiveWatcher() throws Exception {
        when(authenticator.login(client)).thenReturn(session("hvs.1", true));
        start();
        waitUntil(() -> watchers.count() == 1);

        manager.close();

        assertThat(manager.isRunning()).isFalse();
        assertThat(manager.getState()).isEqualTo(SessionState.STOPPED);
        assertThat(watchers.get(0).stopped).isTrue();
        // The last session is still readable after close
        assertThat(manager.currentToken()).isEqualTo("hvs.1");
    }

    @Test
    void close_calledTwice_isHarmless() throws Exception {
        when(authenticator.login(client)).thenReturn(session("hvs.1", true));
        start();

        manager.close();
        manager.close();

        assertThat(manager.getState()).isEqualTo(SessionState.STOPPED);
    }

    @Test
    void close_whenLoopOutlivesShutdownTimeout_doesNotReportStopped() throws Exception {
        when(authenticator.login(client)).thenReturn(session("hvs.1", true));
        AtomicBoolean released = new AtomicBoolean();
        RenewalWatcher.Factory slowToStop = (session, events) -> {
            watchers.create(session, events);
            return new RenewalWatcher() {
                @Override
                public void start() {
                    // nothing to renew
                }

                @Override
                public void stop() {
                    while (!released.get()) {
                        Thread.onSpinWait();
                    }
                }
            };
        };
        manager = SessionManager.start(client, authenticator, slowToStop, INITIAL_BACKOFF, MAX_BACKOFF);
        manager.setShutdownTimeout(Duration.ofMillis(50));
        waitUntil(() -> manager.getState() == SessionState.WATCHING);

        manager.close();

        assertThat(manager.isRunning()).isFalse();
        assertThat(manager.getState()).isNotEqualTo(SessionState.STOPPED);

        released.set(true);
        waitUntil(() -> manager.getState() == SessionState.STOPPED);
    }

    // --- Backoff ---

    @Test
    void calculateBackoff_doublesUpToMaximum() throws Exception {
        when(authenticator.login(client)).thenReturn(session("hvs.1", true));
        manager = SessionManager.start(client, authenticator, watchers,
                Duration.ofMillis(100), Duration.ofMillis(1000));

        assertThat(manager.calculateBackoff(1)).isEqualTo(100);
        assertThat(manager.calculateBackoff(2)).isEqualTo(200);
        assertThat(manager.calculateBackoff(3)).isEqualTo(400);
        assertThat(manager.calculateBackoff(4)).isEqualTo(800);
        assertThat(manager.calculateBackoff(5)).isEqualTo(1000);
        assertThat(manager.calculateBackoff(64)).isEqualTo(1000);
    }
}
