package com.ivamare.eventbus.connection.impl;

import com.ivamare.eventbus.broker.BrokerNames;
import com.ivamare.eventbus.broker.BrokerSession;
import com.ivamare.eventbus.broker.BrokerSessionFactory;
import com.ivamare.eventbus.connection.ConnectionSettings;
import com.ivamare.eventbus.connection.ConnectionSupervisor;
import com.ivamare.eventbus.connection.SessionListener;
import com.ivamare.eventbus.exception.BrokerExceptionClassifier;
import com.ivamare.eventbus.exception.ConnectionException;
import com.ivamare.eventbus.exception.TopologyException;
import com.ivamare.eventbus.model.ExchangeDescriptor;
import com.ivamare.eventbus.model.Exchanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default implementation of ConnectionSupervisor.
 *
 * <p>Connection attempts run on the supplied executor. A single-slot reference
 * holds the attempt in flight; callers arriving while it runs share it. Each
 * {@link #close()} advances an epoch so that an attempt finishing afterwards
 * is discarded instead of installed.
 */
public class DefaultConnectionSupervisor implements ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(DefaultConnectionSupervisor.class);

    private final BrokerSessionFactory sessionFactory;
    private final ConnectionSettings settings;
    private final Executor executor;
    private final List<ExchangeDescriptor> exchanges;
    private final String maskedUrl;
    private final List<SessionListener> sessionListeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private final AtomicReference<CompletableFuture<BrokerSession>> pending = new AtomicReference<>();
    private final AtomicLong epoch = new AtomicLong();
    private volatile BrokerSession session;
    private volatile boolean connectedBefore;

    public DefaultConnectionSupervisor(
            BrokerSessionFactory sessionFactory,
            ConnectionSettings settings,
            Executor executor) {
        this.sessionFactory = sessionFactory;
        this.settings = settings;
        this.executor = executor;
        this.exchanges = mergeExchanges(Exchanges.baseline(settings.deadLetterExchange()), settings.exchanges());
        this.maskedUrl = BrokerNames.maskUrl(settings.url());
    }

    @Override
    public CompletableFuture<BrokerSession> acquireSession() {
        BrokerSession current = session;
        if (current != null) {
            if (current.isOpen()) {
                return CompletableFuture.completedFuture(current);
            }
            // Lost without a close notification
            discard(current);
        }

        while (true) {
            CompletableFuture<BrokerSession> existing = pending.get();
            if (existing != null) {
                return existing;
            }
            CompletableFuture<BrokerSession> attempt = new CompletableFuture<>();
            if (pending.compareAndSet(null, attempt)) {
                long attemptEpoch = epoch.get();
                try {
                    executor.execute(() -> connect(attempt, attemptEpoch, 1));
                } catch (RejectedExecutionException e) {
                    fail(attempt, new ConnectionException("Connection attempt could not be scheduled", e));
                }
                return attempt;
            }
        }
    }

    @Override
    public CompletableFuture<Void> close() {
        BrokerSession toClose;
        CompletableFuture<BrokerSession> inFlight;
        synchronized (lock) {
            epoch.incrementAndGet();
            toClose = session;
            session = null;
            connectedBefore = false;
            inFlight = pending.getAndSet(null);
        }

        if (inFlight != null) {
            inFlight.completeExceptionally(new ConnectionException("Connection supervisor closed"));
        }
        if (toClose == null) {
            return CompletableFuture.completedFuture(null);
        }

        log.info("Closing broker session to {}", maskedUrl);
        return CompletableFuture.runAsync(() -> closeQuietly(toClose), executor);
    }

    @Override
    public boolean isConnected() {
        BrokerSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    public List<ExchangeDescriptor> getDeclaredExchanges() {
        return exchanges;
    }

    @Override
    public void addSessionListener(SessionListener listener) {
        sessionListeners.add(listener);
    }

    // --- Connection attempts ---

    private void connect(CompletableFuture<BrokerSession> attempt, long attemptEpoch, int attemptNumber) {
        if (attempt.isDone()) {
            return;
        }
        if (attemptEpoch != epoch.get()) {
            abandon(attempt);
            return;
        }

        BrokerSession existing = session;
        if (existing != null && existing.isOpen()) {
            pending.compareAndSet(attempt, null);
            attempt.complete(existing);
            return;
        }

        BrokerSession candidate = null;
        try {
            log.info("Connecting to broker {} (attempt {}/{})",
                maskedUrl, attemptNumber, settings.maxReconnectAttempts() + 1);

            candidate = sessionFactory.connect(settings.url());
            if (settings.prefetch() > 0) {
                candidate.setConcurrencyLimit(settings.prefetch());
            }
            for (ExchangeDescriptor exchange : exchanges) {
                candidate.declareExchange(exchange);
            }

            BrokerSession established = candidate;
            established.addCloseListener(cause -> onSessionLost(established, cause));
            install(attempt, attemptEpoch, established);
        } catch (RuntimeException e) {
            closeQuietly(candidate);
            handleFailure(attempt, attemptEpoch, attemptNumber, e);
        }
    }

    private void install(CompletableFuture<BrokerSession> attempt, long attemptEpoch, BrokerSession established) {
        boolean restored;
        synchronized (lock) {
            if (attemptEpoch != epoch.get()) {
                log.debug("Discarding session established after close");
                closeQuietly(established);
                abandon(attempt);
                return;
            }
            restored = connectedBefore;
            session = established;
            connectedBefore = true;
            pending.compareAndSet(attempt, null);
        }

        log.info("Connected to broker {}, declared {} exchanges", maskedUrl, exchanges.size());
        attempt.complete(established);

        if (restored) {
            notifyRestored(established);
        }
    }

    private void handleFailure(CompletableFuture<BrokerSession> attempt, long attemptEpoch,
                               int attemptNumber, RuntimeException e) {
        if (BrokerExceptionClassifier.isPermanent(e)) {
            log.error("Permanent failure connecting to broker {}: {}", maskedUrl, e.getMessage());
            fail(attempt, new ConnectionException(
                "Permanent failure connecting to " + maskedUrl + ": " + e.getMessage(), e, attemptNumber));
            return;
        }

        // The first connect plus maxReconnectAttempts retries
        if (attemptNumber > settings.maxReconnectAttempts()) {
            log.error("Giving up connecting to broker {} after {} attempts: {}",
                maskedUrl, attemptNumber, e.getMessage());
            fail(attempt, new ConnectionException(
                "Failed to connect to " + maskedUrl + " after " + attemptNumber + " attempts", e, attemptNumber));
            return;
        }

        logConnectionError(attemptNumber, e);
        // Delay off the bus executor so a rejection reaches this future
        CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(settings.reconnectDelayMs(), TimeUnit.MILLISECONDS))
            .thenRunAsync(() -> connect(attempt, attemptEpoch, attemptNumber + 1), executor)
            .exceptionally(ex -> {
                // Executor gone (bus shutting down)
                fail(attempt, new ConnectionException("Reconnection could not be scheduled", ex, attemptNumber));
                return null;
            });
    }

    private void logConnectionError(int errorCount, RuntimeException e) {
        String reason = BrokerExceptionClassifier.getTransientReason(e);
        String message = "Broker connection error (count={}, reason={}), retrying in {}ms: {}";

        if (errorCount >= settings.errorThreshold()) {
            log.error(message, errorCount, reason, settings.reconnectDelayMs(), e.getMessage());
        } else {
            log.warn(message, errorCount, reason, settings.reconnectDelayMs(), e.getMessage());
        }
    }

    private void fail(CompletableFuture<BrokerSession> attempt, ConnectionException e) {
        pending.compareAndSet(attempt, null);
        attempt.completeExceptionally(e);
    }

    private void abandon(CompletableFuture<BrokerSession> attempt) {
        fail(attempt, new ConnectionException("Connection supervisor closed"));
    }

    // --- Liveness ---

    private void onSessionLost(BrokerSession lost, Throwable cause) {
        long lostEpoch;
        synchronized (lock) {
            if (session != lost) {
                log.debug("Ignoring close of stale session");
                return;
            }
            session = null;
            lostEpoch = epoch.get();
        }

        log.warn("Broker session lost ({}), reconnecting in {}ms",
            cause != null ? cause.getMessage() : "unknown cause", settings.reconnectDelayMs());

        try {
            executor.execute(() -> closeQuietly(lost));
        } catch (RejectedExecutionException e) {
            closeQuietly(lost);
        }

        CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(settings.reconnectDelayMs(), TimeUnit.MILLISECONDS))
            .thenRunAsync(() -> {
                if (lostEpoch != epoch.get()) {
                    return;
                }
                acquireSession().whenComplete((restored, ex) -> {
                    if (ex != null) {
                        log.error("Background reconnection to {} failed: {}", maskedUrl, ex.getMessage());
                    }
                });
            }, executor)
            .exceptionally(ex -> {
                log.warn("Background reconnection to {} not scheduled: {}", maskedUrl, ex.getMessage());
                return null;
            });
    }

    private void discard(BrokerSession stale) {
        synchronized (lock) {
            if (session != stale) {
                return;
            }
            session = null;
        }
        log.warn("Broker session to {} is no longer open, reconnecting", maskedUrl);
        closeQuietly(stale);
    }

    private void notifyRestored(BrokerSession restored) {
        for (SessionListener listener : sessionListeners) {
            try {
                listener.onSessionRestored(restored);
            } catch (RuntimeException e) {
                log.error("Session listener failed after reconnection", e);
            }
        }
    }

    private void closeQuietly(BrokerSession toClose) {
        if (toClose == null) {
            return;
        }
        try {
            toClose.close();
        } catch (RuntimeException e) {
            log.warn("Error closing broker session: {}", e.getMessage());
        }
    }

    /**
     * Merge the baseline exchanges with configured ones, keeping names unique.
     *
     * @param baseline Exchanges declared on every connection
     * @param configured Additional configured exchanges
     * @return merged exchanges in declaration order
     * @throws TopologyException if a name is declared twice with different parameters
     */
    static List<ExchangeDescriptor> mergeExchanges(List<ExchangeDescriptor> baseline,
                                                   List<ExchangeDescriptor> configured) {
        Map<String, ExchangeDescriptor> merged = new LinkedHashMap<>();
        List<ExchangeDescriptor> all = new ArrayList<>(baseline);
        all.addAll(configured);
        for (ExchangeDescriptor exchange : all) {
            ExchangeDescriptor existing = merged.putIfAbsent(exchange.name(), exchange);
            if (existing != null && !existing.equals(exchange)) {
                throw new TopologyException("Exchange " + exchange.name()
                    + " declared twice with different parameters: " + existing + " vs " + exchange);
            }
        }
        return List.copyOf(merged.values());
    }
}
