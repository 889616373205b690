package io.trigger4j.lifecycle;

import io.trigger4j.config.Trigger4jProperties;
import io.trigger4j.core.CleanupAcknowledgement;
import io.trigger4j.core.SweepResult;
import io.trigger4j.query.EventQueryService;
import io.trigger4j.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Ages events: ACTIVE events older than {@code archiveAfter} are archived and ARCHIVED events
 * older than {@code deleteAfter} are soft deleted.
 *
 * <p>Periodic and manually requested sweeps share one single-threaded executor, so two sweeps
 * never run at the same time.
 */
public class EventLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(EventLifecycleManager.class);

    static final String CLEANUP_QUEUED = "Cleanup task queued";

    private final EventStore eventStore;
    private final EventQueryService queryService;
    private final Trigger4jProperties props;
    private final Clock clock;

    private final Set<CompletableFuture<SweepResult>> pendingRequests = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService executor;

    public EventLifecycleManager(EventStore eventStore,
                                 EventQueryService queryService,
                                 Trigger4jProperties props,
                                 Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore must not be null");
        this.queryService = Objects.requireNonNull(queryService, "queryService must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Run one sweep on the calling thread.
     *
     * @throws io.trigger4j.core.StoreException if the store transaction fails; nothing is committed
     */
    public SweepResult sweep() {
        Instant now = clock.instant();
        SweepResult result = eventStore.sweep(
                now,
                now.minus(props.getArchiveAfter()),
                now.minus(props.getDeleteAfter()));

        if (result.changed()) {
            try {
                queryService.invalidateRecent();
            } catch (RuntimeException e) {
                log.warn("Recent events cache invalidation failed after sweep msg={}", e.getMessage());
            }
        }

        log.info("Event sweep finished archived={} deleted={} at={}", result.archived(), result.deleted(), now);
        return result;
    }

    /**
     * Start the periodic sweep. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (executor != null) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getSweepInterval(), "trigger4j.sweepInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("trigger4j.sweepInterval must be a positive duration");
        }
        if (props.getDeleteAfter().compareTo(props.getArchiveAfter()) < 0) {
            throw new IllegalArgumentException("trigger4j.deleteAfter must not be shorter than trigger4j.archiveAfter");
        }

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("trigger4j.sweeper");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        executor.scheduleWithFixedDelay(this::runScheduledSweep, millis, millis, TimeUnit.MILLISECONDS);

        log.info("Event lifecycle started sweepInterval={} archiveAfter={} deleteAfter={}",
                interval, props.getArchiveAfter(), props.getDeleteAfter());
    }

    /**
     * Queue a sweep on the sweeper thread and return at once.
     *
     * @throws IllegalStateException if the manager has not been started
     */
    public synchronized CleanupAcknowledgement requestSweep() {
        if (executor == null) {
            throw new IllegalStateException("Event lifecycle manager is not started");
        }

        Instant requestedAt = clock.instant();
        CompletableFuture<SweepResult> completion = new CompletableFuture<>();
        pendingRequests.add(completion);
        completion.whenComplete((result, error) -> pendingRequests.remove(completion));
        try {
            executor.execute(() -> {
                try {
                    completion.complete(sweep());
                } catch (RuntimeException e) {
                    log.error("Requested event sweep failed msg={}", e.getMessage(), e);
                    completion.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            pendingRequests.remove(completion);
            throw new IllegalStateException("Event lifecycle manager is shutting down", e);
        }

        log.info("Event sweep requested at={}", requestedAt);
        return new CleanupAcknowledgement(CLEANUP_QUEUED, requestedAt, completion);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Event sweeper did not terminate within {}", props.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        cancelPendingRequests();
        log.info("Event lifecycle stopped.");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    // requested sweeps dropped by shutdown never complete on their own
    private void cancelPendingRequests() {
        int cancelled = 0;
        for (CompletableFuture<SweepResult> completion : List.copyOf(pendingRequests)) {
            if (completion.completeExceptionally(new CancellationException("Event lifecycle manager stopped"))) {
                cancelled++;
            }
        }
        pendingRequests.clear();
        if (cancelled > 0) {
            log.warn("Event lifecycle stopped with {} requested sweeps not run", cancelled);
        }
    }

    void runScheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Scheduled event sweep failed, retrying next interval msg={}", e.getMessage(), e);
        }
    }
}
