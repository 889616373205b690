package io.trigger4j.internal;

import io.trigger4j.JobCallback;
import io.trigger4j.JobScheduler;
import io.trigger4j.config.Trigger4jProperties;
import io.trigger4j.core.JobState;
import io.trigger4j.core.RegistrationResult;
import io.trigger4j.core.ScheduleDescriptor;
import io.trigger4j.utils.NextFireCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process {@link JobScheduler} with an in-memory job registry.
 *
 * <p>A poller thread wakes every {@code processEvery}, collects the due jobs and hands them to a
 * worker pool. The next fire time of a job is computed only after its callback has returned, so
 * firings of one job never overlap. Interval jobs are fixed-delay: the next firing is at least
 * one interval after the previous one started.
 *
 * <p>The job map is guarded by one lock that is never held while a callback runs.
 *
 * <pre>{@code
 * JobScheduler scheduler = new InMemoryJobScheduler(props, Clock.systemUTC());
 * scheduler.start();
 * scheduler.register("trigger_42", ScheduleParser.parse("30"), jobId -> { ... });
 * scheduler.cancel("trigger_42");
 * scheduler.stop();
 * }</pre>
 */
public class InMemoryJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobScheduler.class);

    private final Trigger4jProperties props;
    private final Clock clock;
    private final ZoneId zone;
    private final Executor providedExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, JobHandle> jobs = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;
    private Thread pollerThread;

    public InMemoryJobScheduler(Trigger4jProperties props, Clock clock) {
        this(props, clock, null);
    }

    /**
     * @param workerExecutor executor running the callbacks; when null a fixed pool of
     *                       {@code workerThreads} daemon threads is created on {@link #start()}
     */
    public InMemoryJobScheduler(Trigger4jProperties props, Clock clock, Executor workerExecutor) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = ZoneId.of(props.getTimezone() != null ? props.getTimezone() : "UTC");
        this.providedExecutor = workerExecutor;
    }

    /**
     * Start the poller. Should be idempotent.
     */
    @Override
    public void start() {
        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "trigger4j.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("trigger4j.processEvery must be a positive duration");
        }
        if (props.getWorkerThreads() <= 0) {
            throw new IllegalArgumentException("trigger4j.workerThreads must be a positive number");
        }

        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Scheduler starting with processEvery={}, workerThreads={}, timezone={}",
                props.getProcessEvery(), props.getWorkerThreads(), zone);

        if (providedExecutor == null && workerPool == null) {
            AtomicInteger counter = new AtomicInteger(1);
            workerPool = Executors.newFixedThreadPool(props.getWorkerThreads(), r -> {
                Thread t = new Thread(r);
                t.setName("trigger4j.worker-" + counter.getAndIncrement());
                t.setDaemon(true);
                return t;
            });
        }

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("trigger4j.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("Scheduler started successfully.");
    }

    /**
     * Stop polling and wait for running callbacks. Registered jobs are kept. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    releaseDropped(workerPool.shutdownNow());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                releaseDropped(workerPool.shutdownNow());
            } finally {
                workerPool = null;
            }
        }
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public RegistrationResult register(String jobId, ScheduleDescriptor schedule, JobCallback callback) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(callback, "callback must not be null");

        // computed before touching the registry so an invalid schedule leaves it unchanged
        Instant firstFireAt = NextFireCalculator.firstFireTime(schedule, zone, clock.instant());
        JobHandle handle = new JobHandle(jobId, schedule, callback, firstFireAt);

        JobHandle previous;
        lock.lock();
        try {
            previous = jobs.put(jobId, handle);
            if (previous != null) {
                previous.cancel();
            }
        } finally {
            lock.unlock();
        }

        log.debug("Scheduler registered job id={} schedule={} firstFireAt={} replaced={}",
                jobId, schedule, firstFireAt, previous != null);
        return previous != null ? RegistrationResult.replacedResult() : RegistrationResult.createdResult();
    }

    @Override
    public boolean cancel(String jobId) {
        if (jobId == null) {
            return false;
        }

        JobHandle removed;
        lock.lock();
        try {
            removed = jobs.remove(jobId);
            if (removed != null) {
                removed.cancel();
            }
        } finally {
            lock.unlock();
        }

        if (removed != null) {
            log.debug("Scheduler cancelled job id={}", jobId);
        }
        return removed != null;
    }

    @Override
    public Optional<JobState> state(String jobId) {
        lock.lock();
        try {
            JobHandle handle = jobs.get(jobId);
            return handle == null ? Optional.empty() : Optional.of(handle.state());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Instant> nextFireTime(String jobId) {
        lock.lock();
        try {
            JobHandle handle = jobs.get(jobId);
            if (handle == null || handle.state() == JobState.CANCELLED) {
                return Optional.empty();
            }
            return Optional.of(handle.nextFireAt());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> jobIds() {
        lock.lock();
        try {
            return Set.copyOf(jobs.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dispatch every job due at the current clock instant.
     *
     * @return number of dispatched firings
     */
    public int pollOnce() {
        Executor executor = executor();
        Instant now = clock.instant();

        List<JobHandle> due = new ArrayList<>();
        List<Instant> scheduledFor = new ArrayList<>();
        lock.lock();
        try {
            for (JobHandle handle : jobs.values()) {
                if (handle.isDue(now) && !inFlight.contains(handle.jobId())) {
                    scheduledFor.add(handle.nextFireAt());
                    handle.markFiring(now);
                    inFlight.add(handle.jobId());
                    due.add(handle);
                }
            }
        } finally {
            lock.unlock();
        }

        for (int i = 0; i < due.size(); i++) {
            JobHandle handle = due.get(i);
            Instant fireAt = scheduledFor.get(i);
            try {
                executor.execute(new Dispatch(handle, fireAt));
            } catch (RejectedExecutionException e) {
                log.warn("Scheduler could not dispatch job id={} msg={}", handle.jobId(), e.getMessage());
                release(handle, fireAt);
            }
        }

        if (!due.isEmpty()) {
            log.debug("Scheduler dispatched jobs count={} at={}", due.size(), now);
        }
        return due.size();
    }

    /**
     * Firings queued on the worker pool but never started go back to PENDING with their original
     * fire time, so they run after the next {@link #start()}.
     */
    private void releaseDropped(List<Runnable> dropped) {
        int released = 0;
        for (Runnable task : dropped) {
            if (task instanceof Dispatch dispatch) {
                release(dispatch.handle, dispatch.scheduledFor);
                released++;
            }
        }
        if (released > 0) {
            log.warn("Scheduler stopped before {} queued job firings started; they stay pending", released);
        }
    }

    private void fire(JobHandle handle, Instant scheduledFor) {
        String jobId = handle.jobId();
        Instant startedAt = clock.instant();
        log.debug("Scheduler job started id={} scheduledFor={} at={}", jobId, scheduledFor, startedAt);

        try {
            handle.callback().fire(jobId);
            log.debug("Scheduler job succeeded id={}", jobId);
        } catch (Exception e) {
            log.error("Scheduler job failed id={} msg={}", jobId, e.getMessage(), e);
        } finally {
            Instant next = computeNext(handle, scheduledFor, clock.instant());
            release(handle, next);
        }
    }

    private Instant computeNext(JobHandle handle, Instant scheduledFor, Instant finishedAt) {
        try {
            return NextFireCalculator.nextFireTime(handle.schedule(), zone, scheduledFor, finishedAt);
        } catch (RuntimeException e) {
            log.error("Scheduler could not compute next fire time; cancelling job id={} msg={}",
                    handle.jobId(), e.getMessage(), e);
            return null;
        }
    }

    private void release(JobHandle handle, Instant next) {
        lock.lock();
        try {
            inFlight.remove(handle.jobId());
            handle.completeFiring(next);
            if (handle.state() == JobState.CANCELLED) {
                jobs.remove(handle.jobId(), handle);
            }
        } finally {
            lock.unlock();
        }
    }

    private Executor executor() {
        if (providedExecutor != null) {
            return providedExecutor;
        }
        ExecutorService pool = workerPool;
        if (pool == null) {
            throw new IllegalStateException("scheduler is not started");
        }
        return pool;
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                pollOnce();
            } catch (Exception e) {
                log.error("Scheduler pollOnce failed msg={}", e.getMessage(), e);
            }

            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private final class Dispatch implements Runnable {
        private final JobHandle handle;
        private final Instant scheduledFor;

        private Dispatch(JobHandle handle, Instant scheduledFor) {
            this.handle = handle;
            this.scheduledFor = scheduledFor;
        }

        @Override
        public void run() {
            fire(handle, scheduledFor);
        }
    }
}
