package tiercache.core.service;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

/**
 * Background task that evicts stale entries nobody reads again.
 *
 * <p>Every {@code interval} the sweeper takes a snapshot of the known keys and
 * runs the cache's existence check on each one; the check removes stale entries
 * as a side effect. The next pass is armed only after the previous one was
 * dispatched. Per-key checks either run one after another on the sweeper thread
 * or, for stores with slow I/O, are handed to a worker pool without waiting for
 * their results.
 *
 * <p>Failures of individual checks are logged and never stop the schedule.
 */
public class ExpirySweeper {

    private static final Logger LOG = Logger.getLogger(ExpirySweeper.class);

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    /** Lifecycle of a sweeper. */
    public enum State {
        ARMED,
        SWEEPING,
        TERMINATED
    }

    private final String name;
    private final Duration interval;
    private final Supplier<Set<String>> keys;
    private final Predicate<String> existenceCheck;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final AtomicReference<State> state = new AtomicReference<>(State.ARMED);

    /**
     * Create and arm a sweeper.
     *
     * @param name label used in thread names and logs
     * @param interval delay between the end of one pass and the start of the next
     * @param keys supplies the keys to check on each pass
     * @param existenceCheck the cache's existence check, evicting stale keys
     * @param concurrent dispatch each check to a worker pool instead of running inline
     */
    public ExpirySweeper(
            String name,
            Duration interval,
            Supplier<Set<String>> keys,
            Predicate<String> existenceCheck,
            boolean concurrent) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive, got: " + interval);
        }
        this.name = name;
        this.interval = interval;
        this.keys = keys;
        this.existenceCheck = existenceCheck;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "tiercache-sweeper-" + name);
            t.setDaemon(true);
            return t;
        });
        this.workers = concurrent ? newWorkerPool(name) : null;

        final var nanos = interval.compareTo(MAX_NANOS) > 0 ? Long.MAX_VALUE : interval.toNanos();
        scheduler.scheduleWithFixedDelay(this::sweep, nanos, nanos, TimeUnit.NANOSECONDS);
        LOG.debugf("Expiry sweeper armed for %s every %s", name, interval);
    }

    public State state() {
        return state.get();
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Run one pass over all known keys.
     */
    void sweep() {
        if (!state.compareAndSet(State.ARMED, State.SWEEPING)) {
            return;
        }
        try {
            final Set<String> snapshot;
            try {
                snapshot = keys.get();
            } catch (RuntimeException e) {
                LOG.warnv("Expiry sweep of {0} could not list keys: {1}", name, e.getMessage());
                return;
            }

            if (workers != null) {
                snapshot.forEach(this::dispatch);
                LOG.debugf("Expiry sweep of %s dispatched %d checks", name, snapshot.size());
                return;
            }

            var gone = 0;
            for (String key : snapshot) {
                if (!check(key)) {
                    gone++;
                }
            }
            if (gone > 0) {
                LOG.debugf("Expiry sweep of %s found %d of %d keys stale or gone", name, gone, snapshot.size());
            }
        } finally {
            state.compareAndSet(State.SWEEPING, State.ARMED);
        }
    }

    /**
     * Halt the sweeper permanently. Safe to call more than once.
     */
    public void stop() {
        if (state.getAndSet(State.TERMINATED) == State.TERMINATED) {
            return;
        }
        scheduler.shutdownNow();
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOG.debugf("Expiry sweeper for %s terminated", name);
    }

    private void dispatch(String key) {
        try {
            workers.execute(() -> check(key));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Expiry check for %s skipped, sweeper of %s is stopping", key, name);
        }
    }

    private boolean check(String key) {
        try {
            return existenceCheck.test(key);
        } catch (RuntimeException e) {
            LOG.debugf(e, "Expiry check for %s in %s failed", key, name);
            return true;
        }
    }

    private static ExecutorService newWorkerPool(String name) {
        final var counter = new AtomicInteger();
        final var size = Math.max(2, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(size, r -> {
            var t = new Thread(r, "tiercache-sweeper-io-" + name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
