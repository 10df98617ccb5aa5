package org.sensorvault.storage.sweep;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.sensorvault.storage.api.CancellationToken;
import org.sensorvault.storage.api.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed set of sweepers on a single background thread at a fixed delay.
 * <p>
 * Sweepers run one after another, never concurrently with each other. {@link #stop()} cancels
 * the running pass through its {@link CancellationToken} and waits for the thread to finish.
 * {@link #runOnce()} runs a pass on the caller's thread and is what the scheduled task calls.
 */
public class SweepScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    public enum State {
        STOPPED,
        RUNNING
    }

    private final String name;
    private final List<ISweeper> sweepers;
    private final Duration interval;
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final ConcurrentHashMap<String, SweepResult> lastResults = new ConcurrentHashMap<>();

    private volatile CancellationToken token = new CancellationToken();
    private ScheduledExecutorService executor;

    public SweepScheduler(String name, List<ISweeper> sweepers, Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Sweep interval must be positive: " + interval);
        }
        this.name = name;
        this.sweepers = List.copyOf(sweepers);
        this.interval = interval;
    }

    /**
     * Starts periodic sweeping.
     *
     * @param initialDelay delay before the first pass
     * @throws IllegalStateException if already running
     */
    public synchronized void start(Duration initialDelay) {
        if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException("Sweep scheduler '" + name + "' is already running");
        }
        token = new CancellationToken();
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sweep-" + name);
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::runScheduled,
                initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Sweep scheduler '{}' started ({} sweeper(s), every {})", name, sweepers.size(), interval);
    }

    /**
     * Cancels the running pass and stops the background thread. Does nothing when stopped.
     */
    public synchronized void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            return;
        }
        token.cancel();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Sweep scheduler '{}' did not stop within 30s", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping sweep scheduler '{}'", name);
        }
        executor = null;
        log.debug("Sweep scheduler '{}' stopped", name);
    }

    @Override
    public void close() {
        stop();
    }

    public State getCurrentState() {
        return state.get();
    }

    /**
     * Runs every sweeper once, in order. A sweeper that fails is logged; the next one still runs.
     *
     * @return the results of the sweepers that completed
     */
    public List<SweepResult> runOnce() {
        List<SweepResult> results = new ArrayList<>();
        CancellationToken current = token;
        for (ISweeper sweeper : sweepers) {
            if (current.isCancelled()) {
                break;
            }
            try {
                SweepResult result = sweeper.sweep(current);
                lastResults.put(sweeper.getName(), result);
                results.add(result);
                log.debug("{}", result);
            } catch (StorageException e) {
                log.error("Sweeper '{}' of '{}' failed: {}", sweeper.getName(), name, e.getMessage());
            }
        }
        return results;
    }

    /**
     * Returns the most recent result of a sweeper, or {@code null} if it has not completed yet.
     */
    public SweepResult getLastResult(String sweeperName) {
        return lastResults.get(sweeperName);
    }

    private void runScheduled() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            // escaping exceptions would cancel all future runs
            log.error("Unexpected error in sweep scheduler '{}': {}", name, e.getMessage());
            log.debug("Exception details:", e);
        }
    }
}
