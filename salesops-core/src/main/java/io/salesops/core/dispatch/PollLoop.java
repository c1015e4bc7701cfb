package io.salesops.core.dispatch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link Dispatcher#runCycle()} until stopped. Between cycles it waits the poll interval, or
 * the longer backoff interval after an enumeration failure. {@link #stop()} cuts the wait short but
 * never interrupts a cycle in progress.
 */
public final class PollLoop {
    private static final Logger LOG = LoggerFactory.getLogger(PollLoop.class);

    /** Waits up to {@code delay}; returns true when the loop should stop. */
    @FunctionalInterface
    public interface Waiter {
        boolean await(Duration delay) throws InterruptedException;
    }

    private final Dispatcher dispatcher;
    private final Duration pollInterval;
    private final Duration backoff;
    private final Clock clock;
    private final Waiter waiter;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();

    public PollLoop(Dispatcher dispatcher, Duration pollInterval, Duration backoff, Clock clock) {
        this(dispatcher, pollInterval, backoff, clock, null);
    }

    PollLoop(Dispatcher dispatcher, Duration pollInterval, Duration backoff, Clock clock, Waiter waiter) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.waiter = waiter == null ? this::awaitStop : waiter;
    }

    /** Blocks until {@link #stop()} is called. */
    public void run() {
        LOG.info("Poll loop started (interval={}s, backoff={}s)", pollInterval.toSeconds(), backoff.toSeconds());
        try {
            while (!stopRequested()) {
                CycleReport report = runOnce();
                if (waiter.await(nextDelay(report))) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Poll loop interrupted");
        } finally {
            finished.countDown();
            LOG.info("Poll loop stopped");
        }
    }

    public CycleReport runOnce() {
        CycleReport report;
        try {
            report = dispatcher.runCycle();
        } catch (RuntimeException e) {
            LOG.error("event=cycle.aborted error={}", e.getMessage(), e);
            Instant now = clock.instant();
            report = new CycleReport(now, now, 0, 0, 0, 0, true);
        }
        lastReport.set(report);
        LOG.info(
            "event=cycle.finished discovered={} processed={} skipped={} failed={} enumerationFailed={} durationMs={}",
            report.discovered(),
            report.processed(),
            report.skipped(),
            report.failed(),
            report.enumerationFailed(),
            report.duration().toMillis()
        );
        return report;
    }

    public Duration nextDelay(CycleReport report) {
        return report.enumerationFailed() ? backoff : pollInterval;
    }

    public void stop() {
        stopSignal.countDown();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0;
    }

    private boolean awaitStop(Duration delay) throws InterruptedException {
        return stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
