package dev.jobmatcher.scheduler;

import dev.jobmatcher.model.MatchPassSummary;
import dev.jobmatcher.service.MatchingEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs matching passes on a fixed cadence until stopped.
 * A failed pass never ends the loop: the next attempt waits the retry delay instead of the interval.
 */
@Slf4j
public class MatchScheduler {

    private static final String SEPARATOR = "========================================";

    private final MatchingEngine matchingEngine;
    private final Duration interval;
    private final Duration retryDelay;
    private final Duration shutdownGrace;
    private final boolean runOnStartup;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private CountDownLatch stopSignal;
    private CountDownLatch wakeSignal;

    public MatchScheduler(MatchingEngine matchingEngine, Duration interval, Duration retryDelay,
                          Duration shutdownGrace, boolean runOnStartup) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Scheduler interval must be positive");
        }
        this.matchingEngine = matchingEngine;
        this.interval = interval;
        this.retryDelay = retryDelay != null ? retryDelay : interval;
        this.shutdownGrace = shutdownGrace != null ? shutdownGrace : Duration.ofSeconds(30);
        this.runOnStartup = runOnStartup;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            stopSignal = new CountDownLatch(1);
            wakeSignal = new CountDownLatch(1);
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("match-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            CountDownLatch stop = stopSignal;
            executor.submit(() -> loop(stop));
            log.info("Match scheduler started (interval: {}, retry delay: {}, run on startup: {})",
                    interval, retryDelay, runOnStartup);
        }
    }

    /**
     * Stop the loop. A pass in progress gets the shutdown grace period to finish.
     */
    public void stop() {
        ExecutorService stopping;
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            stopSignal.countDown();
            stopping = executor;
            executor = null;
            stopping.shutdown();
        }
        // The loop thread takes the lock to reset the wake signal, so never wait while holding it.
        try {
            if (!stopping.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Matching pass did not finish within {}, interrupting", shutdownGrace);
                stopping.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopping.shutdownNow();
        }
        log.info("Match scheduler stopped");
    }

    /**
     * Cut the current wait short and run the next pass now.
     */
    public void triggerNow() {
        synchronized (lifecycleLock) {
            if (running.get() && wakeSignal != null) {
                wakeSignal.countDown();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void loop(CountDownLatch stop) {
        Duration nextWait = runOnStartup ? Duration.ZERO : interval;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            if (!nextWait.isZero() && !await(stop, nextWait)) {
                return;
            }
            if (!running.get()) {
                return;
            }
            nextWait = runPass() ? interval : retryDelay;
        }
    }

    /**
     * @return true if the pass completed
     */
    private boolean runPass() {
        try {
            MatchPassSummary summary = matchingEngine.process().block();
            log.info("Next matching pass in {}", interval);
            return summary != null;
        } catch (Exception e) {
            log.error(SEPARATOR);
            log.error("Matching pass failed: {} - retrying in {}", e.getMessage(), retryDelay);
            log.error(SEPARATOR);
            return false;
        }
    }

    /**
     * Wait for the delay, a stop or a manual trigger.
     *
     * @return false if the scheduler is stopping
     */
    private boolean await(CountDownLatch stop, Duration delay) {
        CountDownLatch wake;
        synchronized (lifecycleLock) {
            wake = wakeSignal;
        }
        long deadline = System.nanoTime() + delay.toNanos();
        try {
            while (System.nanoTime() < deadline) {
                if (stop.await(0, TimeUnit.MILLISECONDS)) {
                    return false;
                }
                if (wake.await(Math.min(250, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()) + 1),
                        TimeUnit.MILLISECONDS)) {
                    synchronized (lifecycleLock) {
                        wakeSignal = new CountDownLatch(1);
                    }
                    log.info("Matching pass triggered manually");
                    return true;
                }
            }
            return stop.getCount() > 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
