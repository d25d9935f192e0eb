package io.github.yok.forcelink.core;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Cancellation flag shared between a running dispatch and a user interrupt.
 *
 * <p>
 * Dispatch checks {@link #isCancelled()} at chunk boundaries only. A shutdown hook calls
 * {@link #cancelAndAwait(Duration)} so the JVM does not halt before the in-flight chunk has been
 * recorded.
 * </p>
 */
@Slf4j
public class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Object lock = new Object();
    private int activeRuns;

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Cancellation requested; no further chunks will be started.");
        }
    }

    /**
     * Marks the start of a run.
     */
    void begin() {
        synchronized (lock) {
            activeRuns++;
        }
    }

    /**
     * Marks the end of a run and wakes up a waiting {@link #cancelAndAwait(Duration)}.
     */
    void end() {
        synchronized (lock) {
            activeRuns--;
            lock.notifyAll();
        }
    }

    /**
     * Requests cancellation and waits until every active run has stopped.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if no run was active when this method returned
     */
    public boolean cancelAndAwait(Duration timeout) {
        cancel();
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (activeRuns > 0) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMillis <= 0) {
                    return false;
                }
                try {
                    lock.wait(remainingMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }
}
