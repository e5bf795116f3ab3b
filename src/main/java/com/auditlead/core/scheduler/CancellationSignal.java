package com.auditlead.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Run-wide cancellation token.
 * <p>
 * Cancelling wakes every backoff sleep taken through {@link #sleep(Duration)} and
 * interrupts every worker thread currently {@linkplain #attach(Thread) attached}, so
 * in-flight work functions observe the cancellation as an interrupt.
 */
public class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Set<Thread> attached = ConcurrentHashMap.newKeySet();
    private volatile String reason;

    /**
     * Cancel the run. Only the first call has an effect.
     *
     * @param why human-readable reason, recorded in the error detail of interrupted agents
     */
    public void cancel(String why) {
        synchronized (this) {
            if (isCancelled()) {
                return;
            }
            reason = why;
            cancelled.countDown();
            attached.forEach(Thread::interrupt);
        }
        log.warn("Run cancelled: {}", why);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    /**
     * Sleep for up to {@code delay}, waking early on cancellation.
     *
     * @return {@code true} if the run was cancelled before or during the sleep
     */
    public boolean sleep(Duration delay) throws InterruptedException {
        return cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Schedule cancellation once {@code timeout} elapses.
     */
    public ScheduledFuture<?> cancelAfter(Duration timeout, ScheduledExecutorService scheduler) {
        return scheduler.schedule(
                () -> cancel("deadline of " + timeout + " exceeded"),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Register a worker thread to be interrupted on cancellation. Closing the returned
     * handle unregisters it and clears any interrupt this signal delivered.
     */
    public Attachment attach(Thread worker) {
        synchronized (this) {
            attached.add(worker);
            if (isCancelled()) {
                worker.interrupt();
            }
        }
        return () -> {
            synchronized (this) {
                attached.remove(worker);
                if (isCancelled() && worker == Thread.currentThread()) {
                    Thread.interrupted();
                }
            }
        };
    }

    @FunctionalInterface
    public interface Attachment extends AutoCloseable {
        @Override
        void close();
    }
}
