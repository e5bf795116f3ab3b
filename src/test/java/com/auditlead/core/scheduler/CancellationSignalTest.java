package com.auditlead.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    @DisplayName("first cancel wins")
    void firstCancelWins() {
        var signal = new CancellationSignal();

        assertFalse(signal.isCancelled());
        signal.cancel("first");
        signal.cancel("second");

        assertTrue(signal.isCancelled());
        assertEquals("first", signal.reason());
    }

    @Test
    @DisplayName("sleep returns false after the full delay when not cancelled")
    void sleepCompletes() throws InterruptedException {
        assertFalse(new CancellationSignal().sleep(Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("sleep wakes early on cancel")
    void sleepWakesEarly() throws InterruptedException {
        var signal = new CancellationSignal();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(() -> signal.cancel("stop"), 50, TimeUnit.MILLISECONDS);

        long start = System.nanoTime();
        assertTrue(signal.sleep(Duration.ofSeconds(30)));
        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 10);
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("deadline cancels with a descriptive reason")
    void deadline() throws InterruptedException {
        var signal = new CancellationSignal();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

        signal.cancelAfter(Duration.ofMillis(20), scheduler);

        assertTrue(signal.sleep(Duration.ofSeconds(10)));
        assertTrue(signal.reason().startsWith("deadline of"));
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("attached threads are interrupted and the interrupt is cleared on close")
    void attachInterrupts() throws Exception {
        var signal = new CancellationSignal();
        var attached = new CountDownLatch(1);
        var interrupted = new AtomicBoolean(false);
        var clearedAfterClose = new AtomicBoolean(false);

        Thread worker = new Thread(() -> {
            try (var attachment = signal.attach(Thread.currentThread())) {
                attached.countDown();
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
            clearedAfterClose.set(!Thread.currentThread().isInterrupted());
        });
        worker.start();
        assertTrue(attached.await(5, TimeUnit.SECONDS));

        signal.cancel("stop");
        worker.join(5_000);

        assertTrue(interrupted.get());
        assertTrue(clearedAfterClose.get());
    }

    @Test
    @DisplayName("detached threads are not interrupted")
    void detachedNotInterrupted() {
        var signal = new CancellationSignal();
        try (var attachment = signal.attach(Thread.currentThread())) {
            assertFalse(Thread.currentThread().isInterrupted());
        }

        signal.cancel("later");

        assertFalse(Thread.currentThread().isInterrupted());
    }
}
