package com.vtb.vulnpolicy.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void sleepCompletesWhenNotCancelled() {
        CancellationSignal signal = CancellationSignal.create();
        assertFalse(signal.sleep(Duration.ofMillis(5)));
        assertFalse(signal.isCancelled());
    }

    @Test
    void cancelInterruptsSleepPromptly() {
        CancellationSignal signal = CancellationSignal.create();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(signal::cancel, 50, TimeUnit.MILLISECONDS);
            long started = System.nanoTime();
            assertTrue(signal.sleep(Duration.ofSeconds(30)));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            assertTrue(elapsedMs < 5_000, "сон должен прерываться отменой, прошло " + elapsedMs + " мс");
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void deadlineCancelsSignal() {
        CancellationSignal signal = CancellationSignal.withTimeout(Duration.ofMillis(20));
        assertTrue(signal.sleep(Duration.ofSeconds(30)));
        assertTrue(signal.isCancelled());
    }

    @Test
    void deadlineFiresListenersWithoutPolling() throws Exception {
        CancellationSignal signal = CancellationSignal.withTimeout(Duration.ofMillis(50));
        CountDownLatch fired = new CountDownLatch(1);
        signal.onCancel(fired::countDown);

        assertTrue(fired.await(5, TimeUnit.SECONDS), "дедлайн должен сам вызвать cancel()");
    }

    @Test
    void remainingIsNullWithoutDeadline() {
        assertNull(CancellationSignal.create().remaining());
        Duration left = CancellationSignal.withTimeout(Duration.ofSeconds(30)).remaining();
        assertNotNull(left);
        assertTrue(left.compareTo(Duration.ofSeconds(30)) <= 0);
    }

    @Test
    void listenersRunOnceAndCanBeRemoved() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger kept = new AtomicInteger();
        AtomicInteger removed = new AtomicInteger();

        signal.onCancel(kept::incrementAndGet);
        CancellationSignal.Registration registration = signal.onCancel(removed::incrementAndGet);
        registration.close();

        signal.cancel();
        signal.cancel();

        assertEquals(1, kept.get());
        assertEquals(0, removed.get());
    }

    @Test
    void listenerOnCancelledSignalRunsImmediately() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);
        assertEquals(1, calls.get());
    }
}
