package com.dispatchguard.core.cancel;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void cancelIsIdempotentAndRunsCallbacksOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger fired = new AtomicInteger();
        token.onCancel(fired::incrementAndGet);

        token.cancel();
        token.cancel();

        assertTrue(token.isCancellationRequested());
        assertEquals(1, fired.get());
        assertThrows(CancellationException.class, token::throwIfCancellationRequested);
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        AtomicInteger fired = new AtomicInteger();

        CancellationToken.cancelled().onCancel(fired::incrementAndGet);

        assertEquals(1, fired.get());
    }

    @Test
    void racingRegistrationAndCancelRunCallbackExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            for (int i = 0; i < 500; i++) {
                CancellationToken token = new CancellationToken();
                AtomicInteger fired = new AtomicInteger();
                CountDownLatch start = new CountDownLatch(1);
                Future<?> register = pool.submit(() -> {
                    start.await();
                    token.onCancel(fired::incrementAndGet);
                    return null;
                });
                Future<?> cancelA = pool.submit(() -> {
                    start.await();
                    token.cancel();
                    return null;
                });
                Future<?> cancelB = pool.submit(() -> {
                    start.await();
                    token.cancel();
                    return null;
                });
                start.countDown();
                register.get(5, TimeUnit.SECONDS);
                cancelA.get(5, TimeUnit.SECONDS);
                cancelB.get(5, TimeUnit.SECONDS);

                assertEquals(1, fired.get(), "round " + i);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void noneCannotBeCancelled() {
        assertFalse(CancellationToken.none().isCancellationRequested());
        assertThrows(UnsupportedOperationException.class, () -> CancellationToken.none().cancel());
    }

    @Test
    void awaitReturnsAfterDelayWhenNotCancelled() {
        long start = System.nanoTime();

        new CancellationToken().await(Duration.ofMillis(20));

        assertTrue(System.nanoTime() - start >= Duration.ofMillis(20).toNanos());
    }

    @Test
    void awaitIsInterruptedByCancel() throws Exception {
        CancellationToken token = new CancellationToken();
        Thread t = new Thread(() -> {
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        t.start();

        assertThrows(CancellationException.class, () -> token.await(Duration.ofMinutes(1)));
        t.join();
    }

    @Test
    void awaitOnCancelledTokenFailsFast() {
        assertThrows(CancellationException.class, () -> CancellationToken.cancelled().await(Duration.ZERO));
    }
}
