package com.dispatchguard.core.dlq;

import com.dispatchguard.core.spi.DeadLetterQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeadLetterPurgeLifecycleTest {

    private static final Duration RETENTION = Duration.ofDays(7);

    @Mock
    private DeadLetterQueue dlq;

    @Test
    void purgeOnceReturnsDeletedCount() {
        when(dlq.purgeOlderThan(RETENTION)).thenReturn(4);
        DeadLetterPurgeLifecycle lifecycle = new DeadLetterPurgeLifecycle(dlq, RETENTION,
                Duration.ZERO, Duration.ofMinutes(1), true);

        assertEquals(4, lifecycle.purgeOnce());
    }

    @Test
    void purgeFailureIsContained() {
        when(dlq.purgeOlderThan(RETENTION)).thenThrow(new IllegalStateException("db down"));
        DeadLetterPurgeLifecycle lifecycle = new DeadLetterPurgeLifecycle(dlq, RETENTION,
                Duration.ZERO, Duration.ofMinutes(1), true);

        assertEquals(-1, lifecycle.purgeOnce());
    }

    @Test
    void startSchedulesPurgeAndStopHalts() {
        DeadLetterPurgeLifecycle lifecycle = new DeadLetterPurgeLifecycle(dlq, RETENTION,
                Duration.ZERO, Duration.ofMillis(20), true);

        lifecycle.start();
        try {
            assertTrue(lifecycle.isRunning());
            verify(dlq, timeout(2000).atLeastOnce()).purgeOlderThan(RETENTION);
        } finally {
            lifecycle.stop();
        }
        assertFalse(lifecycle.isRunning());
    }

    @Test
    void disabledLifecycleNeverSchedules() throws Exception {
        DeadLetterPurgeLifecycle lifecycle = new DeadLetterPurgeLifecycle(dlq, RETENTION,
                Duration.ZERO, Duration.ofMillis(10), false);

        lifecycle.start();
        Thread.sleep(50);

        assertFalse(lifecycle.isRunning());
        verify(dlq, never()).purgeOlderThan(RETENTION);
    }

    @Test
    void nonPositivePeriodIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DeadLetterPurgeLifecycle(dlq, RETENTION, Duration.ZERO, Duration.ZERO, true));
    }
}
