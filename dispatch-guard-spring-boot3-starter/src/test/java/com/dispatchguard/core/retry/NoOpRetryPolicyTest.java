package com.dispatchguard.core.retry;

import com.dispatchguard.core.cancel.CancellationToken;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NoOpRetryPolicyTest {

    @Test
    void runsExactlyOnceAndPropagatesFailure() {
        AtomicInteger calls = new AtomicInteger();
        IOException boom = new IOException("boom");

        IOException thrown = assertThrows(IOException.class, () -> NoOpRetryPolicy.INSTANCE.run(ct -> {
            calls.incrementAndGet();
            throw boom;
        }, CancellationToken.none()));

        assertSame(boom, thrown);
        assertEquals(1, calls.get());
    }

    @Test
    void returnsResultAndPropagatesCancellation() throws Exception {
        assertEquals("v", NoOpRetryPolicy.INSTANCE.execute(ct -> "v", null));
        assertThrows(CancellationException.class, () -> NoOpRetryPolicy.INSTANCE.run(
                CancellationToken::throwIfCancellationRequested, CancellationToken.cancelled()));
        assertThrows(NullPointerException.class, () -> NoOpRetryPolicy.INSTANCE.execute(null, null));
    }
}
