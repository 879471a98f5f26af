package com.kiln.environment;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTokenTest {

    @Test
    void listenersRunOnceAndLateListenersRunImmediately() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();
        assertEquals(1, calls.get());
        assertTrue(token.isCancelled());

        token.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get());
    }

    @Test
    void closedRegistrationIsNotCalled() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet).close();

        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertEquals(1, calls.get());
    }
}
