package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.time.Cancellable;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void callbacksFireOnceOnCancel() {
        CancellationToken token = new CancellationToken();
        AtomicInteger fired = new AtomicInteger();
        token.onCancel(fired::incrementAndGet);

        assertTrue(token.cancel());
        assertFalse(token.cancel());

        assertTrue(token.isCancelled());
        assertEquals(1, fired.get());
    }

    @Test
    void lateRegistrationFiresImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger fired = new AtomicInteger();

        token.onCancel(fired::incrementAndGet);

        assertEquals(1, fired.get());
    }

    @Test
    void unregisteredCallbackDoesNotFire() {
        CancellationToken token = new CancellationToken();
        AtomicInteger fired = new AtomicInteger();
        Cancellable registration = token.onCancel(fired::incrementAndGet);

        registration.cancel();
        token.cancel();

        assertEquals(0, fired.get());
    }

    @Test
    void throwingCallbackDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        AtomicInteger fired = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(fired::incrementAndGet);

        token.cancel();

        assertEquals(1, fired.get());
    }
}
