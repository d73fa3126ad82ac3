package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.time.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level, set-once cancellation flag.
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run exactly once,
 * on the cancelling thread, or immediately if the token is already set.</p>
 */
public final class CancellationToken
{
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();

    private static final class Callback
    {
        private final Runnable action;
        private final AtomicBoolean fired = new AtomicBoolean();

        Callback(Runnable action) {
            this.action = action;
        }

        void fire() {
            if (fired.compareAndSet(false, true)) {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.warn("Cancellation callback failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    /**
     * Sets the token.
     *
     * @return {@code true} if this call set it
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Callback c : callbacks) {
            c.fire();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback; the returned handle unregisters it.
     */
    public Cancellable onCancel(Runnable action) {
        Callback callback = new Callback(Objects.requireNonNull(action, "action"));
        callbacks.add(callback);
        if (cancelled.get()) {
            callback.fire();
        }
        return () -> callbacks.remove(callback);
    }
}
