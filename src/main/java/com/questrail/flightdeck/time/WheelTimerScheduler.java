package com.questrail.flightdeck.time;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * WheelTimerScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by Netty's {@link HashedWheelTimer}.
 *
 * <h2>Design</h2>
 * <p>A run arms one deadline per dispatched step and cancels almost all of
 * them because steps usually finish in time. A hashed wheel makes both arming
 * and cancelling O(1), at the cost of tick-granular precision: a task fires
 * at the first tick after its deadline, never before.</p>
 *
 * <h2>Clock Consistency</h2>
 * <p>Absolute deadlines are converted to relative delays with the provided
 * {@link MonotonicClock}; callers must compute deadlines with the same clock.</p>
 *
 * <h2>Ownership</h2>
 * <p>This class owns its timer thread. {@link #close()} stops the wheel and
 * discards pending tasks.</p>
 */
public final class WheelTimerScheduler implements MonotonicScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WheelTimerScheduler.class);

    private final HashedWheelTimer timer;
    private final MonotonicClock clock;

    /**
     * Creates a scheduler with the given tick duration.
     *
     * @param clock the monotonic clock used for delay calculations
     * @param tick  wheel tick duration (precision of deadlines)
     */
    public WheelTimerScheduler(MonotonicClock clock, Duration tick) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(tick, "tick");
        if (tick.isZero() || tick.isNegative()) {
            throw new IllegalArgumentException("tick must be positive");
        }
        this.timer = new HashedWheelTimer(
                new DefaultThreadFactory("flightdeck-deadline", true),
                tick.toNanos(),
                TimeUnit.NANOSECONDS);
    }

    /**
     * Creates a scheduler on the system monotonic clock with a 10 ms tick.
     */
    public static WheelTimerScheduler withDefaults() {
        return new WheelTimerScheduler(SystemMonotonicClock.INSTANCE, Duration.ofMillis(10));
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }

    @Override
    public void close() {
        int discarded = timer.stop().size();
        if (discarded > 0) {
            log.debug("Deadline wheel stopped with {} pending task(s) discarded", discarded);
        }
    }
}
