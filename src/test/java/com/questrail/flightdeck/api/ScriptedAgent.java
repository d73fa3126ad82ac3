package com.questrail.flightdeck.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test agent whose behavior is a script; records executions, cancels and
 * releases for assertions.
 */
public final class ScriptedAgent implements Agent {

    @FunctionalInterface
    public interface Script {
        ActionOutcome run(Action action, ScriptedAgent agent) throws Exception;
    }

    private final Script script;
    private final List<String> executed = new ArrayList<>();
    private final AtomicInteger cancels = new AtomicInteger();
    private final AtomicInteger releases = new AtomicInteger();
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public ScriptedAgent(Script script) {
        this.script = script;
    }

    public static ScriptedAgent passing() {
        return returning(ActionOutcome.passed("ok"));
    }

    public static ScriptedAgent returning(ActionOutcome outcome) {
        return new ScriptedAgent((action, agent) -> outcome);
    }

    public static ScriptedAgent throwing(Exception fault) {
        return new ScriptedAgent((action, agent) -> {
            throw fault;
        });
    }

    /**
     * Works for {@code duration}, returning early (FAILED) when cancelled.
     */
    public static ScriptedAgent working(Duration duration) {
        return new ScriptedAgent((action, agent) -> {
            if (agent.cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                return ActionOutcome.failed("cancelled by engine");
            }
            return ActionOutcome.passed("done after " + duration.toMillis() + " ms");
        });
    }

    /**
     * Works for {@code duration} and ignores cancel(); only an interrupt stops it.
     */
    public static ScriptedAgent stubborn(Duration duration) {
        return new ScriptedAgent((action, agent) -> {
            Thread.sleep(duration.toMillis());
            return ActionOutcome.passed("finally done");
        });
    }

    @Override
    public ActionOutcome execute(Action action, Duration timeout) throws Exception {
        synchronized (executed) {
            executed.add(action.name());
        }
        started.countDown();
        return script.run(action, this);
    }

    @Override
    public void cancel() {
        cancels.incrementAndGet();
        cancelled.countDown();
    }

    @Override
    public void release() {
        releases.incrementAndGet();
    }

    public List<String> executed() {
        synchronized (executed) {
            return new ArrayList<>(executed);
        }
    }

    public int cancels() {
        return cancels.get();
    }

    public int releases() {
        return releases.get();
    }

    public boolean awaitStarted(Duration timeout) throws InterruptedException {
        return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
