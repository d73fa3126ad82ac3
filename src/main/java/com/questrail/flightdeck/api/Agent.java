package com.questrail.flightdeck.api;

import java.time.Duration;

/**
 * Agent
 * -----------------------------------------------------------------------------
 * The mechanism by which a step's {@link Action} is performed against one
 * target interface kind (REST, CLI, GUI, native, ...).
 *
 * <h2>Protocol neutrality</h2>
 * The engine never implements a concrete agent and never special-cases an
 * interface kind. Agents are contributed by external modules through the
 * factory registry and resolved from constraint attributes like any other
 * factory product.
 *
 * <h2>Reuse</h2>
 * One agent instance is bound per resolved requirement and shared by every
 * step that targets the same binding, possibly from concurrently running
 * cases. Implementations must therefore tolerate concurrent
 * {@link #execute(Action, Duration)} calls, or be registered with distinct
 * requirements per case.
 *
 * <h2>Failure</h2>
 * Any exception thrown from {@link #execute(Action, Duration)} is caught at
 * the step boundary and recorded as an {@link Status#ERROR} result; it never
 * aborts sibling steps or the run.
 */
public interface Agent
{
    /**
     * Executes an action.
     *
     * @param action  the action to perform
     * @param timeout deadline the engine will enforce; agents may use it to
     *                bound their own I/O
     * @return the observed outcome
     * @throws Exception any automation fault
     */
    ActionOutcome execute(Action action, Duration timeout) throws Exception;

    /**
     * Best-effort request to abandon in-flight executions. Called from a
     * different thread than {@code execute}; must not block.
     */
    void cancel();

    /**
     * Releases resources when the run that created this agent ends.
     * Agents produced by shared (stateless) factories are never released.
     */
    default void release() {
    }
}
