package com.questrail.flightdeck.tree;

import java.util.Objects;

/**
 * How a container runs its children.
 *
 * <p>{@code maxConcurrency} of zero means "bounded only by the run's worker
 * limit". A sequential policy always has a concurrency of one.</p>
 */
public record ExecutionPolicy(Mode mode, int maxConcurrency)
{
    public enum Mode {
        SEQUENTIAL,
        PARALLEL
    }

    private static final ExecutionPolicy SEQUENTIAL = new ExecutionPolicy(Mode.SEQUENTIAL, 1);
    private static final ExecutionPolicy PARALLEL = new ExecutionPolicy(Mode.PARALLEL, 0);

    public ExecutionPolicy {
        Objects.requireNonNull(mode, "mode");
        if (maxConcurrency < 0) {
            throw new IllegalArgumentException("maxConcurrency must be >= 0");
        }
        if (mode == Mode.SEQUENTIAL) {
            maxConcurrency = 1;
        }
    }

    public static ExecutionPolicy sequential() {
        return SEQUENTIAL;
    }

    public static ExecutionPolicy parallel() {
        return PARALLEL;
    }

    public static ExecutionPolicy parallel(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        return new ExecutionPolicy(Mode.PARALLEL, maxConcurrency);
    }

    public boolean isParallel() {
        return mode == Mode.PARALLEL;
    }

    /**
     * Concurrency actually applied under a run-wide worker limit.
     */
    public int effectiveConcurrency(int workerLimit) {
        if (mode == Mode.SEQUENTIAL) {
            return 1;
        }
        return maxConcurrency == 0 ? workerLimit : Math.min(maxConcurrency, workerLimit);
    }
}
