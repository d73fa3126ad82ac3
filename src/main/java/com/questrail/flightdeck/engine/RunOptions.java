package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.api.FailureResponse;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-run configuration.
 *
 * <ul>
 *   <li>{@code workerLimit}: cases that may run at once across the run.</li>
 *   <li>{@code defaultStepTimeout}: deadline for steps that set none.</li>
 *   <li>{@code cancellationGracePeriod}: how long an abandoned agent call may
 *       take to wind down before its thread is interrupted.</li>
 *   <li>{@code resolutionFailurePolicy}: see {@link ResolutionFailurePolicy}.</li>
 *   <li>{@code strictFinalization}: re-finalizing a node is an invariant
 *       violation instead of a logged no-op.</li>
 *   <li>{@code defaultFailureResponse}: what a flight does after a bad step
 *       that sets no response of its own.</li>
 * </ul>
 */
public record RunOptions(
    int workerLimit,
    Duration defaultStepTimeout,
    Duration cancellationGracePeriod,
    ResolutionFailurePolicy resolutionFailurePolicy,
    boolean strictFinalization,
    FailureResponse defaultFailureResponse
) {
    public RunOptions {
        if (workerLimit < 1) {
            throw new IllegalArgumentException("workerLimit must be >= 1");
        }
        Objects.requireNonNull(defaultStepTimeout, "defaultStepTimeout");
        Objects.requireNonNull(cancellationGracePeriod, "cancellationGracePeriod");
        Objects.requireNonNull(resolutionFailurePolicy, "resolutionFailurePolicy");
        Objects.requireNonNull(defaultFailureResponse, "defaultFailureResponse");
        if (defaultStepTimeout.isZero() || defaultStepTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultStepTimeout must be positive");
        }
        if (cancellationGracePeriod.isNegative()) {
            throw new IllegalArgumentException("cancellationGracePeriod must not be negative");
        }
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int workerLimit = Runtime.getRuntime().availableProcessors();
        private Duration defaultStepTimeout = Duration.ofSeconds(30);
        private Duration cancellationGracePeriod = Duration.ofSeconds(2);
        private ResolutionFailurePolicy resolutionFailurePolicy = ResolutionFailurePolicy.FAIL_RUN;
        private boolean strictFinalization;
        private FailureResponse defaultFailureResponse = FailureResponse.PROCEED;

        public Builder withWorkerLimit(int workerLimit) {
            this.workerLimit = workerLimit;
            return this;
        }

        public Builder withDefaultStepTimeout(Duration timeout) {
            this.defaultStepTimeout = timeout;
            return this;
        }

        public Builder withCancellationGracePeriod(Duration grace) {
            this.cancellationGracePeriod = grace;
            return this;
        }

        public Builder withResolutionFailurePolicy(ResolutionFailurePolicy policy) {
            this.resolutionFailurePolicy = policy;
            return this;
        }

        public Builder withStrictFinalization(boolean strict) {
            this.strictFinalization = strict;
            return this;
        }

        public Builder withDefaultFailureResponse(FailureResponse response) {
            this.defaultFailureResponse = response;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(workerLimit, defaultStepTimeout, cancellationGracePeriod,
                resolutionFailurePolicy, strictFinalization, defaultFailureResponse);
        }
    }
}
