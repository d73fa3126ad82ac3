package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.Action;
import com.questrail.flightdeck.api.Agent;
import com.questrail.flightdeck.api.FailureResponse;
import com.questrail.flightdeck.api.Status;
import com.questrail.flightdeck.constraint.Requirement;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * StepSettings
 * -----------------------------------------------------------------------------
 * Everything the engine needs to execute a {@link Step}.
 *
 * <ul>
 *   <li>{@code action}: what to perform.</li>
 *   <li>{@code agentRequirement}: constraints the performing agent must
 *       satisfy; resolved when the step is dispatched unless
 *       {@code boundAgent} is set.</li>
 *   <li>{@code timeout}: overrides the run's default step timeout.</li>
 *   <li>{@code independent}: the step does not depend on its predecessor and
 *       may run alongside adjacent independent steps.</li>
 *   <li>{@code expected}: agent statuses that count as success
 *       (see {@link Expectations}).</li>
 *   <li>{@code failureResponse}: overrides the run's default response to a
 *       bad result.</li>
 *   <li>{@code preparationFailure}: set when the step could not be prepared
 *       at run start; the step then finalizes as {@code ERROR} without
 *       being dispatched.</li>
 *   <li>{@code boundAgent}: the agent already bound to the targeted topology
 *       component; used as-is instead of resolving {@code agentRequirement}.</li>
 * </ul>
 */
public record StepSettings(Action action,
                           Requirement agentRequirement,
                           Optional<Duration> timeout,
                           boolean independent,
                           Set<Status> expected,
                           Optional<FailureResponse> failureResponse,
                           Optional<Throwable> preparationFailure,
                           Optional<Agent> boundAgent)
{
    public StepSettings {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(agentRequirement, "agentRequirement");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(failureResponse, "failureResponse");
        Objects.requireNonNull(preparationFailure, "preparationFailure");
        Objects.requireNonNull(boundAgent, "boundAgent");
        timeout.ifPresent(t -> {
            if (t.isNegative() || t.isZero()) {
                throw new IllegalArgumentException("timeout must be positive: " + t);
            }
        });
        if (expected.isEmpty()) {
            throw new IllegalArgumentException("expected statuses must not be empty");
        }
        for (Status s : expected) {
            if (!s.isTerminal()) {
                throw new IllegalArgumentException("expected status must be terminal: " + s);
            }
        }
        expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
    }

    public static Builder builder(Action action, Requirement agentRequirement) {
        return new Builder(action, agentRequirement);
    }

    public static final class Builder
    {
        private final Action action;
        private final Requirement agentRequirement;
        private Duration timeout;
        private boolean independent;
        private Set<Status> expected = EnumSet.of(Status.PASSED);
        private FailureResponse failureResponse;
        private Throwable preparationFailure;
        private Agent boundAgent;

        private Builder(Action action, Requirement agentRequirement) {
            this.action = action;
            this.agentRequirement = agentRequirement;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder independent(boolean independent) {
            this.independent = independent;
            return this;
        }

        public Builder expected(Set<Status> expected) {
            this.expected = expected;
            return this;
        }

        public Builder failureResponse(FailureResponse failureResponse) {
            this.failureResponse = failureResponse;
            return this;
        }

        public Builder preparationFailure(Throwable preparationFailure) {
            this.preparationFailure = preparationFailure;
            return this;
        }

        public Builder boundAgent(Agent boundAgent) {
            this.boundAgent = boundAgent;
            return this;
        }

        public StepSettings build() {
            return new StepSettings(action, agentRequirement, Optional.ofNullable(timeout), independent,
                    expected, Optional.ofNullable(failureResponse), Optional.ofNullable(preparationFailure),
                    Optional.ofNullable(boundAgent));
        }
    }
}
