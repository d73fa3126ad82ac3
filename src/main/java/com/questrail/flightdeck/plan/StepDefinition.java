package com.questrail.flightdeck.plan;

import com.questrail.flightdeck.api.Action;
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
 * StepDefinition
 * -----------------------------------------------------------------------------
 * Definition of a single step.
 *
 * <h2>Action</h2>
 * Either a concrete {@link Action}, or a {@link Requirement} naming a
 * version-specific action implementation to be resolved from the factory
 * registry at run start (product type {@code Action}).
 *
 * <h2>Agent</h2>
 * Either the name of an agent component of the run's topology, or a literal
 * {@link Requirement} for an agent.
 */
public record StepDefinition(String name,
                             ActionSource action,
                             AgentTarget agent,
                             Optional<Duration> timeout,
                             boolean independent,
                             Set<Status> expected,
                             Optional<FailureResponse> failureResponse)
{
    /**
     * Where a step's action comes from.
     */
    public sealed interface ActionSource permits Concrete, Resolved {}

    public record Concrete(Action action) implements ActionSource
    {
        public Concrete {
            Objects.requireNonNull(action, "action");
        }
    }

    public record Resolved(Requirement requirement) implements ActionSource
    {
        public Resolved {
            Objects.requireNonNull(requirement, "requirement");
        }
    }

    /**
     * Which agent performs a step.
     */
    public sealed interface AgentTarget permits ComponentRef, Literal {}

    public record ComponentRef(String component) implements AgentTarget
    {
        public ComponentRef {
            Objects.requireNonNull(component, "component");
        }
    }

    public record Literal(Requirement requirement) implements AgentTarget
    {
        public Literal {
            Objects.requireNonNull(requirement, "requirement");
        }
    }

    public StepDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(failureResponse, "failureResponse");
        Objects.requireNonNull(expected, "expected");
        if (expected.isEmpty()) {
            throw new IllegalArgumentException("step '" + name + "' expects no status");
        }
        expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder
    {
        private final String name;
        private ActionSource action;
        private AgentTarget agent;
        private Duration timeout;
        private boolean independent;
        private Set<Status> expected = EnumSet.of(Status.PASSED);
        private FailureResponse failureResponse;

        private Builder(String name) {
            this.name = name;
        }

        public Builder action(Action action) {
            this.action = new Concrete(action);
            return this;
        }

        public Builder action(String name) {
            return action(Action.of(name));
        }

        /**
         * Resolves the action from the registry at run start.
         */
        public Builder actionFrom(Requirement requirement) {
            this.action = new Resolved(requirement);
            return this;
        }

        public Builder agent(String component) {
            this.agent = new ComponentRef(component);
            return this;
        }

        public Builder agent(Requirement requirement) {
            this.agent = new Literal(requirement);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder independent() {
            this.independent = true;
            return this;
        }

        public Builder expect(Status first, Status... more) {
            this.expected = EnumSet.of(first, more);
            return this;
        }

        public Builder onFailure(FailureResponse response) {
            this.failureResponse = response;
            return this;
        }

        public StepDefinition build() {
            if (action == null) {
                throw new IllegalStateException("step '" + name + "' has no action");
            }
            if (agent == null) {
                throw new IllegalStateException("step '" + name + "' has no agent");
            }
            return new StepDefinition(name, action, agent, Optional.ofNullable(timeout), independent,
                    expected, Optional.ofNullable(failureResponse));
        }
    }
}
