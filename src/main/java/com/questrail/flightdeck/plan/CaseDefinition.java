package com.questrail.flightdeck.plan;

import com.questrail.flightdeck.tree.CaseLifecycle;
import com.questrail.flightdeck.tree.ExecutionPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Definition of a test case: its flights and lifecycle hooks.
 */
public record CaseDefinition(String name,
                             CaseLifecycle lifecycle,
                             ExecutionPolicy policy,
                             List<FlightDefinition> flights)
    implements MemberDefinition
{
    public CaseDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(lifecycle, "lifecycle");
        Objects.requireNonNull(policy, "policy");
        flights = List.copyOf(flights);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder
    {
        private final String name;
        private CaseLifecycle lifecycle = CaseLifecycle.NONE;
        private ExecutionPolicy policy = ExecutionPolicy.sequential();
        private final List<FlightDefinition> flights = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder lifecycle(CaseLifecycle lifecycle) {
            this.lifecycle = lifecycle;
            return this;
        }

        public Builder policy(ExecutionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder flight(FlightDefinition flight) {
            flights.add(Objects.requireNonNull(flight, "flight"));
            return this;
        }

        public CaseDefinition build() {
            return new CaseDefinition(name, lifecycle, policy, flights);
        }
    }
}
