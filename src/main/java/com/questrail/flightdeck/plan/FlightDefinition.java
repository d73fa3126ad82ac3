package com.questrail.flightdeck.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Definition of a flight: an ordered list of steps.
 */
public record FlightDefinition(String name, List<StepDefinition> steps)
{
    public FlightDefinition {
        Objects.requireNonNull(name, "name");
        steps = List.copyOf(steps);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder
    {
        private final String name;
        private final List<StepDefinition> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder step(StepDefinition step) {
            steps.add(Objects.requireNonNull(step, "step"));
            return this;
        }

        public FlightDefinition build() {
            return new FlightDefinition(name, steps);
        }
    }
}
