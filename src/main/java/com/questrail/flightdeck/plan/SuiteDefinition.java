package com.questrail.flightdeck.plan;

import com.questrail.flightdeck.tree.ExecutionPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SuiteDefinition
 * -----------------------------------------------------------------------------
 * Declarative test-tree definition rooted at a suite. The run engine turns a
 * definition into a live {@link com.questrail.flightdeck.tree.Suite} at run
 * start.
 *
 * <pre>
 *   SuiteDefinition plan = SuiteDefinition.builder("nightly")
 *       .testCase(CaseDefinition.builder("login")
 *           .flight(FlightDefinition.builder("happy-path")
 *               .step(StepDefinition.builder("submit")
 *                   .action(Action.of("login"))
 *                   .agent("api")
 *                   .build())
 *               .build())
 *           .build())
 *       .build();
 * </pre>
 */
public record SuiteDefinition(String name, ExecutionPolicy policy, List<MemberDefinition> members)
    implements MemberDefinition
{
    public SuiteDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(policy, "policy");
        members = List.copyOf(members);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder
    {
        private final String name;
        private ExecutionPolicy policy = ExecutionPolicy.parallel();
        private final List<MemberDefinition> members = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder policy(ExecutionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder sequential() {
            return policy(ExecutionPolicy.sequential());
        }

        public Builder suite(SuiteDefinition suite) {
            members.add(Objects.requireNonNull(suite, "suite"));
            return this;
        }

        public Builder testCase(CaseDefinition testCase) {
            members.add(Objects.requireNonNull(testCase, "testCase"));
            return this;
        }

        public SuiteDefinition build() {
            return new SuiteDefinition(name, policy, members);
        }
    }
}
