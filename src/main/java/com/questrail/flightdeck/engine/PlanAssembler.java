package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.api.Action;
import com.questrail.flightdeck.api.Agent;
import com.questrail.flightdeck.constraint.Requirement;
import com.questrail.flightdeck.plan.CaseDefinition;
import com.questrail.flightdeck.plan.FlightDefinition;
import com.questrail.flightdeck.plan.MemberDefinition;
import com.questrail.flightdeck.plan.StepDefinition;
import com.questrail.flightdeck.plan.SuiteDefinition;
import com.questrail.flightdeck.resolve.AmbiguousResolutionException;
import com.questrail.flightdeck.resolve.ResolutionException;
import com.questrail.flightdeck.resolve.ResolvedTopology;
import com.questrail.flightdeck.resolve.Resolver;
import com.questrail.flightdeck.resolve.Topology;
import com.questrail.flightdeck.tree.Case;
import com.questrail.flightdeck.tree.Flight;
import com.questrail.flightdeck.tree.StepSettings;
import com.questrail.flightdeck.tree.Suite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * PlanAssembler
 * =============================================================================
 * Turns a {@link SuiteDefinition} into a live tree at run start.
 *
 * <h2>Resolution</h2>
 * <pre>
 *   topology components      → resolved and constructed now; steps targeting
 *                              one are bound to that exact instance
 *   abstract step actions    → resolved and constructed now (product type Action)
 *   literal agent targets    → factory selected now, constructed on first dispatch
 * </pre>
 * Ambiguity anywhere aborts the run. Other resolution failures abort under
 * {@link ResolutionFailurePolicy#FAIL_RUN}; under
 * {@link ResolutionFailurePolicy#FAIL_NODE} they are attached to the affected
 * steps, which later finalize as {@code ERROR} without being dispatched.
 *
 * <p>A step naming an unknown topology component, or a component that is not
 * an agent, is a plan error and always aborts.</p>
 */
final class PlanAssembler
{
    private static final Logger log = LoggerFactory.getLogger(PlanAssembler.class);

    private final Resolver resolver;
    private final RunOptions options;

    private Topology topology;
    private ResolvedTopology resolved;
    private int tolerated;

    PlanAssembler(Resolver resolver, RunOptions options) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @throws ResolutionException      on ambiguity, or any failure under FAIL_RUN
     * @throws IllegalArgumentException on plan errors
     */
    Suite assemble(Topology topology, SuiteDefinition plan) {
        this.topology = Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(plan, "plan");
        this.resolved = tolerant() ? topology.resolveTolerant(resolver) : topology.resolve(resolver);
        resolved.failures().forEach((name, e) -> log.warn("Topology component '{}' unresolved: {}", name, e.getMessage()));

        Suite root = Suite.root(plan.name(), plan.policy());
        addMembers(root, plan);
        log.debug("Assembled plan '{}' ({} resolution failure(s) tolerated)", plan.name(), tolerated);
        return root;
    }

    private void addMembers(Suite suite, SuiteDefinition definition) {
        for (MemberDefinition member : definition.members()) {
            if (member instanceof SuiteDefinition nested) {
                addMembers(suite.addSuite(nested.name(), nested.policy()), nested);
            } else {
                CaseDefinition cd = (CaseDefinition) member;
                Case testCase = suite.addCase(cd.name(), cd.lifecycle(), cd.policy());
                for (FlightDefinition fd : cd.flights()) {
                    Flight flight = testCase.addFlight(fd.name());
                    for (StepDefinition sd : fd.steps()) {
                        flight.addStep(sd.name(), settings(sd));
                    }
                }
            }
        }
    }

    private StepSettings settings(StepDefinition sd) {
        ResolutionException failure = null;

        Action action;
        if (sd.action() instanceof StepDefinition.Concrete concrete) {
            action = concrete.action();
        } else {
            Requirement req = ((StepDefinition.Resolved) sd.action()).requirement();
            try {
                action = resolver.instance(Action.class, req);
            } catch (AmbiguousResolutionException e) {
                throw e;
            } catch (ResolutionException e) {
                failure = tolerate(sd, e);
                action = Action.of("unresolved " + req);
            }
        }

        Requirement agentRequirement;
        Agent boundAgent = null;
        if (sd.agent() instanceof StepDefinition.ComponentRef ref) {
            Topology.Component component = topology.component(ref.component())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Step '" + sd.name() + "' targets unknown component '" + ref.component() + "'"));
            if (!Agent.class.isAssignableFrom(component.productType())) {
                throw new IllegalArgumentException("Step '" + sd.name() + "' targets component '"
                        + ref.component() + "' which is not an agent");
            }
            agentRequirement = component.requirement();
            boundAgent = resolved.binding(ref.component())
                    .map(binding -> Agent.class.cast(binding.instance()))
                    .orElse(null);
            if (failure == null && resolved.failure(ref.component()).isPresent()) {
                failure = resolved.failure(ref.component()).get();
                tolerated++;
            }
        } else {
            agentRequirement = ((StepDefinition.Literal) sd.agent()).requirement();
            if (failure == null) {
                try {
                    resolver.select(Agent.class, agentRequirement);
                } catch (AmbiguousResolutionException e) {
                    throw e;
                } catch (ResolutionException e) {
                    failure = tolerate(sd, e);
                }
            }
        }

        StepSettings.Builder b = StepSettings.builder(action, agentRequirement)
                .independent(sd.independent())
                .expected(sd.expected())
                .preparationFailure(failure)
                .boundAgent(boundAgent);
        sd.timeout().ifPresent(b::timeout);
        sd.failureResponse().ifPresent(b::failureResponse);
        return b.build();
    }

    private ResolutionException tolerate(StepDefinition sd, ResolutionException e) {
        if (!tolerant()) {
            throw e;
        }
        tolerated++;
        log.warn("Step '{}' will fail: {}", sd.name(), e.getMessage());
        return e;
    }

    private boolean tolerant() {
        return options.resolutionFailurePolicy() == ResolutionFailurePolicy.FAIL_NODE;
    }
}
