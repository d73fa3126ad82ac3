package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.api.Agent;
import com.questrail.flightdeck.api.ScriptedAgent;
import com.questrail.flightdeck.constraint.Requirement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopologyTest {

    private static FactoryRegistry registry() {
        FactoryRegistry registry = new FactoryRegistry();
        registry.register("rest", Agent.class, Requirement.parse("interface=REST, version=2.5"), ScriptedAgent::passing);
        registry.register("cli", Agent.class, Requirement.parse("interface=CLI"), ScriptedAgent::passing);
        return registry;
    }

    @Test
    void componentsResolveInDeclarationOrder() {
        Topology topology = Topology.builder()
                .agent("shell", Requirement.parse("interface=CLI"))
                .agent("api", Requirement.parse("interface=REST, version>=2.3"))
                .build();

        try (Resolver resolver = new Resolver(registry())) {
            ResolvedTopology resolved = topology.resolve(resolver);

            assertEquals(List.of("shell", "api"), List.copyOf(resolved.bindings().keySet()));
            assertEquals("rest", resolved.binding("api").orElseThrow().factory().name());
            assertNotNull(resolved.instance("shell", Agent.class));
            assertThrows(IllegalArgumentException.class, () -> resolved.instance("missing", Agent.class));
        }
    }

    @Test
    void sameRequirementSharesTheBinding() {
        Topology topology = Topology.builder()
                .agent("a", Requirement.parse("interface=CLI"))
                .agent("b", Requirement.parse("interface==CLI"))
                .build();

        try (Resolver resolver = new Resolver(registry())) {
            ResolvedTopology resolved = topology.resolve(resolver);
            assertSame(resolved.instance("a", Agent.class), resolved.instance("b", Agent.class));
        }
    }

    @Test
    void strictResolutionFailsOnFirstUnsatisfiableComponent() {
        Topology topology = Topology.builder()
                .agent("gui", Requirement.parse("interface=GUI"))
                .build();

        try (Resolver resolver = new Resolver(registry())) {
            assertThrows(UnsatisfiableConstraintException.class, () -> topology.resolve(resolver));
        }
    }

    @Test
    void tolerantResolutionCollectsFailures() {
        Topology topology = Topology.builder()
                .agent("gui", Requirement.parse("interface=GUI"))
                .agent("shell", Requirement.parse("interface=CLI"))
                .build();

        try (Resolver resolver = new Resolver(registry())) {
            ResolvedTopology resolved = topology.resolveTolerant(resolver);
            assertEquals(1, resolved.size());
            assertInstanceOf(UnsatisfiableConstraintException.class, resolved.failure("gui").orElseThrow());
        }
    }

    @Test
    void duplicateComponentNamesAreRejected() {
        Topology.Builder builder = Topology.builder().agent("api", Requirement.parse("interface=REST"));
        assertThrows(IllegalArgumentException.class, () -> builder.agent("api", Requirement.parse("interface=CLI")));
    }
}
