package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.api.Action;
import com.questrail.flightdeck.api.Agent;
import com.questrail.flightdeck.api.ScriptedAgent;
import com.questrail.flightdeck.constraint.Requirement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FactoryRegistryTest {

    @Test
    void candidatesAreFilteredByProductTypeInRegistrationOrder() {
        FactoryRegistry registry = new FactoryRegistry();
        registry.register("rest", Agent.class, Requirement.parse("interface=REST"), ScriptedAgent::passing);
        registry.register("login", Action.class, Requirement.parse("action=login"), () -> Action.of("login"));
        registry.register("cli", Agent.class, Requirement.parse("interface=CLI"), ScriptedAgent::passing);

        List<String> names = registry.candidates(Agent.class).stream().map(Factory::name).toList();
        assertEquals(List.of("rest", "cli"), names);
        assertEquals(3, registry.candidates(Object.class).size());
    }

    @Test
    void unnamedFactoriesGetGeneratedNames() {
        FactoryRegistry registry = new FactoryRegistry();
        Factory<Action> f = registry.register(Action.class, Requirement.none(), () -> Action.of("noop"));
        assertEquals("Action#1", f.name());
    }

    @Test
    void registrationAfterFreezeIsRejected() {
        FactoryRegistry registry = new FactoryRegistry();
        registry.register("rest", Agent.class, Requirement.parse("interface=REST"), ScriptedAgent::passing);
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register("cli", Agent.class,
                Requirement.parse("interface=CLI"), ScriptedAgent::passing));
        assertEquals(1, registry.factories().size());
    }

    @Test
    void duplicateNamesAreRejected() {
        FactoryRegistry registry = new FactoryRegistry();
        registry.register("rest", Agent.class, Requirement.parse("interface=REST"), ScriptedAgent::passing);
        assertThrows(IllegalArgumentException.class, () -> registry.register("rest", Agent.class,
                Requirement.parse("interface=REST, version=2"), ScriptedAgent::passing));
    }
}
