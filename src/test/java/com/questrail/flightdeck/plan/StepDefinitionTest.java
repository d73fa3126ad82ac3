package com.questrail.flightdeck.plan;

import com.questrail.flightdeck.api.Status;
import com.questrail.flightdeck.constraint.Requirement;
import com.questrail.flightdeck.tree.ExecutionPolicy;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StepDefinitionTest {

    @Test
    void stepNeedsAnActionAndAnAgent() {
        assertThrows(IllegalStateException.class, () -> StepDefinition.builder("x").agent("api").build());
        assertThrows(IllegalStateException.class, () -> StepDefinition.builder("x").action("login").build());
    }

    @Test
    void builderDefaults() {
        StepDefinition step = StepDefinition.builder("login").action("login").agent("api").build();

        assertEquals(Set.of(Status.PASSED), step.expected());
        assertFalse(step.independent());
        assertTrue(step.timeout().isEmpty());
        assertTrue(step.failureResponse().isEmpty());
        assertEquals(new StepDefinition.ComponentRef("api"), step.agent());
    }

    @Test
    void abstractActionsAndLiteralTargets() {
        Requirement action = Requirement.parse("interface=REST, version>=2.3");
        Requirement agent = Requirement.parse("interface=REST");

        StepDefinition step = StepDefinition.builder("login")
                .actionFrom(action)
                .agent(agent)
                .expect(Status.FAILED, Status.SKIPPED)
                .build();

        assertEquals(new StepDefinition.Resolved(action), step.action());
        assertEquals(new StepDefinition.Literal(agent), step.agent());
        assertEquals(Set.of(Status.FAILED, Status.SKIPPED), step.expected());
    }

    @Test
    void suitesRunInParallelAndCasesSequentiallyByDefault() {
        CaseDefinition c = CaseDefinition.builder("c").build();
        SuiteDefinition s = SuiteDefinition.builder("s").testCase(c).build();

        assertEquals(ExecutionPolicy.parallel(), s.policy());
        assertEquals(ExecutionPolicy.sequential(), c.policy());
        assertEquals(1, s.members().size());
    }
}
