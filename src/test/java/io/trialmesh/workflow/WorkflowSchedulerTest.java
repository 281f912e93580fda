package io.trialmesh.workflow;

import io.trialmesh.config.ConfigVariables;
import io.trialmesh.config.ConfigurationException;
import io.trialmesh.config.MapConfigVariables;
import io.trialmesh.model.ExperimentRole;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

final class WorkflowSchedulerTest {
    private final WorkflowScheduler scheduler = new WorkflowScheduler();

    @Test
    void laterDeclarationsReplaceOrDeleteMatchingSteps() {
        StepSet set = new StepSet()
                .declare("prepare", 1, StepScope.ALL, "echo prepare", null, false)
                .declare("model", 2, StepScope.ALL, "echo old", null, false)
                .declare("report", 3, StepScope.ALL, "echo report", null, false)
                .declare("model", 2, StepScope.ALL, "echo new", null, false)
                .declare("report", 3, StepScope.ALL, "", null, false);

        List<RenderedStep> steps = scheduler.resolve(set.steps(), ExperimentRole.BASELINE, emptyEnv());
        Assertions.assertEquals(List.of("prepare", "model"), steps.stream().map(RenderedStep::name).toList());
        Assertions.assertEquals("echo new", steps.get(1).command());
    }

    @Test
    void differentScopeIsADifferentStep() {
        StepSet set = new StepSet()
                .declare("model", 1, StepScope.BASELINE, "run-baseline", null, false)
                .declare("model", 1, StepScope.POLICY, "run-policy", null, false);

        Assertions.assertEquals(2, set.steps().size());
        Assertions.assertEquals("run-baseline",
                scheduler.resolve(set.steps(), ExperimentRole.BASELINE, emptyEnv()).get(0).command());
        Assertions.assertEquals("run-policy",
                scheduler.resolve(set.steps(), ExperimentRole.POLICY, emptyEnv()).get(0).command());
    }

    @Test
    void missingSeqContinuesAfterHighestSeen() {
        StepSet set = new StepSet()
                .declare("a", 10, null, "a", null, false)
                .declare("b", null, null, "b", null, false)
                .declare("c", 5, null, "c", null, false)
                .declare("d", null, null, "d", null, false);

        List<WorkflowStep> steps = set.steps();
        Assertions.assertEquals(11, steps.get(1).seq());
        Assertions.assertEquals(12, steps.get(3).seq());

        List<RenderedStep> ordered = scheduler.resolve(steps, ExperimentRole.POLICY, emptyEnv());
        Assertions.assertEquals(List.of("c", "a", "b", "d"), ordered.stream().map(RenderedStep::name).toList());
    }

    @Test
    void equalSeqStepsShareParallelGroupInDeclarationOrder() {
        StepSet set = new StepSet()
                .declare("x", 1, null, "x", null, false)
                .declare("y", 2, null, "y", null, false)
                .declare("z", 2, null, "z", null, false);

        List<RenderedStep> steps = scheduler.resolve(set.steps(), ExperimentRole.POLICY, emptyEnv());
        Assertions.assertEquals(0, steps.get(0).parallelGroup());
        Assertions.assertEquals("y", steps.get(1).name());
        Assertions.assertEquals(1, steps.get(1).parallelGroup());
        Assertions.assertEquals(1, steps.get(2).parallelGroup());
    }

    @Test
    void groupedStepsRunOnlyForMatchingScenarioGroup() {
        StepSet set = new StepSet()
                .declare("always", 1, null, "always", null, false)
                .declare("elec", 2, null, "elec", "electricity", false)
                .declare("regex", 3, null, "regex", "trans.*", false);

        Assertions.assertEquals(List.of("always"), names(scheduler.resolve(set.steps(), ExperimentRole.POLICY, emptyEnv())));
        Assertions.assertEquals(List.of("always", "elec"), names(scheduler.resolve(
                set.steps(), ExperimentRole.POLICY, emptyEnv(), StepSelection.group("electricity"))));
        Assertions.assertEquals(List.of("always", "regex"), names(scheduler.resolve(
                set.steps(), ExperimentRole.POLICY, emptyEnv(), StepSelection.group("transport"))));

        Assertions.assertThrows(ConfigurationException.class, () -> WorkflowScheduler.groupMatches("(", "x"));
    }

    @Test
    void optionalStepsRequireExplicitSelection() {
        StepSet set = new StepSet()
                .declare("model", 1, null, "model", null, false)
                .declare("plots", 2, null, "plots", null, true);

        Assertions.assertEquals(List.of("model"), names(scheduler.resolve(set.steps(), ExperimentRole.POLICY, emptyEnv())));
        StepSelection only = new StepSelection(Set.of("plots"), Set.of(), null);
        Assertions.assertEquals(List.of("plots"), names(scheduler.resolve(set.steps(), ExperimentRole.POLICY, emptyEnv(), only)));
        StepSelection skip = new StepSelection(Set.of(), Set.of("model"), null);
        Assertions.assertTrue(scheduler.resolve(set.steps(), ExperimentRole.POLICY, emptyEnv(), skip).isEmpty());
    }

    @Test
    void unknownSelectedOrSkippedNamesAreRejected() {
        StepSet set = new StepSet().declare("model", 1, null, "model", null, false);
        Assertions.assertThrows(ConfigurationException.class, () -> scheduler.resolve(
                set.steps(), ExperimentRole.POLICY, emptyEnv(), new StepSelection(Set.of("nope"), Set.of(), null)));
        Assertions.assertThrows(ConfigurationException.class, () -> scheduler.resolve(
                set.steps(), ExperimentRole.POLICY, emptyEnv(), new StepSelection(Set.of(), Set.of("nope"), null)));
    }

    @Test
    void templatesExpandLayeredVariables() {
        ConfigVariables config = new MapConfigVariables(Map.of("Python", "/usr/bin/python3", "region", "west"));
        VariableEnvironment env = VariableEnvironment.builder(config)
                .user(List.of(
                        StepVariable.literal("region", "east"),
                        StepVariable.fromConfig("py", "Python"),
                        StepVariable.evaluated("outFile", "{scenarioDir}/{step}.log"),
                        StepVariable.literal("raw", "{scenarioDir}")
                ))
                .auto(Map.of("scenarioDir", "/tmp/s001/000/003/Tax", "scenario", "Tax"))
                .build();
        StepSet set = new StepSet().declare("model", 1, null, "{py} run.py {scenario} {region} > {outFile} # {raw}", null, false);

        RenderedStep step = scheduler.resolve(set.steps(), ExperimentRole.POLICY, env).get(0);
        Assertions.assertEquals("/usr/bin/python3 run.py Tax east > /tmp/s001/000/003/Tax/model.log # {scenarioDir}", step.command());
    }

    @Test
    void unresolvedVariablesAreConfigurationErrors() {
        VariableEnvironment env = emptyEnv();
        UnresolvedVariableException error = Assertions.assertThrows(UnresolvedVariableException.class,
                () -> env.render("run {missing}"));
        Assertions.assertEquals("missing", error.variable());

        Assertions.assertThrows(UnresolvedVariableException.class, () -> VariableEnvironment.builder(ConfigVariables.empty())
                .user(List.of(StepVariable.fromConfig("py", "Python"))));

        VariableEnvironment looping = VariableEnvironment.builder(ConfigVariables.empty())
                .user(List.of(StepVariable.evaluated("a", "{b}"), StepVariable.evaluated("b", "{a}")))
                .build();
        Assertions.assertThrows(UnresolvedVariableException.class, () -> looping.resolve("a"));
    }

    @Test
    void stepScopeParsesAliases() {
        Assertions.assertEquals(StepScope.ALL, StepScope.fromString(""));
        Assertions.assertEquals(StepScope.ALL, StepScope.fromString("both"));
        Assertions.assertEquals(StepScope.BASELINE, StepScope.fromString("baseline"));
        Assertions.assertTrue(StepScope.ALL.appliesTo(ExperimentRole.BASELINE));
        Assertions.assertFalse(StepScope.POLICY.appliesTo(ExperimentRole.BASELINE));
    }

    private static VariableEnvironment emptyEnv() {
        return VariableEnvironment.builder(ConfigVariables.empty()).build();
    }

    private static List<String> names(List<RenderedStep> steps) {
        return steps.stream().map(RenderedStep::name).toList();
    }
}
