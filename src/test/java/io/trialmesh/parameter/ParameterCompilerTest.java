package io.trialmesh.parameter;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.sampling.DistributionKind;
import io.trialmesh.sampling.DistributionSampler;
import io.trialmesh.sampling.DistributionSpec;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ParameterCompilerTest {
    private static final List<String> EXPERIMENTS = List.of("Reference", "Policy");

    private final ParameterCompiler compiler = new ParameterCompiler(
            new DistributionSampler(), new ParameterApplier(new ApplyFunctionRegistry()));

    @Test
    void sameSeedReproducesEveryDraw() {
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.shared("growth", DistributionSpec.uniform(0.0, 1.0)),
                ParameterDef.independent("price", DistributionSpec.normal(10.0, 2.0))
        ), 1234L);
        CompiledParameters first = compiler.compile(set, EXPERIMENTS, 25);
        CompiledParameters second = compiler.compile(set, EXPERIMENTS, 25);
        Assertions.assertEquals(first.rows(), second.rows());

        CompiledParameters other = compiler.compile(new ParameterSet(set.parameters(), 99L), EXPERIMENTS, 25);
        Assertions.assertNotEquals(first.rows(), other.rows());
    }

    @Test
    void addingParameterDoesNotShiftExistingColumns() {
        ParameterDef growth = ParameterDef.shared("growth", DistributionSpec.uniform(0.0, 1.0));
        CompiledParameters alone = compiler.compile(new ParameterSet(List.of(growth), 5L), EXPERIMENTS, 10);
        CompiledParameters extended = compiler.compile(new ParameterSet(List.of(
                ParameterDef.shared("cost", DistributionSpec.uniform(5.0, 6.0)), growth), 5L), EXPERIMENTS, 10);
        for (int t = 0; t < 10; t++) {
            Assertions.assertEquals(alone.value("growth", t, null), extended.value("growth", t, null));
        }
    }

    @Test
    void sharedDrawsMatchAcrossExperimentsAndIndependentDoNot() {
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.shared("growth", DistributionSpec.uniform(0.0, 1.0)),
                ParameterDef.independent("price", DistributionSpec.uniform(0.0, 1.0))
        ), 7L);
        CompiledParameters compiled = compiler.compile(set, EXPERIMENTS, 20);
        int differing = 0;
        for (int t = 0; t < 20; t++) {
            Assertions.assertEquals(compiled.valuesFor(t, "Reference").get("growth"), compiled.valuesFor(t, "Policy").get("growth"));
            if (compiled.value("price", t, "Reference") != compiled.value("price", t, "Policy")) {
                differing++;
            }
        }
        Assertions.assertTrue(differing > 15, "independent draws should differ per experiment");

        long sharedRows = compiled.rows().stream().filter(r -> r.experiment() == null).count();
        long independentRows = compiled.rows().stream().filter(r -> r.experiment() != null).count();
        Assertions.assertEquals(20, sharedRows);
        Assertions.assertEquals(40, independentRows);
    }

    @Test
    void stratifiedDrawsCoverEveryStratum() {
        ParameterSet set = new ParameterSet(List.of(ParameterDef.shared("u", DistributionSpec.uniform(0.0, 1.0))), 3L);
        CompiledParameters compiled = compiler.compile(set, EXPERIMENTS, 10);
        boolean[] seen = new boolean[10];
        for (int t = 0; t < 10; t++) {
            seen[(int) Math.floor(compiled.value("u", t, null) * 10)] = true;
        }
        for (boolean s : seen) {
            Assertions.assertTrue(s);
        }
    }

    @Test
    void linkedParametersCopyTheirTargetAfterResolution() {
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.shared("copy", DistributionSpec.linked("growth")),
                ParameterDef.shared("growth", DistributionSpec.triangle(1.0, 2.0, 3.0))
        ), 11L);
        CompiledParameters compiled = compiler.compile(set, EXPERIMENTS, 8);
        Assertions.assertEquals("growth", compiled.parameters().get(0).name());
        for (int t = 0; t < 8; t++) {
            Assertions.assertEquals(compiled.value("growth", t, null), compiled.value("copy", t, null));
        }
    }

    @Test
    void cyclicLinksAreReportedWithTheCycle() {
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.shared("a", DistributionSpec.linked("b")),
                ParameterDef.shared("b", DistributionSpec.linked("a"))
        ), 1L);
        CyclicLinkException error = Assertions.assertThrows(CyclicLinkException.class, () -> compiler.compile(set, EXPERIMENTS, 3));
        Assertions.assertTrue(error.cycle().containsAll(List.of("a", "b")));
    }

    @Test
    void sharedParameterCannotLinkToIndependentOne() {
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.independent("base", DistributionSpec.uniform(0.0, 1.0)),
                ParameterDef.shared("copy", DistributionSpec.linked("base"))
        ), 1L);
        Assertions.assertThrows(ConfigurationException.class, () -> compiler.compile(set, EXPERIMENTS, 3));
    }

    @Test
    void unknownApplyOperatorFailsBeforeDrawing() {
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.shared("growth", DistributionSpec.uniform(0.0, 1.0)).applying("squash")
        ), 1L);
        ConfigurationException error = Assertions.assertThrows(ConfigurationException.class, () -> compiler.compile(set, EXPERIMENTS, 3));
        Assertions.assertTrue(error.getMessage().contains("squash"));
    }

    @Test
    void inactiveParametersAreIgnored() {
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.shared("on", DistributionSpec.constant(1.0)),
                ParameterDef.shared("off", DistributionSpec.of(DistributionKind.UNIFORM, "bogus", 1)).inactive()
        ), 1L);
        CompiledParameters compiled = compiler.compile(set, EXPERIMENTS, 2);
        Assertions.assertEquals(List.of("on"), compiled.parameters().stream().map(ParameterDef::name).toList());
    }

    @Test
    void correlatedParametersFollowTargetRankCorrelation() {
        int trials = 300;
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.shared("x", DistributionSpec.uniform(0.0, 1.0)).correlatedWith("y", 0.8),
                ParameterDef.shared("y", DistributionSpec.normal(0.0, 1.0))
        ), 21L);
        CompiledParameters compiled = compiler.compile(set, EXPERIMENTS, trials);
        double[] x = new double[trials];
        double[] y = new double[trials];
        for (int t = 0; t < trials; t++) {
            x[t] = compiled.value("x", t, null);
            y[t] = compiled.value("y", t, null);
        }
        Assertions.assertEquals(0.8, new SpearmansCorrelation().correlation(x, y), 0.1);
    }

    @Test
    void correlationAcrossDrawModesIsRejected() {
        ParameterSet set = new ParameterSet(List.of(
                ParameterDef.shared("x", DistributionSpec.uniform(0.0, 1.0)).correlatedWith("y", 0.5),
                ParameterDef.independent("y", DistributionSpec.uniform(0.0, 1.0))
        ), 1L);
        Assertions.assertThrows(ConfigurationException.class, () -> compiler.compile(set, EXPERIMENTS, 5));
    }

    @Test
    void rejectsBadTrialCountsAndDuplicates() {
        ParameterSet set = new ParameterSet(List.of(ParameterDef.shared("x", DistributionSpec.constant(1.0))), 1L);
        Assertions.assertThrows(ConfigurationException.class, () -> compiler.compile(set, EXPERIMENTS, 0));
        Assertions.assertThrows(ConfigurationException.class, () -> compiler.compile(set, List.of("A", "A"), 1));
        ParameterSet duplicated = new ParameterSet(List.of(
                ParameterDef.shared("x", DistributionSpec.constant(1.0)),
                ParameterDef.shared("x", DistributionSpec.constant(2.0))
        ), 1L);
        Assertions.assertThrows(ConfigurationException.class, () -> compiler.compile(duplicated, EXPERIMENTS, 1));
    }
}
