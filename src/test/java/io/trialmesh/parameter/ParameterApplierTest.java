package io.trialmesh.parameter;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.sampling.DistributionSpec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

final class ParameterApplierTest {

    @Test
    void builtinOperatorsCombineWithBaseValue() {
        ParameterApplier applier = new ParameterApplier(new ApplyFunctionRegistry());
        ParameterDef def = ParameterDef.shared("p", DistributionSpec.constant(0.0));

        Assertions.assertEquals(3.0, applier.realize(def.applying("direct"), 3.0, 10.0));
        Assertions.assertEquals(3.0, applier.realize(def.applying("replace"), 3.0, 10.0));
        Assertions.assertEquals(13.0, applier.realize(def.applying("add"), 3.0, 10.0));
        Assertions.assertEquals(30.0, applier.realize(def.applying("mult"), 3.0, 10.0));
        Assertions.assertEquals(30.0, applier.realize(def.applying("MULTIPLY"), 3.0, 10.0));
    }

    @Test
    void missingBaseUsesIdentityElement() {
        ParameterApplier applier = new ParameterApplier(new ApplyFunctionRegistry());
        ParameterDef def = ParameterDef.shared("p", DistributionSpec.constant(0.0));
        Assertions.assertEquals(3.0, applier.realize(def.applying("add"), 3.0, OptionalDouble.empty()));
        Assertions.assertEquals(3.0, applier.realize(def.applying("mult"), 3.0, OptionalDouble.empty()));
    }

    @Test
    void combinedValueIsClampedToBounds() {
        ParameterApplier applier = new ParameterApplier(new ApplyFunctionRegistry());
        ParameterDef def = ParameterDef.shared("p", DistributionSpec.constant(0.0)).applying("mult").bounded(0.0, 1.0);
        Assertions.assertEquals(1.0, applier.realize(def, 2.0, 0.8));
        Assertions.assertEquals(0.0, applier.realize(def, -2.0, 0.8));
        Assertions.assertEquals(0.4, applier.realize(def, 0.5, 0.8), 1e-12);
    }

    @Test
    void customFunctionsAreLookedUpByName() {
        ApplyFunctionRegistry registry = new ApplyFunctionRegistry();
        registry.register("dir", (name, draw, base) -> draw >= 0.5 ? base : -base);
        ParameterApplier applier = new ParameterApplier(registry);
        ParameterDef def = ParameterDef.shared("p", DistributionSpec.constant(0.0)).applying("dir");
        Assertions.assertEquals(4.0, applier.realize(def, 0.7, 4.0));
        Assertions.assertEquals(-4.0, applier.realize(def, 0.2, 4.0));
        Assertions.assertEquals(ApplyOperator.Kind.CUSTOM, applier.validate(def).kind());

        ParameterDef unknown = def.applying("unknown");
        Assertions.assertThrows(ConfigurationException.class, () -> applier.validate(unknown));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register("add", (n, d, b) -> d));
    }

    @Test
    void boundsMustBeOrdered() {
        Assertions.assertThrows(ConfigurationException.class,
                () -> ParameterDef.shared("p", DistributionSpec.constant(0.0)).bounded(2.0, 1.0));
    }
}
