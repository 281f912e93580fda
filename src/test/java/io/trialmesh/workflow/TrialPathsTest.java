package io.trialmesh.workflow;

import io.trialmesh.config.TrialMeshConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

final class TrialPathsTest {

    @Test
    void trialDirectoriesSplitTrialNumberIntoThousands() {
        Path root = Path.of("/srv/trialmesh");
        TrialPaths paths = new TrialPaths(new TrialMeshConfig(root, "energy"));

        Assertions.assertEquals(root.resolve("sandbox/energy/sims/s007"), paths.simDir(7));
        Assertions.assertEquals(root.resolve("sandbox/energy/sims/s007/001/234"), paths.trialDir(7, 1234));
        Assertions.assertEquals(root.resolve("sandbox/energy/sims/s007/000/005/Tax"), paths.scenarioDir(7, 5, "Tax"));
        Assertions.assertEquals(root.resolve("sandbox/energy/sims/s007/000/005/diffs"), paths.diffsDir(7, 5));
    }

    @Test
    void autoVariablesDescribeTheRun() {
        Path root = Path.of("/srv/trialmesh");
        TrialPaths paths = new TrialPaths(new TrialMeshConfig(root, "energy"));
        Map<String, String> vars = paths.autoVariables(3, 12, "Tax", "Reference");

        Assertions.assertEquals("energy", vars.get("project"));
        Assertions.assertEquals("12", vars.get("trialNum"));
        Assertions.assertEquals("Reference", vars.get("reference"));
        Assertions.assertEquals(vars.get("baseline"), vars.get("reference"));
        Assertions.assertEquals(paths.scenarioDir(3, 12, "Tax").toString(), vars.get("scenarioDir"));
        Assertions.assertEquals(paths.scenarioDir(3, 12, "Reference").toString(), vars.get("baselineDir"));
        Assertions.assertTrue(vars.containsKey("SEP"));
        Assertions.assertTrue(vars.containsKey("PSEP"));
    }
}
