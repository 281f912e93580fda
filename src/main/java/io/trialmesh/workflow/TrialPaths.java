package io.trialmesh.workflow;

import io.trialmesh.config.TrialMeshConfig;

import java.io.File;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Sandbox layout: {@code sims/s{simId}/{trial/1000}/{trial%1000}/{scenario}}, three digits
 * per level, so no directory holds more than a thousand trials.
 */
public final class TrialPaths {
    public static final String DIFFS_DIR = "diffs";

    private final TrialMeshConfig config;

    public TrialPaths(TrialMeshConfig config) {
        this.config = config;
    }

    public Path simDir(long simId) {
        return config.sandboxDir().resolve("sims").resolve(String.format(Locale.ROOT, "s%03d", simId));
    }

    public Path trialDir(long simId, int trialNum) {
        return simDir(simId)
                .resolve(String.format(Locale.ROOT, "%03d", trialNum / 1000))
                .resolve(String.format(Locale.ROOT, "%03d", trialNum % 1000));
    }

    public Path scenarioDir(long simId, int trialNum, String scenario) {
        return trialDir(simId, trialNum).resolve(scenario);
    }

    public Path diffsDir(long simId, int trialNum) {
        return trialDir(simId, trialNum).resolve(DIFFS_DIR);
    }

    /**
     * Automatic variables for one (trial, scenario). {@code reference} is kept as an alias of
     * {@code baseline}.
     */
    public Map<String, String> autoVariables(long simId, int trialNum, String scenario, String baseline) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("project", config.project());
        vars.put("simId", Long.toString(simId));
        vars.put("trialNum", Integer.toString(trialNum));
        vars.put("scenario", scenario);
        vars.put("baseline", baseline);
        vars.put("reference", baseline);
        vars.put("sandboxDir", config.sandboxDir().toString());
        vars.put("simDir", simDir(simId).toString());
        vars.put("trialDir", trialDir(simId, trialNum).toString());
        vars.put("scenarioDir", scenarioDir(simId, trialNum, scenario).toString());
        vars.put("baselineDir", scenarioDir(simId, trialNum, baseline).toString());
        vars.put("diffsDir", diffsDir(simId, trialNum).toString());
        vars.put("batchDir", config.batchDir().toString());
        vars.put("SEP", File.separator);
        vars.put("PSEP", File.pathSeparator);
        return vars;
    }
}
