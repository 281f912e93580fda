package io.trialmesh.workflow;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.model.ExperimentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns declared steps into the ordered command list for one (trial, experiment).
 */
public final class WorkflowScheduler {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowScheduler.class);

    public List<RenderedStep> resolve(List<WorkflowStep> steps, ExperimentRole role, VariableEnvironment env) {
        return resolve(steps, role, env, StepSelection.none());
    }

    public List<RenderedStep> resolve(List<WorkflowStep> steps, ExperimentRole role, VariableEnvironment env, StepSelection selection) {
        Set<String> known = new HashSet<>();
        steps.forEach(s -> known.add(s.name()));
        rejectUnknown(selection.only(), known, "selected");
        rejectUnknown(selection.skip(), known, "skipped");

        List<WorkflowStep> chosen = new ArrayList<>();
        for (WorkflowStep step : steps) {
            if (!step.scope().appliesTo(role)) {
                continue;
            }
            if (!groupMatches(step.group(), selection.scenarioGroup())) {
                continue;
            }
            boolean named = selection.only().contains(step.name());
            if (!selection.only().isEmpty() && !named) {
                continue;
            }
            if (step.optional() && !named) {
                continue;
            }
            if (selection.skip().contains(step.name())) {
                continue;
            }
            chosen.add(step);
        }
        // List.sort is stable, so equal seq keeps declaration order.
        chosen.sort(Comparator.comparingInt(WorkflowStep::seq));

        List<RenderedStep> out = new ArrayList<>(chosen.size());
        int parallelGroup = -1;
        Integer lastSeq = null;
        for (WorkflowStep step : chosen) {
            if (lastSeq == null || lastSeq != step.seq()) {
                parallelGroup++;
                lastSeq = step.seq();
            }
            String command = env.with("step", step.name()).render(step.template());
            out.add(new RenderedStep(step.name(), step.seq(), command, parallelGroup));
        }
        logger.debug("Resolved {} of {} steps for {}", out.size(), steps.size(), role);
        return out;
    }

    static boolean groupMatches(String stepGroup, String scenarioGroup) {
        if (stepGroup == null) {
            return true;
        }
        if (scenarioGroup == null) {
            return false;
        }
        if (stepGroup.equals(scenarioGroup)) {
            return true;
        }
        try {
            return Pattern.compile(stepGroup).matcher(scenarioGroup).matches();
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid step group pattern: " + stepGroup, e);
        }
    }

    private static void rejectUnknown(Set<String> names, Set<String> known, String what) {
        for (String name : names) {
            if (!known.contains(name)) {
                throw new ConfigurationException("Unknown step " + what + ": " + name);
            }
        }
    }
}
