package io.trialmesh.dispatch;

import io.trialmesh.parameter.BaseValueSource;
import io.trialmesh.parameter.ParameterDef;
import io.trialmesh.result.ResultDef;
import io.trialmesh.workflow.StepSelection;
import io.trialmesh.workflow.StepVariable;
import io.trialmesh.workflow.WorkflowStep;

import java.util.List;

/**
 * Everything a worker needs to execute any run of one simulation.
 */
public record SimulationPlan(
        long simId,
        String baseline,
        List<ParameterDef> parameters,
        List<WorkflowStep> steps,
        List<StepVariable> variables,
        List<ResultDef> results,
        StepSelection selection,
        BaseValueSource baseValues
) {
    public SimulationPlan {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        steps = steps == null ? List.of() : List.copyOf(steps);
        variables = variables == null ? List.of() : List.copyOf(variables);
        results = results == null ? List.of() : List.copyOf(results);
        selection = selection == null ? StepSelection.none() : selection;
        baseValues = baseValues == null ? BaseValueSource.NONE : baseValues;
    }
}
