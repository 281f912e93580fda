package io.trialmesh.runtime;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.trialmesh.config.ConfigurationException;
import io.trialmesh.model.ExperimentDef;
import io.trialmesh.model.ExperimentRole;
import io.trialmesh.parameter.BaseValueSource;
import io.trialmesh.parameter.Correlation;
import io.trialmesh.parameter.DrawMode;
import io.trialmesh.parameter.ParameterDef;
import io.trialmesh.result.Constraint;
import io.trialmesh.result.ResultDef;
import io.trialmesh.result.ResultType;
import io.trialmesh.sampling.DistributionSpec;
import io.trialmesh.util.Jsons;
import io.trialmesh.workflow.StepScope;
import io.trialmesh.workflow.StepSelection;
import io.trialmesh.workflow.StepSet;
import io.trialmesh.workflow.StepVariable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON form of a simulation: experiments, parameters, results and workflow.
 */
public record SimulationDefinition(
        String name,
        Integer trials,
        Long seed,
        String description,
        String scenarioGroup,
        List<ExperimentEntry> experiments,
        List<ParameterEntry> parameters,
        List<ResultEntry> results,
        WorkflowEntry workflow,
        Map<String, Double> baseValues
) {
    public static final long DEFAULT_SEED = 0L;

    public SimulationDefinition {
        experiments = experiments == null ? List.of() : List.copyOf(experiments);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        results = results == null ? List.of() : List.copyOf(results);
        workflow = workflow == null ? new WorkflowEntry(List.of(), List.of(), List.of(), List.of(), List.of()) : workflow;
        baseValues = baseValues == null ? Map.of() : Map.copyOf(baseValues);
    }

    public static SimulationDefinition read(Path file) {
        try {
            return Jsons.mapper().readValue(file.toFile(), SimulationDefinition.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read simulation definition " + file + ": " + e.getMessage(), e);
        }
    }

    public static SimulationDefinition parse(String json) {
        try {
            return Jsons.mapper().readValue(json, SimulationDefinition.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid simulation definition: " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return Jsons.toCompactJson(this);
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Simulation name is required");
        }
        if (trials == null || trials < 1) {
            throw new ConfigurationException("Simulation '" + name + "' needs trials >= 1");
        }
        if (experiments.isEmpty()) {
            throw new ConfigurationException("Simulation '" + name + "' declares no experiments");
        }
        baselineName();
        toResults();
        toStepSet();
        toVariables();
    }

    public long seedOrDefault() {
        return seed == null ? DEFAULT_SEED : seed;
    }

    public List<ExperimentDef> toExperiments() {
        List<ExperimentDef> out = new ArrayList<>(experiments.size());
        for (ExperimentEntry e : experiments) {
            out.add(new ExperimentDef(e.name(), ExperimentRole.fromString(e.role()), e.description()));
        }
        return out;
    }

    public String baselineName() {
        return toExperiments().stream()
                .filter(e -> e.role() == ExperimentRole.BASELINE)
                .map(ExperimentDef::name)
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Simulation '" + name + "' has no baseline experiment"));
    }

    public List<ParameterDef> toParameters() {
        List<ParameterDef> out = new ArrayList<>(parameters.size());
        for (ParameterEntry p : parameters) {
            if (p.distribution() == null) {
                throw new ConfigurationException("Parameter '" + p.name() + "' has no distribution");
            }
            List<Correlation> correlations = new ArrayList<>();
            for (CorrelationEntry c : p.correlations() == null ? List.<CorrelationEntry>of() : p.correlations()) {
                correlations.add(new Correlation(c.with(), c.coefficient()));
            }
            out.add(new ParameterDef(
                    p.name(),
                    DistributionSpec.fromMap(p.distribution()),
                    DrawMode.fromString(p.mode()),
                    p.lowBound(),
                    p.highBound(),
                    p.apply(),
                    correlations,
                    p.active() == null || p.active()
            ));
        }
        return out;
    }

    public List<ResultDef> toResults() {
        List<ResultDef> out = new ArrayList<>(results.size());
        for (ResultEntry r : results) {
            List<Constraint> constraints = new ArrayList<>();
            for (ConstraintEntry c : r.constraints() == null ? List.<ConstraintEntry>of() : r.constraints()) {
                constraints.add(Constraint.parse(c.column(), c.op(), c.value()));
            }
            out.add(new ResultDef(
                    r.name(),
                    ResultType.fromString(r.type()),
                    Boolean.TRUE.equals(r.percentage()),
                    Boolean.TRUE.equals(r.cumulative()),
                    r.file(),
                    r.column(),
                    constraints,
                    r.description()
            ));
        }
        return out;
    }

    /**
     * Defaults first, then the simulation's own steps, so the latter override the former.
     */
    public StepSet toStepSet() {
        StepSet set = new StepSet();
        for (StepEntry s : workflow.defaults()) {
            declare(set, s);
        }
        for (StepEntry s : workflow.steps()) {
            declare(set, s);
        }
        return set;
    }

    private static void declare(StepSet set, StepEntry s) {
        set.declare(s.name(), s.seq(), StepScope.fromString(s.runFor()), s.command(), s.group(), Boolean.TRUE.equals(s.optional()));
    }

    public List<StepVariable> toVariables() {
        List<StepVariable> out = new ArrayList<>(workflow.vars().size());
        for (VariableEntry v : workflow.vars()) {
            out.add(new StepVariable(v.name(), v.value(), Boolean.TRUE.equals(v.configVar()), Boolean.TRUE.equals(v.eval())));
        }
        return out;
    }

    public StepSelection toSelection() {
        return new StepSelection(
                Set.copyOf(workflow.only()),
                Set.copyOf(workflow.skip()),
                scenarioGroup
        );
    }

    public BaseValueSource toBaseValues() {
        return baseValues.isEmpty() ? BaseValueSource.NONE : BaseValueSource.of(baseValues);
    }

    public record ExperimentEntry(String name, String role, String description) {
    }

    public record ParameterEntry(
            String name,
            String mode,
            Boolean active,
            String apply,
            @JsonAlias("lowbound") Double lowBound,
            @JsonAlias("highbound") Double highBound,
            Map<String, Object> distribution,
            List<CorrelationEntry> correlations
    ) {
    }

    public record CorrelationEntry(String with, double coefficient) {
    }

    public record ResultEntry(
            String name,
            String type,
            Boolean percentage,
            Boolean cumulative,
            String file,
            String column,
            List<ConstraintEntry> constraints,
            String description
    ) {
    }

    public record ConstraintEntry(String column, String op, String value) {
    }

    public record WorkflowEntry(
            List<VariableEntry> vars,
            List<StepEntry> defaults,
            List<StepEntry> steps,
            List<String> only,
            List<String> skip
    ) {
        public WorkflowEntry {
            vars = vars == null ? List.of() : List.copyOf(vars);
            defaults = defaults == null ? List.of() : List.copyOf(defaults);
            steps = steps == null ? List.of() : List.copyOf(steps);
            only = only == null ? List.of() : List.copyOf(only);
            skip = skip == null ? List.of() : List.copyOf(skip);
        }
    }

    public record VariableEntry(String name, String value, Boolean configVar, Boolean eval) {
    }

    public record StepEntry(String name, Integer seq, String runFor, String group, Boolean optional, String command) {
    }
}
