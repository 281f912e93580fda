package io.trialmesh.parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class CompiledParameters {
    private final List<ParameterDef> order;
    private final List<String> experiments;
    private final int trialCount;
    private final Map<String, double[]> columns;
    private final Map<String, ParameterDef> byName;

    CompiledParameters(List<ParameterDef> order, List<String> experiments, int trialCount, Map<String, double[]> columns) {
        this.order = List.copyOf(order);
        this.experiments = List.copyOf(experiments);
        this.trialCount = trialCount;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        Map<String, ParameterDef> index = new LinkedHashMap<>();
        for (ParameterDef def : order) {
            index.put(def.name(), def);
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * Active parameters in resolution order (link targets before their dependents).
     */
    public List<ParameterDef> parameters() {
        return order;
    }

    public int trialCount() {
        return trialCount;
    }

    public double value(String parameter, int trialNum, String experiment) {
        ParameterDef def = byName.get(parameter);
        if (def == null) {
            throw new IllegalArgumentException("Unknown parameter: " + parameter);
        }
        double[] column = columns.get(columnKey(def, experiment));
        if (column == null) {
            throw new IllegalArgumentException("No draws for parameter '" + parameter + "' in experiment " + experiment);
        }
        return column[trialNum];
    }

    public Map<String, Double> valuesFor(int trialNum, String experiment) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (ParameterDef def : order) {
            out.put(def.name(), value(def.name(), trialNum, experiment));
        }
        return out;
    }

    /**
     * Input-value rows: shared parameters once per trial, independent ones once per
     * (trial, experiment).
     */
    public List<InputValue> rows() {
        List<InputValue> out = new ArrayList<>();
        for (ParameterDef def : order) {
            if (def.mode() == DrawMode.SHARED) {
                double[] column = columns.get(def.name());
                for (int t = 0; t < trialCount; t++) {
                    out.add(new InputValue(def.name(), t, null, column[t]));
                }
                continue;
            }
            for (String experiment : experiments) {
                double[] column = columns.get(columnKey(def, experiment));
                for (int t = 0; t < trialCount; t++) {
                    out.add(new InputValue(def.name(), t, experiment, column[t]));
                }
            }
        }
        return out;
    }

    static String columnKey(ParameterDef def, String experiment) {
        return def.mode() == DrawMode.SHARED ? def.name() : def.name() + "@" + experiment;
    }
}
