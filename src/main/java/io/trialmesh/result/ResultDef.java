package io.trialmesh.result;

import io.trialmesh.config.ConfigurationException;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * A named value extracted from a model query-result table.
 *
 * <p>With {@code column} set the first matching row's cell is the value; otherwise the year
 * columns of all matching rows are summed into a per-year series, optionally collapsed into
 * one {@code cumulative} value.
 */
public record ResultDef(
        String name,
        ResultType type,
        boolean percentage,
        boolean cumulative,
        String file,
        String column,
        List<Constraint> constraints,
        String description
) {
    public ResultDef {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Result name cannot be empty");
        }
        name = name.trim();
        type = type == null ? ResultType.SCENARIO : type;
        if (file == null || file.isBlank()) {
            throw new ConfigurationException("Result '" + name + "' needs a query-result file");
        }
        file = file.trim();
        if (Path.of(file).isAbsolute() || file.contains("..")) {
            throw new ConfigurationException("Result '" + name + "' file must be a relative name: " + file);
        }
        if (percentage && type != ResultType.DIFF) {
            throw new ConfigurationException("Result '" + name + "' can only be a percentage when its type is diff");
        }
        column = column == null || column.isBlank() ? null : column.trim();
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public static ResultDef scenario(String name, String file) {
        return new ResultDef(name, ResultType.SCENARIO, false, false, file, null, List.of(), null);
    }

    public static ResultDef diff(String name, String file) {
        return new ResultDef(name, ResultType.DIFF, false, false, file, null, List.of(), null);
    }

    public ResultDef withColumn(String value) {
        return new ResultDef(name, type, percentage, cumulative, file, value, constraints, description);
    }

    public ResultDef withConstraints(List<Constraint> value) {
        return new ResultDef(name, type, percentage, cumulative, file, column, value, description);
    }

    public ResultDef asCumulative() {
        return new ResultDef(name, type, percentage, true, file, column, constraints, description);
    }

    public ResultDef asPercentage() {
        return new ResultDef(name, type, true, cumulative, file, column, constraints, description);
    }

    /**
     * Table file name for one scenario; names ending in {@code .csv} are used as given.
     */
    public String fileFor(String scenario) {
        if (file.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return file;
        }
        return file + "-" + scenario + ".csv";
    }
}
