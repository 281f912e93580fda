package io.trialmesh.result;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * A model query-result file: a title line, a header line, then data rows. Header names that
 * are four-digit years are year columns.
 */
public final class QueryResultTable {
    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final String title;
    private final List<String> header;
    private final List<Map<String, String>> rows;

    QueryResultTable(String title, List<String> header, List<Map<String, String>> rows) {
        this.title = title;
        this.header = List.copyOf(header);
        this.rows = List.copyOf(rows);
    }

    public static QueryResultTable read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String title = reader.readLine();
            if (title == null) {
                throw new IOException("Empty query-result file: " + file);
            }
            try (CSVParser parser = FORMAT.parse(reader)) {
                List<String> header = parser.getHeaderNames();
                List<Map<String, String>> rows = new ArrayList<>();
                for (CSVRecord record : parser) {
                    Map<String, String> row = new LinkedHashMap<>();
                    for (int i = 0; i < header.size() && i < record.size(); i++) {
                        row.put(header.get(i), record.get(i));
                    }
                    rows.add(row);
                }
                return new QueryResultTable(title.strip(), header, rows);
            } catch (UncheckedIOException e) {
                // Record iteration reports parse errors unchecked.
                throw new IOException("Malformed query-result file " + file + ": " + e.getCause().getMessage(), e.getCause());
            } catch (IllegalArgumentException e) {
                throw new IOException("Malformed query-result header in " + file + ": " + e.getMessage(), e);
            }
        }
    }

    public String title() {
        return title;
    }

    public List<String> header() {
        return header;
    }

    public List<Map<String, String>> rows() {
        return rows;
    }

    public List<Integer> yearColumns(int startYear, int endYear) {
        List<Integer> years = new ArrayList<>();
        for (String name : header) {
            if (YEAR.matcher(name).matches()) {
                int year = Integer.parseInt(name);
                if (year >= startYear && year <= endYear) {
                    years.add(year);
                }
            }
        }
        return years;
    }

    public List<Map<String, String>> select(List<Constraint> constraints) {
        List<Map<String, String>> out = new ArrayList<>();
        for (Map<String, String> row : rows) {
            if (constraints.stream().allMatch(c -> c.matches(row))) {
                out.add(row);
            }
        }
        return out;
    }

    /**
     * Sum of each in-range year column across {@code selected}; empty when no year column
     * falls in range.
     */
    public SortedMap<Integer, Double> sumYears(List<Map<String, String>> selected, int startYear, int endYear) {
        SortedMap<Integer, Double> out = new TreeMap<>();
        for (int year : yearColumns(startYear, endYear)) {
            double sum = 0.0;
            for (Map<String, String> row : selected) {
                OptionalDouble v = parseNumber(row.get(Integer.toString(year)));
                if (v.isPresent()) {
                    sum += v.getAsDouble();
                }
            }
            out.put(year, sum);
        }
        return out;
    }

    static OptionalDouble parseNumber(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
