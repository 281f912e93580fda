package io.trialmesh.dispatch;

import io.trialmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes realized values to {@code trial-inputs.json} in the scenario directory.
 */
public final class JsonTrialInputWriter implements TrialInputWriter {
    public static final String FILE_NAME = "trial-inputs.json";

    @Override
    public void write(RunContext context, Map<String, Double> values) throws IOException {
        Files.createDirectories(context.scenarioDir());
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("simId", context.simId());
        doc.put("runId", context.runId());
        doc.put("trialNum", context.trialNum());
        doc.put("experiment", context.experiment());
        doc.put("values", new TreeMap<>(values));
        Path target = context.scenarioDir().resolve(FILE_NAME);
        Files.writeString(target, Jsons.toJson(doc), StandardCharsets.UTF_8);
    }
}
