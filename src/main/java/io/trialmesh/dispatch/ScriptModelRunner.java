package io.trialmesh.dispatch;

import io.trialmesh.workflow.RenderedStep;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Runs each step's command with {@code sh -c} inside the run's scenario directory.
 */
public final class ScriptModelRunner implements ModelRunner {
    @Override
    public ModelResult run(RunContext context, RenderedStep step, long timeoutMs) throws IOException, InterruptedException {
        if (step.command().isBlank()) {
            return ModelResult.ok("");
        }
        Files.createDirectories(context.scenarioDir());
        ShellCommand.Outcome outcome;
        try {
            outcome = ShellCommand.run(step.command(), context.scenarioDir(), timeoutMs);
        } catch (IOException e) {
            return ModelResult.fail(-1, "step '" + step.name() + "' spawn failed: " + e.getMessage());
        }
        if (outcome.ok()) {
            return ModelResult.ok(outcome.output().strip());
        }
        return ModelResult.fail(outcome.exitCode(), "step '" + step.name() + "' " + outcome.describe());
    }
}
