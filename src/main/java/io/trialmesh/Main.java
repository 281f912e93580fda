package io.trialmesh;

import io.trialmesh.cli.TrialMeshCommand;
import io.trialmesh.config.ConfigurationException;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        CommandLine cli = new CommandLine(new TrialMeshCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof ConfigurationException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            }
            throw ex;
        });
        System.exit(cli.execute(args));
    }
}
