package io.trialmesh.workflow;

import io.trialmesh.config.ConfigurationException;

public class UnresolvedVariableException extends ConfigurationException {
    private final String variable;

    public UnresolvedVariableException(String variable, String message) {
        super(message);
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
