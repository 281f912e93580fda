package io.trialmesh.workflow;

import io.trialmesh.config.ConfigurationException;

/**
 * One declared step. Identity is (name, seq, scope); {@code group} restricts the step to
 * matching scenario groups and {@code optional} steps run only when selected by name.
 */
public record WorkflowStep(
        String name,
        int seq,
        StepScope scope,
        String template,
        String group,
        boolean optional
) {
    public WorkflowStep {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Workflow step name cannot be empty");
        }
        name = name.trim();
        scope = scope == null ? StepScope.ALL : scope;
        template = template == null ? "" : template;
        group = group == null || group.isBlank() ? null : group.trim();
    }

    public boolean sameIdentity(String otherName, int otherSeq, StepScope otherScope) {
        return name.equals(otherName) && seq == otherSeq && scope == otherScope;
    }
}
