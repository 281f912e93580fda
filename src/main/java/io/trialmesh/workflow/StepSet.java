package io.trialmesh.workflow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered step declarations. Later declarations override earlier ones with the same
 * identity: a non-empty template replaces the step in place, an empty one deletes it.
 */
public final class StepSet {
    private final List<WorkflowStep> steps = new ArrayList<>();
    private int maxSeq;

    public StepSet declare(String name, Integer seq, StepScope scope, String template, String group, boolean optional) {
        int resolvedSeq = seq == null ? maxSeq + 1 : seq;
        maxSeq = Math.max(maxSeq, resolvedSeq);
        StepScope resolvedScope = scope == null ? StepScope.ALL : scope;
        String trimmedName = name == null ? null : name.trim();
        boolean delete = template == null || template.isBlank();
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).sameIdentity(trimmedName, resolvedSeq, resolvedScope)) {
                if (delete) {
                    steps.remove(i);
                } else {
                    steps.set(i, new WorkflowStep(trimmedName, resolvedSeq, resolvedScope, template, group, optional));
                }
                return this;
            }
        }
        if (!delete) {
            steps.add(new WorkflowStep(trimmedName, resolvedSeq, resolvedScope, template, group, optional));
        }
        return this;
    }

    public StepSet declare(WorkflowStep step) {
        return declare(step.name(), step.seq(), step.scope(), step.template(), step.group(), step.optional());
    }

    public List<WorkflowStep> steps() {
        return List.copyOf(steps);
    }

    public Set<String> names() {
        Set<String> out = new LinkedHashSet<>();
        steps.forEach(s -> out.add(s.name()));
        return out;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
