package io.trialmesh.workflow;

import java.util.Set;

/**
 * Explicit step choices for one resolution: {@code only} (empty means every step),
 * {@code skip}, and the scenario group matched against step groups.
 */
public record StepSelection(Set<String> only, Set<String> skip, String scenarioGroup) {
    public StepSelection {
        only = only == null ? Set.of() : Set.copyOf(only);
        skip = skip == null ? Set.of() : Set.copyOf(skip);
        scenarioGroup = scenarioGroup == null || scenarioGroup.isBlank() ? null : scenarioGroup.trim();
    }

    public static StepSelection none() {
        return new StepSelection(Set.of(), Set.of(), null);
    }

    public static StepSelection group(String scenarioGroup) {
        return new StepSelection(Set.of(), Set.of(), scenarioGroup);
    }
}
