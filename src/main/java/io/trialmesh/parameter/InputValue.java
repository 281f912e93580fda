package io.trialmesh.parameter;

/**
 * A parameter's draw for one trial. {@code experiment} is null for shared parameters.
 */
public record InputValue(String parameter, int trialNum, String experiment, double value) {
}
