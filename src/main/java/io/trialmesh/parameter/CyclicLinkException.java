package io.trialmesh.parameter;

import io.trialmesh.config.ConfigurationException;

import java.util.List;

public class CyclicLinkException extends ConfigurationException {
    private final List<String> cycle;

    public CyclicLinkException(List<String> cycle) {
        super("Cyclic parameter links: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
