package io.trialmesh.sampling;

import io.trialmesh.config.ConfigurationException;

public class DistributionSpecException extends ConfigurationException {
    public DistributionSpecException(String message) {
        super(message);
    }

    public DistributionSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
