package com.github.dimitryivaniuta.governance.core;

/**
 * Raised while building the static governance tables. Fails application startup.
 */
public class GovernanceConfigurationException extends RuntimeException {

    public GovernanceConfigurationException(String message) {
        super(message);
    }
}
