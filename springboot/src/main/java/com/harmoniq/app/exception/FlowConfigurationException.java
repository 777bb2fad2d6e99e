package com.harmoniq.app.exception;

/**
 * Invalid flow configuration (period list, thresholds). Fatal for the cycle that hits it.
 */
public class FlowConfigurationException extends RuntimeException {

    public FlowConfigurationException(String message) {
        super(message);
    }
}
