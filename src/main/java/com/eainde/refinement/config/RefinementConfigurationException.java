package com.eainde.refinement.config;

/**
 * Malformed input or configuration. The only failure the refinement loop
 * surfaces to its caller; it is always raised before the first iteration.
 */
public class RefinementConfigurationException extends RuntimeException {

    public RefinementConfigurationException(String message) {
        super(message);
    }

    public RefinementConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
