package com.example.d20sim.sim;

/**
 * Invalid simulation input, reported before any day is run.
 */
public class ConfigurationException extends IllegalArgumentException {
    
    public ConfigurationException(String message) {
        super(message);
    }
    
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
