package com.example.d20sim.data;

/**
 * A bundled data resource is missing or malformed.
 */
public class DataLoadException extends RuntimeException {
    
    public DataLoadException(String message) {
        super(message);
    }
    
    public DataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
