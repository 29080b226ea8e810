package com.fsnow.indexadvisor.exception;

/**
 * Raised while normalizing a query whose shape the advisor does not handle.
 * The normalizer turns it into an unsupported query; it never escapes a run.
 */
public class UnsupportedQueryException extends IndexAdvisorException {
    
    public UnsupportedQueryException(String message) {
        super(message);
    }
}
