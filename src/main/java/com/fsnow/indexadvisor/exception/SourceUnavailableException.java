package com.fsnow.indexadvisor.exception;

/**
 * Thrown when the workload source or the sample source cannot be reached at all.
 * Aborts the whole advisory run.
 */
public class SourceUnavailableException extends IndexAdvisorException {
    
    public SourceUnavailableException(String message) {
        super(message);
    }
    
    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
