package com.fsnow.indexadvisor.exception;

/**
 * Thrown when a run is interrupted or exceeds its estimation timeout.
 */
public class AdvisorCancelledException extends IndexAdvisorException {
    
    public AdvisorCancelledException(String message) {
        super(message);
    }
    
    public AdvisorCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
