package com.fsnow.indexadvisor.exception;

/**
 * Base exception for all MongoDB Index Advisor errors.
 */
public class IndexAdvisorException extends RuntimeException {
    
    public IndexAdvisorException(String message) {
        super(message);
    }
    
    public IndexAdvisorException(String message, Throwable cause) {
        super(message, cause);
    }
}
