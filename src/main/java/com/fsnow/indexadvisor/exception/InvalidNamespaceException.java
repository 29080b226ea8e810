package com.fsnow.indexadvisor.exception;

/**
 * Thrown when a namespace is not of the form {@code database.collection}.
 */
public class InvalidNamespaceException extends IndexAdvisorException {
    
    private final String namespace;
    
    public InvalidNamespaceException(String namespace) {
        super(String.format("Invalid namespace '%s', expected database.collection", namespace));
        this.namespace = namespace;
    }
    
    public String getNamespace() {
        return namespace;
    }
}
