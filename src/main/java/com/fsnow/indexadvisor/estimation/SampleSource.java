package com.fsnow.indexadvisor.estimation;

import com.fsnow.indexadvisor.model.Predicate;

import java.util.List;

/**
 * Read access to the data sample used for selectivity estimation.
 * Implementations must be safe for concurrent use; the estimator issues many independent calls.
 */
public interface SampleSource {
    
    /**
     * Total number of documents in the sample.
     * 
     * @throws com.fsnow.indexadvisor.exception.SourceUnavailableException if the sample cannot be reached
     */
    long count();
    
    /**
     * Counts the sample documents matching all of the given predicates.
     * An empty list matches every document.
     * 
     * @throws com.fsnow.indexadvisor.exception.SourceUnavailableException if the sample is lost for good;
     *         any other exception is treated as a failed estimate for this call only
     */
    long countMatching(List<Predicate> conjunction);
}
