package com.fsnow.indexadvisor.workload;

import com.fsnow.indexadvisor.model.RawQuery;

/**
 * Supplies the recorded operations of a collection.
 */
public interface WorkloadSource {
    
    /**
     * Returns the logged operations for a namespace. The sequence may be lazy and is
     * iterated once per run.
     * 
     * @param namespace The database.collection namespace
     * @throws com.fsnow.indexadvisor.exception.SourceUnavailableException if the source cannot be read
     */
    Iterable<RawQuery> queries(String namespace);
}
