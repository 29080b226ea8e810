package com.fsnow.indexadvisor.workload;

import com.fsnow.indexadvisor.model.Query;
import com.fsnow.indexadvisor.model.QueryShape;
import com.fsnow.indexadvisor.model.WorkloadEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses normalized queries into distinct shapes, counting how often each occurs.
 */
public class WorkloadAggregator {
    
    private static final Logger logger = LoggerFactory.getLogger(WorkloadAggregator.class);
    
    private final Map<QueryShape, WorkloadEntry> entries = new LinkedHashMap<>();
    private final int maxRepresentatives;
    private long queryCount;
    
    public WorkloadAggregator(int maxRepresentatives) {
        if (maxRepresentatives <= 0) {
            throw new IllegalArgumentException("Max representatives must be positive");
        }
        this.maxRepresentatives = maxRepresentatives;
    }
    
    /**
     * Adds one supported query to the workload.
     */
    public void add(Query query) {
        if (!query.isSupported()) {
            throw new IllegalArgumentException("Unsupported queries cannot be aggregated: " + query);
        }
        
        QueryShape shape = QueryShape.of(query);
        WorkloadEntry entry = entries.get(shape);
        if (entry == null) {
            entries.put(shape, new WorkloadEntry(query, maxRepresentatives));
            logger.debug("New workload shape: {}", shape);
        } else {
            entry.record(query);
        }
        queryCount++;
    }
    
    public void addAll(Iterable<Query> queries) {
        for (Query query : queries) {
            add(query);
        }
    }
    
    /**
     * Distinct shapes in first-seen order.
     */
    public List<WorkloadEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }
    
    /**
     * Number of queries added, equal to the sum of all entry frequencies.
     */
    public long getQueryCount() {
        return queryCount;
    }
}
