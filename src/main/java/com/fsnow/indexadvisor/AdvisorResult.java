package com.fsnow.indexadvisor;

import com.fsnow.indexadvisor.model.IndexCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one advisory run: the ranked recommendations and what the run saw on the way.
 */
public class AdvisorResult {
    private final List<IndexCandidate> recommendations;
    private final long totalQueries;
    private final long supportedQueries;
    private final Map<String, Integer> skipReasons;
    private final int workloadEntries;
    private final int candidatesGenerated;
    private final long sampleSize;
    private final int unknownEstimates;
    
    private AdvisorResult(Builder builder) {
        this.recommendations = Collections.unmodifiableList(new ArrayList<>(builder.recommendations));
        this.totalQueries = builder.totalQueries;
        this.supportedQueries = builder.supportedQueries;
        this.skipReasons = Collections.unmodifiableMap(new LinkedHashMap<>(builder.skipReasons));
        this.workloadEntries = builder.workloadEntries;
        this.candidatesGenerated = builder.candidatesGenerated;
        this.sampleSize = builder.sampleSize;
        this.unknownEstimates = builder.unknownEstimates;
    }
    
    /**
     * Recommended indexes, best first.
     */
    public List<IndexCandidate> getRecommendations() {
        return recommendations;
    }
    
    public long getTotalQueries() {
        return totalQueries;
    }
    
    public long getSupportedQueries() {
        return supportedQueries;
    }
    
    public long getSkippedQueries() {
        return totalQueries - supportedQueries;
    }
    
    /**
     * How many queries were skipped for each reason.
     */
    public Map<String, Integer> getSkipReasons() {
        return skipReasons;
    }
    
    public int getWorkloadEntries() {
        return workloadEntries;
    }
    
    public int getCandidatesGenerated() {
        return candidatesGenerated;
    }
    
    public long getSampleSize() {
        return sampleSize;
    }
    
    /**
     * True when the sample had no documents, so the ranking reflects workload frequency only.
     */
    public boolean isEmptySample() {
        return sampleSize == 0;
    }
    
    public int getUnknownEstimates() {
        return unknownEstimates;
    }
    
    /**
     * Returns a copy holding only the given recommendations, e.g. after a caller-side cutoff.
     */
    public AdvisorResult withRecommendations(List<IndexCandidate> replacement) {
        Builder builder = toBuilder();
        builder.recommendations = new ArrayList<>(replacement);
        return builder.build();
    }
    
    private Builder toBuilder() {
        Builder builder = new Builder();
        builder.recommendations = new ArrayList<>(recommendations);
        builder.totalQueries = totalQueries;
        builder.supportedQueries = supportedQueries;
        builder.skipReasons = new LinkedHashMap<>(skipReasons);
        builder.workloadEntries = workloadEntries;
        builder.candidatesGenerated = candidatesGenerated;
        builder.sampleSize = sampleSize;
        builder.unknownEstimates = unknownEstimates;
        return builder;
    }
    
    @Override
    public String toString() {
        return String.format("AdvisorResult{recommendations=%d, queries=%d, skipped=%d, shapes=%d, " +
                           "candidates=%d, sampleSize=%d, unknownEstimates=%d}",
                           recommendations.size(), totalQueries, getSkippedQueries(), workloadEntries,
                           candidatesGenerated, sampleSize, unknownEstimates);
    }
    
    /**
     * Builder for AdvisorResult.
     */
    public static class Builder {
        private List<IndexCandidate> recommendations = new ArrayList<>();
        private long totalQueries;
        private long supportedQueries;
        private Map<String, Integer> skipReasons = new LinkedHashMap<>();
        private int workloadEntries;
        private int candidatesGenerated;
        private long sampleSize;
        private int unknownEstimates;
        
        public Builder recommendations(List<IndexCandidate> recommendations) {
            this.recommendations = new ArrayList<>(recommendations);
            return this;
        }
        
        public Builder totalQueries(long totalQueries) {
            this.totalQueries = totalQueries;
            return this;
        }
        
        public Builder supportedQueries(long supportedQueries) {
            this.supportedQueries = supportedQueries;
            return this;
        }
        
        public Builder skipReasons(Map<String, Integer> skipReasons) {
            this.skipReasons = new LinkedHashMap<>(skipReasons);
            return this;
        }
        
        public Builder workloadEntries(int workloadEntries) {
            this.workloadEntries = workloadEntries;
            return this;
        }
        
        public Builder candidatesGenerated(int candidatesGenerated) {
            this.candidatesGenerated = candidatesGenerated;
            return this;
        }
        
        public Builder sampleSize(long sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }
        
        public Builder unknownEstimates(int unknownEstimates) {
            this.unknownEstimates = unknownEstimates;
            return this;
        }
        
        public AdvisorResult build() {
            return new AdvisorResult(this);
        }
    }
}
