package com.fsnow.indexadvisor.estimation;

/**
 * Summary of one estimation pass.
 */
public class EstimationReport {
    private final long sampleSize;
    private final int queriesIssued;
    private final int unknownEstimates;
    
    public EstimationReport(long sampleSize, int queriesIssued, int unknownEstimates) {
        this.sampleSize = sampleSize;
        this.queriesIssued = queriesIssued;
        this.unknownEstimates = unknownEstimates;
    }
    
    public long getSampleSize() {
        return sampleSize;
    }
    
    public boolean isEmptySample() {
        return sampleSize == 0;
    }
    
    /**
     * Number of candidate prefixes whose selectivity fell back to the worst case.
     */
    public int getUnknownEstimates() {
        return unknownEstimates;
    }
    
    @Override
    public String toString() {
        return String.format("EstimationReport{sampleSize=%d, queriesIssued=%d, unknownEstimates=%d}",
                sampleSize, queriesIssued, unknownEstimates);
    }
}
