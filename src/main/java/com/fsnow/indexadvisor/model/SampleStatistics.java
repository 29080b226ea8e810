package com.fsnow.indexadvisor.model;

import java.util.Arrays;

/**
 * Match counts of a candidate's prefixes against the data sample.
 * Position {@code k - 1} holds the count for the prefix of length {@code k};
 * {@link #UNKNOWN} marks a prefix whose count could not be determined.
 */
public final class SampleStatistics {
    
    public static final long UNKNOWN = -1L;
    
    private final long sampleSize;
    private final long[] matchCounts;
    
    public SampleStatistics(long sampleSize, long[] matchCounts) {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("Sample size cannot be negative");
        }
        this.sampleSize = sampleSize;
        this.matchCounts = matchCounts.clone();
    }
    
    public long getSampleSize() {
        return sampleSize;
    }
    
    public int getPrefixCount() {
        return matchCounts.length;
    }
    
    public long getMatchCount(int prefixLength) {
        return matchCounts[prefixLength - 1];
    }
    
    public boolean isUnknown(int prefixLength) {
        return matchCounts[prefixLength - 1] == UNKNOWN;
    }
    
    /**
     * Fraction of the sample matched at the given prefix length. Unknown prefixes and
     * an empty sample read as 1.0, the worst case.
     */
    public double selectivityAt(int prefixLength) {
        long matches = getMatchCount(prefixLength);
        if (matches == UNKNOWN || sampleSize == 0) {
            return 1.0;
        }
        return Math.min(1.0, (double) matches / sampleSize);
    }
    
    public int getUnknownCount() {
        return (int) Arrays.stream(matchCounts).filter(c -> c == UNKNOWN).count();
    }
    
    @Override
    public String toString() {
        return String.format("SampleStatistics{sampleSize=%d, matchCounts=%s}", sampleSize, Arrays.toString(matchCounts));
    }
}
