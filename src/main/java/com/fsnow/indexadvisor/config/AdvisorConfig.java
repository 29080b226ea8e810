package com.fsnow.indexadvisor.config;

/**
 * Configuration for an index advisory run.
 * Use the builder pattern to create instances.
 */
public final class AdvisorConfig {
    
    private final int connectionTimeoutMs;
    private final int concurrency;
    private final long estimationTimeoutMs;
    private final int maxRepresentatives;
    private final int inCardinalityThreshold;
    private final double selectivityExponent;
    private final int maxRecommendations;
    private final int sampleSize;
    private final double sampleRatio;
    private final String sampleDatabase;
    private final boolean excludeExistingIndexes;
    
    private AdvisorConfig(Builder builder) {
        this.connectionTimeoutMs = builder.connectionTimeoutMs;
        this.concurrency = builder.concurrency;
        this.estimationTimeoutMs = builder.estimationTimeoutMs;
        this.maxRepresentatives = builder.maxRepresentatives;
        this.inCardinalityThreshold = builder.inCardinalityThreshold;
        this.selectivityExponent = builder.selectivityExponent;
        this.maxRecommendations = builder.maxRecommendations;
        this.sampleSize = builder.sampleSize;
        this.sampleRatio = builder.sampleRatio;
        this.sampleDatabase = builder.sampleDatabase;
        this.excludeExistingIndexes = builder.excludeExistingIndexes;
    }
    
    /**
     * Creates a new builder for AdvisorConfig.
     * 
     * @return A new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Creates a configuration with all defaults.
     * 
     * @return A default configuration
     */
    public static AdvisorConfig defaultConfig() {
        return new Builder().build();
    }
    
    public int getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }
    
    public int getConcurrency() {
        return concurrency;
    }
    
    public long getEstimationTimeoutMs() {
        return estimationTimeoutMs;
    }
    
    public int getMaxRepresentatives() {
        return maxRepresentatives;
    }
    
    public int getInCardinalityThreshold() {
        return inCardinalityThreshold;
    }
    
    public double getSelectivityExponent() {
        return selectivityExponent;
    }
    
    public int getMaxRecommendations() {
        return maxRecommendations;
    }
    
    public int getSampleSize() {
        return sampleSize;
    }
    
    public double getSampleRatio() {
        return sampleRatio;
    }
    
    public String getSampleDatabase() {
        return sampleDatabase;
    }
    
    public boolean isExcludeExistingIndexes() {
        return excludeExistingIndexes;
    }
    
    /**
     * Builder for AdvisorConfig.
     */
    public static class Builder {
        private int connectionTimeoutMs = 30000;
        private int concurrency = 4;
        private long estimationTimeoutMs = 300000;
        private int maxRepresentatives = 5;
        private int inCardinalityThreshold = 100;
        private double selectivityExponent = 1.0;
        private int maxRecommendations = 0;
        private int sampleSize = 0;
        private double sampleRatio = 0;
        private String sampleDatabase = "samples";
        private boolean excludeExistingIndexes = true;
        
        private Builder() {}
        
        /**
         * Sets the MongoDB connection timeout in milliseconds.
         * Default: 30000 (30 seconds)
         * 
         * @param timeoutMs The timeout in milliseconds
         * @return this builder
         */
        public Builder connectionTimeoutMs(int timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("Connection timeout must be positive");
            }
            this.connectionTimeoutMs = timeoutMs;
            return this;
        }
        
        /**
         * Sets how many sampling queries may run at the same time.
         * Default: 4
         * 
         * @param concurrency The worker pool size (must be positive)
         * @return this builder
         */
        public Builder concurrency(int concurrency) {
            if (concurrency <= 0) {
                throw new IllegalArgumentException("Concurrency must be positive");
            }
            this.concurrency = concurrency;
            return this;
        }
        
        /**
         * Sets the time budget for all sampling queries of one run.
         * Default: 300000 (5 minutes)
         * 
         * @param timeoutMs The timeout in milliseconds
         * @return this builder
         */
        public Builder estimationTimeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("Estimation timeout must be positive");
            }
            this.estimationTimeoutMs = timeoutMs;
            return this;
        }
        
        /**
         * Sets how many distinct example queries are kept per workload shape
         * for binding operand values during estimation.
         * Default: 5
         * 
         * @param count The number of representatives (must be positive)
         * @return this builder
         */
        public Builder maxRepresentatives(int count) {
            if (count <= 0) {
                throw new IllegalArgumentException("Max representatives must be positive");
            }
            this.maxRepresentatives = count;
            return this;
        }
        
        /**
         * Sets the largest $in list still treated as an equality predicate.
         * Longer lists are treated as range predicates.
         * Default: 100
         * 
         * @param threshold The number of values (must be positive)
         * @return this builder
         */
        public Builder inCardinalityThreshold(int threshold) {
            if (threshold <= 0) {
                throw new IllegalArgumentException("$in cardinality threshold must be positive");
            }
            this.inCardinalityThreshold = threshold;
            return this;
        }
        
        /**
         * Sets the exponent applied to {@code (1 - selectivity)} when scoring.
         * Values above 1 favour highly selective indexes more strongly.
         * Default: 1.0
         * 
         * @param exponent The exponent (must be positive)
         * @return this builder
         */
        public Builder selectivityExponent(double exponent) {
            if (!(exponent > 0) || Double.isInfinite(exponent)) {
                throw new IllegalArgumentException("Selectivity exponent must be a positive number");
            }
            this.selectivityExponent = exponent;
            return this;
        }
        
        /**
         * Limits the number of recommendations the facade returns.
         * Default: 0 (no limit)
         * 
         * @param max The maximum, or 0 for all
         * @return this builder
         */
        public Builder maxRecommendations(int max) {
            if (max < 0) {
                throw new IllegalArgumentException("Max recommendations cannot be negative");
            }
            this.maxRecommendations = max;
            return this;
        }
        
        /**
         * Sets the number of documents to materialize into the sample collection.
         * Default: 0 (estimate against the collection itself)
         * 
         * @param size The sample size, or 0
         * @return this builder
         */
        public Builder sampleSize(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("Sample size cannot be negative");
            }
            this.sampleSize = size;
            return this;
        }
        
        /**
         * Sets the fraction of the collection to materialize into the sample collection.
         * The sample size is derived from the collection size at the start of each run;
         * a ratio covering every document estimates against the collection itself.
         * Default: 0 (not used)
         * 
         * @param ratio The ratio in (0, 1], or 0
         * @return this builder
         */
        public Builder sampleRatio(double ratio) {
            if (!(ratio >= 0 && ratio <= 1)) {
                throw new IllegalArgumentException("Sample ratio must be between 0 and 1");
            }
            this.sampleRatio = ratio;
            return this;
        }
        
        /**
         * Sets the database that holds materialized samples.
         * Default: "samples"
         * 
         * @param database The database name
         * @return this builder
         */
        public Builder sampleDatabase(String database) {
            if (database == null || database.trim().isEmpty()) {
                throw new IllegalArgumentException("Sample database cannot be empty");
            }
            this.sampleDatabase = database;
            return this;
        }
        
        /**
         * Enables or disables dropping recommendations an existing index already serves.
         * Default: true
         * 
         * @param exclude true to drop them
         * @return this builder
         */
        public Builder excludeExistingIndexes(boolean exclude) {
            this.excludeExistingIndexes = exclude;
            return this;
        }
        
        /**
         * Builds the configuration.
         * 
         * @return A new AdvisorConfig instance
         */
        public AdvisorConfig build() {
            if (sampleSize > 0 && sampleRatio > 0) {
                throw new IllegalArgumentException("Set either a sample size or a sample ratio, not both");
            }
            return new AdvisorConfig(this);
        }
    }
    
    @Override
    public String toString() {
        return String.format("AdvisorConfig{concurrency=%d, estimationTimeoutMs=%d, maxRepresentatives=%d, " +
                           "inCardinalityThreshold=%d, selectivityExponent=%.2f, maxRecommendations=%d, " +
                           "sampleSize=%d, sampleRatio=%.4f, sampleDatabase='%s', excludeExistingIndexes=%s, " +
                           "connectionTimeoutMs=%d}",
                           concurrency, estimationTimeoutMs, maxRepresentatives,
                           inCardinalityThreshold, selectivityExponent, maxRecommendations,
                           sampleSize, sampleRatio, sampleDatabase, excludeExistingIndexes, connectionTimeoutMs);
    }
}
