package com.fsnow.indexadvisor;

import com.fsnow.indexadvisor.config.AdvisorConfig;
import com.fsnow.indexadvisor.estimation.SampleSource;
import com.fsnow.indexadvisor.exception.InvalidNamespaceException;
import com.fsnow.indexadvisor.integration.IndexRetriever;
import com.fsnow.indexadvisor.integration.MongoClientAdapter;
import com.fsnow.indexadvisor.integration.MongoSampleSource;
import com.fsnow.indexadvisor.integration.ProfilerWorkloadSource;
import com.fsnow.indexadvisor.integration.SampleCollectionBuilder;
import com.fsnow.indexadvisor.model.IndexCandidate;
import com.fsnow.indexadvisor.model.MongoIndex;
import com.fsnow.indexadvisor.output.ResultSink;
import com.fsnow.indexadvisor.workload.WorkloadSource;
import com.mongodb.MongoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point for MongoDB index recommendations.
 * Reads the profiled workload of a collection, estimates candidate selectivity against
 * the collection (or a materialized sample of it) and returns the ranked indexes.
 */
public class IndexAdvisor implements Closeable {
    
    private static final Logger logger = LoggerFactory.getLogger(IndexAdvisor.class);
    
    private final MongoClientAdapter mongoClientAdapter;
    private final IndexRetriever indexRetriever;
    private final SampleCollectionBuilder sampleBuilder;
    private final IndexAdvisorEngine engine;
    private final AdvisorConfig config;
    
    /**
     * Creates an IndexAdvisor with a MongoDB connection string and default settings.
     */
    public IndexAdvisor(String connectionString) {
        this(connectionString, AdvisorConfig.defaultConfig());
    }
    
    /**
     * Creates an IndexAdvisor with a MongoDB connection string and configuration.
     * 
     * @param connectionString The MongoDB connection string
     * @param config The configuration for the advisor
     */
    public IndexAdvisor(String connectionString, AdvisorConfig config) {
        this(new MongoClientAdapter(connectionString, config.getConnectionTimeoutMs()), config);
    }
    
    /**
     * Creates an IndexAdvisor over an existing client adapter. Closing the advisor closes the adapter.
     */
    public IndexAdvisor(MongoClientAdapter mongoClientAdapter, AdvisorConfig config) {
        this.config = config;
        this.mongoClientAdapter = mongoClientAdapter;
        this.indexRetriever = new IndexRetriever(mongoClientAdapter);
        this.sampleBuilder = new SampleCollectionBuilder(mongoClientAdapter);
        this.engine = new IndexAdvisorEngine(config);
        logger.info("IndexAdvisor created with {}", config);
    }
    
    /**
     * Recommends indexes for a collection from its profiled workload.
     * 
     * @param namespace The database.collection namespace
     * @return The run result, recommendations best first
     */
    public AdvisorResult recommend(String namespace) {
        return recommend(namespace, new ProfilerWorkloadSource(mongoClientAdapter));
    }
    
    /**
     * Recommends indexes and hands the final list to a sink.
     */
    public AdvisorResult recommend(String namespace, ResultSink resultSink) {
        AdvisorResult result = recommend(namespace);
        resultSink.publish(result.getRecommendations());
        return result;
    }
    
    /**
     * Recommends indexes for a collection from a caller-supplied workload.
     * 
     * @param namespace The database.collection namespace
     * @param workloadSource The recorded queries of the collection
     * @return The run result, recommendations best first
     */
    public AdvisorResult recommend(String namespace, WorkloadSource workloadSource) {
        logger.info("Recommending indexes for namespace: {}", namespace);
        
        // Validate namespace format
        validateNamespace(namespace);
        
        String sampleNamespace = null;
        RuntimeException failure = null;
        try {
            int sampleSize = sampleSizeFor(namespace);
            if (sampleSize > 0) {
                sampleNamespace = sampleBuilder.materialize(namespace, sampleSize, config.getSampleDatabase());
            }
            
            SampleSource sampleSource = new MongoSampleSource(mongoClientAdapter.getCollection(
                    sampleNamespace != null ? sampleNamespace : namespace));
            AdvisorResult result = engine.recommend(namespace, workloadSource, sampleSource);
            
            return limit(excludeExisting(namespace, result));
        } catch (RuntimeException e) {
            failure = e;
            logger.error("Error recommending indexes for namespace: {}", namespace, e);
            throw e;
        } finally {
            if (sampleNamespace != null) {
                dropSample(sampleNamespace, failure);
            }
        }
    }
    
    /**
     * Number of documents to materialize, or 0 to estimate against the collection itself.
     * A ratio that would cover the whole collection needs no sample.
     */
    private int sampleSizeFor(String namespace) {
        if (config.getSampleSize() > 0) {
            return config.getSampleSize();
        }
        if (config.getSampleRatio() == 0) {
            return 0;
        }
        
        long collectionSize = new MongoSampleSource(mongoClientAdapter.getCollection(namespace)).count();
        long size = Math.max(1, Math.round(collectionSize * config.getSampleRatio()));
        if (collectionSize == 0 || size >= collectionSize) {
            logger.info("Sample ratio {} covers all {} documents of {}, using the collection itself",
                    config.getSampleRatio(), collectionSize, namespace);
            return 0;
        }
        return (int) Math.min(size, Integer.MAX_VALUE);
    }
    
    /**
     * Drops the materialized sample without masking the outcome of the run.
     */
    private void dropSample(String sampleNamespace, RuntimeException failure) {
        try {
            sampleBuilder.drop(sampleNamespace);
        } catch (MongoException e) {
            logger.warn("Failed to drop sample {}", sampleNamespace, e);
            if (failure != null) {
                failure.addSuppressed(e);
            }
        }
    }
    
    private AdvisorResult excludeExisting(String namespace, AdvisorResult result) {
        if (!config.isExcludeExistingIndexes()) {
            return result;
        }
        
        List<MongoIndex> existing = indexRetriever.getIndexes(namespace);
        List<IndexCandidate> remaining = new ArrayList<>();
        for (IndexCandidate candidate : result.getRecommendations()) {
            Optional<MongoIndex> serving = existing.stream().filter(index -> index.serves(candidate)).findFirst();
            if (serving.isPresent()) {
                logger.info("Index {} already served by existing index {}, dropping",
                        candidate.indexName(), serving.get().getName());
            } else {
                remaining.add(candidate);
            }
        }
        return result.withRecommendations(remaining);
    }
    
    private AdvisorResult limit(AdvisorResult result) {
        int max = config.getMaxRecommendations();
        if (max == 0 || result.getRecommendations().size() <= max) {
            return result;
        }
        return result.withRecommendations(result.getRecommendations().subList(0, max));
    }
    
    /**
     * Validates that the namespace follows the "database.collection" format.
     * 
     * @param namespace The namespace to validate
     * @throws InvalidNamespaceException if the namespace format is invalid
     */
    private void validateNamespace(String namespace) {
        if (namespace == null || namespace.trim().isEmpty()) {
            throw new InvalidNamespaceException(namespace);
        }
        
        // The first dot separates database and collection; collection names may contain dots
        String[] parts = namespace.split("\\.", 2);
        if (parts.length != 2) {
            throw new InvalidNamespaceException(namespace);
        }
        
        if (parts[0].trim().isEmpty() || parts[1].trim().isEmpty()) {
            throw new InvalidNamespaceException(namespace);
        }
    }
    
    @Override
    public void close() {
        if (mongoClientAdapter != null) {
            mongoClientAdapter.close();
        }
    }
}
