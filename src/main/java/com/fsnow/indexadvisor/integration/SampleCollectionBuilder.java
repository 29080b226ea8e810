package com.fsnow.indexadvisor.integration;

import com.fsnow.indexadvisor.exception.SourceUnavailableException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Materializes a uniform random sample of a collection into a separate database,
 * using {@code $sample} followed by {@code $out}.
 */
public class SampleCollectionBuilder {
    
    private static final Logger logger = LoggerFactory.getLogger(SampleCollectionBuilder.class);
    
    private final MongoClientAdapter mongoClientAdapter;
    
    public SampleCollectionBuilder(MongoClientAdapter mongoClientAdapter) {
        this.mongoClientAdapter = mongoClientAdapter;
    }
    
    /**
     * Writes a sample of the source collection to {@code <sampleDatabase>.<collection>}.
     * 
     * @param sourceNamespace The database.collection to sample
     * @param sampleSize Number of documents to draw
     * @param sampleDatabase Database receiving the sample
     * @return The namespace of the materialized sample
     */
    public String materialize(String sourceNamespace, int sampleSize, String sampleDatabase) {
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("Sample size must be positive");
        }
        
        MongoClientAdapter.NamespaceInfo source = mongoClientAdapter.parseNamespace(sourceNamespace);
        String sampleNamespace = sampleDatabase + "." + source.getCollection();
        
        List<Document> pipeline = samplePipeline(sampleSize, sampleDatabase, source.getCollection());
        
        try {
            MongoCollection<Document> collection = mongoClientAdapter.getCollection(sourceNamespace);
            collection.aggregate(pipeline).allowDiskUse(true).toCollection();
        } catch (MongoException e) {
            throw new SourceUnavailableException(
                    String.format("Failed to materialize sample of %s", sourceNamespace), e);
        }
        
        logger.info("Materialized sample of {} documents from {} into {}", sampleSize, sourceNamespace, sampleNamespace);
        return sampleNamespace;
    }
    
    /**
     * Drops a previously materialized sample.
     */
    public void drop(String sampleNamespace) {
        mongoClientAdapter.getCollection(sampleNamespace).drop();
        logger.info("Dropped sample {}", sampleNamespace);
    }
    
    static List<Document> samplePipeline(int sampleSize, String sampleDatabase, String collection) {
        return List.of(
                new Document("$sample", new Document("size", sampleSize)),
                new Document("$out", new Document("db", sampleDatabase).append("coll", collection)));
    }
}
