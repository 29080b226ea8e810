package com.fsnow.indexadvisor.integration;

import com.fsnow.indexadvisor.estimation.SampleSource;
import com.fsnow.indexadvisor.exception.IndexAdvisorException;
import com.fsnow.indexadvisor.exception.SourceUnavailableException;
import com.fsnow.indexadvisor.model.Predicate;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Sample source backed by a MongoDB collection, either a materialized sample or the
 * collection itself.
 */
public class MongoSampleSource implements SampleSource {
    
    private static final Logger logger = LoggerFactory.getLogger(MongoSampleSource.class);
    
    private final MongoCollection<Document> collection;
    
    public MongoSampleSource(MongoCollection<Document> collection) {
        if (collection == null) {
            throw new IllegalArgumentException("Collection cannot be null");
        }
        this.collection = collection;
    }
    
    @Override
    public long count() {
        try {
            long count = collection.countDocuments();
            logger.info("Sample {} holds {} documents", collection.getNamespace(), count);
            return count;
        } catch (MongoException e) {
            throw new SourceUnavailableException(
                    String.format("Failed to count sample %s", collection.getNamespace()), e);
        }
    }
    
    @Override
    public long countMatching(List<Predicate> conjunction) {
        Document filter = PredicateFilters.toFilter(conjunction);
        try {
            return collection.countDocuments(filter);
        } catch (MongoException e) {
            if (MongoFailures.isUnavailable(e)) {
                throw new SourceUnavailableException(
                        String.format("Sample %s is unreachable", collection.getNamespace()), e);
            }
            throw new IndexAdvisorException(String.format("Count of %s failed", filter.toJson()), e);
        }
    }
}
