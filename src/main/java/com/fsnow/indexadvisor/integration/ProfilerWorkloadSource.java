package com.fsnow.indexadvisor.integration;

import com.fsnow.indexadvisor.exception.SourceUnavailableException;
import com.fsnow.indexadvisor.model.RawQuery;
import com.fsnow.indexadvisor.workload.WorkloadSource;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads the workload of a collection from its database's {@code system.profile}
 * collection. Profiling must have been enabled on the database beforehand.
 */
public class ProfilerWorkloadSource implements WorkloadSource {
    
    private static final Logger logger = LoggerFactory.getLogger(ProfilerWorkloadSource.class);
    
    static final String PROFILE_COLLECTION = "system.profile";
    
    private final MongoClientAdapter mongoClientAdapter;
    private final ProfileEntryParser parser;
    
    public ProfilerWorkloadSource(MongoClientAdapter mongoClientAdapter) {
        this.mongoClientAdapter = mongoClientAdapter;
        this.parser = new ProfileEntryParser();
    }
    
    @Override
    public Iterable<RawQuery> queries(String namespace) {
        MongoClientAdapter.NamespaceInfo info = mongoClientAdapter.parseNamespace(namespace);
        MongoCollection<Document> profile = mongoClientAdapter
                .getDatabase(info.getDatabase())
                .getCollection(PROFILE_COLLECTION);
        Document filter = profileFilter(namespace);
        
        logger.info("Reading workload for {} from {}.{}", namespace, info.getDatabase(), PROFILE_COLLECTION);
        
        return () -> {
            try {
                return new ParsingIterator(namespace, profile.find(filter).sort(new Document("ts", 1)).iterator());
            } catch (MongoException e) {
                throw new SourceUnavailableException("Failed to query the profiler for " + namespace, e);
            }
        };
    }
    
    static Document profileFilter(String namespace) {
        return new Document("ns", namespace)
                .append("op", new Document("$in", Arrays.asList("query", "update", "remove", "command")));
    }
    
    /**
     * Skips entries the parser does not map to a query and closes the cursor once drained.
     */
    private class ParsingIterator implements Iterator<RawQuery> {
        private final String namespace;
        private final MongoCursor<Document> cursor;
        private RawQuery next;
        private long entriesRead;
        
        ParsingIterator(String namespace, MongoCursor<Document> cursor) {
            this.namespace = namespace;
            this.cursor = cursor;
        }
        
        @Override
        public boolean hasNext() {
            try {
                while (next == null && cursor.hasNext()) {
                    entriesRead++;
                    next = parser.parse(cursor.next());
                }
            } catch (MongoException e) {
                cursor.close();
                throw new SourceUnavailableException("Failed to read the profiler for " + namespace, e);
            }
            if (next == null) {
                cursor.close();
                logger.debug("Read {} profiler entries for {}", entriesRead, namespace);
                return false;
            }
            return true;
        }
        
        @Override
        public RawQuery next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RawQuery result = next;
            next = null;
            return result;
        }
    }
}
