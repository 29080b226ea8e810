package com.fsnow.indexadvisor.integration;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.fsnow.indexadvisor.exception.IndexAdvisorException;
import com.fsnow.indexadvisor.exception.SourceUnavailableException;
import com.fsnow.indexadvisor.model.IndexField;
import com.fsnow.indexadvisor.model.MongoIndex;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lists the indexes already present on a collection, so that recommendations they
 * already serve can be dropped.
 */
public class IndexRetriever {
    
    private static final Logger logger = LoggerFactory.getLogger(IndexRetriever.class);
    
    private final MongoClientAdapter mongoClientAdapter;
    
    public IndexRetriever(MongoClientAdapter mongoClientAdapter) {
        this.mongoClientAdapter = mongoClientAdapter;
    }
    
    /**
     * Retrieves the ascending/descending B-tree indexes for a given namespace.
     */
    public List<MongoIndex> getIndexes(String namespace) {
        MongoCollection<Document> collection = mongoClientAdapter.getCollection(namespace);
        List<MongoIndex> indexes = new ArrayList<>();
        
        try (MongoCursor<Document> cursor = collection.listIndexes().iterator()) {
            while (cursor.hasNext()) {
                MongoIndex index = parseIndexDocument(cursor.next());
                if (index != null) {
                    indexes.add(index);
                    logger.debug("Found index: {}", index);
                }
            }
        } catch (MongoException e) {
            if (MongoFailures.isUnavailable(e)) {
                throw new SourceUnavailableException(
                        String.format("Failed to reach %s while listing indexes", namespace), e);
            }
            throw new IndexAdvisorException(
                    String.format("Failed to retrieve indexes for namespace: %s", namespace), e);
        }
        
        logger.info("Retrieved {} indexes for namespace {}", indexes.size(), namespace);
        return indexes;
    }
    
    /**
     * Parses an index document, returning null for indexes that cannot serve a plain
     * compound key (text, hashed, geo, wildcard).
     */
    MongoIndex parseIndexDocument(Document indexDoc) {
        String name = indexDoc.getString("name");
        if (name == null) {
            logger.warn("Index without name found, skipping");
            return null;
        }
        
        Document key = indexDoc.get("key", Document.class);
        if (key == null || key.isEmpty()) {
            logger.warn("Index {} has no key definition, skipping", name);
            return null;
        }
        
        List<IndexField> fields = new ArrayList<>();
        for (Map.Entry<String, Object> entry : key.entrySet()) {
            if (!(entry.getValue() instanceof Number) || entry.getKey().contains("$**")) {
                logger.debug("Skipping special index {} ({}: {})", name, entry.getKey(), entry.getValue());
                return null;
            }
            int direction = ((Number) entry.getValue()).doubleValue() < 0 ? -1 : 1;
            fields.add(new IndexField(entry.getKey(), direction));
        }
        
        return new MongoIndex(name, fields);
    }
}
