package com.fsnow.indexadvisor.integration;

import com.fsnow.indexadvisor.model.OperationType;
import com.fsnow.indexadvisor.model.RawQuery;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps database profiler entries ({@code system.profile} documents) to raw queries.
 * <p>
 * Reads the {@code command} field written by MongoDB 4.4 and later:
 * <ul>
 *   <li>{@code op: "query"} with a {@code find} command</li>
 *   <li>{@code op: "update"} and {@code op: "remove"} with the statement filter in {@code q}</li>
 *   <li>{@code op: "command"} for count, distinct, findAndModify and aggregate</li>
 * </ul>
 */
public class ProfileEntryParser {
    
    private static final Logger logger = LoggerFactory.getLogger(ProfileEntryParser.class);
    
    /**
     * Parses a profiler entry.
     * 
     * @return The raw query, or null if the entry is not an operation that selects documents
     */
    public RawQuery parse(Document entry) {
        String op = entry.getString("op");
        Document command = entry.get("command", Document.class);
        
        if (op == null || command == null) {
            logger.debug("Profiler entry without op or command, skipping");
            return null;
        }
        
        switch (op) {
            case "query":
                return RawQuery.builder()
                        .operationType(OperationType.FIND)
                        .filter(command.get("filter", Document.class))
                        .sort(command.get("sort", Document.class))
                        .projection(command.get("projection", Document.class))
                        .limit(intValue(command.get("limit")))
                        .build();
                
            case "update":
                return RawQuery.builder()
                        .operationType(OperationType.UPDATE)
                        .filter(command.get("q", Document.class))
                        .build();
                
            case "remove":
                return RawQuery.builder()
                        .operationType(OperationType.DELETE)
                        .filter(command.get("q", Document.class))
                        .limit(intValue(command.get("limit")))
                        .build();
                
            case "command":
                return parseCommand(command);
                
            default:
                logger.debug("Ignoring profiler entry with op '{}'", op);
                return null;
        }
    }
    
    private RawQuery parseCommand(Document command) {
        if (command.isEmpty()) {
            return null;
        }
        
        String name = command.keySet().iterator().next();
        switch (name) {
            case "count":
                return RawQuery.builder()
                        .operationType(OperationType.COUNT)
                        .filter(command.get("query", Document.class))
                        .limit(intValue(command.get("limit")))
                        .build();
                
            case "distinct":
                return RawQuery.builder()
                        .operationType(OperationType.DISTINCT)
                        .filter(command.get("query", Document.class))
                        .build();
                
            case "findAndModify":
            case "findandmodify":
                return RawQuery.builder()
                        .operationType(OperationType.FIND_AND_MODIFY)
                        .filter(command.get("query", Document.class))
                        .sort(command.get("sort", Document.class))
                        .build();
                
            case "aggregate":
                return RawQuery.builder()
                        .operationType(OperationType.AGGREGATE)
                        .build();
                
            default:
                logger.debug("Ignoring profiled command '{}'", name);
                return null;
        }
    }
    
    private Integer intValue(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : null;
    }
}
