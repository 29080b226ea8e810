package com.fsnow.indexadvisor.parser;

import org.bson.Document;
import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts sort field paths in order. Directions are discarded.
 */
public class SortParser {
    
    /**
     * Parses a logged sort document, e.g. {@code {createdAt: -1, score: 1}}.
     */
    public List<String> parse(Document sort) {
        List<String> sortFields = new ArrayList<>();
        
        if (sort == null || sort.isEmpty()) {
            return sortFields;
        }
        
        sortFields.addAll(sort.keySet());
        return sortFields;
    }
    
    /**
     * Converts a Spring Data Sort into the sort document a logged query would carry.
     */
    public Document toDocument(Sort sort) {
        Document document = new Document();
        
        if (sort == null || sort.isUnsorted()) {
            return document;
        }
        
        for (Sort.Order order : sort) {
            document.append(order.getProperty(), order.isAscending() ? 1 : -1);
        }
        
        return document;
    }
}
